package com.ledgerly.backend.repositories;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerly.backend.entities.ExchangeRateEntry;

public interface ExchangeRateEntryRepository extends JpaRepository<ExchangeRateEntry, UUID> {

    Optional<ExchangeRateEntry> findByRateDateAndFromCurrencyAndToCurrency(LocalDate rateDate,
                                                                          String fromCurrency,
                                                                          String toCurrency);
}
