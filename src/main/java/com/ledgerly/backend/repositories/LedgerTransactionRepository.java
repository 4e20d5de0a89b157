package com.ledgerly.backend.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.ledgerly.backend.entities.LedgerTransaction;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, UUID> {

    @Query("""
            select t.referenceNumber
              from LedgerTransaction t
             where t.ownerId = :ownerId
               and t.referenceNumber in :references
            """)
    Set<String> findExistingReferenceNumbers(@Param("ownerId") UUID ownerId,
                                             @Param("references") Collection<String> references);

    List<LedgerTransaction> findByOwnerIdOrderByTransactionDateAsc(UUID ownerId);

    @Query("""
            select t.id
              from LedgerTransaction t
             where t.ownerId = :ownerId
               and t.amountInReferenceCurrency is null
               and t.currency <> :referenceCurrency
             order by t.transactionDate asc, t.id asc
            """)
    List<UUID> findUnconvertedIds(@Param("ownerId") UUID ownerId,
                                  @Param("referenceCurrency") String referenceCurrency);

    long countByOwnerId(UUID ownerId);
}
