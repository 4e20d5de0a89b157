package com.ledgerly.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.ledgerly.backend.enums.TransactionType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Transação persistida no ledger. (owner_id, reference_number) é único quando a referência existe.
 */
@Entity
@Table(name = "ledger_transactions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ledger_transactions_owner_reference", columnNames = {"owner_id", "reference_number"})
        },
        indexes = {
                @Index(name = "idx_ledger_transactions_owner_date", columnList = "owner_id, transaction_date"),
                @Index(name = "idx_ledger_transactions_document", columnList = "document_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(name = "document_id")
    private UUID documentId;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(length = 100)
    private String merchant;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 10)
    private TransactionType type;

    @Column(precision = 19, scale = 2)
    private BigDecimal balance;

    @Column(name = "reference_number", length = 100)
    private String referenceNumber;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "amount_reference_currency", precision = 19, scale = 2)
    private BigDecimal amountInReferenceCurrency;

    @Column(name = "reference_currency", length = 3)
    private String referenceCurrency;

    @Column(name = "exchange_rate", precision = 19, scale = 6)
    private BigDecimal exchangeRate;

    @Column(name = "exchange_rate_date")
    private LocalDate exchangeRateDate;

    @Column(name = "category_id")
    private UUID categoryId;

    @Column(name = "bank_name", length = 100)
    private String bankName;

    @Column(name = "raw_source", columnDefinition = "TEXT")
    private String rawSource;

    @Column(name = "extraction_confidence")
    private Double extractionConfidence;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Column(name = "processed_by_ai", nullable = false)
    private boolean processedByAi;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
