package com.ledgerly.backend.classification.entity;

import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;

import com.ledgerly.backend.enums.RuleMatchField;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Regra de categorização do usuário. Imutável depois de criada: para alterar, exclua e crie outra.
 */
@Entity
@Table(name = "category_rules", indexes = {
        @Index(name = "idx_category_rules_owner_priority", columnList = "owner_id, priority")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CategoryRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(nullable = false, length = 200)
    private String keyword;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_field", nullable = false, length = 20)
    @Builder.Default
    private RuleMatchField matchField = RuleMatchField.DESCRIPTION;

    @Column(nullable = false)
    @Builder.Default
    private int priority = 0;

    @Column(name = "case_sensitive", nullable = false)
    private boolean caseSensitive;

    /** true: keyword é uma expressão regular. */
    @Column(name = "is_pattern", nullable = false)
    private boolean pattern;

    @Column(name = "category_id", nullable = false)
    private UUID categoryId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
