package com.ledgerly.backend.classification.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerly.backend.classification.entity.CategoryRule;

public interface CategoryRuleRepository extends JpaRepository<CategoryRule, UUID> {

    List<CategoryRule> findByOwnerIdOrderByPriorityDescCreatedAtAsc(UUID ownerId);

    List<CategoryRule> findByOwnerIdAndCategoryIdOrderByPriorityDescCreatedAtAsc(UUID ownerId, UUID categoryId);

    Optional<CategoryRule> findByIdAndOwnerId(UUID id, UUID ownerId);
}
