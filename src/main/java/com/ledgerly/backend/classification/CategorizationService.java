package com.ledgerly.backend.classification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerly.backend.classification.entity.CategoryRule;
import com.ledgerly.backend.classification.repository.CategoryRuleRepository;
import com.ledgerly.backend.classification.rules.CategoryRuleMatcher;
import com.ledgerly.backend.enums.RuleMatchField;
import com.ledgerly.backend.services.documents.model.TransactionCandidate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationService {

    private final CategoryRuleRepository categoryRuleRepository;

    private static final Comparator<CategoryRule> EVALUATION_ORDER = Comparator
            .comparingInt(CategoryRule::getPriority).reversed()
            .thenComparing(CategoryRule::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Regras avaliadas por prioridade decrescente (empate: a mais antiga); a primeira que casa vence.
     *
     * @return categoria da regra, a categoria já atribuída ao candidato, ou null
     */
    public UUID categorize(TransactionCandidate candidate, List<CategoryRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return candidate == null ? null : candidate.getCategoryId();
        }
        return firstMatch(candidate, inEvaluationOrder(rules));
    }

    private UUID firstMatch(TransactionCandidate candidate, List<CategoryRule> orderedRules) {
        if (candidate == null) return null;
        if (candidate.getCategoryId() != null) return candidate.getCategoryId();

        for (CategoryRule rule : orderedRules) {
            if (CategoryRuleMatcher.matches(rule, candidate.getDescription(), candidate.getMerchant())) {
                log.debug("[Categorization] Matched rule keyword='{}' priority={} -> category={}",
                        rule.getKeyword(), rule.getPriority(), rule.getCategoryId());
                return rule.getCategoryId();
            }
        }
        return null;
    }

    /**
     * Categoriza o lote com as regras do usuário. Se as regras não puderem ser carregadas,
     * os candidatos seguem sem categoria.
     */
    @Transactional(readOnly = true)
    public List<TransactionCandidate> categorizeAll(UUID ownerId, List<TransactionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return List.of();

        List<CategoryRule> rules;
        try {
            rules = inEvaluationOrder(categoryRuleRepository.findByOwnerIdOrderByPriorityDescCreatedAtAsc(ownerId));
        } catch (RuntimeException e) {
            log.warn("[Categorization] Could not load rules for owner={}: {}", ownerId, e.getMessage());
            return candidates;
        }

        int categorized = 0;
        List<TransactionCandidate> out = new ArrayList<>(candidates.size());
        for (TransactionCandidate c : candidates) {
            if (c.getCategoryId() != null) {
                out.add(c);
                continue;
            }
            UUID category = firstMatch(c, rules);
            if (category == null) {
                out.add(c);
            } else {
                categorized++;
                out.add(c.toBuilder().categoryId(category).build());
            }
        }

        log.info("[Categorization] owner={} rules={} categorized={}/{}",
                ownerId, rules.size(), categorized, candidates.size());
        return out;
    }

    private static List<CategoryRule> inEvaluationOrder(List<CategoryRule> rules) {
        List<CategoryRule> ordered = new ArrayList<>(rules);
        ordered.sort(EVALUATION_ORDER);
        return ordered;
    }

    @Transactional
    public CategoryRule addRule(UUID ownerId,
                                String keyword,
                                RuleMatchField matchField,
                                int priority,
                                boolean caseSensitive,
                                boolean pattern,
                                UUID categoryId) {
        if (ownerId == null || categoryId == null) {
            throw new IllegalArgumentException("ownerId e categoryId são obrigatórios");
        }
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword é obrigatório");
        }

        CategoryRule rule = CategoryRule.builder()
                .ownerId(ownerId)
                .keyword(keyword.trim())
                .matchField(matchField == null ? RuleMatchField.DESCRIPTION : matchField)
                .priority(priority)
                .caseSensitive(caseSensitive)
                .pattern(pattern)
                .categoryId(categoryId)
                .build();
        return categoryRuleRepository.save(rule);
    }

    /**
     * @return false quando a regra não existe ou pertence a outro usuário
     */
    @Transactional
    public boolean deleteRule(UUID ruleId, UUID ownerId) {
        return categoryRuleRepository.findByIdAndOwnerId(ruleId, ownerId)
                .map(rule -> {
                    categoryRuleRepository.delete(rule);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<CategoryRule> getRulesByCategory(UUID categoryId, UUID ownerId) {
        return categoryRuleRepository.findByOwnerIdAndCategoryIdOrderByPriorityDescCreatedAtAsc(ownerId, categoryId);
    }
}
