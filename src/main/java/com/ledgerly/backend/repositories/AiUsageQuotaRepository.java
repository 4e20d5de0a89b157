package com.ledgerly.backend.repositories;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.ledgerly.backend.entities.AiUsageQuota;

public interface AiUsageQuotaRepository extends JpaRepository<AiUsageQuota, UUID> {

    Optional<AiUsageQuota> findByOwnerIdAndPeriodKey(UUID ownerId, String periodKey);

    List<AiUsageQuota> findByOwnerIdOrderByPeriodKeyDesc(UUID ownerId, Pageable pageable);

    /**
     * Incremento atômico: só altera a linha se ainda houver cota. Retorna 1 quando concedido.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AiUsageQuota q
               set q.usageCount = q.usageCount + 1, q.updatedAt = :now
             where q.ownerId = :ownerId
               and q.periodKey = :periodKey
               and q.usageCount < q.monthlyLimit
            """)
    int incrementIfBelowLimit(@Param("ownerId") UUID ownerId,
                              @Param("periodKey") String periodKey,
                              @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AiUsageQuota q
               set q.usageCount = q.usageCount - 1, q.updatedAt = :now
             where q.ownerId = :ownerId
               and q.periodKey = :periodKey
               and q.usageCount > 0
            """)
    int decrementIfPositive(@Param("ownerId") UUID ownerId,
                            @Param("periodKey") String periodKey,
                            @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AiUsageQuota q
               set q.usageCount = 0, q.updatedAt = :now
             where q.ownerId = :ownerId
               and q.periodKey = :periodKey
            """)
    int resetUsage(@Param("ownerId") UUID ownerId,
                   @Param("periodKey") String periodKey,
                   @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AiUsageQuota q
               set q.monthlyLimit = :limit, q.updatedAt = :now
             where q.ownerId = :ownerId
               and q.periodKey = :periodKey
            """)
    int updateLimit(@Param("ownerId") UUID ownerId,
                    @Param("periodKey") String periodKey,
                    @Param("limit") int limit,
                    @Param("now") LocalDateTime now);
}
