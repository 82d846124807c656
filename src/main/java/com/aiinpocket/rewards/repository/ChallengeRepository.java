package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.Challenge;
import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChallengeRepository extends JpaRepository<Challenge, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Challenge c WHERE c.id = :id")
    Optional<Challenge> findByIdForUpdate(@Param("id") Long id);

    /**
     * 條件式狀態轉換。回傳 1 表示取得轉換權，0 表示狀態已被其他交易改變。
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Challenge c SET c.status = :to, c.updatedAt = :now
        WHERE c.id = :id AND c.status IN :from
    """)
    int transition(@Param("id") Long id,
                   @Param("from") Collection<ChallengeStatus> from,
                   @Param("to") ChallengeStatus to,
                   @Param("now") Instant now);

    /** 已過結束時間但仍為 ACTIVE / PAUSED 的挑戰 */
    @Query("""
        SELECT c.id FROM Challenge c
        WHERE c.status IN :statuses AND c.endDate <= :now
        ORDER BY c.endDate ASC
    """)
    List<Long> findExpiredIds(@Param("statuses") Collection<ChallengeStatus> statuses,
                              @Param("now") Instant now);
}
