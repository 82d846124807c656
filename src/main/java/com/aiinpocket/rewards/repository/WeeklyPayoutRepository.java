package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.WeeklyPayout;
import com.aiinpocket.rewards.model.enums.PayoutStatus;
import com.aiinpocket.rewards.model.enums.TierKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface WeeklyPayoutRepository extends JpaRepository<WeeklyPayout, Long> {

    Optional<WeeklyPayout> findByUserIdAndKindAndWeekStart(Long userId, TierKind kind, LocalDate weekStart);

    boolean existsByUserIdAndKindAndWeekStart(Long userId, TierKind kind, LocalDate weekStart);

    @Query("SELECT w.id FROM WeeklyPayout w WHERE w.weekStart = :weekStart AND w.status = :status ORDER BY w.id")
    List<Long> findIdsByWeekStartAndStatus(@Param("weekStart") LocalDate weekStart,
                                           @Param("status") PayoutStatus status);

    /** 條件式狀態轉換，回傳受影響筆數 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WeeklyPayout w SET w.status = :to, w.processedAt = :now
        WHERE w.id = :id AND w.status = :from
    """)
    int transition(@Param("id") Long id,
                   @Param("from") PayoutStatus from,
                   @Param("to") PayoutStatus to,
                   @Param("now") Instant now);
}
