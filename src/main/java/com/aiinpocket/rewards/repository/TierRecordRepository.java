package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.TierRecord;
import com.aiinpocket.rewards.model.enums.TierKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TierRecordRepository extends JpaRepository<TierRecord, Long> {

    Optional<TierRecord> findByUserIdAndKindAndBlockId(Long userId, TierKind kind, Long blockId);

    Optional<TierRecord> findByUserIdAndKindAndBlockIdIsNull(Long userId, TierKind kind);

    /**
     * 可領每週發放的等級紀錄：等級的週發放大於 0，且在該週結束前已取得。
     */
    @Query("""
        SELECT r FROM TierRecord r JOIN FETCH r.currentTier t JOIN FETCH r.user
        WHERE r.kind IN :kinds AND t.weeklyPayout > 0 AND r.achievedAt <= :cutoff
        ORDER BY r.user.id
    """)
    List<TierRecord> findPayable(@Param("kinds") Collection<TierKind> kinds, @Param("cutoff") Instant cutoff);
}
