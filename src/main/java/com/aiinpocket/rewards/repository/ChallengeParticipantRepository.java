package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.ChallengeParticipant;
import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChallengeParticipantRepository extends JpaRepository<ChallengeParticipant, Long> {

    boolean existsByChallengeIdAndUserId(Long challengeId, Long userId);

    long countByChallengeIdAndStatusIn(Long challengeId, Collection<ParticipantStatus> statuses);

    @Query("SELECT p FROM ChallengeParticipant p JOIN FETCH p.challenge JOIN FETCH p.user WHERE p.id = :id")
    Optional<ChallengeParticipant> findWithChallengeById(@Param("id") Long id);

    /**
     * 驗證排程的對象：參加者為 ACTIVE，挑戰為 ACTIVE 且目前在 [start, end) 時間窗內。
     */
    @Query("""
        SELECT p.id FROM ChallengeParticipant p JOIN p.challenge c
        WHERE p.status = :participantStatus
          AND c.status = :challengeStatus
          AND c.startDate <= :now AND c.endDate > :now
        ORDER BY p.id
    """)
    List<Long> findEligibleIds(@Param("participantStatus") ParticipantStatus participantStatus,
                               @Param("challengeStatus") ChallengeStatus challengeStatus,
                               @Param("now") Instant now);

    /**
     * 條件式狀態轉換，回傳受影響筆數。完成時一併寫入完成時間。
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ChallengeParticipant p SET p.status = :to, p.completedAt = :completedAt
        WHERE p.id = :id AND p.status = :from
    """)
    int transition(@Param("id") Long id,
                   @Param("from") ParticipantStatus from,
                   @Param("to") ParticipantStatus to,
                   @Param("completedAt") Instant completedAt);

    /** 接受邀請：INVITED → ACTIVE，並從此刻開始計算進度 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ChallengeParticipant p SET p.status = :to, p.startedAt = :now
        WHERE p.id = :id AND p.status = :from
    """)
    int start(@Param("id") Long id,
              @Param("from") ParticipantStatus from,
              @Param("to") ParticipantStatus to,
              @Param("now") Instant now);

    /** 挑戰結束時，尚未完成的參加者一律標記為指定狀態 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ChallengeParticipant p SET p.status = :to, p.completedAt = :now
        WHERE p.challenge.id = :challengeId AND p.status IN :from
    """)
    int transitionRemaining(@Param("challengeId") Long challengeId,
                            @Param("from") Collection<ParticipantStatus> from,
                            @Param("to") ParticipantStatus to,
                            @Param("now") Instant now);

    /** 寫入進度快照（不改變狀態） */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ChallengeParticipant p
        SET p.progressJson = :progressJson, p.progressPercentage = :percentage, p.lastValidatedAt = :now
        WHERE p.id = :id
    """)
    int updateProgress(@Param("id") Long id,
                       @Param("progressJson") String progressJson,
                       @Param("percentage") double percentage,
                       @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ChallengeParticipant p SET p.prizeAwarded = :amount WHERE p.id = :id AND p.status = :status")
    int recordPrize(@Param("id") Long id,
                    @Param("amount") long amount,
                    @Param("status") ParticipantStatus status);
}
