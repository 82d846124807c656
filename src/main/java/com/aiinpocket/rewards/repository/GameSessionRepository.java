package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.GameSession;
import com.aiinpocket.rewards.model.enums.GameSessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface GameSessionRepository extends JpaRepository<GameSession, Long> {

    /** 使用者參與且已結束的遊戲，依開始時間排序 */
    @Query("""
        SELECT s FROM GameSession s JOIN s.players p
        WHERE p.userId = :userId AND s.status = :status AND s.startedAt >= :since
        ORDER BY s.startedAt
    """)
    List<GameSession> findPlayedByUser(@Param("userId") Long userId,
                                       @Param("status") GameSessionStatus status,
                                       @Param("since") Instant since);
}
