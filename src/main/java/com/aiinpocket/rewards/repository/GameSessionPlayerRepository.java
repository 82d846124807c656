package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.GameSessionPlayer;
import com.aiinpocket.rewards.model.enums.GameSessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface GameSessionPlayerRepository extends JpaRepository<GameSessionPlayer, Long> {

    /** 題組的遊戲統計：[次數, 最佳分數] */
    @Query("""
        SELECT COUNT(p), COALESCE(MAX(p.score), 0) FROM GameSessionPlayer p JOIN p.session s
        WHERE p.userId = :userId AND s.blockId = :blockId AND s.status = :status AND s.startedAt >= :since
    """)
    List<Object[]> attemptsByBlock(@Param("userId") Long userId,
                                   @Param("blockId") Long blockId,
                                   @Param("status") GameSessionStatus status,
                                   @Param("since") Instant since);

    /**
     * 多人遊戲成績：[場次 ID, 模式, 分數, 該場最高分, 答對數, 題數]，最新的在前。
     */
    @Query("""
        SELECT s.id, s.gameType, p.score,
               (SELECT MAX(p2.score) FROM GameSessionPlayer p2 WHERE p2.session = s),
               p.correctAnswers, p.totalQuestions
        FROM GameSessionPlayer p JOIN p.session s
        WHERE p.userId = :userId AND s.gameType IN :gameModes
          AND s.status = :status AND s.startedAt >= :since
          AND (SELECT COUNT(p3) FROM GameSessionPlayer p3 WHERE p3.session = s) > 1
        ORDER BY s.startedAt DESC
    """)
    List<Object[]> findMultiplayerOutcomes(@Param("userId") Long userId,
                                           @Param("gameModes") Collection<String> gameModes,
                                           @Param("status") GameSessionStatus status,
                                           @Param("since") Instant since);

    /** 在某位創作者的題組上遊玩的不重複玩家數 */
    @Query("""
        SELECT COUNT(DISTINCT p.userId) FROM GameSessionPlayer p JOIN p.session s, Block b
        WHERE b.id = s.blockId AND b.creatorId = :creatorId
          AND s.status = :status AND s.startedAt >= :since
    """)
    long countDistinctPlayersOfCreator(@Param("creatorId") Long creatorId,
                                       @Param("status") GameSessionStatus status,
                                       @Param("since") Instant since);

    /** 同上，但不計建立者本人（教師的學生數） */
    @Query("""
        SELECT COUNT(DISTINCT p.userId) FROM GameSessionPlayer p JOIN p.session s, Block b
        WHERE b.id = s.blockId AND b.creatorId = :creatorId AND p.userId <> :creatorId
          AND s.status = :status AND s.startedAt >= :since
    """)
    long countDistinctStudentsOfCreator(@Param("creatorId") Long creatorId,
                                        @Param("status") GameSessionStatus status,
                                        @Param("since") Instant since);

    @Query("""
        SELECT DISTINCT p.userId FROM GameSessionPlayer p JOIN p.session s
        WHERE s.startedAt >= :since
    """)
    List<Long> findUserIdsPlayedSince(@Param("since") Instant since);
}
