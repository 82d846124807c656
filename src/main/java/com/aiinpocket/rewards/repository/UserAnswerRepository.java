package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.UserAnswer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface UserAnswerRepository extends JpaRepository<UserAnswer, Long> {

    /** 題組作答統計：[總作答數, 答對數, 涵蓋主題數] */
    @Query("""
        SELECT COUNT(a), COALESCE(SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END), 0), COUNT(DISTINCT q.topic)
        FROM UserAnswer a, Question q
        WHERE q.id = a.questionId AND a.userId = :userId AND q.blockId = :blockId
          AND a.answeredAt >= :since
    """)
    List<Object[]> tallyByBlock(@Param("userId") Long userId,
                                @Param("blockId") Long blockId,
                                @Param("since") Instant since);

    /** 同上，只計算指定主題的題目 */
    @Query("""
        SELECT COUNT(a), COALESCE(SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END), 0), COUNT(DISTINCT q.topic)
        FROM UserAnswer a, Question q
        WHERE q.id = a.questionId AND a.userId = :userId AND q.blockId = :blockId
          AND a.answeredAt >= :since AND q.topic IN :topics
    """)
    List<Object[]> tallyByBlockAndTopics(@Param("userId") Long userId,
                                         @Param("blockId") Long blockId,
                                         @Param("since") Instant since,
                                         @Param("topics") Collection<String> topics);

    /** 使用者在題組中至少答對一次的不重複題數 */
    @Query("""
        SELECT COUNT(DISTINCT a.questionId) FROM UserAnswer a, Question q
        WHERE q.id = a.questionId AND a.userId = :userId AND q.blockId = :blockId AND a.correct = true
    """)
    long countDistinctCorrectQuestions(@Param("userId") Long userId, @Param("blockId") Long blockId);

    @Query("""
        SELECT DISTINCT q.blockId FROM UserAnswer a, Question q
        WHERE q.id = a.questionId AND a.userId = :userId
    """)
    List<Long> findAnsweredBlockIds(@Param("userId") Long userId);

    @Query("SELECT DISTINCT a.userId FROM UserAnswer a WHERE a.answeredAt >= :since")
    List<Long> findUserIdsAnsweredSince(@Param("since") Instant since);

    @Query("SELECT a.answeredAt FROM UserAnswer a WHERE a.userId = :userId AND a.answeredAt >= :since ORDER BY a.answeredAt")
    List<Instant> findAnswerTimes(@Param("userId") Long userId, @Param("since") Instant since);

    /** 教師題組上學生（排除教師本人）的作答統計：[總作答數, 答對數] */
    @Query("""
        SELECT COUNT(a), COALESCE(SUM(CASE WHEN a.correct = true THEN 1 ELSE 0 END), 0)
        FROM UserAnswer a, Question q, Block b
        WHERE q.id = a.questionId AND b.id = q.blockId AND b.creatorId = :teacherId
          AND a.userId <> :teacherId AND a.answeredAt >= :since
    """)
    List<Object[]> tallyStudentsOfCreator(@Param("teacherId") Long teacherId, @Param("since") Instant since);
}
