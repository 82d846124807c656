package com.aiinpocket.rewards.service.metrics;

import com.aiinpocket.rewards.model.dto.AnswerTally;
import com.aiinpocket.rewards.model.dto.BlockAttempts;
import com.aiinpocket.rewards.model.dto.DailyActivity;
import com.aiinpocket.rewards.model.dto.SessionOutcome;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 活動資料的唯讀投影（作答、遊戲、題組）。驗證器與等級計算只透過此介面讀取活動。
 */
public interface ActivityReadModel {

    /**
     * 使用者在題組中 {@code since} 之後的作答統計。
     *
     * @param topics 只計算這些主題的題目，空集合表示不限制
     */
    AnswerTally answerTally(Long userId, Long blockId, Instant since, Collection<String> topics);

    /** 題組鞏固度：至少答對一次的不重複題數 / 題組總題數 × 100 */
    double blockConsolidation(Long userId, Long blockId);

    /** 題組中 {@code since} 之後已結束的遊戲次數與最佳分數 */
    BlockAttempts blockAttempts(Long userId, Long blockId, Instant since);

    /** 依時區切日的每日活動量，依日期遞增排序，沒有活動的日子不會出現 */
    List<DailyActivity> dailyActivity(Long userId, Instant since, ZoneId zone);

    /** 指定模式、已結束的多人遊戲成績，最新的在前 */
    List<SessionOutcome> multiplayerOutcomes(Long userId, Collection<String> gameModes, Instant since);

    /** 在創作者題組上遊玩的不重複玩家數 */
    long activePlayers(Long creatorId, Instant since);

    /** 同上，但不計創作者本人 */
    long activeStudents(Long teacherId, Instant since);

    /** 學生在教師題組上的答對率 */
    double studentAverageConsolidation(Long teacherId, Instant since);

    /** 使用者曾作答過的題組 */
    List<Long> answeredBlockIds(Long userId);

    /** {@code since} 之後有作答、遊玩的使用者，以及有人遊玩其題組的創作者 */
    Set<Long> recentlyActiveUserIds(Instant since);
}
