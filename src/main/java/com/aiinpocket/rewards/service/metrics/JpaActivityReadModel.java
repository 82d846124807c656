package com.aiinpocket.rewards.service.metrics;

import com.aiinpocket.rewards.model.dto.AnswerTally;
import com.aiinpocket.rewards.model.dto.BlockAttempts;
import com.aiinpocket.rewards.model.dto.DailyActivity;
import com.aiinpocket.rewards.model.dto.SessionOutcome;
import com.aiinpocket.rewards.model.entity.GameSession;
import com.aiinpocket.rewards.model.enums.GameSessionStatus;
import com.aiinpocket.rewards.repository.BlockRepository;
import com.aiinpocket.rewards.repository.GameSessionPlayerRepository;
import com.aiinpocket.rewards.repository.GameSessionRepository;
import com.aiinpocket.rewards.repository.QuestionRepository;
import com.aiinpocket.rewards.repository.UserAnswerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 以 JPA 查詢實作的活動投影。只讀取，不持有任何鎖。
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaActivityReadModel implements ActivityReadModel {

    private final UserAnswerRepository answerRepo;
    private final QuestionRepository questionRepo;
    private final GameSessionRepository sessionRepo;
    private final GameSessionPlayerRepository playerRepo;
    private final BlockRepository blockRepo;

    @Override
    public AnswerTally answerTally(Long userId, Long blockId, Instant since, Collection<String> topics) {
        List<Object[]> rows = topics == null || topics.isEmpty()
                ? answerRepo.tallyByBlock(userId, blockId, since)
                : answerRepo.tallyByBlockAndTopics(userId, blockId, since, topics);
        if (rows.isEmpty()) {
            return AnswerTally.EMPTY;
        }
        Object[] row = rows.get(0);
        return new AnswerTally(toLong(row[0]), toLong(row[1]), toLong(row[2]));
    }

    @Override
    public double blockConsolidation(Long userId, Long blockId) {
        long totalQuestions = questionRepo.countByBlockId(blockId);
        if (totalQuestions == 0) {
            return 0.0;
        }
        long mastered = answerRepo.countDistinctCorrectQuestions(userId, blockId);
        return mastered * 100.0 / totalQuestions;
    }

    @Override
    public BlockAttempts blockAttempts(Long userId, Long blockId, Instant since) {
        List<Object[]> rows = playerRepo.attemptsByBlock(userId, blockId, GameSessionStatus.COMPLETED, since);
        if (rows.isEmpty() || toLong(rows.get(0)[0]) == 0) {
            return BlockAttempts.NONE;
        }
        Object[] row = rows.get(0);
        return new BlockAttempts((int) toLong(row[0]), toLong(row[1]));
    }

    @Override
    public List<DailyActivity> dailyActivity(Long userId, Instant since, ZoneId zone) {
        List<GameSession> sessions = sessionRepo.findPlayedByUser(userId, GameSessionStatus.COMPLETED, since);
        if (sessions.isEmpty()) {
            return List.of();
        }
        List<Instant> answerTimes = answerRepo.findAnswerTimes(userId, since);

        Map<LocalDate, DayTotals> byDay = new TreeMap<>();
        for (GameSession session : sessions) {
            LocalDate day = session.getStartedAt().atZone(zone).toLocalDate();
            DayTotals totals = byDay.computeIfAbsent(day, d -> new DayTotals());
            totals.sessions++;
            totals.minutes += session.duration().toSeconds() / 60.0;
            if (session.getEndedAt() != null) {
                totals.questions += (int) answerTimes.stream()
                        .filter(t -> !t.isBefore(session.getStartedAt()) && !t.isAfter(session.getEndedAt()))
                        .count();
            }
        }

        List<DailyActivity> result = new ArrayList<>(byDay.size());
        byDay.forEach((day, t) -> result.add(new DailyActivity(day, t.sessions, t.minutes, t.questions)));
        return result;
    }

    @Override
    public List<SessionOutcome> multiplayerOutcomes(Long userId, Collection<String> gameModes, Instant since) {
        return playerRepo.findMultiplayerOutcomes(userId, gameModes, GameSessionStatus.COMPLETED, since).stream()
                .map(row -> new SessionOutcome(
                        toLong(row[0]),
                        (String) row[1],
                        (int) toLong(row[2]),
                        (int) toLong(row[3]),
                        (int) toLong(row[4]),
                        (int) toLong(row[5])))
                .toList();
    }

    @Override
    public long activePlayers(Long creatorId, Instant since) {
        return playerRepo.countDistinctPlayersOfCreator(creatorId, GameSessionStatus.COMPLETED, since);
    }

    @Override
    public long activeStudents(Long teacherId, Instant since) {
        return playerRepo.countDistinctStudentsOfCreator(teacherId, GameSessionStatus.COMPLETED, since);
    }

    @Override
    public double studentAverageConsolidation(Long teacherId, Instant since) {
        List<Object[]> rows = answerRepo.tallyStudentsOfCreator(teacherId, since);
        if (rows.isEmpty()) {
            return 0.0;
        }
        return new AnswerTally(toLong(rows.get(0)[0]), toLong(rows.get(0)[1]), 0).percentage();
    }

    @Override
    public List<Long> answeredBlockIds(Long userId) {
        return answerRepo.findAnsweredBlockIds(userId);
    }

    @Override
    public Set<Long> recentlyActiveUserIds(Instant since) {
        Set<Long> userIds = new LinkedHashSet<>(answerRepo.findUserIdsAnsweredSince(since));
        userIds.addAll(playerRepo.findUserIdsPlayedSince(since));
        userIds.addAll(blockRepo.findCreatorIdsOfBlocksPlayedSince(since));
        return userIds;
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static final class DayTotals {
        int sessions;
        double minutes;
        int questions;
    }
}
