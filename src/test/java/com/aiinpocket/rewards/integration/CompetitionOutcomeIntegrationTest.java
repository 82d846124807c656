package com.aiinpocket.rewards.integration;

import com.aiinpocket.rewards.model.config.CompetitionConfig;
import com.aiinpocket.rewards.model.dto.SessionOutcome;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.entity.AppUser;
import com.aiinpocket.rewards.model.entity.GameSession;
import com.aiinpocket.rewards.model.entity.GameSessionPlayer;
import com.aiinpocket.rewards.model.enums.GameSessionStatus;
import com.aiinpocket.rewards.model.progress.CompetitionProgress;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.repository.GameSessionRepository;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import com.aiinpocket.rewards.service.validation.CompetitionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * 多人遊戲成績查詢（H2）：同分並列，以及單人場次、模式、狀態與時間範圍的篩選。
 */
@SpringBootTest
@ActiveProfiles("test")
class CompetitionOutcomeIntegrationTest {

    @Autowired private AppUserRepository userRepo;
    @Autowired private GameSessionRepository sessionRepo;
    @Autowired private ActivityReadModel readModel;
    @Autowired private CompetitionValidator competitionValidator;

    private Instant now;
    private Instant since;
    private Long ana;
    private Long bruno;

    @BeforeEach
    void setUp() {
        now = Instant.now();
        since = now.minus(Duration.ofDays(1));
        ana = userRepo.save(AppUser.builder().displayName("ana-" + now.toEpochMilli()).build()).getId();
        bruno = userRepo.save(AppUser.builder().displayName("bruno-" + now.toEpochMilli()).build()).getId();
    }

    private Long session(String mode, Instant startedAt, GameSessionStatus status, int... scoresAndCorrect) {
        GameSession session = GameSession.builder()
                .gameType(mode)
                .status(status)
                .startedAt(startedAt)
                .endedAt(startedAt.plus(Duration.ofMinutes(10)))
                .build();
        Long[] players = {ana, bruno};
        for (int i = 0; i < scoresAndCorrect.length / 2; i++) {
            session.addPlayer(GameSessionPlayer.builder()
                    .userId(players[i])
                    .score(scoresAndCorrect[2 * i])
                    .correctAnswers(scoresAndCorrect[2 * i + 1])
                    .totalQuestions(10)
                    .build());
        }
        return sessionRepo.save(session).getId();
    }

    @Test
    @DisplayName("同分並列最高分時兩位玩家都算勝場，單人、其他模式與未完成的場次不計入")
    void tiedPlayersBothWinAndSoloGamesAreIgnored() {
        Long tie = session("duelo", now.minus(Duration.ofHours(5)), GameSessionStatus.COMPLETED, 80, 8, 80, 7);
        Long anaWins = session("trivial", now.minus(Duration.ofHours(4)), GameSessionStatus.COMPLETED, 90, 9, 50, 5);
        Long anaLoses = session("duelo", now.minus(Duration.ofHours(3)), GameSessionStatus.COMPLETED, 40, 6, 70, 8);
        session("duelo", now.minus(Duration.ofHours(2)), GameSessionStatus.COMPLETED, 100, 10);
        session("rapido", now.minus(Duration.ofHours(2)), GameSessionStatus.COMPLETED, 100, 10, 10, 1);
        session("duelo", now.minus(Duration.ofDays(3)), GameSessionStatus.COMPLETED, 100, 10, 10, 1);
        session("duelo", now.minus(Duration.ofHours(1)), GameSessionStatus.ABANDONED, 100, 10, 10, 1);

        List<SessionOutcome> anaGames = readModel.multiplayerOutcomes(ana, CompetitionConfig.DEFAULT_GAME_MODES, since);
        List<SessionOutcome> brunoGames = readModel.multiplayerOutcomes(bruno, CompetitionConfig.DEFAULT_GAME_MODES, since);

        assertThat(anaGames)
                .extracting(SessionOutcome::sessionId, SessionOutcome::score, SessionOutcome::maxScore, SessionOutcome::won)
                .containsExactly(
                        tuple(anaLoses, 40, 70, false),
                        tuple(anaWins, 90, 90, true),
                        tuple(tie, 80, 80, true));
        assertThat(brunoGames)
                .filteredOn(SessionOutcome::won)
                .extracting(SessionOutcome::sessionId)
                .containsExactlyInAnyOrder(tie, anaLoses);
    }

    @Test
    @DisplayName("對戰挑戰以資料庫成績驗證：兩勝一敗達成 2 勝、勝率與答對率門檻")
    void competitionChallengeIsValidatedFromStoredGames() {
        session("duelo", now.minus(Duration.ofHours(5)), GameSessionStatus.COMPLETED, 80, 8, 80, 7);
        session("trivial", now.minus(Duration.ofHours(4)), GameSessionStatus.COMPLETED, 90, 9, 50, 5);
        session("duelo", now.minus(Duration.ofHours(3)), GameSessionStatus.COMPLETED, 40, 6, 70, 8);

        ValidationResult<CompetitionProgress> result = competitionValidator.validate(
                new ValidationContext(1L, 1L, ana, since, now), new CompetitionConfig(2, null, 0.6, 0.7));

        assertThat(result.completed()).isTrue();
        assertThat(result.progress().wins()).isEqualTo(2);
        assertThat(result.progress().totalGames()).isEqualTo(3);
    }
}
