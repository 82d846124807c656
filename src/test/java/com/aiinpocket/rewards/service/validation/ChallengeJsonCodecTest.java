package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.config.JacksonConfig;
import com.aiinpocket.rewards.exception.ChallengeConfigException;
import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.config.CompetitionConfig;
import com.aiinpocket.rewards.model.config.LevelConfig;
import com.aiinpocket.rewards.model.config.MarathonConfig;
import com.aiinpocket.rewards.model.config.TemporalConfig;
import com.aiinpocket.rewards.model.enums.ChallengeType;
import com.aiinpocket.rewards.model.enums.ObjectiveType;
import com.aiinpocket.rewards.model.progress.ChallengeProgress;
import com.aiinpocket.rewards.model.progress.ConsolidationProgress;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChallengeJsonCodecTest {

    private final ChallengeJsonCodec codec = new ChallengeJsonCodec(new JacksonConfig().jsonMapper());

    @Test
    void missingFieldsTakeDefaults() {
        ChallengeConfig config = codec.readValidConfig(ChallengeType.MARATHON, "{\"required_blocks\":[4,5]}");

        assertThat(config).isEqualTo(new MarathonConfig(List.of(4L, 5L), 70.0, 3, true));
    }

    @Test
    void competitionWithoutModesUsesDefaultModes() {
        CompetitionConfig config = (CompetitionConfig) codec.readValidConfig(ChallengeType.COMPETITION,
                "{\"required_wins\":3,\"game_modes\":[]}");

        assertThat(config.gameModes()).containsExactly("duelo", "trivial");
        assertThat(config.minWinRate()).isEqualTo(0.6);
    }

    @Test
    void levelTargetsAreKeyedByBlockId() {
        LevelConfig config = (LevelConfig) codec.readValidConfig(ChallengeType.LEVEL,
                "{\"target_levels\":{\"12\":3,\"15\":4}}");

        assertThat(config.targetLevels()).containsEntry(12L, 3).containsEntry(15L, 4);
    }

    @Test
    void temporalObjectivesAcceptSnakeCaseKinds() {
        TemporalConfig config = (TemporalConfig) codec.readValidConfig(ChallengeType.TEMPORAL, """
                {"objectives":[
                  {"id":"win","type":"games_won","target_wins":3},
                  {"id":"study","type":"consolidation_reached","target_block_id":9,"target_percentage":80}
                ],"weights":{"win":2}}
                """);

        assertThat(config.objectives()).extracting(TemporalConfig.Objective::type)
                .containsExactly(ObjectiveType.GAMES_WON, ObjectiveType.CONSOLIDATION_REACHED);
        assertThat(config.weightOf("win")).isEqualTo(2.0);
        assertThat(config.weightOf("study")).isEqualTo(1.0);
    }

    @Test
    void duplicateObjectiveIdsAreRejected() {
        String json = """
                {"objectives":[
                  {"id":"a","type":"games_won","target_wins":3},
                  {"id":"a","type":"games_won","target_wins":5}
                ]}
                """;

        assertThatThrownBy(() -> codec.readValidConfig(ChallengeType.TEMPORAL, json))
                .isInstanceOf(ChallengeConfigException.class)
                .hasMessageContaining("重複");
    }

    @Test
    void zeroTotalWeightIsRejected() {
        String json = """
                {"objectives":[{"id":"a","type":"games_won","target_wins":3}],"weights":{"a":0}}
                """;

        assertThatThrownBy(() -> codec.readValidConfig(ChallengeType.TEMPORAL, json))
                .isInstanceOf(ChallengeConfigException.class);
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThatThrownBy(() -> codec.readValidConfig(ChallengeType.MARATHON,
                "{\"required_blocks\":[1],\"min_average_score\":120}"))
                .isInstanceOf(ChallengeConfigException.class);
        assertThatThrownBy(() -> codec.readValidConfig(ChallengeType.CONSOLIDATION, "{\"target_percentage\":80}"))
                .isInstanceOf(ChallengeConfigException.class)
                .hasMessageContaining("target_block_id");
    }

    @Test
    void malformedJsonBecomesConfigException() {
        assertThatThrownBy(() -> codec.readConfig(ChallengeType.STREAK, "{not json"))
                .isInstanceOf(ChallengeConfigException.class);
        assertThatThrownBy(() -> codec.readConfig(ChallengeType.STREAK, " "))
                .isInstanceOf(ChallengeConfigException.class);
    }

    @Test
    void progressSnapshotIsRestoredByType() {
        ConsolidationProgress progress = new ConsolidationProgress(80.0, 85.0, 10, 8, 2, 94.1);

        ChallengeProgress restored = codec.readProgress(ChallengeType.CONSOLIDATION, codec.writeProgress(progress));

        assertThat(restored).isEqualTo(progress);
        assertThat(codec.readProgress(ChallengeType.CONSOLIDATION, null)).isNull();
    }

    @Test
    void unreadableMetricsSnapshotIsEmpty() {
        assertThat(codec.readMap("{broken")).isEmpty();
        assertThat(codec.readMap(codec.writeMap(Map.of("active_users", 12)))).containsEntry("active_users", 12);
    }
}
