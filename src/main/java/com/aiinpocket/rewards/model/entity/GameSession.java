package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.GameSessionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一場遊戲（單人或多人）。gameType 為遊戲模式代碼，例如 duelo、trivial。
 */
@Entity
@Table(name = "game_session", indexes = {
        @Index(name = "idx_game_session_block_status", columnList = "block_id, status"),
        @Index(name = "idx_game_session_started", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_type", nullable = false, length = 30)
    private String gameType;

    @Column(name = "block_id")
    private Long blockId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private GameSessionStatus status = GameSessionStatus.COMPLETED;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<GameSessionPlayer> players = new ArrayList<>();

    public void addPlayer(GameSessionPlayer player) {
        player.setSession(this);
        players.add(player);
    }

    /** 遊戲時長（尚未結束時為 0） */
    public Duration duration() {
        if (endedAt == null || endedAt.isBefore(startedAt)) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }
}
