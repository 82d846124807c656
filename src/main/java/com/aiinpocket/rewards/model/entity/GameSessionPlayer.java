package com.aiinpocket.rewards.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "game_session_player", uniqueConstraints = {
        @UniqueConstraint(name = "uk_session_player", columnNames = {"session_id", "user_id"})
}, indexes = {
        @Index(name = "idx_session_player_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSessionPlayer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private GameSession session;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    @Builder.Default
    private Integer score = 0;

    @Column(name = "correct_answers", nullable = false)
    @Builder.Default
    private Integer correctAnswers = 0;

    @Column(name = "total_questions", nullable = false)
    @Builder.Default
    private Integer totalQuestions = 0;
}
