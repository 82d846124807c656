package com.aiinpocket.rewards.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 使用者作答紀錄。同一題可作答多次。
 */
@Entity
@Table(name = "user_answer", indexes = {
        @Index(name = "idx_answer_user_time", columnList = "user_id, answered_at"),
        @Index(name = "idx_answer_question", columnList = "question_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAnswer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "question_id", nullable = false)
    private Long questionId;

    @Column(nullable = false)
    private boolean correct;

    @Column(name = "answered_at", nullable = false)
    private Instant answeredAt;
}
