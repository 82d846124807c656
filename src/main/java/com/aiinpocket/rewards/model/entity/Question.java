package com.aiinpocket.rewards.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "question", indexes = {
        @Index(name = "idx_question_block", columnList = "block_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "block_id", nullable = false)
    private Long blockId;

    @Column(length = 100)
    private String topic;
}
