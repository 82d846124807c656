package com.aiinpocket.rewards.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 題組（學習主題）。由出題平台寫入，本服務只讀取。
 */
@Entity
@Table(name = "content_block", indexes = {
        @Index(name = "idx_block_creator", columnList = "creator_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Block {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "creator_id", nullable = false)
    private Long creatorId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
