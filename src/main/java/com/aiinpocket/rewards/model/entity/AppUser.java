package com.aiinpocket.rewards.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 平台使用者 Entity。
 * 每位使用者只有一種可流通的點數餘額，餘額欄位是帳本的快取，
 * 只能透過 {@code LedgerService} 在交易中修改。
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 顯示名稱（排行榜、通知用） */
    @Column(name = "display_name", length = 100)
    private String displayName;

    /** 點數餘額（不可為負數，與已完成轉帳的加總一致） */
    @Column(nullable = false, columnDefinition = "bigint default 0")
    @Builder.Default
    private Long balance = 0L;

    /** 是否為內容創作者（計算 CREATOR 等級） */
    @Column(name = "content_creator", nullable = false)
    @Builder.Default
    private boolean contentCreator = false;

    /** 是否為教師（計算 TEACHER 等級） */
    @Column(nullable = false)
    @Builder.Default
    private boolean teacher = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
