package com.aiinpocket.rewards.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * 分散式鎖服務。
 * 使用 PostgreSQL Advisory Lock 確保多個 Pod 同時收到 Quartz 排程觸發時，
 * 只有一個 Pod 執行驗證、等級重算、到期或每週發放批次。
 *
 * <p>Advisory lock 是 session-level 的鎖，取得與釋放必須在同一個連線上，
 * 所以整個任務在 {@link ConnectionCallback} 內執行，期間占用一條連線。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    private final JdbcTemplate jdbcTemplate;

    /**
     * 在鎖保護下執行任務。
     * 如果無法取得鎖（其他 Pod 正在處理），直接跳過不執行。
     *
     * @param lockId   鎖的唯一識別碼（每種排程一個固定值）
     * @param taskName 任務名稱（用於日誌）
     * @param task     要執行的任務
     * @return true 如果任務被執行
     */
    public boolean executeWithLock(long lockId, String taskName, Runnable task) {
        Boolean executed = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            if (!tryLock(connection, lockId)) {
                log.debug("[分散式鎖] {} 已被其他 Pod 處理，跳過 (lockId={})", taskName, lockId);
                return false;
            }
            try {
                task.run();
                return true;
            } finally {
                unlock(connection, lockId);
            }
        });
        return Boolean.TRUE.equals(executed);
    }

    private boolean tryLock(Connection connection, long lockId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            ps.setLong(1, lockId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private void unlock(Connection connection, long lockId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            ps.setLong(1, lockId);
            ps.executeQuery().close();
        }
    }
}
