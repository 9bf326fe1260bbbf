package com.aiinpocket.studyquest.service;

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
 * 以 PostgreSQL Advisory Lock 實作的跨 Pod 互斥，用於 Quartz 排程任務。
 *
 * <p>Advisory lock 綁定在資料庫連線上，取得與釋放必須使用同一條連線，
 * 因此整個任務在同一個 {@link ConnectionCallback} 內執行。
 * pg_try_advisory_lock() 不阻塞：其他 Pod 持有鎖時直接跳過。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    private final JdbcTemplate jdbcTemplate;

    /**
     * 在鎖保護下執行任務。無法取得鎖時直接跳過。
     *
     * @param lockId   鎖的唯一識別碼（每個排程任務固定一個值）
     * @param taskName 任務名稱（用於日誌）
     * @param task     要執行的任務
     * @return true 如果任務被執行
     */
    public boolean executeWithLock(long lockId, String taskName, Runnable task) {
        Boolean executed = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            if (!query(connection, "SELECT pg_try_advisory_lock(?)", lockId)) {
                log.debug("[分散式鎖] {} 已被其他 Pod 處理，跳過 (lockId={})", taskName, lockId);
                return false;
            }
            try {
                task.run();
                return true;
            } finally {
                query(connection, "SELECT pg_advisory_unlock(?)", lockId);
            }
        });
        return Boolean.TRUE.equals(executed);
    }

    private static boolean query(Connection connection, String sql, long lockId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setLong(1, lockId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
