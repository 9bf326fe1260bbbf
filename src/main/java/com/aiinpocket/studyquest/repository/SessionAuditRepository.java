package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.SessionAudit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface SessionAuditRepository extends JpaRepository<SessionAudit, Long> {

    /** 寬恕計算用：歷史窗口內的調整後懷疑分數 */
    @Query("SELECT a.suspicionScore FROM SessionAudit a WHERE a.userId = :userId AND a.createdAt >= :since")
    List<Integer> findScoresSince(@Param("userId") UUID userId, @Param("since") Instant since);

    @Modifying
    @Query("DELETE FROM SessionAudit a WHERE a.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") UUID sessionId);
}
