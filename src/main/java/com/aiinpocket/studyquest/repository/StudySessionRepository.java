package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.StudySession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface StudySessionRepository extends JpaRepository<StudySession, UUID> {

    /** 連續天數計算用：使用者在指定時間點（含）以前的所有 session 時間，由舊到新 */
    @Query("""
        SELECT s.createdAt FROM StudySession s
        WHERE s.userId = :userId AND s.createdAt <= :upTo
        ORDER BY s.createdAt ASC
    """)
    List<Instant> findCreatedAtByUserIdUpTo(@Param("userId") UUID userId, @Param("upTo") Instant upTo);

    long countByUserId(UUID userId);
}
