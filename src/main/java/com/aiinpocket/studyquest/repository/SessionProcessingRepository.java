package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.SessionProcessing;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface SessionProcessingRepository extends JpaRepository<SessionProcessing, Long> {

    Optional<SessionProcessing> findByUserIdAndSessionIdAndPipelineVersion(UUID userId, UUID sessionId, int pipelineVersion);

    /** 重算前鎖定冪等鍵，避免與其他節點上仍在進行的結算交錯 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT p FROM SessionProcessing p
        WHERE p.userId = :userId AND p.sessionId = :sessionId AND p.pipelineVersion = :version
    """)
    Optional<SessionProcessing> findKeyForUpdate(@Param("userId") UUID userId, @Param("sessionId") UUID sessionId,
                                                 @Param("version") int version);

    @Modifying
    @Query("""
        DELETE FROM SessionProcessing p
        WHERE p.userId = :userId AND p.sessionId = :sessionId AND p.pipelineVersion = :version
    """)
    int deleteKey(@Param("userId") UUID userId, @Param("sessionId") UUID sessionId, @Param("version") int version);
}
