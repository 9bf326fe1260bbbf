package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.GameEventLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

public interface GameEventLogRepository extends JpaRepository<GameEventLog, Long> {

    List<GameEventLog> findByUserIdAndSeenFalseOrderByCreatedAtDesc(UUID userId);

    @Modifying
    @Transactional
    @Query("UPDATE GameEventLog e SET e.seen = true WHERE e.userId = :userId AND e.seen = false")
    int markAllSeenByUserId(@Param("userId") UUID userId);
}
