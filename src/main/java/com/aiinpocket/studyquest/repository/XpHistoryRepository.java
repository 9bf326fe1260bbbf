package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.XpHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface XpHistoryRepository extends JpaRepository<XpHistoryEntry, Long> {

    @Query("SELECT COALESCE(SUM(x.amount), 0) FROM XpHistoryEntry x WHERE x.userId = :userId AND x.sessionId = :sessionId")
    long sumAmountByUserIdAndSessionId(@Param("userId") UUID userId, @Param("sessionId") UUID sessionId);

    @Modifying
    @Query("DELETE FROM XpHistoryEntry x WHERE x.userId = :userId AND x.sessionId = :sessionId")
    int deleteByUserIdAndSessionId(@Param("userId") UUID userId, @Param("sessionId") UUID sessionId);
}
