package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.SessionEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SessionEventRepository extends JpaRepository<SessionEvent, Long> {

    List<SessionEvent> findBySessionIdOrderByCreatedAtAscIdAsc(UUID sessionId);
}
