package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.RankingEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface RankingEventRepository extends JpaRepository<RankingEvent, Long> {

    List<RankingEvent> findTop10ByUserIdOrderByCreatedAtDesc(UUID userId);
}
