package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.DailyUserMetrics;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public interface DailyUserMetricsRepository extends JpaRepository<DailyUserMetrics, Long> {

    Optional<DailyUserMetrics> findByUserIdAndMetricDate(UUID userId, LocalDate metricDate);
}
