package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.UserBadge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface UserBadgeRepository extends JpaRepository<UserBadge, Long> {

    List<UserBadge> findByUserIdOrderByUnlockedAtDesc(UUID userId);

    boolean existsByUserIdAndBadgeKey(UUID userId, String badgeKey);
}
