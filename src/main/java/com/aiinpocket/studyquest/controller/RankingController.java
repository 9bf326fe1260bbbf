package com.aiinpocket.studyquest.controller;

import com.aiinpocket.studyquest.model.dto.LeaderboardEntry;
import com.aiinpocket.studyquest.model.dto.RankingOutcome;
import com.aiinpocket.studyquest.model.dto.RankingStatus;
import com.aiinpocket.studyquest.service.ranking.RankingService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RankingController {

    private static final int MAX_LEADERBOARD = 100;

    private final RankingService rankingService;

    @GetMapping("/users/{userId}/ranking")
    public RankingStatus getStatus(@PathVariable UUID userId) {
        return rankingService.getRankingStatus(userId);
    }

    @PostMapping("/users/{userId}/ranking/check-promotion")
    public RankingOutcome checkPromotion(@PathVariable UUID userId) {
        return rankingService.checkAndPromote(userId);
    }

    @PostMapping("/users/{userId}/ranking/check-downgrade")
    public RankingOutcome checkDowngrade(@PathVariable UUID userId) {
        return rankingService.applyDowngradeIfInactive(userId);
    }

    @GetMapping("/ranking/leaderboard")
    public List<LeaderboardEntry> getLeaderboard(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_LEADERBOARD) {
            throw new IllegalArgumentException("排行榜筆數必須介於 1 到 " + MAX_LEADERBOARD);
        }
        return rankingService.getLeaderboard(limit);
    }
}
