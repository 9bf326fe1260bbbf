package com.aiinpocket.studyquest.controller;

import com.aiinpocket.studyquest.model.dto.ForgivenessProfile;
import com.aiinpocket.studyquest.model.dto.GamificationProfile;
import com.aiinpocket.studyquest.model.dto.LevelProgress;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.service.GamificationService;
import com.aiinpocket.studyquest.service.audit.SoftAuditService;
import com.aiinpocket.studyquest.service.streak.StreakService;
import com.aiinpocket.studyquest.service.xp.XpService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/users/{userId}/gamification")
@RequiredArgsConstructor
public class GamificationController {

    private final GamificationService gamificationService;
    private final XpService xpService;
    private final StreakService streakService;
    private final SoftAuditService auditService;

    @GetMapping("/profile")
    public GamificationProfile getProfile(@PathVariable UUID userId) {
        return gamificationService.getProfile(userId);
    }

    @GetMapping("/level")
    public LevelProgress getLevel(@PathVariable UUID userId) {
        return xpService.getLevelProgress(userId);
    }

    @GetMapping("/streak")
    public StreakResult getStreak(@PathVariable UUID userId) {
        return streakService.getCurrentStreak(userId);
    }

    @GetMapping("/forgiveness")
    public Map<String, Object> getForgiveness(@PathVariable UUID userId) {
        ForgivenessProfile profile = auditService.getForgivenessProfile(userId);
        return Map.of("profile", profile, "message", profile.message());
    }

    @GetMapping("/events")
    public List<GamificationProfile.PendingEvent> getEvents(@PathVariable UUID userId) {
        return gamificationService.getPendingEvents(userId);
    }

    @PostMapping("/events/seen")
    public ResponseEntity<Map<String, Integer>> markEventsSeen(@PathVariable UUID userId) {
        int updated = gamificationService.markEventsSeen(userId);
        return ResponseEntity.ok(Map.of("updated", updated));
    }
}
