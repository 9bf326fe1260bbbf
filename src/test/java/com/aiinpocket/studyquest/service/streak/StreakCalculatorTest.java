package com.aiinpocket.studyquest.service.streak;

import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.enums.StreakMilestone;
import com.aiinpocket.studyquest.support.TestGamificationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StreakCalculator")
class StreakCalculatorTest {

    private static final Instant DAY_1 = Instant.parse("2026-03-01T06:00:00Z");

    private final StreakCalculator calculator = new StreakCalculator(TestGamificationProperties.defaults());

    private static List<Instant> dailySessions(int days) {
        List<Instant> times = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            times.add(DAY_1.plus(Duration.ofDays(i)));
        }
        return times;
    }

    @Nested
    @DisplayName("36 小時連續窗口")
    class ContinuityWindow {

        @Test
        @DisplayName("35 小時 59 分仍保留")
        void keepsJustInsideWindow() {
            StreakResult result = calculator.calculate(List.of(DAY_1), DAY_1.plus(Duration.ofMinutes(35 * 60 + 59)), 0);

            assertThat(result.currentStreak()).isEqualTo(1);
        }

        @Test
        @DisplayName("剛好 36 小時仍保留")
        void keepsAtExactBoundary() {
            StreakResult result = calculator.calculate(List.of(DAY_1), DAY_1.plus(Duration.ofHours(36)), 0);

            assertThat(result.currentStreak()).isEqualTo(1);
            assertThat(result.active()).isTrue();
        }

        @Test
        @DisplayName("36 小時 1 分歸零，但最佳紀錄保留")
        void breaksJustOutsideWindow() {
            StreakResult result = calculator.calculate(dailySessions(3),
                    DAY_1.plus(Duration.ofDays(2)).plus(Duration.ofMinutes(36 * 60 + 1)), 0);

            assertThat(result.currentStreak()).isZero();
            assertThat(result.bestStreak()).isEqualTo(3);
            assertThat(result.multiplier()).isEqualTo(1.0);
            assertThat(result.milestoneReached()).isNull();
        }
    }

    @Nested
    @DisplayName("日曆日計算")
    class CalendarDays {

        @Test
        @DisplayName("UTC 19:00 已是 +05:30 的隔天")
        void anchorsToFixedOffset() {
            Instant utcEvening = Instant.parse("2026-03-01T19:00:00Z");

            assertThat(calculator.anchorDate(utcEvening)).isEqualTo(LocalDate.of(2026, 3, 2));
            assertThat(calculator.anchorDate(Instant.parse("2026-03-01T18:29:59Z")))
                    .isEqualTo(LocalDate.of(2026, 3, 1));
        }

        @Test
        @DisplayName("同一 UTC 日的兩次 session 在錨定時區跨日時算兩天")
        void sameUtcDayCanBeTwoAnchorDays() {
            List<Instant> times = List.of(
                    Instant.parse("2026-03-01T10:00:00Z"),
                    Instant.parse("2026-03-01T19:00:00Z"));

            StreakResult result = calculator.calculate(times, Instant.parse("2026-03-01T20:00:00Z"), 0);

            assertThat(result.currentStreak()).isEqualTo(2);
        }

        @Test
        @DisplayName("同一天多次 session 只算一天")
        void multipleSessionsSameDay() {
            List<Instant> times = List.of(DAY_1, DAY_1.plus(Duration.ofHours(2)), DAY_1.plus(Duration.ofHours(4)));

            StreakResult result = calculator.calculate(times, DAY_1.plus(Duration.ofHours(5)), 0);

            assertThat(result.currentStreak()).isEqualTo(1);
            assertThat(result.bestStreak()).isEqualTo(1);
        }

        @Test
        @DisplayName("中斷一天後 current 從最近區段重新計算，best 保留最長區段")
        void gapResetsCurrentRun() {
            List<Instant> times = new ArrayList<>(dailySessions(4));
            times.remove(2);

            StreakResult result = calculator.calculate(times, DAY_1.plus(Duration.ofDays(3)).plusSeconds(60), 0);

            assertThat(result.currentStreak()).isEqualTo(1);
            assertThat(result.bestStreak()).isEqualTo(2);
        }

        @Test
        @DisplayName("沒有任何 session")
        void emptyHistory() {
            StreakResult result = calculator.calculate(List.of(), DAY_1, 5);

            assertThat(result.currentStreak()).isZero();
            assertThat(result.bestStreak()).isEqualTo(5);
            assertThat(result.bonusXp()).isZero();
        }
    }

    @Nested
    @DisplayName("倍率、獎勵與里程碑")
    class Rewards {

        @Test
        @DisplayName("連續 7 天：倍率 1.7、獎勵 2 XP、首次達成 7 天里程碑")
        void sevenDayStreak() {
            StreakResult result = calculator.calculate(dailySessions(7), DAY_1.plus(Duration.ofDays(6)).plusSeconds(60), 6);

            assertThat(result.currentStreak()).isEqualTo(7);
            assertThat(result.multiplier()).isEqualTo(1.7);
            assertThat(result.bonusXp()).isEqualTo(2);
            assertThat(result.milestoneReached()).isEqualTo(StreakMilestone.DAYS_7);
        }

        @Test
        @DisplayName("最佳紀錄已達過的里程碑不會重發")
        void milestoneOnlyOnce() {
            StreakResult result = calculator.calculate(dailySessions(3), DAY_1.plus(Duration.ofDays(2)).plusSeconds(60), 10);

            assertThat(result.milestoneReached()).isNull();
            assertThat(result.bestStreak()).isEqualTo(10);
        }

        @ParameterizedTest(name = "{0} 天 → 倍率 {1}")
        @CsvSource({"0, 1.0", "1, 1.1", "5, 1.5", "10, 2.0", "40, 2.0"})
        void multiplierIsCapped(int streak, double expected) {
            assertThat(StreakCalculator.multiplierFor(streak)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} 天 → 獎勵 {1}")
        @CsvSource({"6, 0", "7, 2", "14, 4", "175, 50", "365, 50"})
        void bonusIsCapped(int streak, int expected) {
            assertThat(StreakCalculator.bonusFor(streak)).isEqualTo(expected);
        }
    }
}
