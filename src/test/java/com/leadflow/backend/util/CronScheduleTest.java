package com.leadflow.backend.util;

import com.leadflow.backend.exceptions.InvalidCronExpressionException;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.*;

class CronScheduleTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void parse_NormalizesWhitespace() {
        CronSchedule schedule = CronSchedule.parse("  0   9 * *  * ");

        assertThat(schedule.getExpression()).isEqualTo("0 9 * * *");
    }

    @Test
    void parse_RejectsWrongFieldCount() {
        assertThatThrownBy(() -> CronSchedule.parse("0 0 9 * * *"))
                .isInstanceOf(InvalidCronExpressionException.class)
                .hasMessageContaining("found 6");

        assertThatThrownBy(() -> CronSchedule.parse("0 9 *"))
                .isInstanceOf(InvalidCronExpressionException.class);
    }

    @Test
    void parse_RejectsOutOfRangeAndEmpty() {
        assertThat(CronSchedule.isValid("61 9 * * *")).isFalse();
        assertThat(CronSchedule.isValid("0 25 * * *")).isFalse();
        assertThat(CronSchedule.isValid("")).isFalse();
        assertThat(CronSchedule.isValid(null)).isFalse();
        assertThat(CronSchedule.isValid("*/15 * * * 1-5")).isTrue();
    }

    @Test
    void matches_DailyAtNine() {
        CronSchedule schedule = CronSchedule.parse("0 9 * * *");

        assertThat(schedule.matches(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, UTC))).isTrue();
        assertThat(schedule.matches(ZonedDateTime.of(2026, 3, 2, 9, 0, 42, 0, UTC))).isTrue();
        assertThat(schedule.matches(ZonedDateTime.of(2026, 3, 2, 9, 1, 0, 0, UTC))).isFalse();
        assertThat(schedule.matches(ZonedDateTime.of(2026, 3, 2, 8, 59, 59, 0, UTC))).isFalse();
    }

    @Test
    void matches_WeekdaysOnly() {
        CronSchedule schedule = CronSchedule.parse("30 8 * * 1-5");

        // 2026-03-06 is a Friday, 2026-03-07 a Saturday
        assertThat(schedule.matches(ZonedDateTime.of(2026, 3, 6, 8, 30, 0, 0, UTC))).isTrue();
        assertThat(schedule.matches(ZonedDateTime.of(2026, 3, 7, 8, 30, 0, 0, UTC))).isFalse();
    }

    @Test
    void next_ReturnsFollowingFiring() {
        CronSchedule schedule = CronSchedule.parse("0 9 * * *");

        ZonedDateTime next = schedule.next(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, UTC));

        assertThat(next).isEqualTo(ZonedDateTime.of(2026, 3, 3, 9, 0, 0, 0, UTC));
    }

    @Test
    void describe_KnownAndUnknownExpressions() {
        assertThat(CronDescriptions.describe("0 9 * * *")).isEqualTo("Daily at 9:00 AM");
        assertThat(CronDescriptions.describe("7 3 * * 2")).isEqualTo("7 3 * * 2");
    }
}
