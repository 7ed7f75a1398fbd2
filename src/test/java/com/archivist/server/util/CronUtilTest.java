package com.archivist.server.util;

import com.archivist.server.enums.CronPresetEnum;
import com.archivist.server.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CronUtilTest {

    private static final LocalDateTime NOON = LocalDateTime.of(2024, 5, 1, 12, 0, 0);

    @Test
    void everyFiveMinutesFiresFiveMinutesAhead() {
        assertEquals(NOON.plusMinutes(5), CronUtil.nextRun("*/5 * * * *", NOON));
    }

    @Test
    void everyFiveMinutesAlignsToBoundary() {
        assertEquals(LocalDateTime.of(2024, 5, 1, 12, 5),
                CronUtil.nextRun("*/5 * * * *", LocalDateTime.of(2024, 5, 1, 12, 2, 30)));
    }

    @Test
    void dailyAtTwo() {
        assertEquals(LocalDateTime.of(2024, 5, 2, 2, 0), CronUtil.nextRun("0 2 * * *", NOON));
    }

    @Test
    void restrictedDayOfMonthOrDayOfWeekFires() {
        // 1 号或者周一
        assertEquals(LocalDateTime.of(2024, 1, 8, 0, 0),
                CronUtil.nextRun("0 0 1 * 1", LocalDateTime.of(2024, 1, 2, 0, 0)));
        assertEquals(
                List.of(LocalDateTime.of(2024, 1, 29, 0, 0),
                        LocalDateTime.of(2024, 2, 1, 0, 0),
                        LocalDateTime.of(2024, 2, 5, 0, 0)),
                CronUtil.nextRuns("0 0 1 * 1", LocalDateTime.of(2024, 1, 25, 0, 0), 3));
    }

    @Test
    void impossibleDayOfMonthStillFiresOnDayOfWeek() {
        // 2 月 30 日不存在, 仍按周一触发
        assertEquals(LocalDateTime.of(2024, 2, 5, 0, 0),
                CronUtil.nextRun("0 0 30 2 1", LocalDateTime.of(2024, 2, 1, 0, 0)));
    }

    @Test
    void nextRunsAreConsecutive() {
        List<LocalDateTime> runs = CronUtil.nextRuns("0 * * * *", NOON, 3);

        assertEquals(List.of(NOON.plusHours(1), NOON.plusHours(2), NOON.plusHours(3)), runs);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "* * * *", "0 * * * * *", "61 * * * *", "* 25 * * *", "not a cron"})
    void rejectsInvalidExpressions(String expression) {
        assertThrows(ValidationException.class, () -> CronUtil.parse(expression));
        assertFalse(CronUtil.isValid(expression));
    }

    @Test
    void everyPresetIsValid() {
        for (CronPresetEnum preset : CronPresetEnum.values()) {
            assertTrue(CronUtil.isValid(preset.getExpression()), preset.name());
        }
    }

    @Test
    void composeJoinsFields() {
        assertEquals("0 2 * * 1-5", CronUtil.compose("0", "2", "*", "*", "1-5"));
        assertThrows(ValidationException.class, () -> CronUtil.compose("0", "", "*", "*", "*"));
    }
}
