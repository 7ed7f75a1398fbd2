package com.archivist.server.util;

import com.archivist.server.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Five-field cron (minute hour day-of-month month day-of-week) on top of Spring's
 * {@link CronExpression}, which expects a leading seconds field. When both day-of-month and
 * day-of-week are restricted a day matching either one fires, as in crontab.
 */
public class CronUtil {

    private static final int FIELD_COUNT = 5;

    private static final int DAY_OF_MONTH = 2;

    private static final int DAY_OF_WEEK = 4;

    private CronUtil() {}

    public static CronExpression parse(String expression) throws ValidationException {
        String[] fields = splitFields(expression);
        return toCronExpression(expression, fields);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    public static String compose(String minute, String hour, String dayOfMonth, String month, String dayOfWeek)
            throws ValidationException {
        if (StringUtils.isAnyBlank(minute, hour, dayOfMonth, month, dayOfWeek)) {
            throw new ValidationException("compose cron failed. every field is required");
        }
        return String.join(" ", minute.trim(), hour.trim(), dayOfMonth.trim(), month.trim(), dayOfWeek.trim());
    }

    /**
     * @return first fire time strictly after {@code from}, or null if the expression never fires again
     */
    public static LocalDateTime nextRun(String expression, LocalDateTime from) throws ValidationException {
        return next(toSchedule(expression), from);
    }

    public static List<LocalDateTime> nextRuns(String expression, LocalDateTime from, int count)
            throws ValidationException {
        List<CronExpression> schedule = toSchedule(expression);
        List<LocalDateTime> result = new ArrayList<>();
        LocalDateTime cursor = from;
        for (int i = 0; i < count; i++) {
            cursor = next(schedule, cursor);
            if (cursor == null) {
                break;
            }
            result.add(cursor);
        }
        return result;
    }

    private static String[] splitFields(String expression) throws ValidationException {
        if (StringUtils.isBlank(expression)) {
            throw new ValidationException("parse cron failed. expression is blank");
        }
        String[] fields = StringUtils.split(expression.trim());
        if (fields.length != FIELD_COUNT) {
            throw new ValidationException("parse cron failed. expression %s must have %s fields, got %s"
                    .formatted(expression, FIELD_COUNT, fields.length));
        }
        return fields;
    }

    private static CronExpression toCronExpression(String expression, String[] fields) throws ValidationException {
        try {
            // 秒固定为 0
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("parse cron failed. expression %s is invalid".formatted(expression), e);
        }
    }

    // day-of-month 和 day-of-week 都有限定时, 任一满足即触发, 拆成两个表达式取较早的
    private static List<CronExpression> toSchedule(String expression) throws ValidationException {
        String[] fields = splitFields(expression);
        CronExpression full = toCronExpression(expression, fields);
        if (isUnrestricted(fields[DAY_OF_MONTH]) || isUnrestricted(fields[DAY_OF_WEEK])) {
            return List.of(full);
        }
        String[] byDayOfMonth = fields.clone();
        byDayOfMonth[DAY_OF_WEEK] = "*";
        String[] byDayOfWeek = fields.clone();
        byDayOfWeek[DAY_OF_MONTH] = "*";
        return List.of(
                toCronExpression(expression, byDayOfMonth),
                toCronExpression(expression, byDayOfWeek));
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static LocalDateTime next(List<CronExpression> schedule, LocalDateTime from) {
        LocalDateTime result = null;
        for (CronExpression cronExpression : schedule) {
            LocalDateTime candidate = cronExpression.next(from);
            if (candidate != null && (result == null || candidate.isBefore(result))) {
                result = candidate;
            }
        }
        return result;
    }
}
