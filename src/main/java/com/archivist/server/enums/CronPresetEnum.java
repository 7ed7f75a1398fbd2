package com.archivist.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum CronPresetEnum {

    EVERY_MINUTE("Every Minute", "* * * * *", "Run every minute"),

    EVERY_5_MINUTES("Every 5 Minutes", "*/5 * * * *", "Run every 5 minutes"),

    EVERY_15_MINUTES("Every 15 Minutes", "*/15 * * * *", "Run every 15 minutes"),

    EVERY_HOUR("Every Hour", "0 * * * *", "Run every hour"),

    EVERY_6_HOURS("Every 6 Hours", "0 */6 * * *", "Run every 6 hours"),

    DAILY_AT_MIDNIGHT("Daily at Midnight", "0 0 * * *", "Run daily at midnight"),

    DAILY_AT_2_AM("Daily at 2 AM", "0 2 * * *", "Run daily at 2 AM"),

    WEEKLY_ON_SUNDAY("Weekly on Sunday", "0 0 * * 0", "Run weekly on Sunday at midnight"),

    MONTHLY_ON_1ST("Monthly on 1st", "0 0 1 * *", "Run monthly on the 1st at midnight"),

    WEEKDAYS_AT_9_AM("Weekdays at 9 AM", "0 9 * * 1-5", "Run weekdays at 9 AM"),

    WEEKENDS_AT_6_AM("Weekends at 6 AM", "0 6 * * 0,6", "Run weekends at 6 AM")
    ;

    private final String displayName;

    private final String expression;

    private final String description;
}
