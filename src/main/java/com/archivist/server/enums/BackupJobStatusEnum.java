package com.archivist.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

@AllArgsConstructor
@Getter
public enum BackupJobStatusEnum {

    RUNNING("running"),

    COMPLETED("completed"),

    FAILED("failed"),

    CANCELLED("cancelled"),

    UNKNOWN("unknown")
    ;

    private final String name;

    private static final Set<BackupJobStatusEnum> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public static BackupJobStatusEnum fromName(String name) {
        for (BackupJobStatusEnum value : values()) {
            if (value.name.equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    // running 只能迁移一次到终态, 终态不可再变
    public static boolean isTransitionProhibit(String from, BackupJobStatusEnum to) {
        BackupJobStatusEnum fromStatus = fromName(from);
        return fromStatus != RUNNING || !to.isTerminal();
    }
}
