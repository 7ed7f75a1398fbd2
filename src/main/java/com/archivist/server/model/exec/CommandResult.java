package com.archivist.server.model.exec;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Outcome of one external process invocation. Execution failures (non-zero exit, launch failure,
 * timeout, rejected arguments) are represented here rather than thrown.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CommandResult {

    // process never produced an exit code: launch failure, timeout or rejected input
    public static final int ERROR_WITHOUT_EXITCODE = -1;

    private final int exitCode;

    private final String stdout;

    private final String stderr;

    private final boolean success;

    private CommandResult(int exitCode, String stdout, String stderr) {
        this.exitCode = exitCode;
        this.stdout = StringUtils.defaultString(stdout);
        this.stderr = StringUtils.defaultString(stderr);
        this.success = exitCode == 0;
    }

    public static CommandResult of(int exitCode, String stdout, String stderr) {
        return new CommandResult(exitCode, stdout, stderr);
    }

    public static CommandResult success(String stdout) {
        return new CommandResult(0, stdout, "");
    }

    public static CommandResult failed(int exitCode, String stdout, String stderr) {
        if (exitCode == 0) {
            exitCode = ERROR_WITHOUT_EXITCODE;
        }
        return new CommandResult(exitCode, stdout, stderr);
    }

    public static CommandResult failed(String stderr) {
        return new CommandResult(ERROR_WITHOUT_EXITCODE, "", stderr);
    }
}
