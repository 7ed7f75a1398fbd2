package com.archivist.server.util;

import com.archivist.server.exception.BusinessException;
import com.archivist.server.model.exec.CommandResult;
import org.apache.commons.lang3.StringUtils;

public class CommandResultUtil {

    private static final int MESSAGE_MAX_LENGTH = 1000;

    private CommandResultUtil() {}

    /**
     * @return the result itself when it succeeded
     * @throws BusinessException carrying the exit code and stderr otherwise
     */
    public static CommandResult requireSuccess(CommandResult commandResult, String operation)
            throws BusinessException {
        if (!commandResult.isSuccess()) {
            throw new BusinessException("%s failed. exitCode:%s, stderr:%s".formatted(
                    operation,
                    commandResult.getExitCode(),
                    StringUtils.abbreviate(commandResult.getStderr(), MESSAGE_MAX_LENGTH)));
        }
        return commandResult;
    }
}
