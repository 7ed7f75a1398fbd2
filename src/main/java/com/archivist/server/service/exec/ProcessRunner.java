package com.archivist.server.service.exec;

import com.archivist.server.model.exec.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Executor;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ProcessRunner {

    public CommandResult execute(String command, List<String> arguments, Duration timeout) {
        return execute(command, arguments, null, null, timeout);
    }

    public CommandResult execute(
            String command,
            List<String> arguments,
            Map<String, String> envOverride,
            String workingDirectory,
            Duration timeout) {
        // 参数检查
        if (StringUtils.isBlank(command)) {
            return CommandResult.failed("execute failed. command is blank");
        }
        if (ObjectUtils.isEmpty(timeout) || timeout.isNegative() || timeout.isZero()) {
            return CommandResult.failed("execute failed. timeout %s is not positive".formatted(timeout));
        }
        List<String> argumentList = CollectionUtils.isEmpty(arguments) ? List.of() : new ArrayList<>(arguments);
        if (argumentList.contains(null)) {
            return CommandResult.failed("execute failed. arguments %s contain null".formatted(argumentList));
        }
        // 生成 command line, 参数原样传递, 不做 shell 引号处理
        CommandLine commandLine = new CommandLine(command);
        for (String argument : argumentList) {
            commandLine.addArgument(argument, false);
        }
        String printable = toPrintable(command, argumentList);
        Executor executor = DefaultExecutor.builder().get();
        // 接受所有 exit code, 由 CommandResult 判断成功与否
        executor.setExitValues(null);
        // 1. 工作目录
        if (StringUtils.isNotBlank(workingDirectory)) {
            executor.setWorkingDirectory(new File(workingDirectory));
        }
        // 2. 捕获 stdout/stderr
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
        // 3. 超时后由 watchdog 终止进程
        ExecuteWatchdog watchdog = ExecuteWatchdog.builder().setTimeout(timeout).get();
        executor.setWatchdog(watchdog);
        StopWatch stopWatch = StopWatch.createStarted();
        CommandResult result;
        try {
            // 4. 阻塞执行
            int exitCode = executor.execute(commandLine, genEnv(envOverride));
            result = watchdog.killedProcess() ?
                    timedOut(timeout, stdout) :
                    CommandResult.of(exitCode, getStdAsString(stdout), getStdAsString(stderr));
        } catch (ExecuteException e) {
            result = watchdog.killedProcess() ?
                    timedOut(timeout, stdout) :
                    CommandResult.failed(
                            e.getExitValue(),
                            getStdAsString(stdout),
                            "exception: %s with stderr: %s".formatted(e, getStdAsString(stderr)));
        } catch (IOException e) {
            // binary missing, permission denied, working directory missing
            result = CommandResult.failed(
                    CommandResult.ERROR_WITHOUT_EXITCODE,
                    getStdAsString(stdout),
                    "exception: %s with stderr: %s".formatted(e, getStdAsString(stderr)));
        }
        stopWatch.stop();
        if (result.isSuccess()) {
            log.info("command executed. command:[{}], exitCode:{}, elapsedMillis:{}",
                    printable, result.getExitCode(), stopWatch.getTime());
        } else {
            log.warn("command failed. command:[{}], exitCode:{}, elapsedMillis:{}, stderr:{}",
                    printable, result.getExitCode(), stopWatch.getTime(),
                    StringUtils.abbreviate(result.getStderr(), 500));
        }
        return result;
    }

    private static CommandResult timedOut(Duration timeout, ByteArrayOutputStream stdout) {
        return CommandResult.failed(
                CommandResult.ERROR_WITHOUT_EXITCODE,
                getStdAsString(stdout),
                "Command timed out after %s seconds".formatted(timeout.toSeconds()));
    }

    private static String toPrintable(String command, List<String> arguments) {
        if (CollectionUtils.isEmpty(arguments)) {
            return command;
        }
        return command + " " + String.join(" ", arguments);
    }

    private static String getStdAsString(ByteArrayOutputStream std) {
        if (ObjectUtils.isEmpty(std)) {
            return "";
        }
        return std.toString(StandardCharsets.UTF_8).trim();
    }

    private static Map<String, String> genEnv(Map<String, String> envOverride) {
        // 继承当前系统变量, 再覆盖
        Map<String, String> result = new HashMap<>(System.getenv());
        if (MapUtils.isNotEmpty(envOverride)) {
            result.putAll(envOverride);
        }
        return result;
    }
}
