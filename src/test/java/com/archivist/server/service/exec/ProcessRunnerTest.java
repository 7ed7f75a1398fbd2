package com.archivist.server.service.exec;

import com.archivist.server.model.exec.CommandResult;
import org.apache.commons.lang3.time.StopWatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessRunnerTest {

    private final ProcessRunner processRunner = new ProcessRunner();

    @Test
    void shouldCaptureStdoutOnSuccess() {
        CommandResult result = processRunner.execute("echo", List.of("hello", "world"), Duration.ofSeconds(10));

        assertTrue(result.isSuccess());
        assertEquals(0, result.getExitCode());
        assertEquals("hello world", result.getStdout());
    }

    @Test
    void shouldPreserveNonZeroExitCode() {
        CommandResult result = processRunner.execute(
                "sh", List.of("-c", "echo oops >&2; exit 3"), Duration.ofSeconds(10));

        assertFalse(result.isSuccess());
        assertEquals(3, result.getExitCode());
        assertEquals("oops", result.getStderr());
    }

    @Test
    void shouldPassArgumentsWithoutShellInterpretation() {
        CommandResult result = processRunner.execute("echo", List.of("a;b", "$HOME", "x y"), Duration.ofSeconds(10));

        assertTrue(result.isSuccess());
        assertEquals("a;b $HOME x y", result.getStdout());
    }

    @Test
    void shouldKillProcessAfterTimeout() {
        StopWatch stopWatch = StopWatch.createStarted();
        CommandResult result = processRunner.execute("sleep", List.of("30"), Duration.ofSeconds(1));
        stopWatch.stop();

        assertFalse(result.isSuccess());
        assertEquals(CommandResult.ERROR_WITHOUT_EXITCODE, result.getExitCode());
        assertTrue(result.getStderr().contains("timed out after 1 seconds"), result.getStderr());
        assertTrue(stopWatch.getTime() < 10_000, "process was not terminated");
    }

    @Test
    void shouldFoldLaunchFailureIntoResult() {
        CommandResult result = processRunner.execute(
                "definitely-not-a-real-binary-4711", List.of(), Duration.ofSeconds(5));

        assertFalse(result.isSuccess());
        assertEquals(CommandResult.ERROR_WITHOUT_EXITCODE, result.getExitCode());
        assertFalse(result.getStderr().isEmpty());
    }

    @Test
    void shouldApplyEnvironmentOverrideAndWorkingDirectory(@TempDir Path tempDir) throws IOException {
        CommandResult result = processRunner.execute(
                "sh",
                List.of("-c", "echo $ARCHIVIST_TEST_VAR; pwd"),
                Map.of("ARCHIVIST_TEST_VAR", "from-override"),
                tempDir.toString(),
                Duration.ofSeconds(10));

        assertTrue(result.isSuccess());
        String[] lines = result.getStdout().split("\n");
        assertEquals("from-override", lines[0]);
        assertEquals(tempDir.toRealPath().toString(), Path.of(lines[1]).toRealPath().toString());
    }

    @Test
    void shouldRejectInvalidInputWithoutLaunching() {
        assertFalse(processRunner.execute(" ", List.of(), Duration.ofSeconds(1)).isSuccess());
        assertFalse(processRunner.execute("echo", List.of(), Duration.ZERO).isSuccess());
        assertFalse(processRunner.execute("echo", Arrays.asList("a", null), Duration.ofSeconds(1))
                .isSuccess());
    }
}
