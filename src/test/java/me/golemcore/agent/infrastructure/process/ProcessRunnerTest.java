package me.golemcore.agent.infrastructure.process;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {

    @TempDir
    Path tempDir;

    private final ProcessRunner runner = new ProcessRunner(50);

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    private ProcessResult sh(String script, String stdin, long timeoutMs) throws Exception {
        return runner.run(List.of("sh", "-c", script), tempDir, stdin, timeoutMs);
    }

    @Test
    void shouldCaptureStdoutAndExitCode() throws Exception {
        ProcessResult result = sh("echo hello", null, 5000);

        assertTrue(result.isSuccess());
        assertEquals(0, result.exitCode());
        assertEquals("hello\n", result.stdout());
        assertFalse(result.timedOut());
    }

    @Test
    void shouldRunInWorkingDirectory() throws Exception {
        ProcessResult result = sh("pwd", null, 5000);

        assertEquals(tempDir.toRealPath().toString(), result.stdout().strip());
    }

    @Test
    void shouldPassStdin() throws Exception {
        ProcessResult result = sh("cat", "{\"a\":1}", 5000);

        assertEquals("{\"a\":1}", result.stdout());
    }

    @Test
    void shouldReportFailureWithStderr() throws Exception {
        ProcessResult result = sh("echo broken >&2; exit 4", null, 5000);

        assertFalse(result.isSuccess());
        assertEquals(4, result.exitCode());
        assertEquals("broken\n", result.stderr());
    }

    @Test
    void shouldKillProcessAfterTimeout() throws Exception {
        ProcessResult result = sh("sleep 10", null, 200);

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
        assertFalse(result.isSuccess());
        assertTrue(result.durationMs() < 10000);
    }

    @Test
    void shouldKillSpawnedChildrenAfterTimeout() throws Exception {
        Path pidFile = tempDir.resolve("child.pid");

        ProcessResult result = sh("sleep 30 >/dev/null 2>&1 & echo $! > child.pid; wait", null, 500);

        assertTrue(result.timedOut());
        long childPid = Long.parseLong(Files.readString(pidFile).strip());
        Optional<ProcessHandle> child = ProcessHandle.of(childPid);
        if (child.isPresent()) {
            child.get().onExit().get(5, TimeUnit.SECONDS);
        }
        assertFalse(ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false));
    }

    @Test
    void shouldTruncateLongOutput() throws Exception {
        ProcessResult result = sh("i=0; while [ $i -lt 100 ]; do echo 0123456789; i=$((i+1)); done", null, 5000);

        assertTrue(result.stdout().startsWith("0123456789"));
        assertTrue(result.stdout().endsWith("[Output truncated...]"));
        assertEquals(50 + "\n[Output truncated...]".length(), result.stdout().length());
    }

    @Test
    void shouldThrowWhenCommandCannotStart() {
        assertThrows(IOException.class,
                () -> runner.run(List.of("definitely-not-a-command-xyz"), tempDir, null, 1000));
    }
}
