package me.golemcore.agent.infrastructure.process;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs child processes with a timeout, optional stdin payload and bounded
 * capture of stdout and stderr. Shared by the bash tool and subprocess
 * plugins.
 */
@Component
@Slf4j
public class ProcessRunner {

    private static final long DRAIN_TIMEOUT_MS = 1000;

    private final ExecutorService executor;
    private final int maxOutputChars;

    public ProcessRunner() {
        this(100_000);
    }

    // Visible for testing
    public ProcessRunner(int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "process-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Process] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Starts the command in {@code workDir}, writes {@code stdin} (if any) and
     * waits up to {@code timeoutMs}. A process that outlives the timeout is
     * killed together with every process it spawned and reported with
     * {@code timedOut = true}.
     *
     * @throws IOException
     *             if the process cannot be started
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting
     */
    public ProcessResult run(List<String> command, Path workDir, String stdin, long timeoutMs)
            throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        long startTime = System.currentTimeMillis();
        Process process = builder.start();

        Future<String> stdoutFuture = executor.submit(() -> drain(process.getInputStream()));
        Future<String> stderrFuture = executor.submit(() -> drain(process.getErrorStream()));

        try (OutputStream input = process.getOutputStream()) {
            if (stdin != null) {
                input.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            // The child may exit without reading its input
            log.debug("[Process] Could not write stdin: {}", e.getMessage());
        }

        boolean completed = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        if (!completed) {
            destroyTree(process);
        }
        long duration = System.currentTimeMillis() - startTime;

        String stdout = collect(stdoutFuture);
        String stderr = collect(stderrFuture);
        int exitCode = completed ? process.exitValue() : -1;
        return new ProcessResult(exitCode, stdout, stderr, !completed, duration);
    }

    // Descendants are listed before the parent dies, after that they are reparented
    private void destroyTree(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        for (ProcessHandle child : descendants) {
            if (child.destroyForcibly()) {
                log.debug("[Process] Killed descendant {}", child.pid());
            }
        }
    }

    private String drain(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        char[] buffer = new char[8192];
        boolean truncated = false;
        try (Reader in = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read = in.read(buffer);
            while (read != -1) {
                if (output.length() < maxOutputChars) {
                    output.append(buffer, 0, read);
                } else {
                    truncated = true;
                }
                read = in.read(buffer);
            }
        }
        if (output.length() > maxOutputChars) {
            output.setLength(maxOutputChars);
            truncated = true;
        }
        if (truncated) {
            output.append("\n[Output truncated...]");
        }
        return output.toString();
    }

    private String collect(Future<String> future) throws InterruptedException {
        try {
            return future.get(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            log.debug("[Process] Failed to read process output", e);
            return "";
        }
    }
}
