package com.autotune.evaluator.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through a shell ({@code sh -c} by default) in a fixed working directory.
 * Standard output and error go to temporary files so a timeout is enforced even when the command
 * writes a lot; standard error is only logged at debug level. A timed out or destroyed command is
 * killed together with every process it started.
 */
public final class ShellCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandRunner.class);

    public static final List<String> DEFAULT_SHELL = List.of("sh", "-c");

    private final List<String> shell;
    private final Path workingDirectory;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();

    public ShellCommandRunner(Path workingDirectory) {
        this(DEFAULT_SHELL, workingDirectory);
    }

    /**
     * @param shell            shell program and arguments; the command line is appended as the last argument
     * @param workingDirectory directory commands run in; null for the current directory
     */
    public ShellCommandRunner(List<String> shell, Path workingDirectory) {
        if (shell == null || shell.isEmpty()) {
            throw new IllegalArgumentException("Shell command is required");
        }
        this.shell = List.copyOf(shell);
        this.workingDirectory = workingDirectory;
    }

    @Override
    public CommandResult run(String command, Duration timeout) {
        Objects.requireNonNull(command, "command");
        List<String> argv = new ArrayList<>(shell);
        argv.add(command);
        Path stdout = null;
        Path stderr = null;
        Process process = null;
        long start = System.nanoTime();
        try {
            stdout = Files.createTempFile("autotune-", ".out");
            stderr = Files.createTempFile("autotune-", ".err");
            ProcessBuilder pb = new ProcessBuilder(argv);
            if (workingDirectory != null) pb.directory(workingDirectory.toFile());
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());
            start = System.nanoTime();
            process = pb.start();
            running.add(process);

            boolean completed;
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                process.waitFor();
                completed = true;
            } else {
                completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (!completed) {
                destroyTree(process);
                log.warn("Command timed out | timeoutMs={} | command={}", timeout.toMillis(), command);
                return new CommandResult(-1, read(stdout), elapsed, true, null);
            }
            int exit = process.exitValue();
            if (exit != 0 && log.isDebugEnabled()) {
                log.debug("Command failed | exitCode={} | command={} | stderr={}", exit, command, read(stderr).trim());
            }
            return new CommandResult(exit, read(stdout), elapsed, false, null);
        } catch (IOException e) {
            log.warn("Command could not be started | command={} | error={}", command, e.getMessage());
            return CommandResult.launchFailure("launch failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) destroyTree(process);
            return new CommandResult(-1, "", Duration.ofNanos(System.nanoTime() - start), false, "interrupted");
        } finally {
            if (process != null) running.remove(process);
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    @Override
    public void destroyAll() {
        for (Process p : running) {
            log.warn("Destroying running command | pid={}", p.pid());
            destroyTree(p);
        }
    }

    /** Kills the shell and everything it started. Descendants go first, while still reachable from the shell. */
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Temporary file not deleted | path={} | error={}", file, e.getMessage());
        }
    }
}
