package com.autotune.runner;

import com.autotune.evaluator.TranscriptSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutotuneApplicationTest {

    @TempDir
    Path tempDir;

    private final List<String> lines = new ArrayList<>();
    private final TranscriptSink console = lines::add;

    @Test
    void run_withoutSettingsPrintsUsage() {
        int code = AutotuneApplication.run(new String[0], console, false);

        assertEquals(RunReport.EXIT_CONFIGURATION_ERROR, code);
        assertTrue(lines.get(0).startsWith("Usage:"));
    }

    @Test
    void run_invalidSettingsListsProblems() throws Exception {
        Path file = tempDir.resolve("tune.json");
        Files.writeString(file, """
                { "variables": [ { "name": "x" } ], "values": { "x": [] }, "commands": {} }
                """);

        int code = AutotuneApplication.run(new String[]{file.toString()}, console, false);

        assertEquals(RunReport.EXIT_CONFIGURATION_ERROR, code);
        assertTrue(lines.contains("Configuration error:"), lines.toString());
        assertTrue(lines.contains("    Empty value domain for variable 'x'"), lines.toString());
        assertTrue(lines.contains("    No test command given (commands.test)"), lines.toString());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_tunesWithRealShellCommands() throws Exception {
        Path file = tempDir.resolve("tune.json");
        Files.writeString(file, """
                {
                  "variables": [ { "name": "x" } ],
                  "values": { "x": ["3", "1", "2"] },
                  "commands": { "test": "echo %x%" },
                  "optimal": "max",
                  "output": { "log": "out/log.csv" }
                }
                """);

        int code = AutotuneApplication.run(new String[]{file.toString()}, console, false);

        assertEquals(RunReport.EXIT_OK, code);
        assertTrue(lines.contains("Maximal valuation:"), lines.toString());
        assertTrue(lines.contains("x = 3"), lines.toString());
        assertEquals(4, Files.readAllLines(tempDir.resolve("out/log.csv")).size());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_failingTestsExitWithInsufficientResults() throws Exception {
        Path file = tempDir.resolve("tune.json");
        Files.writeString(file, """
                {
                  "variables": [ { "name": "x" } ],
                  "values": { "x": ["1", "2"] },
                  "commands": { "test": "exit 3" }
                }
                """);

        int code = AutotuneApplication.run(new String[]{file.toString()}, console, false);

        assertEquals(RunReport.EXIT_INSUFFICIENT_RESULTS, code);
    }
}
