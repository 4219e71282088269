package io.mcg.engine.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.config.BackendKind;
import io.mcg.engine.config.BackendSpec;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {
    @TempDir
    Path workDir;

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void capturesOutputInTheWorkDirectory() throws Exception {
        ExecutionResult result = runner.run(ProcessRunner.shell("echo hello; echo oops >&2; echo 42 > out.dat"),
            workDir, Map.of(), Duration.ofSeconds(10));
        assertEquals(0, result.exitCode());
        assertEquals("hello\n", result.stdout());
        assertEquals("oops\n", result.stderr());
        assertEquals("42\n", Files.readString(workDir.resolve("out.dat")));
    }

    @Test
    void passesTheEnvironment() {
        ExecutionResult result = runner.run(ProcessRunner.shell("echo $MCG_TEST_VALUE"), workDir,
            Map.of("MCG_TEST_VALUE", "phonon"), Duration.ofSeconds(10));
        assertEquals("phonon\n", result.stdout());
    }

    @Test
    void nonZeroExitFails() {
        ExecutionFailedException error = assertThrows(ExecutionFailedException.class,
            () -> runner.run(ProcessRunner.shell("echo broken >&2; exit 3"), workDir, Map.of(), Duration.ofSeconds(10)));
        assertEquals(3, error.exitCode().get());
        assertEquals("broken\n", error.stderr());
        assertTrue(error.getMessage().contains("code 3"), error.getMessage());
        assertEquals("execution", error.code());
    }

    @Test
    void timeoutKillsTheProcess() {
        long started = System.nanoTime();
        ExecutionFailedException error = assertThrows(ExecutionFailedException.class,
            () -> runner.run(ProcessRunner.shell("sleep 30"), workDir, Map.of(), Duration.ofMillis(300)));
        assertTrue(error.isTimedOut());
        assertTrue(error.exitCode().isEmpty());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 20);
    }

    @Test
    void missingExecutableFailsToLaunch() {
        ExecutionFailedException error = assertThrows(ExecutionFailedException.class,
            () -> runner.run(List.of("/definitely/not/a/tool"), workDir, Map.of(), Duration.ofSeconds(5)));
        assertTrue(error.exitCode().isEmpty());
        assertTrue(!error.isTimedOut());
    }

    @Test
    void localBackendRunsThroughTheShell() {
        BackendSpec spec = new BackendSpec(BackendKind.LOCAL, null, null, Map.of("GREETING", "hi"), Optional.empty(), Map.of());
        ExecutionRequest request = new ExecutionRequest("run_1", "x", "run", spec, workDir, "echo $GREETING from $(pwd)",
            Duration.ofSeconds(10));
        ExecutionResult result = new LocalBackend(runner).execute(request);
        assertTrue(result.stdout().startsWith("hi from "), result.stdout());
    }

    @Test
    void collectsMatchingOutputsSortedByName() throws Exception {
        Files.writeString(workDir.resolve("b.out"), "");
        Files.writeString(workDir.resolve("a.json"), "{}");
        Files.writeString(workDir.resolve("input.in"), "");
        Files.createDirectories(workDir.resolve("nested.out"));
        List<Path> outputs = OutputCollector.collect(workDir, List.of("*.out", "*.json"));
        assertEquals(List.of(workDir.resolve("a.json"), workDir.resolve("b.out")), outputs);
    }

    @Test
    void renderedInputsAreNotCollectedAsOutputs() throws Exception {
        Files.writeString(workDir.resolve("input.json"), "{}");
        Files.writeString(workDir.resolve("result.json"), "{}");
        List<Path> outputs = OutputCollector.collect(workDir, List.of("*.json"), List.of(workDir.resolve("input.json")));
        assertEquals(List.of(workDir.resolve("result.json")), outputs);
    }
}
