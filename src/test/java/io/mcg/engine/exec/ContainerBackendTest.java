package io.mcg.engine.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.mcg.engine.config.BackendKind;
import io.mcg.engine.config.BackendSpec;
import io.mcg.engine.config.ConfigurationException;
import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.support.EngineTestSupport;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContainerBackendTest {
    private static final Path WORK = Path.of("/tmp/mcg-work/run_1");

    @Test
    void buildsARunCommandWithTheWorkDirectoryMounted() {
        JobDefinition definition = EngineTestSupport.definition("x", "{'methods': {'run': {}}, 'execution': {'docker':"
            + " {'image': 'lammps/lammps:stable', 'environment': {'OMP_NUM_THREADS': '4'}, 'options': ['--cpus', '2']}}}");
        ExecutionRequest request = new ExecutionRequest("run_1", "x", "run", definition.backends().get(BackendKind.DOCKER),
            WORK, "lmp -in in.md", Duration.ofMinutes(1));

        List<String> argv = new ContainerBackend(new ProcessRunner()).buildCommand(request);
        assertEquals(List.of(
            "docker", "run", "--rm",
            "-v", WORK.toAbsolutePath() + ":/work",
            "-w", "/work",
            "-e", "OMP_NUM_THREADS=4",
            "--cpus", "2",
            "lammps/lammps:stable",
            "/bin/sh", "-c", "lmp -in in.md"), argv);
    }

    @Test
    void runtimeIsConfigurable() {
        BackendSpec spec = new BackendSpec(BackendKind.DOCKER, null, null, null, Optional.empty(),
            Map.of("image", "alpine", "runtime", "podman"));
        ExecutionRequest request = new ExecutionRequest("run_1", "x", "run", spec, WORK, "true", Duration.ofSeconds(5));
        assertEquals("podman", new ContainerBackend(new ProcessRunner()).buildCommand(request).get(0));
    }

    @Test
    void imageIsRequired() {
        BackendSpec spec = new BackendSpec(BackendKind.DOCKER, null, null, null, Optional.empty(), Map.of());
        ExecutionRequest request = new ExecutionRequest("run_1", "x", "run", spec, WORK, "true", Duration.ofSeconds(5));
        assertThrows(ConfigurationException.class, () -> new ContainerBackend(new ProcessRunner()).buildCommand(request));
    }

    @Test
    void commandsSeeTheMountPoint() {
        assertEquals("/work", new ContainerBackend(new ProcessRunner()).visibleWorkDir(WORK));
        assertEquals(WORK.toString(), new LocalBackend(new ProcessRunner()).visibleWorkDir(WORK));
    }
}
