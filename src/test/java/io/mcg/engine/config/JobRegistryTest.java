package io.mcg.engine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.support.EngineTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobRegistryTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsEveryFormatFromTheDirectory() {
        JobRegistry registry = JobRegistry.load(EngineTestSupport.jobsDirectory());
        assertEquals(List.of("Band Gap", "Lattice Dynamics", "Molecular Dynamics"), registry.names());
        assertEquals(3, registry.definitions().size());
    }

    @Test
    void findsByStemOrDisplayNameIgnoringCaseAndSeparators() {
        JobRegistry registry = JobRegistry.load(EngineTestSupport.jobsDirectory());
        JobDefinition byStem = registry.find("lattice_dynamics");
        assertSame(byStem, registry.find("Lattice Dynamics"));
        assertSame(byStem, registry.find("LATTICE-DYNAMICS"));
        assertSame(byStem, registry.find("latticedynamics"));
        assertEquals("band_gap", registry.find("band gap").key());
    }

    @Test
    void unknownNameListsKnownJobs() {
        JobRegistry registry = JobRegistry.load(EngineTestSupport.jobsDirectory());
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> registry.find("dft"));
        assertEquals(registry.names(), error.alternatives());
        assertTrue(error.getMessage().contains("Unknown job 'dft'"), error.getMessage());
        assertThrows(ConfigurationException.class, () -> registry.find(""));
        assertTrue(registry.lookup(null).isEmpty());
    }

    @Test
    void duplicateNamesFailTheLoad() throws Exception {
        Files.writeString(tempDir.resolve("md.json"), "{\"name\": \"Molecular Dynamics\", \"methods\": {\"run\": {}}}");
        Files.writeString(tempDir.resolve("molecular_dynamics.yaml"), "methods:\n  run: {}\n");
        assertThrows(ConfigurationException.class, () -> JobRegistry.load(tempDir));
    }

    @Test
    void missingDirectoryIsAnError() {
        assertThrows(ConfigurationException.class, () -> JobRegistry.load(tempDir.resolve("absent")));
    }

    @Test
    void reloadPicksUpNewDefinitions() throws Exception {
        Files.writeString(tempDir.resolve("first.json"), "{\"methods\": {\"run\": {}}}");
        JobRegistry registry = JobRegistry.load(tempDir);
        assertEquals(List.of("first"), registry.names());

        Files.writeString(tempDir.resolve("second.toml"), "[methods.run]\n");
        registry.reload();
        assertEquals(List.of("first", "second"), registry.names());
    }

    @Test
    void reloadKeepsPreviousSnapshotWhenTheNewOneIsBroken() throws Exception {
        Files.writeString(tempDir.resolve("first.json"), "{\"methods\": {\"run\": {}}}");
        JobRegistry registry = JobRegistry.load(tempDir);

        Files.writeString(tempDir.resolve("broken.json"), "{\"methods\": {}}");
        assertThrows(ConfigurationException.class, registry::reload);
        assertEquals(List.of("first"), registry.names());
    }

    @Test
    void inMemoryRegistryHasNoDirectory() {
        JobRegistry registry = JobRegistry.of(EngineTestSupport.definition("echo_tool", "{'methods': {'run': {}}}"));
        assertTrue(registry.directory().isEmpty());
        assertEquals("echo_tool", registry.find("Echo Tool").key());
        assertEquals("echotool", JobRegistry.normalize(" Echo_Tool "));
    }
}
