package io.mcg.engine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.provenance.AssetKind;
import io.mcg.engine.support.EngineTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DefinitionLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsJsonDefinition() {
        JobDefinition definition = DefinitionLoader.load(EngineTestSupport.jobsDirectory().resolve("lattice_dynamics.json"));
        assertEquals("lattice_dynamics", definition.key());
        assertEquals("Lattice Dynamics", definition.name());
        assertEquals(List.of("phonons", "conductivity"), definition.methodNames());

        MethodSpec conductivity = definition.method("conductivity").get();
        assertEquals("temperature = ${temperature}\nmesh = ${mesh_text}", conductivity.inputTemplate().get());
        assertEquals("kappa.in", conductivity.inputFile());
        assertEquals(List.of("temperature"), conductivity.needs());
        assertEquals("cat kappa.in\necho 'kappa = 142.5' > kappa.out", conductivity.script().get());
        assertEquals("kappa.dat", conductivity.outputs().get(0).file());

        assertEquals(List.of("T", "temp"), definition.parameterMapping().get("temperature"));
        assertEquals("conductivity", definition.rules().get(0).method());
        assertEquals("phonons", definition.understands().get(0).method());
        assertEquals(ParserKind.REGEX, definition.parsers().get("kappa").kind());
        assertEquals("W/(m*K)", definition.units().get("kappa_W_per_mK"));
        assertEquals(AssetKind.ARTIFACT, definition.resultAssets().get(0).kind());
        assertEquals(EngineTestSupport.jobsDirectory(), definition.baseDirectory().get());
    }

    @Test
    void loadsYamlDefinition() {
        JobDefinition definition = DefinitionLoader.load(EngineTestSupport.jobsDirectory().resolve("molecular_dynamics.yaml"));
        assertEquals("Molecular Dynamics", definition.name());
        MethodSpec nvt = definition.method("nvt").get();
        assertEquals(BackendKind.DOCKER, nvt.mode().get());
        assertEquals(Duration.ofSeconds(120), nvt.timeout().get());
        assertTrue(nvt.inputTemplate().get().startsWith("units metal\nfix 1 all nvt"));

        BackendSpec local = definition.backends().get(BackendKind.LOCAL);
        assertEquals("lmp", local.executable());
        assertEquals("{executable} -in {input_file}", local.commandTemplate());
        assertEquals(Duration.ofSeconds(30), local.timeout().get());

        BackendSpec hpc = definition.backends().get(BackendKind.HPC);
        assertEquals("2", hpc.setting("nodes").get());
        assertEquals("4", hpc.environment().get("OMP_NUM_THREADS"));
        assertEquals(List.of("--cpus", "2"), definition.backends().get(BackendKind.DOCKER).listSetting("options"));

        assertEquals(3, definition.contextBuilders().size());
        assertEquals(PostProcessorKind.ARRAY_INDEXING, definition.postProcessors().get(0).kind());
        assertEquals(JobDefinitionParser.DEFAULT_ARRAY_INDEX.pattern(), definition.postProcessors().get(0).pattern().pattern());
    }

    @Test
    void loadsTomlDefinition() {
        JobDefinition definition = DefinitionLoader.load(EngineTestSupport.jobsDirectory().resolve("band_gap.toml"));
        assertEquals("Band Gap", definition.name());
        assertEquals(List.of("*.csv", "*.dat"), definition.expectedOutputs());
        MethodSpec pbe = definition.method("pbe").get();
        assertEquals("4 4 4", pbe.parameterDefaults().get("kpoints"));
        assertEquals("xyz", pbe.files().get("structure").generator().get());
        assertEquals(GeneratorKind.DATA_FILE, definition.generators().get("xyz").kind());

        ParserSpec gap = definition.parsers().get("gap");
        assertEquals(1, gap.skipLines());
        assertEquals(List.of("k", "energy_eV"), gap.columns());
        assertEquals(2, definition.fileBindings().size());
        assertEquals("bands", definition.fileBindings().get(0).parser());
        assertEquals(ParsePolicy.FAIL, definition.parsePolicy().get());
        assertEquals(0.0, ((Number) definition.defaultResults().get("band_gap_eV")).doubleValue());
    }

    @Test
    void recognisesDefinitionFiles() throws Exception {
        Path json = Files.writeString(tempDir.resolve("a.json"), "{}");
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "");
        assertTrue(DefinitionLoader.isDefinitionFile(json));
        assertTrue(!DefinitionLoader.isDefinitionFile(text));
        assertTrue(!DefinitionLoader.isDefinitionFile(tempDir));
    }

    @Test
    void reportsMalformedDocuments() throws Exception {
        Path array = Files.writeString(tempDir.resolve("array.json"), "[1, 2]");
        assertThrows(ConfigurationException.class, () -> DefinitionLoader.load(array));

        Path toml = Files.writeString(tempDir.resolve("broken.toml"), "name = \n");
        assertThrows(ConfigurationException.class, () -> DefinitionLoader.load(toml));

        Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "name: x\nmethods: [unclosed\n");
        assertThrows(ConfigurationException.class, () -> DefinitionLoader.load(yaml));
    }
}
