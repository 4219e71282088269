package io.mcg.engine.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.JobRegistry;
import io.mcg.engine.config.MethodSpec;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.support.EngineTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateRendererTest {
    private static JobRegistry registry;

    @TempDir
    Path workDir;

    @BeforeAll
    static void loadDefinitions() {
        registry = JobRegistry.load(EngineTestSupport.jobsDirectory());
    }

    @Test
    void substitutesKnownNamesAndKeepsUnknownOnes() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Si");
        values.put("T", 300);
        values.put("empty", null);
        String rendered = TemplateRenderer.substitute("$name at ${T} K, $missing ${also_missing} [$empty]", new RenderContext(values));
        assertEquals("Si at 300 K, $missing ${also_missing} []", rendered);
    }

    @Test
    void doubleDollarIsALiteralDollar() {
        RenderContext context = new RenderContext(Map.of("HOME", "/home/mcg"));
        assertEquals("echo $HOME costs $5", TemplateRenderer.substitute("echo $$HOME costs $$5", context));
        assertEquals("/home/mcg", TemplateRenderer.substitute("$HOME", context));
    }

    @Test
    void resolvesNestedPaths() {
        RenderContext context = new RenderContext(Map.of("system", Map.of("formula", "Si2", "cell", Map.of("a", 5.43))));
        assertEquals("Si2 5.43 ${system.missing}",
            TemplateRenderer.substitute("${system.formula} ${system.cell.a} ${system.missing}", context));
    }

    @Test
    void expandsArrayIndexesAfterSubstitution() {
        JobDefinition md = registry.find("molecular_dynamics");
        RenderContext context = new RenderContext(Map.of("vel", List.of(1.5, 2.5, 3.5), "axis", "z"));
        String rendered = new TemplateRenderer(md).render("v ${vel[0]} ${vel[2]} ${vel[5]} ${axis[0]} $axis", context);
        assertEquals("v 1.5 3.5 ${vel[5]} ${axis[0]} z", rendered);
    }

    @Test
    void arrayIndexesStayWithoutPostProcessor() {
        JobDefinition lattice = registry.find("lattice_dynamics");
        RenderContext context = new RenderContext(Map.of("vel", List.of(1.5)));
        assertEquals("${vel[0]}", new TemplateRenderer(lattice).render("${vel[0]}", context));
    }

    @Test
    void appliesEscapeSequencesBeforeSubstitution() {
        JobDefinition definition = EngineTestSupport.definition("x",
            "{'methods': {'run': {}}, 'template_syntax': {'escape_sequences': {'@@': '$$'}}}");
        RenderContext context = new RenderContext(Map.of("PATH", "/usr/bin"));
        assertEquals("export PATH=$PATH:/usr/bin", new TemplateRenderer(definition).render("export PATH=@@PATH:$PATH", context));
    }

    @Test
    void rendersTemplateFileAndScript() throws Exception {
        JobDefinition lattice = registry.find("lattice_dynamics");
        MethodSpec phonons = lattice.method("phonons").get();
        RenderContext context = ContextBuilder.build(lattice, phonons, List.of(), Map.of(), EngineTestSupport.NOW);

        RenderedFiles files = new TemplateRenderer(lattice).renderFiles(phonons, context, List.of(), workDir);
        assertEquals(2, files.count());
        assertEquals(workDir.resolve("phonons.in"), files.inputFile().get());
        assertEquals(List.of(
            "# phonon input",
            "mesh = 8 8 8",
            "temperature = 300",
            "seed = 12345",
            "cost = $5",
            "unknown = ${not_set}"), Files.readAllLines(files.inputFile().get()));

        String script = Files.readString(files.script().get());
        assertEquals(MethodSpec.SCRIPT_FILE, files.script().get().getFileName().toString());
        assertTrue(script.contains("\"8 8 8\" > phonons.json"), script);
    }

    @Test
    void generatesDataFilesFromTheInputStructure() throws Exception {
        JobDefinition bandGap = registry.find("band_gap");
        MethodSpec pbe = bandGap.method("pbe").get();
        Asset silicon = EngineTestSupport.silicon();
        RenderContext context = ContextBuilder.build(bandGap, pbe, List.of(silicon), Map.of("kpoints", "6 6 6"), EngineTestSupport.NOW);

        RenderedFiles files = new TemplateRenderer(bandGap).renderFiles(pbe, context, List.of(silicon), workDir);
        assertEquals("functional = PBE\nkpoints = 6 6 6\n", Files.readString(workDir.resolve("input.in")));
        assertEquals("formula Si2\n", Files.readString(files.files().get("structure")));
        assertTrue(files.script().isEmpty());
    }

    @Test
    void methodWithoutTemplateWritesNoInput() {
        JobDefinition definition = EngineTestSupport.definition("x", "{'methods': {'run': {}}}");
        RenderContext context = new RenderContext(Map.of());
        RenderedFiles files = new TemplateRenderer(definition).renderFiles(definition.method("run").get(), context, List.of(), workDir);
        assertEquals(0, files.count());
    }

    @Test
    void refusesToWriteOutsideTheWorkDirectory() {
        JobDefinition definition = EngineTestSupport.definition("x",
            "{'methods': {'run': {'files': {'escape': {'name': '../escape.txt', 'content': 'x'}}}}}");
        RenderContext context = new RenderContext(Map.of());
        assertThrows(TemplateException.class, () -> new TemplateRenderer(definition)
            .renderFiles(definition.method("run").get(), context, List.of(), workDir));
        assertTrue(!Files.exists(workDir.resolveSibling("escape.txt")));
    }

    @Test
    void missingTemplateFileIsATemplateError() {
        JobDefinition definition = EngineTestSupport.definition("x",
            "{'methods': {'run': {'template_file': 'does/not/exist.in'}}}");
        assertThrows(TemplateException.class, () -> new TemplateRenderer(definition)
            .renderFiles(definition.method("run").get(), new RenderContext(Map.of()), List.of(), workDir));
    }
}
