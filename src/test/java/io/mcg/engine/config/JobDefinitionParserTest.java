package io.mcg.engine.config;

import static io.mcg.engine.support.EngineTestSupport.definition;
import static io.mcg.engine.support.EngineTestSupport.document;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class JobDefinitionParserTest {
    @Test
    void minimalDefinitionGetsDefaults() {
        JobDefinition definition = definition("echo_tool", "{'methods': {'run': {}}}");
        assertEquals("echo_tool", definition.name());
        assertEquals(JobDefinition.DEFAULT_EXPECTED_OUTPUTS, definition.expectedOutputs());
        MethodSpec run = definition.method("run").get();
        assertEquals(MethodSpec.DEFAULT_INPUT_FILE, run.inputFile());
        assertTrue(!run.hasInputTemplate());
        assertTrue(definition.backends().isEmpty());
    }

    @Test
    void methodsAreRequired() {
        assertThrows(ConfigurationException.class, () -> definition("x", "{'name': 'X'}"));
        assertThrows(ConfigurationException.class, () -> definition("x", "{'methods': {}}"));
        assertThrows(ConfigurationException.class, () -> definition("x", "{'methods': ['a']}"));
    }

    @Test
    void unknownTagsListTheSupportedValues() {
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'parsers': {'p': {'type': 'xml'}}}"));
        assertEquals(List.of("json", "regex", "columnar", "csv"), error.alternatives());
        assertEquals("configuration", error.code());
        assertTrue(error.getMessage().contains("parsers.p.type"), error.getMessage());

        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'execution': {'mode': 'cloud'}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'context_builders': {'n': {'type': 'parameter_transform', 'source': 'a',"
                + " 'transform': {'type': 'reverse'}}}}"));
    }

    @Test
    void crossReferencesMustResolve() {
        ConfigurationException rule = assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'method_resolution': {'fast': {'condition': {'requires_any': ['a']}}}}"));
        assertEquals(List.of("run"), rule.alternatives());

        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'understands': {'go fast': {'keywords': ['fast'], 'method': 'turbo'}}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {'files': {'data': {'generator': 'missing'}}}}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'output_parsing': {'files': [{'name': 'out.txt', 'parser': 'nope'}]}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'output_parsing': {'files': [{'parser': 'json'}]}}"));
    }

    @Test
    void ruleMethodDefaultsToRuleName() {
        JobDefinition definition = definition("x",
            "{'methods': {'run': {}, 'fast': {}}, 'method_resolution': {'fast': {'condition': {'requires_all': ['a', 'b']}}}}");
        assertEquals("fast", definition.rules().get(0).method());
        assertEquals(ConditionKind.REQUIRES_ALL, definition.rules().get(0).conditions().get(0).kind());
    }

    @Test
    void regexPatternsAsListAreKeyedByIndex() {
        JobDefinition definition = definition("x",
            "{'methods': {'run': {}}, 'parsers': {'energies': {'type': 'regex', 'patterns': ['E=(\\\\S+)', 'F=(\\\\S+)']}}}");
        ParserSpec parser = definition.parsers().get("energies");
        assertEquals(List.of("matches_0", "matches_1"), List.copyOf(parser.patterns().keySet()));
        assertEquals("E=(\\S+)", parser.patterns().get("matches_0").pattern());
    }

    @Test
    void rejectsInvalidParserSettings() {
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'parsers': {'r': {'type': 'regex'}}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'parsers': {'r': {'type': 'regex', 'patterns': ['(unclosed']}}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'parsers': {'c': {'type': 'csv', 'delimiter': ';;'}}}"));
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'template_post_processors': [{'type': 'array_indexing', 'pattern': '\\\\$(\\\\w+)'}]}"));
    }

    @Test
    void formulaComputationsMapToTheFormulaLibrary() {
        JobDefinition definition = definition("x", "{'methods': {'run': {}}, 'context_builders': {"
            + "'steps': {'type': 'computed_value', 'computation': {'type': 'formula', 'formula': 'time_ps * 1000 / dt_fs', 'default': 500}},"
            + "'vy': {'type': 'computed_value', 'computation': {'type': 'formula', 'formula': 'velocity[1]'}}}}");
        ContextBuilderSpec steps = definition.contextBuilders().get(0);
        assertEquals(ComputationKind.SCALED_STEPS, steps.computation().get().kind());
        assertEquals("dt_fs", steps.computation().get().timestepKey());
        assertEquals(500, steps.fallback().get());
        ContextBuilderSpec vy = definition.contextBuilders().get(1);
        assertEquals(ComputationKind.VECTOR_COMPONENT, vy.computation().get().kind());
        assertEquals(1, vy.computation().get().index());

        assertThrows(ConfigurationException.class, () -> definition("x", "{'methods': {'run': {}}, 'context_builders': {"
            + "'bad': {'type': 'computed_value', 'computation': {'type': 'formula', 'formula': 'sqrt(a)'}}}}"));
    }

    @Test
    void scriptTemplateIsAnAliasOfScript() {
        JobDefinition definition = definition("x", "{'methods': {'run': {'script_template': ['echo a', 'echo b']}}}");
        assertEquals("echo a\necho b", definition.method("run").get().script().get());
    }

    @Test
    void resultAssetKindMustBeKnown() {
        assertThrows(ConfigurationException.class, () -> definition("x",
            "{'methods': {'run': {}}, 'result_assets': {'a': {'type': 'Blob'}}}"));
    }

    @Test
    void blankKeyIsRejected() {
        assertThrows(ConfigurationException.class, () -> JobDefinitionParser.parse(" ", document("{'methods': {'run': {}}}")));
    }
}
