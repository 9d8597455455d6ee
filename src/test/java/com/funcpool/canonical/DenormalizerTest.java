package com.funcpool.canonical;

import com.funcpool.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DenormalizerTest {

    private static final String HELPER = ContentHasher.sha256("helper");
    private static final String OTHER = ContentHasher.sha256("other");

    private final Denormalizer denormalizer = new Denormalizer();

    private static final String CANONICAL = """
            def _fp_v_0(_fp_v_1, _fp_v_2):
                \"\"\"Add two numbers\"\"\"
                _fp_v_3 = _fp_v_1 + _fp_v_2
                return _fp_v_3""";

    @Test
    void testRestoresNamesAndDocstring() {
        String source = denormalizer.denormalize(CANONICAL,
                Map.of("_fp_v_0", "somme", "_fp_v_1", "premier", "_fp_v_2", "second", "_fp_v_3", "resultat"),
                Map.of(), "Additionne deux nombres");

        assertThat(source).isEqualTo("""
                def somme(premier, second):
                    \"\"\"Additionne deux nombres\"\"\"
                    resultat = premier + second
                    return resultat""");
    }

    @Test
    void testEmptyDocstringRemovesStoredOne() {
        String source = denormalizer.denormalize(CANONICAL,
                Map.of("_fp_v_0", "add", "_fp_v_1", "a", "_fp_v_2", "b", "_fp_v_3", "total"), Map.of(), "");

        assertThat(source).isEqualTo("""
                def add(a, b):
                    total = a + b
                    return total""");
    }

    @Test
    void testDocstringIsInsertedWhenCanonicalTextHasNone() {
        String source = denormalizer.denormalize("def _fp_v_0():\n    return 1",
                Map.of("_fp_v_0", "one"), Map.of(), "Returns one.");

        assertThat(source).isEqualTo("def one():\n    \"\"\"Returns one.\"\"\"\n    return 1");
    }

    @Test
    void testRestoresAliasOnImportAndCalls() {
        String canonical = """
                from funcpool.pool import object_%1$s

                def _fp_v_0(_fp_v_1):
                    return object_%1$s._fp_v_0(_fp_v_1) * 2""".formatted(HELPER);

        String source = denormalizer.denormalize(canonical, Map.of("_fp_v_0", "double_helper", "_fp_v_1", "x"),
                Map.of(HELPER, "helper"), "");

        assertThat(source).isEqualTo("""
                from funcpool.pool import object_%s as helper

                def double_helper(x):
                    return helper(x) * 2""".formatted(HELPER));
        assertThat(source).doesNotContain("._fp_v_0");
    }

    @Test
    void testUnaliasedDependencyKeepsAttributeCall() {
        String canonical = """
                from funcpool.pool import object_%1$s

                def _fp_v_0():
                    return object_%1$s._fp_v_0()""".formatted(HELPER);

        String source = denormalizer.denormalize(canonical, Map.of("_fp_v_0", "call"), Map.of(), "");

        assertThat(source).contains("return object_" + HELPER + "._fp_v_0()");
    }

    @Test
    void testAliasForMissingImportIsCorruption() {
        assertThatThrownBy(() -> denormalizer.denormalize("def _fp_v_0():\n    return 1",
                Map.of("_fp_v_0", "one"), Map.of(OTHER, "other"), ""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining(OTHER);
    }

    @Test
    void testUnmappedSlotIsCorruption() {
        assertThatThrownBy(() -> denormalizer.denormalize(CANONICAL, Map.of("_fp_v_0", "add", "_fp_v_1", "a"),
                Map.of(), ""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("_fp_v_2")
                .hasMessageContaining("_fp_v_3");
    }

    @Test
    void testUnparsableCanonicalTextIsCorruption() {
        assertThatThrownBy(() -> denormalizer.denormalize("def _fp_v_0(:\n    pass", Map.of("_fp_v_0", "f"),
                Map.of(), ""))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("does not parse");
    }

    @Test
    void testStripPoolImportsKeepsOtherImports() {
        String source = """
                from funcpool import check
                from funcpool.pool import object_%s as helper
                import math

                def f(x):
                    return helper(math.floor(x))""".formatted(HELPER);

        assertThat(denormalizer.stripPoolImports(source)).isEqualTo("""
                import math

                def f(x):
                    return helper(math.floor(x))""");
    }

    @Test
    void testDependenciesAreListedInImportOrder() {
        String canonical = """
                from funcpool.pool import object_%s, object_%s

                def _fp_v_0():
                    pass""".formatted(OTHER, HELPER);

        assertThat(denormalizer.dependencies(canonical)).containsExactly(OTHER, HELPER);
    }
}
