package com.funcpool.canonical;

import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.exception.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CanonicalizerTest {

    private static final String HELPER = ContentHasher.sha256("helper");

    private final Canonicalizer canonicalizer = new Canonicalizer();

    @Test
    void testCanonicalTextReplacesNamesWithSlots() {
        CanonicalForm form = canonicalize("""
                def calculate_sum(first, second):
                    \"\"\"Add two numbers\"\"\"
                    result = first + second
                    return result
                """);

        assertThat(form.getFunctionName()).isEqualTo("calculate_sum");
        assertThat(form.getDocstring()).isEqualTo("Add two numbers");
        assertThat(form.getWithoutDocstring()).isEqualTo("""
                def _fp_v_0(_fp_v_1, _fp_v_2):
                    _fp_v_3 = _fp_v_1 + _fp_v_2
                    return _fp_v_3""");
        assertThat(form.getWithDocstring()).isEqualTo("""
                def _fp_v_0(_fp_v_1, _fp_v_2):
                    \"\"\"Add two numbers\"\"\"
                    _fp_v_3 = _fp_v_1 + _fp_v_2
                    return _fp_v_3""");
        assertThat(form.getNameMapping()).containsExactly(
                entry("_fp_v_0", "calculate_sum"),
                entry("_fp_v_1", "first"),
                entry("_fp_v_2", "second"),
                entry("_fp_v_3", "result"));
        assertThat(form.getAliasMapping()).isEmpty();
        assertThat(form.getDependencies()).isEmpty();
    }

    @Test
    void testCanonicalizationIsDeterministic() {
        String source = """
                def scale(values, factor=2):
                    return [v * factor for v in values if v]
                """;

        CanonicalForm first = canonicalize(source);
        CanonicalForm second = canonicalize(source);

        assertThat(second.getWithDocstring()).isEqualTo(first.getWithDocstring());
        assertThat(ContentHasher.identityHash(second)).isEqualTo(ContentHasher.identityHash(first));
    }

    @Test
    void testDocstringDoesNotChangeIdentity() {
        CanonicalForm a = canonicalize("def f(x):\n    \"\"\"A\"\"\"\n    return x\n");
        CanonicalForm b = canonicalize("def f(x):\n    \"\"\"B\"\"\"\n    return x\n");
        CanonicalForm none = canonicalize("def f(x):\n    return x\n");

        assertThat(ContentHasher.identityHash(a))
                .isEqualTo(ContentHasher.identityHash(b))
                .isEqualTo(ContentHasher.identityHash(none));
        assertThat(a.getWithDocstring()).isNotEqualTo(b.getWithDocstring());
    }

    @Test
    void testNamesDoNotChangeIdentity() {
        CanonicalForm add = canonicalize("def add(a, b):\n    return a + b\n");
        CanonicalForm sum2 = canonicalize("def sum2(p, q):\n    return p + q\n");

        assertThat(add.getWithoutDocstring()).isEqualTo("def _fp_v_0(_fp_v_1, _fp_v_2):\n    return _fp_v_1 + _fp_v_2");
        assertThat(ContentHasher.identityHash(add)).isEqualTo(ContentHasher.identityHash(sum2));
        assertThat(add.getNameMapping()).containsValues("add", "a", "b");
        assertThat(sum2.getNameMapping()).containsValues("sum2", "p", "q");
    }

    @Test
    void testDifferentLogicChangesIdentity() {
        CanonicalForm add = canonicalize("def add(a, b):\n    return a + b\n");
        CanonicalForm sub = canonicalize("def sub(a, b):\n    return a - b\n");

        assertThat(ContentHasher.identityHash(add)).isNotEqualTo(ContentHasher.identityHash(sub));
    }

    @Test
    void testSlotsFollowBreadthFirstOrder() {
        CanonicalForm form = canonicalize("""
                def outer(n):
                    def inner(k):
                        return k * n
                    return inner(n)
                """);

        assertThat(form.getNameMapping()).containsExactly(
                entry("_fp_v_0", "outer"),
                entry("_fp_v_1", "inner"),
                entry("_fp_v_2", "n"),
                entry("_fp_v_3", "k"));
        assertThat(form.getWithoutDocstring()).isEqualTo("""
                def _fp_v_0(_fp_v_2):

                    def _fp_v_1(_fp_v_3):
                        return _fp_v_3 * _fp_v_2
                    return _fp_v_1(_fp_v_2)""");
    }

    @Test
    void testBuiltinsAndImportedNamesKeepTheirNames() {
        CanonicalForm form = canonicalize("""
                import math
                def norm(xs):
                    return math.sqrt(sum(x * x for x in xs)) + len(xs)
                """);

        assertThat(form.getWithoutDocstring()).isEqualTo("""
                import math

                def _fp_v_0(_fp_v_1):
                    return math.sqrt(sum((_fp_v_2 * _fp_v_2 for _fp_v_2 in _fp_v_1))) + len(_fp_v_1)""");
        assertThat(form.getNameMapping()).doesNotContainValue("math").doesNotContainValue("len");
    }

    @Test
    void testImportsAreSortedFromImportsFirst() {
        CanonicalForm form = canonicalize("""
                import sys
                from os import path
                import json
                from collections import OrderedDict, Counter
                def f():
                    return path, sys, json, Counter, OrderedDict
                """);

        assertThat(form.getWithoutDocstring()).startsWith("""
                from collections import OrderedDict, Counter
                from os import path
                import json
                import sys
                """);
    }

    @Test
    void testPoolAliasIsRecordedAndReplaced() {
        CanonicalForm form = canonicalize("""
                from funcpool.pool import object_%s as helper
                def twice(x):
                    return helper(helper(x))
                """.formatted(HELPER));

        assertThat(form.getAliasMapping()).containsExactly(entry(HELPER, "helper"));
        assertThat(form.getDependencies()).containsExactly(HELPER);
        assertThat(form.getNameMapping()).doesNotContainValue("helper");
        assertThat(form.getWithoutDocstring()).isEqualTo("""
                from funcpool.pool import object_%1$s

                def _fp_v_0(_fp_v_1):
                    return object_%1$s._fp_v_0(object_%1$s._fp_v_0(_fp_v_1))""".formatted(HELPER));
    }

    @Test
    void testAliasAndDirectReferenceHaveSameIdentity() {
        CanonicalForm aliased = canonicalize("""
                from funcpool.pool import object_%s as helper
                def twice(x):
                    return helper(x)
                """.formatted(HELPER));
        CanonicalForm direct = canonicalize("""
                from funcpool.pool import object_%1$s
                def twice(x):
                    return object_%1$s._fp_v_0(x)
                """.formatted(HELPER));

        assertThat(ContentHasher.identityHash(aliased)).isEqualTo(ContentHasher.identityHash(direct));
        assertThat(direct.getAliasMapping()).isEmpty();
    }

    @Test
    void testCheckDecoratorTargetsAreCollected() {
        CanonicalForm form = canonicalize("""
                from funcpool import check
                from funcpool.pool import object_%1$s
                @check(object_%1$s)
                def test_helper():
                    return object_%1$s._fp_v_0(2) == 4
                """.formatted(HELPER));

        assertThat(form.getChecks()).containsExactly(HELPER);
        assertThat(form.getWithoutDocstring()).contains("@check(object_" + HELPER + ")");
    }

    @Test
    void testConflictingPoolImportIsRejected() {
        assertThatThrownBy(() -> canonicalize("""
                from funcpool.pool import helper
                def f():
                    return helper()
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("object_<sha256 hash>");
    }

    @Test
    void testSecondFunctionIsRejectedWithItsLine() {
        assertThatThrownBy(() -> canonicalize("""
                def f():
                    pass
                def g():
                    pass
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessage("f.py:3: Only one function definition is allowed per file")
                .satisfies(e -> assertThat(((StructuralException) e).getLine()).isEqualTo(3));
    }

    @Test
    void testTopLevelStatementIsRejected() {
        assertThatThrownBy(() -> canonicalize("""
                LIMIT = 3
                def f():
                    return LIMIT
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Only imports and a single function definition are allowed at top level");
    }

    @Test
    void testMissingFunctionIsRejected() {
        assertThatThrownBy(() -> canonicalize("import os\n"))
                .isInstanceOf(StructuralException.class)
                .hasMessage("f.py: No function definition found in file");
    }

    @Test
    void testSyntaxErrorPropagates() {
        assertThatThrownBy(() -> canonicalize("def f(:\n    pass\n"))
                .isInstanceOf(PythonSyntaxException.class);
    }

    @Test
    void testCleanDocstringRemovesCommonIndentation() {
        assertThat(Canonicalizer.cleanDocstring("\n    Line one.\n      indented\n    ")).isEqualTo("Line one.\n  indented");
        assertThat(Canonicalizer.cleanDocstring("Summary.\n\n    Details.\n")).isEqualTo("Summary.\n\nDetails.");
        assertThat(Canonicalizer.cleanDocstring("   single")).isEqualTo("single");
    }

    @Test
    void testDenormalizedSourceHasOriginalNames() {
        String source = """
                from funcpool.pool import object_%s as helper
                def twice(value):
                    \"\"\"Apply helper twice.\"\"\"
                    return helper(helper(value))""".formatted(HELPER);
        CanonicalForm form = canonicalize(source);

        String restored = new Denormalizer().denormalize(form.getWithDocstring(), form.getNameMapping(),
                form.getAliasMapping(), form.getDocstring());

        assertThat(restored).isEqualTo(source.replace("\ndef", "\n\ndef"));
        assertThat(form.getNameMapping()).isEqualTo(Map.of("_fp_v_0", "twice", "_fp_v_1", "value"));
        assertThat(List.copyOf(form.getNameMapping().keySet())).containsExactly("_fp_v_0", "_fp_v_1");
    }

    private CanonicalForm canonicalize(String source) {
        return canonicalizer.canonicalize(source, "f.py");
    }
}
