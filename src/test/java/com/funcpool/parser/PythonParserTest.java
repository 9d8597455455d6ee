package com.funcpool.parser;

import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.model.syntax.Module;
import com.funcpool.model.syntax.Stmt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PythonTokenizer, PythonParser and PythonUnparser.
 */
class PythonParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "x = (1 + 2) * 3          | x = (1 + 2) * 3",
            "y = 1 + (2 * 3)          | y = 1 + 2 * 3",
            "n = 0x1F                 | n = 31",
            "m = 1_000                | m = 1000",
            "z = a if b else c        | z = a if b else c",
            "w = not (a and b)        | w = not (a and b)",
            "v = [i * 2 for i in r if i % 2] | v = [i * 2 for i in r if i % 2]",
            "del d[0], e.f            | del d[0], e.f",
            "x = 1  # trailing comment | x = 1"
    })
    void testUnparseUsesCanonicalLayout(String source, String expected) {
        assertThat(roundTrip(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "s = f'{x=}'          | s = f'x={x!r}'",
            "s = f'{x=:>4}'       | s = f'x={x:>4}'",
            "s = f'{x = !s}'      | s = f'x = {x!s}'",
            "s = f'a{x+1=}b'      | s = f'ax+1={x + 1!r}b'",
            "s = f'{x!r}{y==z}'   | s = f'{x!r}{y == z}'"
    })
    void testSelfDocumentingFieldsExpand(String source, String expected) {
        assertThat(roundTrip(source)).isEqualTo(expected);
    }

    @Test
    void testStringsUseSingleQuotes() {
        assertThat(roundTrip("s = \"hello\"")).isEqualTo("s = 'hello'");
        assertThat(roundTrip("s = \"it's\"")).isEqualTo("s = \"it's\"");
    }

    @Test
    void testFunctionDefinitionLayout() {
        String source = """
                import math
                def f(a, b=2, *args, c, **kw):
                    '''Doc.'''
                    if a:
                        return math.sqrt(a)
                    elif b:
                        pass
                    else:
                        raise ValueError("no")
                """;

        assertThat(roundTrip(source)).isEqualTo("""
                import math

                def f(a, b=2, *args, c, **kw):
                    \"\"\"Doc.\"\"\"
                    if a:
                        return math.sqrt(a)
                    elif b:
                        pass
                    else:
                        raise ValueError('no')""");
    }

    @Test
    void testLineContinuationsAreJoined() {
        String source = """
                total = 1 + \\
                    2
                items = [
                    1,
                    2,
                ]
                """;

        assertThat(roundTrip(source)).isEqualTo("total = 1 + 2\nitems = [1, 2]");
    }

    @Test
    void testUnparsedTextIsStable() {
        String source = """
                async def fetch(session, *, retries=3):
                    for attempt in range(retries):
                        try:
                            async with session.get('x') as response:
                                return await response.json()
                        except (IOError, ValueError) as error:
                            last = error
                        finally:
                            attempt += 1
                    raise RuntimeError('failed') from last
                """;

        String once = roundTrip(source);
        String twice = roundTrip(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void testParsesTopLevelStatementsInOrder() {
        Module module = PythonParser.parse("""
                from funcpool.pool import object_abc
                import os
                def f():
                    pass
                """, "sample.py");

        assertThat(module.getBody()).hasSize(3);
        assertThat(module.getBody().get(0)).isInstanceOf(Stmt.ImportFrom.class);
        assertThat(module.getBody().get(1)).isInstanceOf(Stmt.Import.class);
        assertThat(module.getBody().get(2)).isInstanceOf(Stmt.FunctionDef.class);
        assertThat(module.getBody().get(2).getSourceLine()).isEqualTo(3);
    }

    @Test
    void testSyntaxErrorCarriesPosition() {
        String source = """
                def f(x):
                    y = 1
                    return x +
                """;

        assertThatThrownBy(() -> PythonParser.parse(source, "broken.py"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessageStartingWith("broken.py:3:")
                .satisfies(e -> assertThat(((PythonSyntaxException) e).getLine()).isEqualTo(3));
    }

    @Test
    void testUnclosedBracketIsReported() {
        assertThatThrownBy(() -> PythonParser.parse("x = (1,\n", "open.py"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessageContaining("was never closed");
    }

    private static String roundTrip(String source) {
        return PythonUnparser.unparse(PythonParser.parse(source, "test.py"));
    }
}
