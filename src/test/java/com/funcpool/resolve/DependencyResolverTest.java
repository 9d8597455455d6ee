package com.funcpool.resolve;

import com.funcpool.canonical.ContentHasher;
import com.funcpool.canonical.Denormalizer;
import com.funcpool.exception.NotFoundException;
import com.funcpool.storage.FunctionMetadata;
import com.funcpool.storage.PoolStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class DependencyResolverTest {

    private static final String BASE = ContentHasher.sha256("base");
    private static final String LEFT = ContentHasher.sha256("left");
    private static final String RIGHT = ContentHasher.sha256("right");
    private static final String TOP = ContentHasher.sha256("top");
    private static final String PING = ContentHasher.sha256("ping");
    private static final String PONG = ContentHasher.sha256("pong");

    @TempDir
    Path tempDir;

    private PoolStorage storage;
    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        storage = new PoolStorage(tempDir);
        resolver = new DependencyResolver(storage, new Denormalizer());
    }

    @Test
    void testSharedDependencyIsLoadedOnce() {
        storeDiamond();

        ResolvedProgram program = resolver.resolve(TOP, List.of("eng"));

        assertThat(program.getUnits()).extracting(ResolvedUnit::getHash).containsExactly(BASE, LEFT, RIGHT, TOP);
        assertThat(program.getEntryName()).isEqualTo("top");
        assertThat(program.getEnvironment().hasDeferredBindings()).isFalse();
        assertThat(program.getEnvironment().bindingsOf(TOP))
                .extracting(AliasBinding::getAlias, AliasBinding::getTarget)
                .containsExactly(tuple("left", LEFT), tuple("right", RIGHT));
    }

    @Test
    void testUnitSourceHasNoPoolImports() {
        storeDiamond();

        ResolvedUnit top = resolver.resolve(TOP, List.of("eng")).entry();

        assertThat(top.getDisplaySource()).isEqualTo("""
                from funcpool.pool import object_%s as left, object_%s as right

                def top(value):
                    return left(value) + right(value)""".formatted(LEFT, RIGHT));
        assertThat(top.getSource()).isEqualTo("""
                def top(value):
                    return left(value) + right(value)""");
        assertThat(top.getReferences()).containsExactly(LEFT, RIGHT);
    }

    @Test
    void testCycleDefersClosingBinding() {
        storeCycle();

        ResolvedProgram program = resolver.resolve(PING, List.of("eng"));

        assertThat(program.getUnits()).extracting(ResolvedUnit::getHash).containsExactly(PONG, PING);
        assertThat(program.getEnvironment().bindingsOf(PONG)).containsExactly(new AliasBinding("ping", PING, true));
        assertThat(program.getEnvironment().bindingsOf(PING)).containsExactly(new AliasBinding("pong", PONG, false));
        assertThat(program.getEnvironment().hasDeferredBindings()).isTrue();
    }

    @Test
    void testLanguagesAreTriedInOrder() {
        storeDiamond();
        storage.saveMapping(BASE, "fra", "", Map.of("_fp_v_0", "base_fr", "_fp_v_1", "valeur"), Map.of(), "");
        storage.saveMapping(LEFT, "fra", "", Map.of("_fp_v_0", "gauche", "_fp_v_1", "valeur"), Map.of(), "a");
        storage.saveMapping(LEFT, "fra", "", Map.of("_fp_v_0", "a_gauche", "_fp_v_1", "valeur"), Map.of(), "b");

        ResolvedProgram program = resolver.resolve(TOP, List.of("fra", "eng"));

        Map<String, String> languages = program.getUnits().stream()
                .collect(Collectors.toMap(ResolvedUnit::getHash, ResolvedUnit::getLanguage));
        assertThat(languages).containsEntry(BASE, "fra")
                .containsEntry(LEFT, "eng")
                .containsEntry(RIGHT, "eng")
                .containsEntry(TOP, "eng");
    }

    @Test
    void testMissingLanguageNamesAvailableOnes() {
        storeDiamond();

        assertThatThrownBy(() -> resolver.resolve(TOP, List.of("deu")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("No usable mapping of " + BASE + " in deu")
                .hasMessageContaining("available languages: eng");
    }

    @Test
    void testMissingDependencyIsNotFound() {
        store(TOP, """
                from funcpool.pool import object_%s

                def _fp_v_0():
                    return object_%s._fp_v_0()""".formatted(LEFT, LEFT), Map.of("_fp_v_0", "top"), Map.of());

        assertThatThrownBy(() -> resolver.resolve(TOP, List.of("eng")))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Function not found: " + LEFT);
    }

    @Test
    void testDependencyOrder() {
        storeDiamond();
        storeCycle();

        assertThat(resolver.dependencyOrder(TOP)).containsExactly(BASE, LEFT, RIGHT, TOP);
        assertThat(resolver.dependencyOrder(PONG)).containsExactly(PING, PONG);
        assertThat(resolver.dependencyOrder(BASE)).containsExactly(BASE);
    }

    private void storeDiamond() {
        store(BASE, "def _fp_v_0(_fp_v_1):\n    return _fp_v_1 * 2",
                Map.of("_fp_v_0", "base", "_fp_v_1", "value"), Map.of());
        store(LEFT, dependent(BASE, "_fp_v_1 + 1"), Map.of("_fp_v_0", "left", "_fp_v_1", "value"),
                Map.of(BASE, "base"));
        store(RIGHT, dependent(BASE, "_fp_v_1 - 1"), Map.of("_fp_v_0", "right", "_fp_v_1", "value"),
                Map.of(BASE, "base"));
        store(TOP, """
                from funcpool.pool import object_%1$s, object_%2$s

                def _fp_v_0(_fp_v_1):
                    return object_%1$s._fp_v_0(_fp_v_1) + object_%2$s._fp_v_0(_fp_v_1)""".formatted(LEFT, RIGHT),
                Map.of("_fp_v_0", "top", "_fp_v_1", "value"), Map.of(LEFT, "left", RIGHT, "right"));
    }

    private void storeCycle() {
        store(PING, countdown(PONG), Map.of("_fp_v_0", "ping", "_fp_v_1", "n"), Map.of(PONG, "pong"));
        store(PONG, countdown(PING), Map.of("_fp_v_0", "pong", "_fp_v_1", "n"), Map.of(PING, "ping"));
    }

    private static String dependent(String dependency, String argument) {
        return """
                from funcpool.pool import object_%1$s

                def _fp_v_0(_fp_v_1):
                    return object_%1$s._fp_v_0(%2$s)""".formatted(dependency, argument);
    }

    private static String countdown(String other) {
        return """
                from funcpool.pool import object_%1$s

                def _fp_v_0(_fp_v_1):
                    if _fp_v_1 <= 0:
                        return 0
                    return object_%1$s._fp_v_0(_fp_v_1 - 1)""".formatted(other);
    }

    private void store(String hash, String code, Map<String, String> names, Map<String, String> aliases) {
        storage.saveObject(hash, code, FunctionMetadata.builder().build());
        storage.saveMapping(hash, "eng", "", names, aliases, "");
    }
}
