package com.funcpool.service;

import com.funcpool.canonical.ContentHasher;
import com.funcpool.config.MetadataFactory;
import com.funcpool.config.PoolConfig;
import com.funcpool.exception.AmbiguousMappingException;
import com.funcpool.exception.NotFoundException;
import com.funcpool.exception.PoolException;
import com.funcpool.execution.ProgramExecutor;
import com.funcpool.service.model.AddResult;
import com.funcpool.service.model.LogEntry;
import com.funcpool.service.model.ReviewItem;
import com.funcpool.service.model.ReviewResult;
import com.funcpool.service.model.RunResult;
import com.funcpool.service.model.SearchHit;
import com.funcpool.service.model.ShowResult;
import com.funcpool.storage.PoolStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class PoolServiceTest {

    private static final String CALCULATE_SUM = """
            def calculate_sum(first, second):
                \"\"\"Add two numbers\"\"\"
                result = first + second
                return result
            """;

    private static final String CALCULER_SOMME = """
            def calculer_somme(premier, second):
                \"\"\"Additionne deux nombres\"\"\"
                resultat = premier + second
                return resultat
            """;

    private static final String DOUBLE = """
            def double(x):
                return x * 2
            """;

    @TempDir
    Path tempDir;

    private PoolConfig config;
    private PoolStorage storage;
    private RecordingExecutor executor;
    private PoolService service;

    @BeforeEach
    void setUp() {
        config = PoolConfig.builder().poolDirectory(tempDir).author("alice").build();
        storage = new PoolStorage(tempDir);
        executor = new RecordingExecutor("8");
        service = serviceAt("2025-01-01T00:00:00Z");
    }

    @Test
    void testSameLogicInTwoLanguagesSharesOneHash() {
        AddResult eng = service.add(CALCULATE_SUM, "sum.py", "eng", "", null);
        AddResult fra = service.add(CALCULER_SOMME, "somme.py", "fra", "", null);

        assertThat(fra.getHash()).isEqualTo(eng.getHash());
        assertThat(eng.isNewObject()).isTrue();
        assertThat(fra.isNewObject()).isFalse();
        assertThat(storage.listLanguages(eng.getHash())).containsExactly("eng", "fra");
        assertThat(service.get(eng.getHash(), "fra")).isEqualTo("""
                def calculer_somme(premier, second):
                    \"\"\"Additionne deux nombres\"\"\"
                    resultat = premier + second
                    return resultat""");
        assertThat(service.get(eng.getHash(), "eng")).isEqualTo(CALCULATE_SUM.strip());
    }

    @Test
    void testAddRecordsMetadata() {
        String hash = service.add(CALCULATE_SUM, "sum.py", "eng", "", null).getHash();

        assertThat(storage.loadObject(hash).getMetadata().getCreated()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(storage.loadObject(hash).getMetadata().getAuthor()).isEqualTo("alice");
    }

    @Test
    void testAliasIsShownAsWritten() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);

        assertThat(service.get(twice, "eng")).isEqualTo("""
                from funcpool.pool import object_%s as dbl

                def twice(value):
                    return dbl(dbl(value))""".formatted(helper));
    }

    @Test
    void testMissingDependencyIsRejected() {
        String unknown = ContentHasher.sha256("unknown");

        assertThatThrownBy(() -> addTwice(unknown))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Functions referenced by twice.py are not in the pool: " + unknown);
        assertThat(storage.listFunctions()).isEmpty();
    }

    @Test
    void testMissingParentIsRejected() {
        String unknown = ContentHasher.sha256("unknown");

        assertThatThrownBy(() -> service.add(DOUBLE, "double.py", "eng", "", unknown))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Parent function not found: " + unknown);
    }

    @Test
    void testShowListsVariantsWhenAmbiguous() {
        String hash = service.add(CALCULATE_SUM, "sum.py", "eng", "formal", null).getHash();
        service.add(CALCULATE_SUM.replace("result", "total"), "sum.py", "eng", "short", null);

        ShowResult show = service.show(hash, "eng", null);

        assertThat(show.isAmbiguous()).isTrue();
        assertThat(show.getVariants()).extracting(variant -> variant.getComment())
                .containsExactlyInAnyOrder("formal", "short");
        assertThatThrownBy(() -> service.get(hash, "eng")).isInstanceOf(AmbiguousMappingException.class);

        String chosen = show.getVariants().get(0).getMappingHash();
        assertThat(service.show(hash, "eng", chosen).getSource()).startsWith("def calculate_sum(first, second):");
    }

    @Test
    void testTranslateAddsMapping() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);

        service.translate(twice, "eng", null, "fra", Map.of("twice", "deux_fois", "value", "valeur"),
                "Applique deux fois.", "");

        assertThat(service.get(twice, "fra")).isEqualTo("""
                from funcpool.pool import object_%s as dbl

                def deux_fois(valeur):
                    \"\"\"Applique deux fois.\"\"\"
                    return dbl(dbl(valeur))""".formatted(helper));
    }

    @Test
    void testTranslateReportsEveryProblem() {
        String hash = service.add(CALCULATE_SUM, "sum.py", "eng", "", null).getHash();

        assertThatThrownBy(() -> service.translate(hash, "eng", null, "fra",
                Map.of("calculate_sum", "1somme", "first", "premier", "second", "second"), "", ""))
                .isInstanceOf(PoolException.class)
                .hasMessage("Not a valid identifier: '1somme'; No translation for 'result'");
        assertThat(storage.listLanguages(hash)).containsExactly("eng");
    }

    @Test
    void testRunRendersWholeProgram() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);

        RunResult result = service.run(twice, List.of("eng"), List.of("2"));

        assertThat(result.getOutput()).isEqualTo("8");
        assertThat(result.getFunctionName()).isEqualTo("twice");
        assertThat(result.getDependencyCount()).isEqualTo(1);
        assertThat(executor.arguments).containsExactly("2");
        assertThat(executor.script)
                .contains("'def double(x):\\n    return x * 2'")
                .contains("'def twice(value):\\n    return dbl(dbl(value))'")
                .contains("[('dbl', '" + helper + "')]");
        assertThat(executor.script.indexOf("'" + helper + "',\n")).isLessThan(executor.script.indexOf("'" + twice + "',\n"));
    }

    @Test
    void testRunFallsBackToConfiguredLanguages() {
        String hash = service.add(CALCULER_SOMME, "somme.py", "fra", "", null).getHash();
        config.setLanguages(List.of("fra"));

        RunResult result = service.run(hash, List.of("eng"), List.of("1", "2"));

        assertThat(result.getLanguage()).isEqualTo("fra");
        assertThat(result.getFunctionName()).isEqualTo("calculer_somme");
    }

    @Test
    void testReviewWarnsAboutUntranslatedDependencies() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);
        service.translate(twice, "eng", null, "fra", Map.of("twice", "deux_fois", "value", "valeur"), "", "");

        ReviewResult review = service.review(twice, List.of("fra"));

        assertThat(review.getItems()).singleElement()
                .satisfies(item -> assertThat(item.getSource()).contains("def deux_fois(valeur):"));
        assertThat(review.getWarnings()).singleElement()
                .satisfies(warning -> assertThat(warning).startsWith(helper + ": No usable mapping of " + helper));
    }

    @Test
    void testReviewSkipsMissingDependency() throws IOException {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);
        try (Stream<Path> files = Files.walk(storage.layout().functionDirectory(helper))) {
            for (Path file : files.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(file);
            }
        }

        ReviewResult review = service.review(twice, List.of("eng"));

        assertThat(review.getItems()).extracting(ReviewItem::getHash).containsExactly(twice);
        assertThat(review.getWarnings()).singleElement()
                .satisfies(warning -> assertThat(warning).startsWith(helper + ": Function not found"));
    }

    @Test
    void testLogIsNewestFirst() {
        String older = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String newer = serviceAt("2025-06-01T08:00:00Z").add(CALCULATE_SUM, "sum.py", "eng", "", null).getHash();

        List<LogEntry> entries = service.log();

        assertThat(entries).extracting(LogEntry::getHash).containsExactly(newer, older);
        assertThat(entries.get(0).getCreated()).isEqualTo("2025-06-01T08:00:00Z");
        assertThat(entries.get(1).getLanguages()).containsExactly("eng");
    }

    @Test
    void testSearchLooksAtNamesDocstringsAndVariables() {
        String hash = service.add(CALCULATE_SUM, "sum.py", "eng", "", null).getHash();
        service.add(CALCULER_SOMME, "somme.py", "fra", "", null);

        assertThat(service.search(List.of("CALC")))
                .extracting(SearchHit::getLanguage, SearchHit::getFunctionName, SearchHit::getMatchedIn)
                .containsExactlyInAnyOrder(tuple("eng", "calculate_sum", List.of("name")),
                        tuple("fra", "calculer_somme", List.of("name")));
        assertThat(service.search(List.of("nombres")))
                .extracting(SearchHit::getHash, SearchHit::getMatchedIn)
                .containsExactly(tuple(hash, List.of("docstring")));
        assertThat(service.search(List.of("premier", "nothing")))
                .extracting(SearchHit::getLanguage, SearchHit::getMatchedIn)
                .containsExactly(tuple("fra", List.of("variables")));
        assertThatThrownBy(() -> service.search(List.of())).isInstanceOf(PoolException.class);
    }

    @Test
    void testCallersAndChecks() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);
        String test = service.add("""
                from funcpool import check
                from funcpool.pool import object_%1$s
                @check(object_%1$s)
                def test_double():
                    return object_%1$s._fp_v_0(2) == 4
                """.formatted(helper), "test_double.py", "eng", "", null).getHash();

        assertThat(service.callers(helper)).containsExactlyInAnyOrder(twice, test);
        assertThat(service.callers(twice)).isEmpty();
        assertThat(service.checks(helper)).containsExactly(test);
        assertThat(service.checks(twice)).isEmpty();
    }

    @Test
    void testRefactorSwapsDependency() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String triple = service.add("def triple(x):\n    return x * 3\n", "triple.py", "eng", "", null).getHash();
        String twice = addTwice(helper);

        String refactored = service.refactor(twice, helper, triple);

        assertThat(refactored).isNotEqualTo(twice);
        assertThat(service.get(refactored, "eng")).isEqualTo("""
                from funcpool.pool import object_%s as dbl

                def twice(value):
                    return dbl(dbl(value))""".formatted(triple));
        assertThat(storage.loadObject(refactored).getMetadata().getParent()).isEqualTo(twice);
        assertThat(addTwice(triple)).isEqualTo(refactored);
    }

    @Test
    void testRefactorRequiresExistingDependency() {
        String helper = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String twice = addTwice(helper);
        String unrelated = ContentHasher.sha256("unrelated");

        assertThatThrownBy(() -> service.refactor(twice, unrelated, helper))
                .isInstanceOf(PoolException.class)
                .hasMessage("Function " + twice + " does not depend on " + unrelated);
        assertThatThrownBy(() -> service.refactor(twice, helper, unrelated))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void testMigrateSingleFunction() {
        String current = service.add(DOUBLE, "double.py", "eng", "", null).getHash();
        String code = "def _fp_v_0():\n    return 7";
        String legacy = ContentHasher.sha256(code);
        storage.legacy().save(legacy, "eng", code, "", Map.of("_fp_v_0", "seven"), Map.of());

        assertThat(service.migrate(legacy, false, true).getPending()).containsExactly(legacy);
        assertThat(storage.legacy().exists(legacy)).isTrue();
        assertThat(service.migrate(legacy, false, false).getMigrated()).containsExactly(legacy);
        assertThat(service.get(legacy, "eng")).isEqualTo("def seven():\n    return 7");

        assertThatThrownBy(() -> service.migrate(current, false, false))
                .isInstanceOf(PoolException.class)
                .hasMessage("Function " + current + " already uses schema version 1");
        String unknown = ContentHasher.sha256("unknown");
        assertThatThrownBy(() -> service.migrate(unknown, false, false))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void testPreferredLanguagesAreValidated() {
        config.setLanguages(List.of("eng", "fra"));

        assertThat(service.preferredLanguages(List.of("fra", "deu"))).containsExactly("fra", "deu", "eng");
        assertThatThrownBy(() -> service.preferredLanguages(List.of("x")))
                .isInstanceOf(PoolException.class)
                .hasMessageContaining("Invalid language code 'x'");
    }

    private String addTwice(String helper) {
        return service.add("""
                from funcpool.pool import object_%s as dbl
                def twice(value):
                    return dbl(dbl(value))
                """.formatted(helper), "twice.py", "eng", "", null).getHash();
    }

    private PoolService serviceAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new PoolService(config, storage, executor, new MetadataFactory(config, clock));
    }

    private static class RecordingExecutor implements ProgramExecutor {
        private final String output;
        private String script;
        private List<String> arguments = new ArrayList<>();

        RecordingExecutor(String output) {
            this.output = output;
        }

        @Override
        public String execute(String script, List<String> arguments) {
            this.script = script;
            this.arguments = List.copyOf(arguments);
            return output;
        }
    }
}
