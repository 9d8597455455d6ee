package com.funcpool.service;

import com.funcpool.canonical.CanonicalForm;
import com.funcpool.canonical.Canonicalizer;
import com.funcpool.canonical.ContentHasher;
import com.funcpool.canonical.Denormalizer;
import com.funcpool.canonical.Identifiers;
import com.funcpool.config.MetadataFactory;
import com.funcpool.config.PoolConfig;
import com.funcpool.exception.NotFoundException;
import com.funcpool.exception.PoolException;
import com.funcpool.exception.PoolStorageException;
import com.funcpool.execution.ProgramExecutor;
import com.funcpool.execution.ProgramRenderer;
import com.funcpool.execution.PythonProcessExecutor;
import com.funcpool.resolve.DependencyResolver;
import com.funcpool.resolve.ResolvedProgram;
import com.funcpool.resolve.ResolvedUnit;
import com.funcpool.resolve.SelectedMapping;
import com.funcpool.service.model.AddResult;
import com.funcpool.service.model.LogEntry;
import com.funcpool.service.model.ReviewItem;
import com.funcpool.service.model.ReviewResult;
import com.funcpool.service.model.RunResult;
import com.funcpool.service.model.SearchHit;
import com.funcpool.service.model.ShowResult;
import com.funcpool.storage.CanonicalFunction;
import com.funcpool.storage.FunctionMetadata;
import com.funcpool.storage.LocalizationMapping;
import com.funcpool.storage.MappingVariant;
import com.funcpool.storage.PoolStorage;
import com.funcpool.storage.SchemaValidator;
import com.funcpool.storage.StoredFunction;
import com.funcpool.storage.ValidationResult;
import com.funcpool.storage.migration.MigrationReport;
import com.funcpool.storage.migration.SchemaMigrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Every pool command, independent of how it is invoked.
 */
public class PoolService {
    private static final Logger log = LoggerFactory.getLogger(PoolService.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final PoolConfig config;
    private final PoolStorage storage;
    private final Canonicalizer canonicalizer = new Canonicalizer();
    private final Denormalizer denormalizer = new Denormalizer();
    private final MetadataFactory metadataFactory;
    private final SchemaValidator validator;
    private final SchemaMigrator migrator;
    private final DependencyResolver resolver;
    private final ProgramRenderer renderer = new ProgramRenderer();
    private final ProgramExecutor executor;

    public PoolService(PoolConfig config) {
        this(config, new PoolStorage(config.getPoolDirectory()),
                new PythonProcessExecutor(config.getPythonExecutable(), config.getExecutionTimeout()),
                new MetadataFactory(config));
    }

    public PoolService(PoolConfig config, PoolStorage storage, ProgramExecutor executor,
                       MetadataFactory metadataFactory) {
        this.config = config;
        this.storage = storage;
        this.executor = executor;
        this.metadataFactory = metadataFactory;
        this.validator = new SchemaValidator(storage);
        this.migrator = new SchemaMigrator(storage, validator, metadataFactory);
        this.resolver = new DependencyResolver(storage, denormalizer);
    }

    public PoolStorage storage() {
        return storage;
    }

    public AddResult add(Path file, String language, String comment, String parent) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PoolStorageException("Failed to read " + file, file, e);
        }
        return add(source, file.toString(), language, comment, parent);
    }

    /**
     * Canonicalizes a function source and stores it with its mapping in {@code language}.
     *
     * @throws NotFoundException when a pool import, a check target or the parent is not in the pool
     */
    public AddResult add(String source, String fileName, String language, String comment, String parent) {
        Identifiers.requireLanguage(language);
        if (parent != null) {
            Identifiers.requireHash(parent);
        }
        CanonicalForm form = canonicalizer.canonicalize(source, fileName);

        Set<String> referenced = new LinkedHashSet<>(form.getDependencies());
        referenced.addAll(form.getChecks());
        List<String> missing = referenced.stream()
                .filter(hash -> !storage.exists(hash))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new NotFoundException("Functions referenced by " + fileName + " are not in the pool: "
                    + String.join(", ", missing));
        }
        if (parent != null && !storage.exists(parent)) {
            throw new NotFoundException("Parent function not found: " + parent);
        }

        String hash = ContentHasher.identityHash(form);
        boolean newObject = storage.saveObject(hash, form.getWithDocstring(),
                metadataFactory.create(parent, form.getChecks()));
        String mappingHash = storage.saveMapping(hash, language, form.getDocstring(), form.getNameMapping(),
                form.getAliasMapping(), comment);
        log.info("Added {} as {}@{} (mapping {})", form.getFunctionName(), hash, language, mappingHash);
        return AddResult.builder()
                .hash(hash)
                .language(language)
                .mappingHash(mappingHash)
                .functionName(form.getFunctionName())
                .newObject(newObject)
                .build();
    }

    /**
     * Readable source of a function in a language that has exactly one mapping.
     *
     * @throws com.funcpool.exception.AmbiguousMappingException when the language has several mappings
     */
    public String get(String hash, String language) {
        CanonicalFunction object = storage.loadObject(hash);
        return denormalize(object, storage.loadMapping(hash, language, null));
    }

    /**
     * Like {@link #get} but lists the variants instead of failing when no mapping was chosen and
     * several exist.
     */
    public ShowResult show(String hash, String language, String mappingHash) {
        CanonicalFunction object = storage.loadObject(hash);
        if (mappingHash == null) {
            List<MappingVariant> variants = storage.listMappings(hash, language);
            if (variants.size() > 1) {
                return ShowResult.choices(hash, language, variants);
            }
        }
        return ShowResult.source(hash, language, denormalize(object, storage.loadMapping(hash, language, mappingHash)));
    }

    /**
     * Migrates one legacy function, or every one when {@code hash} is null.
     */
    public MigrationReport migrate(String hash, boolean keepLegacy, boolean dryRun) {
        MigrationReport report;
        if (hash == null) {
            report = migrator.migrateAll(keepLegacy, dryRun);
        } else {
            Identifiers.requireHash(hash);
            if (!storage.legacy().exists(hash)) {
                StoredFunction stored = storage.load(hash);
                throw new PoolException("Function " + hash + " already uses schema version "
                        + stored.generation().getVersion());
            }
            report = new MigrationReport(dryRun);
            if (dryRun) {
                report.getPending().add(hash);
            } else {
                migrator.migrate(hash, keepLegacy);
                report.getMigrated().add(hash);
            }
        }
        log.info("Migration {} {} function(s)", dryRun ? "would affect" : "affected", report.affected().size());
        return report;
    }

    public ValidationResult validate(String hash) {
        return validator.validate(hash);
    }

    public Map<String, ValidationResult> validateAll() {
        return validator.validateAll();
    }

    /**
     * Adds a mapping in {@code targetLanguage} built from an existing one.
     *
     * @param names new identifier for every identifier of the source mapping, keyed by the source identifier
     * @return hash of the new mapping
     */
    public String translate(String hash, String sourceLanguage, String sourceMappingHash, String targetLanguage,
                            Map<String, String> names, String docstring, String comment) {
        Identifiers.requireLanguage(targetLanguage);
        storage.loadObject(hash);
        LocalizationMapping source = storage.loadMapping(hash, sourceLanguage, sourceMappingHash);

        List<String> errors = new ArrayList<>();
        Map<String, String> nameMapping = new LinkedHashMap<>();
        source.getNameMapping().forEach((slot, original) -> {
            String translated = names.get(original);
            if (translated == null) {
                errors.add("No translation for '" + original + "'");
            } else if (!IDENTIFIER.matcher(translated).matches()) {
                errors.add("Not a valid identifier: '" + translated + "'");
            } else {
                nameMapping.put(slot, translated);
            }
        });
        if (!errors.isEmpty()) {
            throw new PoolException(String.join("; ", errors));
        }

        String mappingHash = storage.saveMapping(hash, targetLanguage, LocalizationMapping.builder()
                .docstring(docstring == null ? "" : docstring)
                .nameMapping(nameMapping)
                .aliasMapping(new LinkedHashMap<>(source.getAliasMapping()))
                .comment(comment == null ? "" : comment)
                .build());
        log.info("Translated {} from {} to {} (mapping {})", hash, sourceLanguage, targetLanguage, mappingHash);
        return mappingHash;
    }

    /**
     * Resolves a function with its dependencies and runs it.
     */
    public RunResult run(String hash, List<String> languages, List<String> arguments) {
        ResolvedProgram program = resolver.resolve(hash, preferredLanguages(languages));
        ResolvedUnit entry = program.entry();
        String output = executor.execute(renderer.render(program), arguments);
        return RunResult.builder()
                .hash(hash)
                .language(entry.getLanguage())
                .functionName(entry.getFunctionName())
                .source(entry.getDisplaySource())
                .dependencyCount(program.getUnits().size() - 1)
                .arguments(List.copyOf(arguments))
                .output(output)
                .build();
    }

    /**
     * Shows a function and everything it depends on, lowest level first.
     */
    public ReviewResult review(String hash, List<String> languages) {
        List<String> preferred = preferredLanguages(languages);
        List<ReviewItem> items = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> order = resolver.dependencyOrder(hash, (item, e) -> {
            log.warn("Skipping {} in review: {}", item, e.getMessage());
            warnings.add(item + ": " + e.getMessage());
        });
        for (String item : order) {
            try {
                SelectedMapping selected = resolver.selectMapping(item, preferred);
                items.add(new ReviewItem(item, selected.getLanguage(),
                        denormalize(storage.loadObject(item), selected.getMapping())));
            } catch (PoolException e) {
                log.warn("Skipping {} in review: {}", item, e.getMessage());
                warnings.add(item + ": " + e.getMessage());
            }
        }
        return new ReviewResult(items, warnings);
    }

    /**
     * Every stored function, newest first.
     */
    public List<LogEntry> log() {
        List<LogEntry> entries = new ArrayList<>();
        for (String hash : storage.listFunctions()) {
            try {
                FunctionMetadata metadata = storage.loadObject(hash).getMetadata();
                entries.add(new LogEntry(hash,
                        metadata == null ? null : metadata.getCreated(),
                        metadata == null ? null : metadata.getAuthor(),
                        storage.listLanguages(hash)));
            } catch (PoolException e) {
                log.warn("Skipping unreadable function {}: {}", hash, e.getMessage());
            }
        }
        entries.sort(Comparator.comparing(LogEntry::getCreated, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(LogEntry::getHash));
        return entries;
    }

    /**
     * Case-insensitive search of function names, docstrings and identifiers across every mapping.
     * A mapping matches when any term matches.
     */
    public List<SearchHit> search(List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            throw new PoolException("No search terms given");
        }
        List<String> needles = terms.stream().map(term -> term.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
        List<SearchHit> hits = new ArrayList<>();
        for (String hash : storage.listFunctions()) {
            for (String language : storage.listLanguages(hash)) {
                for (MappingVariant variant : storage.listMappings(hash, language)) {
                    LocalizationMapping mapping;
                    try {
                        mapping = storage.loadMapping(hash, language, variant.getMappingHash());
                    } catch (PoolException e) {
                        log.warn("Skipping mapping {} of {}@{}: {}", variant.getMappingHash(), hash, language,
                                e.getMessage());
                        continue;
                    }
                    String functionName = mapping.getNameMapping().getOrDefault(Identifiers.ENTRY_SLOT, "");
                    String variables = String.join(" ", mapping.getNameMapping().values()).toLowerCase(Locale.ROOT);
                    List<String> matchedIn = new ArrayList<>();
                    if (containsAny(functionName.toLowerCase(Locale.ROOT), needles)) {
                        matchedIn.add("name");
                    }
                    if (containsAny(mapping.getDocstring().toLowerCase(Locale.ROOT), needles)) {
                        matchedIn.add("docstring");
                    }
                    if (!matchedIn.contains("name") && containsAny(variables, needles)) {
                        matchedIn.add("variables");
                    }
                    if (!matchedIn.isEmpty()) {
                        hits.add(new SearchHit(hash, language, variant.getMappingHash(), functionName, matchedIn));
                    }
                }
            }
        }
        return hits;
    }

    /**
     * Functions that import {@code hash}, sorted.
     */
    public List<String> callers(String hash) {
        Identifiers.requireHash(hash);
        List<String> callers = new ArrayList<>();
        for (String candidate : storage.listFunctions()) {
            try {
                if (denormalizer.dependencies(storage.loadObject(candidate).getNormalizedCode()).contains(hash)) {
                    callers.add(candidate);
                }
            } catch (PoolException e) {
                log.warn("Skipping unreadable function {}: {}", candidate, e.getMessage());
            }
        }
        return callers;
    }

    /**
     * Functions declaring themselves a test of {@code hash}, sorted.
     */
    public List<String> checks(String hash) {
        Identifiers.requireHash(hash);
        List<String> tests = new ArrayList<>();
        for (String candidate : storage.listFunctions()) {
            try {
                FunctionMetadata metadata = storage.loadObject(candidate).getMetadata();
                if (metadata != null && metadata.getChecks() != null && metadata.getChecks().contains(hash)) {
                    tests.add(candidate);
                }
            } catch (PoolException e) {
                log.warn("Skipping unreadable function {}: {}", candidate, e.getMessage());
            }
        }
        return tests;
    }

    /**
     * Stores a copy of {@code what} that calls {@code to} wherever it called {@code from}. Every
     * mapping is copied with its alias moved to the new dependency.
     *
     * @return hash of the new function
     */
    public String refactor(String what, String from, String to) {
        Identifiers.requireHash(from);
        Identifiers.requireHash(to);
        CanonicalFunction object = storage.loadObject(what);
        if (!denormalizer.dependencies(object.getNormalizedCode()).contains(from)) {
            throw new PoolException("Function " + what + " does not depend on " + from);
        }
        if (!storage.exists(to)) {
            throw new NotFoundException("Function not found: " + to);
        }

        Pattern reference = Pattern.compile("\\b" + Pattern.quote(Identifiers.objectReference(from)) + "\\b");
        String patched = reference.matcher(object.getNormalizedCode())
                .replaceAll(Matcher.quoteReplacement(Identifiers.objectReference(to)));
        CanonicalForm form = canonicalizer.canonicalize(patched, "<refactor of " + what + ">");
        String hash = ContentHasher.identityHash(form);
        storage.saveObject(hash, form.getWithDocstring(), metadataFactory.create(what, form.getChecks()));

        for (String language : storage.listLanguages(what)) {
            for (MappingVariant variant : storage.listMappings(what, language)) {
                LocalizationMapping mapping = storage.loadMapping(what, language, variant.getMappingHash());
                Map<String, String> nameMapping = new LinkedHashMap<>();
                form.getNameMapping().forEach((slot, previousSlot) ->
                        nameMapping.put(slot, mapping.getNameMapping().getOrDefault(previousSlot, previousSlot)));
                Map<String, String> aliasMapping = new LinkedHashMap<>();
                mapping.getAliasMapping().forEach((dependency, alias) ->
                        aliasMapping.put(dependency.equals(from) ? to : dependency, alias));
                storage.saveMapping(hash, language, mapping.toBuilder()
                        .nameMapping(nameMapping)
                        .aliasMapping(aliasMapping)
                        .build());
            }
        }
        log.info("Refactored {} into {} ({} -> {})", what, hash, from, to);
        return hash;
    }

    /**
     * Requested languages first, then the configured ones.
     */
    List<String> preferredLanguages(List<String> requested) {
        Set<String> languages = new LinkedHashSet<>();
        if (requested != null) {
            languages.addAll(requested);
        }
        languages.addAll(config.getLanguages());
        languages.forEach(Identifiers::requireLanguage);
        return List.copyOf(languages);
    }

    private String denormalize(CanonicalFunction object, LocalizationMapping mapping) {
        return denormalizer.denormalize(object.getNormalizedCode(), mapping.getNameMapping(),
                mapping.getAliasMapping(), mapping.getDocstring());
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        return needles.stream().anyMatch(haystack::contains);
    }
}
