package com.funcpool.resolve;

import com.funcpool.canonical.Denormalizer;
import com.funcpool.canonical.Identifiers;
import com.funcpool.exception.NotFoundException;
import com.funcpool.exception.PoolException;
import com.funcpool.storage.CanonicalFunction;
import com.funcpool.storage.FunctionMetadata;
import com.funcpool.storage.LocalizationMapping;
import com.funcpool.storage.MappingVariant;
import com.funcpool.storage.PoolStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Loads a function and everything it imports from the pool, dependencies before dependents.
 * Cycles are cut at the first back-edge; the binding that closes the cycle is deferred.
 */
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final PoolStorage storage;
    private final Denormalizer denormalizer;

    public DependencyResolver(PoolStorage storage, Denormalizer denormalizer) {
        this.storage = storage;
        this.denormalizer = denormalizer;
    }

    /**
     * Resolves a function for execution.
     *
     * @param languages preferred languages, most preferred first
     */
    public ResolvedProgram resolve(String hash, List<String> languages) {
        Identifiers.requireHash(hash);
        if (languages == null || languages.isEmpty()) {
            throw new NotFoundException("No language given to resolve " + hash);
        }
        Resolution resolution = new Resolution();
        BindingEnvironment environment = new BindingEnvironment();
        List<ResolvedUnit> units = new ArrayList<>();
        walk(hash, resolution, frame -> units.add(link(frame, languages, resolution, environment)), null);
        log.debug("Resolved {} into {} units", hash, units.size());
        return new ResolvedProgram(List.copyOf(units), environment, hash);
    }

    /**
     * Topological order of a function and its transitive dependencies, lowest level first and the
     * function itself last. Nothing is denormalized.
     */
    public List<String> dependencyOrder(String hash) {
        return dependencyOrder(hash, null);
    }

    /**
     * Like {@link #dependencyOrder(String)}, but a dependency that cannot be loaded is handed to
     * {@code onFailure}, left out of the order and treated as a leaf. The function itself must load.
     */
    public List<String> dependencyOrder(String hash, BiConsumer<String, PoolException> onFailure) {
        Identifiers.requireHash(hash);
        List<String> order = new ArrayList<>();
        walk(hash, new Resolution(), frame -> order.add(frame.hash), onFailure);
        return order;
    }

    /**
     * Picks the first preferred language holding exactly one mapping of the function.
     */
    public SelectedMapping selectMapping(String hash, List<String> languages) {
        for (String language : languages) {
            List<MappingVariant> variants = storage.listMappings(hash, language);
            if (variants.isEmpty()) {
                continue;
            }
            if (variants.size() > 1) {
                log.warn("Function {} has {} mappings in '{}', trying the next language", hash, variants.size(),
                        language);
                continue;
            }
            return new SelectedMapping(language, storage.loadMapping(hash, language, variants.get(0).getMappingHash()));
        }
        List<String> available = storage.listLanguages(hash);
        throw new NotFoundException("No usable mapping of " + hash + " in " + String.join(", ", languages)
                + (available.isEmpty() ? "" : "; available languages: " + String.join(", ", available)));
    }

    /**
     * Post-order walk over the pool imports with an explicit stack. A hash seen before, including
     * one still loading on a cycle, is not entered again. Without {@code onFailure} a dependency
     * that fails to load aborts the walk.
     */
    private void walk(String hash, Resolution resolution, Consumer<Frame> onLoaded,
                      BiConsumer<String, PoolException> onFailure) {
        Deque<Frame> stack = new ArrayDeque<>();
        if (resolution.begin(hash)) {
            stack.push(openFrame(hash));
        }
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.dependencies.size()) {
                String dependency = frame.dependencies.get(frame.next++);
                if (resolution.begin(dependency)) {
                    Frame opened = tryOpenFrame(dependency, onFailure);
                    if (opened != null) {
                        stack.push(opened);
                    } else {
                        resolution.complete(dependency);
                    }
                }
                continue;
            }
            stack.pop();
            onLoaded.accept(frame);
            resolution.complete(frame.hash);
        }
    }

    private Frame tryOpenFrame(String hash, BiConsumer<String, PoolException> onFailure) {
        if (onFailure == null) {
            return openFrame(hash);
        }
        try {
            return openFrame(hash);
        } catch (PoolException e) {
            onFailure.accept(hash, e);
            return null;
        }
    }

    private Frame openFrame(String hash) {
        CanonicalFunction object = storage.loadObject(hash);
        return new Frame(hash, object, denormalizer.dependencies(object.getNormalizedCode()));
    }

    private ResolvedUnit link(Frame frame, List<String> languages, Resolution resolution,
                              BindingEnvironment environment) {
        String hash = frame.hash;
        SelectedMapping selected = selectMapping(hash, languages);
        LocalizationMapping mapping = selected.getMapping();
        String displaySource = denormalizer.denormalize(frame.object.getNormalizedCode(), mapping.getNameMapping(),
                mapping.getAliasMapping(), mapping.getDocstring());

        for (String dependency : frame.dependencies) {
            String alias = mapping.getAliasMapping().get(dependency);
            if (alias != null) {
                boolean deferred = resolution.stateOf(dependency) == Resolution.State.LOADING;
                if (deferred) {
                    log.debug("Deferring binding of {} in {} (cycle)", alias, hash);
                }
                environment.bind(hash, alias, dependency, deferred);
            }
        }

        Set<String> references = new LinkedHashSet<>(frame.dependencies);
        FunctionMetadata metadata = frame.object.getMetadata();
        if (metadata != null && metadata.getChecks() != null) {
            references.addAll(metadata.getChecks());
        }
        return ResolvedUnit.builder()
                .hash(hash)
                .language(selected.getLanguage())
                .functionName(mapping.getNameMapping().get(Identifiers.ENTRY_SLOT))
                .displaySource(displaySource)
                .source(denormalizer.stripPoolImports(displaySource))
                .references(List.copyOf(references))
                .build();
    }

    private static class Frame {
        private final String hash;
        private final CanonicalFunction object;
        private final List<String> dependencies;
        private int next;

        Frame(String hash, CanonicalFunction object, List<String> dependencies) {
            this.hash = hash;
            this.object = object;
            this.dependencies = dependencies;
        }
    }
}
