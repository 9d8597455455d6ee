package com.funcpool.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alias bindings of every unit in one resolution. A fresh environment is created per request.
 */
public class BindingEnvironment {

    private final Map<String, List<AliasBinding>> bindings = new LinkedHashMap<>();

    public void bind(String unitHash, String alias, String target, boolean deferred) {
        List<AliasBinding> unitBindings = bindings.computeIfAbsent(unitHash, key -> new ArrayList<>());
        for (AliasBinding existing : unitBindings) {
            if (existing.getAlias().equals(alias) && !existing.getTarget().equals(target)) {
                throw new IllegalStateException("Alias " + alias + " of " + unitHash + " is bound to both "
                        + existing.getTarget() + " and " + target);
            }
        }
        unitBindings.add(new AliasBinding(alias, target, deferred));
    }

    public List<AliasBinding> bindingsOf(String unitHash) {
        return Collections.unmodifiableList(bindings.getOrDefault(unitHash, List.of()));
    }

    public boolean hasDeferredBindings() {
        return bindings.values().stream().flatMap(List::stream).anyMatch(AliasBinding::isDeferred);
    }
}
