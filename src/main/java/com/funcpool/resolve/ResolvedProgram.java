package com.funcpool.resolve;

import lombok.Value;

import java.util.List;

/**
 * Units in load order, dependencies first and the entry function last.
 */
@Value
public class ResolvedProgram {
    List<ResolvedUnit> units;
    BindingEnvironment environment;
    String entryHash;

    public ResolvedUnit entry() {
        return units.get(units.size() - 1);
    }

    public String getEntryName() {
        return entry().getFunctionName();
    }
}
