package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One {@code name [as asname]} entry of an import statement.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class ImportName extends Node {
    private String name;
    private String asname;

    /**
     * The local name this entry binds: the alias, or the first component of a dotted module.
     */
    public String boundName() {
        if (asname != null) {
            return asname;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitImportName(this);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
