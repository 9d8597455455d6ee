package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code for target in iter if cond...} clause of a comprehension.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class ComprehensionClause extends Node {
    private Expr target;
    private Expr iter;
    private List<Expr> ifs = new ArrayList<>();
    private boolean async;

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComprehensionClause(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(target, iter, ifs);
    }
}
