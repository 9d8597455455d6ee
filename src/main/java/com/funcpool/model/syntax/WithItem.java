package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class WithItem extends Node {
    private Expr contextExpr;
    private Expr optionalVars;

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWithItem(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(contextExpr, optionalVars);
    }
}
