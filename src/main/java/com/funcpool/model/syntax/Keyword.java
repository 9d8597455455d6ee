package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Keyword argument of a call or class definition; a null {@code arg} is {@code **value}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class Keyword extends Node {
    private String arg;
    private Expr value;

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitKeyword(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(value);
    }
}
