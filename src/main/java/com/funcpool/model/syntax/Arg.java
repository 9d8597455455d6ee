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
public class Arg extends Node {
    private String name;
    private Expr annotation;

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArg(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(annotation);
    }
}
