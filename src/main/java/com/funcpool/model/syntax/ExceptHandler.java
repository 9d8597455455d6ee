package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class ExceptHandler extends Node {
    private Expr type;
    private String name;
    private List<Stmt> body = new ArrayList<>();

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExceptHandler(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(type, body);
    }
}
