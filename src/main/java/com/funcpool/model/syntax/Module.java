package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed source file.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class Module extends Node {
    private List<Stmt> body = new ArrayList<>();

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitModule(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(body);
    }
}
