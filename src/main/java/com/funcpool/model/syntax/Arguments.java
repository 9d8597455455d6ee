package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameter list of a function or lambda.
 *
 * {@code defaults} align with the tail of {@code posonlyargs + args}; {@code kwDefaults} has one
 * entry per keyword-only parameter, null where there is no default.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class Arguments extends Node {
    private List<Arg> posonlyargs = new ArrayList<>();
    private List<Arg> args = new ArrayList<>();
    private Arg vararg;
    private List<Arg> kwonlyargs = new ArrayList<>();
    private List<Expr> kwDefaults = new ArrayList<>();
    private Arg kwarg;
    private List<Expr> defaults = new ArrayList<>();

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArguments(this);
    }

    @Override
    public List<Node> children() {
        return childrenOf(posonlyargs, args, vararg, kwonlyargs, kwDefaults, kwarg, defaults);
    }
}
