package com.funcpool.canonical;

import com.funcpool.model.syntax.Arg;
import com.funcpool.model.syntax.ExceptHandler;
import com.funcpool.model.syntax.Expr;
import com.funcpool.model.syntax.Node;
import com.funcpool.model.syntax.NodeRewriter;
import com.funcpool.model.syntax.Stmt;

import java.util.Map;

/**
 * Renames every identifier found in a rename table: names, parameters, nested function and class
 * names, {@code except ... as} names and {@code global}/{@code nonlocal} declarations. Attribute
 * names and keyword argument names are left alone.
 */
public class IdentifierRenamer extends NodeRewriter {

    private final Map<String, String> renames;

    public IdentifierRenamer(Map<String, String> renames) {
        this.renames = renames;
    }

    private String renamed(String name) {
        return name == null ? null : renames.getOrDefault(name, name);
    }

    @Override
    public Node visitName(Expr.Name node) {
        node.setId(renamed(node.getId()));
        return node;
    }

    @Override
    public Node visitArg(Arg node) {
        node.setName(renamed(node.getName()));
        return super.visitArg(node);
    }

    @Override
    public Node visitFunctionDef(Stmt.FunctionDef node) {
        node.setName(renamed(node.getName()));
        return super.visitFunctionDef(node);
    }

    @Override
    public Node visitClassDef(Stmt.ClassDef node) {
        node.setName(renamed(node.getName()));
        return super.visitClassDef(node);
    }

    @Override
    public Node visitExceptHandler(ExceptHandler node) {
        node.setName(renamed(node.getName()));
        return super.visitExceptHandler(node);
    }

    @Override
    public Node visitGlobal(Stmt.Global node) {
        node.getNames().replaceAll(this::renamed);
        return node;
    }

    @Override
    public Node visitNonlocal(Stmt.Nonlocal node) {
        node.getNames().replaceAll(this::renamed);
        return node;
    }
}
