package com.funcpool.model.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Traversal helpers for syntax trees.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    /**
     * All nodes of the tree rooted at {@code root} in breadth-first order, root first, children in
     * source field order.
     */
    public static List<Node> breadthFirst(Node root) {
        List<Node> order = new ArrayList<>();
        Deque<Node> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            order.add(node);
            queue.addAll(node.children());
        }
        return order;
    }

    /**
     * If the first statement of {@code body} is a bare string literal, returns it.
     */
    public static Expr.Constant docstringOf(List<Stmt> body) {
        if (body.isEmpty()) {
            return null;
        }
        if (body.get(0) instanceof Stmt.ExprStmt expr
                && expr.getValue() instanceof Expr.Constant constant
                && constant.isString()) {
            return constant;
        }
        return null;
    }
}
