package com.funcpool.model.syntax;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Base class for all Python syntax tree nodes.
 *
 * Source positions are not part of node equality; only statements and except handlers keep the
 * line they started on, for error reporting.
 */
public abstract class Node {

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Direct child nodes in source field order. Absent optional children are skipped.
     */
    public abstract List<Node> children();

    protected static List<Node> childrenOf(Object... parts) {
        List<Node> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                children.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object item : collection) {
                    if (item instanceof Node node) {
                        children.add(node);
                    }
                }
            }
        }
        return children;
    }
}
