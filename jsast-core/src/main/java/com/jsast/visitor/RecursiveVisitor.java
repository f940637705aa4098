package com.jsast.visitor;

import com.jsast.ast.Node;

/**
 * Visits every node of a tree. Overriding methods should call {@code super} (or
 * {@link #visitChildren}) to keep descending.
 *
 * <p>Recursion depth follows tree depth; use {@link com.jsast.tree.Trees#walk} for trees that
 * may be nested deeply enough to overflow the stack.</p>
 *
 * @param <T> result type, ignored by the default traversal
 */
public class RecursiveVisitor<T> extends BaseVisitor<T> {

    @Override
    protected T defaultNode(Node node) {
        visitChildren(node);
        return null;
    }

    protected void visitChildren(Node node) {
        node.forEach(this::visit);
    }
}
