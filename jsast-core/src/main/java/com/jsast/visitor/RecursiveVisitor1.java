package com.jsast.visitor;

import com.jsast.ast.Node;

/**
 * Visits every node of a tree, passing the same argument to each child.
 * Override a method and call {@link #visitChildren} with a different argument to change what
 * the subtree receives.
 *
 * @param <T> result type, ignored by the default traversal
 * @param <A> argument type
 */
public class RecursiveVisitor1<T, A> extends BaseVisitor1<T, A> {

    @Override
    protected T defaultNode(Node node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    protected void visitChildren(Node node, A arg) {
        node.forEach(child -> visit(child, arg));
    }
}
