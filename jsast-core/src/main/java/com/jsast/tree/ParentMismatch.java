package com.jsast.tree;

import com.jsast.ast.Node;

/**
 * A child whose parent link does not point at the node that lists it as a child.
 *
 * @param child the child node
 * @param expectedParent the node enumerating {@code child}
 * @param actualParent what {@code child.parent()} returns, possibly null
 */
public record ParentMismatch(Node child, Node expectedParent, Node actualParent) {

    @Override
    public String toString() {
        return child.type() + " under " + expectedParent.type() + " has parent "
            + (actualParent == null ? "null" : actualParent.type());
    }
}
