package com.jsast.ast;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * A child list owned by a node. Elements added or set through the list become children of the
 * owner; removed elements are orphaned if they still point at the owner. Adding a node that
 * another parent still lists does not remove it there, so moves should remove first.
 *
 * <p>Only the list in {@link ArrayExpression} accepts null elements, which stand for elided
 * array entries.</p>
 *
 * @param <N> element type
 */
public final class NodeList<N extends Node> extends AbstractList<N> implements RandomAccess {

    private final Node owner;
    private final boolean allowHoles;
    private final ArrayList<N> elements;

    NodeList(Node owner, List<? extends N> initial, boolean allowHoles) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.allowHoles = allowHoles;
        this.elements = new ArrayList<>(initial.size());
        for (N element : initial) {
            add(element);
        }
    }

    /** The node whose children these are. */
    public Node owner() {
        return owner;
    }

    @Override
    public N get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public N set(int index, N element) {
        check(element);
        N old = elements.set(index, element);
        release(old);
        if (element != null) {
            element.setParent(owner);
        }
        return old;
    }

    @Override
    public void add(int index, N element) {
        check(element);
        elements.add(index, element);
        modCount++;
        if (element != null) {
            element.setParent(owner);
        }
    }

    @Override
    public N remove(int index) {
        N old = elements.remove(index);
        modCount++;
        release(old);
        return old;
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        for (int i = fromIndex; i < toIndex; i++) {
            release(elements.get(i));
        }
        elements.subList(fromIndex, toIndex).clear();
        modCount++;
    }

    /**
     * Orphans every element that still points at the owner. The list itself is left intact;
     * used when a node swaps in a whole new list.
     */
    void releaseAll() {
        for (N element : elements) {
            release(element);
        }
    }

    private void check(N element) {
        if (element == null && !allowHoles) {
            throw new NullPointerException("null element in " + owner.type() + " child list");
        }
    }

    private void release(N element) {
        if (element != null && element.parent() == owner) {
            element.setParent(null);
        }
    }
}
