package com.jsast.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Base class for all AST nodes.
 *
 * <p>Nodes are mutable. The parent link is a plain back-reference: constructors and child
 * setters keep it in step with the child slots, but code that calls {@link #setParent}
 * directly is responsible for keeping the tree consistent.</p>
 *
 * <p>Adopting a node does not remove it from its previous parent. To move a subtree, detach it
 * from the old slot or list first; otherwise the old parent still lists it and
 * {@link com.jsast.tree.Trees#checkParents} reports the mismatch.</p>
 */
public abstract sealed class Node permits
    Programs,
    Scope,
    Name,
    Statement,
    Expression,
    SwitchCase,
    VariableDeclarator,
    Property {

    /** Marker for an unknown source offset or line. */
    public static final int NO_POSITION = -1;

    private Node parent;
    private int start = NO_POSITION;
    private int end = NO_POSITION;
    private int line = NO_POSITION;

    /**
     * The parent of this node, or null for a {@link Program} root or an orphan.
     */
    public Node parent() {
        return parent;
    }

    public void setParent(Node parent) {
        this.parent = parent;
    }

    /** Source offset of the first character, or {@link #NO_POSITION}. */
    public int start() {
        return start;
    }

    /** Source offset just past the last character, or {@link #NO_POSITION}. */
    public int end() {
        return end;
    }

    /** 1-based line number, or {@link #NO_POSITION}. */
    public int line() {
        return line;
    }

    public void setSpan(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public void setLine(int line) {
        this.line = line;
    }

    public boolean hasSpan() {
        return start != NO_POSITION && end != NO_POSITION;
    }

    public boolean hasLine() {
        return line != NO_POSITION;
    }

    /**
     * Name of the node variant, e.g. {@code "IfStatement"}.
     */
    public abstract String type();

    /**
     * Calls {@code callback} once for each immediate child, in source order.
     * Absent optional children are skipped.
     */
    public abstract void forEach(Consumer<? super Node> callback);

    /**
     * Calls the {@code visit} method of {@code visitor} that matches this node's variant.
     */
    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * Calls the {@code visit} method of {@code visitor} that matches this node's variant,
     * passing {@code arg} along.
     */
    public abstract <T, A> T accept(Visitor1<T, A> visitor, A arg);

    /**
     * The immediate children as a new list, in {@link #forEach} order.
     */
    public List<Node> children() {
        List<Node> children = new ArrayList<>();
        forEach(children::add);
        return children;
    }

    /**
     * Returns the {@link Program} enclosing this node, possibly the node itself,
     * or null if the node is not inside a program.
     */
    public Program enclosingProgram() {
        for (Node node = this; node != null; node = node.parent) {
            if (node instanceof Program program) {
                return program;
            }
        }
        return null;
    }

    /**
     * Returns the {@link FunctionNode} enclosing this node, possibly the node itself,
     * or null if the node is not inside a function.
     */
    public FunctionNode enclosingFunction() {
        for (Node node = this; node != null; node = node.parent) {
            if (node instanceof FunctionNode function) {
                return function;
            }
        }
        return null;
    }

    /**
     * Returns the nearest {@link Scope} of any kind, possibly the node itself, or null.
     */
    public Scope enclosingScope() {
        for (Node node = this; node != null; node = node.parent) {
            if (node instanceof Scope scope) {
                return scope;
            }
        }
        return null;
    }

    /**
     * Filename of the enclosing program, or null if the node is orphaned.
     */
    public String filename() {
        Program program = enclosingProgram();
        return program != null ? program.filename() : null;
    }

    /**
     * {@code "filename:line"} for diagnostics, or null if the node is orphaned.
     */
    public String location() {
        Program program = enclosingProgram();
        if (program == null) {
            return null;
        }
        return program.filename() + ":" + (hasLine() ? String.valueOf(line) : "?");
    }

    @Override
    public String toString() {
        return type();
    }

    /**
     * Makes this node the parent of {@code child} and returns it. Null is passed through.
     * A previous parent keeps its reference to {@code child}.
     */
    protected final <N extends Node> N adopt(N child) {
        if (child != null) {
            child.setParent(this);
        }
        return child;
    }

    /**
     * Replaces a child slot: the old child is orphaned if it still points here,
     * and the new one is adopted.
     */
    protected final <N extends Node> N replace(Node oldChild, N newChild) {
        if (oldChild != null && oldChild != newChild && oldChild.parent == this) {
            oldChild.setParent(null);
        }
        return adopt(newChild);
    }

    /**
     * Wraps {@code elements} in a list owned by this node.
     */
    protected final <N extends Node> NodeList<N> adoptAll(List<? extends N> elements) {
        return new NodeList<>(this, elements, false);
    }

    /**
     * Swaps a child list: elements of the old list are orphaned, the new ones adopted.
     */
    protected final <N extends Node> NodeList<N> replaceAll(NodeList<N> oldList, List<? extends N> elements) {
        oldList.releaseAll();
        return adoptAll(elements);
    }
}
