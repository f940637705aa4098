package com.jsast.tree;

import com.jsast.ast.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Whole-tree operations built on {@link Node#forEach}. All of them keep an explicit work stack
 * instead of recursing, so tree depth is bounded by heap, not by the call stack.
 */
public final class Trees {

    private Trees() {
        // Utility class
    }

    /**
     * Calls {@code action} on {@code root} and every node below it, in pre-order: a node before
     * its children, children in source order.
     */
    public static void walk(Node root, Consumer<? super Node> action) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        List<Node> children = new ArrayList<>();
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            action.accept(node);
            children.clear();
            node.forEach(children::add);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * All nodes of the given type at or below {@code root}, in pre-order.
     */
    public static <N extends Node> List<N> collect(Node root, Class<N> type) {
        List<N> found = new ArrayList<>();
        walk(root, node -> {
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
        });
        return found;
    }

    /**
     * Points the parent link of every node below {@code root} at the node that lists it as a
     * child. The parent of {@code root} itself is left alone.
     */
    public static void fixParents(Node root) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            node.forEach(child -> {
                child.setParent(node);
                stack.push(child);
            });
        }
    }

    /**
     * Every child below {@code root} whose parent link disagrees with the tree structure.
     * Empty when the tree is consistent.
     */
    public static List<ParentMismatch> checkParents(Node root) {
        List<ParentMismatch> mismatches = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            node.forEach(child -> {
                if (child.parent() != node) {
                    mismatches.add(new ParentMismatch(child, node, child.parent()));
                }
                stack.push(child);
            });
        }
        return mismatches;
    }

    /**
     * Throws if {@link #checkParents} finds any mismatch.
     *
     * @throws IllegalStateException naming the first mismatch and the total count
     */
    public static void requireConsistent(Node root) {
        List<ParentMismatch> mismatches = checkParents(root);
        if (!mismatches.isEmpty()) {
            throw new IllegalStateException("Inconsistent parent links (" + mismatches.size() + "): "
                + mismatches.get(0));
        }
    }
}
