package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Mention of a variable, property, or label. What it is depends on the parent node.
 */
public final class Name extends Node {

    private String value;
    private Scope scope;

    public Name(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * The identifier text, with unicode escapes already resolved.
     */
    public String value() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * The scope declaring this variable, or null if no resolver has assigned one
     * (or this is not a variable).
     */
    public Scope scope() {
        return scope;
    }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    /**
     * The declaring scope, falling back to the enclosing {@link Program} for undeclared
     * names, which are implicit globals. Null for an orphan with no assigned scope.
     */
    public Scope scopeOrGlobal() {
        return scope != null ? scope : enclosingProgram();
    }

    /** True if this refers to a variable name. */
    public boolean isVariable() {
        Node parent = parent();
        return parent instanceof NameExpression
            || parent instanceof FunctionNode
            || parent instanceof ArrowFunctionNode
            || parent instanceof VariableDeclarator
            || parent instanceof CatchClause;
    }

    /** True if this refers to a property name. */
    public boolean isProperty() {
        Node parent = parent();
        return (parent instanceof MemberExpression member && member.property() == this)
            || (parent instanceof Property property && property.key() == this);
    }

    /** True if this refers to a label name. */
    public boolean isLabel() {
        Node parent = parent();
        return parent instanceof BreakStatement
            || parent instanceof ContinueStatement
            || parent instanceof LabeledStatement;
    }

    @Override
    public String type() {
        return "Name";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitName(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitName(this, arg);
    }

    @Override
    public String toString() {
        return value;
    }
}
