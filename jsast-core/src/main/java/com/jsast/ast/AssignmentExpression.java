package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [left] = [right]} or {@code [left] += [right]}, or using any of the
 * assignment operators: {@code =, +=, -=, *=, /=, %=, <<=, >>=, >>>=, |=, ^=, &=}
 */
public final class AssignmentExpression extends Expression {

    private Expression left;
    private String operator;
    private Expression right;

    public AssignmentExpression(Expression left, String operator, Expression right) {
        this.left = adopt(Objects.requireNonNull(left, "left"));
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = adopt(Objects.requireNonNull(right, "right"));
    }

    public Expression left() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = replace(this.left, Objects.requireNonNull(left, "left"));
    }

    public String operator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Expression right() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = replace(this.right, Objects.requireNonNull(right, "right"));
    }

    /** True for every operator other than plain {@code =}. */
    public boolean isCompound() {
        return operator.length() > 1;
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(left);
        callback.accept(right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitAssignment(this, arg);
    }
}
