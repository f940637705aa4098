package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [left] + [right]}, or using any of the binary operators:
 * {@code ==, !=, ===, !==, <, <=, >, >=, <<, >>, >>>, +, -, *, /, %, |, ^, &, &&, ||, in, instanceof}
 */
public final class BinaryExpression extends Expression {

    private Expression left;
    private String operator;
    private Expression right;

    public BinaryExpression(Expression left, String operator, Expression right) {
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

    @Override
    public String toString() {
        return "BinaryExpression(\"" + left + "\" " + operator + " \"" + right + "\")";
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(left);
        callback.accept(right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitBinary(this, arg);
    }
}
