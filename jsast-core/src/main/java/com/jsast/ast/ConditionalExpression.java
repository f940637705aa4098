package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [condition] ? [then] : [otherwise]}
 */
public final class ConditionalExpression extends Expression {

    private Expression condition;
    private Expression then;
    private Expression otherwise;

    public ConditionalExpression(Expression condition, Expression then, Expression otherwise) {
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.then = adopt(Objects.requireNonNull(then, "then"));
        this.otherwise = adopt(Objects.requireNonNull(otherwise, "otherwise"));
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = replace(this.condition, Objects.requireNonNull(condition, "condition"));
    }

    public Expression then() {
        return then;
    }

    public void setThen(Expression then) {
        this.then = replace(this.then, Objects.requireNonNull(then, "then"));
    }

    public Expression otherwise() {
        return otherwise;
    }

    public void setOtherwise(Expression otherwise) {
        this.otherwise = replace(this.otherwise, Objects.requireNonNull(otherwise, "otherwise"));
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(condition);
        callback.accept(then);
        callback.accept(otherwise);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitConditional(this, arg);
    }
}
