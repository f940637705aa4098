package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code [expression];}
 */
public final class ExpressionStatement extends Statement {

    private Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = adopt(Objects.requireNonNull(expression, "expression"));
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = replace(this.expression, Objects.requireNonNull(expression, "expression"));
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(expression);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitExpressionStatement(this, arg);
    }
}
