package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code +[argument]}, or using any of the unary operators:
 * {@code +, -, !, ~, typeof, void, delete}
 */
public final class UnaryExpression extends Expression {

    private String operator;
    private Expression argument;

    public UnaryExpression(String operator, Expression argument) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.argument = adopt(Objects.requireNonNull(argument, "argument"));
    }

    public String operator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Expression argument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = replace(this.argument, Objects.requireNonNull(argument, "argument"));
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(argument);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitUnary(this, arg);
    }
}
