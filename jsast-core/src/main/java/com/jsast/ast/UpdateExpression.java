package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code ++[argument]}, {@code --[argument]}, {@code [argument]++}, {@code [argument]--}.
 */
public final class UpdateExpression extends Expression {

    private String operator;  // ++ or --
    private Expression argument;
    private boolean prefix;

    public UpdateExpression(String operator, Expression argument, boolean prefix) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.argument = adopt(Objects.requireNonNull(argument, "argument"));
        this.prefix = prefix;
    }

    public static UpdateExpression prefix(String operator, Expression argument) {
        return new UpdateExpression(operator, argument, true);
    }

    public static UpdateExpression postfix(String operator, Expression argument) {
        return new UpdateExpression(operator, argument, false);
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

    public boolean isPrefix() {
        return prefix;
    }

    public void setPrefix(boolean prefix) {
        this.prefix = prefix;
    }

    @Override
    public String type() {
        return "UpdateExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(argument);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitUpdateExpression(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitUpdateExpression(this, arg);
    }
}
