package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code if ([condition]) [then] else [otherwise]}
 */
public final class IfStatement extends Statement {

    private Expression condition;
    private Statement then;
    private Statement otherwise;  // Can be null

    public IfStatement(Expression condition, Statement then) {
        this(condition, then, null);
    }

    public IfStatement(Expression condition, Statement then, Statement otherwise) {
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.then = adopt(Objects.requireNonNull(then, "then"));
        this.otherwise = adopt(otherwise);
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = replace(this.condition, Objects.requireNonNull(condition, "condition"));
    }

    public Statement then() {
        return then;
    }

    public void setThen(Statement then) {
        this.then = replace(this.then, Objects.requireNonNull(then, "then"));
    }

    public Statement otherwise() {
        return otherwise;
    }

    public void setOtherwise(Statement otherwise) {
        this.otherwise = replace(this.otherwise, otherwise);
    }

    @Override
    public String type() {
        return "IfStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(condition);
        callback.accept(then);
        if (otherwise != null) {
            callback.accept(otherwise);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitIf(this, arg);
    }
}
