package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code while ([condition]) [body]}
 */
public final class WhileStatement extends Statement {

    private Expression condition;
    private Statement body;

    public WhileStatement(Expression condition, Statement body) {
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = replace(this.condition, Objects.requireNonNull(condition, "condition"));
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    @Override
    public String type() {
        return "WhileStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(condition);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitWhile(this, arg);
    }
}
