package com.jsast.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [callee](..[arguments]..)} or {@code new [callee](..[arguments]..)}.
 */
public final class CallExpression extends Expression {

    private boolean isNew;
    private Expression callee;
    private NodeList<Expression> arguments;

    public CallExpression(Expression callee, List<Expression> arguments) {
        this(callee, arguments, false);
    }

    public CallExpression(Expression callee, List<Expression> arguments, boolean isNew) {
        this.isNew = isNew;
        this.callee = adopt(Objects.requireNonNull(callee, "callee"));
        this.arguments = adoptAll(arguments);
    }

    public static CallExpression newCall(Expression callee, List<Expression> arguments) {
        return new CallExpression(callee, arguments, true);
    }

    /** True for a constructor invocation, {@code new [callee](...)}. */
    public boolean isNew() {
        return isNew;
    }

    public void setNew(boolean isNew) {
        this.isNew = isNew;
    }

    public Expression callee() {
        return callee;
    }

    public void setCallee(Expression callee) {
        this.callee = replace(this.callee, Objects.requireNonNull(callee, "callee"));
    }

    public NodeList<Expression> arguments() {
        return arguments;
    }

    public void setArguments(List<Expression> arguments) {
        this.arguments = replaceAll(this.arguments, arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(callee);
        arguments.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitCall(this, arg);
    }
}
