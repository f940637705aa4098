package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Comma-separated expressions. The value is that of the last one.
 */
public final class SequenceExpression extends Expression {

    private NodeList<Expression> expressions;

    public SequenceExpression(List<Expression> expressions) {
        this.expressions = adoptAll(expressions);
    }

    public NodeList<Expression> expressions() {
        return expressions;
    }

    public void setExpressions(List<Expression> expressions) {
        this.expressions = replaceAll(this.expressions, expressions);
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        expressions.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSequence(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitSequence(this, arg);
    }
}
