package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [ [expressions] ]}
 *
 * <p>The element list may contain nulls for elided entries, e.g. {@code [1,,3]} has three
 * elements of which the middle one is null. {@link #forEach} skips them.</p>
 */
public final class ArrayExpression extends Expression {

    private NodeList<Expression> expressions;

    public ArrayExpression(List<Expression> expressions) {
        this.expressions = new NodeList<>(this, expressions, true);
    }

    public NodeList<Expression> expressions() {
        return expressions;
    }

    public void setExpressions(List<Expression> expressions) {
        this.expressions.releaseAll();
        this.expressions = new NodeList<>(this, expressions, true);
    }

    /** True if the element at {@code index} is elided. */
    public boolean isHole(int index) {
        return expressions.get(index) == null;
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        for (Expression expression : expressions) {
            if (expression != null) {
                callback.accept(expression);
            }
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitArray(this, arg);
    }
}
