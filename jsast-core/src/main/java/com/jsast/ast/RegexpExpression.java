package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A regular expression literal.
 */
public final class RegexpExpression extends Expression {

    private String regexp;

    public RegexpExpression(String regexp) {
        this.regexp = Objects.requireNonNull(regexp, "regexp");
    }

    /** The entire literal, including slashes and flags. */
    public String regexp() {
        return regexp;
    }

    public void setRegexp(String regexp) {
        this.regexp = Objects.requireNonNull(regexp, "regexp");
    }

    @Override
    public String type() {
        return "RegexpExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitRegexp(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitRegexp(this, arg);
    }
}
