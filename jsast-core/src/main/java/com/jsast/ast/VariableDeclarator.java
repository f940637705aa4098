package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Variable declaration: {@code [name]} or {@code [name] = [init]}.
 */
public final class VariableDeclarator extends Node {

    private Name name;
    private Expression init;  // Can be null

    public VariableDeclarator(Name name) {
        this(name, null);
    }

    public VariableDeclarator(Name name, Expression init) {
        this.name = adopt(Objects.requireNonNull(name, "name"));
        this.init = adopt(init);
    }

    public Name name() {
        return name;
    }

    public void setName(Name name) {
        this.name = replace(this.name, Objects.requireNonNull(name, "name"));
    }

    public Expression init() {
        return init;
    }

    public void setInit(Expression init) {
        this.init = replace(this.init, init);
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(name);
        if (init != null) {
            callback.accept(init);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitVariableDeclarator(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitVariableDeclarator(this, arg);
    }
}
