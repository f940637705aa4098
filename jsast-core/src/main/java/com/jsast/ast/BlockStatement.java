package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Statement of form: {@code { [body] }}
 */
public final class BlockStatement extends Statement {

    private NodeList<Statement> body;

    public BlockStatement(List<Statement> body) {
        this.body = adoptAll(body);
    }

    public NodeList<Statement> body() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = replaceAll(this.body, body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        body.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitBlock(this, arg);
    }
}
