package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code try [block] catch [handler] finally [finalizer]}.
 * At least one of handler and finalizer is present.
 */
public final class TryStatement extends Statement {

    private BlockStatement block;
    private CatchClause handler;      // Can be null
    private BlockStatement finalizer; // Can be null, but not together with handler

    public TryStatement(BlockStatement block, CatchClause handler, BlockStatement finalizer) {
        requireHandlerOrFinalizer(handler, finalizer);
        this.block = adopt(Objects.requireNonNull(block, "block"));
        this.handler = adopt(handler);
        this.finalizer = adopt(finalizer);
    }

    public BlockStatement block() {
        return block;
    }

    public void setBlock(BlockStatement block) {
        this.block = replace(this.block, Objects.requireNonNull(block, "block"));
    }

    public CatchClause handler() {
        return handler;
    }

    public void setHandler(CatchClause handler) {
        requireHandlerOrFinalizer(handler, finalizer);
        this.handler = replace(this.handler, handler);
    }

    public BlockStatement finalizer() {
        return finalizer;
    }

    public void setFinalizer(BlockStatement finalizer) {
        requireHandlerOrFinalizer(handler, finalizer);
        this.finalizer = replace(this.finalizer, finalizer);
    }

    private static void requireHandlerOrFinalizer(CatchClause handler, BlockStatement finalizer) {
        if (handler == null && finalizer == null) {
            throw new IllegalArgumentException("try statement needs a catch clause or a finally block");
        }
    }

    @Override
    public String type() {
        return "TryStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(block);
        if (handler != null) {
            callback.accept(handler);
        }
        if (finalizer != null) {
            callback.accept(finalizer);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitTry(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitTry(this, arg);
    }
}
