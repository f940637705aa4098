package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * The root of one compilation unit, and its top-level scope.
 */
public final class Program extends Scope {

    private String filename;
    private NodeList<Statement> body;

    public Program(List<Statement> body) {
        this(null, body);
    }

    public Program(String filename, List<Statement> body) {
        this.filename = filename;
        this.body = adoptAll(body);
    }

    /**
     * Where the program was parsed from. Any string the parser was given; used for diagnostics only.
     */
    @Override
    public String filename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public NodeList<Statement> body() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = replaceAll(this.body, body);
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        body.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitProgram(this, arg);
    }
}
