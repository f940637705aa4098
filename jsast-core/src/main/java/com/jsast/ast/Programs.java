package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * A collection of {@link Program} nodes.
 *
 * <p>Never produced by a parser; a way to hold several compilation units in one tree.
 * The programs keep their own filenames and are otherwise unrelated.</p>
 */
public final class Programs extends Node {

    private NodeList<Program> programs;

    public Programs(List<Program> programs) {
        this.programs = adoptAll(programs);
    }

    public NodeList<Program> programs() {
        return programs;
    }

    public void setPrograms(List<Program> programs) {
        this.programs = replaceAll(this.programs, programs);
    }

    @Override
    public String type() {
        return "Programs";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        programs.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitPrograms(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitPrograms(this, arg);
    }
}
