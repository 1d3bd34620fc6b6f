package faxc.codegen;

import faxc.diag.CodegenException;

/** Append-only output buffer with an indentation depth. */
public final class SourceWriter {
    private final StringBuilder out = new StringBuilder();
    private final String unit;
    private int depth = 0;

    public SourceWriter(int indentWidth) {
        this.unit = " ".repeat(indentWidth);
    }

    public int depth() { return depth; }

    public void push() { depth++; }

    public void pop() {
        if (depth == 0) throw CodegenException.internal("Indentation underflow");
        depth--;
    }

    public SourceWriter indent() {
        out.append(unit.repeat(depth));
        return this;
    }

    public SourceWriter append(String s) {
        out.append(s);
        return this;
    }

    public SourceWriter append(char c) {
        out.append(c);
        return this;
    }

    public SourceWriter newline() {
        out.append('\n');
        return this;
    }

    public SourceWriter line(String s) {
        return indent().append(s).newline();
    }

    @Override
    public String toString() { return out.toString(); }
}
