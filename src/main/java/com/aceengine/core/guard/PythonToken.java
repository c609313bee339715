package com.aceengine.core.guard;

import java.util.Objects;

/**
 * One token of Python source. Immutable.
 */
public final class PythonToken {

    private final PythonTokenType type;
    private final String          text;
    private final int             line;
    private final int             offset;

    public PythonToken(PythonTokenType type, String text, int line, int offset) {
        this.type   = type;
        this.text   = text;
        this.line   = line;
        this.offset = offset;
    }

    public PythonTokenType getType()   { return type; }
    public String          getText()   { return text; }
    public int             getLine()   { return line; }
    public int             getOffset() { return offset; }

    public boolean is(PythonTokenType t, String value) {
        return type == t && text.equals(value);
    }

    public boolean isOp(String value) {
        return is(PythonTokenType.OP, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PythonToken)) return false;
        PythonToken other = (PythonToken) o;
        return type == other.type && text.equals(other.text) && line == other.line;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, line);
    }

    @Override
    public String toString() {
        return type + "(" + text.replace("\n", "\\n").replace("\r", "\\r") + ")@" + line;
    }
}
