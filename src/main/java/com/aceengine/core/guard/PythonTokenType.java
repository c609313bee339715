package com.aceengine.core.guard;

/**
 * Token kinds produced by {@link PythonTokenizer}.
 *
 * INDENT, DEDENT, ENDMARKER and a NEWLINE synthesized at end of input are zero-width.
 * Every other token carries the exact source text it covers.
 */
public enum PythonTokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    COMMENT,
    /** End of a logical line. */
    NEWLINE,
    /** Line break that does not end a logical line (blank line, comment line, inside brackets). */
    NL,
    WHITESPACE,
    /** Backslash followed by a line break. */
    CONTINUATION,
    INDENT,
    DEDENT,
    ENDMARKER;

    /** Tokens that carry program structure, as opposed to layout trivia. */
    public boolean isSignificant() {
        return switch (this) {
            case NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, ENDMARKER -> true;
            default -> false;
        };
    }
}
