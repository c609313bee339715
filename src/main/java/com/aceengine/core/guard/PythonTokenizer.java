package com.aceengine.core.guard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * PythonTokenizer — lossless tokenizer for Python 3 source.
 *
 * Every character of the input belongs to exactly one token, so concatenating
 * {@link PythonToken#getText()} over the result reproduces the source byte for byte.
 * Layout is preserved as WHITESPACE, COMMENT, NL and CONTINUATION tokens; block
 * structure is reported with zero-width INDENT/DEDENT tokens the way CPython's
 * tokenizer does.
 *
 * Rejected input (raises {@link PythonSyntaxException}):
 *   - unterminated single- or triple-quoted strings
 *   - unmatched, mismatched or unclosed brackets
 *   - a dedent to a column that matches no enclosing block
 *   - characters that cannot start any token ($, ?, backtick, stray !)
 *   - anything other than a line break after a line-continuation backslash
 *
 * Tabs advance indentation to the next multiple of 8, as in CPython.
 */
public final class PythonTokenizer {

    private static final int TAB_SIZE = 8;

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf"
    );

    private static final String[] THREE_CHAR_OPS = {
            "**=", "//=", ">>=", "<<=", "..."
    };

    private static final String[] TWO_CHAR_OPS = {
            "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@="
    };

    private static final String ONE_CHAR_OPS = "+-*/%@&|^~<>()[]{},:;.=";

    private final String source;
    private final int    length;

    private final List<PythonToken> tokens      = new ArrayList<>();
    private final List<Integer>     indents     = new ArrayList<>();
    private final Deque<PythonToken> brackets   = new ArrayDeque<>();

    private int     pos         = 0;
    private int     line        = 1;
    private boolean atLineStart = true;
    private boolean lineHasCode = false;

    private PythonTokenizer(String source) {
        this.source = source;
        this.length = source.length();
        this.indents.add(0);
    }

    public static List<PythonToken> tokenize(String source) throws PythonSyntaxException {
        return new PythonTokenizer(source).run();
    }

    // ================================================================
    // Main loop
    // ================================================================

    private List<PythonToken> run() throws PythonSyntaxException {
        if (length > 0 && source.charAt(0) == '\uFEFF') {
            emit(PythonTokenType.WHITESPACE, 1);
        }

        while (pos < length) {
            if (atLineStart && brackets.isEmpty()) {
                readIndentation();
                continue;
            }

            char c = source.charAt(pos);

            if (c == '\n' || c == '\r') {
                readLineBreak();
            } else if (c == ' ' || c == '\t' || c == '\f') {
                emit(PythonTokenType.WHITESPACE, spanWhile(pos, " \t\f"));
            } else if (c == '#') {
                emit(PythonTokenType.COMMENT, commentLength());
            } else if (c == '\\') {
                readContinuation();
            } else if (c == '"' || c == '\'') {
                readString(pos);
            } else if (isDigit(c) || (c == '.' && pos + 1 < length && isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (isIdentifierStart(c)) {
                readNameOrPrefixedString();
            } else {
                readOperator(c);
            }
        }

        return finish();
    }

    private List<PythonToken> finish() throws PythonSyntaxException {
        if (!brackets.isEmpty()) {
            PythonToken open = brackets.peek();
            throw new PythonSyntaxException("'" + open.getText() + "' was never closed", open.getLine());
        }
        if (lineHasCode) {
            zeroWidth(PythonTokenType.NEWLINE);
            lineHasCode = false;
        }
        while (indents.size() > 1) {
            indents.remove(indents.size() - 1);
            zeroWidth(PythonTokenType.DEDENT);
        }
        zeroWidth(PythonTokenType.ENDMARKER);
        return tokens;
    }

    // ================================================================
    // Layout
    // ================================================================

    private void readIndentation() throws PythonSyntaxException {
        int start  = pos;
        int column = 0;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ')       column++;
            else if (c == '\t') column = (column / TAB_SIZE + 1) * TAB_SIZE;
            else if (c == '\f') column = 0;
            else break;
            pos++;
        }
        if (pos > start) {
            tokens.add(new PythonToken(PythonTokenType.WHITESPACE, source.substring(start, pos), line, start));
        }
        atLineStart = false;

        // Blank and comment-only lines do not take part in block structure.
        if (pos >= length) return;
        char next = source.charAt(pos);
        if (next == '#' || next == '\n' || next == '\r') return;

        int current = indents.get(indents.size() - 1);
        if (column > current) {
            indents.add(column);
            zeroWidth(PythonTokenType.INDENT);
        } else if (column < current) {
            while (indents.get(indents.size() - 1) > column) {
                indents.remove(indents.size() - 1);
                zeroWidth(PythonTokenType.DEDENT);
            }
            if (indents.get(indents.size() - 1) != column) {
                throw new PythonSyntaxException(
                        "unindent does not match any outer indentation level", line);
            }
        }
    }

    private void readLineBreak() {
        int len = lineBreakLength(pos);
        boolean logicalEnd = brackets.isEmpty() && lineHasCode;
        emit(logicalEnd ? PythonTokenType.NEWLINE : PythonTokenType.NL, len);
        if (logicalEnd) {
            lineHasCode = false;
        }
        line++;
        atLineStart = brackets.isEmpty();
    }

    private void readContinuation() throws PythonSyntaxException {
        int after = pos + 1;
        if (after >= length) {
            throw new PythonSyntaxException("unexpected EOF while parsing", line);
        }
        char c = source.charAt(after);
        if (c != '\n' && c != '\r') {
            throw new PythonSyntaxException("unexpected character after line continuation character", line);
        }
        emit(PythonTokenType.CONTINUATION, 1 + lineBreakLength(after));
        line++;
    }

    private int commentLength() {
        int end = pos;
        while (end < length && source.charAt(end) != '\n' && source.charAt(end) != '\r') end++;
        return end - pos;
    }

    // ================================================================
    // Names, strings, numbers, operators
    // ================================================================

    private void readNameOrPrefixedString() throws PythonSyntaxException {
        int end = pos + 1;
        while (end < length && isIdentifierPart(source.charAt(end))) end++;

        String word = source.substring(pos, end);
        if (end < length
                && (source.charAt(end) == '"' || source.charAt(end) == '\'')
                && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            readString(end);
            return;
        }
        emit(PythonTokenType.NAME, end - pos);
        lineHasCode = true;
    }

    /**
     * Reads a string literal whose optional prefix starts at {@code pos} and whose
     * opening quote is at {@code quoteAt}.
     */
    private void readString(int quoteAt) throws PythonSyntaxException {
        char    quote     = source.charAt(quoteAt);
        boolean triple    = source.startsWith(String.valueOf(quote).repeat(3), quoteAt);
        int     startLine = line;
        int     i         = quoteAt + (triple ? 3 : 1);
        int     breaks    = 0;

        while (true) {
            if (i >= length) {
                throw new PythonSyntaxException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine);
            }
            char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 < length && (source.charAt(i + 1) == '\n' || source.charAt(i + 1) == '\r')) {
                    breaks++;
                    i += 1 + lineBreakLength(i + 1);
                } else {
                    i += 2;
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new PythonSyntaxException("unterminated string literal", startLine);
                }
                breaks++;
                i += lineBreakLength(i);
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    i++;
                    break;
                }
                if (source.startsWith(String.valueOf(quote).repeat(3), i)) {
                    i += 3;
                    break;
                }
            }
            i++;
        }

        emit(PythonTokenType.STRING, i - pos);
        line += breaks;
        lineHasCode = true;
    }

    private void readNumber() throws PythonSyntaxException {
        int i = pos;
        if (source.charAt(i) == '0' && i + 1 < length && "xXoObB".indexOf(source.charAt(i + 1)) >= 0) {
            int radix = radixOf(source.charAt(i + 1));
            i += 2;
            while (i < length && (Character.digit(source.charAt(i), 16) >= 0 || source.charAt(i) == '_')) {
                char d = source.charAt(i);
                if (d != '_' && Character.digit(d, radix) < 0) {
                    throw new PythonSyntaxException("invalid digit '" + d + "' in "
                            + radixName(radix) + " literal", line);
                }
                i++;
            }
        } else {
            i = skipDigits(i);
            boolean integral = true;
            if (i < length && source.charAt(i) == '.') {
                integral = false;
                i = skipDigits(i + 1);
            }
            if (integral && i < length && "eEjJ".indexOf(source.charAt(i)) >= 0) {
                integral = false;
            }
            String digits = source.substring(pos, i).replace("_", "");
            if (integral && digits.length() > 1 && digits.charAt(0) == '0' && !digits.matches("0+")) {
                throw new PythonSyntaxException(
                        "leading zeros in decimal integer literals are not permitted", line);
            }
            if (i < length && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
                int exp = i + 1;
                if (exp < length && (source.charAt(exp) == '+' || source.charAt(exp) == '-')) exp++;
                if (exp < length && isDigit(source.charAt(exp))) {
                    i = skipDigits(exp);
                }
            }
            if (i < length && (source.charAt(i) == 'j' || source.charAt(i) == 'J')) i++;
        }

        if (i < length && isIdentifierPart(source.charAt(i))) {
            throw new PythonSyntaxException("invalid decimal literal", line);
        }
        emit(PythonTokenType.NUMBER, i - pos);
        lineHasCode = true;
    }

    private void readOperator(char c) throws PythonSyntaxException {
        for (String op : THREE_CHAR_OPS) {
            if (source.startsWith(op, pos)) {
                emitOperator(op.length());
                return;
            }
        }
        for (String op : TWO_CHAR_OPS) {
            if (source.startsWith(op, pos)) {
                emitOperator(op.length());
                return;
            }
        }
        if (ONE_CHAR_OPS.indexOf(c) < 0) {
            throw new PythonSyntaxException("invalid character '" + c + "'", line);
        }

        PythonToken token = new PythonToken(PythonTokenType.OP, String.valueOf(c), line, pos);
        if (c == '(' || c == '[' || c == '{') {
            brackets.push(token);
        } else if (c == ')' || c == ']' || c == '}') {
            if (brackets.isEmpty()) {
                throw new PythonSyntaxException("unmatched '" + c + "'", line);
            }
            PythonToken open = brackets.pop();
            if (closerOf(open.getText().charAt(0)) != c) {
                throw new PythonSyntaxException("closing parenthesis '" + c
                        + "' does not match opening parenthesis '" + open.getText() + "'", line);
            }
        }
        tokens.add(token);
        pos++;
        lineHasCode = true;
    }

    private void emitOperator(int len) {
        emit(PythonTokenType.OP, len);
        lineHasCode = true;
    }

    // ================================================================
    // Helpers
    // ================================================================

    private void emit(PythonTokenType type, int len) {
        tokens.add(new PythonToken(type, source.substring(pos, pos + len), line, pos));
        pos += len;
    }

    private void zeroWidth(PythonTokenType type) {
        tokens.add(new PythonToken(type, "", line, pos));
    }

    private int spanWhile(int from, String chars) {
        int end = from;
        while (end < length && chars.indexOf(source.charAt(end)) >= 0) end++;
        return end - from;
    }

    private int skipDigits(int from) {
        int i = from;
        while (i < length && (isDigit(source.charAt(i)) || source.charAt(i) == '_')) i++;
        return i;
    }

    private int lineBreakLength(int at) {
        if (source.charAt(at) == '\r' && at + 1 < length && source.charAt(at + 1) == '\n') {
            return 2;
        }
        return 1;
    }

    private static int radixOf(char marker) {
        return switch (Character.toLowerCase(marker)) {
            case 'x' -> 16;
            case 'o' -> 8;
            default  -> 2;
        };
    }

    private static String radixName(int radix) {
        return switch (radix) {
            case 16 -> "hexadecimal";
            case 8  -> "octal";
            default -> "binary";
        };
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default  -> '}';
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }
}
