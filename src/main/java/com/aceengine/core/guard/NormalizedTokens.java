package com.aceengine.core.guard;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formatting-independent view of a token stream.
 *
 * Two modules whose normalized streams are equal differ only in layout: whitespace,
 * comments, blank lines, line continuations, string quote style and escapes, and
 * number spelling. Block structure (NEWLINE/INDENT/DEDENT) is kept.
 */
final class NormalizedTokens {

    private NormalizedTokens() {}

    static List<String> of(List<PythonToken> tokens) {
        List<String> out = new ArrayList<>();
        StringLiteral pending = null;

        for (PythonToken token : tokens) {
            PythonTokenType type = token.getType();
            if (!type.isSignificant()) continue;

            if (type == PythonTokenType.STRING) {
                StringLiteral literal = StringLiteral.parse(token.getText());
                if (pending != null && pending.canJoin(literal)) {
                    pending = pending.join(literal);
                } else {
                    if (pending != null) out.add(pending.key());
                    pending = literal;
                }
                continue;
            }

            if (pending != null) {
                out.add(pending.key());
                pending = null;
            }

            switch (type) {
                case NEWLINE, INDENT, DEDENT, ENDMARKER -> out.add(type.name());
                case NUMBER -> out.add("NUMBER:" + normalizeNumber(token.getText()));
                default -> out.add(type.name() + ":" + token.getText());
            }
        }
        if (pending != null) out.add(pending.key());
        return out;
    }

    static String normalizeNumber(String text) {
        String t = text.replace("_", "").toLowerCase(Locale.ROOT);
        if (t.endsWith("j")) {
            return t;
        }
        int radix = 10;
        String digits = t;
        if (t.startsWith("0x"))      { radix = 16; digits = t.substring(2); }
        else if (t.startsWith("0o")) { radix = 8;  digits = t.substring(2); }
        else if (t.startsWith("0b")) { radix = 2;  digits = t.substring(2); }

        if (radix != 10 || t.chars().allMatch(Character::isDigit)) {
            return new BigInteger(digits.isEmpty() ? "0" : digits, radix).toString();
        }
        return Double.toString(Double.parseDouble(t));
    }

    // ================================================================
    // String literals
    // ================================================================

    private static final class StringLiteral {
        final String  kind;
        final String  value;

        StringLiteral(String kind, String value) {
            this.kind  = kind;
            this.value = value;
        }

        static StringLiteral parse(String text) {
            int quoteAt = 0;
            while (text.charAt(quoteAt) != '"' && text.charAt(quoteAt) != '\'') quoteAt++;
            String prefix = text.substring(0, quoteAt).toLowerCase(Locale.ROOT);

            char    quote  = text.charAt(quoteAt);
            boolean triple = text.startsWith(String.valueOf(quote).repeat(3), quoteAt);
            int     open   = triple ? 3 : 1;
            String  body   = text.substring(quoteAt + open, text.length() - open);

            boolean raw   = prefix.contains("r");
            boolean bytes = prefix.contains("b");
            boolean fmt   = prefix.contains("f");

            if (fmt) {
                return new StringLiteral(raw ? "fr" : "f", body);
            }
            return new StringLiteral(bytes ? "b" : "s", raw ? body : unescape(body, bytes));
        }

        boolean canJoin(StringLiteral next) {
            return !kind.startsWith("f") && kind.equals(next.kind);
        }

        StringLiteral join(StringLiteral next) {
            return new StringLiteral(kind, value + next.value);
        }

        String key() {
            return "STRING:" + kind + ":" + value;
        }
    }

    /**
     * Resolves the escape sequences whose spelling can vary without changing the value.
     * Bytes literals have no unicode escapes, so a backslash followed by {@code u},
     * {@code U} or {@code N} stays literal there.
     */
    static String unescape(String body, boolean bytes) {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char n = body.charAt(i + 1);
            switch (n) {
                case '\n' -> i += 2;
                case '\r' -> i += (i + 2 < body.length() && body.charAt(i + 2) == '\n') ? 3 : 2;
                case '\\' -> { sb.append('\\'); i += 2; }
                case '\'' -> { sb.append('\''); i += 2; }
                case '"'  -> { sb.append('"');  i += 2; }
                case 'n'  -> { sb.append('\n'); i += 2; }
                case 't'  -> { sb.append('\t'); i += 2; }
                case 'r'  -> { sb.append('\r'); i += 2; }
                case 'a'  -> { sb.append('\u0007'); i += 2; }
                case 'b'  -> { sb.append('\b'); i += 2; }
                case 'f'  -> { sb.append('\f'); i += 2; }
                case 'v'  -> { sb.append('\u000B'); i += 2; }
                case 'x'  -> i = appendCodePoint(sb, body, i, 2);
                case 'u'  -> i = bytes ? appendLiteral(sb, c, n, i) : appendCodePoint(sb, body, i, 4);
                case 'U'  -> i = bytes ? appendLiteral(sb, c, n, i) : appendCodePoint(sb, body, i, 8);
                default -> {
                    if (n >= '0' && n <= '7') {
                        int end = i + 1;
                        while (end < body.length() && end < i + 4 && body.charAt(end) >= '0' && body.charAt(end) <= '7') end++;
                        sb.appendCodePoint(Integer.parseInt(body.substring(i + 1, end), 8));
                        i = end;
                    } else {
                        sb.append(c).append(n);
                        i += 2;
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendLiteral(StringBuilder sb, char backslash, char n, int at) {
        sb.append(backslash).append(n);
        return at + 2;
    }

    private static int appendCodePoint(StringBuilder sb, String body, int at, int digits) {
        int start = at + 2;
        int end   = start + digits;
        if (end <= body.length()) {
            String hex = body.substring(start, end);
            if (hex.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
                long codePoint = Long.parseLong(hex, 16);
                if (codePoint <= Character.MAX_CODE_POINT) {
                    sb.appendCodePoint((int) codePoint);
                    return end;
                }
            }
        }
        sb.append(body, at, start);
        return start;
    }
}
