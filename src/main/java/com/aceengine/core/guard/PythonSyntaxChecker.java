package com.aceengine.core.guard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of a tokenized Python module.
 *
 * Works on logical lines (significant tokens between NEWLINEs) and rejects the
 * shapes that cannot appear in a valid module: block headers without a trailing
 * colon, indented blocks where no header opened one, headers without a body,
 * {@code elif}/{@code else}/{@code except}/{@code finally} clauses with no block
 * to continue, statements ending in a dangling operator, two operands with
 * nothing between them, statement keywords in the middle of a statement,
 * {@code =} in a block header, assignments to literals, calls or expressions,
 * positional arguments after keyword arguments and parameters without defaults
 * after parameters with defaults.
 *
 * This is a conservative approximation of the grammar, not a parser. Anything it
 * rejects is invalid; the interpreter check covers the rest.
 */
public final class PythonSyntaxChecker {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield"
    );

    private static final Set<String> VALUE_KEYWORDS = Set.of("False", "None", "True");

    private static final Set<String> SOFT_KEYWORDS = Set.of("match", "case", "type");

    private static final Set<String> BLOCK_KEYWORDS = Set.of(
            "if", "elif", "while", "for", "with", "def", "class",
            "try", "except", "finally", "else"
    );

    private static final Set<String> BARE_BLOCK_KEYWORDS = Set.of("try", "finally", "else");

    /** Keywords that only ever open a statement. */
    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "return", "pass", "break", "continue", "del", "global", "nonlocal", "assert",
            "raise", "import", "def", "class", "while", "try", "finally", "except", "elif", "with"
    );

    private static final Set<String> AUGMENTED_ASSIGN = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>="
    );

    private static final Set<String> TARGET_OPERATORS = Set.of(
            ",", ".", "*", "(", ")", "[", "]", "{", "}"
    );

    /** Clause keyword to the block keywords it may continue. */
    private static final Map<String, Set<String>> CLAUSE_PREDECESSORS = Map.of(
            "elif",    Set.of("if", "elif"),
            "else",    Set.of("if", "elif", "for", "while", "try", "except"),
            "except",  Set.of("try", "except"),
            "finally", Set.of("try", "except", "else")
    );

    /** Operators that need a right-hand operand. */
    private static final Set<String> DANGLING_OPERATORS = Set.of(
            "+", "-", "/", "//", "%", "**", "@", "~",
            "=", "==", "!=", "<", ">", "<=", ">=", "&", "|", "^", "<<", ">>",
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=",
            ".", "->", ":="
    );

    /** Keywords that cannot end a statement. */
    private static final Set<String> DANGLING_KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "import", "from", "del", "if", "elif",
            "else", "while", "for", "with", "as", "assert", "global", "nonlocal",
            "lambda", "def", "class", "await"
    );

    /** Operators that can only appear between two operands. */
    private static final Set<String> BINARY_ONLY = Set.of(
            "/", "//", "%", "=", "==", "!=", "<", ">", "<=", ">=", "&", "|", "^", "<<", ">>",
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=",
            ":="
    );

    private static final Set<String> INFIX = Set.of(
            "+", "-", "*", "**", "@", "/", "//", "%", "=", "==", "!=", "<", ">", "<=", ">=",
            "&", "|", "^", "<<", ">>", ":=",
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>="
    );

    private static final Set<String> INVALID_LINE_START = Set.of(
            ",", ":", ";", ".", "**", "/", "//", "%", "=", "==", "!=", "<", ">", "<=", ">=",
            "&", "|", "^", "<<", ">>", "->", ":=",
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>="
    );

    private PythonSyntaxChecker() {}

    /**
     * @throws PythonSyntaxException describing the first structural problem found
     */
    public static void check(List<PythonToken> tokens) throws PythonSyntaxException {
        List<LogicalLine> lines = logicalLines(tokens);

        for (int i = 0; i < lines.size(); i++) {
            LogicalLine current  = lines.get(i);
            LogicalLine previous = i > 0 ? lines.get(i - 1) : null;

            if (current.indented && (previous == null || !previous.endsWithColon())) {
                throw new PythonSyntaxException("unexpected indent", current.firstLine());
            }
            if (current.endsWithColon()) {
                boolean hasBody = i + 1 < lines.size() && lines.get(i + 1).indented;
                if (!hasBody) {
                    throw new PythonSyntaxException(
                            "expected an indented block after line " + current.firstLine(),
                            current.firstLine());
                }
            }

            checkLineStart(current);
            checkBlockHeader(current);
            checkClause(lines, i);
            checkLineEnd(current);
            checkAdjacency(current);
            checkStatements(current);
            checkArguments(current);
        }
    }

    // ================================================================
    // Line checks
    // ================================================================

    private static void checkLineStart(LogicalLine line) throws PythonSyntaxException {
        PythonToken first = line.tokens.get(0);
        if (first.getType() == PythonTokenType.OP && INVALID_LINE_START.contains(first.getText())) {
            throw new PythonSyntaxException("invalid syntax near '" + first.getText() + "'", first.getLine());
        }
    }

    private static void checkBlockHeader(LogicalLine line) throws PythonSyntaxException {
        List<PythonToken> t = line.tokens;
        int head = 0;
        if (t.get(0).is(PythonTokenType.NAME, "async") && t.size() > 1) {
            head = 1;
        }
        PythonToken keyword = t.get(head);
        if (keyword.getType() != PythonTokenType.NAME || !BLOCK_KEYWORDS.contains(keyword.getText())) {
            return;
        }

        if (BARE_BLOCK_KEYWORDS.contains(keyword.getText())) {
            if (t.size() <= head + 1 || !t.get(head + 1).isOp(":")) {
                throw new PythonSyntaxException("expected ':' after '" + keyword.getText() + "'", keyword.getLine());
            }
            return;
        }

        if (keyword.getText().equals("def")) {
            boolean wellFormed = t.size() > head + 2
                    && t.get(head + 1).getType() == PythonTokenType.NAME
                    && !KEYWORDS.contains(t.get(head + 1).getText())
                    && (t.get(head + 2).isOp("(") || t.get(head + 2).isOp("["));
            if (!wellFormed) {
                throw new PythonSyntaxException("invalid function definition", keyword.getLine());
            }
        } else if (keyword.getText().equals("class")) {
            boolean wellFormed = t.size() > head + 1
                    && t.get(head + 1).getType() == PythonTokenType.NAME
                    && !KEYWORDS.contains(t.get(head + 1).getText());
            if (!wellFormed) {
                throw new PythonSyntaxException("invalid class definition", keyword.getLine());
            }
        }

        if (!hasTopLevelColon(t, head + 1)) {
            throw new PythonSyntaxException("expected ':'", keyword.getLine());
        }
    }

    private static void checkLineEnd(LogicalLine line) throws PythonSyntaxException {
        PythonToken last = line.tokens.get(line.tokens.size() - 1);
        boolean dangling;
        if (last.getType() == PythonTokenType.OP) {
            dangling = DANGLING_OPERATORS.contains(last.getText())
                    || (last.isOp("*") && !line.tokens.get(0).is(PythonTokenType.NAME, "from"));
        } else {
            dangling = last.getType() == PythonTokenType.NAME && DANGLING_KEYWORDS.contains(last.getText());
        }
        if (dangling) {
            throw new PythonSyntaxException("invalid syntax: statement ends with '" + last.getText() + "'",
                    last.getLine());
        }
    }

    private static void checkAdjacency(LogicalLine line) throws PythonSyntaxException {
        List<PythonToken> t = line.tokens;
        for (int i = 0; i + 1 < t.size(); i++) {
            PythonToken left  = t.get(i);
            PythonToken right = t.get(i + 1);

            boolean implicitConcatenation = left.getType() == PythonTokenType.STRING
                    && right.getType() == PythonTokenType.STRING;
            if (endsOperand(left) && startsOperand(right) && !implicitConcatenation) {
                boolean softKeywordStatement = i == 0
                        && left.getType() == PythonTokenType.NAME
                        && SOFT_KEYWORDS.contains(left.getText());
                if (!softKeywordStatement) {
                    throw new PythonSyntaxException("invalid syntax. Perhaps you forgot a comma?",
                            right.getLine());
                }
            }

            if (left.getType() == PythonTokenType.OP && INFIX.contains(left.getText())
                    && right.getType() == PythonTokenType.OP && BINARY_ONLY.contains(right.getText())) {
                throw new PythonSyntaxException("invalid syntax near '" + left.getText() + " "
                        + right.getText() + "'", right.getLine());
            }

            // Unpacking only follows an assignment, never another operator.
            boolean unpacking = right.isOp("*") || right.isOp("**");
            if (unpacking && left.getType() == PythonTokenType.OP && INFIX.contains(left.getText())
                    && !left.isOp("=") && !left.isOp(":=") && !AUGMENTED_ASSIGN.contains(left.getText())) {
                throw new PythonSyntaxException("invalid syntax near '" + left.getText() + " "
                        + right.getText() + "'", right.getLine());
            }
        }
    }

    private static void checkClause(List<LogicalLine> lines, int index) throws PythonSyntaxException {
        LogicalLine line  = lines.get(index);
        PythonToken first = line.tokens.get(0);
        if (first.getType() != PythonTokenType.NAME || !CLAUSE_PREDECESSORS.containsKey(first.getText())) {
            return;
        }
        for (int j = index - 1; j >= 0; j--) {
            LogicalLine candidate = lines.get(j);
            if (candidate.level > line.level) continue;
            if (candidate.level == line.level
                    && CLAUSE_PREDECESSORS.get(first.getText()).contains(candidate.blockKeyword())) {
                return;
            }
            break;
        }
        throw new PythonSyntaxException("invalid syntax: '" + first.getText() + "' without a matching block",
                first.getLine());
    }

    // ================================================================
    // Statement checks
    // ================================================================

    private static void checkStatements(LogicalLine line) throws PythonSyntaxException {
        for (Segment segment : segments(line)) {
            checkStatementKeywords(segment.tokens);
            if (segment.header) {
                int assign = indexOfAssign(segment.tokens, 0, segment.tokens.size());
                if (assign >= 0) {
                    throw new PythonSyntaxException(
                            "invalid syntax. Maybe you meant '==' or ':=' instead of '='?",
                            segment.tokens.get(assign).getLine());
                }
            } else {
                checkAssignmentTargets(segment.tokens);
            }
        }
    }

    private static void checkStatementKeywords(List<PythonToken> t) throws PythonSyntaxException {
        for (int i = 1; i < t.size(); i++) {
            PythonToken token = t.get(i);
            if (token.getType() != PythonTokenType.NAME || !STATEMENT_KEYWORDS.contains(token.getText())) {
                continue;
            }
            String  text        = token.getText();
            boolean asyncPrefix = i == 1 && t.get(0).is(PythonTokenType.NAME, "async")
                    && (text.equals("def") || text.equals("with"));
            boolean fromImport  = text.equals("import") && t.get(0).is(PythonTokenType.NAME, "from");
            if (!asyncPrefix && !fromImport) {
                throw new PythonSyntaxException("invalid syntax near '" + text + "'", token.getLine());
            }
        }
    }

    private static void checkAssignmentTargets(List<PythonToken> t) throws PythonSyntaxException {
        List<Integer> cuts = new ArrayList<>();
        int from = 0;
        int assign;
        while ((assign = indexOfAssign(t, from, t.size())) >= 0) {
            cuts.add(assign);
            from = assign + 1;
        }
        int start = 0;
        for (int cut : cuts) {
            List<PythonToken> target = t.subList(start, cut);
            int annotation = indexOfTopLevel(target, ":");
            if (annotation >= 0) {
                target = target.subList(0, annotation);
            }
            checkTarget(target, t.get(cut));
            start = cut + 1;
        }
    }

    private static void checkTarget(List<PythonToken> target, PythonToken assign) throws PythonSyntaxException {
        if (target.isEmpty()) {
            throw new PythonSyntaxException("invalid syntax near '='", assign.getLine());
        }
        int depth = 0;
        int elementStart = 0;
        for (int i = 0; i <= target.size(); i++) {
            PythonToken token = i < target.size() ? target.get(i) : null;
            if (token != null && depth == 0) {
                if (token.getType() == PythonTokenType.NAME && KEYWORDS.contains(token.getText())) {
                    throw new PythonSyntaxException("cannot assign to '" + token.getText() + "'", token.getLine());
                }
                if (token.getType() == PythonTokenType.OP && !TARGET_OPERATORS.contains(token.getText())) {
                    throw new PythonSyntaxException("cannot assign to expression", token.getLine());
                }
            }
            if (token == null || (depth == 0 && token.isOp(","))) {
                checkTargetElement(target.subList(elementStart, i));
                elementStart = i + 1;
                continue;
            }
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) depth++;
            else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) depth--;
        }
    }

    private static void checkTargetElement(List<PythonToken> element) throws PythonSyntaxException {
        if (element.isEmpty()) return;
        PythonToken last = element.get(element.size() - 1);
        if (last.getType() == PythonTokenType.NUMBER || last.getType() == PythonTokenType.STRING) {
            throw new PythonSyntaxException("cannot assign to literal", last.getLine());
        }
        if (last.isOp("}")) {
            throw new PythonSyntaxException("cannot assign to dict or set display", last.getLine());
        }
        if (last.isOp(")")) {
            int open = matchingOpen(element, element.size() - 1);
            if (open > 0 && endsOperand(element.get(open - 1))) {
                throw new PythonSyntaxException("cannot assign to function call", last.getLine());
            }
        }
    }

    // ================================================================
    // Argument lists
    // ================================================================

    private enum FrameKind { CALL, DEF, OTHER }

    private static final class Frame {
        final FrameKind kind;
        int     argStart;
        int     lambdaOpen;
        boolean sawKeyword;
        boolean sawDefault;
        boolean sawStar;

        Frame(FrameKind kind, int argStart) {
            this.kind     = kind;
            this.argStart = argStart;
        }
    }

    private static void checkArguments(LogicalLine line) throws PythonSyntaxException {
        List<PythonToken> t      = line.tokens;
        Deque<Frame>      frames = new ArrayDeque<>();
        boolean defPending = false;

        for (int i = 0; i < t.size(); i++) {
            PythonToken token = t.get(i);
            Frame       top   = frames.peek();

            if (token.is(PythonTokenType.NAME, "def")) {
                defPending = true;
            } else if (token.is(PythonTokenType.NAME, "lambda") && top != null) {
                top.lambdaOpen++;
            } else if (token.isOp(":") && top != null && top.lambdaOpen > 0) {
                top.lambdaOpen--;
            } else if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                FrameKind kind = FrameKind.OTHER;
                if (token.isOp("(") && defPending && frames.isEmpty()) {
                    kind       = FrameKind.DEF;
                    defPending = false;
                } else if (token.isOp("(") && i > 0 && endsOperand(t.get(i - 1))) {
                    kind = FrameKind.CALL;
                }
                frames.push(new Frame(kind, i + 1));
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                if (top != null) {
                    checkArgument(top, t.subList(top.argStart, i));
                    frames.pop();
                }
            } else if (token.isOp(",") && top != null && top.lambdaOpen == 0) {
                checkArgument(top, t.subList(top.argStart, i));
                top.argStart = i + 1;
            }
        }
    }

    private static void checkArgument(Frame frame, List<PythonToken> arg) throws PythonSyntaxException {
        if (arg.isEmpty() || frame.kind == FrameKind.OTHER) return;
        PythonToken first = arg.get(0);

        if (frame.kind == FrameKind.CALL) {
            boolean keyword = first.isOp("**")
                    || (arg.size() > 1 && first.getType() == PythonTokenType.NAME && arg.get(1).isOp("="));
            if (keyword) {
                frame.sawKeyword = true;
            } else if (!first.isOp("*") && frame.sawKeyword) {
                throw new PythonSyntaxException("positional argument follows keyword argument", first.getLine());
            }
            return;
        }

        if (first.isOp("*") || first.isOp("**")) {
            frame.sawStar = true;
            return;
        }
        if (arg.size() == 1 && first.isOp("/")) return;
        if (indexOfTopLevel(arg, "=") >= 0) {
            frame.sawDefault = true;
        } else if (frame.sawDefault && !frame.sawStar) {
            throw new PythonSyntaxException("parameter without a default follows parameter with a default",
                    first.getLine());
        }
    }

    // ================================================================
    // Helpers
    // ================================================================

    private static boolean endsOperand(PythonToken token) {
        return switch (token.getType()) {
            case NAME -> !KEYWORDS.contains(token.getText()) || VALUE_KEYWORDS.contains(token.getText());
            case NUMBER, STRING -> true;
            case OP -> token.isOp(")") || token.isOp("]") || token.isOp("}");
            default -> false;
        };
    }

    private static boolean startsOperand(PythonToken token) {
        return switch (token.getType()) {
            case NAME -> !KEYWORDS.contains(token.getText()) || VALUE_KEYWORDS.contains(token.getText());
            case NUMBER, STRING -> true;
            default -> false;
        };
    }

    private static boolean hasTopLevelColon(List<PythonToken> tokens, int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.getType() != PythonTokenType.OP) continue;
            switch (token.getText()) {
                case "(", "[", "{" -> depth++;
                case ")", "]", "}" -> depth--;
                case ":" -> {
                    if (depth == 0) return true;
                }
                default -> { }
            }
        }
        return false;
    }

    /** First {@code =} at bracket depth 0 in {@code [from, to)}, skipping lambda parameter lists. */
    private static int indexOfAssign(List<PythonToken> tokens, int from, int to) {
        int depth      = 0;
        int lambdaOpen = 0;
        for (int i = from; i < to; i++) {
            PythonToken token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) depth++;
            else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) depth--;
            else if (depth > 0) continue;
            else if (token.is(PythonTokenType.NAME, "lambda")) lambdaOpen++;
            else if (token.isOp(":") && lambdaOpen > 0) lambdaOpen--;
            else if (token.isOp("=") && lambdaOpen == 0) return i;
        }
        return -1;
    }

    /** Header colon of a compound statement: the first depth-0 ':' not closing a lambda. */
    private static int headerColon(List<PythonToken> tokens, int from) {
        int depth      = 0;
        int lambdaOpen = 0;
        for (int i = from; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) depth++;
            else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) depth--;
            else if (depth > 0) continue;
            else if (token.is(PythonTokenType.NAME, "lambda")) lambdaOpen++;
            else if (token.isOp(":")) {
                if (lambdaOpen == 0) return i;
                lambdaOpen--;
            }
        }
        return -1;
    }

    private static int indexOfTopLevel(List<PythonToken> tokens, String op) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) depth++;
            else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) depth--;
            else if (depth == 0 && token.isOp(op)) return i;
        }
        return -1;
    }

    private static int matchingOpen(List<PythonToken> tokens, int close) {
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            PythonToken token = tokens.get(i);
            if (token.isOp(")") || token.isOp("]") || token.isOp("}")) depth++;
            else if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                if (--depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Splits a logical line into statements: at depth-0 ';' and, for compound
     * statements, after the header colon. The header itself is flagged.
     */
    private static List<Segment> segments(LogicalLine line) {
        List<PythonToken> t        = line.tokens;
        List<Segment>     segments = new ArrayList<>();
        int colon = line.isCompound() ? headerColon(t, 1) : -1;
        int start = 0;
        int depth = 0;
        for (int i = 0; i < t.size(); i++) {
            PythonToken token = t.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) depth++;
            else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) depth--;
            else if (i == colon) {
                segments.add(new Segment(t.subList(start, i), true));
                start = i + 1;
            } else if (depth == 0 && token.isOp(";")) {
                if (i > start) segments.add(new Segment(t.subList(start, i), false));
                start = i + 1;
            }
        }
        if (start < t.size()) {
            segments.add(new Segment(t.subList(start, t.size()), false));
        }
        return segments;
    }

    private static List<LogicalLine> logicalLines(List<PythonToken> tokens) {
        List<LogicalLine> lines   = new ArrayList<>();
        List<PythonToken> current = new ArrayList<>();
        boolean indented = false;
        int     level    = 0;

        for (PythonToken token : tokens) {
            switch (token.getType()) {
                case INDENT -> {
                    indented = true;
                    level++;
                }
                case DEDENT -> level--;
                case NEWLINE -> {
                    if (!current.isEmpty()) {
                        lines.add(new LogicalLine(current, indented, level));
                    }
                    current  = new ArrayList<>();
                    indented = false;
                }
                case NAME, NUMBER, STRING, OP -> current.add(token);
                default -> { }
            }
        }
        if (!current.isEmpty()) {
            lines.add(new LogicalLine(current, indented, level));
        }
        return lines;
    }

    private static final class Segment {
        final List<PythonToken> tokens;
        final boolean           header;

        Segment(List<PythonToken> tokens, boolean header) {
            this.tokens = tokens;
            this.header = header;
        }
    }

    private static final class LogicalLine {
        final List<PythonToken> tokens;
        final boolean           indented;
        final int               level;

        LogicalLine(List<PythonToken> tokens, boolean indented, int level) {
            this.tokens   = tokens;
            this.indented = indented;
            this.level    = level;
        }

        boolean endsWithColon() {
            return tokens.get(tokens.size() - 1).isOp(":");
        }

        /** The block keyword opening this line, skipping {@code async}; empty if none. */
        String blockKeyword() {
            int head = tokens.get(0).is(PythonTokenType.NAME, "async") && tokens.size() > 1 ? 1 : 0;
            PythonToken keyword = tokens.get(head);
            if (keyword.getType() == PythonTokenType.NAME && BLOCK_KEYWORDS.contains(keyword.getText())) {
                return keyword.getText();
            }
            return "";
        }

        boolean isCompound() {
            if (!blockKeyword().isEmpty()) return true;
            PythonToken first = tokens.get(0);
            if (tokens.size() < 2 || first.getType() != PythonTokenType.NAME
                    || !(first.getText().equals("match") || first.getText().equals("case"))) {
                return false;
            }
            PythonToken next = tokens.get(1);
            boolean statementUse = next.isOp("=") || next.isOp(".") || next.isOp(":") || next.isOp(",")
                    || AUGMENTED_ASSIGN.contains(next.getText());
            return !statementUse && headerColon(tokens, 1) >= 0;
        }

        int firstLine() {
            return tokens.get(0).getLine();
        }
    }
}
