package com.aceengine.core.edit;

import com.aceengine.core.error.OperationalException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Applies line-range edits to file content.
 *
 * Edits are applied bottom-up (highest start line first) so earlier line numbers
 * stay valid. Every line keeps its own terminator ({@code \r\n}, {@code \n} or
 * {@code \r}), so lines not covered by an edit are reproduced byte for byte even
 * when a file mixes newline styles. Payload lines take the file's first newline
 * style; the last line of a replacement keeps the terminator of the line it replaced.
 */
public final class EditApplier {

    private EditApplier() {}

    /**
     * Applies {@code edits} (indexes into {@code sorted}) to {@code content}.
     *
     * @param sorted  edits in position order
     * @param indices which of them to apply
     */
    public static String apply(String content, List<Edit> sorted, Collection<Integer> indices) {
        List<Integer> order = new ArrayList<>(indices);
        // Bottom-up; at equal start lines range edits go before inserts so an insert
        // lands above the replaced text, and same-line inserts keep their order.
        order.sort(Comparator
                .comparingInt((Integer i) -> sorted.get(i).getStartLine()).reversed()
                .thenComparing(i -> sorted.get(i).isInsert())
                .thenComparing(Comparator.<Integer>reverseOrder()));

        String     newline  = detectNewline(content);
        List<Line> lines    = splitLines(content);
        boolean    trailing = lines.isEmpty() || !lines.get(lines.size() - 1).eol.isEmpty();

        for (int index : order) {
            applyOne(lines, sorted.get(index), newline);
        }

        StringBuilder out = new StringBuilder(content.length() + 64);
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            out.append(line.text);
            boolean last = i == lines.size() - 1;
            if (!last || trailing) {
                out.append(line.eol.isEmpty() ? newline : line.eol);
            }
        }
        return out.toString();
    }

    public static String apply(String content, List<Edit> sorted) {
        List<Integer> all = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) all.add(i);
        return apply(content, sorted, all);
    }

    private static void applyOne(List<Line> lines, Edit edit, String newline) {
        int start = edit.getStartLine();
        int end   = edit.getEndLine();
        switch (edit.getOp()) {
            case INSERT -> {
                if (start < 1 || start > lines.size() + 1) {
                    throw new OperationalException("Insert position out of range: " + edit
                            + " (file has " + lines.size() + " lines)");
                }
                lines.addAll(start - 1, payloadLines(edit.getPayload(), newline, newline));
            }
            case REPLACE, DELETE -> {
                if (start < 1 || end < start || end > lines.size()) {
                    throw new OperationalException("Line range out of bounds: " + edit
                            + " (file has " + lines.size() + " lines)");
                }
                List<Line> range   = lines.subList(start - 1, end);
                String     lastEol = range.get(range.size() - 1).eol;
                range.clear();
                if (edit.getOp() == EditOp.REPLACE) {
                    range.addAll(payloadLines(edit.getPayload(), newline, lastEol));
                }
            }
        }
    }

    // ================================================================
    // Validation
    // ================================================================

    /**
     * @throws OperationalException naming the first overlapping pair
     */
    public static void validateNonOverlapping(List<Edit> edits) {
        for (int i = 0; i < edits.size(); i++) {
            for (int j = i + 1; j < edits.size(); j++) {
                if (edits.get(i).overlaps(edits.get(j))) {
                    throw new OperationalException("Overlapping edits: " + edits.get(i)
                            + " and " + edits.get(j));
                }
            }
        }
    }

    public static List<Edit> sortByPosition(Collection<Edit> edits) {
        List<Edit> sorted = new ArrayList<>(edits);
        sorted.sort(Edit.POSITION_ORDER);
        return sorted;
    }

    // ================================================================
    // Line handling
    // ================================================================

    /** The first line terminator in {@code content}, or {@code \n} when there is none. */
    static String detectNewline(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n') return "\n";
            if (c == '\r') {
                return i + 1 < content.length() && content.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
        }
        return "\n";
    }

    /** Lines with their own terminators; only the last line may have none. */
    static List<Line> splitLines(String content) {
        List<Line> lines = new ArrayList<>();
        int start = 0;
        int i     = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\n' || c == '\r') {
                int eolEnd = (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(new Line(content.substring(start, i), content.substring(i, eolEnd)));
                start = eolEnd;
                i     = eolEnd;
            } else {
                i++;
            }
        }
        if (start < content.length()) {
            lines.add(new Line(content.substring(start), ""));
        }
        return lines;
    }

    /** Payload lines, without line terminators. An empty payload is zero lines. */
    static List<String> splitPayload(String payload) {
        List<String> texts = new ArrayList<>();
        for (Line line : splitLines(payload)) {
            texts.add(line.text);
        }
        return texts;
    }

    private static List<Line> payloadLines(String payload, String newline, String lastEol) {
        List<String> texts = splitPayload(payload);
        List<Line>   lines = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            boolean last = i == texts.size() - 1;
            lines.add(new Line(texts.get(i), last ? lastEol : newline));
        }
        return lines;
    }

    public static int countLines(String content) {
        return splitLines(content).size();
    }

    static final class Line {
        final String text;
        final String eol;

        Line(String text, String eol) {
            this.text = text;
            this.eol  = eol;
        }
    }
}
