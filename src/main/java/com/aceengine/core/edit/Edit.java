package com.aceengine.core.edit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * One line-range edit. Lines are 1-based and inclusive.
 *
 * REPLACE swaps lines [start_line, end_line] for the payload lines.
 * DELETE removes them. INSERT places the payload before start_line;
 * start_line = line count + 1 appends.
 */
public final class Edit {

    /** The only ordering edits are ever processed in. */
    public static final Comparator<Edit> POSITION_ORDER = Comparator
            .comparingInt(Edit::getStartLine)
            .thenComparingInt(Edit::getEndLine);

    @JsonProperty("file")
    private final String file;

    @JsonProperty("start_line")
    private final int startLine;

    @JsonProperty("end_line")
    private final int endLine;

    @JsonProperty("op")
    private final EditOp op;

    @JsonProperty("payload")
    private final String payload;

    @JsonCreator
    public Edit(
            @JsonProperty("file") String file,
            @JsonProperty("start_line") int startLine,
            @JsonProperty("end_line") int endLine,
            @JsonProperty("op") EditOp op,
            @JsonProperty("payload") String payload
    ) {
        this.file      = Objects.requireNonNull(file, "file");
        this.startLine = startLine;
        this.endLine   = endLine;
        this.op        = Objects.requireNonNull(op, "op");
        this.payload   = payload == null ? "" : payload;
    }

    public static Edit replace(String file, int startLine, int endLine, String payload) {
        return new Edit(file, startLine, endLine, EditOp.REPLACE, payload);
    }

    public static Edit insert(String file, int beforeLine, String payload) {
        return new Edit(file, beforeLine, beforeLine, EditOp.INSERT, payload);
    }

    public static Edit delete(String file, int startLine, int endLine) {
        return new Edit(file, startLine, endLine, EditOp.DELETE, "");
    }

    public String getFile()      { return file; }
    public int    getStartLine() { return startLine; }
    public int    getEndLine()   { return endLine; }
    public EditOp getOp()        { return op; }
    public String getPayload()   { return payload; }

    @JsonIgnore
    public boolean isInsert() {
        return op == EditOp.INSERT;
    }

    /**
     * Lines touched, for change budgets: the replaced or deleted range, or the
     * number of inserted lines.
     */
    public int changedLineCount() {
        if (op == EditOp.INSERT) {
            return EditApplier.splitPayload(payload).size();
        }
        return endLine - startLine + 1;
    }

    /**
     * Two line-consuming edits overlap when their ranges intersect. An insert
     * overlaps a range only when its insertion point falls strictly inside it.
     */
    public boolean overlaps(Edit other) {
        if (!file.equals(other.file)) return false;
        if (isInsert() && other.isInsert()) return false;
        if (isInsert())       return other.startLine < startLine && startLine <= other.endLine;
        if (other.isInsert()) return startLine < other.startLine && other.startLine <= endLine;
        return Math.max(startLine, other.startLine) <= Math.min(endLine, other.endLine);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edit)) return false;
        Edit e = (Edit) o;
        return startLine == e.startLine && endLine == e.endLine && op == e.op
                && file.equals(e.file) && payload.equals(e.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, startLine, endLine, op, payload);
    }

    @Override
    public String toString() {
        return op.wireName() + " " + file + ":" + startLine + "-" + endLine;
    }
}
