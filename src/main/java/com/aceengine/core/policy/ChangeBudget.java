package com.aceengine.core.policy;

import com.aceengine.core.edit.EditPlan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ChangeBudget — caps how much one run may change.
 *
 * Plans are taken in the given (priority) order. A plan is kept when the files and
 * changed lines it adds keep both totals within limits; otherwise it is left out and
 * the next plan is considered. A limit of 0 or less means unlimited.
 */
public final class ChangeBudget {

    private static final Logger log = LoggerFactory.getLogger(ChangeBudget.class);

    private final int maxFiles;
    private final int maxLines;

    public ChangeBudget(int maxFiles, int maxLines) {
        this.maxFiles = maxFiles;
        this.maxLines = maxLines;
    }

    public static ChangeBudget unlimited() {
        return new ChangeBudget(0, 0);
    }

    public int getMaxFiles() { return maxFiles; }
    public int getMaxLines() { return maxLines; }

    public BudgetResult apply(List<EditPlan> orderedPlans) {
        List<EditPlan> selected = new ArrayList<>();
        List<EditPlan> excluded = new ArrayList<>();
        Set<String>    files    = new HashSet<>();
        int            lines    = 0;

        for (EditPlan plan : orderedPlans) {
            Set<String> newFiles = new HashSet<>(files);
            newFiles.addAll(plan.files());
            int newLines = lines + plan.changedLineCount();

            boolean filesOk = maxFiles <= 0 || newFiles.size() <= maxFiles;
            boolean linesOk = maxLines <= 0 || newLines <= maxLines;
            if (filesOk && linesOk) {
                selected.add(plan);
                files = newFiles;
                lines = newLines;
            } else {
                excluded.add(plan);
            }
        }

        if (!excluded.isEmpty()) {
            log.info("[ChangeBudget] {} plan(s) over budget (max_files={}, max_lines={})",
                    excluded.size(), maxFiles, maxLines);
        }
        return new BudgetResult(selected, excluded, files.size(), lines);
    }

    /** Plans kept and left out by {@link #apply}, with the totals of the kept set. */
    public static final class BudgetResult {

        private final List<EditPlan> selected;
        private final List<EditPlan> excluded;
        private final int            fileCount;
        private final int            lineCount;

        BudgetResult(List<EditPlan> selected, List<EditPlan> excluded, int fileCount, int lineCount) {
            this.selected  = List.copyOf(selected);
            this.excluded  = List.copyOf(excluded);
            this.fileCount = fileCount;
            this.lineCount = lineCount;
        }

        public List<EditPlan> getSelected()  { return selected;  }
        public List<EditPlan> getExcluded()  { return excluded;  }
        public int            getFileCount() { return fileCount; }
        public int            getLineCount() { return lineCount; }
    }
}
