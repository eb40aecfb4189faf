package com.latexformatter.passes;

import com.latexformatter.api.FormattingChange;
import com.latexformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Fixed, ordered sequence of passes. Disabled passes are skipped; the others run in
 * list order regardless of which subset is enabled.
 */
public class PassPipeline {
    private static final Logger logger = LoggerUtil.getLogger(PassPipeline.class);

    private final List<FormattingPass> passes;

    public PassPipeline(List<FormattingPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * The standard nine-pass pipeline.
     */
    public static PassPipeline standard() {
        return new PassPipeline(List.of(
                new WhitespacePass(),
                new CommandPass(),
                new PackageSortPass(),
                new IndentationPass(),
                new TableAlignmentPass(),
                new MathSpacingPass(),
                new QuotePass(),
                new LineWrapPass(),
                new CommentAlignmentPass()));
    }

    public List<FormattingPass> getPasses() {
        return passes;
    }

    /**
     * Runs every enabled pass in order.
     */
    public Result run(String text, PassContext context, Set<PassId> enabled) {
        List<FormattingChange> changes = new ArrayList<>();
        String current = text;

        for (FormattingPass pass : passes) {
            if (!enabled.contains(pass.getId())) {
                continue;
            }
            String next = pass.apply(current, context);
            if (!next.equals(current)) {
                FormattingChange change = _describeChange(pass.getId(), current, next);
                changes.add(change);
                logger.fine("Pass " + pass.getId().getConfigName() + " changed lines "
                        + change.getStartLine() + "-" + change.getEndLine());
            }
            current = next;
        }
        return new Result(current, changes);
    }

    private static FormattingChange _describeChange(PassId id, String before, String after) {
        List<String> oldLines = LatexLines.split(before);
        List<String> newLines = LatexLines.split(after);

        int first = 0;
        while (first < oldLines.size() && first < newLines.size()
                && oldLines.get(first).equals(newLines.get(first))) {
            first++;
        }
        int oldEnd = oldLines.size() - 1;
        int newEnd = newLines.size() - 1;
        while (oldEnd >= first && newEnd >= first && oldLines.get(oldEnd).equals(newLines.get(newEnd))) {
            oldEnd--;
            newEnd--;
        }

        int startLine = first + 1;
        int endLine = Math.max(startLine, newEnd + 1);
        return new FormattingChange(id.getConfigName(), startLine, endLine, _describe(id));
    }

    private static String _describe(PassId id) {
        return switch (id) {
            case WHITESPACE -> "Normalized whitespace and blank lines";
            case COMMANDS -> "Normalized command spacing";
            case PACKAGES -> "Sorted \\usepackage declarations";
            case INDENTATION -> "Re-indented environment bodies";
            case TABLES -> "Aligned table columns";
            case MATH -> "Normalized spacing around math operators";
            case QUOTES -> "Converted straight double quotes";
            case WRAP -> "Wrapped long lines";
            case COMMENTS -> "Aligned trailing comments";
        };
    }

    /**
     * Output text of a pipeline run together with the passes that changed something.
     */
    public static final class Result {
        private final String text;
        private final List<FormattingChange> changes;

        public Result(String text, List<FormattingChange> changes) {
            this.text = text;
            this.changes = Collections.unmodifiableList(new ArrayList<>(changes));
        }

        public String getText() { return text; }
        public List<FormattingChange> getChanges() { return changes; }
    }
}
