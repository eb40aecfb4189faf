package com.latexformatter.core;

import com.latexformatter.api.DocumentDiff;
import com.latexformatter.api.LineEdit;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-based diff between an original and a formatted document, computed with JGit's
 * Myers implementation.
 */
public final class UnifiedDiff {
    private static final int CONTEXT_LINES = 3;

    private UnifiedDiff() {
    }

    public static DocumentDiff compute(String documentName, String original, String formatted) {
        RawText originalText = new RawText(original.getBytes(StandardCharsets.UTF_8));
        RawText formattedText = new RawText(formatted.getBytes(StandardCharsets.UTF_8));
        DiffAlgorithm algorithm = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.MYERS);
        EditList edits = algorithm.diff(RawTextComparator.DEFAULT, originalText, formattedText);

        if (edits.isEmpty()) {
            return new DocumentDiff(documentName, List.of(), "");
        }
        return new DocumentDiff(documentName, _toLineEdits(edits, originalText, formattedText),
                _format(documentName, edits, originalText, formattedText));
    }

    private static List<LineEdit> _toLineEdits(EditList edits, RawText original, RawText formatted) {
        List<LineEdit> result = new ArrayList<>(edits.size());
        for (Edit edit : edits) {
            LineEdit.Type type = switch (edit.getType()) {
                case INSERT -> LineEdit.Type.INSERT;
                case DELETE -> LineEdit.Type.DELETE;
                default -> LineEdit.Type.REPLACE;
            };
            result.add(new LineEdit(type, edit.getBeginA(), edit.getEndA(), edit.getBeginB(), edit.getEndB(),
                    _lines(original, edit.getBeginA(), edit.getEndA()),
                    _lines(formatted, edit.getBeginB(), edit.getEndB())));
        }
        return result;
    }

    private static List<String> _lines(RawText text, int begin, int end) {
        List<String> lines = new ArrayList<>(end - begin);
        for (int i = begin; i < end; i++) {
            lines.add(text.getString(i));
        }
        return lines;
    }

    private static String _format(String documentName, EditList edits, RawText original, RawText formatted) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setContext(CONTEXT_LINES);
            formatter.format(edits, original, formatted);
            formatter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render diff for " + documentName, e);
        }
        return "--- a/" + documentName + "\n"
                + "+++ b/" + documentName + "\n"
                + out.toString(StandardCharsets.UTF_8);
    }
}
