package com.latexformatter.passes;

import static com.latexformatter.passes.PassTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import org.junit.jupiter.api.Test;

class TableAlignmentPassTest {

    private final TableAlignmentPass pass = new TableAlignmentPass();

    @Test
    void alignsColumns() {
        String text = "\\begin{tabular}{ll}\nA&B\\\\\nAlpha&B\\\\\n\\end{tabular}\n";

        assertThat(pass.apply(text, context()))
                .isEqualTo("\\begin{tabular}{ll}\nA     & B \\\\\nAlpha & B \\\\\n\\end{tabular}\n");
    }

    @Test
    void keepsIndentationAndTrailingComments() {
        String text = "\\begin{tabular}{ll}\n  long&x\\\\ % first\n  s&y\\\\\n\\end{tabular}\n";

        assertThat(pass.apply(text, context()))
                .isEqualTo("\\begin{tabular}{ll}\n  long & x \\\\ % first\n  s    & y \\\\\n\\end{tabular}\n");
    }

    @Test
    void ignoresAmpersandsInsideBraces() {
        String text = "\\begin{tabular}{ll}\n\\textbf{a&b}&c\\\\\nd&e\\\\\n\\end{tabular}\n";

        assertThat(pass.apply(text, context()))
                .isEqualTo("\\begin{tabular}{ll}\n\\textbf{a&b} & c \\\\\nd            & e \\\\\n\\end{tabular}\n");
    }

    @Test
    void leavesRaggedRowsAndReportsThem() {
        PassContext context = context();
        String text = "\\begin{tabular}{lll}\na&b\\\\\nc&d\\\\\ne&f&g\\\\\n\\end{tabular}\n";

        String result = pass.apply(text, context);

        assertThat(result).isEqualTo("\\begin{tabular}{lll}\na & b \\\\\nc & d \\\\\ne&f&g\\\\\n\\end{tabular}\n");
        assertThat(context.getNotes()).hasSize(1);
        Diagnostic note = context.getNotes().get(0);
        assertThat(note.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(note.getKind()).isEqualTo(DiagnosticKind.RAGGED_TABLE_ROW);
        assertThat(note.getLine()).isEqualTo(4);
    }

    @Test
    void ignoresAmpersandsOutsideTables() {
        String text = "a&b\\\\\nAlpha&b\\\\\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void widthCountsWideCharactersTwice() {
        String text = "\\begin{tabular}{ll}\n漢字&x\\\\\nabc&y\\\\\n\\end{tabular}\n";

        assertThat(pass.apply(text, context()))
                .isEqualTo("\\begin{tabular}{ll}\n漢字 & x \\\\\nabc  & y \\\\\n\\end{tabular}\n");
    }
}
