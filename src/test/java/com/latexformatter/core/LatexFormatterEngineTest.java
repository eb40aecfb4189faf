package com.latexformatter.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.latexformatter.api.DocumentDiff;
import com.latexformatter.api.FormatResult;
import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import com.latexformatter.config.FormatterConfig;
import com.latexformatter.passes.FormattingPass;
import com.latexformatter.passes.PassContext;
import com.latexformatter.passes.PassId;
import com.latexformatter.passes.PassPipeline;
import com.latexformatter.patterns.PatternStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatexFormatterEngineTest {

    static final String SAMPLE = String.join("\n",
            "\\documentclass{article}",
            "\\usepackage{graphicx}",
            "\\usepackage{amsmath}",
            "\\begin{document}",
            "\\section {Results}",
            "We measured \"two-dimensional\" Li-S cells, see References 3-5.",
            "\\begin{itemize}",
            "\\item first $a=b+c$ % note",
            "\\item second",
            "\\end{itemize}",
            "\\begin{tabular}{ll}",
            "A&B\\\\",
            "Alpha&Beta\\\\",
            "\\end{tabular}",
            "\\begin{equation}",
            "x=-y",
            "\\end{equation}",
            "\\begin{verbatim}",
            "  keep   \"this\"  a=b   ",
            "\\end{verbatim}",
            "\\end{document}",
            "");

    private final LatexFormatterEngine engine = new LatexFormatterEngine(FormatterConfig.defaults());

    @Test
    void formatsSampleDocument() {
        FormatResult result = engine.format(SAMPLE);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getOutputText()).isEqualTo(String.join("\n",
                "\\documentclass{article}",
                "\\usepackage{amsmath}",
                "\\usepackage{graphicx}",
                "\\begin{document}",
                "\\section{Results}",
                "We measured ``two-dimensional'' Li-S cells, see References 3-5.",
                "\\begin{itemize}",
                "  \\item first $a = b + c$ % note",
                "  \\item second",
                "\\end{itemize}",
                "\\begin{tabular}{ll}",
                "  A     & B    \\\\",
                "  Alpha & Beta \\\\",
                "\\end{tabular}",
                "\\begin{equation}",
                "  x = -y",
                "\\end{equation}",
                "\\begin{verbatim}",
                "  keep   \"this\"  a=b   ",
                "\\end{verbatim}",
                "\\end{document}",
                ""));
        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.getAppliedChanges()).isNotEmpty();
    }

    @Test
    void formattingIsIdempotent() {
        String once = engine.format(SAMPLE).getOutputText();
        FormatResult twice = engine.format(once);

        assertThat(twice.getOutputText()).isEqualTo(once);
        assertThat(twice.isChanged()).isFalse();
        assertThat(engine.check(once)).isTrue();
        assertThat(engine.check(SAMPLE)).isFalse();
    }

    @Test
    void wrappingIsIdempotent() {
        LatexFormatterEngine wrapping = new LatexFormatterEngine(
                FormatterConfig.builder().wrapLongLines(true).lineLength(30).build());
        String text = "\\begin{itemize}\n\\item This item is long enough to need wrapping twice over, % c\n"
                + "\\end{itemize}\n";

        String once = wrapping.format(text).getOutputText();

        assertThat(once.lines()).allMatch(line -> line.length() <= 36);
        assertThat(wrapping.format(once).getOutputText()).isEqualTo(once);
    }

    @Test
    void sortsPackages() {
        assertThat(engine.format("\\usepackage{b}\n\\usepackage{a}\n").getOutputText())
                .isEqualTo("\\usepackage{a}\n\\usepackage{b}\n");
    }

    @Test
    void alignsTable() {
        String text = "\\begin{tabular}{ll}\nA&B\\\\\nAlpha&B\\\\\n\\end{tabular}\n";

        assertThat(engine.format(text).getOutputText())
                .isEqualTo("\\begin{tabular}{ll}\n  A     & B \\\\\n  Alpha & B \\\\\n\\end{tabular}\n");
    }

    @Test
    void convertsQuotes() {
        assertThat(engine.format("He said \"hi\"\n").getOutputText()).isEqualTo("He said ``hi''\n");
    }

    @Test
    void verbatimIsByteIdentical() {
        String text = "\\begin{verbatim}\n  x  =  y   \n\n\n\n\t\"q\"  % c\n\\end{verbatim}\n";

        FormatResult result = engine.format(text);

        assertThat(result.getOutputText()).isEqualTo(text);
        assertThat(result.isChanged()).isFalse();
    }

    @Test
    void protectedSpansSurviveVerbatim() {
        String text = "Numbers 10-20 in Ti₃C₂Tₓ and \\verb|a  \"b\"  =c| stay. % ---- keep -- this\n";

        assertThat(engine.format(text).getOutputText()).isEqualTo(text);
    }

    @Test
    void packageOptionsAreProtected() {
        String text = "\\usepackage[margin=1in]{geometry}\n\\usepackage{amsmath}\n";

        assertThat(engine.format(text).getOutputText())
                .isEqualTo("\\usepackage{amsmath}\n\\usepackage[margin=1in]{geometry}\n");
    }

    @Test
    void preservesBraceBalance() {
        String text = "\\begin{document}\n\\textbf {a} {b}\n\\end{document}\n";

        String output = engine.format(text).getOutputText();

        assertThat(count(output, '{')).isEqualTo(count(text, '{'));
        assertThat(count(output, '}')).isEqualTo(count(text, '}'));
        assertThat(engine.checkSyntax(output)).isEmpty();
    }

    @Test
    void reportsSyntaxProblemsButStillFormats() {
        FormatResult result = engine.format("\\begin{itemize}\n\\item a {\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getOutputText()).isEqualTo("\\begin{itemize}\n  \\item a {\n");
        assertThat(result.hasDiagnostics(Severity.ERROR)).isTrue();
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .contains(DiagnosticKind.UNBALANCED_BRACE, DiagnosticKind.UNBALANCED_ENVIRONMENT);
    }

    @Test
    void reportsCrossReferencesNextToSyntaxDiagnostics() {
        String text = "\\section{A}\\label{sec:a}\nSee\\ref{sec:b}.\n";

        FormatResult result = engine.format(text);

        assertThat(result.getOutputText()).isEqualTo("\\section{A}\\label{sec:a}\nSee \\ref{sec:b}.\n");
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.UNDEFINED_REFERENCE, DiagnosticKind.UNUSED_LABEL);
        assertThat(result.hasDiagnostics(Severity.ERROR)).isFalse();
        assertThat(engine.checkSyntax(text)).hasSize(2);

        LatexFormatterEngine quiet = new LatexFormatterEngine(
                FormatterConfig.builder().validateCrossReferences(false).build());
        assertThat(quiet.checkSyntax(text)).isEmpty();
    }

    @Test
    void surfacesRaggedRowNotes() {
        String text = "\\begin{tabular}{ll}\na&b\\\\\nc&d\\\\\ne&f&g\\\\\n\\end{tabular}\n";

        FormatResult result = engine.format(text);

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.RAGGED_TABLE_ROW);
        assertThat(result.hasDiagnostics(Severity.INFO)).isTrue();
    }

    @Test
    void runsOnlyRequestedPasses() {
        FormatResult result = engine.format("\\section {A} \"q\"", EnumSet.of(PassId.QUOTES));

        assertThat(result.getOutputText()).isEqualTo("\\section {A} ``q''");
    }

    @Test
    void producesUnifiedDiff() {
        DocumentDiff diff = engine.diff("doc.tex", "\\usepackage{b}\n\\usepackage{a}\n");

        assertThat(diff.isEmpty()).isFalse();
        assertThat(diff.getUnifiedText()).startsWith("--- a/doc.tex\n+++ b/doc.tex\n@@");
        assertThat(diff.getUnifiedText()).contains("-\\usepackage{", "+\\usepackage{");
        assertThat(engine.diff("doc.tex", "\\usepackage{a}\n").isEmpty()).isTrue();
    }

    @Test
    void lostPlaceholderLeavesDocumentUnchanged() {
        FormattingPass tokenEater = new FormattingPass() {
            @Override
            public PassId getId() {
                return PassId.WHITESPACE;
            }

            @Override
            public String apply(String text, PassContext context) {
                return text.replaceAll("[\\x{E000}-\\x{F8FF}]", "");
            }
        };
        LatexFormatterEngine broken = new LatexFormatterEngine(FormatterConfig.defaults(),
                PatternStore.withDefaults(), new PassPipeline(List.of(tokenEater)));

        FormatResult result = broken.format("Li-S cells\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.isChanged()).isFalse();
        assertThat(result.getOutputText()).isEqualTo("Li-S cells\n");
        assertThat(result.getDiagnostics()).hasSize(1);
        assertThat(result.getDiagnostics().get(0).getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(result.getDiagnostics().get(0).getKind()).isEqualTo(DiagnosticKind.INTERNAL_CONSISTENCY);
        assertThat(broken.getErrorCount()).isEqualTo(1);
        assertThat(broken.check("Li-S cells\n")).isFalse();
    }

    @Test
    void countsProcessedDocuments() {
        engine.format("a\n");
        engine.format("b  \n");

        assertThat(engine.getProcessedCount()).isEqualTo(2);
        assertThat(engine.getSuccessCount()).isEqualTo(2);
        assertThat(engine.getErrorCount()).isZero();
    }

    @Test
    void usesReloadedPatterns(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE);
        Files.writeString(file, "{\"compound_terms\": [\"\\\"raw\\\"\"]}");
        LatexFormatterEngine custom = new LatexFormatterEngine(FormatterConfig.builder().patternConfigDir(dir).build());

        assertThat(custom.format("a \"raw\" b\n").getOutputText()).isEqualTo("a \"raw\" b\n");

        Files.writeString(file, "{\"compound_terms\": [\"unused-term\"]}");
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 10_000));

        assertThat(custom.reloadPatterns()).isTrue();
        assertThat(custom.format("a \"raw\" b\n").getOutputText()).isEqualTo("a ``raw'' b\n");
    }

    private static long count(String text, char c) {
        return text.chars().filter(ch -> ch == c).count();
    }
}
