package com.latexformatter.passes;

import static com.latexformatter.passes.PassTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;

import com.latexformatter.config.FormatterConfig;
import org.junit.jupiter.api.Test;

class CommandPassTest {

    private final CommandPass pass = new CommandPass();

    @Test
    void removesSpaceBetweenCommandAndArgument() {
        assertThat(pass.apply("\\section {Intro}\n", context())).isEqualTo("\\section{Intro}\n");
    }

    @Test
    void trimsStructuralArguments() {
        assertThat(pass.apply("\\begin{ itemize }\n\\label{ fig:a }\n", context()))
                .isEqualTo("\\begin{itemize}\n\\label{fig:a}\n");
        assertThat(pass.apply("\\usepackage[utf8]{ inputenc }", context()))
                .isEqualTo("\\usepackage[utf8]{inputenc}");
    }

    @Test
    void normalizesCitationKeys() {
        assertThat(pass.apply("see \\cite{a,b ,  c} and \\citep[p.~2]{x ,y}\n", context()))
                .isEqualTo("see \\cite{a, b, c} and \\citep[p.~2]{x, y}\n");
    }

    @Test
    void leavesCommentsAndVerbatimAlone() {
        String text = "x % \\section {A}\n\\begin{verbatim}\n\\label{ raw }\n\\end{verbatim}\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void formatsTextAfterSameLineVerbatim() {
        assertThat(pass.apply("\\begin{ verbatim }\\section {x}\\end{verbatim} \\section {A}\n", context()))
                .isEqualTo("\\begin{verbatim}\\section {x}\\end{verbatim} \\section{A}\n");
    }

    @Test
    void separatesBibitemKeyFromEntry() {
        assertThat(pass.apply("\\bibitem{ knuth84 }Knuth, D.\n\\bibitem[KR]{kr}Kernighan\n", context()))
                .isEqualTo("\\bibitem{knuth84} Knuth, D.\n\\bibitem[KR]{kr} Kernighan\n");
        assertThat(pass.apply("\\bibitem{a} Already spaced\n\\bibitem{b}\n", context()))
                .isEqualTo("\\bibitem{a} Already spaced\n\\bibitem{b}\n");
    }

    @Test
    void spacesReferencesRunIntoWords() {
        assertThat(pass.apply("see\\ref{fig:a}and page~\\pageref{b}, Eq.\\eqref{c}\n", context()))
                .isEqualTo("see \\ref{fig:a} and page~\\pageref{b}, Eq.\\eqref{c}\n");
    }

    @Test
    void referenceSpacingCanBeDisabled() {
        FormatterConfig config = FormatterConfig.builder().normalizeRefSpacing(false).build();

        assertThat(pass.apply("see\\ref{ a }and\n", context(config))).isEqualTo("see\\ref{a}and\n");
    }
}
