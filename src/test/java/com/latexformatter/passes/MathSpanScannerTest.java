package com.latexformatter.passes;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class MathSpanScannerTest {

    private static List<String> spans(String text) {
        List<LineClassifier.LineInfo> infos = LineClassifier.classify(LatexLines.split(text), Set.of("verbatim"),
                Set.of(), UnaryOperator.identity());
        return MathSpanScanner.scan(text, infos, Set.of("align", "equation"), UnaryOperator.identity()).stream()
                .map(segment -> text.substring(segment.getStart(), segment.getEnd()))
                .collect(Collectors.toList());
    }

    @Test
    void findsAllDelimiterStyles() {
        assertThat(spans("$a$ and $$b$$, \\(c\\) then \\[d\\]")).containsExactly("a", "b", "c", "d");
    }

    @Test
    void findsMathEnvironments() {
        assertThat(spans("\\begin{align}\nx\n\\end{align}\n\\begin{center}y\\end{center}"))
                .containsExactly("\nx\n");
    }

    @Test
    void inlineMathStopsAtBlankLine() {
        assertThat(spans("$a\n\nb")).containsExactly("a");
    }

    @Test
    void escapedDollarIsText() {
        assertThat(spans("costs \\$5 and $x$")).containsExactly("x");
    }

    @Test
    void splitsAroundComments() {
        assertThat(spans("\\begin{equation}\na % c=d\nb\n\\end{equation}")).containsExactly("\na ", "\nb\n");
    }

    @Test
    void skipsVerbatim() {
        assertThat(spans("\\begin{verbatim}\n$x$\n\\end{verbatim}\n$y$")).containsExactly("y");
    }

    @Test
    void maskMarksSegmentOffsets() {
        String text = "a $b$";
        List<LineClassifier.LineInfo> infos = LineClassifier.classify(LatexLines.split(text), Set.of(), Set.of(),
                UnaryOperator.identity());

        boolean[] mask = MathSpanScanner.mask(text,
                MathSpanScanner.scan(text, infos, Set.of(), UnaryOperator.identity()));

        assertThat(mask).containsExactly(false, false, false, true, false);
    }
}
