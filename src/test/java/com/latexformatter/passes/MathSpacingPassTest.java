package com.latexformatter.passes;

import static com.latexformatter.passes.PassTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MathSpacingPassTest {

    private final MathSpacingPass pass = new MathSpacingPass();

    @Test
    void spacesBinaryOperatorsInInlineMath() {
        assertThat(pass.apply("$a=b+c$\n", context())).isEqualTo("$a = b + c$\n");
        assertThat(pass.apply("\\(a<=b\\)", context())).isEqualTo("\\(a <= b\\)");
    }

    @Test
    void leavesTextOutsideMathAlone() {
        assertThat(pass.apply("a=b and $c=d$", context())).isEqualTo("a=b and $c = d$");
    }

    @Test
    void keepsUnaryOperatorsAttached() {
        assertThat(pass.apply("$-x$", context())).isEqualTo("$-x$");
        assertThat(pass.apply("$a=-b$", context())).isEqualTo("$a = -b$");
        assertThat(pass.apply("\\[x^{-1}+(-y)\\]", context())).isEqualTo("\\[x^{-1} + (-y)\\]");
    }

    @Test
    void spacesCommandOperatorsInEnvironments() {
        String text = "\\begin{equation}\na\\pm b\\times c\n\\end{equation}\n";

        assertThat(pass.apply(text, context())).isEqualTo("\\begin{equation}\na \\pm b \\times c\n\\end{equation}\n");
    }

    @Test
    void keepsNegativeBoundAfterRelation() {
        String text = "\\begin{align}\na &\\le -1 \\\\\nb &\\ne +2\n\\end{align}\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
        assertThat(pass.apply("$x\\ge-1$", context())).isEqualTo("$x \\ge -1$");
    }

    @Test
    void resumesAfterSameLineVerbatim() {
        assertThat(pass.apply("\\begin{verbatim}$a=b$\\end{verbatim} then $c=d$\n", context()))
                .isEqualTo("\\begin{verbatim}$a=b$\\end{verbatim} then $c = d$\n");
    }

    @Test
    void preservesLineBreaksAroundOperators() {
        String text = "\\begin{align}\na &= b\n  + c\n\\end{align}\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void leavesLabelArgumentsAlone() {
        assertThat(pass.apply("$\\label{eq:a-b} x=y$", context())).isEqualTo("$\\label{eq:a-b} x = y$");
    }

    @Test
    void skipsMathOnTableRows() {
        String text = "\\begin{tabular}{c}\n$a=b$\\\\\n\\end{tabular}\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void skipsComments() {
        assertThat(pass.apply("$a=b$ % $c=d$\n", context())).isEqualTo("$a = b$ % $c=d$\n");
    }

    @Test
    void spaceIsStableOnSpacedInput() {
        List<String> symbols = List.of("<=", "=", "+", "-");
        String once = MathSpacingPass.space("x=y+-z", symbols, Set.of("pm"));

        assertThat(once).isEqualTo("x = y + -z");
        assertThat(MathSpacingPass.space(once, symbols, Set.of("pm"))).isEqualTo(once);
    }
}
