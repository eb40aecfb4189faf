package com.latexformatter.passes;

import static com.latexformatter.passes.PassTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CommentAlignmentPassTest {

    private final CommentAlignmentPass pass = new CommentAlignmentPass();

    @Test
    void alignsCommentsOfConsecutiveLines() {
        assertThat(pass.apply("a % x\nlonger % y\n", context())).isEqualTo("a      % x\nlonger % y\n");
    }

    @Test
    void collapsesWideGapOnSingleLine() {
        assertThat(pass.apply("code        % note\n", context())).isEqualTo("code % note\n");
    }

    @Test
    void leavesGluedCommentsAlone() {
        String text = "a% x\nlonger % y\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void commentOnlyLinesBreakRuns() {
        String text = "a % x\n% full line\nlonger % y\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void keepsControlSpaceBeforeComment() {
        String text = "a\\ % x\nlonger % y\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }

    @Test
    void ignoresEscapedPercent() {
        assertThat(pass.apply("50\\% done\n", context())).isEqualTo("50\\% done\n");
    }
}
