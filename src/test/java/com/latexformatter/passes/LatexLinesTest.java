package com.latexformatter.passes;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class LatexLinesTest {

    @Test
    void splitAndJoinTrackTrailingNewline() {
        assertThat(LatexLines.split("a\nb\n")).containsExactly("a", "b");
        assertThat(LatexLines.split("a\n\nb")).containsExactly("a", "", "b");
        assertThat(LatexLines.split("")).isEmpty();
        assertThat(LatexLines.join(List.of("a", "b"), true)).isEqualTo("a\nb\n");
        assertThat(LatexLines.join(List.of("a", "b"), false)).isEqualTo("a\nb");
    }

    @Test
    void findsFirstUnescapedPercent() {
        assertThat(LatexLines.commentStart("50\\% of % rest")).isEqualTo(8);
        assertThat(LatexLines.commentStart("\\\\% comment")).isEqualTo(2);
        assertThat(LatexLines.commentStart("no comment")).isEqualTo(-1);
        assertThat(LatexLines.codePart("x % y")).isEqualTo("x ");
        assertThat(LatexLines.isCommentOnly("   % only")).isTrue();
    }

    @Test
    void detectsEnvironmentEvents() {
        List<LatexLines.EnvironmentEvent> events =
                LatexLines.environmentEvents("\\begin{ a }x\\end{b} \\\\begin{c}");

        assertThat(events).hasSize(2);
        assertThat(events.get(0).isBegin()).isTrue();
        assertThat(events.get(0).getName()).isEqualTo("a");
        assertThat(events.get(1).isBegin()).isFalse();
        assertThat(events.get(1).getName()).isEqualTo("b");
    }

    @Test
    void detectsRowTerminator() {
        assertThat(LatexLines.endsWithLineBreak("a & b \\\\  ")).isTrue();
        assertThat(LatexLines.endsWithLineBreak("a \\\\\\\\")).isTrue();
        assertThat(LatexLines.endsWithLineBreak("a \\\\\\")).isFalse();
        assertThat(LatexLines.endsWithLineBreak("a \\")).isFalse();
    }

    @Test
    void measuresDisplayWidth() {
        assertThat(LatexLines.displayWidth("abc")).isEqualTo(3);
        assertThat(LatexLines.displayWidth("漢字")).isEqualTo(4);
        assertThat(LatexLines.displayWidth("e\u0301")).isEqualTo(1);
        assertThat(LatexLines.displayWidth("Ti₃C₂Tₓ")).isEqualTo(7);
    }
}
