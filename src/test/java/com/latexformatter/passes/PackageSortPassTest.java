package com.latexformatter.passes;

import static com.latexformatter.passes.PassTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PackageSortPassTest {

    private final PackageSortPass pass = new PackageSortPass();

    @Test
    void sortsConsecutivePackageLines() {
        assertThat(pass.apply("\\usepackage{b}\n\\usepackage{a}\n", context()))
                .isEqualTo("\\usepackage{a}\n\\usepackage{b}\n");
    }

    @Test
    void sortsByNameIgnoringOptionsAndCase() {
        String text = "\\usepackage[utf8]{inputenc}\n\\usepackage{Zeta}\n\\usepackage{amsmath} % math\n";

        assertThat(pass.apply(text, context()))
                .isEqualTo("\\usepackage{amsmath} % math\n\\usepackage[utf8]{inputenc}\n\\usepackage{Zeta}\n");
    }

    @Test
    void blankLinesSeparateGroups() {
        String text = "\\usepackage{c}\n\\usepackage{b}\n\n\\usepackage{a}\n";

        assertThat(pass.apply(text, context())).isEqualTo("\\usepackage{b}\n\\usepackage{c}\n\n\\usepackage{a}\n");
    }

    @Test
    void leavesDocumentBodyAlone() {
        String text = "\\begin{document}\n\\usepackage{b}\n\\usepackage{a}\n\\end{document}\n";

        assertThat(pass.apply(text, context())).isEqualTo(text);
    }
}
