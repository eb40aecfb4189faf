package com.latexformatter.patterns;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.latexformatter.api.error.ConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatternStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsBuiltInDefaults() {
        PatternStore store = PatternStore.withDefaults();

        assertThat(store.getConfigDir()).isNull();
        assertThat(store.current().size()).isGreaterThan(20);
        assertThat(sources(store.patternsFor(PatternCategory.COMPOUND_TERM))).contains("two-dimensional", "X-ray");
        assertThat(store.current().getMathPatterns().getEnvironments()).contains("equation", "align*");
        assertThat(store.current().getMathPatterns().getCommandOperators()).contains("pm", "times");
    }

    @Test
    void ordersPatternsByPriorityWithinCategory() {
        List<ProtectedPattern> chemical = PatternStore.withDefaults().patternsFor(PatternCategory.CHEMICAL_FORMULA);

        assertThat(sources(chemical).subList(0, 4))
                .containsExactly("Ti₃C₂Tₓ", "USTB-27-Co", "PPy@S/GA-VD", "HKUST-1");
        assertThat(chemical.get(0).getPriority()).isEqualTo(100);
        assertThat(chemical.get(chemical.size() - 1).getPriority()).isEqualTo(1);
    }

    @Test
    void protectionOrderFollowsCategoryOrder() {
        List<ProtectedPattern> ordered = PatternStore.withDefaults().current().inProtectionOrder();

        assertThat(ordered.get(0).getCategory()).isEqualTo(PatternCategory.INLINE_VERBATIM);
        assertThat(ordered.get(ordered.size() - 1).getCategory()).isEqualTo(PatternCategory.GENERAL_SCIENTIFIC);
    }

    @Test
    void customFileReplacesDefaultCategories() throws IOException {
        Files.writeString(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE),
                "{\"compound_terms\": [\"state-of-the-art\"]}");

        PatternStore store = new PatternStore(tempDir);

        assertThat(sources(store.patternsFor(PatternCategory.COMPOUND_TERM))).containsExactly("state-of-the-art");
        assertThat(store.patternsFor(PatternCategory.CHEMICAL_FORMULA)).isEmpty();
        // math file absent: defaults
        assertThat(store.current().getMathPatterns().getOperators()).contains("=", "\\pm");
    }

    @Test
    void customMathFileFallsBackPerKey() throws IOException {
        Files.writeString(tempDir.resolve(PatternStore.MATH_PATTERNS_FILE), "{\"operators\": [\"=\"]}");

        MathPatterns math = new PatternStore(tempDir).current().getMathPatterns();

        assertThat(math.getOperators()).containsExactly("=");
        assertThat(math.getEnvironments()).contains("equation");
    }

    @Test
    void rejectsInvalidRegex() throws IOException {
        Files.writeString(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE),
                "{\"compound_terms\": [\"(unclosed\"]}");

        assertThatThrownBy(() -> new PatternStore(tempDir))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("compound_terms");
    }

    @Test
    void rejectsUnknownCategory() throws IOException {
        Files.writeString(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE), "{\"spelling\": [\"colou?r\"]}");

        assertThatThrownBy(() -> new PatternStore(tempDir))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("spelling");
    }

    @Test
    void rejectsMalformedJson() throws IOException {
        Files.writeString(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE), "{\"compound_terms\": [");

        assertThatThrownBy(() -> new PatternStore(tempDir)).isInstanceOf(ConfigException.class);
    }

    @Test
    void acceptsCategoryAliases() throws IOException {
        Files.writeString(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE),
                "{\"chemical_formula\": [\"LiFePO4\"], \"reference_ranges\": [{\"pattern\": \"Eqs?\\\\. \\\\d+-\\\\d+\"}]}");

        PatternStore store = new PatternStore(tempDir);

        assertThat(sources(store.patternsFor(PatternCategory.CHEMICAL_FORMULA))).containsExactly("LiFePO4");
        assertThat(store.patternsFor(PatternCategory.REFERENCE_RANGE)).hasSize(1);
    }

    @Test
    void addsAndRemovesPatterns() throws IOException {
        PatternStore store = new PatternStore(tempDir);

        store.addPattern(PatternCategory.COMPOUND_TERM, "state-of-the-art");

        assertThat(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE)).exists();
        assertThat(store.listPatterns().get(PatternCategory.COMPOUND_TERM)).contains("state-of-the-art", "X-ray");
        assertThat(new PatternStore(tempDir).listPatterns().get(PatternCategory.COMPOUND_TERM))
                .contains("state-of-the-art");

        assertThat(store.removePattern(PatternCategory.COMPOUND_TERM, "state-of-the-art")).isTrue();
        assertThat(store.removePattern(PatternCategory.COMPOUND_TERM, "state-of-the-art")).isFalse();
        assertThat(store.listPatterns().get(PatternCategory.COMPOUND_TERM)).doesNotContain("state-of-the-art");
    }

    @Test
    void addingDuplicatePatternKeepsOneEntry() throws IOException {
        PatternStore store = new PatternStore(tempDir);

        store.addPattern(PatternCategory.COMPOUND_TERM, "X-ray");

        assertThat(store.listPatterns().get(PatternCategory.COMPOUND_TERM)).containsOnlyOnce("X-ray");
    }

    @Test
    void rejectsInvalidRegexOnAdd() {
        PatternStore store = new PatternStore(tempDir);

        assertThatThrownBy(() -> store.addPattern(PatternCategory.GENERAL_SCIENTIFIC, "[a-"))
                .isInstanceOf(ConfigException.class);
        assertThat(tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE)).doesNotExist();
    }

    @Test
    void editingRequiresConfigurationDirectory() {
        PatternStore store = PatternStore.withDefaults();

        assertThatThrownBy(() -> store.addPattern(PatternCategory.COMPOUND_TERM, "a-b"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reloadsOnlyWhenFilesChange() throws IOException {
        Path file = tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE);
        Files.writeString(file, "{\"compound_terms\": [\"first-term\"]}");
        PatternStore store = new PatternStore(tempDir);
        PatternSet before = store.current();

        assertThat(store.reloadIfChanged()).isFalse();

        Files.writeString(file, "{\"compound_terms\": [\"second-term\"]}");
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 10_000));

        assertThat(store.reloadIfChanged()).isTrue();
        assertThat(sources(store.patternsFor(PatternCategory.COMPOUND_TERM))).containsExactly("second-term");
        assertThat(sources(before.patternsFor(PatternCategory.COMPOUND_TERM))).containsExactly("first-term");
    }

    @Test
    void reloadsWhenFileIsRemoved() throws IOException {
        Path file = tempDir.resolve(PatternStore.SCIENTIFIC_PATTERNS_FILE);
        Files.writeString(file, "{\"compound_terms\": [\"first-term\"]}");
        PatternStore store = new PatternStore(tempDir);

        Files.delete(file);

        assertThat(store.reloadIfChanged()).isTrue();
        assertThat(sources(store.patternsFor(PatternCategory.COMPOUND_TERM))).contains("X-ray");
    }

    private static List<String> sources(List<ProtectedPattern> patterns) {
        return patterns.stream().map(p -> p.getRegex().pattern()).collect(Collectors.toList());
    }
}
