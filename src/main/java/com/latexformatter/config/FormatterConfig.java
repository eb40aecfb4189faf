package com.latexformatter.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.latexformatter.api.error.ConfigException;
import com.latexformatter.passes.PassId;

/**
 * Immutable configuration for the formatter. Instances are validated on construction;
 * an out-of-range value fails with {@link ConfigException} instead of being clamped.
 */
public class FormatterConfig {
    public static final int MIN_LINE_LENGTH = 20;
    public static final int MAX_LINE_LENGTH = 1000;
    public static final int MIN_INDENT_SIZE = 1;
    public static final int MAX_INDENT_SIZE = 16;
    public static final int MAX_EMPTY_LINES_LIMIT = 100;

    private final int lineLength;
    private final int indentSize;
    private final int maxEmptyLines;
    private final boolean sortPackages;
    private final boolean wrapLongLines;
    private final boolean normalizeCommands;
    private final boolean alignEnvironments;
    private final boolean alignAmpersands;
    private final boolean fixMathSpacing;
    private final boolean normalizeQuotes;
    private final boolean alignComments;
    private final boolean normalizeRefSpacing;
    private final boolean validateCrossReferences;
    private final Set<String> opaqueEnvironments;
    private final Set<String> noIndentEnvironments;
    private final Set<String> tableEnvironments;
    private final Set<PassId> explicitPasses;
    private final Path patternConfigDir;

    private FormatterConfig(Builder builder) {
        this.lineLength = builder.lineLength;
        this.indentSize = builder.indentSize;
        this.maxEmptyLines = builder.maxEmptyLines;
        this.sortPackages = builder.sortPackages;
        this.wrapLongLines = builder.wrapLongLines;
        this.normalizeCommands = builder.normalizeCommands;
        this.alignEnvironments = builder.alignEnvironments;
        this.alignAmpersands = builder.alignAmpersands;
        this.fixMathSpacing = builder.fixMathSpacing;
        this.normalizeQuotes = builder.normalizeQuotes;
        this.alignComments = builder.alignComments;
        this.normalizeRefSpacing = builder.normalizeRefSpacing;
        this.validateCrossReferences = builder.validateCrossReferences;
        this.opaqueEnvironments = Collections.unmodifiableSet(new LinkedHashSet<>(builder.opaqueEnvironments));
        this.noIndentEnvironments = Collections.unmodifiableSet(new LinkedHashSet<>(builder.noIndentEnvironments));
        this.tableEnvironments = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tableEnvironments));
        this.explicitPasses = builder.explicitPasses == null
                ? null
                : Collections.unmodifiableSet(_copyPasses(builder.explicitPasses));
        this.patternConfigDir = builder.patternConfigDir;
    }

    public static FormatterConfig defaults() {
        return builder().build();
    }

    public int getLineLength() { return lineLength; }
    public int getIndentSize() { return indentSize; }
    public int getMaxEmptyLines() { return maxEmptyLines; }
    public boolean isSortPackages() { return sortPackages; }
    public boolean isWrapLongLines() { return wrapLongLines; }
    public boolean isNormalizeCommands() { return normalizeCommands; }
    public boolean isAlignEnvironments() { return alignEnvironments; }
    public boolean isAlignAmpersands() { return alignAmpersands; }
    public boolean isFixMathSpacing() { return fixMathSpacing; }
    public boolean isNormalizeQuotes() { return normalizeQuotes; }
    public boolean isAlignComments() { return alignComments; }
    public boolean isNormalizeRefSpacing() { return normalizeRefSpacing; }
    public boolean isValidateCrossReferences() { return validateCrossReferences; }
    public Set<String> getOpaqueEnvironments() { return opaqueEnvironments; }
    public Set<String> getNoIndentEnvironments() { return noIndentEnvironments; }
    public Set<String> getTableEnvironments() { return tableEnvironments; }
    public Path getPatternConfigDir() { return patternConfigDir; }

    /**
     * Passes to run. An explicit {@code passes} list wins over the individual toggles.
     */
    public Set<PassId> getEnabledPasses() {
        if (explicitPasses != null) {
            return explicitPasses;
        }
        EnumSet<PassId> enabled = EnumSet.of(PassId.WHITESPACE);
        if (normalizeCommands) {
            enabled.add(PassId.COMMANDS);
        }
        if (sortPackages) {
            enabled.add(PassId.PACKAGES);
        }
        if (alignEnvironments) {
            enabled.add(PassId.INDENTATION);
        }
        if (alignAmpersands) {
            enabled.add(PassId.TABLES);
        }
        if (fixMathSpacing) {
            enabled.add(PassId.MATH);
        }
        if (normalizeQuotes) {
            enabled.add(PassId.QUOTES);
        }
        if (wrapLongLines) {
            enabled.add(PassId.WRAP);
        }
        if (alignComments) {
            enabled.add(PassId.COMMENTS);
        }
        return Collections.unmodifiableSet(enabled);
    }

    /**
     * Snake-case view of this configuration, in the shape {@link ConfigurationLoader} reads.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("line_length", lineLength);
        map.put("indent_size", indentSize);
        map.put("max_empty_lines", maxEmptyLines);
        map.put("sort_packages", sortPackages);
        map.put("wrap_long_lines", wrapLongLines);
        map.put("normalize_commands", normalizeCommands);
        map.put("align_environments", alignEnvironments);
        map.put("align_ampersands", alignAmpersands);
        map.put("fix_math_spacing", fixMathSpacing);
        map.put("normalize_quotes", normalizeQuotes);
        map.put("align_comments", alignComments);
        map.put("normalize_ref_spacing", normalizeRefSpacing);
        map.put("validate_crossreferences", validateCrossReferences);
        map.put("opaque_environments", new ArrayList<>(opaqueEnvironments));
        map.put("no_indent_environments", new ArrayList<>(noIndentEnvironments));
        map.put("table_environments", new ArrayList<>(tableEnvironments));
        if (explicitPasses != null) {
            List<String> names = new ArrayList<>();
            explicitPasses.forEach(p -> names.add(p.getConfigName()));
            map.put("passes", names);
        }
        if (patternConfigDir != null) {
            map.put("pattern_config_dir", patternConfigDir.toString());
        }
        return map;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .lineLength(lineLength)
                .indentSize(indentSize)
                .maxEmptyLines(maxEmptyLines)
                .sortPackages(sortPackages)
                .wrapLongLines(wrapLongLines)
                .normalizeCommands(normalizeCommands)
                .alignEnvironments(alignEnvironments)
                .alignAmpersands(alignAmpersands)
                .fixMathSpacing(fixMathSpacing)
                .normalizeQuotes(normalizeQuotes)
                .alignComments(alignComments)
                .normalizeRefSpacing(normalizeRefSpacing)
                .validateCrossReferences(validateCrossReferences)
                .opaqueEnvironments(opaqueEnvironments)
                .noIndentEnvironments(noIndentEnvironments)
                .tableEnvironments(tableEnvironments)
                .patternConfigDir(patternConfigDir);
        builder.explicitPasses = explicitPasses == null ? null : _copyPasses(explicitPasses);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<PassId> _copyPasses(Collection<PassId> passes) {
        Set<PassId> copy = EnumSet.noneOf(PassId.class);
        copy.addAll(passes);
        return copy;
    }

    public static class Builder {
        private int lineLength = 80;
        private int indentSize = 2;
        private int maxEmptyLines = 2;
        private boolean sortPackages = true;
        private boolean wrapLongLines = false;
        private boolean normalizeCommands = true;
        private boolean alignEnvironments = true;
        private boolean alignAmpersands = true;
        private boolean fixMathSpacing = true;
        private boolean normalizeQuotes = true;
        private boolean alignComments = true;
        private boolean normalizeRefSpacing = true;
        private boolean validateCrossReferences = true;
        private Set<String> opaqueEnvironments =
                new LinkedHashSet<>(List.of("verbatim", "verbatim*", "lstlisting", "minted", "comment"));
        private Set<String> noIndentEnvironments = new LinkedHashSet<>(List.of("document"));
        private Set<String> tableEnvironments = new LinkedHashSet<>(
                List.of("tabular", "tabular*", "tabularx", "tabulary", "longtable", "array"));
        private Set<PassId> explicitPasses;
        private Path patternConfigDir;

        public Builder lineLength(int lineLength) {
            this.lineLength = lineLength;
            return this;
        }

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder maxEmptyLines(int maxEmptyLines) {
            this.maxEmptyLines = maxEmptyLines;
            return this;
        }

        public Builder sortPackages(boolean sortPackages) {
            this.sortPackages = sortPackages;
            return this;
        }

        public Builder wrapLongLines(boolean wrapLongLines) {
            this.wrapLongLines = wrapLongLines;
            return this;
        }

        public Builder normalizeCommands(boolean normalizeCommands) {
            this.normalizeCommands = normalizeCommands;
            return this;
        }

        public Builder alignEnvironments(boolean alignEnvironments) {
            this.alignEnvironments = alignEnvironments;
            return this;
        }

        public Builder alignAmpersands(boolean alignAmpersands) {
            this.alignAmpersands = alignAmpersands;
            return this;
        }

        public Builder fixMathSpacing(boolean fixMathSpacing) {
            this.fixMathSpacing = fixMathSpacing;
            return this;
        }

        public Builder normalizeQuotes(boolean normalizeQuotes) {
            this.normalizeQuotes = normalizeQuotes;
            return this;
        }

        public Builder alignComments(boolean alignComments) {
            this.alignComments = alignComments;
            return this;
        }

        public Builder normalizeRefSpacing(boolean normalizeRefSpacing) {
            this.normalizeRefSpacing = normalizeRefSpacing;
            return this;
        }

        public Builder validateCrossReferences(boolean validateCrossReferences) {
            this.validateCrossReferences = validateCrossReferences;
            return this;
        }

        public Builder opaqueEnvironments(Set<String> opaqueEnvironments) {
            this.opaqueEnvironments = new LinkedHashSet<>(opaqueEnvironments);
            return this;
        }

        public Builder noIndentEnvironments(Set<String> noIndentEnvironments) {
            this.noIndentEnvironments = new LinkedHashSet<>(noIndentEnvironments);
            return this;
        }

        public Builder tableEnvironments(Set<String> tableEnvironments) {
            this.tableEnvironments = new LinkedHashSet<>(tableEnvironments);
            return this;
        }

        public Builder passes(Set<PassId> passes) {
            this.explicitPasses = passes == null ? null : _copyPasses(passes);
            return this;
        }

        public Builder patternConfigDir(Path patternConfigDir) {
            this.patternConfigDir = patternConfigDir;
            return this;
        }

        public FormatterConfig build() {
            _requireRange("line_length", lineLength, MIN_LINE_LENGTH, MAX_LINE_LENGTH);
            _requireRange("indent_size", indentSize, MIN_INDENT_SIZE, MAX_INDENT_SIZE);
            _requireRange("max_empty_lines", maxEmptyLines, 0, MAX_EMPTY_LINES_LIMIT);
            return new FormatterConfig(this);
        }

        private static void _requireRange(String key, int value, int min, int max) {
            if (value < min || value > max) {
                throw new ConfigException("Configuration value '" + key + "' = " + value
                        + " is outside acceptable range (" + min + "-" + max + ")");
            }
        }
    }
}
