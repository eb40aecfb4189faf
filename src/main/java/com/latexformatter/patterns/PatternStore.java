package com.latexformatter.patterns;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.latexformatter.api.error.ConfigException;
import com.latexformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads protection patterns from a configuration directory and keeps the current
 * {@link PatternSet}. A missing directory or file falls back to the built-in defaults.
 *
 * <p>The store itself is owned by one formatter instance. The pattern set it hands out
 * is immutable, so a reload never affects a document that is already being formatted.
 */
public class PatternStore {
    private static final Logger logger = LoggerUtil.getLogger(PatternStore.class);

    public static final String SCIENTIFIC_PATTERNS_FILE = "scientific_patterns.json";
    public static final String MATH_PATTERNS_FILE = "math_patterns.json";
    private static final String DEFAULT_RESOURCE_DIR = "/patterns/";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path configDir;
    private final Map<String, Long> modificationTimes = new HashMap<>();
    private volatile PatternSet current;

    /**
     * Creates a store reading from {@code configDir}; {@code null} means built-in defaults only.
     */
    public PatternStore(Path configDir) {
        this.configDir = configDir;
        synchronized (this) {
            this.current = load(configDir);
            _recordModificationTimes();
        }
    }

    public static PatternStore withDefaults() {
        return new PatternStore(null);
    }

    /**
     * Loads and validates the pattern files of a directory.
     *
     * @throws ConfigException if a file is malformed or a regex fails to compile
     */
    public static PatternSet load(Path configDir) {
        JsonNode scientific = _readPatternFile(configDir, SCIENTIFIC_PATTERNS_FILE);
        JsonNode math = _readPatternFile(configDir, MATH_PATTERNS_FILE);

        Map<PatternCategory, List<ProtectedPattern>> patterns = _parseScientific(scientific);
        MathPatterns mathPatterns = _parseMath(math, _defaultMath());
        PatternSet set = new PatternSet(patterns, mathPatterns);

        logger.info("Loaded " + set.size() + " protection patterns from "
                + (configDir == null ? "built-in defaults" : configDir.toString()));
        return set;
    }

    public PatternSet current() {
        return current;
    }

    public Path getConfigDir() {
        return configDir;
    }

    public List<ProtectedPattern> patternsFor(PatternCategory category) {
        return current.patternsFor(category);
    }

    /**
     * Reloads the pattern files when one of them was created, modified or removed
     * since the last load.
     *
     * @return true if a new pattern set was loaded
     */
    public synchronized boolean reloadIfChanged() {
        if (configDir == null) {
            return false;
        }
        boolean changed = false;
        for (String fileName : List.of(SCIENTIFIC_PATTERNS_FILE, MATH_PATTERNS_FILE)) {
            long previous = modificationTimes.getOrDefault(fileName, -1L);
            if (previous != _modificationTime(configDir.resolve(fileName))) {
                changed = true;
            }
        }
        if (!changed) {
            return false;
        }

        logger.info("Pattern configuration changed in " + configDir + ", reloading");
        this.current = load(configDir);
        _recordModificationTimes();
        return true;
    }

    /**
     * Adds a pattern to the scientific pattern file of the configuration directory,
     * creating the file from the defaults when needed, and reloads.
     */
    public synchronized void addPattern(PatternCategory category, String regex) throws IOException {
        _compile(category, regex);
        ObjectNode root = _editableScientificTree();
        ArrayNode entries = _arrayFor(root, category);
        for (JsonNode entry : entries) {
            if (regex.equals(_patternText(entry))) {
                logger.fine("Pattern already present in " + category.getConfigKey() + ": " + regex);
                return;
            }
        }
        entries.add(regex);
        _writeScientificTree(root);
        logger.info("Added pattern to " + category.getConfigKey() + ": " + regex);
    }

    /**
     * Removes a pattern from the scientific pattern file and reloads.
     *
     * @return true if the pattern was present
     */
    public synchronized boolean removePattern(PatternCategory category, String regex) throws IOException {
        ObjectNode root = _editableScientificTree();
        ArrayNode entries = _arrayFor(root, category);
        for (int i = 0; i < entries.size(); i++) {
            if (regex.equals(_patternText(entries.get(i)))) {
                entries.remove(i);
                _writeScientificTree(root);
                logger.info("Removed pattern from " + category.getConfigKey() + ": " + regex);
                return true;
            }
        }
        return false;
    }

    /**
     * Pattern sources of the current set, per category, in application order.
     */
    public Map<PatternCategory, List<String>> listPatterns() {
        Map<PatternCategory, List<String>> result = new EnumMap<>(PatternCategory.class);
        PatternSet set = current;
        for (PatternCategory category : PatternCategory.values()) {
            List<String> sources = new ArrayList<>();
            for (ProtectedPattern pattern : set.patternsFor(category)) {
                sources.add(pattern.getRegex().pattern());
            }
            result.put(category, sources);
        }
        return result;
    }

    private ObjectNode _editableScientificTree() {
        if (configDir == null) {
            throw new IllegalStateException("Pattern store has no configuration directory");
        }
        JsonNode tree = _readPatternFile(configDir, SCIENTIFIC_PATTERNS_FILE);
        if (!(tree instanceof ObjectNode)) {
            throw new ConfigException(SCIENTIFIC_PATTERNS_FILE + " must contain a JSON object");
        }
        return ((ObjectNode) tree).deepCopy();
    }

    private static ArrayNode _arrayFor(ObjectNode root, PatternCategory category) {
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (PatternCategory.fromConfigKey(field.getKey()) == category && field.getValue().isArray()) {
                return (ArrayNode) field.getValue();
            }
        }
        return root.putArray(category.getConfigKey());
    }

    private void _writeScientificTree(ObjectNode root) throws IOException {
        Files.createDirectories(configDir);
        MAPPER.writerWithDefaultPrettyPrinter()
                .writeValue(configDir.resolve(SCIENTIFIC_PATTERNS_FILE).toFile(), root);
        this.current = load(configDir);
        _recordModificationTimes();
    }

    private void _recordModificationTimes() {
        modificationTimes.clear();
        if (configDir == null) {
            return;
        }
        for (String fileName : List.of(SCIENTIFIC_PATTERNS_FILE, MATH_PATTERNS_FILE)) {
            modificationTimes.put(fileName, _modificationTime(configDir.resolve(fileName)));
        }
    }

    private static long _modificationTime(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            logger.warning("Cannot read modification time of " + file + ": " + e.getMessage());
            return -1L;
        }
    }

    private static JsonNode _readPatternFile(Path configDir, String fileName) {
        if (configDir != null) {
            Path file = configDir.resolve(fileName);
            if (Files.isRegularFile(file)) {
                try {
                    return MAPPER.readTree(file.toFile());
                } catch (IOException e) {
                    throw new ConfigException("Malformed pattern file " + file + ": " + e.getMessage(), e);
                }
            }
            logger.fine("Pattern file " + file + " not found, using built-in defaults");
        }
        return _readDefaultResource(fileName);
    }

    private static JsonNode _readDefaultResource(String fileName) {
        try (InputStream in = PatternStore.class.getResourceAsStream(DEFAULT_RESOURCE_DIR + fileName)) {
            if (in == null) {
                throw new ConfigException("Built-in pattern resource missing: " + fileName);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigException("Cannot read built-in pattern resource " + fileName + ": " + e.getMessage(), e);
        }
    }

    private static Map<PatternCategory, List<ProtectedPattern>> _parseScientific(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException(SCIENTIFIC_PATTERNS_FILE + " must contain a JSON object of categories");
        }

        Map<PatternCategory, List<ProtectedPattern>> result = new EnumMap<>(PatternCategory.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            PatternCategory category = PatternCategory.fromConfigKey(field.getKey());
            if (category == null) {
                throw new ConfigException("Unknown pattern category '" + field.getKey() + "'");
            }
            JsonNode entries = field.getValue();
            if (!entries.isArray()) {
                throw new ConfigException("Pattern category '" + field.getKey() + "' must be an array");
            }

            List<ProtectedPattern> patterns = result.computeIfAbsent(category, c -> new ArrayList<>());
            int size = entries.size();
            for (int i = 0; i < size; i++) {
                JsonNode entry = entries.get(i);
                int defaultPriority = size - i;
                patterns.add(_parseEntry(category, entry, defaultPriority));
            }
        }
        return result;
    }

    private static ProtectedPattern _parseEntry(PatternCategory category, JsonNode entry, int defaultPriority) {
        if (entry.isTextual()) {
            return new ProtectedPattern(category, _compile(category, entry.asText()), defaultPriority);
        }
        if (entry.isObject()) {
            JsonNode pattern = entry.get("pattern");
            if (pattern == null || !pattern.isTextual()) {
                throw new ConfigException("Pattern entry in '" + category.getConfigKey()
                        + "' is missing a string 'pattern' field: " + entry);
            }
            JsonNode priority = entry.get("priority");
            if (priority != null && !priority.isIntegralNumber()) {
                throw new ConfigException("Priority of pattern '" + pattern.asText() + "' must be an integer");
            }
            int value = priority == null ? defaultPriority : priority.asInt();
            return new ProtectedPattern(category, _compile(category, pattern.asText()), value);
        }
        throw new ConfigException("Invalid pattern entry in '" + category.getConfigKey() + "': " + entry);
    }

    private static String _patternText(JsonNode entry) {
        if (entry.isTextual()) {
            return entry.asText();
        }
        JsonNode pattern = entry.get("pattern");
        return pattern == null ? null : pattern.asText();
    }

    private static Pattern _compile(PatternCategory category, String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new ConfigException("Empty pattern in category '" + category.getConfigKey() + "'");
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigException("Invalid regex in category '" + category.getConfigKey() + "': "
                    + e.getDescription() + " in " + regex, e);
        }
    }

    private static MathPatterns _defaultMath() {
        return _parseMath(_readDefaultResource(MATH_PATTERNS_FILE), null);
    }

    private static MathPatterns _parseMath(JsonNode root, MathPatterns fallback) {
        if (root == null || !root.isObject()) {
            throw new ConfigException(MATH_PATTERNS_FILE + " must contain a JSON object");
        }
        List<String> operators = _stringList(root, "operators",
                fallback == null ? List.of() : fallback.getOperators());
        List<String> environments = _stringList(root, "environments",
                fallback == null ? List.of() : new ArrayList<>(fallback.getEnvironments()));
        List<String> functions = _stringList(root, "functions",
                fallback == null ? List.of() : fallback.getFunctions());
        List<String> symbols = _stringList(root, "symbols",
                fallback == null ? List.of() : fallback.getSymbols());

        for (String operator : operators) {
            if (operator.isBlank() || operator.chars().anyMatch(Character::isWhitespace)) {
                throw new ConfigException("Invalid math operator '" + operator + "'");
            }
        }
        return new MathPatterns(operators, new LinkedHashSet<>(environments), functions, symbols);
    }

    private static List<String> _stringList(JsonNode root, String key, List<String> fallback) {
        JsonNode node = root.get(key);
        if (node == null) {
            return fallback;
        }
        if (!node.isArray()) {
            throw new ConfigException("Math pattern key '" + key + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ConfigException("Math pattern key '" + key + "' must contain only strings, got: " + item);
            }
            values.add(item.asText());
        }
        return values;
    }
}
