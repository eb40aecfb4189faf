package com.latexformatter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.latexformatter.api.error.ConfigException;
import com.latexformatter.passes.PassId;
import com.latexformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads formatter configuration from JSON, YAML or TOML files, with fallback to the
 * embedded defaults. Malformed files and out-of-range values fail fast.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    private static final String TOML_TOOL_SECTION = "latex-formatter";

    private static volatile FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file. A null or missing path yields the default
     * configuration; a file that exists but cannot be parsed raises {@link ConfigException}.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        logger.info("Loading configuration from: " + configPath);
        Map<String, Object> values;
        try {
            values = _readMap(configPath);
        } catch (IOException e) {
            throw new ConfigException("Error parsing configuration file " + configPath + ": " + e.getMessage(), e);
        }

        FormatterConfig config = fromMap(values);
        logger.info("Configuration loaded successfully from " + configPath);
        return config;
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static FormatterConfig loadDefaultConfig() {
        FormatterConfig cached = _cachedDefaultConfig;
        if (cached != null) {
            return cached;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.warning("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                _cachedDefaultConfig = FormatterConfig.defaults();
                return _cachedDefaultConfig;
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = fromMap(config == null ? Map.of() : config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            throw new ConfigException("Failed to load default configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a configuration from a parsed key/value map. Unknown keys are ignored.
     */
    public static FormatterConfig fromMap(Map<String, Object> values) {
        FormatterConfig.Builder builder = FormatterConfig.builder();

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            switch (key) {
                case "line_length" -> builder.lineLength(_requireInt(key, value));
                case "indent_size" -> builder.indentSize(_requireInt(key, value));
                case "max_empty_lines" -> builder.maxEmptyLines(_requireInt(key, value));
                case "sort_packages" -> builder.sortPackages(_requireBoolean(key, value));
                case "wrap_long_lines" -> builder.wrapLongLines(_requireBoolean(key, value));
                case "normalize_commands" -> builder.normalizeCommands(_requireBoolean(key, value));
                case "align_environments" -> builder.alignEnvironments(_requireBoolean(key, value));
                case "align_ampersands" -> builder.alignAmpersands(_requireBoolean(key, value));
                case "fix_math_spacing" -> builder.fixMathSpacing(_requireBoolean(key, value));
                case "normalize_quotes" -> builder.normalizeQuotes(_requireBoolean(key, value));
                case "align_comments" -> builder.alignComments(_requireBoolean(key, value));
                case "normalize_ref_spacing" -> builder.normalizeRefSpacing(_requireBoolean(key, value));
                case "validate_crossreferences" -> builder.validateCrossReferences(_requireBoolean(key, value));
                case "opaque_environments" -> builder.opaqueEnvironments(_requireStringSet(key, value));
                case "no_indent_environments" -> builder.noIndentEnvironments(_requireStringSet(key, value));
                case "table_environments" -> builder.tableEnvironments(_requireStringSet(key, value));
                case "passes" -> builder.passes(_requirePassSet(key, value));
                case "pattern_config_dir" -> builder.patternConfigDir(
                        value == null ? null : Paths.get(value.toString()));
                default -> logger.fine("Ignoring unknown configuration key '" + key + "'");
            }
        }

        return builder.build();
    }

    /**
     * Saves configuration to a YAML file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), config.toMap());

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _readMap(Path configPath) throws IOException {
        String fileName = configPath.getFileName().toString().toLowerCase(Locale.ROOT);
        Map<String, Object> values;

        if (fileName.endsWith(".json")) {
            values = new ObjectMapper().readValue(configPath.toFile(), Map.class);
        } else if (fileName.endsWith(".toml")) {
            values = new TomlMapper().readValue(configPath.toFile(), Map.class);
            values = _unwrapToolSection(values);
        } else {
            values = new ObjectMapper(new YAMLFactory()).readValue(configPath.toFile(), Map.class);
        }

        return values == null ? new HashMap<>() : values;
    }

    /**
     * pyproject.toml keeps formatter settings under {@code [tool.latex-formatter]}.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> _unwrapToolSection(Map<String, Object> values) {
        if (values == null) {
            return null;
        }
        Object tool = values.get("tool");
        if (tool instanceof Map && ((Map<String, Object>) tool).get(TOML_TOOL_SECTION) instanceof Map) {
            return (Map<String, Object>) ((Map<String, Object>) tool).get(TOML_TOOL_SECTION);
        }
        if (values.get(TOML_TOOL_SECTION) instanceof Map) {
            return (Map<String, Object>) values.get(TOML_TOOL_SECTION);
        }
        return values;
    }

    private static int _requireInt(String key, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long longValue = ((Number) value).longValue();
            if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
                throw new ConfigException("Configuration value '" + key + "' is out of range: " + value);
            }
            return (int) longValue;
        }
        throw new ConfigException("Configuration value '" + key + "' must be an integer, got: " + value);
    }

    private static boolean _requireBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new ConfigException("Configuration value '" + key + "' must be a boolean, got: " + value);
    }

    private static Set<String> _requireStringSet(String key, Object value) {
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof String) {
            result.add(((String) value).trim());
            return result;
        }
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (!(item instanceof String)) {
                    throw new ConfigException("Configuration value '" + key + "' must contain only strings, got: " + item);
                }
                result.add(((String) item).trim());
            }
            return result;
        }
        throw new ConfigException("Configuration value '" + key + "' must be a list of strings, got: " + value);
    }

    private static Set<PassId> _requirePassSet(String key, Object value) {
        Set<PassId> passes = EnumSet.noneOf(PassId.class);
        for (String name : _requireStringSet(key, value)) {
            try {
                passes.add(PassId.fromConfigName(name));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Configuration value '" + key + "' names an unknown pass: " + name, e);
            }
        }
        return passes;
    }
}
