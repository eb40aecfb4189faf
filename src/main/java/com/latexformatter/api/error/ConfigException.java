package com.latexformatter.api.error;

/**
 * Raised when configuration or pattern files are malformed, a pattern fails to compile,
 * or a numeric option is out of range. Always raised at load time, before any document
 * is processed.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
