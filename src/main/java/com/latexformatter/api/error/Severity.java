package com.latexformatter.api.error;

public enum Severity {
    FATAL,   // Document could not be formatted safely, original returned
    ERROR,   // Structural problems reported by the syntax checker
    WARNING, // Suspicious but harmless input
    INFO     // Informational notes produced by passes
}
