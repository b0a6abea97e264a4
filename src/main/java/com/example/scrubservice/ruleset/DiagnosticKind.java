package com.example.scrubservice.ruleset;

/**
 * Reasons a provider can be excluded from a compiled {@link RuleSet}.
 */
public enum DiagnosticKind {

    /**
     * A pattern string is not a valid regular expression.
     */
    PATTERN_COMPILE_ERROR,

    /**
     * A pattern string exceeds the configured maximum length.
     */
    PATTERN_TOO_LONG,

    /**
     * The provider has no textual {@code urlPattern}.
     */
    MISSING_URL_PATTERN,

    /**
     * A pattern list field is not an array of strings.
     */
    INVALID_FIELD
}
