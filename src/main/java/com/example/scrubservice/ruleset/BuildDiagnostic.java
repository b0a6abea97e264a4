package com.example.scrubservice.ruleset;

import lombok.Builder;
import lombok.Value;

/**
 * Describes why a provider was left out of a compiled {@link RuleSet}.
 */
@Value
@Builder
public class BuildDiagnostic {

    String providerName;

    DiagnosticKind kind;

    /**
     * Document field holding the offending value (e.g. "rules", "urlPattern").
     */
    String field;

    /**
     * Offending pattern string, when the problem is a single pattern.
     */
    String pattern;

    String message;
}
