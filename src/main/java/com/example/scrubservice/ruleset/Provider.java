package com.example.scrubservice.ruleset;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A compiled provider: a named bundle of cleaning rules for URLs matching {@link #getUrlPattern()}.
 *
 * <p>All patterns are compiled once by {@link RuleSetCompiler}. The URL pattern, exceptions,
 * redirections and the two query-key rule lists are case-insensitive and are prefix-matched;
 * raw rules are case-sensitive and applied anywhere in the URL.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
@Getter
@ToString(of = {"name", "completeProvider"})
public final class Provider {

    private final String name;

    private final Pattern urlPattern;

    /**
     * When true every matching URL is blocked instead of cleaned.
     */
    private final boolean completeProvider;

    private final List<Pattern> exceptions;

    /**
     * Patterns whose first capture group holds an embedded redirect target.
     */
    private final List<Pattern> redirections;

    /**
     * Patterns tested against query parameter names.
     */
    private final List<Pattern> rules;

    /**
     * Second query parameter rule list, applied after {@link #getRules()}.
     */
    private final List<Pattern> referralMarketing;

    /**
     * Patterns removed from the whole URL string.
     */
    private final List<Pattern> rawRules;

    @Builder
    private Provider(String name,
                     Pattern urlPattern,
                     boolean completeProvider,
                     List<Pattern> exceptions,
                     List<Pattern> redirections,
                     List<Pattern> rules,
                     List<Pattern> referralMarketing,
                     List<Pattern> rawRules) {
        if (name == null || urlPattern == null) {
            throw new IllegalArgumentException("Provider requires a name and a URL pattern");
        }
        this.name = name;
        this.urlPattern = urlPattern;
        this.completeProvider = completeProvider;
        this.exceptions = copyOf(exceptions);
        this.redirections = copyOf(redirections);
        this.rules = copyOf(rules);
        this.referralMarketing = copyOf(referralMarketing);
        this.rawRules = copyOf(rawRules);
    }

    private static List<Pattern> copyOf(List<Pattern> patterns) {
        return patterns == null ? List.of() : List.copyOf(patterns);
    }
}
