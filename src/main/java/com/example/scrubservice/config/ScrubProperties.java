package com.example.scrubservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the URL cleaning ruleset.
 *
 * <h3>Configuration Example:</h3>
 * <pre>
 * scrub:
 *   rules:
 *     location: https://kevinroebert.gitlab.io/ClearUrls/data/data.minify.json
 *     load-on-startup: false
 *     max-pattern-length: 4096
 *     connect-timeout-ms: 5000
 *     read-timeout-ms: 15000
 * </pre>
 *
 * <p>{@code location} accepts http(s) URLs as well as {@code classpath:} and {@code file:}
 * resource locations.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "scrub.rules")
@Data
public class ScrubProperties {

    public static final String DEFAULT_LOCATION = "https://kevinroebert.gitlab.io/ClearUrls/data/data.minify.json";

    /**
     * Where the rules document is retrieved from.
     * Default: the ClearURLs minified rules file
     */
    private String location = DEFAULT_LOCATION;

    /**
     * Retrieve and publish the ruleset while the application starts.
     * When false the ruleset is retrieved on first use.
     * Default: false
     */
    private boolean loadOnStartup = false;

    /**
     * Longest pattern string accepted when compiling a provider.
     * Default: 4096 characters
     */
    private int maxPatternLength = 4096;

    /**
     * Connect timeout for http(s) retrieval.
     * Default: 5000ms
     */
    private int connectTimeoutMs = 5000;

    /**
     * Read timeout for http(s) retrieval.
     * Default: 15000ms
     */
    private int readTimeoutMs = 15000;
}
