package com.example.scrubservice.ruleset;

import com.example.scrubservice.config.ScrubProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles a rules document into an immutable {@link RuleSet}.
 *
 * <p>Document format (ClearURLs):</p>
 * <pre>
 * {
 *   "providers": {
 *     "google": {
 *       "urlPattern": "^https?:\\/\\/(?:[a-z0-9-]+\\.)*?google\\.com",
 *       "completeProvider": false,
 *       "rules": ["ved", "bi[a-z]*"],
 *       "referralMarketing": ["referrer"],
 *       "rawRules": ["\\/ref=[^\\/?]*"],
 *       "exceptions": ["^https?:\\/\\/mail\\.google\\.com"],
 *       "redirections": ["^https?:\\/\\/(?:[a-z0-9-]+\\.)*?google\\.com\\/url\\?.*?url=([^&]*)"]
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>A root object without a {@code providers} member is read as the provider mapping itself.
 * A provider with an unusable pattern is excluded and reported as a {@link BuildDiagnostic};
 * the rest of the document still compiles. A document that is not a mapping of provider
 * objects is rejected with {@link MalformedRulesDocumentException}.</p>
 */
@Component
@Slf4j
public class RuleSetCompiler {

    static final String PROVIDERS = "providers";
    static final String URL_PATTERN = "urlPattern";
    static final String COMPLETE_PROVIDER = "completeProvider";
    static final String EXCEPTIONS = "exceptions";
    static final String REDIRECTIONS = "redirections";
    static final String RULES = "rules";
    static final String REFERRAL_MARKETING = "referralMarketing";
    static final String RAW_RULES = "rawRules";

    private static final int IGNORE_CASE = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final int MATCH_CASE = 0;

    private final int maxPatternLength;

    @Autowired
    public RuleSetCompiler(ScrubProperties properties) {
        this(properties.getMaxPatternLength());
    }

    public RuleSetCompiler(int maxPatternLength) {
        if (maxPatternLength <= 0) {
            throw new IllegalArgumentException("maxPatternLength must be positive: " + maxPatternLength);
        }
        this.maxPatternLength = maxPatternLength;
    }

    public RuleSet compile(JsonNode document) {
        return compile(document, null);
    }

    /**
     * Compile a rules document.
     *
     * @param document Parsed rules document
     * @param source   Location the document was read from (informational, may be null)
     * @return Compiled ruleset containing every provider that compiled cleanly
     * @throws MalformedRulesDocumentException if the document is not a mapping of provider objects
     */
    public RuleSet compile(JsonNode document, String source) {
        JsonNode providersNode = providerMapping(document);

        Map<String, Provider> providers = new LinkedHashMap<>();
        List<BuildDiagnostic> diagnostics = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> entries = providersNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = entry.getKey();
            JsonNode providerNode = entry.getValue();

            if (!providerNode.isObject()) {
                throw new MalformedRulesDocumentException(
                        "Provider '" + name + "' is not an object but " + providerNode.getNodeType());
            }

            try {
                providers.put(name, compileProvider(name, providerNode));
            } catch (ProviderRejectedException e) {
                BuildDiagnostic diagnostic = e.getDiagnostic();
                diagnostics.add(diagnostic);
                log.warn("Provider '{}' excluded ({}): {}", name, diagnostic.getKind(), diagnostic.getMessage());
            }
        }

        log.info("Compiled {} providers from {} ({} excluded)",
                providers.size(), source != null ? source : "document", diagnostics.size());
        return new RuleSet(providers, diagnostics, source, Instant.now());
    }

    private JsonNode providerMapping(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new MalformedRulesDocumentException("Rules document must be a JSON object");
        }
        JsonNode providers = document.get(PROVIDERS);
        if (providers == null) {
            return document;
        }
        if (!providers.isObject()) {
            throw new MalformedRulesDocumentException("'" + PROVIDERS + "' must be a JSON object");
        }
        return providers;
    }

    private Provider compileProvider(String name, JsonNode node) throws ProviderRejectedException {
        JsonNode urlPattern = node.get(URL_PATTERN);
        if (urlPattern == null || !urlPattern.isTextual()) {
            throw new ProviderRejectedException(BuildDiagnostic.builder()
                    .providerName(name)
                    .kind(DiagnosticKind.MISSING_URL_PATTERN)
                    .field(URL_PATTERN)
                    .message("urlPattern is missing or not a string")
                    .build());
        }

        return Provider.builder()
                .name(name)
                .urlPattern(compilePattern(name, URL_PATTERN, urlPattern.asText(), IGNORE_CASE))
                .completeProvider(node.path(COMPLETE_PROVIDER).asBoolean(false))
                .exceptions(compileList(name, node, EXCEPTIONS, IGNORE_CASE))
                .redirections(compileList(name, node, REDIRECTIONS, IGNORE_CASE))
                .rules(compileList(name, node, RULES, IGNORE_CASE))
                .referralMarketing(compileList(name, node, REFERRAL_MARKETING, IGNORE_CASE))
                .rawRules(compileList(name, node, RAW_RULES, MATCH_CASE))
                .build();
    }

    private List<Pattern> compileList(String name, JsonNode node, String field, int flags)
            throws ProviderRejectedException {
        JsonNode list = node.get(field);
        if (list == null || list.isNull()) {
            return List.of();
        }
        if (!list.isArray()) {
            throw invalidField(name, field, field + " must be an array of strings");
        }

        List<Pattern> patterns = new ArrayList<>(list.size());
        for (JsonNode element : list) {
            if (!element.isTextual()) {
                throw invalidField(name, field, field + " contains a non-string element: " + element);
            }
            patterns.add(compilePattern(name, field, element.asText(), flags));
        }
        return patterns;
    }

    private Pattern compilePattern(String name, String field, String regex, int flags)
            throws ProviderRejectedException {
        if (regex.length() > maxPatternLength) {
            throw new ProviderRejectedException(BuildDiagnostic.builder()
                    .providerName(name)
                    .kind(DiagnosticKind.PATTERN_TOO_LONG)
                    .field(field)
                    .pattern(regex)
                    .message("Pattern length " + regex.length() + " exceeds limit " + maxPatternLength)
                    .build());
        }
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new ProviderRejectedException(BuildDiagnostic.builder()
                    .providerName(name)
                    .kind(DiagnosticKind.PATTERN_COMPILE_ERROR)
                    .field(field)
                    .pattern(regex)
                    .message(e.getDescription() + " near index " + e.getIndex())
                    .build());
        }
    }

    private static ProviderRejectedException invalidField(String name, String field, String message) {
        return new ProviderRejectedException(BuildDiagnostic.builder()
                .providerName(name)
                .kind(DiagnosticKind.INVALID_FIELD)
                .field(field)
                .message(message)
                .build());
    }

    private static final class ProviderRejectedException extends Exception {

        private final BuildDiagnostic diagnostic;

        ProviderRejectedException(BuildDiagnostic diagnostic) {
            super(diagnostic.getMessage(), null, false, false);
            this.diagnostic = diagnostic;
        }

        BuildDiagnostic getDiagnostic() {
            return diagnostic;
        }
    }
}
