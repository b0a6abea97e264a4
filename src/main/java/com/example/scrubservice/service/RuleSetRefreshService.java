package com.example.scrubservice.service;

import com.example.scrubservice.config.ScrubProperties;
import com.example.scrubservice.ruleset.MalformedRulesDocumentException;
import com.example.scrubservice.ruleset.RuleSet;
import com.example.scrubservice.ruleset.RuleSetCompiler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Retrieves a rules document, compiles it and publishes the result.
 *
 * <p>http(s) locations are downloaded with {@link RestTemplate}; any other location
 * ({@code classpath:}, {@code file:}) is read through Spring's {@link ResourceLoader}.</p>
 *
 * <p>On any failure the previously published ruleset stays in place:</p>
 * <ul>
 *   <li>{@link RulesTransportException} - the document could not be retrieved</li>
 *   <li>{@link MalformedRulesDocumentException} - the document is not JSON or not a provider mapping</li>
 * </ul>
 */
@Service
@Slf4j
public class RuleSetRefreshService {

    private final RestTemplate restTemplate;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RuleSetCompiler compiler;
    private final RuleSetRegistry registry;
    private final boolean loadOnStartup;

    // Location used when refresh is called without one
    private final AtomicReference<String> sourceLocation;

    public RuleSetRefreshService(@Qualifier("rulesRestTemplate") RestTemplate restTemplate,
                                 ResourceLoader resourceLoader,
                                 ObjectMapper objectMapper,
                                 RuleSetCompiler compiler,
                                 RuleSetRegistry registry,
                                 ScrubProperties properties) {
        this.restTemplate = restTemplate;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.compiler = compiler;
        this.registry = registry;
        this.loadOnStartup = properties.isLoadOnStartup();
        this.sourceLocation = new AtomicReference<>(properties.getLocation());
    }

    @PostConstruct
    public void init() {
        if (!loadOnStartup) {
            log.info("Rules will be loaded on first use from {}", sourceLocation.get());
            return;
        }
        try {
            refresh(null);
        } catch (RulesTransportException | MalformedRulesDocumentException e) {
            log.error("Initial rules load from {} failed; will retry on first use", sourceLocation.get(), e);
        }
    }

    /**
     * Retrieve, compile and publish a rules document.
     *
     * <p>When {@code location} is given and differs from the current source, a successful
     * refresh makes it the source for later refreshes. Refreshes are serialized, so the
     * published ruleset always comes from the recorded source.</p>
     *
     * @param location Document location, or null/blank for the current source
     * @return The newly published ruleset
     */
    public synchronized RuleSet refresh(String location) {
        String current = sourceLocation.get();
        String target = StringUtils.hasText(location) ? location.trim() : current;

        log.debug("Downloading rules data from {}", target);
        String body = fetch(target);
        RuleSet ruleSet = compiler.compile(parse(body, target), target);
        registry.publish(ruleSet);

        if (!target.equals(current)) {
            sourceLocation.set(target);
            log.info("Rules source changed from {} to {}", current, target);
        }
        return ruleSet;
    }

    public String getSourceLocation() {
        return sourceLocation.get();
    }

    private String fetch(String location) {
        try {
            if (isHttp(location)) {
                String body = restTemplate.getForObject(location, String.class);
                if (body == null) {
                    throw new RulesTransportException("Empty response body from " + location);
                }
                return body;
            }

            Resource resource = resourceLoader.getResource(location);
            try (InputStream in = resource.getInputStream()) {
                return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            }
        } catch (RestClientException | IOException e) {
            throw new RulesTransportException("Could not retrieve rules from " + location, e);
        }
    }

    private JsonNode parse(String body, String location) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedRulesDocumentException("Rules document from " + location + " is not valid JSON", e);
        }
    }

    private static boolean isHttp(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
