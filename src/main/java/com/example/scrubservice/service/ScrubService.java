package com.example.scrubservice.service;

import com.example.scrubservice.engine.PercentDecoder;
import com.example.scrubservice.engine.UrlSanitizer;
import com.example.scrubservice.extraction.UrlExtractor;
import com.example.scrubservice.model.ScrubReport;
import com.example.scrubservice.model.Verdict;
import com.example.scrubservice.ruleset.MalformedRulesDocumentException;
import com.example.scrubservice.ruleset.RuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scrubs single URLs and the links found in free-form text with the published ruleset.
 *
 * <p>If no ruleset has been published yet, the first call loads one from the configured
 * source.</p>
 */
@Service
@Slf4j
public class ScrubService {

    private final UrlExtractor urlExtractor;
    private final UrlSanitizer sanitizer;
    private final RuleSetRegistry registry;
    private final RuleSetRefreshService refreshService;
    private final ScrubMetricsService metricsService;

    private final Object initialLoadLock = new Object();

    public ScrubService(UrlExtractor urlExtractor,
                        UrlSanitizer sanitizer,
                        RuleSetRegistry registry,
                        RuleSetRefreshService refreshService,
                        ScrubMetricsService metricsService) {
        this.urlExtractor = urlExtractor;
        this.sanitizer = sanitizer;
        this.registry = registry;
        this.refreshService = refreshService;
        this.metricsService = metricsService;
    }

    /**
     * Evaluate one URL against the current ruleset.
     *
     * @throws RuleSetUnavailableException if no ruleset is published and loading one fails
     */
    public Verdict scrubUrl(String url) {
        return evaluate(url, currentRuleSet());
    }

    /**
     * Scrub every distinct http(s) link found in the text.
     *
     * <p>A link is reported as cleaned only if the result differs from it beyond letter case
     * and percent-encoding. Blocked links are reported separately.</p>
     *
     * @param content Free-form text
     * @return Cleaned and blocked links; empty lists when nothing changed
     * @throws RuleSetUnavailableException if no ruleset is published and loading one fails
     */
    public ScrubReport scrubText(String content) {
        List<String> links = urlExtractor.extractUrls(content);
        if (links.isEmpty()) {
            return ScrubReport.builder().build();
        }

        RuleSet ruleSet = currentRuleSet();
        List<String> cleanedLinks = new ArrayList<>();
        List<String> blockedLinks = new ArrayList<>();

        for (String link : links) {
            Verdict verdict = evaluate(link, ruleSet);
            if (verdict.isBlocked()) {
                blockedLinks.add(link);
                continue;
            }
            String cleaned = verdict.getUrl().orElseThrow();
            if (differsMeaningfully(link, cleaned)) {
                cleanedLinks.add(cleaned);
            }
        }

        log.info("Scrubbed text with {} links: {} cleaned, {} blocked",
                links.size(), cleanedLinks.size(), blockedLinks.size());

        return ScrubReport.builder()
                .cleanedLinks(cleanedLinks)
                .blockedLinks(blockedLinks)
                .message(summary(cleanedLinks.size()))
                .build();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        RuleSet ruleSet = registry.current().orElse(null);
        stats.put("published", ruleSet != null);
        stats.put("providers", ruleSet != null ? ruleSet.size() : 0);
        stats.put("excludedProviders", ruleSet != null ? ruleSet.getDiagnostics().size() : 0);
        stats.put("loadedFrom", ruleSet != null ? ruleSet.getSource() : null);
        stats.put("loadedAt", ruleSet != null ? ruleSet.getLoadedAt().toString() : null);
        stats.put("sourceLocation", refreshService.getSourceLocation());
        stats.put("evaluations", metricsService.getStatistics());
        return stats;
    }

    RuleSet currentRuleSet() {
        return registry.current().orElseGet(this::loadInitialRuleSet);
    }

    private RuleSet loadInitialRuleSet() {
        synchronized (initialLoadLock) {
            return registry.current().orElseGet(() -> {
                try {
                    return refreshService.refresh(null);
                } catch (RulesTransportException | MalformedRulesDocumentException e) {
                    throw new RuleSetUnavailableException("No ruleset published and initial load failed", e);
                }
            });
        }
    }

    private Verdict evaluate(String url, RuleSet ruleSet) {
        long start = System.nanoTime();
        Verdict verdict = sanitizer.evaluate(url, ruleSet);
        metricsService.recordEvaluation(verdict, System.nanoTime() - start);
        log.debug("{} -> {}", url, verdict);
        return verdict;
    }

    private static boolean differsMeaningfully(String link, String cleaned) {
        String original = link.toLowerCase(Locale.ROOT);
        return !original.equals(cleaned.toLowerCase(Locale.ROOT))
                && !original.equals(PercentDecoder.decode(cleaned).toLowerCase(Locale.ROOT));
    }

    private static String summary(int cleanedCount) {
        if (cleanedCount == 0) {
            return null;
        }
        return cleanedCount == 1 ? "I scrubbed this for you" : "I scrubbed these for you";
    }
}
