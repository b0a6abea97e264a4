package com.example.scrubservice.engine;

import com.example.scrubservice.model.Verdict;
import com.example.scrubservice.model.VerdictType;
import com.example.scrubservice.ruleset.RuleSet;
import com.example.scrubservice.ruleset.RuleSetCompiler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlSanitizerTest {

    private static final String EXAMPLE_PROVIDER =
            "\"example\": {\"urlPattern\": \"^https://example\\\\.com\", \"rules\": [\"^utm_\"]}";

    private static final String REDIRECT_PROVIDER =
            "\"redirector\": {\"urlPattern\": \"^https://go\\\\.example\","
                    + " \"redirections\": [\"^https://go\\\\.example/\\\\?u=([^&]*)\"]}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RuleSetCompiler compiler = new RuleSetCompiler(4096);

    private UrlSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new UrlSanitizer();
    }

    // ========== Query Rules ==========

    @Test
    void shouldRemoveTrackingParameter() {
        // Given
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        // When
        Verdict verdict = sanitizer.evaluate("https://example.com/a?utm_source=x&id=1", ruleSet);

        // Then
        assertEquals(VerdictType.CLEANED, verdict.getType());
        assertEquals("https://example.com/a?id=1", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldLeaveNonMatchingUrlUnchanged() {
        // Given
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        // When
        Verdict verdict = sanitizer.evaluate("https://other.com/a?utm_source=x", ruleSet);

        // Then
        assertEquals(Verdict.unchanged("https://other.com/a?utm_source=x", List.of()), verdict);
    }

    @Test
    void shouldLeaveUrlUnchangedWhenNoParameterMatches() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        Verdict verdict = sanitizer.evaluate("https://example.com/a?id=1&page=2", ruleSet);

        assertEquals(VerdictType.UNCHANGED, verdict.getType());
        assertEquals("https://example.com/a?id=1&page=2", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldKeepDuplicateKeysAndOrder() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        Verdict verdict = sanitizer.evaluate(
                "https://example.com/?id=1&utm_source=x&id=2&utm_medium=y&flag", ruleSet);

        assertEquals("https://example.com/?id=1&id=2&flag", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldMatchUrlPatternAndKeysIgnoringCase() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        Verdict verdict = sanitizer.evaluate("HTTPS://EXAMPLE.COM/a?UTM_SOURCE=x&Id=1", ruleSet);

        assertEquals("https://EXAMPLE.COM/a?Id=1", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldLowerCaseSchemeAndDropEmptyFragment() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        assertEquals(Verdict.cleaned("https://example.com/a", List.of()),
                sanitizer.evaluate("HTTPS://example.com/a?utm_source=x", ruleSet));
        assertEquals(Verdict.cleaned("https://example.com/a", List.of()),
                sanitizer.evaluate("https://example.com/a?utm_source=x#", ruleSet));
    }

    @Test
    void shouldMatchRulesAgainstDecodedKeys() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        Verdict verdict = sanitizer.evaluate("https://example.com/a?utm%5Fsource=x&q=a+b%20c", ruleSet);

        assertEquals("https://example.com/a?q=a+b%20c", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldDropQueryDelimiterWhenAllParametersRemoved() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        assertEquals("https://example.com/a",
                sanitizer.evaluate("https://example.com/a?utm_source=x", ruleSet).getUrl().orElseThrow());
        assertEquals("https://example.com/a#top",
                sanitizer.evaluate("https://example.com/a?utm_source=x#top", ruleSet).getUrl().orElseThrow());
    }

    @Test
    void shouldPreserveParamsAndFragment() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER);

        Verdict verdict = sanitizer.evaluate("https://example.com/p;v=1?utm_source=x&id=2#frag", ruleSet);

        assertEquals("https://example.com/p;v=1?id=2#frag", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldApplyReferralMarketingAfterRules() {
        // Given
        RuleSet ruleSet = ruleSet("\"example\": {\"urlPattern\": \"^https://example\\\\.com\","
                + " \"rules\": [\"^utm_\"], \"referralMarketing\": [\"^ref$\"]}");

        // When
        Verdict verdict = sanitizer.evaluate("https://example.com/?ref=a&referrer=b&utm_x=1", ruleSet);

        // Then
        assertEquals("https://example.com/?referrer=b", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldTreatRulesAsPrefixMatches() {
        RuleSet ruleSet = ruleSet("\"example\": {\"urlPattern\": \"^https://example\\\\.com\", \"rules\": [\"ref\"]}");

        Verdict verdict = sanitizer.evaluate("https://example.com/?ref=1&referrer=2&xref=3", ruleSet);

        assertEquals("https://example.com/?xref=3", verdict.getUrl().orElseThrow());
    }

    // ========== Raw Rules ==========

    @Test
    void shouldRemoveRawRuleMatchesEverywhere() {
        RuleSet ruleSet = ruleSet("\"shop\": {\"urlPattern\": \"^https://shop\\\\.example\","
                + " \"rawRules\": [\"/ref=[^/?]*\"]}");

        Verdict verdict = sanitizer.evaluate("https://shop.example/item/ref=abc/x/ref=def?x=1", ruleSet);

        assertEquals("https://shop.example/item/x?x=1", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldApplyRawRulesCaseSensitively() {
        RuleSet ruleSet = ruleSet("\"shop\": {\"urlPattern\": \"^https://shop\\\\.example\","
                + " \"rawRules\": [\"/ref=[^/?]*\"]}");

        Verdict verdict = sanitizer.evaluate("https://shop.example/item/REF=abc/details", ruleSet);

        assertEquals(VerdictType.UNCHANGED, verdict.getType());
    }

    @Test
    void shouldApplyRawRulesInOrderOnPreviousResult() {
        RuleSet ruleSet = ruleSet("\"shop\": {\"urlPattern\": \"^https://shop\\\\.example\","
                + " \"rawRules\": [\"/tracking\", \"/a/b\"]}");

        Verdict verdict = sanitizer.evaluate("https://shop.example/a/tracking/b/c", ruleSet);

        assertEquals("https://shop.example/c", verdict.getUrl().orElseThrow());
    }

    // ========== Complete Providers ==========

    @Test
    void shouldBlockUrlMatchedByCompleteProvider() {
        RuleSet ruleSet = ruleSet("\"ads\": {\"urlPattern\": \"^https://go\\\\.example\", \"completeProvider\": true}");

        Verdict verdict = sanitizer.evaluate("https://go.example/x", ruleSet);

        assertTrue(verdict.isBlocked());
        assertTrue(verdict.getUrl().isEmpty());
    }

    @Test
    void shouldBlockEvenAfterEarlierProviderCleaned() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER + ","
                + "\"blockAll\": {\"urlPattern\": \"^https://example\\\\.com/ads\", \"completeProvider\": true},"
                + "\"later\": {\"urlPattern\": \".*\", \"rules\": [\"id\"]}");

        Verdict verdict = sanitizer.evaluate("https://example.com/ads?utm_source=x&id=1", ruleSet);

        assertEquals(VerdictType.BLOCKED, verdict.getType());
    }

    @Test
    void shouldBlockRedirectTargetMatchedByCompleteProvider() {
        RuleSet ruleSet = ruleSet(REDIRECT_PROVIDER + ","
                + "\"tracker\": {\"urlPattern\": \"^https://tracker\\\\.example\", \"completeProvider\": true}");

        Verdict verdict = sanitizer.evaluate("https://go.example/?u=" + encode("https://tracker.example/p"), ruleSet);

        assertTrue(verdict.isBlocked());
    }

    // ========== Exceptions ==========

    @Test
    void shouldSkipProviderWhenExceptionMatches() {
        // Given
        RuleSet ruleSet = ruleSet("\"example\": {\"urlPattern\": \"^https://example\\\\.com\","
                + " \"exceptions\": [\"^https://example\\\\.com/keep\"],"
                + " \"rules\": [\"^utm_\"], \"rawRules\": [\"/keep\"]}");

        // When
        Verdict verdict = sanitizer.evaluate("https://example.com/keep?utm_source=x", ruleSet);

        // Then
        assertEquals(Verdict.unchanged("https://example.com/keep?utm_source=x", List.of()), verdict);
    }

    @Test
    void shouldStillRunOtherProvidersWhenOneIsExcepted() {
        RuleSet ruleSet = ruleSet("\"shop\": {\"urlPattern\": \"^https://shop\\\\.example\","
                + " \"exceptions\": [\"^https://shop\\\\.example/checkout\"], \"rules\": [\"sid\"]},"
                + "\"global\": {\"urlPattern\": \".*\", \"rules\": [\"utm_\"]}");

        Verdict verdict = sanitizer.evaluate("https://shop.example/checkout?sid=1&utm_source=x", ruleSet);

        assertEquals("https://shop.example/checkout?sid=1", verdict.getUrl().orElseThrow());
    }

    // ========== Redirections ==========

    @Test
    void shouldFollowRedirectAndCleanTarget() {
        // Given
        RuleSet ruleSet = ruleSet(REDIRECT_PROVIDER + "," + EXAMPLE_PROVIDER);
        String url = "https://go.example/?u=" + encode("https://example.com/a?utm_source=x&id=1") + "&foo=bar";

        // When
        Verdict verdict = sanitizer.evaluate(url, ruleSet);

        // Then
        assertEquals(VerdictType.CLEANED, verdict.getType());
        assertEquals("https://example.com/a?id=1", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldReportRedirectToCleanTargetAsUnchanged() {
        RuleSet ruleSet = ruleSet(REDIRECT_PROVIDER + "," + EXAMPLE_PROVIDER);
        String url = "https://go.example/?u=" + encode("https://dest.example/");

        Verdict verdict = sanitizer.evaluate(url, ruleSet);

        assertEquals(VerdictType.UNCHANGED, verdict.getType());
        assertEquals(Verdict.unchanged("https://dest.example/", List.of()), verdict);
    }

    @Test
    void shouldEqualNestedEvaluationOfDecodedTarget() {
        RuleSet ruleSet = ruleSet(REDIRECT_PROVIDER + "," + EXAMPLE_PROVIDER);
        List<String> targets = List.of(
                "https://example.com/a?utm_source=x&id=1",
                "https://dest.example/",
                "https://example.com/clean?id=1");

        for (String target : targets) {
            Verdict outer = sanitizer.evaluate("https://go.example/?u=" + encode(target), ruleSet);
            Verdict inner = sanitizer.evaluate(target, ruleSet, RedirectDepth.NO_MORE_REDIRECTS);

            assertEquals(inner, outer, "redirect to " + target);
            assertEquals(inner.getType(), outer.getType(), "redirect to " + target);
        }
    }

    @Test
    void shouldNotFollowSecondRedirect() {
        // Given
        RuleSet ruleSet = ruleSet(REDIRECT_PROVIDER + "," + EXAMPLE_PROVIDER);
        String finalTarget = "https://example.com/a?utm_source=x";
        String secondHop = "https://go.example/?u=" + encode(finalTarget);
        String firstHop = "https://go.example/?u=" + encode(secondHop);
        String url = "https://go.example/?u=" + encode(firstHop);

        // When
        Verdict verdict = sanitizer.evaluate(url, ruleSet);

        // Then: the first hop is followed, the second only replaced in place, the third never
        assertEquals(VerdictType.CLEANED, verdict.getType());
        assertEquals(secondHop, verdict.getUrl().orElseThrow());
        assertEquals(sanitizer.evaluate(firstHop, ruleSet, RedirectDepth.NO_MORE_REDIRECTS), verdict);
    }

    @Test
    void shouldReplaceInPlaceAndContinueProviderWhenRecursionExhausted() {
        // Given
        RuleSet ruleSet = ruleSet("\"wrap\": {\"urlPattern\": \"^https://wrap\\\\.example\","
                + " \"redirections\": [\"^https://wrap\\\\.example/\\\\?u=([^&]*)\"],"
                + " \"rules\": [\"^utm_\"]}");
        String url = "https://wrap.example/?u=" + encode("https://dest.example/p?utm_medium=m&keep=1");

        // When
        Verdict verdict = sanitizer.evaluate(url, ruleSet, RedirectDepth.NO_MORE_REDIRECTS);

        // Then
        assertEquals("https://dest.example/p?keep=1", verdict.getUrl().orElseThrow());
    }

    @Test
    void shouldApplyRawRulesToRedirectTargetReplacedInPlace() {
        // Given
        RuleSet ruleSet = ruleSet("\"wrap\": {\"urlPattern\": \"^https://wrap\\\\.example\","
                + " \"redirections\": [\"^https://wrap\\\\.example/\\\\?u=([^&]*)\"],"
                + " \"rules\": [\"^utm_\"], \"rawRules\": [\"/ref=[^/?]*\"]}");
        String url = "https://wrap.example/?u=" + encode("https://dest.example/item/ref=sr_1?utm_source=m&keep=1");

        // When
        Verdict verdict = sanitizer.evaluate(url, ruleSet, RedirectDepth.NO_MORE_REDIRECTS);

        // Then
        assertEquals(Verdict.cleaned("https://dest.example/item?keep=1", List.of()), verdict);
    }

    @Test
    void shouldWarnAndContinueWhenRedirectionHasNoCaptureGroup() {
        // Given
        RuleSet ruleSet = ruleSet("\"nogroup\": {\"urlPattern\": \"^https://nogroup\\\\.example\","
                + " \"redirections\": [\"^https://nogroup\\\\.example/out\","
                + " \"^https://nogroup\\\\.example/out\\\\?to=([^&]*)\"]}");

        // When
        Verdict verdict = sanitizer.evaluate(
                "https://nogroup.example/out?to=" + encode("https://dest.example/"), ruleSet);

        // Then
        assertEquals("https://dest.example/", verdict.getUrl().orElseThrow());
        assertEquals(1, verdict.getWarnings().size());
        assertTrue(verdict.getWarnings().get(0).contains("[nogroup]"));
    }

    @Test
    void shouldIgnoreEmptyRedirectTarget() {
        RuleSet ruleSet = ruleSet("\"out\": {\"urlPattern\": \"^https://out\\\\.example\","
                + " \"redirections\": [\"^https://out\\\\.example/\\\\?to=([^&]*)\"],"
                + " \"rules\": [\"^utm_\"]}");

        Verdict verdict = sanitizer.evaluate("https://out.example/?to=&utm_source=x", ruleSet);

        assertEquals("https://out.example/?to=", verdict.getUrl().orElseThrow());
    }

    // ========== Provider Order ==========

    @Test
    void shouldFeedOneProvidersResultIntoTheNext() {
        String unwrap = "\"unwrap\": {\"urlPattern\": \"^https://a\\\\.example\","
                + " \"rawRules\": [\"^https://a\\\\.example/wrap/\"]}";
        String clean = "\"clean\": {\"urlPattern\": \"^https://b\\\\.example\", \"rules\": [\"^utm_\"]}";
        String url = "https://a.example/wrap/https://b.example/?utm_source=x";

        assertEquals("https://b.example/",
                sanitizer.evaluate(url, ruleSet(unwrap + "," + clean)).getUrl().orElseThrow());
        assertEquals("https://b.example/?utm_source=x",
                sanitizer.evaluate(url, ruleSet(clean + "," + unwrap)).getUrl().orElseThrow());
    }

    @Test
    void shouldNotReintroduceRemovedParameters() {
        RuleSet ruleSet = ruleSet(EXAMPLE_PROVIDER + ","
                + "\"global\": {\"urlPattern\": \".*\", \"rules\": [\"fbclid\"]}");

        String result = sanitizer.evaluate("https://example.com/?utm_source=x&fbclid=1&utm_medium=y&a=b", ruleSet)
                .getUrl().orElseThrow();

        assertEquals("https://example.com/?a=b", result);
        assertFalse(result.contains("utm_"));
    }

    // ========== General ==========

    @Test
    void shouldBeIdempotent() {
        RuleSet ruleSet = ruleSet(REDIRECT_PROVIDER + "," + EXAMPLE_PROVIDER + ","
                + "\"global\": {\"urlPattern\": \".*\", \"rules\": [\"fbclid\"], \"rawRules\": [\"/amp(?=/|$)\"]}");
        List<String> urls = List.of(
                "https://example.com/a?utm_source=x&id=1",
                "https://example.com/p/amp?fbclid=1#top",
                "https://go.example/?u=" + encode("https://example.com/?utm_campaign=c&q=1"),
                "https://other.example/x?&&a=1",
                "https://other.example/?");

        for (String url : urls) {
            String once = sanitizer.evaluate(url, ruleSet).getUrl().orElseThrow();
            Verdict twice = sanitizer.evaluate(once, ruleSet);
            assertEquals(Verdict.unchanged(once, List.of()), twice, "not idempotent for " + url);
        }
    }

    @Test
    void shouldKeepBlockedUrlBlocked() {
        RuleSet ruleSet = ruleSet("\"ads\": {\"urlPattern\": \"^https://ads\\\\.example\", \"completeProvider\": true}");

        assertTrue(sanitizer.evaluate("https://ads.example/x", ruleSet).isBlocked());
        assertTrue(sanitizer.evaluate("https://ads.example/x", ruleSet).isBlocked());
    }

    @Test
    void shouldReturnUnchangedForEmptyRuleSet() {
        Verdict verdict = sanitizer.evaluate("https://example.com/?utm_source=x", RuleSet.empty());

        assertEquals(VerdictType.UNCHANGED, verdict.getType());
    }

    @Test
    void shouldNotFailOnTextThatIsNotAUrl() {
        RuleSet ruleSet = ruleSet("\"global\": {\"urlPattern\": \".*\", \"rules\": [\"utm_\"]}");

        Verdict verdict = sanitizer.evaluate("not a url %zz ?? # ;", ruleSet);

        assertNotNull(verdict);
        assertFalse(verdict.isBlocked());
    }

    private RuleSet ruleSet(String providers) {
        try {
            return compiler.compile(objectMapper.readTree("{\"providers\": {" + providers + "}}"));
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad test ruleset: " + providers, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
