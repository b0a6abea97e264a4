package com.example.scrubservice.engine;

import com.example.scrubservice.model.Verdict;
import com.example.scrubservice.ruleset.Provider;
import com.example.scrubservice.ruleset.RuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates a URL against a {@link RuleSet}.
 *
 * <p>Providers run in ruleset order over a single working URL: each provider receives the URL
 * as the previous one left it. Per matching provider the pipeline is</p>
 * <ol>
 *   <li>complete provider: the whole evaluation is {@code BLOCKED}</li>
 *   <li>exceptions: the provider is skipped</li>
 *   <li>redirections: the embedded target replaces the URL (see below)</li>
 *   <li>rules, then referral marketing rules: matching query parameters are removed</li>
 *   <li>raw rules: matching text is removed from the whole URL</li>
 * </ol>
 *
 * <p>A redirection whose first group captures a target short-circuits a top-level evaluation:
 * the result is exactly the evaluation of the decoded target at {@link RedirectDepth#NO_MORE_REDIRECTS},
 * classified against the target rather than the redirect URL.
 * Inside that nested evaluation a further redirection only replaces the working URL and the
 * provider's remaining steps run on the target.</p>
 *
 * <p>Stateless and thread-safe. Never throws for any input string.</p>
 */
@Component
@Slf4j
public class UrlSanitizer {

    public Verdict evaluate(String url, RuleSet ruleSet) {
        return evaluate(url, ruleSet, RedirectDepth.AT_MOST_ONE_REDIRECT);
    }

    Verdict evaluate(String url, RuleSet ruleSet, RedirectDepth depth) {
        List<String> warnings = new ArrayList<>();
        String current = url;

        for (Provider provider : ruleSet.getProviders()) {
            ProviderOutcome outcome = applyProvider(provider, current, ruleSet, depth, warnings);
            switch (outcome.kind) {
                case BLOCKED:
                    log.debug("URL blocked by provider '{}': {}", provider.getName(), url);
                    return Verdict.blocked(warnings);
                case REDIRECTED:
                    return outcome.redirectVerdict.withLeadingWarnings(warnings);
                default:
                    current = outcome.url;
            }
        }

        return Verdict.of(url, current, warnings);
    }

    private ProviderOutcome applyProvider(Provider provider, String url, RuleSet ruleSet,
                                          RedirectDepth depth, List<String> warnings) {
        if (!prefixMatches(provider.getUrlPattern(), url)) {
            return ProviderOutcome.proceed(url);
        }

        if (provider.isCompleteProvider()) {
            return ProviderOutcome.blocked();
        }

        if (anyPrefixMatches(provider.getExceptions(), url)) {
            log.debug("Provider '{}' skipped by exception: {}", provider.getName(), url);
            return ProviderOutcome.proceed(url);
        }

        String current = url;
        for (Pattern redirection : provider.getRedirections()) {
            Matcher matcher = redirection.matcher(current);
            if (!matcher.lookingAt()) {
                continue;
            }
            if (matcher.groupCount() < 1) {
                log.warn("Redirect target match failed [{}]: {}", provider.getName(), redirection.pattern());
                warnings.add(String.format("Redirect target match failed [%s]: %s",
                        provider.getName(), redirection.pattern()));
                continue;
            }
            String captured = matcher.group(1);
            if (captured == null || captured.isEmpty()) {
                continue;
            }

            String target = PercentDecoder.decode(captured);
            if (depth.allowsRecursion()) {
                log.debug("Provider '{}' redirects to {}", provider.getName(), target);
                return ProviderOutcome.redirected(evaluate(target, ruleSet, depth.next()));
            }
            current = target;
            break;
        }

        current = removeQueryParameters(provider, current);

        for (Pattern rawRule : provider.getRawRules()) {
            current = rawRule.matcher(current).replaceAll("");
        }

        return ProviderOutcome.proceed(current);
    }

    private String removeQueryParameters(Provider provider, String url) {
        UrlComponents components = UrlComponents.parse(url);

        List<QueryParameter> kept = components.getQueryParameters();
        kept = retainUnmatched(kept, provider.getRules());
        kept = retainUnmatched(kept, provider.getReferralMarketing());

        return components.withQueryParameters(kept).toUrlString();
    }

    private static List<QueryParameter> retainUnmatched(List<QueryParameter> parameters, List<Pattern> rules) {
        List<QueryParameter> kept = parameters;
        for (Pattern rule : rules) {
            List<QueryParameter> next = new ArrayList<>(kept.size());
            for (QueryParameter parameter : kept) {
                if (!prefixMatches(rule, parameter.getName())) {
                    next.add(parameter);
                }
            }
            kept = next;
        }
        return kept;
    }

    private static boolean prefixMatches(Pattern pattern, String input) {
        return pattern.matcher(input).lookingAt();
    }

    private static boolean anyPrefixMatches(List<Pattern> patterns, String input) {
        for (Pattern pattern : patterns) {
            if (prefixMatches(pattern, input)) {
                return true;
            }
        }
        return false;
    }

    private enum OutcomeKind {
        PROCEED, BLOCKED, REDIRECTED
    }

    private static final class ProviderOutcome {

        private static final ProviderOutcome BLOCKED = new ProviderOutcome(OutcomeKind.BLOCKED, null, null);

        private final OutcomeKind kind;
        private final String url;
        private final Verdict redirectVerdict;

        private ProviderOutcome(OutcomeKind kind, String url, Verdict redirectVerdict) {
            this.kind = kind;
            this.url = url;
            this.redirectVerdict = redirectVerdict;
        }

        static ProviderOutcome proceed(String url) {
            return new ProviderOutcome(OutcomeKind.PROCEED, url, null);
        }

        static ProviderOutcome blocked() {
            return BLOCKED;
        }

        static ProviderOutcome redirected(Verdict verdict) {
            return new ProviderOutcome(OutcomeKind.REDIRECTED, null, verdict);
        }
    }
}
