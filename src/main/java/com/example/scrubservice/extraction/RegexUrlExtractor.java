package com.example.scrubservice.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts http/https URLs using a greedy pattern: the scheme followed by every
 * non-whitespace character up to the next whitespace.
 *
 * Examples:
 * - "see https://example.com/a?b=1 now" -> "https://example.com/a?b=1"
 * - "(http://x.org)" -> "http://x.org)" (trailing punctuation is kept)
 */
@Component
@Slf4j
public class RegexUrlExtractor implements UrlExtractor {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public List<String> extractUrls(String content) {
        if (content == null || content.isEmpty()) {
            return new ArrayList<>();
        }

        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL_PATTERN.matcher(content);
        while (matcher.find()) {
            urls.add(matcher.group());
        }

        log.debug("Extracted {} distinct URLs", urls.size());
        return new ArrayList<>(urls);
    }
}
