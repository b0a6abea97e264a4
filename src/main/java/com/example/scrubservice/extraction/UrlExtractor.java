package com.example.scrubservice.extraction;

import java.util.List;

/**
 * Strategy interface for finding candidate URLs in free-form text
 */
public interface UrlExtractor {
    /**
     * Extract the distinct URLs mentioned in the text
     * @param content Free-form text (chat message, document body, ...)
     * @return Distinct candidate URLs in order of first appearance (empty if none)
     */
    List<String> extractUrls(String content);
}
