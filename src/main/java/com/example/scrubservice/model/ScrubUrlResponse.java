package com.example.scrubservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * REST representation of a {@link Verdict}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrubUrlResponse {

    private VerdictType verdict;

    private String originalUrl;

    /**
     * Resulting URL; null when blocked.
     */
    private String url;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public static ScrubUrlResponse from(String originalUrl, Verdict verdict) {
        return ScrubUrlResponse.builder()
                .verdict(verdict.getType())
                .originalUrl(originalUrl)
                .url(verdict.getUrl().orElse(null))
                .warnings(new ArrayList<>(verdict.getWarnings()))
                .build();
    }
}
