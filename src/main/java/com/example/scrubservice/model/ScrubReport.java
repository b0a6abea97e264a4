package com.example.scrubservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Links found in a block of text that were cleaned or blocked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrubReport {

    /**
     * Cleaned forms of the links that changed.
     */
    @Builder.Default
    private List<String> cleanedLinks = new ArrayList<>();

    /**
     * Original links matched by a complete provider.
     */
    @Builder.Default
    private List<String> blockedLinks = new ArrayList<>();

    /**
     * Summary line, null when nothing was cleaned.
     */
    private String message;

    public boolean hasChanges() {
        return !cleanedLinks.isEmpty() || !blockedLinks.isEmpty();
    }
}
