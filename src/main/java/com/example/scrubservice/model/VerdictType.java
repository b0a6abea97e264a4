package com.example.scrubservice.model;

/**
 * Outcome of evaluating a URL against a ruleset.
 */
public enum VerdictType {

    /**
     * At least one provider changed the URL.
     */
    CLEANED("URL was cleaned"),

    /**
     * No provider changed the URL.
     */
    UNCHANGED("URL was left unchanged"),

    /**
     * A complete provider matched; the URL must be discarded, not cleaned.
     */
    BLOCKED("URL is blocked");

    private final String description;

    VerdictType(String description) {
        this.description = description;
    }

    /**
     * @return Human-readable description of the outcome
     */
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("%s: %s", name(), description);
    }
}
