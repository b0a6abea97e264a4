package com.example.scrubservice.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of evaluating one URL: cleaned, unchanged or blocked.
 *
 * <p>A blocked verdict has no URL. Callers read the URL through {@link #getUrl()} so that a
 * blocked result cannot be mistaken for a cleaned one.</p>
 *
 * <p>Warnings are non-fatal problems met during evaluation (for example a redirection pattern
 * without a capture group). They are not part of equality.</p>
 */
public final class Verdict {

    private final VerdictType type;
    private final String url;
    private final List<String> warnings;

    private Verdict(VerdictType type, String url, List<String> warnings) {
        this.type = type;
        this.url = url;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static Verdict cleaned(String url, List<String> warnings) {
        return new Verdict(VerdictType.CLEANED, Objects.requireNonNull(url, "url"), warnings);
    }

    public static Verdict unchanged(String url, List<String> warnings) {
        return new Verdict(VerdictType.UNCHANGED, Objects.requireNonNull(url, "url"), warnings);
    }

    public static Verdict blocked(List<String> warnings) {
        return new Verdict(VerdictType.BLOCKED, null, warnings);
    }

    /**
     * Tag a result URL relative to the input it was computed from.
     *
     * @param input  URL handed to the evaluation
     * @param result URL after all providers ran
     * @return CLEANED when the two differ, UNCHANGED otherwise
     */
    public static Verdict of(String input, String result, List<String> warnings) {
        return input.equals(result) ? unchanged(result, warnings) : cleaned(result, warnings);
    }

    public VerdictType getType() {
        return type;
    }

    /**
     * @return the resulting URL, empty when blocked
     */
    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isBlocked() {
        return type == VerdictType.BLOCKED;
    }

    public boolean isCleaned() {
        return type == VerdictType.CLEANED;
    }

    /**
     * Copy of this verdict with extra warnings placed in front of its own.
     */
    public Verdict withLeadingWarnings(List<String> leading) {
        if (leading.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(leading);
        merged.addAll(warnings);
        return new Verdict(type, url, merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Verdict)) {
            return false;
        }
        Verdict other = (Verdict) o;
        return type == other.type && Objects.equals(url, other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, url);
    }

    @Override
    public String toString() {
        return url == null ? type.name() : type.name() + "(" + url + ")";
    }
}
