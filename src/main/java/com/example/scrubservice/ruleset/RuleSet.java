package com.example.scrubservice.ruleset;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of compiled providers.
 *
 * <p>Iteration order is the order in which providers appear in the rules document. Providers
 * that failed to compile are not part of the set; they are described by {@link #getDiagnostics()}.
 * Refreshing rules means building a new {@code RuleSet}; an instance is never modified.</p>
 */
public final class RuleSet {

    private static final RuleSet EMPTY = new RuleSet(Map.of(), List.of(), null, Instant.EPOCH);

    private final Map<String, Provider> providers;
    private final List<BuildDiagnostic> diagnostics;
    private final String source;
    private final Instant loadedAt;

    RuleSet(Map<String, Provider> providers, List<BuildDiagnostic> diagnostics, String source, Instant loadedAt) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        this.diagnostics = List.copyOf(diagnostics);
        this.source = source;
        this.loadedAt = loadedAt;
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    /**
     * @return providers in document order
     */
    public Collection<Provider> getProviders() {
        return providers.values();
    }

    public Optional<Provider> getProvider(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public List<String> getProviderNames() {
        return List.copyOf(providers.keySet());
    }

    public int size() {
        return providers.size();
    }

    /**
     * @return problems found while compiling, one per excluded provider
     */
    public List<BuildDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return location the rules document was read from, or null when built in memory
     */
    public String getSource() {
        return source;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    @Override
    public String toString() {
        return String.format("RuleSet[providers=%d, diagnostics=%d, source=%s]",
                providers.size(), diagnostics.size(), source);
    }
}
