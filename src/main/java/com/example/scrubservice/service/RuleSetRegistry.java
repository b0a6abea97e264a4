package com.example.scrubservice.service;

import com.example.scrubservice.ruleset.RuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published {@link RuleSet}.
 *
 * <p>Publishing swaps the reference atomically; readers get either the old or the new
 * ruleset, never a partially updated one.</p>
 */
@Component
@Slf4j
public class RuleSetRegistry {

    private final AtomicReference<RuleSet> current = new AtomicReference<>();

    public Optional<RuleSet> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Publish a new ruleset for subsequent evaluations.
     *
     * @return the ruleset it replaces, empty if none was published
     */
    public Optional<RuleSet> publish(RuleSet ruleSet) {
        RuleSet previous = current.getAndSet(Objects.requireNonNull(ruleSet, "ruleSet"));
        log.info("Published ruleset with {} providers from {} (previous: {})",
                ruleSet.size(), ruleSet.getSource(), previous != null ? previous.size() + " providers" : "none");
        return Optional.ofNullable(previous);
    }

    public boolean isPublished() {
        return current.get() != null;
    }
}
