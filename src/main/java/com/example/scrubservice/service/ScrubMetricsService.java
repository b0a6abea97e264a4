package com.example.scrubservice.service;

import com.example.scrubservice.model.Verdict;
import com.example.scrubservice.model.VerdictType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts evaluation outcomes.
 *
 * <p>Internal counters are always kept; when a Micrometer registry is present the same numbers
 * are published as {@code scrub.verdicts{verdict=...}} and the {@code scrub.evaluation} timer
 * (exposed at /actuator/metrics).</p>
 */
@Service
@Slf4j
public class ScrubMetricsService {

    @Autowired(required = false)
    private MeterRegistry meterRegistry;

    private final Map<VerdictType, AtomicLong> verdictCounts = new EnumMap<>(VerdictType.class);
    private final Map<VerdictType, Counter> verdictCounters = new EnumMap<>(VerdictType.class);
    private final AtomicLong totalEvaluationNanos = new AtomicLong(0);
    private final AtomicLong warningCount = new AtomicLong(0);

    private Timer evaluationTimer;

    public ScrubMetricsService() {
        for (VerdictType type : VerdictType.values()) {
            verdictCounts.put(type, new AtomicLong(0));
        }
    }

    @PostConstruct
    public void initialize() {
        if (meterRegistry == null) {
            log.info("Scrub metrics initialized without Micrometer registry");
            return;
        }
        for (VerdictType type : VerdictType.values()) {
            verdictCounters.put(type, Counter.builder("scrub.verdicts")
                    .tag("verdict", type.name().toLowerCase(Locale.ROOT))
                    .description("URL evaluations by outcome")
                    .register(meterRegistry));
        }
        evaluationTimer = Timer.builder("scrub.evaluation")
                .description("Time spent evaluating one URL")
                .register(meterRegistry);
        log.info("Scrub metrics initialized with Micrometer registry");
    }

    public void recordEvaluation(Verdict verdict, long durationNanos) {
        verdictCounts.get(verdict.getType()).incrementAndGet();
        totalEvaluationNanos.addAndGet(durationNanos);
        warningCount.addAndGet(verdict.getWarnings().size());

        Counter counter = verdictCounters.get(verdict.getType());
        if (counter != null) {
            counter.increment();
        }
        if (evaluationTimer != null) {
            evaluationTimer.record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }

    public long getCount(VerdictType type) {
        return verdictCounts.get(type).get();
    }

    public long getTotalEvaluations() {
        long total = 0;
        for (AtomicLong count : verdictCounts.values()) {
            total += count.get();
        }
        return total;
    }

    public double getAverageEvaluationTimeMs() {
        long total = getTotalEvaluations();
        return total == 0 ? 0.0 : totalEvaluationNanos.get() / 1_000_000.0 / total;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalEvaluations", getTotalEvaluations());
        stats.put("cleaned", getCount(VerdictType.CLEANED));
        stats.put("unchanged", getCount(VerdictType.UNCHANGED));
        stats.put("blocked", getCount(VerdictType.BLOCKED));
        stats.put("warnings", warningCount.get());
        stats.put("averageEvaluationTimeMs", getAverageEvaluationTimeMs());
        return stats;
    }
}
