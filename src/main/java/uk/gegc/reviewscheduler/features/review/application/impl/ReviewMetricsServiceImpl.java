package uk.gegc.reviewscheduler.features.review.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.reviewscheduler.features.review.application.ReviewMetricsService;

/**
 * Micrometer counters for the review write path.
 */
@Slf4j
@Service
public class ReviewMetricsServiceImpl implements ReviewMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter scheduledCounter;
    private final Counter replayedCounter;
    private final Counter conflictCounter;

    public ReviewMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.scheduledCounter = Counter.builder("review.records.scheduled")
                .description("Number of review records created")
                .register(meterRegistry);
        this.replayedCounter = Counter.builder("review.completions.replayed")
                .description("Number of completions answered as replays")
                .register(meterRegistry);
        this.conflictCounter = Counter.builder("review.completions.conflicts")
                .description("Number of completions rejected as conflicting")
                .register(meterRegistry);
    }

    @Override
    public void recordScheduled() {
        scheduledCounter.increment();
    }

    @Override
    public void recordCompleted(int quality) {
        // tagged per quality so lapse rates can be charted
        Counter.builder("review.completions.applied")
                .description("Number of applied review completions")
                .tag("quality", String.valueOf(quality))
                .register(meterRegistry)
                .increment();
        log.debug("Recorded applied completion with quality {}", quality);
    }

    @Override
    public void recordReplayed() {
        replayedCounter.increment();
    }

    @Override
    public void recordConflict() {
        conflictCounter.increment();
    }
}
