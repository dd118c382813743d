package dev.feedcraft.metrics;

import dev.feedcraft.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for feed parsing.
 * <ul>
 *   <li>{@code feedcraft.parse.total} (Counter), tagged {@code outcome=success|input|xml_syntax|missing_element|validation}</li>
 *   <li>{@code feedcraft.parse.items} (DistributionSummary), items per successfully parsed feed</li>
 *   <li>{@code feedcraft.parse.duration} (Timer)</li>
 * </ul>
 */
public class FeedParseMetrics {

    public static final String PARSE_TOTAL = "feedcraft.parse.total";
    public static final String PARSE_ITEMS = "feedcraft.parse.items";
    public static final String PARSE_DURATION = "feedcraft.parse.duration";

    private final MeterRegistry meterRegistry;

    // Cached meter references to avoid a registry lookup per parse
    private final Counter successCounter;
    private final Map<ErrorKind, Counter> failureCounters = new EnumMap<>(ErrorKind.class);
    private final DistributionSummary itemsSummary;
    private final Timer durationTimer;

    public FeedParseMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.successCounter = Counter.builder(PARSE_TOTAL)
                .description("RSS documents parsed, by outcome")
                .tag("outcome", "success")
                .register(meterRegistry);
        for (ErrorKind kind : ErrorKind.values()) {
            failureCounters.put(kind, Counter.builder(PARSE_TOTAL)
                    .description("RSS documents parsed, by outcome")
                    .tag("outcome", kind.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        this.itemsSummary = DistributionSummary.builder(PARSE_ITEMS)
                .description("Items per successfully parsed feed")
                .register(meterRegistry);
        this.durationTimer = Timer.builder(PARSE_DURATION)
                .description("Time spent parsing one RSS document")
                .register(meterRegistry);
    }

    public void recordSuccess(int itemCount, long elapsedNanos) {
        successCounter.increment();
        itemsSummary.record(itemCount);
        durationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFailure(ErrorKind kind, long elapsedNanos) {
        failureCounters.get(kind).increment();
        durationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
