package dev.feedcraft.metrics;

import dev.feedcraft.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FeedParseMetrics")
class FeedParseMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private FeedParseMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new FeedParseMetrics(meterRegistry);
    }

    private double outcomeCount(String outcome) {
        Counter counter = meterRegistry.find(FeedParseMetrics.PARSE_TOTAL).tag("outcome", outcome).counter();
        assertThat(counter).as("counter for outcome %s", outcome).isNotNull();
        return counter.count();
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("should register one counter per outcome up front")
        void shouldRegisterOutcomeCounters() {
            assertThat(outcomeCount("success")).isZero();
            assertThat(outcomeCount("input")).isZero();
            assertThat(outcomeCount("xml_syntax")).isZero();
            assertThat(outcomeCount("missing_element")).isZero();
            assertThat(outcomeCount("validation")).isZero();
        }

        @Test
        @DisplayName("should register the items summary and duration timer")
        void shouldRegisterSummaryAndTimer() {
            assertThat(meterRegistry.find(FeedParseMetrics.PARSE_ITEMS).summary()).isNotNull();
            assertThat(meterRegistry.find(FeedParseMetrics.PARSE_DURATION).timer()).isNotNull();
        }

        @Test
        @DisplayName("should expose the registry it was built with")
        void shouldExposeRegistry() {
            assertThat(metrics.getMeterRegistry()).isSameAs(meterRegistry);
        }
    }

    @Nested
    @DisplayName("recording")
    class Recording {

        @Test
        @DisplayName("should count a success with its item count and duration")
        void shouldRecordSuccess() {
            metrics.recordSuccess(3, TimeUnit.MILLISECONDS.toNanos(5));
            metrics.recordSuccess(1, TimeUnit.MILLISECONDS.toNanos(5));

            DistributionSummary items = meterRegistry.find(FeedParseMetrics.PARSE_ITEMS).summary();
            Timer duration = meterRegistry.find(FeedParseMetrics.PARSE_DURATION).timer();
            assertThat(outcomeCount("success")).isEqualTo(2.0);
            assertThat(items.count()).isEqualTo(2);
            assertThat(items.totalAmount()).isEqualTo(4.0);
            assertThat(duration.count()).isEqualTo(2);
            assertThat(duration.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(10.0);
        }

        @Test
        @DisplayName("should count a failure under its kind without touching the items summary")
        void shouldRecordFailure() {
            metrics.recordFailure(ErrorKind.XML_SYNTAX, 1_000);

            assertThat(outcomeCount("xml_syntax")).isEqualTo(1.0);
            assertThat(outcomeCount("success")).isZero();
            assertThat(outcomeCount("validation")).isZero();
            assertThat(meterRegistry.find(FeedParseMetrics.PARSE_ITEMS).summary().count()).isZero();
            assertThat(meterRegistry.find(FeedParseMetrics.PARSE_DURATION).timer().count()).isEqualTo(1);
        }
    }
}
