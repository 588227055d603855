package com.metadata.reconciliation.metrics;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordMergeDuration(3, Duration.ofMillis(2));
                noOp.recordMergeConfidence(0.9);
                noOp.incrementNoMetadataAvailable();
                noOp.incrementInvalidRecord(null);
                noOp.incrementFieldCorroborated(MetadataField.YEAR);
                noOp.incrementOverrideApplied(MetadataField.ALBUM, Provider.DISCOGS);
                noOp.incrementOverrideRejected(MetadataField.ALBUM, Provider.YOUTUBE);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record merge duration per record count")
        void recordMergeDuration() {
            metrics.recordMergeDuration(3, Duration.ofMillis(4));
            metrics.recordMergeDuration(3, Duration.ofMillis(6));
            metrics.recordMergeDuration(1, Duration.ofMillis(1));

            Timer timer = registry.find("metadata.merge.duration").tag("records", "3").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should record merge confidence distribution")
        void recordMergeConfidence() {
            metrics.recordMergeConfidence(0.9);
            metrics.recordMergeConfidence(0.7);

            DistributionSummary summary = registry.find("metadata.merge.confidence").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.6, summary.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Should count invalid records per provider tag")
        void incrementInvalidRecord() {
            metrics.incrementInvalidRecord("napster");
            metrics.incrementInvalidRecord("napster");
            metrics.incrementInvalidRecord(null);

            assertEquals(2.0, registry.find("metadata.record.invalid").tag("provider", "napster").counter().count());
            assertEquals(1.0, registry.find("metadata.record.invalid")
                    .tag("provider", MicrometerMetricsService.UNKNOWN_PROVIDER).counter().count());
        }

        @Test
        @DisplayName("Should count corroborated fields")
        void incrementFieldCorroborated() {
            metrics.incrementFieldCorroborated(MetadataField.YEAR);
            metrics.incrementFieldCorroborated(MetadataField.TITLE);
            metrics.incrementFieldCorroborated(MetadataField.YEAR);

            Counter year = registry.find("metadata.field.corroborated").tag("field", "year").counter();
            assertNotNull(year);
            assertEquals(2.0, year.count());
        }

        @Test
        @DisplayName("Should count applied and rejected overrides separately")
        void overrides() {
            metrics.incrementOverrideApplied(MetadataField.ALBUM, Provider.DISCOGS);
            metrics.incrementOverrideRejected(MetadataField.ALBUM, Provider.YOUTUBE);
            metrics.incrementOverrideRejected(MetadataField.ALBUM, Provider.YOUTUBE);

            assertEquals(1.0, registry.find("metadata.override.applied")
                    .tag("field", "album").tag("provider", "discogs").counter().count());
            assertEquals(2.0, registry.find("metadata.override.rejected")
                    .tag("field", "album").tag("provider", "youtube").counter().count());
        }

        @Test
        @DisplayName("Should count unavailable merges and cache lookups")
        void simpleCounters() {
            metrics.incrementNoMetadataAvailable();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("metadata.merge.unavailable").counter().count());
            assertEquals(1.0, registry.find("metadata.cache.hit").counter().count());
            assertEquals(2.0, registry.find("metadata.cache.miss").counter().count());
        }
    }
}
