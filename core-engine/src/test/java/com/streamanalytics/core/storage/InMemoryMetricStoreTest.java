package com.streamanalytics.core.storage;

import com.streamanalytics.core.error.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMetricStoreTest extends MetricStoreContract {

    @Override
    protected MetricStore createStore() {
        return new InMemoryMetricStore(1000);
    }

    @Test
    @DisplayName("Should evict the oldest records beyond capacity")
    void shouldEvictOldestBeyondCapacity() {
        InMemoryMetricStore small = new InMemoryMetricStore(2);
        small.insertBatch(List.of(
                aggregate("latency", T0.plusSeconds(60), 2.0),
                aggregate("latency", T0, 1.0),
                aggregate("latency", T0.plusSeconds(120), 3.0)));

        assertThat(small.size()).isEqualTo(2);
        assertThat(small.evictedCount()).isEqualTo(1);
        assertThat(small.queryRange(RecordKind.AGGREGATE, "latency", T0, T0.plusSeconds(180)))
                .extracting(StorageRecord::getTimestamp)
                .containsExactly(T0.plusSeconds(60), T0.plusSeconds(120));
    }

    @Test
    @DisplayName("Should refuse access once closed")
    void shouldFailWhenClosed() {
        InMemoryMetricStore closed = new InMemoryMetricStore(10);
        closed.close();

        assertThatThrownBy(() -> closed.queryRange(RecordKind.AGGREGATE, "latency", T0, Instant.MAX))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("closed");
    }
}
