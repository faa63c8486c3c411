package com.streamanalytics.core.storage;

import com.streamanalytics.core.config.StorageBackend;
import com.streamanalytics.core.config.StorageConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the store contract against an in-memory H2 database in PostgreSQL
 * mode.
 */
class JdbcMetricStoreTest extends MetricStoreContract {

    @Override
    protected MetricStore createStore() {
        StorageConfig config = new StorageConfig();
        config.setBackend(StorageBackend.DURABLE);
        config.setJdbcUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaxPoolSize(2);
        config.setInsertChunkSize(2);
        return JdbcMetricStore.create(config);
    }

    @Test
    @DisplayName("Should answer ranges that span several day partitions")
    void shouldQueryAcrossDayPartitions() {
        store.insertBatch(List.of(
                aggregate("latency", T0.minus(Duration.ofDays(1)), 1.0),
                aggregate("latency", T0, 2.0),
                aggregate("latency", T0.plus(Duration.ofDays(1)), 3.0)));

        assertThat(store.queryRange(RecordKind.AGGREGATE, "latency",
                T0.minus(Duration.ofDays(2)), T0.plus(Duration.ofDays(2))))
                .extracting(StorageRecord::getTimestamp)
                .containsExactly(T0.minus(Duration.ofDays(1)), T0, T0.plus(Duration.ofDays(1)));
    }

    @Test
    @DisplayName("Should keep the last record when a batch repeats a key")
    void shouldKeepLastWriteWithinBatch() {
        store.insertBatch(List.of(
                aggregate("latency", T0, 1.0),
                aggregate("latency", T0, 4.0)));

        assertThat(store.find(aggregate("latency", T0, 0.0).getKey()))
                .hasValueSatisfying(r -> assertThat(r.getPayload())
                        .isEqualTo(aggregate("latency", T0, 4.0).getPayload()));
    }

    @Test
    @DisplayName("Should name partitions by kind and UTC day")
    void shouldNamePartitionsByDay() {
        assertThat(JdbcMetricStore.partitionName(RecordKind.ANOMALY, java.time.LocalDate.of(2024, 3, 10)))
                .isEqualTo("anomaly_p20240310");
    }
}
