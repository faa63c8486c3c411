package com.streamanalytics.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricKey}.
 */
class MetricKeyTest {

    @Test
    @DisplayName("Should render tags sorted by key")
    void shouldRenderSortedTags() {
        MetricKey key = MetricKey.of("latency", Map.of("zone", "b", "app", "shop"));

        assertThat(key.tagString()).isEqualTo("app=shop,zone=b");
        assertThat(key.toString()).isEqualTo("latency{app=shop,zone=b}");
    }

    @Test
    @DisplayName("Should treat null and empty tags alike")
    void shouldTreatNullTagsAsEmpty() {
        assertThat(MetricKey.of("cpu", null)).isEqualTo(MetricKey.of("cpu"));
        assertThat(MetricKey.toTagString(null)).isEmpty();
    }

    @Test
    @DisplayName("Should distinguish series with the same name but different tags")
    void shouldDistinguishByTags() {
        assertThat(MetricKey.of("cpu", Map.of("host", "a")))
                .isNotEqualTo(MetricKey.of("cpu", Map.of("host", "b")));
    }

    @Test
    @DisplayName("Should order by name, then by tags")
    void shouldOrderByNameThenTags() {
        MetricKey a = MetricKey.of("cpu", Map.of("host", "a"));
        MetricKey b = MetricKey.of("cpu", Map.of("host", "b"));
        MetricKey c = MetricKey.of("disk");

        assertThat(a).isLessThan(b);
        assertThat(b).isLessThan(c);
    }
}
