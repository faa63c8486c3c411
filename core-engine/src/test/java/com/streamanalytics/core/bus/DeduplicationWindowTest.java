package com.streamanalytics.core.bus;

import com.streamanalytics.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeduplicationWindowTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should accept an id once and reject repeats")
    void shouldRejectRepeatedIds() {
        DeduplicationWindow window = new DeduplicationWindow(10, Duration.ofMinutes(1), clock);
        UUID id = UUID.randomUUID();

        assertThat(window.markSeen(id)).isTrue();
        assertThat(window.markSeen(id)).isFalse();
        assertThat(window.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should forget the eldest id when capacity is exceeded")
    void shouldEvictEldestOverCapacity() {
        DeduplicationWindow window = new DeduplicationWindow(2, Duration.ofMinutes(1), clock);
        UUID first = UUID.randomUUID();

        window.markSeen(first);
        window.markSeen(UUID.randomUUID());
        window.markSeen(UUID.randomUUID());

        assertThat(window.size()).isEqualTo(2);
        assertThat(window.markSeen(first)).isTrue();
    }

    @Test
    @DisplayName("Should forget ids older than the horizon")
    void shouldExpireOldIds() {
        DeduplicationWindow window = new DeduplicationWindow(10, Duration.ofSeconds(30), clock);
        UUID id = UUID.randomUUID();
        window.markSeen(id);

        clock.advance(Duration.ofSeconds(31));

        assertThat(window.markSeen(id)).isTrue();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> new DeduplicationWindow(0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
