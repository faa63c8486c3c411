package com.streamanalytics.core.stream;

import com.streamanalytics.core.model.WindowType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowAssignersTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should place every timestamp in exactly one epoch-aligned tumbling window")
    void shouldPartitionTimeWithTumblingWindows() {
        TumblingWindowAssigner assigner = new TumblingWindowAssigner(Duration.ofSeconds(60));
        Set<WindowBounds> seen = new HashSet<>();

        for (long s = 0; s < 600; s += 7) {
            Instant ts = T0.plusSeconds(s);
            List<WindowBounds> windows = assigner.assign(ts);
            assertThat(windows).singleElement().satisfies(w -> assertThat(w.contains(ts)).isTrue());
            seen.addAll(windows);
        }

        assertThat(seen).hasSize(10);
        assertThat(assigner.type()).isEqualTo(WindowType.TUMBLING);
    }

    @Test
    @DisplayName("Should treat the window end as exclusive")
    void shouldUseHalfOpenBounds() {
        TumblingWindowAssigner assigner = new TumblingWindowAssigner(Duration.ofSeconds(60));

        assertThat(assigner.assign(T0.plusSeconds(60)))
                .containsExactly(new WindowBounds(T0.plusSeconds(60), T0.plusSeconds(120)));
    }

    @Test
    @DisplayName("Should align tumbling windows before the epoch")
    void shouldAlignBeforeEpoch() {
        TumblingWindowAssigner assigner = new TumblingWindowAssigner(Duration.ofSeconds(60));

        assertThat(assigner.assign(Instant.ofEpochMilli(-1)))
                .containsExactly(new WindowBounds(Instant.ofEpochMilli(-60_000), Instant.EPOCH));
    }

    @Test
    @DisplayName("Should place a timestamp in size/slide overlapping sliding windows")
    void shouldAssignOverlappingSlidingWindows() {
        SlidingWindowAssigner assigner = new SlidingWindowAssigner(Duration.ofSeconds(30), Duration.ofSeconds(10));
        Instant ts = T0.plusSeconds(125);

        List<WindowBounds> windows = assigner.assign(ts);

        assertThat(windows).containsExactly(
                new WindowBounds(T0.plusSeconds(100), T0.plusSeconds(130)),
                new WindowBounds(T0.plusSeconds(110), T0.plusSeconds(140)),
                new WindowBounds(T0.plusSeconds(120), T0.plusSeconds(150)));
        assertThat(windows).allSatisfy(w -> assertThat(w.contains(ts)).isTrue());
    }

    @Test
    @DisplayName("Should reject a slide larger than the window")
    void shouldRejectSlideLargerThanSize() {
        assertThatThrownBy(() -> new SlidingWindowAssigner(Duration.ofSeconds(10), Duration.ofSeconds(20)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a slide equal to the window size")
    void shouldRejectSlideEqualToSize() {
        assertThatThrownBy(() -> new SlidingWindowAssigner(Duration.ofSeconds(30), Duration.ofSeconds(30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("slide < size");
    }

    @Test
    @DisplayName("Should reject empty window bounds")
    void shouldRejectEmptyBounds() {
        assertThatThrownBy(() -> new WindowBounds(T0, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
