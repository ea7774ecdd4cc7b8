package org.iceforge.ullr.query;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryModelsTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void resolvesMissingBoundsAgainstClock() {
        long now = clock.millis();

        assertThat(QueryModels.TimeWindow.resolve(null, null, clock, Duration.ofHours(1)))
                .isEqualTo(new QueryModels.TimeWindow(now - 3_600_000L, now));
        assertThat(QueryModels.TimeWindow.resolve(now - 10_000L, null, clock, Duration.ofHours(1)))
                .isEqualTo(new QueryModels.TimeWindow(now - 10_000L, now));
        assertThat(QueryModels.TimeWindow.resolve(null, now - 1_000L, clock, Duration.ofMinutes(1)))
                .isEqualTo(new QueryModels.TimeWindow(now - 61_000L, now - 1_000L));
    }

    @Test
    void nonPositiveLookbackMeansOneDay() {
        long now = clock.millis();
        assertThat(QueryModels.TimeWindow.trailing(clock, Duration.ZERO).startMillis())
                .isEqualTo(now - Duration.ofHours(24).toMillis());
    }

    @Test
    void endMustBeAfterStart() {
        assertThatThrownBy(() -> new QueryModels.TimeWindow(100L, 100L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("after start");
        assertThatThrownBy(() -> QueryModels.TimeWindow.resolve(200L, 100L, clock, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void terminalStates() {
        assertThat(QueryModels.QueryState.SUBMITTED.terminal()).isFalse();
        assertThat(QueryModels.QueryState.RUNNING.terminal()).isFalse();
        assertThat(QueryModels.QueryState.COMPLETE.terminal()).isTrue();
        assertThat(QueryModels.QueryState.TIMED_OUT.terminal()).isTrue();
    }
}
