package com.example.prr.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Threshold}.
 */
class ThresholdTest {

    @Test
    void parse_percentage_returnsPercent() {
        assertThat(Threshold.parse("99.9%")).contains(new Threshold(99.9, Threshold.Unit.PERCENT));
    }

    @Test
    void parse_durations_normalisesToMilliseconds() {
        assertThat(Threshold.parse("300ms")).contains(new Threshold(300, Threshold.Unit.MILLISECONDS));
        assertThat(Threshold.parse("2s")).contains(new Threshold(2_000, Threshold.Unit.MILLISECONDS));
        assertThat(Threshold.parse("1m")).contains(new Threshold(60_000, Threshold.Unit.MILLISECONDS));
    }

    @Test
    void parse_withComparatorAndSpaces_isAccepted() {
        assertThat(Threshold.parse(" < 300 ms ")).contains(new Threshold(300, Threshold.Unit.MILLISECONDS));
    }

    @Test
    void parse_freeText_isRejected() {
        assertThat(Threshold.parse("fast enough")).isEmpty();
        assertThat(Threshold.parse("p95 latency < 300ms")).isEmpty();
        assertThat(Threshold.parse(null)).isEmpty();
        assertThat(Threshold.isParseable("")).isFalse();
    }

    @Test
    void compareTo_differentUnits_throws() {
        Threshold percent = Threshold.parse("99%").orElseThrow();
        Threshold millis = Threshold.parse("1s").orElseThrow();

        assertThatThrownBy(() -> percent.compareTo(millis)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Threshold.parse("500ms").orElseThrow()).isLessThan(millis);
    }
}
