package com.factguard.infrastructure.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeframeTest {

    @Test
    @DisplayName("Ranges with business days are read in days")
    void business_day_range() {
        Timeframe timeframe = Timeframe.find("Refunds are processed within 7-10 business days.").orElseThrow();

        assertThat(timeframe.minDays()).isEqualTo(7.0);
        assertThat(timeframe.maxDays()).isEqualTo(10.0);
        assertThat(timeframe.text()).isEqualTo("7-10 business days");
    }

    @Test
    @DisplayName("Hours, minutes and weeks are converted to days")
    void unit_conversion() {
        assertThat(Timeframe.find("within 24 hours").orElseThrow().maxDays()).isCloseTo(1.0, within(1e-9));
        assertThat(Timeframe.find("in 30 minutes").orElseThrow().maxDays()).isCloseTo(30.0 / 1440, within(1e-9));
        assertThat(Timeframe.find("about 2 to 3 weeks").orElseThrow().minDays()).isEqualTo(14.0);
        assertThat(Timeframe.find("after 1 month").orElseThrow().maxDays()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Shorter and longer compare whole ranges")
    void comparisons() {
        Timeframe policy = Timeframe.find("7-10 days").orElseThrow();

        assertThat(Timeframe.find("24 hours").orElseThrow().isShorterThan(policy)).isTrue();
        assertThat(Timeframe.find("3 weeks").orElseThrow().isLongerThan(policy)).isTrue();
        assertThat(Timeframe.find("8 days").orElseThrow().isShorterThan(policy)).isFalse();
        assertThat(Timeframe.find("8 days").orElseThrow().isLongerThan(policy)).isFalse();
    }

    @Test
    @DisplayName("Text without a duration has no timeframe")
    void no_timeframe() {
        assertThat(Timeframe.find("Refunds are processed quickly.")).isEmpty();
        assertThat(Timeframe.find(null)).isEmpty();
    }
}
