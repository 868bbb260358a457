package com.minicrm.support.stats.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatsServiceTest {

    @Test
    void load_percentage_is_share_of_limit() {
        assertThat(StatsService.loadPercentage(1, 4)).isEqualTo(25.0);
        assertThat(StatsService.loadPercentage(3, 3)).isEqualTo(100.0);
        assertThat(StatsService.loadPercentage(1, 3)).isCloseTo(33.333, within(0.001));
    }

    @Test
    void load_above_limit_is_reported_as_is() {
        assertThat(StatsService.loadPercentage(3, 2)).isEqualTo(150.0);
    }

    @Test
    void non_positive_limit_reports_zero() {
        assertThat(StatsService.loadPercentage(5, 0)).isZero();
        assertThat(StatsService.loadPercentage(5, -1)).isZero();
    }
}
