package com.minicrm.support.request.service.distribution;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightedSelectorTest {

    private static final List<WeightedCandidate<String>> ABC = List.of(
            new WeightedCandidate<>("A", 50),
            new WeightedCandidate<>("B", 30),
            new WeightedCandidate<>("C", 20)
    );

    @Test
    void fixed_draw_picks_candidate_whose_range_contains_it() {
        assertThat(new WeightedSelector(bound -> 65.0).select(ABC)).contains("B");
        assertThat(new WeightedSelector(bound -> 10.0).select(ABC)).contains("A");
        assertThat(new WeightedSelector(bound -> 99.9).select(ABC)).contains("C");
    }

    @Test
    void range_boundaries_are_half_open() {
        // A=[0,50) B=[50,80) C=[80,100)
        assertThat(WeightedSelector.selectAt(ABC, 0.0)).contains("A");
        assertThat(WeightedSelector.selectAt(ABC, 49.999)).contains("A");
        assertThat(WeightedSelector.selectAt(ABC, 50.0)).contains("B");
        assertThat(WeightedSelector.selectAt(ABC, 79.999)).contains("B");
        assertThat(WeightedSelector.selectAt(ABC, 80.0)).contains("C");
    }

    @Test
    void draw_bound_is_total_weight() {
        var seen = new double[1];
        new WeightedSelector(bound -> {
            seen[0] = bound;
            return 0.0;
        }).select(ABC);
        assertThat(seen[0]).isEqualTo(100.0);
    }

    @Test
    void empty_or_null_list_yields_none() {
        var selector = new WeightedSelector(bound -> 0.0);
        assertThat(selector.select(List.<WeightedCandidate<String>>of())).isEmpty();
        assertThat(selector.<String>select(null)).isEmpty();
    }

    @Test
    void all_zero_weights_yield_none_without_drawing() {
        var selector = new WeightedSelector(bound -> {
            throw new AssertionError("draw must not happen");
        });
        var zeros = List.of(new WeightedCandidate<>("A", 0), new WeightedCandidate<>("B", 0));
        assertThat(selector.select(zeros)).isEmpty();
    }

    @Test
    void zero_weight_candidate_is_never_picked() {
        var list = List.of(
                new WeightedCandidate<>("A", 10),
                new WeightedCandidate<>("Z", 0),
                new WeightedCandidate<>("B", 10)
        );
        assertThat(WeightedSelector.selectAt(list, 9.99)).contains("A");
        assertThat(WeightedSelector.selectAt(list, 10.0)).contains("B");
    }

    @Test
    void single_candidate_always_wins() {
        var one = List.of(new WeightedCandidate<>("only", 1));
        assertThat(new WeightedSelector().select(one)).contains("only");
    }

    @Test
    void draw_outside_total_is_rejected() {
        assertThatThrownBy(() -> WeightedSelector.selectAt(ABC, 100.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("draw_out_of_range");
        assertThatThrownBy(() -> WeightedSelector.selectAt(ABC, -0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void empirical_frequencies_converge_to_weight_share() {
        var rnd = new Random(42);
        var selector = new WeightedSelector(bound -> rnd.nextDouble() * bound);

        int n = 20_000;
        var counts = new HashMap<String, Integer>();
        for (int i = 0; i < n; i++) {
            var picked = selector.select(ABC).orElseThrow();
            counts.merge(picked, 1, Integer::sum);
        }

        assertThat(counts.get("A") / (double) n).isCloseTo(0.50, within(0.02));
        assertThat(counts.get("B") / (double) n).isCloseTo(0.30, within(0.02));
        assertThat(counts.get("C") / (double) n).isCloseTo(0.20, within(0.02));
    }

    @Test
    void default_draw_stays_within_candidates() {
        var selector = new WeightedSelector();
        for (int i = 0; i < 1_000; i++) {
            assertThat(selector.select(ABC)).get().isIn("A", "B", "C");
        }
    }
}
