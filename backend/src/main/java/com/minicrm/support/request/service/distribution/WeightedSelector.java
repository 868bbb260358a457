package com.minicrm.support.request.service.distribution;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Weighted random choice over cumulative weights.
 * <p>
 * Candidate {@code i} owns the half-open range {@code [cum(i-1), cum(i))} of {@code [0, total)}; a draw
 * {@code r} selects the candidate whose range contains it, so each candidate wins with probability
 * {@code weight / total}. Non-positive weights own an empty range and are never picked.
 */
@Component
public class WeightedSelector {

    private final RandomDraw draw;

    public WeightedSelector() {
        this(bound -> ThreadLocalRandom.current().nextDouble(bound));
    }

    public WeightedSelector(RandomDraw draw) {
        this.draw = draw;
    }

    /**
     * @return the picked candidate, or empty when the list is empty or all weights are zero
     */
    public <T> Optional<T> select(List<WeightedCandidate<T>> candidates) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();

        var total = totalWeight(candidates);
        if (total <= 0) return Optional.empty();

        return selectAt(candidates, draw.next(total));
    }

    /**
     * Deterministic half of {@link #select}: resolves an already drawn {@code r} against the candidates.
     *
     * @throws IllegalArgumentException when {@code r} lies outside {@code [0, total)}
     */
    public static <T> Optional<T> selectAt(List<WeightedCandidate<T>> candidates, double r) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();

        var cumulative = new long[candidates.size()];
        long running = 0;
        for (int i = 0; i < candidates.size(); i++) {
            running += Math.max(0, candidates.get(i).weight());
            cumulative[i] = running;
        }
        if (running <= 0) return Optional.empty();
        if (!(r >= 0 && r < running)) {
            throw new IllegalArgumentException("draw_out_of_range");
        }

        // smallest index whose cumulative weight is strictly greater than r
        int lo = 0;
        int hi = cumulative.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulative[mid] > r) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return Optional.ofNullable(candidates.get(lo).candidate());
    }

    static <T> long totalWeight(List<WeightedCandidate<T>> candidates) {
        long total = 0;
        for (var c : candidates) {
            total += Math.max(0, c.weight());
        }
        return total;
    }
}
