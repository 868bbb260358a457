package com.minicrm.support.request.service.distribution;

/**
 * Source of uniform draws for {@link WeightedSelector}. Tests pass a fixed draw.
 */
@FunctionalInterface
public interface RandomDraw {

    /**
     * @param bound exclusive upper bound, always positive
     * @return a value in {@code [0, bound)}
     */
    double next(double bound);
}
