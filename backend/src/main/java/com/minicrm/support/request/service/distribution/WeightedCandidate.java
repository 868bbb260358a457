package com.minicrm.support.request.service.distribution;

public record WeightedCandidate<T>(T candidate, int weight) {
}
