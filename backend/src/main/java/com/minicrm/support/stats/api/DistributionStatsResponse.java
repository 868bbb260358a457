package com.minicrm.support.stats.api;

import java.util.List;

public record DistributionStatsResponse(
        List<OperatorBucket> by_operator,
        List<SourceBucket> by_source,
        long total_requests,
        long unassigned_requests
) {
    /**
     * {@code operator_id} is null for the unassigned bucket.
     */
    public record OperatorBucket(String operator_id, String operator_name, long request_count) {
    }

    public record SourceBucket(String source_id, String source_name, long request_count) {
    }
}
