package com.minicrm.support.stats.api;

public record OperatorLoadItem(
        String operator_id,
        String operator_name,
        boolean is_active,
        int current_load,
        int max_load_limit,
        double load_percentage
) {
}
