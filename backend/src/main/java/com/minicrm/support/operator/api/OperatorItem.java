package com.minicrm.support.operator.api;

import com.minicrm.support.operator.repo.OperatorRepository;

import java.time.Instant;

public record OperatorItem(
        String id,
        String name,
        boolean is_active,
        int max_load_limit,
        int current_load,
        Instant created_at
) {
    static OperatorItem from(OperatorRepository.OperatorRow row) {
        return new OperatorItem(
                row.id(),
                row.name(),
                row.active(),
                row.maxLoadLimit(),
                row.currentLoad(),
                row.createdAt()
        );
    }
}
