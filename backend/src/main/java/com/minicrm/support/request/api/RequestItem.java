package com.minicrm.support.request.api;

import com.minicrm.support.request.repo.RequestRepository;

import java.time.Instant;

public record RequestItem(
        String id,
        String user_id,
        String source_id,
        String operator_id,
        String message,
        String status,
        Instant created_at
) {
    static RequestItem from(RequestRepository.RequestRow row) {
        return new RequestItem(
                row.id(),
                row.userId(),
                row.sourceId(),
                row.operatorId(),
                row.message(),
                row.status().value(),
                row.createdAt()
        );
    }
}
