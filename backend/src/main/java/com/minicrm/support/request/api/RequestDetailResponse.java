package com.minicrm.support.request.api;

import com.minicrm.support.request.repo.RequestRepository;

import java.time.Instant;

public record RequestDetailResponse(
        String id,
        String user_id,
        String user_identifier,
        String source_id,
        String source_name,
        String operator_id,
        String operator_name,
        String message,
        String status,
        Instant created_at
) {
    static RequestDetailResponse from(RequestRepository.RequestDetailRow row) {
        return new RequestDetailResponse(
                row.id(),
                row.userId(),
                row.userIdentifier(),
                row.sourceId(),
                row.sourceName(),
                row.operatorId(),
                row.operatorName(),
                row.message(),
                row.status().value(),
                row.createdAt()
        );
    }
}
