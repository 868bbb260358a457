package com.minicrm.support.source.api;

import com.minicrm.support.source.repo.SourceRepository;

import java.time.Instant;

public record SourceItem(String id, String name, String identifier, Instant created_at) {
    static SourceItem from(SourceRepository.SourceRow row) {
        return new SourceItem(row.id(), row.name(), row.identifier(), row.createdAt());
    }
}
