package com.minicrm.support.request.repo;

/**
 * Lifecycle of a request: {@code pending -> assigned} or {@code pending -> waiting}.
 * Both targets are terminal.
 */
public enum RequestStatus {
    PENDING("pending"),
    ASSIGNED("assigned"),
    WAITING("waiting");

    private final String value;

    RequestStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RequestStatus fromValue(String raw) {
        for (var s : values()) {
            if (s.value.equals(raw)) return s;
        }
        throw new IllegalStateException("unknown_request_status " + raw);
    }
}
