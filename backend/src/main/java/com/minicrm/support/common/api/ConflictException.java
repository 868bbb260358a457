package com.minicrm.support.common.api;

/**
 * The change collides with existing rows (duplicate identifier, delete blocked by references).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String code) {
        super(code);
    }

    public ConflictException(String code, Throwable cause) {
        super(code, cause);
    }
}
