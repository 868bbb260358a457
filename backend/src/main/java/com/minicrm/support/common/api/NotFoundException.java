package com.minicrm.support.common.api;

/**
 * A referenced operator, source or request does not exist. The message is the error code.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String code) {
        super(code);
    }
}
