package com.social.warbler.error;

/**
 * Base of every per-request failure. Each subtype is mapped to a response by
 * {@link com.social.warbler.web.WebExceptionHandler}.
 */
public abstract class WarblerException extends RuntimeException {

    protected WarblerException(String message) {
        super(message);
    }

    protected WarblerException(String message, Throwable cause) {
        super(message, cause);
    }
}
