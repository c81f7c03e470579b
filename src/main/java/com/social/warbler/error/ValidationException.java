package com.social.warbler.error;

/** Input had the wrong shape, e.g. an empty or over-long warble. */
public class ValidationException extends WarblerException {

    public ValidationException(String message) {
        super(message);
    }
}
