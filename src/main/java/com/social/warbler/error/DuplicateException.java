package com.social.warbler.error;

/** A unique constraint rejected the write. */
public class DuplicateException extends WarblerException {

    public DuplicateException(String message, Throwable cause) {
        super(message, cause);
    }
}
