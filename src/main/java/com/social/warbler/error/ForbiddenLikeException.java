package com.social.warbler.error;

/** Raised when a user tries to like their own warble. */
public class ForbiddenLikeException extends WarblerException {

    public ForbiddenLikeException() {
        super("You cannot like your own warble.");
    }
}
