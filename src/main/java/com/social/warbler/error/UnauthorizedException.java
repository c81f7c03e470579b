package com.social.warbler.error;

public class UnauthorizedException extends WarblerException {

    public static final String ACCESS_UNAUTHORIZED = "Access unauthorized.";

    public UnauthorizedException() {
        super(ACCESS_UNAUTHORIZED);
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
