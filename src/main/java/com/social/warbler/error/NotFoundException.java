package com.social.warbler.error;

public class NotFoundException extends WarblerException {

    public NotFoundException(String what, Object id) {
        super(what + " not found: " + id);
    }
}
