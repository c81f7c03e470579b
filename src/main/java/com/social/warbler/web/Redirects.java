package com.social.warbler.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.net.URI;

/** 302 responses carrying the view data of the action that caused them. */
public final class Redirects {

    private Redirects() {}

    public static <T> ResponseEntity<T> to(String path, T body) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(path)).body(body);
    }
}
