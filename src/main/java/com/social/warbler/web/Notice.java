package com.social.warbler.web;

import java.io.Serializable;

/** A one-shot message for the presentation layer, e.g. ("danger", "Access unauthorized."). */
public record Notice(String category, String text) implements Serializable {

    public static Notice danger(String text) { return new Notice("danger", text); }

    public static Notice success(String text) { return new Notice("success", text); }

    public static Notice primary(String text) { return new Notice("primary", text); }
}
