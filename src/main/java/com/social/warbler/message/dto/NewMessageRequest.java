package com.social.warbler.message.dto;

import jakarta.validation.constraints.NotNull;

/** Length is checked by the service so the error message is uniform. */
public record NewMessageRequest(@NotNull String text) { }
