package com.social.warbler.user.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/** Profile edit form. {@code password} is the current password, required to confirm. */
public record ProfileUpdate(
        @NotBlank String username,
        @NotBlank @Email String email,
        String imageUrl,
        String headerImageUrl,
        String bio,
        String location,
        @NotBlank String password
) { }
