package com.social.warbler.user.dto;

import com.social.warbler.user.model.User;

/** Current values used to pre-fill the profile edit form. */
public record ProfileForm(String username, String email, String imageUrl,
                          String headerImageUrl, String bio, String location) {

    public static ProfileForm from(User u) {
        return new ProfileForm(u.getUsername(), u.getEmail(), u.getImageUrl(),
                u.getHeaderImageUrl(), u.getBio(), u.getLocation());
    }
}
