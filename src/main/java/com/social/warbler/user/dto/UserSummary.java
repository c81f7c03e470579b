package com.social.warbler.user.dto;

import com.social.warbler.user.model.User;

public record UserSummary(Long id, String username, String imageUrl, String bio) {

    public static UserSummary from(User u) {
        return new UserSummary(u.getId(), u.getUsername(), u.getImageUrl(), u.getBio());
    }
}
