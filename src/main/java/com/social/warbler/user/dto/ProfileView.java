package com.social.warbler.user.dto;

import com.social.warbler.message.dto.MessageView;
import com.social.warbler.user.model.User;

import java.util.List;
import java.util.Set;

/**
 * Everything a profile page shows: the user, their counters, their latest
 * warbles and, for a signed-in viewer, which of those the viewer liked.
 */
public record ProfileView(
        Long id,
        String username,
        String imageUrl,
        String headerImageUrl,
        String bio,
        String location,
        long messageCount,
        long followingCount,
        long followerCount,
        long likeCount,
        boolean followedByViewer,
        List<MessageView> messages,
        Set<Long> likes
) {
    public static ProfileView of(User u, Counts counts, boolean followedByViewer,
                                 List<MessageView> messages, Set<Long> likes) {
        return new ProfileView(u.getId(), u.getUsername(), u.getImageUrl(), u.getHeaderImageUrl(),
                u.getBio(), u.getLocation(), counts.messages(), counts.following(), counts.followers(),
                counts.likes(), followedByViewer, messages, likes);
    }

    public record Counts(long messages, long following, long followers, long likes) { }
}
