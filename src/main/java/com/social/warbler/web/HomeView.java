package com.social.warbler.web;

import com.social.warbler.message.dto.MessageView;
import com.social.warbler.user.dto.UserSummary;

import java.util.List;
import java.util.Set;

/** Landing page for anonymous visitors, feed for signed-in users. */
public record HomeView(
        boolean authenticated,
        UserSummary user,
        List<MessageView> messages,
        Set<Long> likes,
        List<Notice> notices
) {
    public static HomeView anonymous(List<Notice> notices) {
        return new HomeView(false, null, List.of(), Set.of(), notices);
    }
}
