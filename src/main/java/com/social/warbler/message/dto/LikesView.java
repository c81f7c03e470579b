package com.social.warbler.message.dto;

import com.social.warbler.user.dto.UserSummary;

import java.util.List;
import java.util.Set;

public record LikesView(UserSummary user, List<MessageView> messages, Set<Long> likes) { }
