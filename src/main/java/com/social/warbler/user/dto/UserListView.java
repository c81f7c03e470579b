package com.social.warbler.user.dto;

import java.util.List;

/** A user plus a list of related users (following / followers). */
public record UserListView(UserSummary user, List<UserSummary> users) { }
