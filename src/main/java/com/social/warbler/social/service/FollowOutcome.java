package com.social.warbler.social.service;

public enum FollowOutcome {
    FOLLOWED,
    ALREADY_FOLLOWING,
    UNFOLLOWED,
    NOT_FOLLOWING
}
