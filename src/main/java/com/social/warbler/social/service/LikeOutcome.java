package com.social.warbler.social.service;

public enum LikeOutcome {
    LIKED,
    UNLIKED
}
