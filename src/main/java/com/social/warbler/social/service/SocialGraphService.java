// src/main/java/com/social/warbler/social/service/SocialGraphService.java
package com.social.warbler.social.service;

import com.social.warbler.error.DuplicateException;
import com.social.warbler.error.ForbiddenLikeException;
import com.social.warbler.error.NotFoundException;
import com.social.warbler.error.ValidationException;
import com.social.warbler.message.model.Message;
import com.social.warbler.message.repository.MessageRepository;
import com.social.warbler.security.AccessGate;
import com.social.warbler.security.Viewer;
import com.social.warbler.social.model.Follow;
import com.social.warbler.social.model.FollowId;
import com.social.warbler.social.model.MessageLike;
import com.social.warbler.social.repository.FollowRepository;
import com.social.warbler.social.repository.MessageLikeRepository;
import com.social.warbler.user.model.User;
import com.social.warbler.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Follow and like edges, and the views derived from them (feed, followers,
 * following, liked warbles).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class SocialGraphService {

    private final FollowRepository follows;
    private final MessageLikeRepository likes;
    private final MessageRepository messages;
    private final UserRepository users;

    @Value("${warbler.feed.limit:100}")
    private int limit;

    // ---------- follow graph ----------

    /** Is {@code a} following {@code b}? */
    @Transactional(readOnly = true)
    public boolean isFollowing(Long a, Long b) {
        return follows.existsById(new FollowId(a, b));
    }

    /** Is {@code a} followed by {@code b}? */
    @Transactional(readOnly = true)
    public boolean isFollowedBy(Long a, Long b) {
        return follows.existsById(new FollowId(b, a));
    }

    /**
     * Runs outside a service transaction: the insert commits or fails on its
     * own, and a primary-key clash with a concurrent identical follow is
     * reported as {@link FollowOutcome#ALREADY_FOLLOWING}.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public FollowOutcome follow(Viewer viewer, Long targetId) {
        Long followerId = AccessGate.requireUser(viewer);
        User target = users.findById(targetId).orElseThrow(() -> new NotFoundException("User", targetId));
        if (followerId.equals(targetId)) {
            throw new ValidationException("You cannot follow yourself.");
        }
        if (follows.existsById(new FollowId(followerId, targetId))) {
            return FollowOutcome.ALREADY_FOLLOWING;
        }
        User follower = users.findById(followerId).orElseThrow(() -> new NotFoundException("User", followerId));
        try {
            follows.saveAndFlush(new Follow(follower, target));
        } catch (DataIntegrityViolationException ex) {
            log.debug("User {} already follows {} (concurrent insert)", followerId, targetId);
            return FollowOutcome.ALREADY_FOLLOWING;
        }
        log.debug("User {} now follows {}", followerId, targetId);
        return FollowOutcome.FOLLOWED;
    }

    /** Removing an absent edge is a no-op. */
    public FollowOutcome unfollow(Viewer viewer, Long targetId) {
        Long followerId = AccessGate.requireUser(viewer);
        FollowId id = new FollowId(followerId, targetId);
        if (!follows.existsById(id)) {
            return FollowOutcome.NOT_FOLLOWING;
        }
        follows.deleteById(id);
        log.debug("User {} stopped following {}", followerId, targetId);
        return FollowOutcome.UNFOLLOWED;
    }

    @Transactional(readOnly = true)
    public List<User> following(Viewer viewer, Long userId) {
        AccessGate.requireUser(viewer);
        requireUser(userId);
        return follows.findFollowing(userId);
    }

    @Transactional(readOnly = true)
    public List<User> followers(Viewer viewer, Long userId) {
        AccessGate.requireUser(viewer);
        requireUser(userId);
        return follows.findFollowers(userId);
    }

    @Transactional(readOnly = true)
    public long countFollowing(Long userId) {
        return follows.countByIdFollowerId(userId);
    }

    @Transactional(readOnly = true)
    public long countFollowers(Long userId) {
        return follows.countByIdFollowedId(userId);
    }

    // ---------- likes ----------

    /**
     * Likes the warble, or removes the like if the viewer already gave it.
     * Liking one's own warble is refused without touching any state.
     */
    public LikeOutcome toggleLike(Viewer viewer, Long messageId) {
        Long userId = AccessGate.requireUser(viewer);
        Message message = messages.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
        if (message.getUser().getId().equals(userId)) {
            log.warn("User {} tried to like own warble {}", userId, messageId);
            throw new ForbiddenLikeException();
        }
        var existing = likes.findByUserIdAndMessageId(userId, messageId);
        if (existing.isPresent()) {
            likes.delete(existing.get());
            log.debug("User {} unliked warble {}", userId, messageId);
            return LikeOutcome.UNLIKED;
        }
        try {
            likes.saveAndFlush(new MessageLike(users.getReferenceById(userId), message));
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateException("This warble has already been liked.", ex);
        }
        log.debug("User {} liked warble {}", userId, messageId);
        return LikeOutcome.LIKED;
    }

    /** Liked warbles of {@code userId}; the viewer must be signed in. */
    @Transactional(readOnly = true)
    public List<Message> messagesLikedBy(Viewer viewer, Long userId) {
        AccessGate.requireUser(viewer);
        requireUser(userId);
        return messages.findLikedBy(userId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Set<Long> likedMessageIds(Long userId) {
        return new HashSet<>(likes.findMessageIdsLikedBy(userId));
    }

    @Transactional(readOnly = true)
    public long countLikes(Long userId) {
        return likes.countByUserId(userId);
    }

    // ---------- feed ----------

    /** Own warbles plus those of followed users, newest first, each at most once. */
    @Transactional(readOnly = true)
    public List<Message> feedFor(Viewer viewer) {
        return AccessGate.guard(viewer, userId -> messages.findFeed(userId, PageRequest.of(0, limit)));
    }

    private void requireUser(Long userId) {
        if (!users.existsById(userId)) throw new NotFoundException("User", userId);
    }
}
