// src/main/java/com/social/warbler/user/service/UserService.java
package com.social.warbler.user.service;

import com.social.warbler.error.DuplicateException;
import com.social.warbler.error.NotFoundException;
import com.social.warbler.error.UnauthorizedException;
import com.social.warbler.message.repository.MessageRepository;
import com.social.warbler.security.AccessGate;
import com.social.warbler.security.CredentialStore;
import com.social.warbler.security.Viewer;
import com.social.warbler.social.repository.FollowRepository;
import com.social.warbler.social.repository.MessageLikeRepository;
import com.social.warbler.user.dto.ProfileUpdate;
import com.social.warbler.user.model.User;
import com.social.warbler.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class UserService {

    private final UserRepository repo;
    private final MessageRepository messages;
    private final FollowRepository follows;
    private final MessageLikeRepository likes;
    private final CredentialStore credentials;

    /**
     * Creates the account. Uniqueness of username and email is left to the
     * database; the flush inside this transaction surfaces a clash as
     * {@link DuplicateException} and nothing is committed.
     */
    public User signup(String username, String email, String password, String imageUrl) {
        User user = User.builder()
                .username(username)
                .email(email)
                .password(credentials.hash(password))
                .imageUrl(StringUtils.hasText(imageUrl) ? imageUrl : User.DEFAULT_IMAGE_URL)
                .build();
        try {
            User saved = repo.saveAndFlush(user);
            log.info("Signed up user {} ({})", saved.getId(), saved.getUsername());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            log.warn("Signup rejected for username '{}': {}", username, ex.getMostSpecificCause().getMessage());
            throw new DuplicateException("Username already taken", ex);
        }
    }

    /** Unknown username and wrong password are indistinguishable to the caller. */
    @Transactional(readOnly = true)
    public Optional<User> authenticate(String username, String password) {
        if (username == null) return Optional.empty();
        return repo.findByUsername(username)
                .filter(u -> credentials.verify(u.getPassword(), password));
    }

    @Transactional(readOnly = true)
    public User getById(Long id) {
        return repo.findById(id).orElseThrow(() -> new NotFoundException("User", id));
    }

    /** Blank query lists everyone; otherwise a username substring search. */
    @Transactional(readOnly = true)
    public List<User> search(String q) {
        if (!StringUtils.hasText(q)) return repo.findAllByOrderByUsernameAsc();
        return repo.findByUsernameContainingOrderByUsernameAsc(q);
    }

    @Transactional(readOnly = true)
    public User currentProfile(Viewer viewer) {
        return AccessGate.guard(viewer, this::getById);
    }

    /** Requires the current password; blank image fields fall back to the defaults. */
    public User updateProfile(Viewer viewer, ProfileUpdate form) {
        Long userId = AccessGate.requireUser(viewer);
        User user = getById(userId);
        if (!credentials.verify(user.getPassword(), form.password())) {
            log.warn("Profile update for user {} refused: wrong password", userId);
            throw new UnauthorizedException("Invalid password.");
        }
        user.setUsername(form.username());
        user.setEmail(form.email());
        user.setImageUrl(StringUtils.hasText(form.imageUrl()) ? form.imageUrl() : User.DEFAULT_IMAGE_URL);
        user.setHeaderImageUrl(StringUtils.hasText(form.headerImageUrl())
                ? form.headerImageUrl() : User.DEFAULT_HEADER_IMAGE_URL);
        user.setBio(form.bio());
        user.setLocation(form.location());
        try {
            return repo.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateException("Username or email already taken", ex);
        }
    }

    /**
     * Removes the viewer's account together with their warbles, follow edges in
     * both directions, likes they gave and likes on their warbles.
     */
    public void deleteAccount(Viewer viewer) {
        AccessGate.run(viewer, userId -> {
            User user = getById(userId);
            int likeRows = likes.deleteAllTouching(userId);
            int followRows = follows.deleteAllTouching(userId);
            int messageRows = messages.deleteAllByAuthor(userId);
            repo.delete(user);
            repo.flush();
            log.info("Deleted user {} with {} warbles, {} follow edges, {} likes",
                    userId, messageRows, followRows, likeRows);
        });
    }
}
