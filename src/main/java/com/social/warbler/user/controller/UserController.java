// src/main/java/com/social/warbler/user/controller/UserController.java
package com.social.warbler.user.controller;

import com.social.warbler.message.dto.LikesView;
import com.social.warbler.message.dto.MessageView;
import com.social.warbler.message.service.MessageService;
import com.social.warbler.security.SessionGate;
import com.social.warbler.security.Viewer;
import com.social.warbler.security.WarblerPrincipal;
import com.social.warbler.social.service.FollowOutcome;
import com.social.warbler.social.service.LikeOutcome;
import com.social.warbler.social.service.SocialGraphService;
import com.social.warbler.user.dto.*;
import com.social.warbler.user.model.User;
import com.social.warbler.user.service.UserService;
import com.social.warbler.web.FlashNotices;
import com.social.warbler.web.Notice;
import com.social.warbler.web.Redirects;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService users;
    private final MessageService messages;
    private final SocialGraphService graph;
    private final SessionGate sessions;
    private final FlashNotices flashes;

    @GetMapping
    public List<UserSummary> list(@RequestParam(name = "q", required = false) String q) {
        return users.search(q).stream().map(UserSummary::from).toList();
    }

    @GetMapping("/{userId}")
    public ProfileView show(@PathVariable Long userId,
                            @AuthenticationPrincipal WarblerPrincipal principal) {
        Viewer viewer = Viewer.of(principal);
        User user = users.getById(userId);
        List<MessageView> recent = MessageView.fromAll(messages.recentBy(userId));
        boolean followed = viewer.isAuthenticated() && graph.isFollowing(viewer.userId(), userId);
        Set<Long> likes = viewer.isAuthenticated() ? graph.likedMessageIds(viewer.userId()) : Set.of();
        return ProfileView.of(user, counts(userId), followed, recent, likes);
    }

    @GetMapping("/{userId}/likes")
    public LikesView likes(@PathVariable Long userId,
                           @AuthenticationPrincipal WarblerPrincipal principal) {
        Viewer viewer = Viewer.of(principal);
        List<MessageView> liked = MessageView.fromAll(graph.messagesLikedBy(viewer, userId));
        return new LikesView(UserSummary.from(users.getById(userId)), liked,
                graph.likedMessageIds(viewer.userId()));
    }

    @GetMapping("/{userId}/following")
    public UserListView following(@PathVariable Long userId,
                                  @AuthenticationPrincipal WarblerPrincipal principal) {
        List<User> list = graph.following(Viewer.of(principal), userId);
        return new UserListView(UserSummary.from(users.getById(userId)),
                list.stream().map(UserSummary::from).toList());
    }

    @GetMapping("/{userId}/followers")
    public UserListView followers(@PathVariable Long userId,
                                  @AuthenticationPrincipal WarblerPrincipal principal) {
        List<User> list = graph.followers(Viewer.of(principal), userId);
        return new UserListView(UserSummary.from(users.getById(userId)),
                list.stream().map(UserSummary::from).toList());
    }

    @PostMapping("/follow/{followId}")
    public ResponseEntity<Map<String, Object>> follow(@PathVariable Long followId,
                                                      @AuthenticationPrincipal WarblerPrincipal principal) {
        Viewer viewer = Viewer.of(principal);
        FollowOutcome outcome = graph.follow(viewer, followId);
        return Redirects.to("/users/" + viewer.userId() + "/following",
                Map.of("userId", followId, "outcome", outcome));
    }

    @PostMapping("/stop-following/{followId}")
    public ResponseEntity<Map<String, Object>> stopFollowing(@PathVariable Long followId,
                                                             @AuthenticationPrincipal WarblerPrincipal principal) {
        Viewer viewer = Viewer.of(principal);
        FollowOutcome outcome = graph.unfollow(viewer, followId);
        return Redirects.to("/users/" + viewer.userId() + "/following",
                Map.of("userId", followId, "outcome", outcome));
    }

    @GetMapping("/profile")
    public ProfileForm editForm(@AuthenticationPrincipal WarblerPrincipal principal) {
        return ProfileForm.from(users.currentProfile(Viewer.of(principal)));
    }

    @PostMapping("/profile")
    public ResponseEntity<UserSummary> updateProfile(@Valid @RequestBody ProfileUpdate body,
                                                     @AuthenticationPrincipal WarblerPrincipal principal,
                                                     HttpServletRequest request) {
        User updated = users.updateProfile(Viewer.of(principal), body);
        flashes.add(request.getSession(), Notice.success("Profile updated successfully!"));
        return Redirects.to("/users/" + updated.getId(), UserSummary.from(updated));
    }

    @PostMapping("/delete")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal WarblerPrincipal principal,
                                       HttpServletRequest request) {
        users.deleteAccount(Viewer.of(principal));
        sessions.logout(request.getSession(false));
        return Redirects.to("/", null);
    }

    @PostMapping("/add_like/{messageId}")
    public ResponseEntity<Map<String, Object>> toggleLike(@PathVariable Long messageId,
                                                          @AuthenticationPrincipal WarblerPrincipal principal) {
        LikeOutcome outcome = graph.toggleLike(Viewer.of(principal), messageId);
        return Redirects.to("/", Map.of("messageId", messageId, "outcome", outcome));
    }

    private ProfileView.Counts counts(Long userId) {
        return new ProfileView.Counts(
                messages.countBy(userId),
                graph.countFollowing(userId),
                graph.countFollowers(userId),
                graph.countLikes(userId));
    }
}
