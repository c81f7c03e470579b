package com.social.warbler.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.social.warbler.IntegrationTestSupport;
import com.social.warbler.error.DuplicateException;
import com.social.warbler.error.UnauthorizedException;
import com.social.warbler.message.service.MessageService;
import com.social.warbler.security.Viewer;
import com.social.warbler.social.service.SocialGraphService;
import com.social.warbler.user.dto.ProfileUpdate;
import com.social.warbler.user.model.User;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class UserServiceTest extends IntegrationTestSupport {

    @Autowired MessageService messageService;
    @Autowired SocialGraphService graph;

    @Test
    void signupStoresHashAndAuthenticates() {
        User alice = userService.signup("alice", "a@x.com", "pw1", null);

        User stored = userRepository.findById(alice.getId()).orElseThrow();
        assertThat(stored.getPassword()).isNotEqualTo("pw1");
        assertThat(stored.getImageUrl()).isEqualTo(User.DEFAULT_IMAGE_URL);
        assertThat(stored.getHeaderImageUrl()).isEqualTo(User.DEFAULT_HEADER_IMAGE_URL);
        assertThat(userService.authenticate("alice", "pw1")).map(User::getId).contains(alice.getId());
    }

    @Test
    void signupKeepsGivenImage() {
        User alice = userService.signup("alice", "a@x.com", "pw1", "/img/alice.png");
        assertThat(alice.getImageUrl()).isEqualTo("/img/alice.png");
    }

    @Test
    void duplicateUsernameIsRejectedWithoutPartialRow() {
        userService.signup("alice", "a@x.com", "pw1", null);

        assertThatThrownBy(() -> userService.signup("alice", "other@x.com", "pw2", null))
                .isInstanceOf(DuplicateException.class)
                .hasMessage("Username already taken");
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    void duplicateEmailIsRejected() {
        userService.signup("alice", "a@x.com", "pw1", null);

        assertThatThrownBy(() -> userService.signup("alicia", "a@x.com", "pw2", null))
                .isInstanceOf(DuplicateException.class);
        assertThat(userRepository.findByUsername("alicia")).isEmpty();
    }

    @Test
    void usernamesAreCaseSensitive() {
        userService.signup("alice", "a@x.com", "pw1", null);
        userService.signup("Alice", "A2@x.com", "pw1", null);

        assertThat(userRepository.count()).isEqualTo(2);
        assertThat(userService.authenticate("ALICE", "pw1")).isEmpty();
    }

    @Test
    void badUsernameAndBadPasswordLookTheSame() {
        userService.signup("alice", "a@x.com", "pw1", null);

        assertThat(userService.authenticate("nobody", "pw1")).isEmpty();
        assertThat(userService.authenticate("alice", "wrong")).isEmpty();
    }

    @Test
    void searchMatchesUsernameSubstring() {
        signup("alice");
        signup("malice");
        signup("bob");

        assertThat(userService.search("lic")).extracting(User::getUsername)
                .containsExactly("alice", "malice");
        assertThat(userService.search(null)).hasSize(3);
        assertThat(userService.search("")).hasSize(3);
    }

    @Test
    void profileUpdateNeedsCurrentPassword() {
        User alice = userService.signup("alice", "a@x.com", "pw1", null);
        var form = new ProfileUpdate("alice2", "a2@x.com", "", null, "hi", "Paris", "wrong");

        assertThatThrownBy(() -> userService.updateProfile(viewer(alice), form))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid password.");
        assertThat(userRepository.findById(alice.getId()).orElseThrow().getUsername()).isEqualTo("alice");
    }

    @Test
    void profileUpdateAppliesFields() {
        User alice = userService.signup("alice", "a@x.com", "pw1", "/img/a.png");
        var form = new ProfileUpdate("alice2", "a2@x.com", "", "/img/header.png", "hi", "Paris", "pw1");

        User updated = userService.updateProfile(viewer(alice), form);

        assertThat(updated.getUsername()).isEqualTo("alice2");
        assertThat(updated.getEmail()).isEqualTo("a2@x.com");
        assertThat(updated.getImageUrl()).isEqualTo(User.DEFAULT_IMAGE_URL);
        assertThat(updated.getHeaderImageUrl()).isEqualTo("/img/header.png");
        assertThat(updated.getBio()).isEqualTo("hi");
        assertThat(updated.getLocation()).isEqualTo("Paris");
        assertThat(userService.authenticate("alice2", "pw1")).isPresent();
    }

    @Test
    void profileUpdateToTakenUsernameIsDuplicate() {
        User alice = signup("alice");
        signup("bob");
        var form = new ProfileUpdate("bob", "alice@x.com", null, null, null, null, "pw-alice");

        assertThatThrownBy(() -> userService.updateProfile(viewer(alice), form))
                .isInstanceOf(DuplicateException.class);
    }

    @Test
    void anonymousCannotUpdateOrDelete() {
        signup("alice");
        var form = new ProfileUpdate("x", "x@x.com", null, null, null, null, "pw-alice");

        assertThatThrownBy(() -> userService.updateProfile(Viewer.anonymous(), form))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> userService.deleteAccount(Viewer.anonymous()))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    void deletingAccountRemovesEverythingTouchingIt() {
        User alice = signup("alice");
        User bob = signup("bob");
        User carol = signup("carol");
        var bobMsg = messageService.post(viewer(bob), "from bob");
        var aliceMsg = messageService.post(viewer(alice), "from alice");
        graph.follow(viewer(alice), bob.getId());
        graph.follow(viewer(bob), alice.getId());
        graph.follow(viewer(carol), bob.getId());
        graph.toggleLike(viewer(alice), bobMsg.getId());
        graph.toggleLike(viewer(bob), aliceMsg.getId());

        userService.deleteAccount(viewer(bob));

        assertThat(userRepository.existsById(bob.getId())).isFalse();
        assertThat(messageRepository.countByUserId(bob.getId())).isZero();
        assertThat(graph.isFollowing(alice.getId(), bob.getId())).isFalse();
        assertThat(graph.isFollowedBy(alice.getId(), bob.getId())).isFalse();
        assertThat(graph.countFollowers(alice.getId())).isZero();
        assertThat(graph.countFollowing(carol.getId())).isZero();
        assertThat(likeRepository.count()).isZero();
        assertThat(graph.feedFor(viewer(alice))).extracting(m -> m.getText()).containsExactly("from alice");
    }
}
