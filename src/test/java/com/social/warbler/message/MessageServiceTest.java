package com.social.warbler.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.social.warbler.IntegrationTestSupport;
import com.social.warbler.error.NotFoundException;
import com.social.warbler.error.UnauthorizedException;
import com.social.warbler.error.ValidationException;
import com.social.warbler.message.model.Message;
import com.social.warbler.message.service.MessageService;
import com.social.warbler.security.Viewer;
import com.social.warbler.social.service.SocialGraphService;
import com.social.warbler.user.model.User;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class MessageServiceTest extends IntegrationTestSupport {

    @Autowired MessageService messageService;
    @Autowired SocialGraphService graph;

    @Test
    void textOf140CharactersIsAccepted() {
        User alice = signup("alice");
        Instant before = Instant.now();

        Message msg = messageService.post(viewer(alice), "a".repeat(140));

        assertThat(msg.getId()).isNotNull();
        assertThat(msg.getTimestamp()).isAfterOrEqualTo(before);
        assertThat(messageService.getById(msg.getId()).getUser().getUsername()).isEqualTo("alice");
    }

    @Test
    void textOf141CharactersIsRejected() {
        User alice = signup("alice");

        assertThatThrownBy(() -> messageService.post(viewer(alice), "a".repeat(141)))
                .isInstanceOf(ValidationException.class);
        assertThat(messageRepository.count()).isZero();
    }

    @Test
    void lengthCountsCharactersNotUtf16Units() {
        User alice = signup("alice");
        String emoji = "\uD83D\uDE00";

        Message msg = messageService.post(viewer(alice), emoji.repeat(140));

        assertThat(msg.getText().codePointCount(0, msg.getText().length())).isEqualTo(140);
        assertThatThrownBy(() -> messageService.post(viewer(alice), emoji.repeat(141)))
                .isInstanceOf(ValidationException.class);
        assertThat(messageRepository.count()).isEqualTo(1);
    }

    @Test
    void blankTextIsRejected() {
        User alice = signup("alice");

        assertThatThrownBy(() -> messageService.post(viewer(alice), "   \t\n"))
                .isInstanceOf(ValidationException.class);
        assertThat(messageRepository.count()).isZero();
    }

    @Test
    void emptyTextIsRejected() {
        User alice = signup("alice");

        assertThatThrownBy(() -> messageService.post(viewer(alice), ""))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> messageService.post(viewer(alice), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void anonymousCannotPost() {
        assertThatThrownBy(() -> messageService.post(Viewer.anonymous(), "hello"))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(messageRepository.count()).isZero();
    }

    @Test
    void onlyTheAuthorMayDelete() {
        User alice = signup("alice");
        User bob = signup("bob");
        Message msg = messageService.post(viewer(alice), "mine");

        assertThatThrownBy(() -> messageService.delete(viewer(bob), msg.getId()))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> messageService.delete(Viewer.anonymous(), msg.getId()))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(messageRepository.existsById(msg.getId())).isTrue();

        messageService.delete(viewer(alice), msg.getId());
        assertThat(messageRepository.existsById(msg.getId())).isFalse();
    }

    @Test
    void deletingAMessageRemovesItsLike() {
        User alice = signup("alice");
        User bob = signup("bob");
        Message msg = messageService.post(viewer(alice), "like me");
        graph.toggleLike(viewer(bob), msg.getId());

        messageService.delete(viewer(alice), msg.getId());

        assertThat(likeRepository.count()).isZero();
        assertThat(graph.likedMessageIds(bob.getId())).isEmpty();
    }

    @Test
    void unknownMessageIsNotFound() {
        User alice = signup("alice");

        assertThatThrownBy(() -> messageService.getById(999_999L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> messageService.delete(viewer(alice), 999_999L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void profileMessagesAreNewestFirst() {
        User alice = signup("alice");
        messageService.post(viewer(alice), "one");
        messageService.post(viewer(alice), "two");
        messageService.post(viewer(alice), "three");

        assertThat(messageService.recentBy(alice.getId())).extracting(Message::getText)
                .containsExactly("three", "two", "one");
        assertThat(messageService.countBy(alice.getId())).isEqualTo(3);
    }
}
