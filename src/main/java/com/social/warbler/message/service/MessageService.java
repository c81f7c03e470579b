// src/main/java/com/social/warbler/message/service/MessageService.java
package com.social.warbler.message.service;

import com.social.warbler.error.NotFoundException;
import com.social.warbler.error.UnauthorizedException;
import com.social.warbler.error.ValidationException;
import com.social.warbler.message.model.Message;
import com.social.warbler.message.repository.MessageRepository;
import com.social.warbler.security.AccessGate;
import com.social.warbler.security.Viewer;
import com.social.warbler.social.repository.MessageLikeRepository;
import com.social.warbler.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class MessageService {

    private final MessageRepository repo;
    private final MessageLikeRepository likes;
    private final UserRepository users;

    @Value("${warbler.feed.limit:100}")
    private int limit;

    /** Text must hold 1..140 characters (code points) and not be blank. */
    public Message post(Viewer viewer, String text) {
        Long authorId = AccessGate.requireUser(viewer);
        if (!StringUtils.hasText(text) || text.codePointCount(0, text.length()) > Message.MAX_TEXT_LENGTH) {
            throw new ValidationException("Warble text must be 1 to " + Message.MAX_TEXT_LENGTH + " characters.");
        }
        Message saved = repo.save(Message.of(users.getReferenceById(authorId), text));
        log.debug("User {} posted warble {}", authorId, saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Message getById(Long id) {
        return repo.findWithAuthorById(id).orElseThrow(() -> new NotFoundException("Message", id));
    }

    /** Only the author may delete; likes on the warble go with it. */
    public void delete(Viewer viewer, Long messageId) {
        Long requesterId = AccessGate.requireUser(viewer);
        Message msg = getById(messageId);
        if (!msg.getUser().getId().equals(requesterId)) {
            log.warn("User {} tried to delete warble {} owned by {}", requesterId, messageId, msg.getUser().getId());
            throw new UnauthorizedException();
        }
        likes.deleteAllOnMessage(messageId);
        repo.delete(msg);
        log.debug("User {} deleted warble {}", requesterId, messageId);
    }

    /** Newest first, capped at the feed limit. */
    @Transactional(readOnly = true)
    public List<Message> recentBy(Long userId) {
        return repo.findRecentByAuthor(userId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public long countBy(Long userId) {
        return repo.countByUserId(userId);
    }
}
