// src/main/java/com/social/warbler/message/controller/MessageController.java
package com.social.warbler.message.controller;

import com.social.warbler.message.dto.MessageView;
import com.social.warbler.message.dto.NewMessageRequest;
import com.social.warbler.message.model.Message;
import com.social.warbler.message.service.MessageService;
import com.social.warbler.security.Viewer;
import com.social.warbler.security.WarblerPrincipal;
import com.social.warbler.web.Redirects;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messages;

    @PostMapping("/new")
    public ResponseEntity<MessageView> create(@Valid @RequestBody NewMessageRequest body,
                                              @AuthenticationPrincipal WarblerPrincipal principal) {
        Viewer viewer = Viewer.of(principal);
        Message saved = messages.post(viewer, body.text());
        return Redirects.to("/users/" + viewer.userId(), MessageView.from(saved));
    }

    @GetMapping("/{messageId}")
    public MessageView show(@PathVariable Long messageId) {
        return MessageView.from(messages.getById(messageId));
    }

    @PostMapping("/{messageId}/delete")
    public ResponseEntity<Void> delete(@PathVariable Long messageId,
                                       @AuthenticationPrincipal WarblerPrincipal principal) {
        Viewer viewer = Viewer.of(principal);
        messages.delete(viewer, messageId);
        return Redirects.to("/users/" + viewer.userId(), null);
    }
}
