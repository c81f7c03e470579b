package com.social.warbler.message.dto;

import com.social.warbler.message.model.Message;
import com.social.warbler.user.dto.UserSummary;

import java.time.Instant;
import java.util.List;

public record MessageView(Long id, String text, Instant timestamp, UserSummary author) {

    public static MessageView from(Message m) {
        return new MessageView(m.getId(), m.getText(), m.getTimestamp(), UserSummary.from(m.getUser()));
    }

    public static List<MessageView> fromAll(List<Message> messages) {
        return messages.stream().map(MessageView::from).toList();
    }
}
