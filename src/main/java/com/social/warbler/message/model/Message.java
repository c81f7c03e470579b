// src/main/java/com/social/warbler/message/model/Message.java
package com.social.warbler.message.model;

import com.social.warbler.user.model.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/** A single warble. */
@Entity
@Table(name = "messages",
        indexes = {
                @Index(name = "ix_messages_user", columnList = "user_id"),
                @Index(name = "ix_messages_timestamp", columnList = "timestamp")
        })
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

    public static final int MAX_TEXT_LENGTH = 140;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    // Sized in UTF-16 units: 140 characters outside the BMP take 280.
    @Column(nullable = false, length = 2 * MAX_TEXT_LENGTH)
    private String text;

    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @PrePersist
    public void prePersist() {
        if (timestamp == null) timestamp = Instant.now();
    }

    /** Convenience factory. */
    public static Message of(User author, String text) {
        return Message.builder()
                .user(author)
                .text(text)
                .timestamp(Instant.now())
                .build();
    }
}
