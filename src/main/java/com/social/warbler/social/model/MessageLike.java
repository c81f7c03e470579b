// src/main/java/com/social/warbler/social/model/MessageLike.java
package com.social.warbler.social.model;

import com.social.warbler.message.model.Message;
import com.social.warbler.user.model.User;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * A user liking a warble.
 * <p>
 * {@code message_id} is unique: a warble holds at most one like across all users.
 */
@Getter
@NoArgsConstructor
@Entity
@Table(name = "likes",
        uniqueConstraints = @UniqueConstraint(name = "uq_likes_message", columnNames = "message_id"),
        indexes = @Index(name = "ix_likes_user", columnList = "user_id"))
public class MessageLike {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Message message;

    public MessageLike(User user, Message message) {
        this.user = user;
        this.message = message;
    }
}
