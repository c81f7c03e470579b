// src/main/java/com/social/warbler/social/model/Follow.java
package com.social.warbler.social.model;

import com.social.warbler.user.model.User;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.springframework.data.domain.Persistable;

/**
 * Directed follow edge, follower -> followed.
 * Both directions of the graph are answered from this one relation.
 * <p>
 * The id is assigned, so a freshly built edge reports itself as new and is
 * inserted (never merged into an existing row); a concurrent duplicate fails
 * on the primary key.
 */
@Getter
@NoArgsConstructor
@Entity
@Table(name = "follows", indexes = {
        @Index(name = "ix_follows_follower", columnList = "follower_id"),
        @Index(name = "ix_follows_followed", columnList = "followed_id")
})
public class Follow implements Persistable<FollowId> {

    @EmbeddedId
    private FollowId id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @MapsId("followerId")
    @JoinColumn(name = "follower_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User follower;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @MapsId("followedId")
    @JoinColumn(name = "followed_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User followed;

    @Transient
    private boolean fresh = true;

    public Follow(User follower, User followed) {
        this.follower = follower;
        this.followed = followed;
        this.id = new FollowId(follower.getId(), followed.getId());
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }
}
