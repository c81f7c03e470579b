// src/main/java/com/social/warbler/social/repository/MessageLikeRepository.java
package com.social.warbler.social.repository;

import com.social.warbler.social.model.MessageLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MessageLikeRepository extends JpaRepository<MessageLike, Long> {

    Optional<MessageLike> findByUserIdAndMessageId(Long userId, Long messageId);

    long countByUserId(Long userId);

    @Query("select l.message.id from MessageLike l where l.user.id = :userId")
    List<Long> findMessageIdsLikedBy(@Param("userId") Long userId);

    @Modifying
    @Query("delete from MessageLike l where l.message.id = :messageId")
    int deleteAllOnMessage(@Param("messageId") Long messageId);

    /** Likes given by the user and likes received on the user's warbles. */
    @Modifying
    @Query("""
        delete from MessageLike l
         where l.user.id = :userId
            or l.message.id in (select m.id from Message m where m.user.id = :userId)
    """)
    int deleteAllTouching(@Param("userId") Long userId);
}
