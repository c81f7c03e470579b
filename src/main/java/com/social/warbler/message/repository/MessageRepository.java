// src/main/java/com/social/warbler/message/repository/MessageRepository.java
package com.social.warbler.message.repository;

import com.social.warbler.message.model.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MessageRepository extends JpaRepository<Message, Long> {

    @Query("select m from Message m join fetch m.user where m.id = :id")
    Optional<Message> findWithAuthorById(@Param("id") Long id);

    @Query("""
        select m from Message m join fetch m.user
         where m.user.id = :userId
         order by m.timestamp desc, m.id desc
    """)
    List<Message> findRecentByAuthor(@Param("userId") Long userId, Pageable page);

    /**
     * Own warbles plus those of every followed user. The follow edges are a
     * subquery so a warble is returned at most once.
     */
    @Query("""
        select m from Message m join fetch m.user
         where m.user.id = :userId
            or m.user.id in (select f.id.followedId from Follow f where f.id.followerId = :userId)
         order by m.timestamp desc, m.id desc
    """)
    List<Message> findFeed(@Param("userId") Long userId, Pageable page);

    @Query("""
        select m from Message m join fetch m.user
         where m.id in (select l.message.id from MessageLike l where l.user.id = :userId)
         order by m.timestamp desc, m.id desc
    """)
    List<Message> findLikedBy(@Param("userId") Long userId, Pageable page);

    long countByUserId(Long userId);

    @Modifying
    @Query("delete from Message m where m.user.id = :userId")
    int deleteAllByAuthor(@Param("userId") Long userId);
}
