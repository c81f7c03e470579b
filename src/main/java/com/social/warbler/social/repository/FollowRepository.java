// src/main/java/com/social/warbler/social/repository/FollowRepository.java
package com.social.warbler.social.repository;

import com.social.warbler.social.model.Follow;
import com.social.warbler.social.model.FollowId;
import com.social.warbler.user.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface FollowRepository extends JpaRepository<Follow, FollowId> {

    @Query("""
        select f.followed from Follow f
         where f.id.followerId = :userId
         order by f.followed.username asc
    """)
    List<User> findFollowing(@Param("userId") Long userId);

    @Query("""
        select f.follower from Follow f
         where f.id.followedId = :userId
         order by f.follower.username asc
    """)
    List<User> findFollowers(@Param("userId") Long userId);

    long countByIdFollowerId(Long followerId);

    long countByIdFollowedId(Long followedId);

    @Modifying
    @Query("delete from Follow f where f.id.followerId = :userId or f.id.followedId = :userId")
    int deleteAllTouching(@Param("userId") Long userId);
}
