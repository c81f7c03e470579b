// src/main/java/com/social/warbler/user/repository/UserRepository.java
package com.social.warbler.user.repository;

import com.social.warbler.user.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    // Exact, case-sensitive match
    Optional<User> findByUsername(String username);

    List<User> findByUsernameContainingOrderByUsernameAsc(String fragment);

    List<User> findAllByOrderByUsernameAsc();
}
