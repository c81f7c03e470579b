package com.social.warbler;

import com.social.warbler.message.repository.MessageRepository;
import com.social.warbler.security.Viewer;
import com.social.warbler.social.repository.FollowRepository;
import com.social.warbler.social.repository.MessageLikeRepository;
import com.social.warbler.user.model.User;
import com.social.warbler.user.repository.UserRepository;
import com.social.warbler.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Full application context on H2. Tests are not transactional: every service
 * call commits or rolls back on its own, as it would per request.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    @Autowired protected UserService userService;
    @Autowired protected UserRepository userRepository;
    @Autowired protected MessageRepository messageRepository;
    @Autowired protected FollowRepository followRepository;
    @Autowired protected MessageLikeRepository likeRepository;

    @BeforeEach
    protected void clearTables() {
        likeRepository.deleteAllInBatch();
        followRepository.deleteAllInBatch();
        messageRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    protected User signup(String username) {
        return userService.signup(username, username + "@x.com", "pw-" + username, null);
    }

    protected static Viewer viewer(User user) {
        return Viewer.of(user.getId(), user.getUsername());
    }
}
