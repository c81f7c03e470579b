// src/main/java/com/social/warbler/user/controller/AuthController.java
package com.social.warbler.user.controller;

import com.social.warbler.security.SessionGate;
import com.social.warbler.user.dto.LoginRequest;
import com.social.warbler.user.dto.SignupRequest;
import com.social.warbler.user.dto.UserSummary;
import com.social.warbler.user.model.User;
import com.social.warbler.user.service.UserService;
import com.social.warbler.web.FlashNotices;
import com.social.warbler.web.Notice;
import com.social.warbler.web.Redirects;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Signup, login and logout. None of these require a session identity. */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final UserService users;
    private final SessionGate sessions;
    private final FlashNotices flashes;

    @PostMapping("/signup")
    public ResponseEntity<UserSummary> signup(@Valid @RequestBody SignupRequest body,
                                              HttpServletRequest request) {
        User user = users.signup(body.username(), body.email(), body.password(), body.imageUrl());
        sessions.login(request.getSession(), user);
        return Redirects.to("/", UserSummary.from(user));
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest body,
                                   HttpServletRequest request) {
        return users.authenticate(body.username(), body.password())
                .<ResponseEntity<?>>map(user -> {
                    HttpSession session = request.getSession();
                    sessions.login(session, user);
                    flashes.add(session, Notice.success("Hello, " + user.getUsername() + "!"));
                    return Redirects.to("/", UserSummary.from(user));
                })
                .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(Notice.danger("Invalid credentials.")));
    }

    @GetMapping("/logout")
    public ResponseEntity<Notice> logout(HttpServletRequest request) {
        HttpSession session = request.getSession();
        sessions.logout(session);
        Notice notice = Notice.primary("You have been logged out.");
        flashes.add(session, notice);
        return Redirects.to("/", notice);
    }
}
