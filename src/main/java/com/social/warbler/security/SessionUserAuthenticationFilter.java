package com.social.warbler.security;

import com.social.warbler.user.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Resolves the session's user id into a {@link WarblerPrincipal}. An id whose
 * user no longer exists is dropped from the session and the request stays
 * anonymous.
 */
public class SessionUserAuthenticationFilter extends OncePerRequestFilter {
    private final SessionGate sessions;
    private final UserRepository users;

    public SessionUserAuthenticationFilter(SessionGate sessions, UserRepository users) {
        this.sessions = sessions;
        this.users = users;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        HttpSession session = request.getSession(false);
        sessions.currentUserId(session).ifPresent(id -> users.findById(id).ifPresentOrElse(
                user -> {
                    var principal = new WarblerPrincipal(user.getId(), user.getUsername());
                    var auth = new UsernamePasswordAuthenticationToken(
                            principal, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
                    SecurityContextHolder.getContext().setAuthentication(auth);
                },
                () -> sessions.logout(session)));
        chain.doFilter(request, response);
    }
}
