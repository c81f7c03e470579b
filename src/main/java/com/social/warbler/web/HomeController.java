package com.social.warbler.web;

import com.social.warbler.message.dto.MessageView;
import com.social.warbler.security.Viewer;
import com.social.warbler.security.WarblerPrincipal;
import com.social.warbler.social.service.SocialGraphService;
import com.social.warbler.user.dto.UserSummary;
import com.social.warbler.user.service.UserService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class HomeController {

    private final SocialGraphService graph;
    private final UserService users;
    private final FlashNotices flashes;

    @GetMapping("/")
    public HomeView home(@AuthenticationPrincipal WarblerPrincipal principal, HttpServletRequest request) {
        List<Notice> notices = flashes.drain(request.getSession(false));
        Viewer viewer = Viewer.of(principal);
        if (!viewer.isAuthenticated()) {
            return HomeView.anonymous(notices);
        }
        return new HomeView(true,
                UserSummary.from(users.getById(viewer.userId())),
                MessageView.fromAll(graph.feedFor(viewer)),
                graph.likedMessageIds(viewer.userId()),
                notices);
    }
}
