package com.social.warbler.web;

import jakarta.servlet.http.HttpSession;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Notices queued in the session until the next page that shows them. */
@Component
public class FlashNotices {

    static final String ATTRIBUTE = "_flashes";

    public void add(HttpSession session, Notice notice) {
        List<Notice> queued = peek(session);
        List<Notice> next = new ArrayList<>(queued);
        next.add(notice);
        session.setAttribute(ATTRIBUTE, next);
    }

    /** Returns the queued notices and clears them. */
    public List<Notice> drain(HttpSession session) {
        if (session == null) return List.of();
        List<Notice> queued = peek(session);
        session.removeAttribute(ATTRIBUTE);
        return queued;
    }

    @SuppressWarnings("unchecked")
    private List<Notice> peek(HttpSession session) {
        Object v = session.getAttribute(ATTRIBUTE);
        return v instanceof List<?> l ? List.copyOf((List<Notice>) l) : List.of();
    }
}
