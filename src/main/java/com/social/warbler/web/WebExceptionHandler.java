// src/main/java/com/social/warbler/web/WebExceptionHandler.java
package com.social.warbler.web;

import com.social.warbler.error.DuplicateException;
import com.social.warbler.error.ForbiddenLikeException;
import com.social.warbler.error.NotFoundException;
import com.social.warbler.error.UnauthorizedException;
import com.social.warbler.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps per-request failures to responses. Refusals send the client back to the
 * landing page with a notice; bad input is answered in place.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class WebExceptionHandler {

    private final FlashNotices flashes;

    @ExceptionHandler({UnauthorizedException.class, ForbiddenLikeException.class})
    public ResponseEntity<Notice> refused(RuntimeException ex, HttpServletRequest request) {
        Notice notice = Notice.danger(ex.getMessage());
        flashes.add(request.getSession(), notice);
        return Redirects.to("/", notice);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Notice> invalid(ValidationException ex) {
        return ResponseEntity.badRequest().body(Notice.danger(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Notice> invalidForm(MethodArgumentNotValidException ex) {
        String text = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Notice.danger(text));
    }

    @ExceptionHandler(DuplicateException.class)
    public ResponseEntity<Notice> duplicate(DuplicateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Notice.danger(ex.getMessage()));
    }

    /** A constraint clash no service translated, e.g. a lost race between two requests. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Notice> conflict(DataIntegrityViolationException ex) {
        log.warn("Unhandled constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Notice.danger("The request conflicted with a concurrent change."));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Notice> notFound(NotFoundException ex) {
        log.debug("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Notice.danger(ex.getMessage()));
    }
}
