package uk.gegc.quizdrill.features.attempt.infra.session;

import jakarta.servlet.http.HttpSessionEvent;
import jakarta.servlet.http.HttpSessionListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.quizdrill.features.attempt.application.session.SessionStateStore;

/**
 * Releases test state when the HTTP session that keys it expires or is invalidated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionStateCleanupListener implements HttpSessionListener {

    private final SessionStateStore sessionStateStore;

    @Override
    public void sessionDestroyed(HttpSessionEvent event) {
        String sessionId = event.getSession().getId();
        sessionStateStore.clear(sessionId);
        log.debug("Session state released: sessionId={}", sessionId);
    }
}
