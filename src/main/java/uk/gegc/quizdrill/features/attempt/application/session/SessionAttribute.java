package uk.gegc.quizdrill.features.attempt.application.session;

import uk.gegc.quizdrill.features.attempt.domain.model.TestResults;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;

/**
 * Typed key for a value held in per-user session state.
 */
public record SessionAttribute<T>(String name, Class<T> type) {

    public static final SessionAttribute<TestSession> CURRENT_TEST =
            new SessionAttribute<>("currentTest", TestSession.class);

    public static final SessionAttribute<TestResults> LAST_RESULTS =
            new SessionAttribute<>("lastResults", TestResults.class);
}
