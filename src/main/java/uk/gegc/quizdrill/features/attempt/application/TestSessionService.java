package uk.gegc.quizdrill.features.attempt.application;

import uk.gegc.quizdrill.features.attempt.domain.model.TestResults;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;

import java.util.List;
import java.util.Map;

/**
 * Test lifecycle for one user context: create, view, submit, then read results.
 */
public interface TestSessionService {

    /**
     * Samples a new test and makes it the active one, replacing any previous test and
     * discarding the last results.
     *
     * @throws uk.gegc.quizdrill.shared.exception.EmptyQuestionPoolException if no question matches
     */
    TestSession createSession(String userKey, TestSessionRequest request);

    /**
     * @throws uk.gegc.quizdrill.shared.exception.NoActiveSessionException if no test is active
     */
    TestSession currentSession(String userKey);

    /**
     * Scores the active test, records mistakes and stores the results. The test is consumed.
     *
     * @param answersByQuestionId selected choice indices as submitted, keyed by question id
     * @throws uk.gegc.quizdrill.shared.exception.NoActiveSessionException if no test is active
     */
    TestResults submit(String userKey, Map<String, List<String>> answersByQuestionId);

    /**
     * @throws uk.gegc.quizdrill.shared.exception.NoResultsException if nothing was submitted yet
     */
    TestResults lastResults(String userKey);

    void clearResults(String userKey);
}
