package uk.gegc.quizdrill.features.attempt.application;

import uk.gegc.quizdrill.features.attempt.domain.model.TestMode;

/**
 * Parameters for a new test.
 *
 * @param requestedCount number of questions as entered by the learner; blank, non-numeric or
 *                       non-positive values select the whole pool
 * @param domain         exact domain to draw from, or {@code null}/empty for all domains
 * @param mode           {@link TestMode#REVIEW} restricts the pool to questions with open mistakes
 */
public record TestSessionRequest(String requestedCount, String domain, TestMode mode) {

    public TestSessionRequest {
        if (mode == null) {
            mode = TestMode.STANDARD;
        }
    }

    public static TestSessionRequest standard(String requestedCount, String domain) {
        return new TestSessionRequest(requestedCount, domain, TestMode.STANDARD);
    }

    public static TestSessionRequest review(String requestedCount) {
        return new TestSessionRequest(requestedCount, null, TestMode.REVIEW);
    }
}
