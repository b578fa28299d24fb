package uk.gegc.quizdrill.features.attempt.domain.model;

import uk.gegc.quizdrill.features.question.domain.model.Question;

import java.time.Instant;
import java.util.List;

/**
 * An in-progress test. The question list is fixed when the session is created and
 * keeps its sampled order.
 */
public record TestSession(List<Question> questions, Instant createdAt, TestMode mode) {

    public TestSession {
        questions = List.copyOf(questions);
    }
}
