package uk.gegc.quizdrill.features.attempt.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizdrill.features.attempt.application.ScoringEngine;
import uk.gegc.quizdrill.features.attempt.application.TestSessionRequest;
import uk.gegc.quizdrill.features.attempt.application.TestSessionService;
import uk.gegc.quizdrill.features.attempt.application.session.SessionAttribute;
import uk.gegc.quizdrill.features.attempt.application.session.SessionStateStore;
import uk.gegc.quizdrill.features.attempt.domain.model.QuestionResult;
import uk.gegc.quizdrill.features.attempt.domain.model.TestMode;
import uk.gegc.quizdrill.features.attempt.domain.model.TestResults;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizdrill.features.repetition.application.WrongAnswerService;
import uk.gegc.quizdrill.shared.exception.EmptyQuestionPoolException;
import uk.gegc.quizdrill.shared.exception.NoActiveSessionException;
import uk.gegc.quizdrill.shared.exception.NoResultsException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;

@Service
@Slf4j
public class TestSessionServiceImpl implements TestSessionService {

    private final QuestionRepository questionRepository;
    private final WrongAnswerService wrongAnswerService;
    private final ScoringEngine scoringEngine;
    private final SessionStateStore sessionStateStore;
    private final Random random;
    private final Clock clock;

    public TestSessionServiceImpl(QuestionRepository questionRepository,
                                  WrongAnswerService wrongAnswerService,
                                  ScoringEngine scoringEngine,
                                  SessionStateStore sessionStateStore,
                                  Random random,
                                  Clock clock) {
        this.questionRepository = questionRepository;
        this.wrongAnswerService = wrongAnswerService;
        this.scoringEngine = scoringEngine;
        this.sessionStateStore = sessionStateStore;
        this.random = random;
        this.clock = clock;
    }

    @Override
    public TestSession createSession(String userKey, TestSessionRequest request) {
        List<Question> pool = questionRepository.loadAll();
        if (request.mode() == TestMode.REVIEW) {
            pool = wrongAnswerService.reviewPool(pool);
        }
        String domain = request.domain();
        if (domain != null && !domain.isEmpty()) {
            pool = pool.stream()
                    .filter(question -> domain.equals(question.domain()))
                    .toList();
        }
        if (pool.isEmpty()) {
            throw new EmptyQuestionPoolException(request.mode() == TestMode.REVIEW
                    ? "There are no questions to review right now."
                    : "No questions available for the selected criteria.");
        }

        int count = effectiveCount(parseRequestedCount(request.requestedCount()), pool.size());
        TestSession session = new TestSession(sample(pool, count), Instant.now(clock), request.mode());
        sessionStateStore.set(userKey, SessionAttribute.CURRENT_TEST, session);
        sessionStateStore.pop(userKey, SessionAttribute.LAST_RESULTS);

        log.info("Test session created: mode={}, domain={}, poolSize={}, questionCount={}",
                request.mode(), domain, pool.size(), count);
        return session;
    }

    @Override
    public TestSession currentSession(String userKey) {
        return sessionStateStore.get(userKey, SessionAttribute.CURRENT_TEST)
                .orElseThrow(NoActiveSessionException::new);
    }

    @Override
    public TestResults submit(String userKey, Map<String, List<String>> answersByQuestionId) {
        TestSession session = sessionStateStore.pop(userKey, SessionAttribute.CURRENT_TEST)
                .orElseThrow(NoActiveSessionException::new);
        Map<String, List<String>> answers = answersByQuestionId == null ? Map.of() : answersByQuestionId;

        List<QuestionResult> perQuestion = new ArrayList<>(session.questions().size());
        int correctCount = 0;
        for (Question question : session.questions()) {
            List<Integer> selected = parseSelection(answers.get(question.id()));
            List<Integer> correctAnswers = new ArrayList<>(new TreeSet<>(question.correctAnswers()));
            boolean correct = scoringEngine.isCorrect(selected, correctAnswers);
            if (correct) {
                correctCount++;
            }
            wrongAnswerService.update(question.id(), selected, correct);
            log.debug("Question scored: questionId={}, selected={}, correct={}", question.id(), selected, correct);
            perQuestion.add(new QuestionResult(question, selected, correctAnswers, correct));
        }

        int total = session.questions().size();
        TestResults results = new TestResults(
                perQuestion,
                scoringEngine.scorePercentage(correctCount, total),
                correctCount,
                total,
                session.mode()
        );
        sessionStateStore.set(userKey, SessionAttribute.LAST_RESULTS, results);

        log.info("Test submitted: mode={}, correct={}, total={}, score={}",
                session.mode(), correctCount, total, results.score());
        return results;
    }

    @Override
    public TestResults lastResults(String userKey) {
        return sessionStateStore.get(userKey, SessionAttribute.LAST_RESULTS)
                .orElseThrow(NoResultsException::new);
    }

    @Override
    public void clearResults(String userKey) {
        sessionStateStore.pop(userKey, SessionAttribute.LAST_RESULTS);
    }

    static int parseRequestedCount(String raw) {
        if (raw == null) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    static int effectiveCount(int requested, int poolSize) {
        int count = requested <= 0 ? poolSize : Math.min(requested, poolSize);
        return Math.max(1, count);
    }

    private List<Question> sample(List<Question> pool, int count) {
        List<Question> shuffled = new ArrayList<>(pool);
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(shuffled.size() - i);
            Collections.swap(shuffled, i, j);
        }
        return List.copyOf(shuffled.subList(0, count));
    }

    private List<Integer> parseSelection(List<String> submitted) {
        if (submitted == null || submitted.isEmpty()) {
            return List.of();
        }
        TreeSet<Integer> indices = new TreeSet<>();
        for (String value : submitted) {
            if (value == null) {
                continue;
            }
            try {
                indices.add(Integer.parseInt(value.trim()));
            } catch (NumberFormatException ex) {
                log.debug("Ignoring non-numeric choice value: {}", value);
            }
        }
        return new ArrayList<>(indices);
    }
}
