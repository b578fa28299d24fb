package uk.gegc.quizdrill.features.attempt.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.quizdrill.features.attempt.application.impl.TestSessionServiceImpl;
import uk.gegc.quizdrill.features.attempt.domain.model.TestResults;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;
import uk.gegc.quizdrill.features.attempt.infra.session.InMemorySessionStateStore;
import uk.gegc.quizdrill.features.question.api.dto.ImportSummaryDto;
import uk.gegc.quizdrill.features.question.application.QuestionIdGenerator;
import uk.gegc.quizdrill.features.question.application.QuestionNormalizer;
import uk.gegc.quizdrill.features.question.application.imports.ImportPayloadReader;
import uk.gegc.quizdrill.features.question.application.imports.impl.QuestionImportServiceImpl;
import uk.gegc.quizdrill.features.question.application.raw.RawQuestionParser;
import uk.gegc.quizdrill.features.question.config.QuestionProperties;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.infra.persistence.JsonFileQuestionRepository;
import uk.gegc.quizdrill.features.repetition.application.impl.WrongAnswerServiceImpl;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;
import uk.gegc.quizdrill.features.repetition.infra.persistence.JsonFileWrongAnswerRepository;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Import, test and review against real JSON files.
 */
@DisplayName("Test session flow")
class TestSessionFlowTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path dataDir;

    private QuestionImportServiceImpl importService;
    private WrongAnswerServiceImpl wrongAnswerService;
    private TestSessionServiceImpl testSessionService;
    private JsonFileWrongAnswerRepository wrongAnswerRepository;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        JsonFileQuestionRepository questionRepository =
                new JsonFileQuestionRepository(dataDir.resolve("questions.json"), objectMapper);
        wrongAnswerRepository = new JsonFileWrongAnswerRepository(dataDir.resolve("wrong_questions.json"), objectMapper);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        importService = new QuestionImportServiceImpl(
                new ImportPayloadReader(objectMapper),
                new QuestionNormalizer(new RawQuestionParser(), new QuestionIdGenerator(new QuestionProperties())),
                questionRepository);
        wrongAnswerService = new WrongAnswerServiceImpl(wrongAnswerRepository, clock);
        testSessionService = new TestSessionServiceImpl(
                questionRepository,
                wrongAnswerService,
                new ScoringEngine(),
                new InMemorySessionStateStore(),
                new Random(7),
                clock);
    }

    @Test
    @DisplayName("a domain test of two questions with one right answer scores 50 and records one mistake")
    void domainTest_oneRightOneWrong_scoresFifty() {
        ImportSummaryDto summary = importService.importQuestions(new ByteArrayInputStream("""
                [
                  {"id": "a-1", "question": "A one", "choices": ["x", "y"], "correct_answers": [0], "domain": "A"},
                  {"id": "a-2", "question": "A two", "choices": ["x", "y"], "correct_answers": [1], "domain": "A"},
                  {"id": "b-1", "question": "B one", "choices": ["x", "y"], "correct_answers": [0], "domain": "B"},
                  {"id": "b-2", "question": "B two", "choices": ["x", "y"], "correct_answers": [1], "domain": "B"}
                ]
                """.getBytes(StandardCharsets.UTF_8)));
        assertThat(summary.imported()).isEqualTo(4);

        TestSession session = testSessionService.createSession("user", TestSessionRequest.standard("5", "A"));
        assertThat(session.questions()).extracting(Question::id).containsExactlyInAnyOrder("a-1", "a-2");

        TestResults results = testSessionService.submit("user", Map.of(
                "a-1", List.of("0"),
                "a-2", List.of("0")
        ));

        assertThat(results.score()).isEqualTo(50.0);
        assertThat(results.correctCount()).isEqualTo(1);
        assertThat(wrongAnswerRepository.loadAll())
                .containsExactly(new WrongAnswerRecord("a-2", 1, NOW, List.of(0)));
    }

    @Test
    @DisplayName("a review test draws the missed question and clears it once answered correctly")
    void reviewTest_correctAnswer_clearsMistake() {
        importService.importQuestions(new ByteArrayInputStream("""
                {"questions": [
                  {"id": "q-1", "question": "One", "choices": ["x", "y"], "correct_answers": [0]},
                  {"id": "q-2", "question": "Two", "choices": ["x", "y"], "correct_answers": [1]}
                ]}
                """.getBytes(StandardCharsets.UTF_8)));
        testSessionService.createSession("user", TestSessionRequest.standard(null, null));
        testSessionService.submit("user", Map.of("q-1", List.of("0"), "q-2", List.of("0")));

        TestSession review = testSessionService.createSession("user", TestSessionRequest.review(""));
        assertThat(review.questions()).extracting(Question::id).containsExactly("q-2");

        testSessionService.submit("user", Map.of("q-2", List.of("1")));

        assertThat(wrongAnswerService.findAll()).isEmpty();
    }
}
