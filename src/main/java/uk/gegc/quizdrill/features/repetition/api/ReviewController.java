package uk.gegc.quizdrill.features.repetition.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizdrill.features.attempt.application.TestSessionRequest;
import uk.gegc.quizdrill.features.attempt.application.TestSessionService;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;
import uk.gegc.quizdrill.features.question.application.QuestionQueryService;
import uk.gegc.quizdrill.features.repetition.api.dto.ReviewTestRequest;
import uk.gegc.quizdrill.features.repetition.application.WrongAnswerService;
import uk.gegc.quizdrill.features.repetition.application.dto.ReviewItemDto;

import java.util.List;

@Tag(name = "Review", description = "Questions answered wrongly and review tests drawn from them")
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
public class ReviewController {

    private final WrongAnswerService wrongAnswerService;
    private final QuestionQueryService questionQueryService;
    private final TestSessionService testSessionService;

    @GetMapping
    @Operation(summary = "List questions due for review", description = "Each item carries the mistake count and last wrong answer.")
    public ResponseEntity<List<ReviewItemDto>> getReviewQueue() {
        return ResponseEntity.ok(wrongAnswerService.reviewOverview(questionQueryService.findAll()));
    }

    @PostMapping("/tests")
    @Operation(summary = "Start a review test", description = "Samples only from questions with an open mistake.")
    public ResponseEntity<TestSession> createReviewTest(@Valid @RequestBody(required = false) ReviewTestRequest request,
                                                        HttpSession session) {
        String totalQuestions = request == null ? null : request.totalQuestions();
        TestSession created = testSessionService.createSession(session.getId(), TestSessionRequest.review(totalQuestions));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
