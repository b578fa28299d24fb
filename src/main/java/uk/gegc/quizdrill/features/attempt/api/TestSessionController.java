package uk.gegc.quizdrill.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizdrill.features.attempt.api.dto.CreateTestRequest;
import uk.gegc.quizdrill.features.attempt.api.dto.SubmitAnswersRequest;
import uk.gegc.quizdrill.features.attempt.application.TestSessionRequest;
import uk.gegc.quizdrill.features.attempt.application.TestSessionService;
import uk.gegc.quizdrill.features.attempt.domain.model.TestResults;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;

@Tag(name = "Tests", description = "Create, take and score randomized tests")
@RestController
@RequestMapping("/api/v1/tests")
@RequiredArgsConstructor
public class TestSessionController {

    private final TestSessionService testSessionService;

    @PostMapping
    @Operation(summary = "Start a test", description = "Samples questions at random and makes them the active test.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Test created",
                    content = @Content(schema = @Schema(implementation = TestSession.class))),
            @ApiResponse(responseCode = "400", description = "Request fields too long",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "No questions match the criteria",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<TestSession> createTest(@Valid @RequestBody(required = false) CreateTestRequest request,
                                                  HttpSession session) {
        CreateTestRequest body = request == null ? new CreateTestRequest(null, null) : request;
        TestSession created = testSessionService.createSession(
                session.getId(),
                TestSessionRequest.standard(body.totalQuestions(), body.domain()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/current")
    @Operation(summary = "Get the active test")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Active test"),
            @ApiResponse(responseCode = "409", description = "No active test",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<TestSession> getCurrentTest(HttpSession session) {
        return ResponseEntity.ok(testSessionService.currentSession(session.getId()));
    }

    @PostMapping("/current/submit")
    @Operation(summary = "Submit answers", description = "Scores the active test and records wrong answers for review.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Results",
                    content = @Content(schema = @Schema(implementation = TestResults.class))),
            @ApiResponse(responseCode = "409", description = "No active test",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<TestResults> submit(@RequestBody(required = false) SubmitAnswersRequest request,
                                              HttpSession session) {
        SubmitAnswersRequest body = request == null ? new SubmitAnswersRequest(null) : request;
        return ResponseEntity.ok(testSessionService.submit(session.getId(), body.answers()));
    }

    @GetMapping("/results")
    @Operation(summary = "Get the last results")
    public ResponseEntity<TestResults> getResults(HttpSession session) {
        return ResponseEntity.ok(testSessionService.lastResults(session.getId()));
    }

    @DeleteMapping("/results")
    @Operation(summary = "Discard the last results")
    public ResponseEntity<Void> clearResults(HttpSession session) {
        testSessionService.clearResults(session.getId());
        return ResponseEntity.noContent().build();
    }
}
