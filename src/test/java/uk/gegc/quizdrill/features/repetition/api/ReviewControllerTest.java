package uk.gegc.quizdrill.features.repetition.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.quizdrill.features.attempt.application.TestSessionRequest;
import uk.gegc.quizdrill.features.attempt.application.TestSessionService;
import uk.gegc.quizdrill.features.attempt.domain.model.TestMode;
import uk.gegc.quizdrill.features.attempt.domain.model.TestSession;
import uk.gegc.quizdrill.features.question.application.QuestionQueryService;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.repetition.application.WrongAnswerService;
import uk.gegc.quizdrill.features.repetition.application.dto.ReviewItemDto;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ReviewController")
class ReviewControllerTest {

    private static final Question QUESTION =
            new Question("q-1", "Which port?", List.of("22", "443"), List.of(1), "Networking", "");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WrongAnswerService wrongAnswerService;

    @MockitoBean
    private QuestionQueryService questionQueryService;

    @MockitoBean
    private TestSessionService testSessionService;

    @Test
    @DisplayName("GET /api/v1/review lists due questions with their mistake history")
    void getReviewQueue_returnsItems() throws Exception {
        when(questionQueryService.findAll()).thenReturn(List.of(QUESTION));
        when(wrongAnswerService.reviewOverview(List.of(QUESTION))).thenReturn(List.of(new ReviewItemDto(
                QUESTION, new WrongAnswerRecord("q-1", 2, Instant.parse("2024-06-01T12:00:00Z"), List.of(0)))));

        mockMvc.perform(get("/api/v1/review"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].question.id").value("q-1"))
                .andExpect(jsonPath("$[0].record.wrong_count").value(2))
                .andExpect(jsonPath("$[0].record.last_answer[0]").value(0));
    }

    @Test
    @DisplayName("POST /api/v1/review/tests starts a review test")
    void createReviewTest_returnsCreated() throws Exception {
        MockHttpSession httpSession = new MockHttpSession(null, "http-session-2");
        when(testSessionService.createSession("http-session-2", TestSessionRequest.review(null)))
                .thenReturn(new TestSession(List.of(QUESTION), Instant.parse("2024-06-01T12:00:00Z"), TestMode.REVIEW));

        mockMvc.perform(post("/api/v1/review/tests").session(httpSession))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.mode").value("review"))
                .andExpect(jsonPath("$.questions[0].id").value("q-1"));
    }
}
