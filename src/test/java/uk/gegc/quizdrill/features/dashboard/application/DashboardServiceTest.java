package uk.gegc.quizdrill.features.dashboard.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.quizdrill.BaseUnitTest;
import uk.gegc.quizdrill.features.dashboard.application.dto.DashboardSummaryDto;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizdrill.features.repetition.application.WrongAnswerService;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@DisplayName("DashboardService")
class DashboardServiceTest extends BaseUnitTest {

    @Mock
    private QuestionRepository questionRepository;

    @Mock
    private WrongAnswerService wrongAnswerService;

    @InjectMocks
    private DashboardService dashboardService;

    @Test
    @DisplayName("summary counts questions and mistakes and lists sorted distinct domains")
    void summary_countsAndDomains() {
        Question crypto = question("q-1", "Cryptography");
        Question access = question("q-2", "Access Control");
        Question crypto2 = question("q-3", "Cryptography");
        WrongAnswerRecord onCrypto = new WrongAnswerRecord("q-1", 2, Instant.EPOCH, List.of(1));
        WrongAnswerRecord orphan = new WrongAnswerRecord("gone", 1, Instant.EPOCH, List.of(0));
        when(questionRepository.loadAll()).thenReturn(List.of(crypto, access, crypto2));
        when(wrongAnswerService.findAll()).thenReturn(List.of(onCrypto, orphan));

        DashboardSummaryDto summary = dashboardService.summary();

        assertThat(summary.questionCount()).isEqualTo(3);
        assertThat(summary.wrongCount()).isEqualTo(2);
        assertThat(summary.domains()).containsExactly("Access Control", "Cryptography");
        assertThat(summary.wrongDetails()).hasSize(2);
        assertThat(summary.wrongDetails().get(0).question()).isEqualTo(crypto);
        assertThat(summary.wrongDetails().get(1).question()).isNull();
        assertThat(summary.wrongDetails().get(1).record()).isEqualTo(orphan);
    }

    @Test
    @DisplayName("summary of an empty bank is all zeros")
    void summary_emptyBank() {
        when(questionRepository.loadAll()).thenReturn(List.of());
        when(wrongAnswerService.findAll()).thenReturn(List.of());

        DashboardSummaryDto summary = dashboardService.summary();

        assertThat(summary.questionCount()).isZero();
        assertThat(summary.wrongCount()).isZero();
        assertThat(summary.domains()).isEmpty();
        assertThat(summary.wrongDetails()).isEmpty();
    }

    private Question question(String id, String domain) {
        return new Question(id, "Question " + id, List.of("a", "b"), List.of(0), domain, "");
    }
}
