package uk.gegc.quizdrill.features.dashboard.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.quizdrill.features.dashboard.application.dto.DashboardSummaryDto;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizdrill.features.repetition.application.WrongAnswerService;
import uk.gegc.quizdrill.features.repetition.application.dto.ReviewItemDto;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private final QuestionRepository questionRepository;
    private final WrongAnswerService wrongAnswerService;

    public DashboardSummaryDto summary() {
        List<Question> questions = questionRepository.loadAll();
        List<WrongAnswerRecord> records = wrongAnswerService.findAll();

        Map<String, Question> questionsById = questions.stream()
                .filter(question -> question.id() != null)
                .collect(Collectors.toMap(Question::id, Function.identity(), (first, second) -> second));
        TreeSet<String> domains = questions.stream()
                .map(Question::domain)
                .collect(Collectors.toCollection(TreeSet::new));
        List<ReviewItemDto> wrongDetails = records.stream()
                .map(record -> new ReviewItemDto(questionsById.get(record.questionId()), record))
                .toList();

        return new DashboardSummaryDto(questions.size(), records.size(), List.copyOf(domains), wrongDetails);
    }
}
