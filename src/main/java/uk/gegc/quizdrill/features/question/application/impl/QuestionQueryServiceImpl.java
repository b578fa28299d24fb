package uk.gegc.quizdrill.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.quizdrill.features.question.application.QuestionQueryService;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.domain.repository.QuestionRepository;

import java.util.List;
import java.util.TreeSet;

@Service
@RequiredArgsConstructor
public class QuestionQueryServiceImpl implements QuestionQueryService {

    private final QuestionRepository questionRepository;

    @Override
    public List<Question> findAll() {
        return List.copyOf(questionRepository.loadAll());
    }

    @Override
    public List<Question> findByDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return findAll();
        }
        return questionRepository.loadAll().stream()
                .filter(question -> domain.equals(question.domain()))
                .toList();
    }

    @Override
    public List<String> findDomains() {
        TreeSet<String> domains = new TreeSet<>();
        questionRepository.loadAll().forEach(question -> domains.add(question.domain()));
        return List.copyOf(domains);
    }
}
