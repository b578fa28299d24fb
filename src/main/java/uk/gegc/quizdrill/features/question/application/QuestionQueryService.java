package uk.gegc.quizdrill.features.question.application;

import uk.gegc.quizdrill.features.question.domain.model.Question;

import java.util.List;

public interface QuestionQueryService {

    List<Question> findAll();

    /**
     * @param domain exact, case-sensitive domain label; {@code null} or blank returns every question
     */
    List<Question> findByDomain(String domain);

    /**
     * Distinct domain labels in natural order.
     */
    List<String> findDomains();
}
