package uk.gegc.quizdrill.features.question.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizdrill.features.question.application.raw.AnswerToken;
import uk.gegc.quizdrill.features.question.application.raw.ChoiceInput;
import uk.gegc.quizdrill.features.question.application.raw.RawQuestion;
import uk.gegc.quizdrill.features.question.application.raw.RawQuestionParser;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Turns loosely shaped question records into canonical {@link Question}s.
 * Performs no I/O; a record that cannot be normalized raises {@link ValidationException}
 * and the caller decides whether to skip it or abort.
 */
@Component
@RequiredArgsConstructor
public class QuestionNormalizer {

    private static final int MIN_CHOICES = 2;

    private final RawQuestionParser rawQuestionParser;
    private final QuestionIdGenerator idGenerator;

    public Question normalize(JsonNode rawQuestion) {
        return normalize(rawQuestionParser.parse(rawQuestion));
    }

    public Question normalize(RawQuestion raw) {
        String text = raw.text();
        if (text == null || text.isBlank()) {
            throw new ValidationException("Question text is required");
        }

        List<String> choices = orderedChoices(raw.choices());
        if (choices.size() < MIN_CHOICES) {
            throw new ValidationException("Choices must be a list with at least two options");
        }

        List<Integer> correctAnswers = normalizeCorrectAnswers(raw.correctAnswers(), choices);
        if (correctAnswers.isEmpty()) {
            throw new ValidationException("At least one correct answer is required");
        }

        String domain = raw.domain() == null ? Question.DEFAULT_DOMAIN : raw.domain();
        String comment = raw.comment() == null ? "" : raw.comment();
        String id = raw.id() != null ? raw.id() : idGenerator.deriveId(raw.sourceText());

        return new Question(id, text, choices, correctAnswers, domain, comment);
    }

    /**
     * Resolves answer tokens to choice indices. Integers are taken as indices, single letters
     * as {@code A = 0, B = 1, ...}, anything else is matched case-insensitively against the
     * choice text. Tokens that resolve to nothing are dropped.
     *
     * @return distinct indices in ascending order, possibly empty
     */
    public List<Integer> normalizeCorrectAnswers(List<AnswerToken> tokens, List<String> choices) {
        List<String> lowerChoices = choices.stream()
                .map(choice -> choice.toLowerCase(Locale.ROOT))
                .toList();
        TreeSet<Integer> resolved = new TreeSet<>();
        for (AnswerToken token : tokens) {
            if (token instanceof AnswerToken.IndexToken indexToken) {
                if (inRange(indexToken.index(), choices.size())) {
                    resolved.add(indexToken.index());
                }
            } else if (token instanceof AnswerToken.TextToken textToken) {
                int index = resolveText(textToken.value(), lowerChoices);
                if (index >= 0) {
                    resolved.add(index);
                }
            }
        }
        return new ArrayList<>(resolved);
    }

    private int resolveText(String value, List<String> lowerChoices) {
        if (value.length() == 1) {
            char letter = Character.toUpperCase(value.charAt(0));
            if (letter >= 'A' && letter <= 'Z') {
                int index = letter - 'A';
                if (inRange(index, lowerChoices.size())) {
                    return index;
                }
            }
        }
        return lowerChoices.indexOf(value.toLowerCase(Locale.ROOT));
    }

    private List<String> orderedChoices(ChoiceInput input) {
        if (input instanceof ChoiceInput.Sequence sequence) {
            return sequence.values();
        }
        if (input instanceof ChoiceInput.Mapping mapping) {
            return List.copyOf(mapping.entries().values());
        }
        return List.of();
    }

    private static boolean inRange(int index, int size) {
        return index >= 0 && index < size;
    }
}
