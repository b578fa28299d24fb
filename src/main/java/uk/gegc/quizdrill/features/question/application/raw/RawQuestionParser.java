package uk.gegc.quizdrill.features.question.application.raw;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.quizdrill.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads a raw JSON question record into a {@link RawQuestion}. All field aliasing and
 * shape detection for imported questions happens here and nowhere else.
 */
@Component
public class RawQuestionParser {

    private static final List<String> TEXT_FIELDS = List.of("question", "text", "prompt");
    private static final List<String> CHOICE_FIELDS = List.of("choices", "options");
    private static final List<String> ANSWER_FIELDS = List.of("correct_answers", "correct_answer", "answer", "answers");
    private static final List<String> COMMENT_FIELDS = List.of("comment", "explanation");
    private static final List<String> ID_FIELDS = List.of("id", "uuid");

    public RawQuestion parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("Question must be a JSON object");
        }
        JsonNode text = firstScalar(node, TEXT_FIELDS);
        JsonNode id = firstScalar(node, ID_FIELDS);
        return new RawQuestion(
                id == null ? null : id.asText(),
                text == null ? null : text.asText().trim(),
                text == null ? null : text.asText(),
                readChoices(node),
                readAnswers(node),
                scalarText(node.get("domain")),
                firstText(node, COMMENT_FIELDS)
        );
    }

    private ChoiceInput readChoices(JsonNode node) {
        JsonNode choices = firstPresent(node, CHOICE_FIELDS);
        if (choices == null) {
            return new ChoiceInput.Absent();
        }
        if (choices.isArray()) {
            List<String> values = new ArrayList<>(choices.size());
            for (JsonNode choice : choices) {
                values.add(stringForm(choice));
            }
            return new ChoiceInput.Sequence(values);
        }
        if (choices.isObject()) {
            SortedMap<String, String> entries = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = choices.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), stringForm(field.getValue()));
            }
            return new ChoiceInput.Mapping(entries);
        }
        return new ChoiceInput.Unsupported(choices.getNodeType().name());
    }

    private List<AnswerToken> readAnswers(JsonNode node) {
        JsonNode answers = firstPresent(node, ANSWER_FIELDS);
        if (answers == null) {
            return List.of();
        }
        List<AnswerToken> tokens = new ArrayList<>();
        if (answers.isArray()) {
            for (JsonNode answer : answers) {
                addToken(tokens, answer);
            }
        } else {
            addToken(tokens, answers);
        }
        return tokens;
    }

    private void addToken(List<AnswerToken> tokens, JsonNode answer) {
        if (answer.isIntegralNumber() && answer.canConvertToInt()) {
            tokens.add(new AnswerToken.IndexToken(answer.intValue()));
        } else if (answer.isTextual()) {
            String value = answer.textValue().trim();
            if (!value.isEmpty()) {
                tokens.add(new AnswerToken.TextToken(value));
            }
        }
    }

    /**
     * First aliased field that is present, not null and not an empty string or container.
     * A numeric zero counts as present.
     */
    private JsonNode firstPresent(JsonNode node, List<String> fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isTextual() && value.textValue().isBlank()) {
                continue;
            }
            if (value.isContainerNode() && value.isEmpty()) {
                continue;
            }
            return value;
        }
        return null;
    }

    private String firstText(JsonNode node, List<String> fieldNames) {
        JsonNode value = firstScalar(node, fieldNames);
        return value == null ? null : value.asText().trim();
    }

    /**
     * First aliased field holding a scalar whose text is not blank.
     */
    private JsonNode firstScalar(JsonNode node, List<String> fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (scalarText(value) != null) {
                return value;
            }
        }
        return null;
    }

    private String scalarText(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private String stringForm(JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }
}
