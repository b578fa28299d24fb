package uk.gegc.quizdrill.features.question.application.raw;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizdrill.BaseUnitTest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RawQuestionParser")
class RawQuestionParserTest extends BaseUnitTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RawQuestionParser parser = new RawQuestionParser();

    @Test
    @DisplayName("parse tags array choices as a sequence and keeps order")
    void parse_arrayChoices_sequence() throws Exception {
        RawQuestion raw = parser.parse(objectMapper.readTree("""
                {"question": "Q", "choices": ["b", "a"], "correct_answers": [1]}
                """));

        assertThat(raw.choices()).isEqualTo(new ChoiceInput.Sequence(List.of("b", "a")));
        assertThat(raw.correctAnswers()).containsExactly(new AnswerToken.IndexToken(1));
    }

    @Test
    @DisplayName("parse tags object choices as a key-sorted mapping")
    void parse_objectChoices_mapping() throws Exception {
        RawQuestion raw = parser.parse(objectMapper.readTree("""
                {"question": "Q", "options": {"2": "two", "1": "one"}, "answer": "1"}
                """));

        assertThat(raw.choices()).isInstanceOf(ChoiceInput.Mapping.class);
        assertThat(((ChoiceInput.Mapping) raw.choices()).entries()).containsExactly(
                Map.entry("1", "one"),
                Map.entry("2", "two"));
        assertThat(raw.correctAnswers()).containsExactly(new AnswerToken.TextToken("1"));
    }

    @Test
    @DisplayName("parse reports missing and unsupported choices")
    void parse_missingOrScalarChoices_tagged() throws Exception {
        RawQuestion missing = parser.parse(objectMapper.readTree("""
                {"question": "Q"}
                """));
        RawQuestion scalar = parser.parse(objectMapper.readTree("""
                {"question": "Q", "choices": 7}
                """));

        assertThat(missing.choices()).isInstanceOf(ChoiceInput.Absent.class);
        assertThat(scalar.choices()).isEqualTo(new ChoiceInput.Unsupported("NUMBER"));
    }

    @Test
    @DisplayName("parse treats a numeric zero answer as present")
    void parse_zeroAnswer_present() throws Exception {
        RawQuestion raw = parser.parse(objectMapper.readTree("""
                {"question": "Q", "correct_answer": 0, "answer": 1}
                """));

        assertThat(raw.correctAnswers()).containsExactly(new AnswerToken.IndexToken(0));
    }

    @Test
    @DisplayName("parse drops booleans, fractions, nulls and blank strings from answers")
    void parse_unusableAnswerValues_dropped() throws Exception {
        RawQuestion raw = parser.parse(objectMapper.readTree("""
                {"question": "Q", "answers": [true, 1.5, null, "  ", [0], " c "]}
                """));

        assertThat(raw.correctAnswers()).containsExactly(new AnswerToken.TextToken("c"));
    }

    @Test
    @DisplayName("parse trims scalar fields, keeps the id and source text as written and nulls out blanks")
    void parse_scalarFields_trimmed() throws Exception {
        RawQuestion raw = parser.parse(objectMapper.readTree("""
                {"id": "  ", "uuid": " u-1 ", "text": " T ", "domain": " Crypto ", "comment": ""}
                """));

        assertThat(raw.id()).isEqualTo(" u-1 ");
        assertThat(raw.text()).isEqualTo("T");
        assertThat(raw.sourceText()).isEqualTo(" T ");
        assertThat(raw.domain()).isEqualTo("Crypto");
        assertThat(raw.comment()).isNull();
    }
}
