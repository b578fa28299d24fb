package uk.gegc.quizdrill.features.question.application.raw;

import java.util.List;
import java.util.SortedMap;

/**
 * The shapes a raw {@code choices}/{@code options} field can take.
 */
public sealed interface ChoiceInput {

    /**
     * Options as an ordered array.
     */
    record Sequence(List<String> values) implements ChoiceInput {
        public Sequence {
            values = List.copyOf(values);
        }
    }

    /**
     * Options keyed by label, e.g. {@code {"A": "...", "B": "..."}}. Entries are kept sorted by key.
     */
    record Mapping(SortedMap<String, String> entries) implements ChoiceInput {
    }

    record Absent() implements ChoiceInput {
    }

    record Unsupported(String nodeType) implements ChoiceInput {
    }
}
