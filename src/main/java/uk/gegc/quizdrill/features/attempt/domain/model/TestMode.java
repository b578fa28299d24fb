package uk.gegc.quizdrill.features.attempt.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TestMode {
    @JsonProperty("standard")
    STANDARD,
    /**
     * Questions are drawn only from those with an open mistake record.
     */
    @JsonProperty("review")
    REVIEW
}
