package uk.gegc.quizdrill.features.attempt.application.session;

import java.util.Optional;

/**
 * Ephemeral key-value state scoped to one user context. Values in different user contexts
 * never see each other.
 */
public interface SessionStateStore {

    <T> Optional<T> get(String userKey, SessionAttribute<T> attribute);

    <T> void set(String userKey, SessionAttribute<T> attribute, T value);

    /**
     * Removes the value and returns what was stored, if anything.
     */
    <T> Optional<T> pop(String userKey, SessionAttribute<T> attribute);

    /**
     * Drops every value held for the user context.
     */
    void clear(String userKey);
}
