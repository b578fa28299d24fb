package uk.gegc.quizdrill.features.attempt.infra.session;

import org.springframework.stereotype.Component;
import uk.gegc.quizdrill.features.attempt.application.session.SessionAttribute;
import uk.gegc.quizdrill.features.attempt.application.session.SessionStateStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemorySessionStateStore implements SessionStateStore {

    private final Map<String, Map<String, Object>> stateByUser = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(String userKey, SessionAttribute<T> attribute) {
        Map<String, Object> state = stateByUser.get(userKey);
        if (state == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.get(attribute.name())).map(attribute.type()::cast);
    }

    @Override
    public <T> void set(String userKey, SessionAttribute<T> attribute, T value) {
        if (value == null) {
            pop(userKey, attribute);
            return;
        }
        stateByUser.computeIfAbsent(userKey, key -> new ConcurrentHashMap<>())
                .put(attribute.name(), value);
    }

    @Override
    public <T> Optional<T> pop(String userKey, SessionAttribute<T> attribute) {
        Map<String, Object> state = stateByUser.get(userKey);
        if (state == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.remove(attribute.name())).map(attribute.type()::cast);
    }

    @Override
    public void clear(String userKey) {
        stateByUser.remove(userKey);
    }
}
