package uk.gegc.quizdrill.features.repetition.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.repetition.application.WrongAnswerService;
import uk.gegc.quizdrill.features.repetition.application.dto.ReviewItemDto;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;
import uk.gegc.quizdrill.features.repetition.domain.repository.WrongAnswerRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

@Service
@Slf4j
public class WrongAnswerServiceImpl implements WrongAnswerService {

    private final WrongAnswerRepository repository;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();

    public WrongAnswerServiceImpl(WrongAnswerRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void update(String questionId, List<Integer> selectedIndices, boolean correct) {
        writeLock.lock();
        try {
            Map<String, WrongAnswerRecord> records = lookup();
            if (correct) {
                if (records.remove(questionId) != null) {
                    repository.saveAll(new ArrayList<>(records.values()));
                    log.debug("Mistake cleared: questionId={}", questionId);
                }
                return;
            }

            Instant now = Instant.now(clock);
            WrongAnswerRecord existing = records.get(questionId);
            WrongAnswerRecord next = existing == null
                    ? WrongAnswerRecord.first(questionId, selectedIndices, now)
                    : existing.recordAnotherMiss(selectedIndices, now);
            records.put(questionId, next);
            repository.saveAll(new ArrayList<>(records.values()));
            log.debug("Mistake recorded: questionId={}, wrongCount={}", questionId, next.wrongCount());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Question> reviewPool(List<Question> allQuestions) {
        Map<String, WrongAnswerRecord> records = lookup();
        return allQuestions.stream()
                .filter(question -> records.containsKey(question.id()))
                .toList();
    }

    @Override
    public List<WrongAnswerRecord> findAll() {
        return List.copyOf(repository.loadAll());
    }

    @Override
    public Map<String, WrongAnswerRecord> lookup() {
        Map<String, WrongAnswerRecord> byQuestionId = new LinkedHashMap<>();
        for (WrongAnswerRecord record : repository.loadAll()) {
            if (record.questionId() != null) {
                byQuestionId.put(record.questionId(), record);
            }
        }
        return byQuestionId;
    }

    @Override
    public List<ReviewItemDto> reviewOverview(List<Question> allQuestions) {
        Map<String, WrongAnswerRecord> records = lookup();
        return allQuestions.stream()
                .filter(question -> records.containsKey(question.id()))
                .map(question -> new ReviewItemDto(question, records.get(question.id())))
                .toList();
    }
}
