package uk.gegc.quizdrill.features.question.application.imports.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizdrill.features.question.api.dto.ImportErrorDto;
import uk.gegc.quizdrill.features.question.api.dto.ImportSummaryDto;
import uk.gegc.quizdrill.features.question.application.QuestionNormalizer;
import uk.gegc.quizdrill.features.question.application.imports.ImportPayloadReader;
import uk.gegc.quizdrill.features.question.application.imports.NormalizationOutcome;
import uk.gegc.quizdrill.features.question.application.imports.QuestionImportService;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizdrill.shared.exception.ValidationException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionImportServiceImpl implements QuestionImportService {

    private final ImportPayloadReader payloadReader;
    private final QuestionNormalizer normalizer;
    private final QuestionRepository questionRepository;

    private final ReentrantLock writeLock = new ReentrantLock();

    @Override
    public ImportSummaryDto importQuestions(InputStream input) {
        return importQuestions(payloadReader.readTree(input));
    }

    @Override
    public ImportSummaryDto importQuestions(JsonNode payload) {
        List<JsonNode> records = payloadReader.extractRecords(payload);
        List<NormalizationOutcome> outcomes = normalizeAll(records);

        writeLock.lock();
        try {
            return merge(outcomes);
        } finally {
            writeLock.unlock();
        }
    }

    private List<NormalizationOutcome> normalizeAll(List<JsonNode> records) {
        List<NormalizationOutcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            try {
                outcomes.add(NormalizationOutcome.success(i, normalizer.normalize(records.get(i))));
            } catch (ValidationException ex) {
                log.debug("Skipping import record: index={}, reason={}", i, ex.getMessage());
                outcomes.add(NormalizationOutcome.failure(i, ex.getMessage()));
            }
        }
        return outcomes;
    }

    private ImportSummaryDto merge(List<NormalizationOutcome> outcomes) {
        Map<String, Question> byId = new LinkedHashMap<>();
        for (Question existing : questionRepository.loadAll()) {
            if (existing.id() != null) {
                byId.put(existing.id(), existing);
            }
        }

        int imported = 0;
        int updated = 0;
        List<ImportErrorDto> errors = new ArrayList<>();
        for (NormalizationOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                errors.add(new ImportErrorDto(outcome.index(), outcome.error()));
                continue;
            }
            Question question = outcome.question();
            if (byId.containsKey(question.id())) {
                updated++;
            } else {
                imported++;
            }
            byId.put(question.id(), question);
        }

        questionRepository.saveAll(new ArrayList<>(byId.values()));
        log.info("Question import finished: imported={}, updated={}, skipped={}, total={}",
                imported, updated, errors.size(), byId.size());
        return new ImportSummaryDto(imported, updated, errors.size(), errors);
    }
}
