package uk.gegc.quizdrill.features.dashboard.application.dto;

import uk.gegc.quizdrill.features.repetition.application.dto.ReviewItemDto;

import java.util.List;

/**
 * Overview of the question bank and the open mistakes.
 *
 * @param questionCount number of stored questions
 * @param wrongCount    number of open mistake records
 * @param domains       distinct domains in natural order
 * @param wrongDetails  every open mistake record with its question, if still stored
 */
public record DashboardSummaryDto(
        int questionCount,
        int wrongCount,
        List<String> domains,
        List<ReviewItemDto> wrongDetails
) {
}
