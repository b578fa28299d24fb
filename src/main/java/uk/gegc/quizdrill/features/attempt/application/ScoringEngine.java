package uk.gegc.quizdrill.features.attempt.application;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashSet;

/**
 * All-or-nothing scoring: an answer counts only when the selected indices are exactly the
 * correct ones.
 */
@Component
public class ScoringEngine {

    public boolean isCorrect(Collection<Integer> selected, Collection<Integer> correct) {
        return new HashSet<>(selected).equals(new HashSet<>(correct));
    }

    /**
     * The ratio is computed in double precision and its exact binary value rounded half-even,
     * so {@code 1 / 32} scores {@code 3.12}.
     *
     * @return {@code correctCount / totalQuestions * 100} rounded to two decimals,
     * or {@code 0} for an empty test
     */
    public double scorePercentage(int correctCount, int totalQuestions) {
        if (totalQuestions == 0) {
            return 0.0;
        }
        double percentage = (double) correctCount / totalQuestions * 100;
        return new BigDecimal(percentage)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
