package ai.letitride.analytics;

import ai.letitride.game.FiveCardHandRank;
import ai.letitride.simulation.AggregateStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sanity checks a run against poker combinatorics and the game's known house edge: the final
 * five-card hands must follow the deal probabilities of a fair 52-card deck, and the per-hand
 * expected value and session win rate must be plausible.
 */
public final class HandFrequencyValidator {
    private static final double TOTAL_HANDS = 2_598_960.0;

    /** Probability of each five-card category from a fair deck, both pair ranks under {@code pair}. */
    public static final Map<String, Double> THEORETICAL_PROBABILITIES;

    static {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        probabilities.put("royal_flush", 4 / TOTAL_HANDS);
        probabilities.put("straight_flush", 36 / TOTAL_HANDS);
        probabilities.put("four_of_a_kind", 624 / TOTAL_HANDS);
        probabilities.put("full_house", 3_744 / TOTAL_HANDS);
        probabilities.put("flush", 5_108 / TOTAL_HANDS);
        probabilities.put("straight", 10_200 / TOTAL_HANDS);
        probabilities.put("three_of_a_kind", 54_912 / TOTAL_HANDS);
        probabilities.put("two_pair", 123_552 / TOTAL_HANDS);
        probabilities.put("pair", 1_098_240 / TOTAL_HANDS);
        probabilities.put("high_card", 1_302_540 / TOTAL_HANDS);
        THEORETICAL_PROBABILITIES = Collections.unmodifiableMap(probabilities);
    }

    /** House edge of the main game under basic strategy, per unit of base bet. */
    public static final double HOUSE_EDGE = 0.035;
    static final double SUSPICIOUS_P_VALUE = 0.001;
    static final double MAX_EV_DEVIATION = 0.20;

    private final double significanceLevel;
    private final double baseBet;

    public HandFrequencyValidator() {
        this(0.05, 1.0);
    }

    /**
     * @param baseBet scales the theoretical expected value so it compares with per-hand figures in
     *                currency
     */
    public HandFrequencyValidator(double significanceLevel, double baseBet) {
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("Significance level must be between 0 and 1, got " + significanceLevel);
        }
        if (baseBet <= 0) {
            throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
        }
        this.significanceLevel = significanceLevel;
        this.baseBet = baseBet;
    }

    public ValidationReport validate(AggregateStatistics stats) {
        List<String> warnings = new ArrayList<>();
        Map<String, Long> counts = categoryCounts(stats.getHandFrequencies());
        long counted = 0;
        for (long count : counts.values()) {
            counted += count;
        }

        ChiSquareResult chiSquare;
        Map<String, Double> observed = new LinkedHashMap<>();
        if (counted == 0) {
            chiSquare = ChiSquareResult.untested();
            warnings.add("No hand frequency data available for the chi-square test");
            THEORETICAL_PROBABILITIES.keySet().forEach(category -> observed.put(category, 0.0));
        } else {
            double[] expected = new double[THEORETICAL_PROBABILITIES.size()];
            long[] actual = new long[expected.length];
            int i = 0;
            for (Map.Entry<String, Double> entry : THEORETICAL_PROBABILITIES.entrySet()) {
                expected[i] = entry.getValue() * counted;
                actual[i] = counts.get(entry.getKey());
                observed.put(entry.getKey(), actual[i] / (double) counted);
                i++;
            }
            chiSquare = ChiSquareResult.test(expected, actual, significanceLevel);
            if (chiSquare.getPValue() < SUSPICIOUS_P_VALUE) {
                warnings.add(String.format("Chi-square p-value (%.6f) is very low, hands do not look randomly dealt",
                        chiSquare.getPValue()));
            }
        }

        double evTheoretical = -HOUSE_EDGE * baseBet;
        double evActual = stats.getExpectedValuePerHand();
        double evDeviation = Math.abs((evActual - evTheoretical) / evTheoretical);
        if (evDeviation > MAX_EV_DEVIATION) {
            warnings.add(String.format("EV deviation (%.1f%%) exceeds %.1f%%", evDeviation * 100,
                    MAX_EV_DEVIATION * 100));
        }

        ConfidenceInterval winRateInterval = ConfidenceInterval.wilson(stats.getWinningSessions(),
                stats.getTotalSessions(), 0.95);
        boolean extremeWinRate = stats.getSessionWinRate() < 0.1 || stats.getSessionWinRate() > 0.9;
        if (extremeWinRate) {
            warnings.add(String.format("Session win rate (%.1f%%) is unusually extreme",
                    stats.getSessionWinRate() * 100));
        }

        boolean valid = chiSquare.isPassed() && chiSquare.getPValue() >= SUSPICIOUS_P_VALUE && !extremeWinRate;
        return new ValidationReport(chiSquare, observed, THEORETICAL_PROBABILITIES, evActual, evTheoretical,
                evDeviation, stats.getSessionWinRate(), winRateInterval, warnings, valid);
    }

    /** Folds the two pair ranks together so counts line up with {@link #THEORETICAL_PROBABILITIES}. */
    static Map<String, Long> categoryCounts(Map<FiveCardHandRank, Long> frequencies) {
        Map<String, Long> counts = new LinkedHashMap<>();
        THEORETICAL_PROBABILITIES.keySet().forEach(category -> counts.put(category, 0L));
        frequencies.forEach((rank, count) -> {
            String category = rank == FiveCardHandRank.PAIR_BELOW_TENS || rank == FiveCardHandRank.PAIR_TENS_OR_BETTER
                    ? "pair" : rank.wireName();
            counts.merge(category, count, Long::sum);
        });
        return counts;
    }
}
