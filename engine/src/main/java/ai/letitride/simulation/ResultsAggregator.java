package ai.letitride.simulation;

import ai.letitride.game.FiveCardHandRank;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds session results into {@link AggregateStatistics}.
 */
public final class ResultsAggregator {

    private ResultsAggregator() {
    }

    /**
     * @throws IllegalArgumentException if there are no results
     */
    public static AggregateStatistics aggregate(List<SessionResult> results) {
        return aggregate(results, Map.of());
    }

    /**
     * Aggregates sessions together with the counts of final hand ranks collected while they ran.
     *
     * @throws IllegalArgumentException if there are no results
     */
    public static AggregateStatistics aggregate(List<SessionResult> results,
                                                Map<FiveCardHandRank, Long> handFrequencies) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty list of session results");
        }
        int wins = 0;
        int losses = 0;
        int pushes = 0;
        long hands = 0;
        double mainWagered = 0.0;
        double bonusWagered = 0.0;
        double netResult = 0.0;
        double bonusNet = 0.0;
        List<Double> profits = new ArrayList<>(results.size());
        for (SessionResult result : results) {
            switch (result.getOutcome()) {
                case WIN:
                    wins++;
                    break;
                case LOSS:
                    losses++;
                    break;
                default:
                    pushes++;
                    break;
            }
            hands += result.getHandsPlayed();
            mainWagered += result.getTotalWagered();
            bonusWagered += result.getTotalBonusWagered();
            netResult += result.getSessionProfit();
            bonusNet += result.getBonusNetResult();
            profits.add(result.getSessionProfit());
        }
        double bonusWon = bonusWagered + bonusNet;
        double mainWon = mainWagered + (netResult - bonusNet);
        return build(wins, losses, pushes, hands, mainWagered, mainWon, bonusWagered, bonusWon,
                handFrequencies, profits);
    }

    /**
     * Combines two aggregates, as if their sessions had been aggregated together.
     */
    public static AggregateStatistics merge(AggregateStatistics a, AggregateStatistics b) {
        Map<FiveCardHandRank, Long> frequencies = new EnumMap<>(FiveCardHandRank.class);
        frequencies.putAll(a.getHandFrequencies());
        b.getHandFrequencies().forEach((rank, count) -> frequencies.merge(rank, count, Long::sum));
        List<Double> profits = new ArrayList<>(a.getSessionProfits());
        profits.addAll(b.getSessionProfits());
        return build(a.getWinningSessions() + b.getWinningSessions(),
                a.getLosingSessions() + b.getLosingSessions(),
                a.getPushSessions() + b.getPushSessions(),
                a.getTotalHands() + b.getTotalHands(),
                a.getMainWagered() + b.getMainWagered(),
                a.getMainWon() + b.getMainWon(),
                a.getBonusWagered() + b.getBonusWagered(),
                a.getBonusWon() + b.getBonusWon(),
                frequencies, profits);
    }

    private static AggregateStatistics build(int wins, int losses, int pushes, long hands, double mainWagered,
                                             double mainWon, double bonusWagered, double bonusWon,
                                             Map<FiveCardHandRank, Long> frequencies, List<Double> profits) {
        int n = profits.size();
        double mean = 0.0;
        double std = 0.0;
        double median = 0.0;
        double min = 0.0;
        double max = 0.0;
        if (n > 0) {
            double sum = 0.0;
            for (double profit : profits) {
                sum += profit;
            }
            mean = sum / n;
            if (n > 1) {
                double squares = 0.0;
                for (double profit : profits) {
                    squares += (profit - mean) * (profit - mean);
                }
                std = Math.sqrt(squares / (n - 1));
            }
            List<Double> sorted = new ArrayList<>(profits);
            Collections.sort(sorted);
            median = n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
            min = sorted.get(0);
            max = sorted.get(n - 1);
        }
        return new AggregateStatistics(wins, losses, pushes, hands, mainWagered, mainWon, bonusWagered, bonusWon,
                frequencies, profits, mean, std, median, min, max);
    }
}
