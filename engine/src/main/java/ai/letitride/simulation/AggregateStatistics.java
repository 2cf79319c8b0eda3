package ai.letitride.simulation;

import ai.letitride.game.FiveCardHandRank;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics over a set of sessions. Built by {@link ResultsAggregator}.
 *
 * <p>Amounts follow the usual casino convention: {@code totalWon} is what came back to the players
 * (stakes included), so {@code netResult == totalWon - totalWagered}. Per-hand expected values divide
 * by {@code totalHands}. The individual session profits are retained so two aggregates can be merged
 * without losing the median or standard deviation.
 */
public final class AggregateStatistics {
    private final int totalSessions;
    private final int winningSessions;
    private final int losingSessions;
    private final int pushSessions;
    private final long totalHands;
    private final double mainWagered;
    private final double mainWon;
    private final double bonusWagered;
    private final double bonusWon;
    private final Map<FiveCardHandRank, Long> handFrequencies;
    private final List<Double> sessionProfits;
    private final double sessionProfitMean;
    private final double sessionProfitStd;
    private final double sessionProfitMedian;
    private final double sessionProfitMin;
    private final double sessionProfitMax;

    AggregateStatistics(int winningSessions, int losingSessions, int pushSessions, long totalHands,
                        double mainWagered, double mainWon, double bonusWagered, double bonusWon,
                        Map<FiveCardHandRank, Long> handFrequencies, List<Double> sessionProfits,
                        double sessionProfitMean, double sessionProfitStd, double sessionProfitMedian,
                        double sessionProfitMin, double sessionProfitMax) {
        this.totalSessions = winningSessions + losingSessions + pushSessions;
        this.winningSessions = winningSessions;
        this.losingSessions = losingSessions;
        this.pushSessions = pushSessions;
        this.totalHands = totalHands;
        this.mainWagered = mainWagered;
        this.mainWon = mainWon;
        this.bonusWagered = bonusWagered;
        this.bonusWon = bonusWon;
        Map<FiveCardHandRank, Long> frequencies = new EnumMap<>(FiveCardHandRank.class);
        frequencies.putAll(handFrequencies);
        this.handFrequencies = Collections.unmodifiableMap(frequencies);
        this.sessionProfits = List.copyOf(sessionProfits);
        this.sessionProfitMean = sessionProfitMean;
        this.sessionProfitStd = sessionProfitStd;
        this.sessionProfitMedian = sessionProfitMedian;
        this.sessionProfitMin = sessionProfitMin;
        this.sessionProfitMax = sessionProfitMax;
    }

    public int getTotalSessions() {
        return totalSessions;
    }

    public int getWinningSessions() {
        return winningSessions;
    }

    public int getLosingSessions() {
        return losingSessions;
    }

    public int getPushSessions() {
        return pushSessions;
    }

    /** Fraction of sessions that ended in profit. */
    public double getSessionWinRate() {
        return totalSessions == 0 ? 0.0 : (double) winningSessions / totalSessions;
    }

    public long getTotalHands() {
        return totalHands;
    }

    public double getTotalWagered() {
        return mainWagered + bonusWagered;
    }

    public double getTotalWon() {
        return mainWon + bonusWon;
    }

    public double getNetResult() {
        return getTotalWon() - getTotalWagered();
    }

    public double getExpectedValuePerHand() {
        return perHand(getNetResult());
    }

    public double getMainWagered() {
        return mainWagered;
    }

    public double getMainWon() {
        return mainWon;
    }

    public double getMainEvPerHand() {
        return perHand(mainWon - mainWagered);
    }

    public double getBonusWagered() {
        return bonusWagered;
    }

    public double getBonusWon() {
        return bonusWon;
    }

    public double getBonusEvPerHand() {
        return perHand(bonusWon - bonusWagered);
    }

    /**
     * Final five-card ranks of the hands that were settled, in rank order. Empty when no hand
     * counts were collected.
     */
    public Map<FiveCardHandRank, Long> getHandFrequencies() {
        return handFrequencies;
    }

    /**
     * Share of each rank among the counted hands (0 to 1), keyed by wire name.
     */
    public Map<String, Double> getHandFrequencyPct() {
        long counted = 0;
        for (long count : handFrequencies.values()) {
            counted += count;
        }
        Map<String, Double> pct = new LinkedHashMap<>();
        if (counted == 0) {
            return pct;
        }
        for (Map.Entry<FiveCardHandRank, Long> entry : handFrequencies.entrySet()) {
            pct.put(entry.getKey().wireName(), entry.getValue() / (double) counted);
        }
        return pct;
    }

    public List<Double> getSessionProfits() {
        return sessionProfits;
    }

    public double getSessionProfitMean() {
        return sessionProfitMean;
    }

    /** Sample standard deviation; 0 for fewer than two sessions. */
    public double getSessionProfitStd() {
        return sessionProfitStd;
    }

    public double getSessionProfitMedian() {
        return sessionProfitMedian;
    }

    public double getSessionProfitMin() {
        return sessionProfitMin;
    }

    public double getSessionProfitMax() {
        return sessionProfitMax;
    }

    private double perHand(double amount) {
        return totalHands == 0 ? 0.0 : amount / totalHands;
    }

    @Override
    public String toString() {
        return String.format("AggregateStatistics(sessions=%d, winRate=%.4f, hands=%d, net=%.2f, ev/hand=%.4f, "
                        + "profit mean=%.2f std=%.2f median=%.2f)", totalSessions, getSessionWinRate(), totalHands,
                getNetResult(), getExpectedValuePerHand(), sessionProfitMean, sessionProfitStd, sessionProfitMedian);
    }
}
