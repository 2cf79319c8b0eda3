package ai.letitride.analytics;

import ai.letitride.simulation.SessionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Estimates the chance of losing a whole bankroll by replaying observed session profits.
 *
 * <p>For each bankroll level (a multiple of the base bet) the calculator runs Monte Carlo trials
 * that draw session profits with replacement from the observed sessions until the bankroll is gone
 * or the session cap is reached. Alongside full ruin it reports how often the bankroll dropped to
 * half and to three quarters of its starting size. An analytical estimate from the diffusion
 * approximation {@code exp(-2 * mean * bankroll / variance)} is reported for comparison.
 */
public final class RiskOfRuinCalculator {
    public static final List<Integer> DEFAULT_BANKROLL_UNITS = List.of(20, 40, 60, 80, 100);
    static final int MIN_SESSIONS = 10;

    private final List<Integer> bankrollUnits;
    private final Double baseBet;
    private final int simulationsPerLevel;
    private final int maxSessionsPerSimulation;
    private final double confidenceLevel;
    private final long seed;

    private RiskOfRuinCalculator(Builder b) {
        this.bankrollUnits = List.copyOf(new TreeSet<>(b.bankrollUnits));
        this.baseBet = b.baseBet;
        this.simulationsPerLevel = b.simulationsPerLevel;
        this.maxSessionsPerSimulation = b.maxSessionsPerSimulation;
        this.confidenceLevel = b.confidenceLevel;
        this.seed = b.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException with fewer than ten sessions or a non-positive base bet
     */
    public RiskOfRuinReport calculate(List<SessionResult> sessions) {
        if (sessions.size() < MIN_SESSIONS) {
            throw new IllegalArgumentException("At least " + MIN_SESSIONS
                    + " session results are needed to estimate risk of ruin, got " + sessions.size());
        }
        double[] profits = new double[sessions.size()];
        SummaryStatistics summary = new SummaryStatistics();
        double totalWagered = 0.0;
        long totalHands = 0;
        for (int i = 0; i < profits.length; i++) {
            SessionResult session = sessions.get(i);
            profits[i] = session.getSessionProfit();
            summary.addValue(profits[i]);
            totalWagered += session.getTotalWagered();
            totalHands += session.getHandsPlayed();
        }
        // Each hand puts three base bets on the layout before any are pulled.
        double unit = baseBet != null ? baseBet : totalHands > 0 ? totalWagered / (totalHands * 3.0) : 1.0;
        if (!(unit > 0)) {
            throw new IllegalArgumentException("Base bet must be positive, got " + unit);
        }
        double mean = summary.getMean();
        double std = profits.length > 1 ? summary.getStandardDeviation() : 0.0;

        Random random = new Random(seed);
        List<RiskOfRuinReport.Level> levels = new ArrayList<>();
        for (int units : bankrollUnits) {
            double bankroll = unit * units;
            levels.add(simulateLevel(profits, units, bankroll, random));
        }
        List<Double> analytical = new ArrayList<>();
        for (int units : bankrollUnits) {
            analytical.add(analyticalRuin(mean, std, unit * units));
        }
        return new RiskOfRuinReport(unit, sessions.get(0).getStartingBankroll(), levels, mean, std, analytical);
    }

    private RiskOfRuinReport.Level simulateLevel(double[] profits, int units, double bankroll, Random random) {
        double halfThreshold = bankroll * 0.5;
        double quarterThreshold = bankroll * 0.75;
        int ruined = 0;
        int halfLost = 0;
        int quarterLost = 0;
        for (int trial = 0; trial < simulationsPerLevel; trial++) {
            double balance = bankroll;
            boolean hitQuarter = false;
            boolean hitHalf = false;
            for (int s = 0; s < maxSessionsPerSimulation; s++) {
                balance += profits[random.nextInt(profits.length)];
                if (!hitQuarter && balance <= quarterThreshold) {
                    hitQuarter = true;
                    quarterLost++;
                }
                if (!hitHalf && balance <= halfThreshold) {
                    hitHalf = true;
                    halfLost++;
                }
                if (balance <= 0) {
                    ruined++;
                    break;
                }
            }
        }
        return new RiskOfRuinReport.Level(units, bankroll, ruined / (double) simulationsPerLevel,
                ConfidenceInterval.wilson(ruined, simulationsPerLevel, confidenceLevel),
                halfLost / (double) simulationsPerLevel, quarterLost / (double) simulationsPerLevel,
                simulationsPerLevel);
    }

    /**
     * Ruin probability of a random walk with drift {@code mean} and spread {@code std} per session.
     */
    static double analyticalRuin(double mean, double std, double bankroll) {
        if (std == 0) {
            return mean > 0 ? 0.0 : 1.0;
        }
        if (mean <= 0) {
            return 1.0;
        }
        double exponent = -2.0 * mean * bankroll / (std * std);
        return exponent < -700 ? 0.0 : Math.exp(exponent);
    }

    public static final class Builder {
        private List<Integer> bankrollUnits = DEFAULT_BANKROLL_UNITS;
        private Double baseBet;
        private int simulationsPerLevel = 10_000;
        private int maxSessionsPerSimulation = 10_000;
        private double confidenceLevel = 0.95;
        private long seed = 42L;

        private Builder() {
        }

        public Builder bankrollUnits(List<Integer> units) {
            this.bankrollUnits = units;
            return this;
        }

        /** Base bet in currency; inferred from the sessions' wagers when not set. */
        public Builder baseBet(double baseBet) {
            this.baseBet = baseBet;
            return this;
        }

        public Builder simulationsPerLevel(int simulations) {
            this.simulationsPerLevel = simulations;
            return this;
        }

        public Builder maxSessionsPerSimulation(int sessions) {
            this.maxSessionsPerSimulation = sessions;
            return this;
        }

        public Builder confidenceLevel(double level) {
            this.confidenceLevel = level;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a bankroll level or count is not positive or the
         *                                  confidence level is outside (0, 1)
         */
        public RiskOfRuinCalculator build() {
            if (bankrollUnits == null || bankrollUnits.isEmpty()) {
                throw new IllegalArgumentException("At least one bankroll level is required");
            }
            for (Integer units : bankrollUnits) {
                if (units == null || units <= 0) {
                    throw new IllegalArgumentException("Bankroll levels must be positive, got " + bankrollUnits);
                }
            }
            if (simulationsPerLevel <= 0 || maxSessionsPerSimulation <= 0) {
                throw new IllegalArgumentException("Simulation counts must be positive");
            }
            ConfidenceInterval.checkLevel(confidenceLevel);
            return new RiskOfRuinCalculator(this);
        }
    }
}
