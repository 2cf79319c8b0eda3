package ai.letitride.analytics;

import java.util.List;

/**
 * Risk of ruin across bankroll levels, in ascending bankroll order. Built by
 * {@link RiskOfRuinCalculator}.
 */
public final class RiskOfRuinReport {
    private final double baseBet;
    private final double startingBankroll;
    private final List<Level> levels;
    private final double meanSessionProfit;
    private final double sessionProfitStd;
    private final List<Double> analyticalEstimates;

    RiskOfRuinReport(double baseBet, double startingBankroll, List<Level> levels, double meanSessionProfit,
                     double sessionProfitStd, List<Double> analyticalEstimates) {
        this.baseBet = baseBet;
        this.startingBankroll = startingBankroll;
        this.levels = List.copyOf(levels);
        this.meanSessionProfit = meanSessionProfit;
        this.sessionProfitStd = sessionProfitStd;
        this.analyticalEstimates = List.copyOf(analyticalEstimates);
    }

    public double getBaseBet() {
        return baseBet;
    }

    /** Starting bankroll of the simulated sessions the estimate was drawn from. */
    public double getStartingBankroll() {
        return startingBankroll;
    }

    public List<Level> getLevels() {
        return levels;
    }

    public double getMeanSessionProfit() {
        return meanSessionProfit;
    }

    public double getSessionProfitStd() {
        return sessionProfitStd;
    }

    /** Diffusion-approximation ruin probabilities, one per level. */
    public List<Double> getAnalyticalEstimates() {
        return analyticalEstimates;
    }

    @Override
    public String toString() {
        return "RiskOfRuinReport{baseBet=" + baseBet + ", levels=" + levels + '}';
    }

    public static final class Level {
        private final int bankrollUnits;
        private final double bankroll;
        private final double ruinProbability;
        private final ConfidenceInterval ruinInterval;
        private final double halfBankrollRisk;
        private final double quarterBankrollRisk;
        private final int simulations;

        Level(int bankrollUnits, double bankroll, double ruinProbability, ConfidenceInterval ruinInterval,
              double halfBankrollRisk, double quarterBankrollRisk, int simulations) {
            this.bankrollUnits = bankrollUnits;
            this.bankroll = bankroll;
            this.ruinProbability = ruinProbability;
            this.ruinInterval = ruinInterval;
            this.halfBankrollRisk = halfBankrollRisk;
            this.quarterBankrollRisk = quarterBankrollRisk;
            this.simulations = simulations;
        }

        /** Bankroll as a multiple of the base bet. */
        public int getBankrollUnits() {
            return bankrollUnits;
        }

        public double getBankroll() {
            return bankroll;
        }

        public double getRuinProbability() {
            return ruinProbability;
        }

        public ConfidenceInterval getRuinInterval() {
            return ruinInterval;
        }

        /** Share of trials that fell to half the bankroll or less. */
        public double getHalfBankrollRisk() {
            return halfBankrollRisk;
        }

        /** Share of trials that lost a quarter of the bankroll or more. */
        public double getQuarterBankrollRisk() {
            return quarterBankrollRisk;
        }

        public int getSimulations() {
            return simulations;
        }

        @Override
        public String toString() {
            return String.format("%d units: ruin %.4f %s, 50%% loss %.4f, 25%% loss %.4f", bankrollUnits,
                    ruinProbability, ruinInterval, halfBankrollRisk, quarterBankrollRisk);
        }
    }
}
