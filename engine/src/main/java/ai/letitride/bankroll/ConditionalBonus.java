package ai.letitride.bankroll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conditions under which a bankroll-conditional bonus bet is placed, and how much it stakes.
 *
 * <p>No bonus is placed while the session profit is below {@code minSessionProfit}, the bankroll has
 * fallen below {@code minBankrollRatio} of its start, or the drawdown from the start exceeds
 * {@code maxDrawdown}. Otherwise the stake is {@code baseAmount}, replaced by the first matching
 * {@link ProfitTier}, and replaced again by {@code profitPercentage} of a positive profit. The result
 * is dropped below {@code minBet} and capped at {@code maxBet}. Unset conditions do not apply.
 */
public final class ConditionalBonus {
    private final double baseAmount;
    private final Double minSessionProfit;
    private final Double minBankrollRatio;
    private final Double maxDrawdown;
    private final Double profitPercentage;
    private final List<ProfitTier> tiers;
    private final double minBet;
    private final double maxBet;

    private ConditionalBonus(Builder b) {
        this.baseAmount = b.baseAmount;
        this.minSessionProfit = b.minSessionProfit;
        this.minBankrollRatio = b.minBankrollRatio;
        this.maxDrawdown = b.maxDrawdown;
        this.profitPercentage = b.profitPercentage;
        this.tiers = Collections.unmodifiableList(new ArrayList<>(b.tiers));
        this.minBet = b.minBet;
        this.maxBet = b.maxBet;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the bonus stake for the next hand, 0 when a condition blocks it
     */
    public double bonusBet(BettingContext context) {
        double profit = context.getSessionProfit();
        double start = context.getStartingBankroll();
        if (minSessionProfit != null && profit < minSessionProfit) {
            return 0.0;
        }
        if (minBankrollRatio != null && start > 0 && context.getBankroll() / start < minBankrollRatio) {
            return 0.0;
        }
        if (maxDrawdown != null && start > 0 && (start - context.getBankroll()) / start > maxDrawdown) {
            return 0.0;
        }
        double bet = baseAmount;
        for (ProfitTier tier : tiers) {
            if (tier.contains(profit)) {
                bet = tier.getBetAmount();
                break;
            }
        }
        if (profitPercentage != null && profit > 0) {
            bet = profit * profitPercentage;
        }
        if (bet <= 0 || bet < minBet) {
            return 0.0;
        }
        return Math.min(bet, maxBet);
    }

    public double getBaseAmount() {
        return baseAmount;
    }

    public List<ProfitTier> getTiers() {
        return tiers;
    }

    @Override
    public String toString() {
        return "ConditionalBonus(base=" + baseAmount + ", minProfit=" + minSessionProfit + ", minRatio="
                + minBankrollRatio + ", maxDrawdown=" + maxDrawdown + ", profitPct=" + profitPercentage
                + ", tiers=" + tiers.size() + ", limits=" + minBet + "-" + maxBet + ")";
    }

    /**
     * Stake used while the session profit lies in {@code [minProfit, maxProfit)}.
     */
    public static final class ProfitTier {
        private final double minProfit;
        private final Double maxProfit;
        private final double betAmount;

        /**
         * @param maxProfit exclusive upper bound, {@code null} for none
         * @throws IllegalArgumentException for a negative amount or an empty range
         */
        public ProfitTier(double minProfit, Double maxProfit, double betAmount) {
            if (betAmount < 0) {
                throw new IllegalArgumentException("Tier bet amount cannot be negative, got " + betAmount);
            }
            if (maxProfit != null && minProfit >= maxProfit) {
                throw new IllegalArgumentException("Tier min profit " + minProfit + " must be below max profit "
                        + maxProfit);
            }
            this.minProfit = minProfit;
            this.maxProfit = maxProfit;
            this.betAmount = betAmount;
        }

        boolean contains(double profit) {
            return profit >= minProfit && (maxProfit == null || profit < maxProfit);
        }

        public double getBetAmount() {
            return betAmount;
        }

        @Override
        public String toString() {
            return "[" + minProfit + ", " + (maxProfit == null ? "inf" : maxProfit) + ") -> " + betAmount;
        }
    }

    public static final class Builder {
        private double baseAmount = 1.0;
        private Double minSessionProfit = 0.0;
        private Double minBankrollRatio;
        private Double maxDrawdown = 0.25;
        private Double profitPercentage;
        private final List<ProfitTier> tiers = new ArrayList<>();
        private double minBet = 1.0;
        private double maxBet = 25.0;

        private Builder() {
        }

        public Builder baseAmount(double baseAmount) {
            this.baseAmount = baseAmount;
            return this;
        }

        /** {@code null} for no minimum. */
        public Builder minSessionProfit(Double minSessionProfit) {
            this.minSessionProfit = minSessionProfit;
            return this;
        }

        public Builder minBankrollRatio(Double minBankrollRatio) {
            this.minBankrollRatio = minBankrollRatio;
            return this;
        }

        /** Fraction of the starting bankroll, {@code null} for no limit. */
        public Builder maxDrawdown(Double maxDrawdown) {
            this.maxDrawdown = maxDrawdown;
            return this;
        }

        public Builder profitPercentage(Double profitPercentage) {
            this.profitPercentage = profitPercentage;
            return this;
        }

        /** Tiers are matched in the order added. */
        public Builder tier(double minProfit, Double maxProfit, double betAmount) {
            tiers.add(new ProfitTier(minProfit, maxProfit, betAmount));
            return this;
        }

        public Builder limits(double minBet, double maxBet) {
            this.minBet = minBet;
            this.maxBet = maxBet;
            return this;
        }

        /**
         * @throws IllegalArgumentException for negative amounts, ratios outside (0, 1] or inverted limits
         */
        public ConditionalBonus build() {
            if (baseAmount < 0) {
                throw new IllegalArgumentException("Base amount cannot be negative, got " + baseAmount);
            }
            checkFraction("Min bankroll ratio", minBankrollRatio);
            checkFraction("Max drawdown", maxDrawdown);
            checkFraction("Profit percentage", profitPercentage);
            if (minBet < 0 || maxBet <= 0 || minBet > maxBet) {
                throw new IllegalArgumentException("Invalid bonus limits " + minBet + "-" + maxBet);
            }
            return new ConditionalBonus(this);
        }

        private static void checkFraction(String name, Double value) {
            if (value != null && (value <= 0 || value > 1)) {
                throw new IllegalArgumentException(name + " must be in (0, 1], got " + value);
            }
        }
    }
}
