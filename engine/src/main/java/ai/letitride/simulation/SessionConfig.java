package ai.letitride.simulation;

import ai.letitride.bankroll.BettingContext;
import ai.letitride.bankroll.BonusBetPolicy;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Stakes and stop conditions of one player session.
 *
 * <p>Built through {@link #builder()}; {@link Builder#build()} rejects a configuration that could
 * never stop or could not afford its first hand.
 */
public final class SessionConfig {
    private final double startingBankroll;
    private final double baseBet;
    private final Double winLimit;
    private final Double lossLimit;
    private final Integer maxHands;
    private final boolean stopOnInsufficientFunds;
    private final double bonusBet;
    private final BonusBetPolicy bonusPolicy;

    private SessionConfig(Builder b) {
        this.startingBankroll = b.startingBankroll;
        this.baseBet = b.baseBet;
        this.winLimit = b.winLimit;
        this.lossLimit = b.lossLimit;
        this.maxHands = b.maxHands;
        this.stopOnInsufficientFunds = b.stopOnInsufficientFunds;
        this.bonusBet = b.bonusBet;
        this.bonusPolicy = b.bonusPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getStartingBankroll() {
        return startingBankroll;
    }

    public double getBaseBet() {
        return baseBet;
    }

    public OptionalDouble getWinLimit() {
        return winLimit == null ? OptionalDouble.empty() : OptionalDouble.of(winLimit);
    }

    public OptionalDouble getLossLimit() {
        return lossLimit == null ? OptionalDouble.empty() : OptionalDouble.of(lossLimit);
    }

    public OptionalInt getMaxHands() {
        return maxHands == null ? OptionalInt.empty() : OptionalInt.of(maxHands);
    }

    public boolean isStopOnInsufficientFunds() {
        return stopOnInsufficientFunds;
    }

    public double getBonusBet() {
        return bonusBet;
    }

    /**
     * Bonus stake for the next hand. A conditional policy decides from the session state and is
     * skipped when the bankroll cannot cover it on top of three base bets; otherwise the fixed
     * {@link #getBonusBet()} applies.
     */
    public double bonusBetFor(double baseBet, BettingContext context) {
        if (bonusPolicy == null || !bonusPolicy.isConditional()) {
            return bonusBet;
        }
        double amount = bonusPolicy.bonusBet(baseBet, context);
        return amount <= context.getBankroll() - baseBet * 3 ? amount : 0.0;
    }

    /** Three base bets plus the reserved bonus bet: what every hand must be able to cover. */
    public double minimumBankrollForHand() {
        return baseBet * 3 + bonusBet;
    }

    /**
     * Checks the stop conditions against a seat's state, in the order win limit, loss limit,
     * max hands, insufficient funds.
     *
     * @return the first condition that holds, or {@code null}
     */
    StopReason firstStopCondition(double sessionProfit, int handsPlayed, double balance) {
        if (winLimit != null && sessionProfit >= winLimit) {
            return StopReason.WIN_LIMIT;
        }
        if (lossLimit != null && sessionProfit <= -lossLimit) {
            return StopReason.LOSS_LIMIT;
        }
        if (maxHands != null && handsPlayed >= maxHands) {
            return StopReason.MAX_HANDS;
        }
        if (stopOnInsufficientFunds && balance < minimumBankrollForHand()) {
            return StopReason.INSUFFICIENT_FUNDS;
        }
        return null;
    }

    @Override
    public String toString() {
        return "SessionConfig(bankroll=" + startingBankroll + ", baseBet=" + baseBet + ", bonusBet=" + bonusBet
                + ", winLimit=" + winLimit + ", lossLimit=" + lossLimit + ", maxHands=" + maxHands
                + ", stopOnInsufficientFunds=" + stopOnInsufficientFunds + ")";
    }

    public static final class Builder {
        private double startingBankroll;
        private double baseBet;
        private Double winLimit;
        private Double lossLimit;
        private Integer maxHands;
        private boolean stopOnInsufficientFunds = true;
        private double bonusBet;
        private BonusBetPolicy bonusPolicy;

        private Builder() {
        }

        public Builder startingBankroll(double startingBankroll) {
            this.startingBankroll = startingBankroll;
            return this;
        }

        public Builder baseBet(double baseBet) {
            this.baseBet = baseBet;
            return this;
        }

        /** {@code null} disables the limit. */
        public Builder winLimit(Double winLimit) {
            this.winLimit = winLimit;
            return this;
        }

        /** Positive amount of loss; {@code null} disables the limit. */
        public Builder lossLimit(Double lossLimit) {
            this.lossLimit = lossLimit;
            return this;
        }

        /** {@code null} for no cap. */
        public Builder maxHands(Integer maxHands) {
            this.maxHands = maxHands;
            return this;
        }

        public Builder stopOnInsufficientFunds(boolean stopOnInsufficientFunds) {
            this.stopOnInsufficientFunds = stopOnInsufficientFunds;
            return this;
        }

        public Builder bonusBet(double bonusBet) {
            this.bonusBet = bonusBet;
            return this;
        }

        /** Sizes the bonus per hand when the policy is conditional; other policies use {@link #bonusBet}. */
        public Builder bonusPolicy(BonusBetPolicy bonusPolicy) {
            this.bonusPolicy = bonusPolicy;
            return this;
        }

        /**
         * @throws IllegalArgumentException if an amount or limit is out of range, no stop condition
         *                                  is configured, or the bankroll cannot cover one hand
         */
        public SessionConfig build() {
            if (startingBankroll <= 0) {
                throw new IllegalArgumentException("Starting bankroll must be positive, got " + startingBankroll);
            }
            if (baseBet <= 0) {
                throw new IllegalArgumentException("Base bet must be positive, got " + baseBet);
            }
            if (winLimit != null && winLimit <= 0) {
                throw new IllegalArgumentException("Win limit must be positive if set, got " + winLimit);
            }
            if (lossLimit != null && lossLimit <= 0) {
                throw new IllegalArgumentException("Loss limit must be positive if set, got " + lossLimit);
            }
            if (maxHands != null && maxHands <= 0) {
                throw new IllegalArgumentException("Max hands must be positive if set, got " + maxHands);
            }
            if (bonusBet < 0) {
                throw new IllegalArgumentException("Bonus bet cannot be negative, got " + bonusBet);
            }
            if (winLimit == null && lossLimit == null && maxHands == null && !stopOnInsufficientFunds) {
                throw new IllegalArgumentException("At least one stop condition must be configured: "
                        + "win limit, loss limit, max hands or stop on insufficient funds");
            }
            double required = baseBet * 3 + bonusBet;
            if (startingBankroll < required) {
                throw new IllegalArgumentException("Starting bankroll (" + startingBankroll
                        + ") must cover three base bets plus the bonus bet (" + required + ")");
            }
            return new SessionConfig(this);
        }
    }
}
