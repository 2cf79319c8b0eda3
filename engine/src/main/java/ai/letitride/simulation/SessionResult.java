package ai.letitride.simulation;

import java.util.Objects;

/**
 * Final figures of one player session.
 *
 * <p>{@code totalWagered} sums the main-game amounts left at risk after the pull/ride decisions;
 * bonus stakes are kept apart in {@code totalBonusWagered} and their net in {@code bonusNetResult},
 * so the main game's net is {@code sessionProfit - bonusNetResult}.
 */
public final class SessionResult {
    private final SessionOutcome outcome;
    private final StopReason stopReason;
    private final int handsPlayed;
    private final double startingBankroll;
    private final double finalBankroll;
    private final double sessionProfit;
    private final double totalWagered;
    private final double totalBonusWagered;
    private final double bonusNetResult;
    private final double peakBankroll;
    private final double maxDrawdown;
    private final double maxDrawdownPct;

    public SessionResult(StopReason stopReason, int handsPlayed, double startingBankroll, double finalBankroll,
                         double totalWagered, double totalBonusWagered, double bonusNetResult, double peakBankroll,
                         double maxDrawdown, double maxDrawdownPct) {
        this.stopReason = Objects.requireNonNull(stopReason, "stopReason");
        this.handsPlayed = handsPlayed;
        this.startingBankroll = startingBankroll;
        this.finalBankroll = finalBankroll;
        this.sessionProfit = finalBankroll - startingBankroll;
        this.outcome = SessionOutcome.fromProfit(sessionProfit);
        this.totalWagered = totalWagered;
        this.totalBonusWagered = totalBonusWagered;
        this.bonusNetResult = bonusNetResult;
        this.peakBankroll = peakBankroll;
        this.maxDrawdown = maxDrawdown;
        this.maxDrawdownPct = maxDrawdownPct;
    }

    public SessionOutcome getOutcome() {
        return outcome;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public int getHandsPlayed() {
        return handsPlayed;
    }

    public double getStartingBankroll() {
        return startingBankroll;
    }

    public double getFinalBankroll() {
        return finalBankroll;
    }

    public double getSessionProfit() {
        return sessionProfit;
    }

    public double getTotalWagered() {
        return totalWagered;
    }

    public double getTotalBonusWagered() {
        return totalBonusWagered;
    }

    public double getBonusNetResult() {
        return bonusNetResult;
    }

    public double getPeakBankroll() {
        return peakBankroll;
    }

    public double getMaxDrawdown() {
        return maxDrawdown;
    }

    public double getMaxDrawdownPct() {
        return maxDrawdownPct;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionResult)) {
            return false;
        }
        SessionResult that = (SessionResult) o;
        return handsPlayed == that.handsPlayed
                && Double.compare(startingBankroll, that.startingBankroll) == 0
                && Double.compare(finalBankroll, that.finalBankroll) == 0
                && Double.compare(totalWagered, that.totalWagered) == 0
                && Double.compare(totalBonusWagered, that.totalBonusWagered) == 0
                && Double.compare(bonusNetResult, that.bonusNetResult) == 0
                && Double.compare(peakBankroll, that.peakBankroll) == 0
                && Double.compare(maxDrawdown, that.maxDrawdown) == 0
                && Double.compare(maxDrawdownPct, that.maxDrawdownPct) == 0
                && stopReason == that.stopReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(stopReason, handsPlayed, startingBankroll, finalBankroll, totalWagered,
                totalBonusWagered, bonusNetResult, peakBankroll, maxDrawdown, maxDrawdownPct);
    }

    @Override
    public String toString() {
        return "SessionResult(" + outcome + ", stop=" + stopReason.token() + ", hands=" + handsPlayed
                + ", profit=" + sessionProfit + ", wagered=" + totalWagered + ", peak=" + peakBankroll
                + ", maxDrawdown=" + maxDrawdown + ")";
    }
}
