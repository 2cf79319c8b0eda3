package ai.letitride.simulation;

import ai.letitride.bankroll.BankrollTracker;
import ai.letitride.bankroll.BettingContext;
import ai.letitride.bankroll.BettingSystem;
import ai.letitride.engine.GameEngine;
import ai.letitride.engine.GameHandResult;
import ai.letitride.strategy.StrategyContext;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One player's sequence of hands against a single bankroll.
 *
 * <p>The session is a small state machine: it plays hands until {@link #shouldStop()} records a
 * {@link StopReason}, after which {@link #playHand()} is refused. Given the same engine RNG,
 * strategy, paytables and configuration it always plays the same hands.
 */
public class Session {
    private static final Logger log = LoggerFactory.getLogger(Session.class);

    /**
     * Observer called after every hand with the bankroll it left behind.
     */
    @FunctionalInterface
    public interface HandListener {
        void onHand(GameHandResult hand, double bankrollAfter);
    }

    private final SessionConfig config;
    private final GameEngine engine;
    private final BettingSystem bettingSystem;
    private final HandListener listener;
    private final BankrollTracker bankroll;
    private int handsPlayed;
    private double totalWagered;
    private double totalBonusWagered;
    private double bonusNetResult;
    private Double lastResult;
    private int streak;
    private StopReason stopReason;

    public Session(SessionConfig config, GameEngine engine, BettingSystem bettingSystem) {
        this(config, engine, bettingSystem, null);
    }

    /**
     * @param listener per-hand observer, or {@code null}
     */
    public Session(SessionConfig config, GameEngine engine, BettingSystem bettingSystem, HandListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.bettingSystem = Objects.requireNonNull(bettingSystem, "bettingSystem");
        this.listener = listener;
        this.bankroll = new BankrollTracker(config.getStartingBankroll());
        this.bettingSystem.reset();
    }

    /**
     * Streak after a hand: wins extend a positive streak, losses a negative one, a push leaves it.
     */
    static int nextStreak(int streak, double netResult) {
        if (netResult > 0) {
            return streak > 0 ? streak + 1 : 1;
        }
        if (netResult < 0) {
            return streak < 0 ? streak - 1 : -1;
        }
        return streak;
    }

    /**
     * Checks the stop conditions, recording the first one that holds.
     *
     * @return true once the session has stopped
     */
    public boolean shouldStop() {
        if (stopReason == null) {
            stopReason = config.firstStopCondition(bankroll.getSessionProfit(), handsPlayed, bankroll.getBalance());
            if (stopReason != null && log.isDebugEnabled()) {
                log.debug("Session stopped after {} hands: {} (bankroll {})", handsPlayed, stopReason.token(),
                        bankroll.getBalance());
            }
        }
        return stopReason != null;
    }

    /**
     * Plays one hand and applies it to the bankroll.
     *
     * @throws IllegalStateException if the session has already stopped
     */
    public GameHandResult playHand() {
        if (stopReason != null) {
            throw new IllegalStateException("Cannot play hand: session is already complete (" + stopReason.token()
                    + ")");
        }
        BettingContext bettingContext = new BettingContext(bankroll.getBalance(), config.getStartingBankroll(),
                bankroll.getSessionProfit(), lastResult, streak, handsPlayed);
        double baseBet = bettingSystem.nextBet(bettingContext);
        double bonusBet = config.bonusBetFor(baseBet, bettingContext);
        StrategyContext strategyContext = new StrategyContext(bankroll.getSessionProfit(), handsPlayed, streak,
                bankroll.getBalance());

        GameHandResult hand = engine.playHand(handsPlayed, baseBet, bonusBet, strategyContext);

        handsPlayed++;
        totalWagered += hand.getBetsAtRisk();
        totalBonusWagered += bonusBet;
        bonusNetResult += hand.getBonusPayout() > 0 ? hand.getBonusPayout() : -bonusBet;
        bankroll.applyResult(hand.getNetResult());
        lastResult = hand.getNetResult();
        streak = nextStreak(streak, hand.getNetResult());
        bettingSystem.recordResult(hand.getNetResult());
        if (listener != null) {
            listener.onHand(hand, bankroll.getBalance());
        }
        return hand;
    }

    /**
     * Plays hands until a stop condition fires.
     */
    public SessionResult runToCompletion() {
        while (!shouldStop()) {
            playHand();
        }
        return new SessionResult(stopReason, handsPlayed, config.getStartingBankroll(), bankroll.getBalance(),
                totalWagered, totalBonusWagered, bonusNetResult, bankroll.getPeak(), bankroll.getMaxDrawdown(),
                bankroll.getMaxDrawdownPct());
    }

    public int getHandsPlayed() {
        return handsPlayed;
    }

    public boolean isComplete() {
        return stopReason != null;
    }

    public Optional<StopReason> getStopReason() {
        return Optional.ofNullable(stopReason);
    }

    public double getSessionProfit() {
        return bankroll.getSessionProfit();
    }

    public double getBankroll() {
        return bankroll.getBalance();
    }

    public int getStreak() {
        return streak;
    }
}
