package ai.letitride.simulation;

import ai.letitride.bankroll.BankrollTracker;
import ai.letitride.bankroll.BettingContext;
import ai.letitride.bankroll.BettingSystem;
import ai.letitride.engine.GameHandResult;
import ai.letitride.engine.SeatRoundResult;
import ai.letitride.engine.SeatWager;
import ai.letitride.engine.Table;
import ai.letitride.engine.TableRoundResult;
import ai.letitride.strategy.StrategyContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Several players at one {@link Table}, sharing the community cards of every round.
 *
 * <p>Each seat keeps its own bankroll, betting system, streak and stop conditions, and decides
 * with its own strategy context. Two modes:
 * <ul>
 *     <li><b>Classic</b>: the table advances round by round until every seat has stopped. A stopped
 *     seat is still dealt in but no longer wagers, so every seat reports the same hands played.</li>
 *     <li><b>Seat replacement</b> ({@code tableTotalRounds} set): a seat that hits a stop condition
 *     books its session and a new player sits down with a fresh bankroll. The table stops after the
 *     configured rounds; sessions still running then are reported as {@link StopReason#IN_PROGRESS}.</li>
 * </ul>
 */
public class TableSession {
    private static final Logger log = LoggerFactory.getLogger(TableSession.class);

    /**
     * Observer called after every settled seat hand.
     */
    @FunctionalInterface
    public interface SeatHandListener {
        void onHand(int seatNumber, GameHandResult hand, double bankrollAfter);
    }

    private final TableSessionConfig config;
    private final SessionConfig seatConfig;
    private final Table table;
    private final SeatHandListener listener;
    private final List<SeatState> seats;
    private int roundsPlayed;
    private StopReason stopReason;

    public TableSession(TableSessionConfig config, Table table, Supplier<BettingSystem> bettingSystems) {
        this(config, table, bettingSystems, null);
    }

    /**
     * @param bettingSystems creates one betting system per seat
     * @param listener       per-hand observer, or {@code null}
     * @throws IllegalArgumentException if the table's seat count differs from the configuration
     */
    public TableSession(TableSessionConfig config, Table table, Supplier<BettingSystem> bettingSystems,
                        SeatHandListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.seatConfig = config.getSeatConfig();
        this.table = Objects.requireNonNull(table, "table");
        if (table.getNumSeats() != config.getNumSeats()) {
            throw new IllegalArgumentException("Table has " + table.getNumSeats() + " seats but the session expects "
                    + config.getNumSeats());
        }
        this.listener = listener;
        this.seats = new ArrayList<>(config.getNumSeats());
        for (int i = 0; i < config.getNumSeats(); i++) {
            seats.add(new SeatState(i + 1, bettingSystems.get()));
        }
    }

    /**
     * Checks whether the table is done, evaluating seat stop conditions at a classic table.
     */
    public boolean shouldStop() {
        if (stopReason != null) {
            return true;
        }
        if (config.isSeatReplacement()) {
            if (roundsPlayed >= config.getTableTotalRounds().getAsInt()) {
                stopReason = StopReason.TABLE_ROUNDS_COMPLETE;
            }
            return stopReason != null;
        }
        boolean allStopped = true;
        for (SeatState seat : seats) {
            checkSeat(seat);
            allStopped &= seat.stopReason != null;
        }
        if (allStopped) {
            // The table reports the reason of the highest-numbered seat.
            stopReason = seats.get(seats.size() - 1).stopReason;
            if (log.isDebugEnabled()) {
                log.debug("All {} seats stopped after {} rounds", seats.size(), roundsPlayed);
            }
        }
        return allStopped;
    }

    /**
     * Deals and settles one round for every seat still wagering.
     *
     * @throws IllegalStateException if the table has already stopped
     */
    public TableRoundResult playRound() {
        if (stopReason != null) {
            throw new IllegalStateException("Cannot play round: table session is already complete ("
                    + stopReason.token() + ")");
        }
        if (config.isSeatReplacement()) {
            seats.forEach(this::checkSeat);
        }

        List<SeatWager> wagers = new ArrayList<>(seats.size());
        for (SeatState seat : seats) {
            wagers.add(seat.stopReason == null ? seat.nextWager() : null);
        }
        TableRoundResult round = table.playRound(roundsPlayed, wagers);
        for (SeatRoundResult seatResult : round.getSeatResults()) {
            SeatState seat = seats.get(seatResult.getSeatNumber() - 1);
            seat.apply(seatResult.getHand(), wagers.get(seatResult.getSeatNumber() - 1).getBonusBet());
            if (listener != null) {
                listener.onHand(seat.seatNumber, seatResult.getHand(), seat.bankroll.getBalance());
            }
        }
        roundsPlayed++;

        if (config.isSeatReplacement()) {
            seats.forEach(this::checkSeat);
        }
        return round;
    }

    /**
     * Plays rounds until the table stops.
     */
    public TableSessionResult runToCompletion() {
        while (!shouldStop()) {
            playRound();
        }
        if (!config.isSeatReplacement()) {
            List<SeatSessionResult> results = new ArrayList<>(seats.size());
            for (SeatState seat : seats) {
                results.add(seat.result(seat.stopReason));
            }
            return new TableSessionResult(results, roundsPlayed, stopReason, null);
        }

        Map<Integer, List<SeatSessionResult>> seatSessions = new LinkedHashMap<>();
        List<SeatSessionResult> lastSessions = new ArrayList<>(seats.size());
        for (SeatState seat : seats) {
            List<SeatSessionResult> sessions = new ArrayList<>(seat.completedSessions);
            if (seat.handsThisSession() > 0) {
                sessions.add(seat.result(StopReason.IN_PROGRESS));
            }
            seatSessions.put(seat.seatNumber, sessions);
            if (!sessions.isEmpty()) {
                lastSessions.add(sessions.get(sessions.size() - 1));
            }
        }
        return new TableSessionResult(lastSessions, roundsPlayed, stopReason, seatSessions);
    }

    private void checkSeat(SeatState seat) {
        if (seat.stopReason != null) {
            return;
        }
        StopReason reason = seatConfig.firstStopCondition(seat.bankroll.getSessionProfit(), seat.handsThisSession(),
                seat.bankroll.getBalance());
        if (reason == null) {
            return;
        }
        if (config.isSeatReplacement()) {
            seat.completedSessions.add(seat.result(reason));
            if (log.isDebugEnabled()) {
                log.debug("Seat {} replaced after round {}: {}", seat.seatNumber, roundsPlayed, reason.token());
            }
            seat.startNewSession();
        } else {
            seat.stopReason = reason;
        }
    }

    public int getRoundsPlayed() {
        return roundsPlayed;
    }

    public boolean isComplete() {
        return stopReason != null;
    }

    public Optional<StopReason> getStopReason() {
        return Optional.ofNullable(stopReason);
    }

    /**
     * Per-seat state. A seat-replacement table resets it for each new player but keeps the sessions
     * already booked.
     */
    private final class SeatState {
        final int seatNumber;
        final BettingSystem bettingSystem;
        final List<SeatSessionResult> completedSessions = new ArrayList<>();
        BankrollTracker bankroll;
        double totalWagered;
        double totalBonusWagered;
        double bonusNetResult;
        Double lastResult;
        int streak;
        int sessionStartRound;
        StopReason stopReason;

        SeatState(int seatNumber, BettingSystem bettingSystem) {
            this.seatNumber = seatNumber;
            this.bettingSystem = bettingSystem;
            startNewSession();
        }

        void startNewSession() {
            bankroll = new BankrollTracker(seatConfig.getStartingBankroll());
            totalWagered = 0.0;
            totalBonusWagered = 0.0;
            bonusNetResult = 0.0;
            lastResult = null;
            streak = 0;
            sessionStartRound = roundsPlayed;
            stopReason = null;
            bettingSystem.reset();
        }

        int handsThisSession() {
            return roundsPlayed - sessionStartRound;
        }

        SeatWager nextWager() {
            int hands = handsThisSession();
            BettingContext bettingContext = new BettingContext(bankroll.getBalance(),
                    seatConfig.getStartingBankroll(), bankroll.getSessionProfit(), lastResult, streak, hands);
            double baseBet = bettingSystem.nextBet(bettingContext);
            StrategyContext context = new StrategyContext(bankroll.getSessionProfit(), hands, streak,
                    bankroll.getBalance());
            return new SeatWager(baseBet, seatConfig.bonusBetFor(baseBet, bettingContext), context);
        }

        void apply(GameHandResult hand, double bonusBet) {
            totalWagered += hand.getBetsAtRisk();
            totalBonusWagered += bonusBet;
            bonusNetResult += hand.getBonusPayout() > 0 ? hand.getBonusPayout() : -bonusBet;
            bankroll.applyResult(hand.getNetResult());
            lastResult = hand.getNetResult();
            streak = Session.nextStreak(streak, hand.getNetResult());
            bettingSystem.recordResult(hand.getNetResult());
        }

        SeatSessionResult result(StopReason reason) {
            return new SeatSessionResult(seatNumber, new SessionResult(reason, handsThisSession(),
                    seatConfig.getStartingBankroll(), bankroll.getBalance(), totalWagered, totalBonusWagered,
                    bonusNetResult, bankroll.getPeak(), bankroll.getMaxDrawdown(), bankroll.getMaxDrawdownPct()));
        }
    }
}
