package ai.letitride.simulation;

import ai.letitride.engine.GameEngine;
import ai.letitride.engine.GameHandResult;
import ai.letitride.engine.Table;
import ai.letitride.game.Deck;
import ai.letitride.game.FiveCardHandRank;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs a batch of independent units (sessions, or table sessions) on a fixed pool of workers.
 *
 * <p>Unit {@code i} deals from {@code new Random(SeedSequence.unitSeed(seed, i))} and writes its
 * result into slot {@code i}, so the results do not depend on the worker count or on the order in
 * which workers finish. A failing unit aborts the batch: units not yet started are cancelled and a
 * {@link SimulationException} naming the lowest failing unit index is thrown. Nothing is retried.
 */
public class SimulationController {
    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);
    private static final String THREAD_NAME_PREFIX = "sim-worker-";

    private final SimulationSettings settings;

    public SimulationController(SimulationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public SimulationResults run() {
        return run(ProgressListener.NONE);
    }

    /**
     * Runs every unit to completion.
     *
     * @param progress told about each finished unit, from worker threads
     * @throws SimulationException if any unit fails or the calling thread is interrupted
     */
    public SimulationResults run(ProgressListener progress) {
        Instant start = Instant.now();
        long seed = settings.getSeed().orElseGet(SeedSequence::randomSeed);
        int total = settings.getSessions();
        boolean logHands = settings.isLogHands() || HandRecordLogger.isForced();
        log.info("Starting {} {} on {} workers with seed {}", total, settings.isTable() ? "table sessions" : "sessions",
                settings.getWorkers(), seed);

        UnitResult[] slots = new UnitResult[total];
        AtomicInteger completed = new AtomicInteger();
        ThreadPoolTaskExecutor executor = createExecutor(Math.min(settings.getWorkers(), total));
        List<Future<?>> futures = new ArrayList<>(total);
        try {
            for (int i = 0; i < total; i++) {
                int unit = i;
                futures.add(executor.submit(() -> {
                    slots[unit] = runUnit(unit, seed, logHands);
                    int done = completed.incrementAndGet();
                    progress.onProgress(done, total);
                    if (done % settings.getProgressInterval() == 0 || done == total) {
                        log.info("Completed {}/{} units", done, total);
                    }
                }));
            }
            awaitAll(futures);
        } finally {
            executor.shutdown();
        }

        List<SessionResult> sessions = new ArrayList<>();
        List<TableSessionResult> tables = new ArrayList<>();
        Map<FiveCardHandRank, Long> frequencies = new EnumMap<>(FiveCardHandRank.class);
        for (UnitResult slot : slots) {
            sessions.addAll(slot.sessions);
            if (slot.table != null) {
                tables.add(slot.table);
            }
            slot.frequencies.forEach((rank, count) -> frequencies.merge(rank, count, Long::sum));
        }
        AggregateStatistics statistics = ResultsAggregator.aggregate(sessions, frequencies);
        Instant end = Instant.now();
        log.info("Finished {} units ({} sessions, {} hands) in {} ms", total, sessions.size(),
                statistics.getTotalHands(), end.toEpochMilli() - start.toEpochMilli());
        return new SimulationResults(settings, seed, sessions, tables, start, end, statistics);
    }

    private void awaitAll(List<Future<?>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(false));
                log.error("Unit {} failed, aborting the run", i, e.getCause());
                throw new SimulationException(i, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(false));
                throw new SimulationException("Interrupted while waiting for simulation units", e);
            }
        }
    }

    private UnitResult runUnit(int unit, long seed, boolean logHands) {
        Random rng = new Random(SeedSequence.unitSeed(seed, unit));
        Map<FiveCardHandRank, Long> frequencies = new EnumMap<>(FiveCardHandRank.class);
        if (settings.isTable()) {
            Table table = new Table(new Deck(), settings.getStrategy(), settings.getMainPaytable(),
                    settings.getBonusPaytable(), rng, settings.getSeats(), settings.getDealerSettings());
            TableSession tableSession = new TableSession(settings.tableSessionConfig(), table,
                    settings.bettingSystems(),
                    (seat, hand, bankrollAfter) -> onHand(unit, seat, hand, bankrollAfter, frequencies, logHands));
            TableSessionResult result = tableSession.runToCompletion();
            return new UnitResult(result.allSessionResults(), result, frequencies);
        }
        GameEngine engine = new GameEngine(new Deck(), settings.getStrategy(), settings.getMainPaytable(),
                settings.getBonusPaytable(), rng, settings.getDealerSettings());
        Session session = new Session(settings.getSessionConfig(), engine, settings.newBettingSystem(),
                (hand, bankrollAfter) -> onHand(unit, null, hand, bankrollAfter, frequencies, logHands));
        return new UnitResult(List.of(session.runToCompletion()), null, frequencies);
    }

    private static void onHand(int unit, Integer seat, GameHandResult hand, double bankrollAfter,
                               Map<FiveCardHandRank, Long> frequencies, boolean logHands) {
        frequencies.merge(hand.getFinalHandRank(), 1L, Long::sum);
        if (logHands) {
            HandRecordLogger.log(HandRecord.fromGameHandResult(hand, unit, seat, bankrollAfter));
        }
    }

    private static ThreadPoolTaskExecutor createExecutor(int workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix(THREAD_NAME_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /** What one unit produced. */
    private static final class UnitResult {
        final List<SessionResult> sessions;
        final TableSessionResult table;
        final Map<FiveCardHandRank, Long> frequencies;

        UnitResult(List<SessionResult> sessions, TableSessionResult table, Map<FiveCardHandRank, Long> frequencies) {
            this.sessions = sessions;
            this.table = table;
            this.frequencies = frequencies;
        }
    }
}
