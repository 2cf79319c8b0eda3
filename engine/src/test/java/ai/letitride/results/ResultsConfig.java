package ai.letitride.results;

/**
 * Shared knobs for strategy result sweeps.
 *
 * Purpose:
 * - Keep sweep sizing consistent across the strategy and bonus comparison runs.
 * - These values directly affect statistical confidence and runtime.
 *
 * How to think about changes:
 * - More sessions => narrower confidence interval on EV per hand, but longer sweeps.
 *   Let It Ride hands have a large variance (royal flush pays 1000:1 on up to three bets),
 *   so EV estimates converge slowly: expect to need millions of hands for two decimal places.
 */
public final class ResultsConfig {
    private ResultsConfig() {}

    /**
     * Number of sessions per strategy in a single sweep.
     *
     * Can be overridden via: -Dtest.sessions=<number>
     * Example: mvn test -Dtest=StrategyResultsTest -Dtest.sessions=10000
     */
    public static final int SESSIONS = Integer.getInteger("test.sessions", 20);

    /**
     * Hands per session; sessions also stop early on insufficient funds.
     *
     * Can be overridden via: -Dtest.hands.per.session=<number>
     */
    public static final int HANDS_PER_SESSION = Integer.getInteger("test.hands.per.session", 200);

    /**
     * Worker threads for each sweep.
     *
     * Can be overridden via: -Dtest.workers=<number>
     */
    public static final int WORKERS = Integer.getInteger("test.workers", 2);

    /**
     * Fixed seed so sweeps are comparable run to run.
     *
     * Can be overridden via: -Dtest.seed=<number>
     */
    public static final long SEED = Long.getLong("test.seed", 20240601L);

    /**
     * How often the controller logs progress, in finished sessions.
     *
     * Can be overridden via: -Dtest.progress.log.interval=<number>
     */
    public static final int PROGRESS_LOG_INTERVAL = Integer.getInteger("test.progress.log.interval", 1000);
}
