package ai.letitride.simulation;

import ai.letitride.bankroll.BettingSystem;
import ai.letitride.bankroll.BettingSystems;
import ai.letitride.bankroll.BonusBetPolicy;
import ai.letitride.engine.DealerSettings;
import ai.letitride.paytable.BonusPaytable;
import ai.letitride.paytable.MainGamePaytable;
import ai.letitride.paytable.Paytables;
import ai.letitride.strategy.Strategy;
import ai.letitride.strategy.StrategyFactory;
import ai.letitride.strategy.StrategyRule;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Validated, immutable description of a simulation run: how many units, how they are seeded and
 * spread over workers, and the game, bankroll and table rules every unit plays by.
 *
 * <p>{@link Builder#build()} resolves the strategy and paytables up front, so an unknown name or a
 * malformed custom rule fails before any hand is dealt.
 */
public final class SimulationSettings {
    public static final int MAX_SEATS = 6;

    private final int sessions;
    private final Integer handsPerSession;
    private final Long seed;
    private final int workers;
    private final int progressInterval;
    private final boolean logHands;
    private final SessionConfig sessionConfig;
    private final String bettingSystem;
    private final BettingSystems bettingOptions;
    private final String strategyType;
    private final Strategy strategy;
    private final BonusBetPolicy bonusPolicy;
    private final MainGamePaytable mainPaytable;
    private final BonusPaytable bonusPaytable;
    private final int seats;
    private final Integer tableTotalRounds;
    private final DealerSettings dealerSettings;

    private SimulationSettings(Builder b, SessionConfig sessionConfig, Strategy strategy,
                               MainGamePaytable mainPaytable, BonusPaytable bonusPaytable) {
        this.sessions = b.sessions;
        this.handsPerSession = b.handsPerSession;
        this.seed = b.seed;
        this.workers = b.workers;
        this.progressInterval = b.progressInterval;
        this.logHands = b.logHands;
        this.sessionConfig = sessionConfig;
        this.bettingSystem = b.bettingSystem;
        this.bettingOptions = b.bettingOptions.copy();
        this.strategyType = b.strategyType;
        this.strategy = strategy;
        this.bonusPolicy = b.bonusPolicy;
        this.mainPaytable = mainPaytable;
        this.bonusPaytable = bonusPaytable;
        this.seats = b.seats;
        this.tableTotalRounds = b.tableTotalRounds;
        this.dealerSettings = b.dealerSettings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of units: sessions, or table sessions when {@link #isTable()}. */
    public int getSessions() {
        return sessions;
    }

    public Integer getHandsPerSession() {
        return handsPerSession;
    }

    public OptionalLong getSeed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    public int getWorkers() {
        return workers;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public boolean isLogHands() {
        return logHands;
    }

    public SessionConfig getSessionConfig() {
        return sessionConfig;
    }

    public String getBettingSystem() {
        return bettingSystem;
    }

    public String getStrategyType() {
        return strategyType;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public BonusBetPolicy getBonusPolicy() {
        return bonusPolicy;
    }

    public MainGamePaytable getMainPaytable() {
        return mainPaytable;
    }

    /** {@code null} when the bonus bet is never placed. */
    public BonusPaytable getBonusPaytable() {
        return bonusPaytable;
    }

    public int getSeats() {
        return seats;
    }

    public Integer getTableTotalRounds() {
        return tableTotalRounds;
    }

    public DealerSettings getDealerSettings() {
        return dealerSettings;
    }

    /** Units run as table sessions: more than one seat, or a seat-replacement table. */
    public boolean isTable() {
        return seats > 1 || tableTotalRounds != null;
    }

    public TableSessionConfig tableSessionConfig() {
        return new TableSessionConfig(sessionConfig, seats, tableTotalRounds);
    }

    /**
     * Creates a fresh betting system; every session or seat owns its own.
     */
    public BettingSystem newBettingSystem() {
        return bettingOptions.create(bettingSystem, sessionConfig.getBaseBet());
    }

    public Supplier<BettingSystem> bettingSystems() {
        return this::newBettingSystem;
    }

    @Override
    public String toString() {
        return "SimulationSettings(sessions=" + sessions + ", handsPerSession=" + handsPerSession + ", seed=" + seed
                + ", workers=" + workers + ", strategy=" + strategyType + ", betting=" + bettingSystem
                + ", bonus=" + bonusPolicy + ", seats=" + seats + ", tableTotalRounds=" + tableTotalRounds
                + ", " + dealerSettings + ", " + sessionConfig + ")";
    }

    public static final class Builder {
        private int sessions = 1;
        private Integer handsPerSession = 200;
        private Long seed;
        private int workers = 1;
        private int progressInterval = 1000;
        private boolean logHands;
        private double startingBankroll = 500.0;
        private double baseBet = 5.0;
        private Double winLimit;
        private Double lossLimit;
        private boolean stopOnInsufficientFunds = true;
        private String bettingSystem = BettingSystems.FLAT;
        private BettingSystems bettingOptions = new BettingSystems();
        private String strategyType = StrategyFactory.BASIC;
        private List<StrategyRule> customBet1Rules = List.of();
        private List<StrategyRule> customBet2Rules = List.of();
        private Strategy strategy;
        private BonusBetPolicy bonusPolicy = BonusBetPolicy.never();
        private String bonusPaytable = Paytables.BONUS_B;
        private int progressivePayout = Paytables.DEFAULT_PROGRESSIVE_PAYOUT;
        private String mainPaytable = Paytables.STANDARD;
        private int seats = 1;
        private Integer tableTotalRounds;
        private DealerSettings dealerSettings = DealerSettings.DISABLED;

        private Builder() {
        }

        public Builder sessions(int sessions) {
            this.sessions = sessions;
            return this;
        }

        /** {@code null} to play until another stop condition fires. */
        public Builder handsPerSession(Integer handsPerSession) {
            this.handsPerSession = handsPerSession;
            return this;
        }

        /** {@code null} for a fresh random seed on each run. */
        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder logHands(boolean logHands) {
            this.logHands = logHands;
            return this;
        }

        public Builder startingBankroll(double startingBankroll) {
            this.startingBankroll = startingBankroll;
            return this;
        }

        public Builder baseBet(double baseBet) {
            this.baseBet = baseBet;
            return this;
        }

        public Builder winLimit(Double winLimit) {
            this.winLimit = winLimit;
            return this;
        }

        public Builder lossLimit(Double lossLimit) {
            this.lossLimit = lossLimit;
            return this;
        }

        public Builder stopOnInsufficientFunds(boolean stopOnInsufficientFunds) {
            this.stopOnInsufficientFunds = stopOnInsufficientFunds;
            return this;
        }

        /** One of {@link BettingSystems#NAMES}. */
        public Builder bettingSystem(String bettingSystem) {
            this.bettingSystem = bettingSystem;
            return this;
        }

        public Builder martingale(double lossMultiplier, double maxBet, int maxProgressions) {
            bettingOptions.martingale(lossMultiplier, maxBet, maxProgressions);
            return this;
        }

        /** Replaces every progression option at once. */
        public Builder bettingOptions(BettingSystems bettingOptions) {
            this.bettingOptions = Objects.requireNonNull(bettingOptions, "bettingOptions").copy();
            return this;
        }

        public Builder strategyType(String strategyType) {
            this.strategyType = strategyType;
            return this;
        }

        public Builder customRules(List<StrategyRule> bet1Rules, List<StrategyRule> bet2Rules) {
            this.customBet1Rules = List.copyOf(bet1Rules);
            this.customBet2Rules = List.copyOf(bet2Rules);
            return this;
        }

        /** Uses this strategy instance instead of building one from {@link #strategyType(String)}. */
        public Builder strategy(Strategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder bonusPolicy(BonusBetPolicy bonusPolicy) {
            this.bonusPolicy = Objects.requireNonNull(bonusPolicy, "bonusPolicy");
            return this;
        }

        public Builder bonusPaytable(String bonusPaytable) {
            this.bonusPaytable = bonusPaytable;
            return this;
        }

        public Builder progressivePayout(int progressivePayout) {
            this.progressivePayout = progressivePayout;
            return this;
        }

        public Builder mainPaytable(String mainPaytable) {
            this.mainPaytable = mainPaytable;
            return this;
        }

        public Builder seats(int seats) {
            this.seats = seats;
            return this;
        }

        /** Enables seat replacement; {@code null} for a classic table. */
        public Builder tableTotalRounds(Integer tableTotalRounds) {
            this.tableTotalRounds = tableTotalRounds;
            return this;
        }

        public Builder dealerSettings(DealerSettings dealerSettings) {
            this.dealerSettings = Objects.requireNonNull(dealerSettings, "dealerSettings");
            return this;
        }

        /**
         * @throws IllegalArgumentException for any out-of-range value or unknown name
         * @throws ai.letitride.strategy.StrategyDefinitionException for invalid custom rules
         */
        public SimulationSettings build() {
            if (sessions < 1) {
                throw new IllegalArgumentException("Sessions must be at least 1, got " + sessions);
            }
            if (workers < 1) {
                throw new IllegalArgumentException("Workers must be at least 1, got " + workers);
            }
            if (progressInterval < 1) {
                throw new IllegalArgumentException("Progress interval must be at least 1, got " + progressInterval);
            }
            if (seats < 1 || seats > MAX_SEATS) {
                throw new IllegalArgumentException("Seats must be between 1 and " + MAX_SEATS + ", got " + seats);
            }
            if (tableTotalRounds != null && tableTotalRounds <= 0) {
                throw new IllegalArgumentException("Table total rounds must be positive if set, got "
                        + tableTotalRounds);
            }
            bettingSystem = BettingSystems.normalize(bettingSystem);

            SessionConfig sessionConfig = SessionConfig.builder()
                    .startingBankroll(startingBankroll)
                    .baseBet(baseBet)
                    .winLimit(winLimit)
                    .lossLimit(lossLimit)
                    .maxHands(handsPerSession)
                    .stopOnInsufficientFunds(stopOnInsufficientFunds)
                    .bonusBet(bonusPolicy.bonusBet(baseBet))
                    .bonusPolicy(bonusPolicy)
                    .build();
            Strategy resolved;
            if (strategy != null) {
                resolved = strategy;
                strategyType = strategy.getClass().getSimpleName();
            } else {
                resolved = StrategyFactory.create(strategyType, customBet1Rules, customBet2Rules);
            }
            MainGamePaytable main = Paytables.mainByName(mainPaytable);
            BonusPaytable bonus = bonusPolicy.isActive() ? Paytables.bonusByName(bonusPaytable, progressivePayout) : null;
            SimulationSettings settings = new SimulationSettings(this, sessionConfig, resolved, main, bonus);
            // Fail on bad progression options now rather than inside a worker.
            settings.newBettingSystem();
            return settings;
        }
    }
}
