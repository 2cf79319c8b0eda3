package ai.letitride.bankroll;

import java.util.List;
import java.util.Locale;

/**
 * Progression options for every betting system, and the factory that turns a system name into a
 * fresh {@link BettingSystem}.
 *
 * <p>Instances are mutable while being configured and are handed over to immutable settings once
 * built; {@link #create(String, double)} never changes them.
 */
public final class BettingSystems {
    public static final String FLAT = "flat";
    public static final String MARTINGALE = "martingale";
    public static final String REVERSE_MARTINGALE = "reverse_martingale";
    public static final String PAROLI = "paroli";
    public static final String DALEMBERT = "dalembert";
    public static final String FIBONACCI = "fibonacci";

    public static final List<String> NAMES = List.of(FLAT, MARTINGALE, REVERSE_MARTINGALE, PAROLI, DALEMBERT,
            FIBONACCI);

    private double martingaleLossMultiplier = 2.0;
    private double martingaleMaxBet = 500.0;
    private int martingaleMaxProgressions = 6;

    private double reverseMartingaleWinMultiplier = 2.0;
    private double reverseMartingaleMaxBet = 500.0;
    private int reverseMartingaleProfitTargetStreak = 3;

    private double paroliWinMultiplier = 2.0;
    private double paroliMaxBet = 500.0;
    private int paroliWinsBeforeReset = 3;

    private double dalembertUnit = 5.0;
    private double dalembertMinBet = 5.0;
    private double dalembertMaxBet = 500.0;

    private double fibonacciUnit = 5.0;
    private double fibonacciMaxBet = 500.0;
    private int fibonacciMaxPosition = 10;
    private int fibonacciWinRegression = 2;

    /**
     * Lower-cased, trimmed system name; {@code null} means flat.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static String normalize(String type) {
        String name = type == null ? FLAT : type.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("d_alembert".equals(name)) {
            name = DALEMBERT;
        }
        if (!NAMES.contains(name)) {
            throw new IllegalArgumentException("Unknown betting system '" + type + "', expected one of " + NAMES);
        }
        return name;
    }

    /**
     * Creates a betting system in its opening state.
     *
     * @param type    one of {@link #NAMES}
     * @param baseBet the session base bet; the Fibonacci system sizes from its own unit instead
     * @throws IllegalArgumentException for an unknown name or out-of-range options
     */
    public BettingSystem create(String type, double baseBet) {
        switch (normalize(type)) {
            case MARTINGALE:
                return new MartingaleBetting(baseBet, martingaleLossMultiplier, martingaleMaxBet,
                        martingaleMaxProgressions);
            case REVERSE_MARTINGALE:
                return new ReverseMartingaleBetting(baseBet, reverseMartingaleWinMultiplier, reverseMartingaleMaxBet,
                        reverseMartingaleProfitTargetStreak);
            case PAROLI:
                return new ParoliBetting(baseBet, paroliWinMultiplier, paroliMaxBet, paroliWinsBeforeReset);
            case DALEMBERT:
                return new DAlembertBetting(baseBet, dalembertUnit, dalembertMinBet, dalembertMaxBet);
            case FIBONACCI:
                return new FibonacciBetting(fibonacciUnit, fibonacciMaxBet, fibonacciMaxPosition,
                        fibonacciWinRegression);
            default:
                return new FlatBetting(baseBet);
        }
    }

    public BettingSystems martingale(double lossMultiplier, double maxBet, int maxProgressions) {
        this.martingaleLossMultiplier = lossMultiplier;
        this.martingaleMaxBet = maxBet;
        this.martingaleMaxProgressions = maxProgressions;
        return this;
    }

    public BettingSystems reverseMartingale(double winMultiplier, double maxBet, int profitTargetStreak) {
        this.reverseMartingaleWinMultiplier = winMultiplier;
        this.reverseMartingaleMaxBet = maxBet;
        this.reverseMartingaleProfitTargetStreak = profitTargetStreak;
        return this;
    }

    public BettingSystems paroli(double winMultiplier, double maxBet, int winsBeforeReset) {
        this.paroliWinMultiplier = winMultiplier;
        this.paroliMaxBet = maxBet;
        this.paroliWinsBeforeReset = winsBeforeReset;
        return this;
    }

    public BettingSystems dalembert(double unit, double minBet, double maxBet) {
        this.dalembertUnit = unit;
        this.dalembertMinBet = minBet;
        this.dalembertMaxBet = maxBet;
        return this;
    }

    public BettingSystems fibonacci(double unit, double maxBet, int maxPosition, int winRegression) {
        this.fibonacciUnit = unit;
        this.fibonacciMaxBet = maxBet;
        this.fibonacciMaxPosition = maxPosition;
        this.fibonacciWinRegression = winRegression;
        return this;
    }

    /** A copy, so settings built from this instance do not see later changes. */
    public BettingSystems copy() {
        BettingSystems copy = new BettingSystems();
        copy.martingale(martingaleLossMultiplier, martingaleMaxBet, martingaleMaxProgressions)
                .reverseMartingale(reverseMartingaleWinMultiplier, reverseMartingaleMaxBet,
                        reverseMartingaleProfitTargetStreak)
                .paroli(paroliWinMultiplier, paroliMaxBet, paroliWinsBeforeReset)
                .dalembert(dalembertUnit, dalembertMinBet, dalembertMaxBet)
                .fibonacci(fibonacciUnit, fibonacciMaxBet, fibonacciMaxPosition, fibonacciWinRegression);
        return copy;
    }
}
