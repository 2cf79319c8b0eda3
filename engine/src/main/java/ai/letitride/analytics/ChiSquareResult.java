package ai.letitride.analytics;

import org.apache.commons.math3.stat.inference.ChiSquareTest;

/**
 * Outcome of a chi-square goodness-of-fit test. {@code passed} means the observed counts are
 * consistent with the expected ones at the chosen significance level.
 */
public final class ChiSquareResult {
    private final double statistic;
    private final double pValue;
    private final int degreesOfFreedom;
    private final boolean passed;

    public ChiSquareResult(double statistic, double pValue, int degreesOfFreedom, boolean passed) {
        this.statistic = statistic;
        this.pValue = pValue;
        this.degreesOfFreedom = degreesOfFreedom;
        this.passed = passed;
    }

    /** Result used when there is nothing to test. */
    static ChiSquareResult untested() {
        return new ChiSquareResult(0.0, 1.0, 0, true);
    }

    /**
     * Tests {@code observed} against {@code expected}, which must be positive and line up with the
     * observed categories.
     */
    static ChiSquareResult test(double[] expected, long[] observed, double significanceLevel) {
        ChiSquareTest test = new ChiSquareTest();
        double statistic = test.chiSquare(expected, observed);
        double pValue = test.chiSquareTest(expected, observed);
        return new ChiSquareResult(statistic, pValue, observed.length - 1, pValue > significanceLevel);
    }

    public double getStatistic() {
        return statistic;
    }

    public double getPValue() {
        return pValue;
    }

    public int getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    public boolean isPassed() {
        return passed;
    }

    @Override
    public String toString() {
        return String.format("chi2=%.4f (df=%d, p=%.6f, %s)", statistic, degreesOfFreedom, pValue,
                passed ? "pass" : "fail");
    }
}
