package ai.letitride.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link HandFrequencyValidator}. Frequencies are shares (0 to 1) keyed by hand category.
 */
public final class ValidationReport {
    private final ChiSquareResult chiSquare;
    private final Map<String, Double> observedFrequencies;
    private final Map<String, Double> expectedFrequencies;
    private final double evActual;
    private final double evTheoretical;
    private final double evDeviation;
    private final double sessionWinRate;
    private final ConfidenceInterval sessionWinRateInterval;
    private final List<String> warnings;
    private final boolean valid;

    ValidationReport(ChiSquareResult chiSquare, Map<String, Double> observedFrequencies,
                     Map<String, Double> expectedFrequencies, double evActual, double evTheoretical,
                     double evDeviation, double sessionWinRate, ConfidenceInterval sessionWinRateInterval,
                     List<String> warnings, boolean valid) {
        this.chiSquare = chiSquare;
        this.observedFrequencies = Collections.unmodifiableMap(new LinkedHashMap<>(observedFrequencies));
        this.expectedFrequencies = Collections.unmodifiableMap(new LinkedHashMap<>(expectedFrequencies));
        this.evActual = evActual;
        this.evTheoretical = evTheoretical;
        this.evDeviation = evDeviation;
        this.sessionWinRate = sessionWinRate;
        this.sessionWinRateInterval = sessionWinRateInterval;
        this.warnings = List.copyOf(warnings);
        this.valid = valid;
    }

    public ChiSquareResult getChiSquare() {
        return chiSquare;
    }

    public Map<String, Double> getObservedFrequencies() {
        return observedFrequencies;
    }

    public Map<String, Double> getExpectedFrequencies() {
        return expectedFrequencies;
    }

    public double getEvActual() {
        return evActual;
    }

    public double getEvTheoretical() {
        return evTheoretical;
    }

    /** Relative distance of the observed EV from the theoretical one. */
    public double getEvDeviation() {
        return evDeviation;
    }

    public double getSessionWinRate() {
        return sessionWinRate;
    }

    public ConfidenceInterval getSessionWinRateInterval() {
        return sessionWinRateInterval;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * True when the hand distribution passes the chi-square test without a suspiciously low p-value
     * and the session win rate is not extreme. EV deviation only warns.
     */
    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return "ValidationReport{valid=" + valid + ", chiSquare=" + chiSquare + ", evActual=" + evActual
                + ", evDeviation=" + evDeviation + ", warnings=" + warnings + '}';
    }
}
