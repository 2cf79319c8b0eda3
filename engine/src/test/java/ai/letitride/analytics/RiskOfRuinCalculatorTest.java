package ai.letitride.analytics;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.simulation.SessionResult;
import ai.letitride.simulation.StopReason;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class RiskOfRuinCalculatorTest {
    private static final double EPS = 1e-9;

    /** Ten hands at a base bet of 5 with every bet ridden. */
    private static SessionResult session(double profit) {
        return new SessionResult(StopReason.MAX_HANDS, 10, 500, 500 + profit, 150, 0, 0,
                Math.max(500, 500 + profit), Math.max(0, -profit), Math.max(0, -profit) / 500);
    }

    private static List<SessionResult> sessions(double... profits) {
        List<SessionResult> sessions = new ArrayList<>();
        for (double profit : profits) {
            sessions.add(session(profit));
        }
        return sessions;
    }

    private static List<SessionResult> repeated(double profit, int count) {
        return new ArrayList<>(Collections.nCopies(count, session(profit)));
    }

    private static RiskOfRuinCalculator.Builder quick() {
        return RiskOfRuinCalculator.builder().simulationsPerLevel(200).maxSessionsPerSimulation(500).seed(3L);
    }

    @Test
    void steadyLossesAlwaysRuin() {
        RiskOfRuinReport report = quick().build().calculate(repeated(-10, 20));

        assertEquals(5.0, report.getBaseBet(), EPS);
        assertEquals(500.0, report.getStartingBankroll(), EPS);
        assertEquals(5, report.getLevels().size());
        for (RiskOfRuinReport.Level level : report.getLevels()) {
            assertEquals(1.0, level.getRuinProbability(), EPS);
            assertEquals(1.0, level.getHalfBankrollRisk(), EPS);
            assertEquals(1.0, level.getQuarterBankrollRisk(), EPS);
            assertEquals(200, level.getSimulations());
            assertTrue(level.getRuinInterval().getLower() > 0.95);
        }
        report.getAnalyticalEstimates().forEach(p -> assertEquals(1.0, p.doubleValue(), EPS));
    }

    @Test
    void steadyWinsNeverRuin() {
        RiskOfRuinReport report = quick().build().calculate(repeated(10, 12));
        for (RiskOfRuinReport.Level level : report.getLevels()) {
            assertEquals(0.0, level.getRuinProbability(), EPS);
            assertEquals(0.0, level.getQuarterBankrollRisk(), EPS);
            assertEquals(0.0, level.getRuinInterval().getLower(), EPS);
        }
        report.getAnalyticalEstimates().forEach(p -> assertEquals(0.0, p.doubleValue(), EPS));
    }

    @Test
    void levelsAreSortedAndSizedFromTheBaseBet() {
        RiskOfRuinReport report = quick().bankrollUnits(List.of(60, 20)).baseBet(2).build()
                .calculate(repeated(-10, 10));
        assertEquals(2.0, report.getBaseBet(), EPS);
        assertEquals(20, report.getLevels().get(0).getBankrollUnits());
        assertEquals(40.0, report.getLevels().get(0).getBankroll(), EPS);
        assertEquals(60, report.getLevels().get(1).getBankrollUnits());
    }

    @Test
    void analyticalEstimateFollowsTheDiffusionFormula() {
        double[] profits = new double[20];
        for (int i = 0; i < profits.length; i++) {
            profits[i] = i % 2 == 0 ? 15 : -5;
        }
        RiskOfRuinReport report = quick().bankrollUnits(List.of(20)).baseBet(5).build().calculate(sessions(profits));

        assertEquals(5.0, report.getMeanSessionProfit(), EPS);
        double variance = 2000.0 / 19;
        assertEquals(Math.sqrt(variance), report.getSessionProfitStd(), EPS);
        double expected = Math.exp(-2 * 5.0 * 100 / variance);
        assertEquals(expected, report.getAnalyticalEstimates().get(0).doubleValue(), 1e-12);
    }

    @Test
    void analyticalEstimateEdgeCases() {
        assertEquals(1.0, RiskOfRuinCalculator.analyticalRuin(-1, 10, 100), EPS);
        assertEquals(1.0, RiskOfRuinCalculator.analyticalRuin(0, 0, 100), EPS);
        assertEquals(0.0, RiskOfRuinCalculator.analyticalRuin(1, 0, 100), EPS);
        assertEquals(0.0, RiskOfRuinCalculator.analyticalRuin(100, 1, 10_000), 0.0);
    }

    @Test
    void sameSeedGivesTheSameEstimate() {
        List<SessionResult> mixed = sessions(40, -60, 25, -35, 10, -80, 55, -20, 5, -45, 30, -15);
        RiskOfRuinReport first = quick().bankrollUnits(List.of(20, 40)).build().calculate(mixed);
        RiskOfRuinReport second = quick().bankrollUnits(List.of(20, 40)).build().calculate(mixed);
        for (int i = 0; i < 2; i++) {
            assertEquals(first.getLevels().get(i).getRuinProbability(),
                    second.getLevels().get(i).getRuinProbability(), 0.0);
            RiskOfRuinReport.Level level = first.getLevels().get(i);
            assertTrue(level.getRuinProbability() <= level.getHalfBankrollRisk());
            assertTrue(level.getHalfBankrollRisk() <= level.getQuarterBankrollRisk());
        }
    }

    @Test
    void rejectsTooFewSessionsAndBadSettings() {
        RiskOfRuinCalculator calculator = quick().build();
        assertThrows(IllegalArgumentException.class, () -> calculator.calculate(repeated(-10, 9)));
        assertThrows(IllegalArgumentException.class, () -> quick().bankrollUnits(List.of(20, 0)).build());
        assertThrows(IllegalArgumentException.class, () -> quick().bankrollUnits(List.of()).build());
        assertThrows(IllegalArgumentException.class, () -> quick().confidenceLevel(1.0).build());
        assertThrows(IllegalArgumentException.class, () -> quick().simulationsPerLevel(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> quick().baseBet(0).build().calculate(repeated(-10, 10)));
    }
}
