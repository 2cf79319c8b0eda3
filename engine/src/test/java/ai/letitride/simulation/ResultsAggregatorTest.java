package ai.letitride.simulation;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.game.FiveCardHandRank;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultsAggregatorTest {
    private static final double EPS = 1e-9;

    private static SessionResult session(double profit, int hands, double wagered, double bonusWagered,
                                         double bonusNet) {
        return new SessionResult(StopReason.MAX_HANDS, hands, 500, 500 + profit, wagered, bonusWagered, bonusNet,
                Math.max(500, 500 + profit), 0, 0);
    }

    private static final List<SessionResult> SESSIONS = List.of(
            session(100, 10, 150, 10, -4),
            session(-50, 20, 300, 0, 0),
            session(0, 5, 75, 5, 5),
            session(30, 15, 225, 0, 0));

    @Test
    void countsOutcomes() {
        AggregateStatistics stats = ResultsAggregator.aggregate(SESSIONS);
        assertEquals(4, stats.getTotalSessions());
        assertEquals(2, stats.getWinningSessions());
        assertEquals(1, stats.getLosingSessions());
        assertEquals(1, stats.getPushSessions());
        assertEquals(0.5, stats.getSessionWinRate(), EPS);
        assertEquals(50, stats.getTotalHands());
    }

    @Test
    void profitDistribution() {
        AggregateStatistics stats = ResultsAggregator.aggregate(SESSIONS);
        assertEquals(20.0, stats.getSessionProfitMean(), EPS);
        assertEquals(15.0, stats.getSessionProfitMedian(), EPS);
        assertEquals(-50.0, stats.getSessionProfitMin(), EPS);
        assertEquals(100.0, stats.getSessionProfitMax(), EPS);
        assertEquals(Math.sqrt(11_800.0 / 3), stats.getSessionProfitStd(), EPS);
    }

    @Test
    void splitsMainAndBonus() {
        AggregateStatistics stats = ResultsAggregator.aggregate(SESSIONS);
        assertEquals(15.0, stats.getBonusWagered(), EPS);
        assertEquals(16.0, stats.getBonusWon(), EPS);
        assertEquals(750.0, stats.getMainWagered(), EPS);
        // Net 80, of which the bonus made 1.
        assertEquals(750.0 + 79.0, stats.getMainWon(), EPS);
        assertEquals(765.0, stats.getTotalWagered(), EPS);
        assertEquals(80.0, stats.getNetResult(), EPS);
        assertEquals(80.0 / 50, stats.getExpectedValuePerHand(), EPS);
        assertEquals(1.0 / 50, stats.getBonusEvPerHand(), EPS);
    }

    @Test
    void singleSessionHasNoSpread() {
        AggregateStatistics stats = ResultsAggregator.aggregate(List.of(SESSIONS.get(0)));
        assertEquals(0.0, stats.getSessionProfitStd());
        assertEquals(100.0, stats.getSessionProfitMedian());
    }

    @Test
    void mergeMatchesAggregatingEverything() {
        AggregateStatistics all = ResultsAggregator.aggregate(SESSIONS);
        AggregateStatistics merged = ResultsAggregator.merge(
                ResultsAggregator.aggregate(SESSIONS.subList(0, 2)),
                ResultsAggregator.aggregate(SESSIONS.subList(2, 4)));
        assertEquals(all.getTotalSessions(), merged.getTotalSessions());
        assertEquals(all.getWinningSessions(), merged.getWinningSessions());
        assertEquals(all.getTotalHands(), merged.getTotalHands());
        assertEquals(all.getNetResult(), merged.getNetResult(), EPS);
        assertEquals(all.getMainWon(), merged.getMainWon(), EPS);
        assertEquals(all.getSessionProfitMedian(), merged.getSessionProfitMedian(), EPS);
        assertEquals(all.getSessionProfitStd(), merged.getSessionProfitStd(), EPS);
    }

    @Test
    void handFrequencies() {
        AggregateStatistics stats = ResultsAggregator.aggregate(SESSIONS,
                Map.of(FiveCardHandRank.HIGH_CARD, 30L, FiveCardHandRank.PAIR_BELOW_TENS, 20L));
        assertEquals(Long.valueOf(30L), stats.getHandFrequencies().get(FiveCardHandRank.HIGH_CARD));
        assertEquals(0.6, stats.getHandFrequencyPct().get("high_card"), EPS);
        assertEquals(0.4, stats.getHandFrequencyPct().get("pair_below_tens"), EPS);
        assertTrue(ResultsAggregator.aggregate(SESSIONS).getHandFrequencyPct().isEmpty());
    }

    @Test
    void nothingToAggregate() {
        assertThrows(IllegalArgumentException.class, () -> ResultsAggregator.aggregate(List.of()));
    }
}
