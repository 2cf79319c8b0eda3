package ai.letitride.simulation;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.engine.GameEngine;
import ai.letitride.engine.GameHandResult;
import ai.letitride.helpers.StackedDeck;
import ai.letitride.paytable.Paytables;
import ai.letitride.strategy.AlwaysPullStrategy;
import ai.letitride.strategy.StrategyContext;
import java.util.Random;
import org.junit.jupiter.api.Test;

class HandRecordTest {

    private static GameHandResult pairOfJacks(double bonusBet) {
        GameEngine engine = new GameEngine(new StackedDeck("Jc Jd 2h 5s 8c"), new AlwaysPullStrategy(),
                Paytables.standard(), Paytables.paytableB(), new Random(1));
        return engine.playHand(12, 10.0, bonusBet, StrategyContext.EMPTY);
    }

    @Test
    void usesWireNames() {
        HandRecord record = HandRecord.fromGameHandResult(pairOfJacks(0.0), 3, null, 510.0);
        assertEquals(3, record.getSessionId());
        assertNull(record.getSeatNumber());
        assertEquals(12, record.getHandId());
        assertEquals("Jc Jd 2h", record.getCardsPlayer());
        assertEquals("5s 8c", record.getCardsCommunity());
        assertEquals("pull", record.getDecisionBet1());
        assertEquals("pull", record.getDecisionBet2());
        assertEquals("pair_tens_or_better", record.getFinalHandRank());
        assertNull(record.getBonusHandRank());
        assertEquals(10.0, record.getNetResult());
        assertEquals(510.0, record.getBankrollAfter());
    }

    @Test
    void serializesAsSnakeCaseJson() {
        String json = HandRecordLogger.toJson(HandRecord.fromGameHandResult(pairOfJacks(1.0), 0, 4, 512.0));
        assertTrue(json.startsWith("{\"session_id\":0,\"seat_number\":4,\"hand_id\":12,"), json);
        assertTrue(json.contains("\"cards_player\":\"Jc Jd 2h\""), json);
        assertTrue(json.contains("\"final_hand_rank\":\"pair_tens_or_better\""), json);
        assertTrue(json.contains("\"bonus_hand_rank\":\"pair\""), json);
        assertTrue(json.contains("\"bankroll_after\":512.0"), json);
        assertFalse(json.contains("\n"));
    }

    @Test
    void readsBackALoggedLine() {
        HandRecord record = HandRecord.fromGameHandResult(pairOfJacks(1.0), 2, 1, 512.0);
        String line = HandRecordLogger.PREFIX + HandRecordLogger.toJson(record);
        assertEquals(record, HandRecordLogger.fromJson(line));
    }

    @Test
    void rejectsForeignLines() {
        assertThrows(IllegalArgumentException.class, () -> HandRecordLogger.fromJson("HAND not json"));
    }
}
