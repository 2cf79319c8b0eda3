package ai.letitride.simulation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SessionConfigTest {

    @Test
    void defaultsStopOnInsufficientFunds() {
        SessionConfig config = SessionConfig.builder().startingBankroll(100).baseBet(5).build();
        assertTrue(config.isStopOnInsufficientFunds());
        assertTrue(config.getWinLimit().isEmpty());
        assertTrue(config.getLossLimit().isEmpty());
        assertTrue(config.getMaxHands().isEmpty());
        assertEquals(0.0, config.getBonusBet());
        assertEquals(15.0, config.minimumBankrollForHand());
    }

    @Test
    void needsAtLeastOneStopCondition() {
        SessionConfig.Builder builder = SessionConfig.builder().startingBankroll(100).baseBet(5)
                .stopOnInsufficientFunds(false);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("stop condition"));
        assertEquals(10, builder.maxHands(10).build().getMaxHands().getAsInt());
    }

    @Test
    void bankrollMustCoverTheFirstHand() {
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(14).baseBet(5).build());
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(15).baseBet(5).bonusBet(1).build());
        assertEquals(16.0, SessionConfig.builder().startingBankroll(16).baseBet(5).bonusBet(1).build()
                .minimumBankrollForHand());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(0).baseBet(5).build());
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(100).baseBet(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(100).baseBet(5).winLimit(0.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(100).baseBet(5).lossLimit(-10.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(100).baseBet(5).maxHands(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SessionConfig.builder().startingBankroll(100).baseBet(5).bonusBet(-1).build());
    }

    @Test
    void stopConditionsAreCheckedInOrder() {
        SessionConfig config = SessionConfig.builder().startingBankroll(100).baseBet(5)
                .winLimit(50.0).lossLimit(50.0).maxHands(10).build();
        assertNull(config.firstStopCondition(0, 0, 100));
        assertEquals(StopReason.WIN_LIMIT, config.firstStopCondition(50, 10, 150));
        assertEquals(StopReason.LOSS_LIMIT, config.firstStopCondition(-50, 10, 10));
        assertEquals(StopReason.MAX_HANDS, config.firstStopCondition(-20, 10, 10));
        assertEquals(StopReason.INSUFFICIENT_FUNDS, config.firstStopCondition(-20, 3, 14.99));
    }
}
