package ai.letitride.paytable;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.game.FiveCardHandRank;
import ai.letitride.game.ThreeCardHandRank;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PaytablesTest {

    @Test
    void standardSchedule() {
        MainGamePaytable standard = Paytables.standard();
        assertEquals(1000, standard.multiplier(FiveCardHandRank.ROYAL_FLUSH));
        assertEquals(11, standard.multiplier(FiveCardHandRank.FULL_HOUSE));
        assertEquals(1, standard.multiplier(FiveCardHandRank.PAIR_TENS_OR_BETTER));
        assertEquals(0, standard.multiplier(FiveCardHandRank.PAIR_BELOW_TENS));
        assertEquals(15.0, standard.payout(FiveCardHandRank.PAIR_TENS_OR_BETTER, 15.0));
        assertEquals(0.0, standard.payout(FiveCardHandRank.HIGH_CARD, 15.0));
        assertEquals(120.0, standard.payout(FiveCardHandRank.FLUSH, 15.0));
    }

    @Test
    void bonusVariants() {
        assertEquals(50, Paytables.paytableA().multiplier(ThreeCardHandRank.MINI_ROYAL));
        assertEquals(100, Paytables.paytableB().multiplier(ThreeCardHandRank.MINI_ROYAL));
        assertEquals(4, Paytables.paytableB().multiplier(ThreeCardHandRank.FLUSH));
        assertEquals(2500, Paytables.paytableC(2500).multiplier(ThreeCardHandRank.MINI_ROYAL));
        assertEquals(200, Paytables.paytableC(2500).multiplier(ThreeCardHandRank.STRAIGHT_FLUSH));
        assertEquals(0.0, Paytables.paytableB().payout(ThreeCardHandRank.HIGH_CARD, 5.0));
    }

    @Test
    void lookupByName() {
        assertEquals(Paytables.STANDARD, Paytables.mainByName(" Standard ").getName());
        assertEquals(Paytables.BONUS_B, Paytables.bonusByName("b", 1000).getName());
        assertEquals(Paytables.BONUS_C, Paytables.bonusByName("paytable_c", 1000).getName());
        assertThrows(IllegalArgumentException.class, () -> Paytables.mainByName("liberal"));
        assertThrows(IllegalArgumentException.class, () -> Paytables.bonusByName("z", 1000));
    }

    @Test
    void missingRankIsRejectedEagerly() {
        Map<FiveCardHandRank, Integer> partial = new EnumMap<>(Paytables.standard().getMultipliers());
        partial.remove(FiveCardHandRank.STRAIGHT);
        partial.remove(FiveCardHandRank.FLUSH);
        PaytableValidationException ex = assertThrows(PaytableValidationException.class,
                () -> new MainGamePaytable("broken", partial));
        assertEquals("Paytable 'broken' missing ranks: straight, flush", ex.getMessage());
    }

    @Test
    void negativePayoutIsRejected() {
        Map<ThreeCardHandRank, Integer> m = new EnumMap<>(Paytables.paytableA().getMultipliers());
        m.put(ThreeCardHandRank.PAIR, -1);
        assertThrows(PaytableValidationException.class, () -> new BonusPaytable("bad", m));
    }
}
