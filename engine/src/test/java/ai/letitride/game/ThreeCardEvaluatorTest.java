package ai.letitride.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.helpers.Cards;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ThreeCardEvaluatorTest {

    private static ThreeCardHandRank eval(String cards) {
        return ThreeCardEvaluator.evaluate(Cards.of(cards));
    }

    @Test
    void miniRoyalBeatsOtherStraightFlushes() {
        assertEquals(ThreeCardHandRank.MINI_ROYAL, eval("Qs As Ks"));
        assertEquals(ThreeCardHandRank.STRAIGHT_FLUSH, eval("2h 3h 4h"));
        assertEquals(ThreeCardHandRank.STRAIGHT_FLUSH, eval("Jd Qd Kd"));
        assertEquals(ThreeCardHandRank.STRAIGHT_FLUSH, eval("Ac 2c 3c"));
        assertTrue(ThreeCardHandRank.MINI_ROYAL.getStrength() > ThreeCardHandRank.STRAIGHT_FLUSH.getStrength());
    }

    @Test
    void categories() {
        assertEquals(ThreeCardHandRank.THREE_OF_A_KIND, eval("8c 8d 8s"));
        assertEquals(ThreeCardHandRank.STRAIGHT, eval("9c Td Js"));
        assertEquals(ThreeCardHandRank.STRAIGHT, eval("As 2d 3c"));
        assertEquals(ThreeCardHandRank.STRAIGHT, eval("Qs Kd Ac"));
        assertEquals(ThreeCardHandRank.FLUSH, eval("2s 7s Ks"));
        assertEquals(ThreeCardHandRank.PAIR, eval("Kc Kd 2s"));
        assertEquals(ThreeCardHandRank.HIGH_CARD, eval("2c 7d Ks"));
        assertEquals(ThreeCardHandRank.HIGH_CARD, eval("Kc Ad 2s"));
    }

    @Test
    void straightOutranksFlush() {
        assertTrue(ThreeCardHandRank.BY_STRENGTH.compare(ThreeCardHandRank.STRAIGHT, ThreeCardHandRank.FLUSH) > 0);
    }

    @Test
    void rejectsWrongCountAndDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> eval("2c 3c"));
        assertThrows(IllegalArgumentException.class, () -> eval("2c 3c 4c 5c"));
        assertThrows(IllegalArgumentException.class, () -> eval("2c 2c 4c"));
    }

    @Test
    void resultIsIndependentOfCardOrder() {
        Random rng = new Random(5);
        List<Card> deck = new ArrayList<>(Card.canonicalOrder());
        for (int trial = 0; trial < 500; trial++) {
            Collections.shuffle(deck, rng);
            List<Card> hand = new ArrayList<>(deck.subList(0, 3));
            ThreeCardHandRank expected = ThreeCardEvaluator.evaluate(hand);
            Collections.reverse(hand);
            assertEquals(expected, ThreeCardEvaluator.evaluate(hand));
            Collections.swap(hand, 0, 1);
            assertEquals(expected, ThreeCardEvaluator.evaluate(hand));
        }
    }
}
