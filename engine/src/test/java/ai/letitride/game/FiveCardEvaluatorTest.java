package ai.letitride.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.helpers.Cards;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FiveCardEvaluatorTest {

    private static HandResult eval(String cards) {
        return FiveCardEvaluator.evaluate(Cards.of(cards));
    }

    @Nested
    @DisplayName("categories")
    class Categories {

        @Test
        void royalFlush() {
            HandResult result = eval("Ts Js Qs Ks As");
            assertEquals(FiveCardHandRank.ROYAL_FLUSH, result.getRank());
            assertEquals(List.of(Rank.ACE), result.getPrimaryRanks());
        }

        @Test
        void straightFlushAndSteelWheel() {
            HandResult nineHigh = eval("5h 6h 7h 8h 9h");
            assertEquals(FiveCardHandRank.STRAIGHT_FLUSH, nineHigh.getRank());
            assertEquals(List.of(Rank.NINE), nineHigh.getPrimaryRanks());

            HandResult steelWheel = eval("Ad 2d 3d 4d 5d");
            assertEquals(FiveCardHandRank.STRAIGHT_FLUSH, steelWheel.getRank());
            assertEquals(List.of(Rank.FIVE), steelWheel.getPrimaryRanks());
        }

        @Test
        void wheelIsFiveHighStraight() {
            HandResult wheel = eval("Ah 2c 3d 4s 5h");
            assertEquals(FiveCardHandRank.STRAIGHT, wheel.getRank());
            assertEquals(List.of(Rank.FIVE), wheel.getPrimaryRanks());
            assertTrue(wheel.compareTo(eval("2h 3c 4d 5s 6h")) < 0);
        }

        @Test
        void noWrapAroundStraight() {
            assertEquals(FiveCardHandRank.HIGH_CARD, eval("Qh Kc Ad 2s 3h").getRank());
        }

        @Test
        void fourOfAKind() {
            HandResult result = eval("9c 9d 9h 9s Kd");
            assertEquals(FiveCardHandRank.FOUR_OF_A_KIND, result.getRank());
            assertEquals(List.of(Rank.NINE), result.getPrimaryRanks());
            assertEquals(List.of(Rank.KING), result.getKickers());
        }

        @Test
        void fullHouseRanksTripsThenPair() {
            HandResult result = eval("4c 4d Kh Ks 4s");
            assertEquals(FiveCardHandRank.FULL_HOUSE, result.getRank());
            assertEquals(List.of(Rank.FOUR, Rank.KING), result.getPrimaryRanks());
            assertTrue(result.getKickers().isEmpty());
        }

        @Test
        void flushKeepsAllRanksDescending() {
            HandResult result = eval("2c 9c Jc 4c Kc");
            assertEquals(FiveCardHandRank.FLUSH, result.getRank());
            assertEquals(List.of(Rank.KING, Rank.JACK, Rank.NINE, Rank.FOUR, Rank.TWO), result.getPrimaryRanks());
        }

        @Test
        void threeOfAKind() {
            HandResult result = eval("7c 7d 7h As 2d");
            assertEquals(FiveCardHandRank.THREE_OF_A_KIND, result.getRank());
            assertEquals(List.of(Rank.ACE, Rank.TWO), result.getKickers());
        }

        @Test
        void twoPair() {
            HandResult result = eval("3c 3d Jh Js 8d");
            assertEquals(FiveCardHandRank.TWO_PAIR, result.getRank());
            assertEquals(List.of(Rank.JACK, Rank.THREE), result.getPrimaryRanks());
            assertEquals(List.of(Rank.EIGHT), result.getKickers());
        }

        @Test
        void pairOfJacksPaysAndPairOfNinesDoesNot() {
            HandResult jacks = eval("Jc Jd 2h 5s 8d");
            HandResult nines = eval("9c 9d 2h 5s Kd");
            assertEquals(FiveCardHandRank.PAIR_TENS_OR_BETTER, jacks.getRank());
            assertEquals(FiveCardHandRank.PAIR_BELOW_TENS, nines.getRank());
            assertEquals(List.of(Rank.KING, Rank.FIVE, Rank.TWO), nines.getKickers());
            assertEquals(FiveCardHandRank.PAIR_TENS_OR_BETTER, eval("Tc Td 2h 5s 8d").getRank());
        }

        @Test
        void highCard() {
            HandResult result = eval("2c 5d 9h Js Kd");
            assertEquals(FiveCardHandRank.HIGH_CARD, result.getRank());
            assertEquals(List.of(Rank.KING), result.getPrimaryRanks());
            assertEquals(List.of(Rank.JACK, Rank.NINE, Rank.FIVE, Rank.TWO), result.getKickers());
        }
    }

    @Test
    void rejectsWrongCardCount() {
        assertThrows(IllegalArgumentException.class, () -> FiveCardEvaluator.evaluate(Cards.of("Ah Kh Qh Jh")));
        assertThrows(IllegalArgumentException.class, () -> FiveCardEvaluator.evaluate(Cards.of("Ah Kh Qh Jh Th 9h")));
    }

    @Test
    void resultIsIndependentOfCardOrder() {
        Random rng = new Random(11);
        List<Card> deck = new ArrayList<>(Card.canonicalOrder());
        for (int trial = 0; trial < 500; trial++) {
            Collections.shuffle(deck, rng);
            List<Card> hand = new ArrayList<>(deck.subList(0, 5));
            HandResult expected = FiveCardEvaluator.evaluate(hand);
            for (int i = 0; i < 5; i++) {
                Collections.shuffle(hand, rng);
                assertEquals(expected, FiveCardEvaluator.evaluate(hand));
            }
        }
    }

    @Test
    void handResultOrderingIsTotalAndConsistent() {
        HandResult acesKingKicker = eval("Ac Ad Kh 5s 2d");
        HandResult acesQueenKicker = eval("Ac Ad Qh 5s 2d");
        HandResult acesKingKickerOtherSuits = eval("Ah As Kc 5d 2c");
        HandResult kings = eval("Kc Kd Ah 5s 2d");

        assertTrue(acesKingKicker.compareTo(acesQueenKicker) > 0);
        assertTrue(acesQueenKicker.compareTo(kings) > 0);
        assertEquals(0, acesKingKicker.compareTo(acesKingKickerOtherSuits));
        assertEquals(acesKingKicker, acesKingKickerOtherSuits);

        List<HandResult> sorted = new ArrayList<>(List.of(kings, acesKingKicker, eval("2c 3d 4h 5s 7d"),
                eval("Ts Js Qs Ks As"), acesQueenKicker));
        Collections.sort(sorted);
        assertEquals(FiveCardHandRank.HIGH_CARD, sorted.get(0).getRank());
        assertEquals(kings, sorted.get(1));
        assertEquals(FiveCardHandRank.ROYAL_FLUSH, sorted.get(4).getRank());
    }

    @Test
    void strengthsAreExplicitAndIncreasing() {
        FiveCardHandRank[] ranks = FiveCardHandRank.values();
        for (int i = 1; i < ranks.length; i++) {
            assertTrue(ranks[i].beats(ranks[i - 1]));
        }
        assertEquals(10, FiveCardHandRank.ROYAL_FLUSH.getStrength());
        assertEquals("pair_tens_or_better", FiveCardHandRank.PAIR_TENS_OR_BETTER.wireName());
        assertEquals(FiveCardHandRank.FLUSH, FiveCardHandRank.fromWireName("flush"));
    }
}
