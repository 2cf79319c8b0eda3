package ai.letitride.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classifies five cards into a {@link HandResult}.
 * <p>
 * The evaluator is stateless and allocation-light: ranks are bucketed into a 15 slot count array
 * indexed by rank value, so the result does not depend on the order the cards are given in.
 * Straights include the wheel (A-2-3-4-5), which is five-high.
 */
public final class FiveCardEvaluator {

    private FiveCardEvaluator() {
    }

    public static HandResult evaluate(Card... cards) {
        if (cards.length != 5) {
            throw new IllegalArgumentException("Hand must contain exactly 5 cards, got " + cards.length);
        }
        return evaluate(List.of(cards));
    }

    /**
     * Evaluates exactly five cards.
     *
     * @param cards the five cards, in any order
     * @return the category with its tie-break ranks
     * @throws IllegalArgumentException if the hand does not hold exactly five cards
     */
    public static HandResult evaluate(List<Card> cards) {
        if (cards.size() != 5) {
            throw new IllegalArgumentException("Hand must contain exactly 5 cards, got " + cards.size());
        }

        int[] counts = new int[15];
        Suit firstSuit = cards.get(0).getSuit();
        boolean flush = true;
        int maxCount = 0;
        int uniqueRanks = 0;
        for (Card card : cards) {
            int value = card.getRank().getValue();
            if (counts[value]++ == 0) {
                uniqueRanks++;
            }
            maxCount = Math.max(maxCount, counts[value]);
            if (card.getSuit() != firstSuit) {
                flush = false;
            }
        }

        int straightHigh = straightHigh(counts, uniqueRanks);
        boolean straight = straightHigh > 0;

        // Distinct ranks, grouped by multiplicity then by value, highest first.
        List<Rank> grouped = new ArrayList<>(uniqueRanks);
        for (int count = 4; count >= 1; count--) {
            for (int value = 14; value >= 2; value--) {
                if (counts[value] == count) {
                    grouped.add(Rank.fromValue(value));
                }
            }
        }

        if (straight && flush) {
            if (straightHigh == Rank.ACE.getValue()) {
                return new HandResult(FiveCardHandRank.ROYAL_FLUSH, List.of(Rank.ACE), List.of());
            }
            return new HandResult(FiveCardHandRank.STRAIGHT_FLUSH, List.of(Rank.fromValue(straightHigh)), List.of());
        }
        if (maxCount == 4) {
            return new HandResult(FiveCardHandRank.FOUR_OF_A_KIND, grouped.subList(0, 1), grouped.subList(1, 2));
        }
        if (maxCount == 3 && uniqueRanks == 2) {
            return new HandResult(FiveCardHandRank.FULL_HOUSE, grouped, Collections.emptyList());
        }
        if (flush) {
            return new HandResult(FiveCardHandRank.FLUSH, grouped, Collections.emptyList());
        }
        if (straight) {
            return new HandResult(FiveCardHandRank.STRAIGHT, List.of(Rank.fromValue(straightHigh)), List.of());
        }
        if (maxCount == 3) {
            return new HandResult(FiveCardHandRank.THREE_OF_A_KIND, grouped.subList(0, 1), grouped.subList(1, 3));
        }
        if (maxCount == 2 && uniqueRanks == 3) {
            return new HandResult(FiveCardHandRank.TWO_PAIR, grouped.subList(0, 2), grouped.subList(2, 3));
        }
        if (maxCount == 2) {
            Rank pair = grouped.get(0);
            FiveCardHandRank rank = pair.getValue() >= Rank.TEN.getValue()
                    ? FiveCardHandRank.PAIR_TENS_OR_BETTER
                    : FiveCardHandRank.PAIR_BELOW_TENS;
            return new HandResult(rank, grouped.subList(0, 1), grouped.subList(1, 4));
        }
        return new HandResult(FiveCardHandRank.HIGH_CARD, grouped.subList(0, 1), grouped.subList(1, 5));
    }

    /**
     * Returns the high card value of a straight, 5 for the wheel, or 0 when the ranks are not a straight.
     */
    private static int straightHigh(int[] counts, int uniqueRanks) {
        if (uniqueRanks != 5) {
            return 0;
        }
        int min = 15;
        int max = 0;
        for (int value = 2; value <= 14; value++) {
            if (counts[value] > 0) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        if (max - min == 4) {
            return max;
        }
        if (counts[14] > 0 && counts[2] > 0 && counts[3] > 0 && counts[4] > 0 && counts[5] > 0) {
            return 5;
        }
        return 0;
    }
}
