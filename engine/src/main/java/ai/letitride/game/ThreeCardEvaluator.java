package ai.letitride.game;

import java.util.List;

/**
 * Classifies the player's three cards for the bonus bet.
 * <p>
 * Three values are ordered with a fixed three-comparator sorting network, so there is no
 * general-purpose sort or collection allocation per hand.
 */
public final class ThreeCardEvaluator {

    private ThreeCardEvaluator() {
    }

    /**
     * Evaluates exactly three distinct cards.
     *
     * @param cards the player's three cards, in any order
     * @return the three-card category
     * @throws IllegalArgumentException if there are not exactly three cards or a card repeats
     */
    public static ThreeCardHandRank evaluate(List<Card> cards) {
        if (cards.size() != 3) {
            throw new IllegalArgumentException("Bonus hand must contain exactly 3 cards, got " + cards.size());
        }
        Card c0 = cards.get(0);
        Card c1 = cards.get(1);
        Card c2 = cards.get(2);
        if (c0.equals(c1) || c0.equals(c2) || c1.equals(c2)) {
            throw new IllegalArgumentException("Bonus hand contains duplicate cards: " + Card.format(cards));
        }

        int v0 = c0.getRank().getValue();
        int v1 = c1.getRank().getValue();
        int v2 = c2.getRank().getValue();
        int t;
        if (v0 > v1) {
            t = v0;
            v0 = v1;
            v1 = t;
        }
        if (v1 > v2) {
            t = v1;
            v1 = v2;
            v2 = t;
        }
        if (v0 > v1) {
            t = v0;
            v0 = v1;
            v1 = t;
        }

        boolean flush = c0.getSuit() == c1.getSuit() && c1.getSuit() == c2.getSuit();
        boolean trips = v0 == v2;
        boolean distinct = v0 != v1 && v1 != v2;
        boolean wheel = v0 == 2 && v1 == 3 && v2 == 14;
        boolean straight = distinct && (wheel || (v1 - v0 == 1 && v2 - v1 == 1));

        if (flush && straight) {
            if (v0 == 12 && v1 == 13 && v2 == 14) {
                return ThreeCardHandRank.MINI_ROYAL;
            }
            return ThreeCardHandRank.STRAIGHT_FLUSH;
        }
        if (trips) {
            return ThreeCardHandRank.THREE_OF_A_KIND;
        }
        if (straight) {
            return ThreeCardHandRank.STRAIGHT;
        }
        if (flush) {
            return ThreeCardHandRank.FLUSH;
        }
        if (!distinct) {
            return ThreeCardHandRank.PAIR;
        }
        return ThreeCardHandRank.HIGH_CARD;
    }
}
