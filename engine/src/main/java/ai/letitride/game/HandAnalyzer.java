package ai.letitride.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link HandAnalysis} features for the two pull/ride decision points: the player's three
 * cards (first bet) and those cards plus the first community card (second bet).
 * <p>
 * High cards are ten through ace. Straight potential is measured over the five-wide windows 1-5
 * through 10-14, with the ace also tried low when the hand holds a card of five or below. Only
 * windows holding at least three of the cards count.
 */
public final class HandAnalyzer {
    private static final int HIGH_CARD_MIN = Rank.TEN.getValue();

    private HandAnalyzer() {
    }

    /**
     * Analyzes the player's three cards for the first decision.
     *
     * @param cards exactly three cards
     * @return the hand features
     * @throws IllegalArgumentException if there are not exactly three cards
     */
    public static HandAnalysis analyzeThreeCards(List<Card> cards) {
        if (cards.size() != 3) {
            throw new IllegalArgumentException("Expected 3 cards, got " + cards.size());
        }
        return analyze(cards);
    }

    /**
     * Analyzes the player's three cards plus the first community card for the second decision.
     *
     * @param cards exactly four cards
     * @return the hand features
     * @throws IllegalArgumentException if there are not exactly four cards
     */
    public static HandAnalysis analyzeFourCards(List<Card> cards) {
        if (cards.size() != 4) {
            throw new IllegalArgumentException("Expected 4 cards, got " + cards.size());
        }
        return analyze(cards);
    }

    private static HandAnalysis analyze(List<Card> cards) {
        boolean fourCards = cards.size() == 4;
        HandAnalysis.Builder builder = HandAnalysis.builder();

        int[] rankCounts = new int[15];
        int highCards = 0;
        int uniqueRanks = 0;
        int maxCount = 0;
        for (Card card : cards) {
            int value = card.getRank().getValue();
            if (value >= HIGH_CARD_MIN) {
                highCards++;
            }
            if (rankCounts[value]++ == 0) {
                uniqueRanks++;
            }
            maxCount = Math.max(maxCount, rankCounts[value]);
        }
        builder.highCards(highCards);

        // Made hands
        boolean twoPair = fourCards && uniqueRanks == 2 && maxCount == 2;
        boolean trips = maxCount >= 3;
        boolean pair = maxCount == 2 && !twoPair;
        boolean highPair = false;
        if (pair) {
            for (int value = 14; value >= 2; value--) {
                if (rankCounts[value] == 2) {
                    builder.pairRank(Rank.fromValue(value));
                    highPair = value >= HIGH_CARD_MIN;
                    break;
                }
            }
        }
        builder.trips(trips)
                .pair(pair)
                .highPair(highPair)
                .payingHand(trips || highPair || twoPair);

        // Straight potential
        StraightWindow window = bestStraightWindow(rankCounts, cards.size());
        builder.connectedCards(window.connected)
                .gaps(5 - window.connected)
                .openStraightDraw(window.open)
                .insideStraightDraw(window.inside)
                .straightDraw(window.connected >= (fourCards ? 4 : 3));

        // Suits
        List<Card> suited = largestSuitGroup(cards);
        int suitedHigh = 0;
        for (Card card : suited) {
            if (card.getRank().getValue() >= HIGH_CARD_MIN) {
                suitedHigh++;
            }
        }
        boolean flushDraw = fourCards ? suited.size() >= 4 : suited.size() == 3;
        builder.suitedCards(suited.size())
                .suitedHighCards(suitedHigh)
                .flushDraw(flushDraw);

        if (flushDraw) {
            int spread = straightFlushSpread(suited);
            if (spread > 0) {
                builder.straightFlushDraw(true)
                        .straightFlushSpread(spread)
                        .excludedStraightFlushConsecutive(isExcludedConsecutive(suited));
            }
            builder.royalDraw(isRoyalDraw(suited));
        }
        return builder.build();
    }

    /**
     * Cards of the most common suit; on a tie the suit seen first wins.
     */
    private static List<Card> largestSuitGroup(List<Card> cards) {
        int[] suitCounts = new int[Suit.values().length];
        for (Card card : cards) {
            suitCounts[card.getSuit().ordinal()]++;
        }
        Suit best = null;
        for (Card card : cards) {
            Suit suit = card.getSuit();
            if (best == null || suitCounts[suit.ordinal()] > suitCounts[best.ordinal()]) {
                best = suit;
            }
        }
        List<Card> group = new ArrayList<>(cards.size());
        for (Card card : cards) {
            if (card.getSuit() == best) {
                group.add(card);
            }
        }
        return group;
    }

    private static StraightWindow bestStraightWindow(int[] rankCounts, int handSize) {
        boolean[] high = new boolean[15];
        boolean hasLowCard = false;
        for (int value = 2; value <= 14; value++) {
            high[value] = rankCounts[value] > 0;
            if (high[value] && value <= 5) {
                hasLowCard = true;
            }
        }
        StraightWindow best = new StraightWindow();
        scanWindows(high, handSize, best);
        if (high[14] && hasLowCard) {
            boolean[] low = high.clone();
            low[14] = false;
            low[1] = true;
            scanWindows(low, handSize, best);
        }
        return best;
    }

    private static void scanWindows(boolean[] present, int handSize, StraightWindow best) {
        for (int windowLow = 1; windowLow <= 10; windowLow++) {
            int count = 0;
            int min = 0;
            int max = 0;
            for (int value = windowLow; value <= windowLow + 4; value++) {
                if (present[value]) {
                    if (count == 0) {
                        min = value;
                    }
                    max = value;
                    count++;
                }
            }
            if (count < 3 || count <= best.connected) {
                continue;
            }
            best.connected = count;
            best.open = false;
            best.inside = false;
            if (count == 4 && handSize >= 4) {
                if (max - min == 3) {
                    // A-2-3-4 can only fill high, J-Q-K-A only low.
                    best.open = min > 1 && max < 14;
                    best.inside = !best.open;
                } else {
                    best.inside = true;
                }
            }
        }
    }

    private static int straightFlushSpread(List<Card> suited) {
        int min = 15;
        int max = 0;
        int minLow = 15;
        int maxLow = 0;
        for (Card card : suited) {
            int value = card.getRank().getValue();
            int lowValue = card.getRank().getLowValue();
            min = Math.min(min, value);
            max = Math.max(max, value);
            minLow = Math.min(minLow, lowValue);
            maxLow = Math.max(maxLow, lowValue);
        }
        int span = Math.min(max - min, maxLow - minLow);
        return span <= 4 ? span + 1 : 0;
    }

    private static boolean isRoyalDraw(List<Card> suited) {
        int royals = 0;
        boolean ace = false;
        for (Card card : suited) {
            if (card.getRank().isHigh()) {
                royals++;
                ace |= card.getRank() == Rank.ACE;
            }
        }
        return royals >= 3 && ace;
    }

    private static boolean isExcludedConsecutive(List<Card> suited) {
        if (suited.size() != 3) {
            return false;
        }
        int mask = 0;
        for (Card card : suited) {
            mask |= 1 << card.getRank().getValue();
        }
        int aceTwoThree = (1 << 14) | (1 << 2) | (1 << 3);
        int twoThreeFour = (1 << 2) | (1 << 3) | (1 << 4);
        return mask == aceTwoThree || mask == twoThreeFour;
    }

    /** Without a window of three or more cards the hand reports one connected card and four gaps. */
    private static final class StraightWindow {
        int connected = 1;
        boolean open;
        boolean inside;
    }
}
