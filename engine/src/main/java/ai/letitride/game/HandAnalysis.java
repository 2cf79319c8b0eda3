package ai.letitride.game;

import java.util.Optional;

/**
 * Immutable snapshot of the features of a partial hand (3 cards at the first decision, 4 cards at
 * the second) that pull/ride strategies decide on.
 * <p>
 * Instances are produced by {@link HandAnalyzer}; the {@link Builder} is public so strategy tests can
 * describe a hand by its features alone.
 */
public final class HandAnalysis {
    // Card counts
    private final int highCards;
    private final int suitedCards;
    private final int connectedCards;
    private final int gaps;
    private final int suitedHighCards;
    private final int straightFlushSpread;

    // Made hands
    private final boolean payingHand;
    private final boolean pair;
    private final boolean highPair;
    private final boolean trips;
    private final Rank pairRank;

    // Draws
    private final boolean flushDraw;
    private final boolean straightDraw;
    private final boolean openStraightDraw;
    private final boolean insideStraightDraw;
    private final boolean straightFlushDraw;
    private final boolean royalDraw;
    private final boolean excludedStraightFlushConsecutive;

    private HandAnalysis(Builder b) {
        this.highCards = b.highCards;
        this.suitedCards = b.suitedCards;
        this.connectedCards = b.connectedCards;
        this.gaps = b.gaps;
        this.suitedHighCards = b.suitedHighCards;
        this.straightFlushSpread = b.straightFlushSpread;
        this.payingHand = b.payingHand;
        this.pair = b.pair;
        this.highPair = b.highPair;
        this.trips = b.trips;
        this.pairRank = b.pairRank;
        this.flushDraw = b.flushDraw;
        this.straightDraw = b.straightDraw;
        this.openStraightDraw = b.openStraightDraw;
        this.insideStraightDraw = b.insideStraightDraw;
        this.straightFlushDraw = b.straightFlushDraw;
        this.royalDraw = b.royalDraw;
        this.excludedStraightFlushConsecutive = b.excludedStraightFlushConsecutive;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Count of cards ranked ten or higher. */
    public int getHighCards() {
        return highCards;
    }

    /** Size of the largest single-suit group. */
    public int getSuitedCards() {
        return suitedCards;
    }

    /** Most distinct ranks that fit in one five-wide straight window (Ace may play low). */
    public int getConnectedCards() {
        return connectedCards;
    }

    /** Missing ranks in that best window ({@code 5 - connectedCards}). */
    public int getGaps() {
        return gaps;
    }

    /** High cards inside the largest suit group. */
    public int getSuitedHighCards() {
        return suitedHighCards;
    }

    /**
     * Width (high minus low plus one) of the suited cards' tightest window, Ace playing low where that
     * is tighter; 0 when the hand is not a straight-flush draw.
     */
    public int getStraightFlushSpread() {
        return straightFlushSpread;
    }

    /** The cards already qualify for a main game payout. */
    public boolean hasPayingHand() {
        return payingHand;
    }

    /** Exactly one pair (not two pair, not trips). */
    public boolean hasPair() {
        return pair;
    }

    /** The single pair is tens or better. */
    public boolean hasHighPair() {
        return highPair;
    }

    /** Three or more cards of one rank. */
    public boolean hasTrips() {
        return trips;
    }

    public Optional<Rank> getPairRank() {
        return Optional.ofNullable(pairRank);
    }

    public boolean isFlushDraw() {
        return flushDraw;
    }

    public boolean isStraightDraw() {
        return straightDraw;
    }

    public boolean isOpenStraightDraw() {
        return openStraightDraw;
    }

    public boolean isInsideStraightDraw() {
        return insideStraightDraw;
    }

    public boolean isStraightFlushDraw() {
        return straightFlushDraw;
    }

    public boolean isRoyalDraw() {
        return royalDraw;
    }

    /** Suited A-2-3 or 2-3-4, the consecutive straight-flush draws basic strategy pulls. */
    public boolean isExcludedStraightFlushConsecutive() {
        return excludedStraightFlushConsecutive;
    }

    @Override
    public String toString() {
        return "HandAnalysis(high=" + highCards + ", suited=" + suitedCards + ", connected=" + connectedCards
                + ", gaps=" + gaps + ", suitedHigh=" + suitedHighCards + ", sfSpread=" + straightFlushSpread
                + ", paying=" + payingHand + ", pair=" + pair + ", highPair=" + highPair + ", trips=" + trips
                + ", flushDraw=" + flushDraw + ", straightDraw=" + straightDraw + ", open=" + openStraightDraw
                + ", inside=" + insideStraightDraw + ", sfDraw=" + straightFlushDraw + ", royalDraw=" + royalDraw
                + ")";
    }

    /**
     * Mutable builder; every field defaults to zero or {@code false}.
     */
    public static final class Builder {
        private int highCards;
        private int suitedCards;
        private int connectedCards;
        private int gaps;
        private int suitedHighCards;
        private int straightFlushSpread;
        private boolean payingHand;
        private boolean pair;
        private boolean highPair;
        private boolean trips;
        private Rank pairRank;
        private boolean flushDraw;
        private boolean straightDraw;
        private boolean openStraightDraw;
        private boolean insideStraightDraw;
        private boolean straightFlushDraw;
        private boolean royalDraw;
        private boolean excludedStraightFlushConsecutive;

        private Builder() {
        }

        public Builder highCards(int highCards) {
            this.highCards = highCards;
            return this;
        }

        public Builder suitedCards(int suitedCards) {
            this.suitedCards = suitedCards;
            return this;
        }

        public Builder connectedCards(int connectedCards) {
            this.connectedCards = connectedCards;
            return this;
        }

        public Builder gaps(int gaps) {
            this.gaps = gaps;
            return this;
        }

        public Builder suitedHighCards(int suitedHighCards) {
            this.suitedHighCards = suitedHighCards;
            return this;
        }

        public Builder straightFlushSpread(int straightFlushSpread) {
            this.straightFlushSpread = straightFlushSpread;
            return this;
        }

        public Builder payingHand(boolean payingHand) {
            this.payingHand = payingHand;
            return this;
        }

        public Builder pair(boolean pair) {
            this.pair = pair;
            return this;
        }

        public Builder highPair(boolean highPair) {
            this.highPair = highPair;
            return this;
        }

        public Builder trips(boolean trips) {
            this.trips = trips;
            return this;
        }

        public Builder pairRank(Rank pairRank) {
            this.pairRank = pairRank;
            return this;
        }

        public Builder flushDraw(boolean flushDraw) {
            this.flushDraw = flushDraw;
            return this;
        }

        public Builder straightDraw(boolean straightDraw) {
            this.straightDraw = straightDraw;
            return this;
        }

        public Builder openStraightDraw(boolean openStraightDraw) {
            this.openStraightDraw = openStraightDraw;
            return this;
        }

        public Builder insideStraightDraw(boolean insideStraightDraw) {
            this.insideStraightDraw = insideStraightDraw;
            return this;
        }

        public Builder straightFlushDraw(boolean straightFlushDraw) {
            this.straightFlushDraw = straightFlushDraw;
            return this;
        }

        public Builder royalDraw(boolean royalDraw) {
            this.royalDraw = royalDraw;
            return this;
        }

        public Builder excludedStraightFlushConsecutive(boolean excluded) {
            this.excludedStraightFlushConsecutive = excluded;
            return this;
        }

        public HandAnalysis build() {
            return new HandAnalysis(this);
        }
    }
}
