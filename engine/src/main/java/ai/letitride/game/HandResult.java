package ai.letitride.game;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating five cards: the hand category plus the ranks that decide ties.
 * <p>
 * {@code primaryRanks} are the ranks that define the category (the pair, the trips then the pair of
 * a full house, the straight's high card, all five flush ranks) and {@code kickers} are the
 * remaining ranks, both highest first. Results are totally ordered: category strength, then primary
 * ranks lexicographically, then kickers lexicographically.
 */
public final class HandResult implements Comparable<HandResult> {
    private final FiveCardHandRank rank;
    private final List<Rank> primaryRanks;
    private final List<Rank> kickers;

    public HandResult(FiveCardHandRank rank, List<Rank> primaryRanks, List<Rank> kickers) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.primaryRanks = List.copyOf(primaryRanks);
        this.kickers = List.copyOf(kickers);
    }

    public FiveCardHandRank getRank() {
        return rank;
    }

    public List<Rank> getPrimaryRanks() {
        return primaryRanks;
    }

    public List<Rank> getKickers() {
        return kickers;
    }

    @Override
    public int compareTo(HandResult other) {
        int cmp = Integer.compare(rank.getStrength(), other.rank.getStrength());
        if (cmp != 0) {
            return cmp;
        }
        cmp = compareRanks(primaryRanks, other.primaryRanks);
        if (cmp != 0) {
            return cmp;
        }
        return compareRanks(kickers, other.kickers);
    }

    private static int compareRanks(List<Rank> a, List<Rank> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(a.get(i).getValue(), b.get(i).getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandResult)) {
            return false;
        }
        HandResult that = (HandResult) o;
        return rank == that.rank && primaryRanks.equals(that.primaryRanks) && kickers.equals(that.kickers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, primaryRanks, kickers);
    }

    @Override
    public String toString() {
        return "HandResult(" + rank.wireName() + ", primary=" + primaryRanks + ", kickers=" + kickers + ")";
    }
}
