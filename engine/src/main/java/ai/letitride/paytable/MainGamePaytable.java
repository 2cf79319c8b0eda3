package ai.letitride.paytable;

import ai.letitride.game.FiveCardHandRank;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main game paytable: a payout multiplier (to one) for every five-card category.
 * <p>
 * Validated on construction, so a table that exists is always complete.
 */
public final class MainGamePaytable {
    private final String name;
    private final Map<FiveCardHandRank, Integer> multipliers;

    /**
     * @param name        identifier used in configuration and logs
     * @param multipliers payout to one for each category
     * @throws PaytableValidationException if a category is missing or a multiplier is negative
     */
    public MainGamePaytable(String name, Map<FiveCardHandRank, Integer> multipliers) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(multipliers, "multipliers");
        List<String> missing = new ArrayList<>();
        Map<FiveCardHandRank, Integer> copy = new EnumMap<>(FiveCardHandRank.class);
        for (FiveCardHandRank rank : FiveCardHandRank.values()) {
            Integer multiplier = multipliers.get(rank);
            if (multiplier == null) {
                missing.add(rank.wireName());
                continue;
            }
            if (multiplier < 0) {
                throw new PaytableValidationException(
                        "Paytable '" + name + "' has negative payout for " + rank.wireName() + ": " + multiplier);
            }
            copy.put(rank, multiplier);
        }
        if (!missing.isEmpty()) {
            throw new PaytableValidationException("Paytable '" + name + "' missing ranks: " + String.join(", ", missing));
        }
        this.multipliers = Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    public int multiplier(FiveCardHandRank rank) {
        return multipliers.get(rank);
    }

    /**
     * Profit paid on a winning hand: multiplier times the amount at risk. Zero for non-paying hands.
     *
     * @param rank        final hand category
     * @param betsAtRisk  total of the bets left in action
     * @return the payout, not including the returned stake
     */
    public double payout(FiveCardHandRank rank, double betsAtRisk) {
        return multipliers.get(rank) * betsAtRisk;
    }

    public Map<FiveCardHandRank, Integer> getMultipliers() {
        return multipliers;
    }

    @Override
    public String toString() {
        return "MainGamePaytable(" + name + ")";
    }
}
