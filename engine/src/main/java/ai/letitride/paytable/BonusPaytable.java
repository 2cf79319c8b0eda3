package ai.letitride.paytable;

import ai.letitride.game.ThreeCardHandRank;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Three Card Bonus paytable: a multiplier for every three-card category.
 */
public final class BonusPaytable {
    private final String name;
    private final Map<ThreeCardHandRank, Integer> multipliers;

    /**
     * @throws PaytableValidationException if a category is missing or a multiplier is negative
     */
    public BonusPaytable(String name, Map<ThreeCardHandRank, Integer> multipliers) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(multipliers, "multipliers");
        List<String> missing = new ArrayList<>();
        Map<ThreeCardHandRank, Integer> copy = new EnumMap<>(ThreeCardHandRank.class);
        for (ThreeCardHandRank rank : ThreeCardHandRank.values()) {
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

    public int multiplier(ThreeCardHandRank rank) {
        return multipliers.get(rank);
    }

    public double payout(ThreeCardHandRank rank, double bonusBet) {
        return multipliers.get(rank) * bonusBet;
    }

    public Map<ThreeCardHandRank, Integer> getMultipliers() {
        return multipliers;
    }

    @Override
    public String toString() {
        return "BonusPaytable(" + name + ")";
    }
}
