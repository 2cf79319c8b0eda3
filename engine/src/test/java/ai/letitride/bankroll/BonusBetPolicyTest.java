package ai.letitride.bankroll;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class BonusBetPolicyTest {

    @Test
    void resolvesStakeFromBaseBet() {
        assertEquals(0, BonusBetPolicy.never().bonusBet(10));
        assertEquals(5, BonusBetPolicy.fixed(5).bonusBet(10));
        assertEquals(2.5, BonusBetPolicy.ratio(0.25).bonusBet(10));
    }

    @Test
    void zeroStakeMeansNoBonus() {
        assertFalse(BonusBetPolicy.fixed(0).isActive());
        assertFalse(BonusBetPolicy.of("ratio", 0, 0).isActive());
        assertTrue(BonusBetPolicy.of("always", 5, 0).isActive());
        assertFalse(BonusBetPolicy.of(null, 5, 0).isActive());
    }

    @Test
    void rejectsBadConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> BonusBetPolicy.fixed(-1));
        assertThrows(IllegalArgumentException.class, () -> BonusBetPolicy.ratio(-0.5));
        assertThrows(IllegalArgumentException.class, () -> BonusBetPolicy.of("sometimes", 1, 1));
    }

    private static BettingContext session(double bankroll, double profit) {
        return new BettingContext(bankroll, 500, profit, null, 0, 10);
    }

    @Test
    void conditionalPolicyChecksProfitRatioAndDrawdown() {
        BonusBetPolicy policy = BonusBetPolicy.conditional(ConditionalBonus.builder()
                .baseAmount(3)
                .minSessionProfit(-50.0)
                .minBankrollRatio(0.95)
                .maxDrawdown(0.02)
                .build());
        assertTrue(policy.isActive());
        assertTrue(policy.isConditional());
        assertEquals(0, policy.bonusBet(5));
        assertEquals(3, policy.bonusBet(5, session(500, 0)));
        assertEquals(3, policy.bonusBet(5, session(490, -10)));
        assertEquals(0, policy.bonusBet(5, session(485, -15)), "drawdown above 2%");
        assertEquals(0, policy.bonusBet(5, session(440, -60)), "profit below the minimum");
    }

    @Test
    void profitTiersAndPercentageSetTheStake() {
        ConditionalBonus tiered = ConditionalBonus.builder()
                .baseAmount(1)
                .tier(50, 100.0, 5)
                .tier(100, null, 10)
                .build();
        assertEquals(1, tiered.bonusBet(session(520, 20)));
        assertEquals(5, tiered.bonusBet(session(550, 50)));
        assertEquals(10, tiered.bonusBet(session(900, 400)));

        ConditionalBonus share = ConditionalBonus.builder().profitPercentage(0.1).limits(2, 25).build();
        assertEquals(0, share.bonusBet(session(510, 10)), "1.0 is below the minimum bonus");
        assertEquals(8, share.bonusBet(session(580, 80)), 1e-9);
        assertEquals(25, share.bonusBet(session(1000, 500)));
    }

    @Test
    void conditionalPolicyIsBuiltFromConfiguration() {
        ConditionalBonus conditions = ConditionalBonus.builder().build();
        assertTrue(BonusBetPolicy.of("bankroll_conditional", 0, 0, conditions).isConditional());
        assertThrows(IllegalArgumentException.class, () -> BonusBetPolicy.of("bankroll_conditional", 0, 0, null));
        assertThrows(IllegalArgumentException.class, () -> ConditionalBonus.builder().maxDrawdown(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> new ConditionalBonus.ProfitTier(100, 50.0, 5));
    }
}
