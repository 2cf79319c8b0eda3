package ai.letitride.config;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.bankroll.BettingContext;
import ai.letitride.bankroll.FibonacciBetting;
import ai.letitride.simulation.SimulationSettings;
import ai.letitride.strategy.CustomStrategy;
import ai.letitride.strategy.StrategyDefinitionException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class LetItRidePropertiesTest {

    private static LetItRideProperties bind(Map<String, String> values) {
        LetItRideProperties properties = new LetItRideProperties();
        new Binder(new MapConfigurationPropertySource(values))
                .bind("letitride", Bindable.ofInstance(properties));
        return properties;
    }

    @Test
    void defaultsBuildValidSettings() {
        SimulationSettings settings = new LetItRideProperties().toSettings();
        assertEquals(1000, settings.getSessions());
        assertEquals(Integer.valueOf(200), settings.getHandsPerSession());
        assertTrue(settings.getSeed().isEmpty());
        assertTrue(settings.getWorkers() >= 1);
        assertEquals("basic", settings.getStrategyType());
        assertEquals("flat", settings.getBettingSystem());
        assertNull(settings.getBonusPaytable());
        assertFalse(settings.isTable());
        assertFalse(settings.getDealerSettings().isDiscardEnabled());
        assertEquals(500.0, settings.getSessionConfig().getStartingBankroll());
    }

    @Test
    void bindsRelaxedPropertyNames() {
        Map<String, String> values = new HashMap<>();
        values.put("letitride.simulation.sessions", "50");
        values.put("letitride.simulation.seed", "7");
        values.put("letitride.simulation.workers", "3");
        values.put("letitride.bankroll.starting-amount", "1000");
        values.put("letitride.bankroll.base-bet", "10");
        values.put("letitride.bankroll.win-limit", "250");
        values.put("letitride.bankroll.betting-system", "martingale");
        values.put("letitride.bonus.policy", "ratio");
        values.put("letitride.bonus.ratio", "0.5");
        values.put("letitride.bonus.paytable", "paytable_c");
        values.put("letitride.table.seats", "4");
        values.put("letitride.table.total-rounds", "300");
        values.put("letitride.dealer.discard-enabled", "true");
        values.put("letitride.dealer.discard-cards", "5");
        SimulationSettings settings = bind(values).toSettings();

        assertEquals(50, settings.getSessions());
        assertEquals(7L, settings.getSeed().getAsLong());
        assertEquals(3, settings.getWorkers());
        assertEquals(1000.0, settings.getSessionConfig().getStartingBankroll());
        assertEquals(250.0, settings.getSessionConfig().getWinLimit().getAsDouble());
        assertEquals(5.0, settings.getSessionConfig().getBonusBet());
        assertEquals("martingale", settings.getBettingSystem());
        assertEquals("paytable_c", settings.getBonusPaytable().getName());
        assertEquals(4, settings.getSeats());
        assertEquals(Integer.valueOf(300), settings.getTableTotalRounds());
        assertTrue(settings.isTable());
        assertEquals(5, settings.getDealerSettings().getDiscardCards());
    }

    @Test
    void bindsProgressionAndConditionalBonusSettings() {
        Map<String, String> values = new HashMap<>();
        values.put("letitride.bankroll.betting-system", "fibonacci");
        values.put("letitride.bankroll.fibonacci.unit", "10");
        values.put("letitride.bankroll.fibonacci.max-position", "4");
        values.put("letitride.bonus.policy", "bankroll_conditional");
        values.put("letitride.bonus.conditional.base-amount", "2");
        values.put("letitride.bonus.conditional.tiers[0].min-profit", "50");
        values.put("letitride.bonus.conditional.tiers[0].max-profit", "100");
        values.put("letitride.bonus.conditional.tiers[0].bet-amount", "5");
        LetItRideProperties properties = bind(values);
        SimulationSettings settings = properties.toSettings();

        assertEquals(1, properties.getBonus().getConditional().getTiers().size());
        assertEquals("fibonacci", settings.getBettingSystem());
        FibonacciBetting fibonacci = (FibonacciBetting) settings.newBettingSystem();
        assertEquals(10.0, fibonacci.nextBet(new BettingContext(500, 500, 0, null, 0, 0)));
        assertTrue(settings.getBonusPolicy().isConditional());
        assertEquals(0.0, settings.getSessionConfig().getBonusBet());
        assertNotNull(settings.getBonusPaytable());
        assertEquals(2.0, settings.getBonusPolicy().bonusBet(5, new BettingContext(510, 500, 10, null, 1, 3)));
        assertEquals(5.0, settings.getBonusPolicy().bonusBet(5, new BettingContext(560, 500, 60, null, 1, 3)));
    }

    @Test
    void customRulesBindAsIndexedLists() {
        Map<String, String> values = new HashMap<>();
        values.put("letitride.strategy.type", "custom");
        values.put("letitride.strategy.custom.bet1-rules[0].condition", "has_paying_hand");
        values.put("letitride.strategy.custom.bet1-rules[0].action", "ride");
        values.put("letitride.strategy.custom.bet1-rules[1].condition", "default");
        values.put("letitride.strategy.custom.bet1-rules[1].action", "pull");
        values.put("letitride.strategy.custom.bet2-rules[0].condition", "is_flush_draw or has_paying_hand");
        values.put("letitride.strategy.custom.bet2-rules[0].action", "ride");
        LetItRideProperties properties = bind(values);

        assertEquals(2, properties.getStrategy().getCustom().getBet1Rules().size());
        assertInstanceOf(CustomStrategy.class, properties.toSettings().getStrategy());
    }

    @Test
    void invalidCustomRulesFailBeforeTheRun() {
        Map<String, String> values = new HashMap<>();
        values.put("letitride.strategy.type", "custom");
        values.put("letitride.strategy.custom.bet1-rules[0].condition", "high_cards >=");
        values.put("letitride.strategy.custom.bet1-rules[0].action", "ride");
        LetItRideProperties properties = bind(values);
        assertThrows(StrategyDefinitionException.class, properties::toSettings);
    }

    @Test
    void invalidValuesAreRejected() {
        Map<String, String> values = new HashMap<>();
        values.put("letitride.table.seats", "9");
        assertThrows(IllegalArgumentException.class, () -> bind(values).toSettings());
    }

    @Test
    void bindsAnalyticsSettings() {
        Map<String, String> values = new HashMap<>();
        values.put("letitride.analytics.enabled", "false");
        values.put("letitride.analytics.confidence-level", "0.9");
        values.put("letitride.analytics.bankroll-units", "50,10");
        values.put("letitride.analytics.risk-of-ruin-simulations", "20");
        LetItRideProperties.Analytics analytics = bind(values).getAnalytics();

        assertFalse(analytics.isEnabled());
        assertEquals(0.9, analytics.getConfidenceLevel(), 0.0);
        assertEquals(List.of(50, 10), analytics.getBankrollUnits());
        assertEquals(20, analytics.getRiskOfRuinSimulations());
        assertEquals(10_000, analytics.getRiskOfRuinMaxSessions());
        assertNotNull(analytics.toRiskOfRuinCalculator(1L));

        values.put("letitride.analytics.bankroll-units", "0");
        LetItRideProperties invalid = bind(values);
        assertThrows(IllegalArgumentException.class, () -> invalid.getAnalytics().toRiskOfRuinCalculator(1L));
    }
}
