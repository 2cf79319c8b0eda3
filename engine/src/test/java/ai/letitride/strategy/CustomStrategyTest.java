package ai.letitride.strategy;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.game.HandAnalysis;
import ai.letitride.game.HandAnalyzer;
import ai.letitride.helpers.Cards;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CustomStrategyTest {

    private static CustomStrategy strategy(String... conditionsThenRide) {
        List<StrategyRule> rules = new java.util.ArrayList<>();
        for (String condition : conditionsThenRide) {
            rules.add(StrategyRule.of(condition, Decision.RIDE));
        }
        rules.add(StrategyRule.of("default", Decision.PULL));
        return new CustomStrategy(rules, rules);
    }

    private static HandAnalysis three(String cards) {
        return HandAnalyzer.analyzeThreeCards(Cards.of(cards));
    }

    @Nested
    @DisplayName("evaluation")
    class Evaluation {

        @Test
        void firstMatchingRuleWins() {
            List<StrategyRule> rules = List.of(
                    StrategyRule.of("has_pair", Decision.PULL),
                    StrategyRule.of("high_cards >= 2", Decision.RIDE),
                    StrategyRule.of("default", Decision.PULL));
            CustomStrategy strategy = new CustomStrategy(rules, rules);
            assertEquals(Decision.PULL, strategy.decideBet1(three("Kc Kd 2s"), StrategyContext.EMPTY));
            assertEquals(Decision.RIDE, strategy.decideBet1(three("Kc Qd 2s"), StrategyContext.EMPTY));
            assertEquals(Decision.PULL, strategy.decideBet1(three("Kc 7d 2s"), StrategyContext.EMPTY));
        }

        @Test
        void booleanOperatorsAndParentheses() {
            CustomStrategy strategy = strategy("(is_flush_draw and not has_pair) or high_cards == 3");
            assertEquals(Decision.RIDE, strategy.decideBet1(three("2h 7h 9h"), StrategyContext.EMPTY));
            assertEquals(Decision.RIDE, strategy.decideBet1(three("Tc Jd Qs"), StrategyContext.EMPTY));
            assertEquals(Decision.PULL, strategy.decideBet1(three("2h 7d 9h"), StrategyContext.EMPTY));
        }

        @Test
        void andBindsTighterThanOr() {
            CustomStrategy strategy = strategy("has_trips or has_pair and high_cards >= 3");
            assertEquals(Decision.RIDE, strategy.decideBet1(three("3c 3d 3s"), StrategyContext.EMPTY));
            assertEquals(Decision.PULL, strategy.decideBet1(three("4c 4d Ks"), StrategyContext.EMPTY));
            assertEquals(Decision.RIDE, strategy.decideBet1(three("Kc Kd As"), StrategyContext.EMPTY));
        }

        @Test
        void fieldsCompareWithFieldsAndKeywordsIgnoreCase() {
            CustomStrategy strategy = strategy("SUITED_HIGH_CARDS == High_Cards AND suited_cards > 2");
            assertEquals(Decision.RIDE, strategy.decideBet1(three("Th Jh 2h"), StrategyContext.EMPTY));
            assertEquals(Decision.PULL, strategy.decideBet1(three("Th Jd 2h"), StrategyContext.EMPTY));
        }

        @Test
        void noMatchingRulePulls() {
            CustomStrategy strategy = new CustomStrategy(
                    List.of(StrategyRule.of("has_trips", Decision.RIDE)),
                    List.of(StrategyRule.of("has_trips", Decision.RIDE)));
            assertEquals(Decision.PULL, strategy.decideBet1(three("2c 7d Ks"), StrategyContext.EMPTY));
        }

        @Test
        void presetsMatchTheirDescriptions() {
            CustomStrategy conservative = StrategyPresets.conservative();
            CustomStrategy aggressive = StrategyPresets.aggressive();
            HandAnalysis flushDraw = three("2h 7h 9h");
            assertEquals(Decision.PULL, conservative.decideBet1(flushDraw, StrategyContext.EMPTY));
            assertEquals(Decision.RIDE, aggressive.decideBet1(flushDraw, StrategyContext.EMPTY));
            assertEquals(Decision.RIDE, conservative.decideBet1(three("Ac Ad 2s"), StrategyContext.EMPTY));
            HandAnalysis fourStraight = HandAnalyzer.analyzeFourCards(Cards.of("5c 6d 7h 8s"));
            assertEquals(Decision.RIDE, aggressive.decideBet2(fourStraight, StrategyContext.EMPTY));
            assertEquals(Decision.PULL, conservative.decideBet2(fourStraight, StrategyContext.EMPTY));
        }
    }

    @Nested
    @DisplayName("definition errors")
    class DefinitionErrors {

        @Test
        void unknownFieldIsAParseError() {
            ConditionParseException ex = assertThrows(ConditionParseException.class, () -> strategy("has_flush"));
            assertTrue(ex.getMessage().contains("unknown field 'has_flush'"));
        }

        @Test
        void typeMismatchIsAnInvalidFieldError() {
            InvalidFieldException compared = assertThrows(InvalidFieldException.class, () -> strategy("has_pair >= 1"));
            assertEquals("has_pair", compared.getField());
            assertThrows(InvalidFieldException.class, () -> strategy("high_cards"));
            assertThrows(InvalidFieldException.class, () -> strategy("2 < is_royal_draw"));
        }

        @Test
        void malformedConditions() {
            assertThrows(ConditionParseException.class, () -> strategy(""));
            assertThrows(ConditionParseException.class, () -> strategy("   "));
            assertThrows(ConditionParseException.class, () -> strategy("has_pair and"));
            assertThrows(ConditionParseException.class, () -> strategy("(has_pair"));
            assertThrows(ConditionParseException.class, () -> strategy("has_pair)"));
            assertThrows(ConditionParseException.class, () -> strategy("high_cards >="));
            assertThrows(ConditionParseException.class, () -> strategy("high_cards => 2"));
            assertThrows(ConditionParseException.class, () -> strategy("high_cards >= 2 & has_pair"));
            assertThrows(ConditionParseException.class, () -> strategy("3"));
            assertThrows(ConditionParseException.class, () -> strategy("has_pair has_trips"));
        }

        @Test
        void emptyRuleListsAreRejected() {
            List<StrategyRule> rules = List.of(StrategyRule.of("default", Decision.PULL));
            assertThrows(StrategyDefinitionException.class, () -> new CustomStrategy(List.of(), rules));
            assertThrows(StrategyDefinitionException.class, () -> new CustomStrategy(rules, List.of()));
        }
    }
}
