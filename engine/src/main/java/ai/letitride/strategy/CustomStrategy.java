package ai.letitride.strategy;

import ai.letitride.game.HandAnalysis;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-list strategy: for each decision the first rule whose condition matches wins.
 *
 * <p>Every condition is compiled when the strategy is built, so a bad rule fails configuration
 * instead of a session. When no rule matches the bet is pulled.
 */
public final class CustomStrategy implements Strategy {
    private static final Logger log = LoggerFactory.getLogger(CustomStrategy.class);

    private final List<StrategyRule> bet1Rules;
    private final List<StrategyRule> bet2Rules;
    private final List<CompiledRule> bet1;
    private final List<CompiledRule> bet2;

    /**
     * @param bet1Rules rules for the three-card decision, in priority order (non-empty)
     * @param bet2Rules rules for the four-card decision, in priority order (non-empty)
     * @throws StrategyDefinitionException if a rule list is empty or a condition does not compile
     */
    public CustomStrategy(List<StrategyRule> bet1Rules, List<StrategyRule> bet2Rules) {
        this.bet1Rules = List.copyOf(bet1Rules);
        this.bet2Rules = List.copyOf(bet2Rules);
        this.bet1 = compile("bet1", this.bet1Rules);
        this.bet2 = compile("bet2", this.bet2Rules);
    }

    private static List<CompiledRule> compile(String decisionPoint, List<StrategyRule> rules) {
        if (rules.isEmpty()) {
            throw new StrategyDefinitionException(decisionPoint + " rules must not be empty");
        }
        List<CompiledRule> compiled = new ArrayList<>(rules.size());
        for (StrategyRule rule : rules) {
            compiled.add(new CompiledRule(ConditionCompiler.compile(rule.getCondition()), rule.getAction()));
        }
        if (log.isDebugEnabled()) {
            log.debug("Compiled {} {} rules: {}", compiled.size(), decisionPoint, rules);
        }
        return List.copyOf(compiled);
    }

    @Override
    public Decision decideBet1(HandAnalysis analysis, StrategyContext context) {
        return decide(bet1, analysis);
    }

    @Override
    public Decision decideBet2(HandAnalysis analysis, StrategyContext context) {
        return decide(bet2, analysis);
    }

    private static Decision decide(List<CompiledRule> rules, HandAnalysis analysis) {
        for (CompiledRule rule : rules) {
            if (rule.condition.test(analysis)) {
                return rule.action;
            }
        }
        return Decision.PULL;
    }

    public List<StrategyRule> getBet1Rules() {
        return bet1Rules;
    }

    public List<StrategyRule> getBet2Rules() {
        return bet2Rules;
    }

    private static final class CompiledRule {
        final Predicate<HandAnalysis> condition;
        final Decision action;

        CompiledRule(Predicate<HandAnalysis> condition, Decision action) {
            this.condition = condition;
            this.action = action;
        }
    }
}
