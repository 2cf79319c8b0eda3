package ai.letitride.config;

import ai.letitride.analytics.RiskOfRuinCalculator;
import ai.letitride.bankroll.BettingSystems;
import ai.letitride.bankroll.BonusBetPolicy;
import ai.letitride.bankroll.ConditionalBonus;
import ai.letitride.engine.DealerSettings;
import ai.letitride.paytable.Paytables;
import ai.letitride.simulation.SimulationSettings;
import ai.letitride.strategy.Decision;
import ai.letitride.strategy.StrategyFactory;
import ai.letitride.strategy.StrategyRule;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for a simulation run, bound from {@code letitride.*}.
 *
 * Defaults live in {@code application.properties}; any value can be overridden on the command line,
 * for example:
 * {@code java -jar let-it-ride-engine.jar --letitride.simulation.sessions=100000 --letitride.strategy.type=aggressive}
 *
 * {@link #toSettings()} validates the bound values and turns them into {@link SimulationSettings}.
 */
@Component
@ConfigurationProperties(prefix = "letitride")
public class LetItRideProperties {
  private final Simulation simulation = new Simulation();
  private final Bankroll bankroll = new Bankroll();
  private final Strategy strategy = new Strategy();
  private final Bonus bonus = new Bonus();
  private final Paytable paytable = new Paytable();
  private final TableProps table = new TableProps();
  private final Dealer dealer = new Dealer();
  private final Analytics analytics = new Analytics();

  public Simulation getSimulation() {
    return simulation;
  }

  public Bankroll getBankroll() {
    return bankroll;
  }

  public Strategy getStrategy() {
    return strategy;
  }

  public Bonus getBonus() {
    return bonus;
  }

  public Paytable getPaytable() {
    return paytable;
  }

  public TableProps getTable() {
    return table;
  }

  public Dealer getDealer() {
    return dealer;
  }

  public Analytics getAnalytics() {
    return analytics;
  }

  /**
   * Builds validated run settings from the bound properties.
   *
   * @throws IllegalArgumentException for invalid values or unknown names
   * @throws ai.letitride.strategy.StrategyDefinitionException for invalid custom rules
   */
  public SimulationSettings toSettings() {
    SimulationSettings.Builder builder = SimulationSettings.builder()
        .sessions(simulation.sessions)
        .handsPerSession(simulation.handsPerSession)
        .seed(simulation.seed)
        .workers(simulation.workers > 0 ? simulation.workers : Runtime.getRuntime().availableProcessors())
        .progressInterval(simulation.progressInterval)
        .logHands(simulation.logHands)
        .startingBankroll(bankroll.startingAmount)
        .baseBet(bankroll.baseBet)
        .winLimit(bankroll.winLimit)
        .lossLimit(bankroll.lossLimit)
        .stopOnInsufficientFunds(bankroll.stopOnInsufficientFunds)
        .bettingSystem(bankroll.bettingSystem)
        .bettingOptions(bankroll.toBettingOptions())
        .strategyType(strategy.type)
        .customRules(toRules(strategy.custom.bet1Rules), toRules(strategy.custom.bet2Rules))
        .bonusPolicy(BonusBetPolicy.of(bonus.policy, bonus.amount, bonus.ratio, bonus.conditional.toConditions()))
        .bonusPaytable(bonus.paytable)
        .progressivePayout(bonus.progressivePayout)
        .mainPaytable(paytable.main)
        .seats(table.seats)
        .tableTotalRounds(table.totalRounds)
        .dealerSettings(DealerSettings.of(dealer.discardEnabled, dealer.discardCards));
    return builder.build();
  }

  private static List<StrategyRule> toRules(List<Rule> rules) {
    List<StrategyRule> converted = new ArrayList<>(rules.size());
    for (Rule rule : rules) {
      converted.add(StrategyRule.of(rule.condition, Decision.fromToken(rule.action)));
    }
    return converted;
  }

  /** {@code letitride.simulation.*} */
  public static class Simulation {
    private int sessions = 1000;
    private Integer handsPerSession = 200;
    private Long seed;
    /** 0 means one worker per available processor. */
    private int workers = 0;
    private int progressInterval = 1000;
    private boolean logHands = false;

    public int getSessions() {
      return sessions;
    }

    public void setSessions(int sessions) {
      this.sessions = sessions;
    }

    public Integer getHandsPerSession() {
      return handsPerSession;
    }

    public void setHandsPerSession(Integer handsPerSession) {
      this.handsPerSession = handsPerSession;
    }

    public Long getSeed() {
      return seed;
    }

    public void setSeed(Long seed) {
      this.seed = seed;
    }

    public int getWorkers() {
      return workers;
    }

    public void setWorkers(int workers) {
      this.workers = workers;
    }

    public int getProgressInterval() {
      return progressInterval;
    }

    public void setProgressInterval(int progressInterval) {
      this.progressInterval = progressInterval;
    }

    public boolean isLogHands() {
      return logHands;
    }

    public void setLogHands(boolean logHands) {
      this.logHands = logHands;
    }
  }

  /** {@code letitride.bankroll.*} */
  public static class Bankroll {
    private double startingAmount = 500.0;
    private double baseBet = 5.0;
    private Double winLimit;
    private Double lossLimit;
    private boolean stopOnInsufficientFunds = true;
    private String bettingSystem = BettingSystems.FLAT;
    private final Martingale martingale = new Martingale();
    private final ReverseMartingale reverseMartingale = new ReverseMartingale();
    private final Paroli paroli = new Paroli();
    private final DAlembert dalembert = new DAlembert();
    private final Fibonacci fibonacci = new Fibonacci();

    BettingSystems toBettingOptions() {
      return new BettingSystems()
          .martingale(martingale.lossMultiplier, martingale.maxBet, martingale.maxProgressions)
          .reverseMartingale(reverseMartingale.winMultiplier, reverseMartingale.maxBet,
              reverseMartingale.profitTargetStreak)
          .paroli(paroli.winMultiplier, paroli.maxBet, paroli.winsBeforeReset)
          .dalembert(dalembert.unit, dalembert.minBet, dalembert.maxBet)
          .fibonacci(fibonacci.unit, fibonacci.maxBet, fibonacci.maxPosition, fibonacci.winRegression);
    }

    public double getStartingAmount() {
      return startingAmount;
    }

    public void setStartingAmount(double startingAmount) {
      this.startingAmount = startingAmount;
    }

    public double getBaseBet() {
      return baseBet;
    }

    public void setBaseBet(double baseBet) {
      this.baseBet = baseBet;
    }

    public Double getWinLimit() {
      return winLimit;
    }

    public void setWinLimit(Double winLimit) {
      this.winLimit = winLimit;
    }

    public Double getLossLimit() {
      return lossLimit;
    }

    public void setLossLimit(Double lossLimit) {
      this.lossLimit = lossLimit;
    }

    public boolean isStopOnInsufficientFunds() {
      return stopOnInsufficientFunds;
    }

    public void setStopOnInsufficientFunds(boolean stopOnInsufficientFunds) {
      this.stopOnInsufficientFunds = stopOnInsufficientFunds;
    }

    public String getBettingSystem() {
      return bettingSystem;
    }

    public void setBettingSystem(String bettingSystem) {
      this.bettingSystem = bettingSystem;
    }

    public Martingale getMartingale() {
      return martingale;
    }

    public ReverseMartingale getReverseMartingale() {
      return reverseMartingale;
    }

    public Paroli getParoli() {
      return paroli;
    }

    public DAlembert getDalembert() {
      return dalembert;
    }

    public Fibonacci getFibonacci() {
      return fibonacci;
    }
  }

  /** {@code letitride.bankroll.martingale.*} */
  public static class Martingale {
    private double lossMultiplier = 2.0;
    private double maxBet = 500.0;
    private int maxProgressions = 6;

    public double getLossMultiplier() {
      return lossMultiplier;
    }

    public void setLossMultiplier(double lossMultiplier) {
      this.lossMultiplier = lossMultiplier;
    }

    public double getMaxBet() {
      return maxBet;
    }

    public void setMaxBet(double maxBet) {
      this.maxBet = maxBet;
    }

    public int getMaxProgressions() {
      return maxProgressions;
    }

    public void setMaxProgressions(int maxProgressions) {
      this.maxProgressions = maxProgressions;
    }
  }

  /** {@code letitride.bankroll.reverse-martingale.*} */
  public static class ReverseMartingale {
    private double winMultiplier = 2.0;
    private double maxBet = 500.0;
    private int profitTargetStreak = 3;

    public double getWinMultiplier() {
      return winMultiplier;
    }

    public void setWinMultiplier(double winMultiplier) {
      this.winMultiplier = winMultiplier;
    }

    public double getMaxBet() {
      return maxBet;
    }

    public void setMaxBet(double maxBet) {
      this.maxBet = maxBet;
    }

    public int getProfitTargetStreak() {
      return profitTargetStreak;
    }

    public void setProfitTargetStreak(int profitTargetStreak) {
      this.profitTargetStreak = profitTargetStreak;
    }
  }

  /** {@code letitride.bankroll.paroli.*} */
  public static class Paroli {
    private double winMultiplier = 2.0;
    private double maxBet = 500.0;
    private int winsBeforeReset = 3;

    public double getWinMultiplier() {
      return winMultiplier;
    }

    public void setWinMultiplier(double winMultiplier) {
      this.winMultiplier = winMultiplier;
    }

    public double getMaxBet() {
      return maxBet;
    }

    public void setMaxBet(double maxBet) {
      this.maxBet = maxBet;
    }

    public int getWinsBeforeReset() {
      return winsBeforeReset;
    }

    public void setWinsBeforeReset(int winsBeforeReset) {
      this.winsBeforeReset = winsBeforeReset;
    }
  }

  /** {@code letitride.bankroll.dalembert.*} */
  public static class DAlembert {
    private double unit = 5.0;
    private double minBet = 5.0;
    private double maxBet = 500.0;

    public double getUnit() {
      return unit;
    }

    public void setUnit(double unit) {
      this.unit = unit;
    }

    public double getMinBet() {
      return minBet;
    }

    public void setMinBet(double minBet) {
      this.minBet = minBet;
    }

    public double getMaxBet() {
      return maxBet;
    }

    public void setMaxBet(double maxBet) {
      this.maxBet = maxBet;
    }
  }

  /** {@code letitride.bankroll.fibonacci.*} */
  public static class Fibonacci {
    private double unit = 5.0;
    private double maxBet = 500.0;
    private int maxPosition = 10;
    private int winRegression = 2;

    public double getUnit() {
      return unit;
    }

    public void setUnit(double unit) {
      this.unit = unit;
    }

    public double getMaxBet() {
      return maxBet;
    }

    public void setMaxBet(double maxBet) {
      this.maxBet = maxBet;
    }

    public int getMaxPosition() {
      return maxPosition;
    }

    public void setMaxPosition(int maxPosition) {
      this.maxPosition = maxPosition;
    }

    public int getWinRegression() {
      return winRegression;
    }

    public void setWinRegression(int winRegression) {
      this.winRegression = winRegression;
    }
  }

  /** {@code letitride.strategy.*} */
  public static class Strategy {
    private String type = StrategyFactory.BASIC;
    private final Custom custom = new Custom();

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public Custom getCustom() {
      return custom;
    }
  }

  /** {@code letitride.strategy.custom.*}: ordered rules, first match wins. */
  public static class Custom {
    private List<Rule> bet1Rules = new ArrayList<>();
    private List<Rule> bet2Rules = new ArrayList<>();

    public List<Rule> getBet1Rules() {
      return bet1Rules;
    }

    public void setBet1Rules(List<Rule> bet1Rules) {
      this.bet1Rules = bet1Rules;
    }

    public List<Rule> getBet2Rules() {
      return bet2Rules;
    }

    public void setBet2Rules(List<Rule> bet2Rules) {
      this.bet2Rules = bet2Rules;
    }
  }

  public static class Rule {
    private String condition;
    private String action;

    public String getCondition() {
      return condition;
    }

    public void setCondition(String condition) {
      this.condition = condition;
    }

    public String getAction() {
      return action;
    }

    public void setAction(String action) {
      this.action = action;
    }
  }

  /** {@code letitride.bonus.*} */
  public static class Bonus {
    private String policy = BonusBetPolicy.NEVER;
    private double amount = 1.0;
    private double ratio = 0.2;
    private String paytable = Paytables.BONUS_B;
    private int progressivePayout = Paytables.DEFAULT_PROGRESSIVE_PAYOUT;
    private final Conditional conditional = new Conditional();

    public Conditional getConditional() {
      return conditional;
    }

    public String getPolicy() {
      return policy;
    }

    public void setPolicy(String policy) {
      this.policy = policy;
    }

    public double getAmount() {
      return amount;
    }

    public void setAmount(double amount) {
      this.amount = amount;
    }

    public double getRatio() {
      return ratio;
    }

    public void setRatio(double ratio) {
      this.ratio = ratio;
    }

    public String getPaytable() {
      return paytable;
    }

    public void setPaytable(String paytable) {
      this.paytable = paytable;
    }

    public int getProgressivePayout() {
      return progressivePayout;
    }

    public void setProgressivePayout(int progressivePayout) {
      this.progressivePayout = progressivePayout;
    }
  }

  /** {@code letitride.bonus.conditional.*}, used by the {@code bankroll_conditional} policy. */
  public static class Conditional {
    private double baseAmount = 1.0;
    private Double minSessionProfit = 0.0;
    private Double minBankrollRatio;
    private Double maxDrawdown = 0.25;
    private Double profitPercentage;
    private double minBet = 1.0;
    private double maxBet = 25.0;
    private List<Tier> tiers = new ArrayList<>();

    ConditionalBonus toConditions() {
      ConditionalBonus.Builder builder = ConditionalBonus.builder()
          .baseAmount(baseAmount)
          .minSessionProfit(minSessionProfit)
          .minBankrollRatio(minBankrollRatio)
          .maxDrawdown(maxDrawdown)
          .profitPercentage(profitPercentage)
          .limits(minBet, maxBet);
      for (Tier tier : tiers) {
        builder.tier(tier.minProfit, tier.maxProfit, tier.betAmount);
      }
      return builder.build();
    }

    public double getBaseAmount() {
      return baseAmount;
    }

    public void setBaseAmount(double baseAmount) {
      this.baseAmount = baseAmount;
    }

    public Double getMinSessionProfit() {
      return minSessionProfit;
    }

    public void setMinSessionProfit(Double minSessionProfit) {
      this.minSessionProfit = minSessionProfit;
    }

    public Double getMinBankrollRatio() {
      return minBankrollRatio;
    }

    public void setMinBankrollRatio(Double minBankrollRatio) {
      this.minBankrollRatio = minBankrollRatio;
    }

    public Double getMaxDrawdown() {
      return maxDrawdown;
    }

    public void setMaxDrawdown(Double maxDrawdown) {
      this.maxDrawdown = maxDrawdown;
    }

    public Double getProfitPercentage() {
      return profitPercentage;
    }

    public void setProfitPercentage(Double profitPercentage) {
      this.profitPercentage = profitPercentage;
    }

    public double getMinBet() {
      return minBet;
    }

    public void setMinBet(double minBet) {
      this.minBet = minBet;
    }

    public double getMaxBet() {
      return maxBet;
    }

    public void setMaxBet(double maxBet) {
      this.maxBet = maxBet;
    }

    public List<Tier> getTiers() {
      return tiers;
    }

    public void setTiers(List<Tier> tiers) {
      this.tiers = tiers;
    }
  }

  /** One profit tier: stake {@code betAmount} while profit is in {@code [minProfit, maxProfit)}. */
  public static class Tier {
    private double minProfit;
    private Double maxProfit;
    private double betAmount = 1.0;

    public double getMinProfit() {
      return minProfit;
    }

    public void setMinProfit(double minProfit) {
      this.minProfit = minProfit;
    }

    public Double getMaxProfit() {
      return maxProfit;
    }

    public void setMaxProfit(Double maxProfit) {
      this.maxProfit = maxProfit;
    }

    public double getBetAmount() {
      return betAmount;
    }

    public void setBetAmount(double betAmount) {
      this.betAmount = betAmount;
    }
  }

  /** {@code letitride.paytable.*} */
  public static class Paytable {
    private String main = Paytables.STANDARD;

    public String getMain() {
      return main;
    }

    public void setMain(String main) {
      this.main = main;
    }
  }

  /** {@code letitride.table.*} */
  public static class TableProps {
    private int seats = 1;
    /** Set to run seat-replacement tables for this many rounds. */
    private Integer totalRounds;

    public int getSeats() {
      return seats;
    }

    public void setSeats(int seats) {
      this.seats = seats;
    }

    public Integer getTotalRounds() {
      return totalRounds;
    }

    public void setTotalRounds(Integer totalRounds) {
      this.totalRounds = totalRounds;
    }
  }

  /** {@code letitride.dealer.*} */
  public static class Dealer {
    private boolean discardEnabled = false;
    private int discardCards = DealerSettings.DEFAULT_DISCARD;

    public boolean isDiscardEnabled() {
      return discardEnabled;
    }

    public void setDiscardEnabled(boolean discardEnabled) {
      this.discardEnabled = discardEnabled;
    }

    public int getDiscardCards() {
      return discardCards;
    }

    public void setDiscardCards(int discardCards) {
      this.discardCards = discardCards;
    }
  }

  /** {@code letitride.analytics.*} */
  public static class Analytics {
    private boolean enabled = true;
    private double confidenceLevel = 0.95;
    private List<Integer> bankrollUnits = new ArrayList<>(RiskOfRuinCalculator.DEFAULT_BANKROLL_UNITS);
    private int riskOfRuinSimulations = 10_000;
    private int riskOfRuinMaxSessions = 10_000;

    /**
     * @param seed seed of the run being analysed, so the ruin estimate is repeatable with it
     */
    public RiskOfRuinCalculator toRiskOfRuinCalculator(long seed) {
      return RiskOfRuinCalculator.builder()
          .bankrollUnits(bankrollUnits)
          .simulationsPerLevel(riskOfRuinSimulations)
          .maxSessionsPerSimulation(riskOfRuinMaxSessions)
          .confidenceLevel(confidenceLevel)
          .seed(seed)
          .build();
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public double getConfidenceLevel() {
      return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
      this.confidenceLevel = confidenceLevel;
    }

    public List<Integer> getBankrollUnits() {
      return bankrollUnits;
    }

    public void setBankrollUnits(List<Integer> bankrollUnits) {
      this.bankrollUnits = bankrollUnits;
    }

    public int getRiskOfRuinSimulations() {
      return riskOfRuinSimulations;
    }

    public void setRiskOfRuinSimulations(int riskOfRuinSimulations) {
      this.riskOfRuinSimulations = riskOfRuinSimulations;
    }

    public int getRiskOfRuinMaxSessions() {
      return riskOfRuinMaxSessions;
    }

    public void setRiskOfRuinMaxSessions(int riskOfRuinMaxSessions) {
      this.riskOfRuinMaxSessions = riskOfRuinMaxSessions;
    }
  }
}
