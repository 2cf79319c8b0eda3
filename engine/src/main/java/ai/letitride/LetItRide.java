package ai.letitride;

import ai.letitride.analytics.ChairPositionAnalyzer;
import ai.letitride.analytics.ChairPositionReport;
import ai.letitride.analytics.DetailedStatistics;
import ai.letitride.analytics.HandFrequencyValidator;
import ai.letitride.analytics.RiskOfRuinReport;
import ai.letitride.analytics.StatisticsCalculator;
import ai.letitride.analytics.ValidationReport;
import ai.letitride.config.LetItRideProperties;
import ai.letitride.simulation.AggregateStatistics;
import ai.letitride.simulation.SimulationController;
import ai.letitride.simulation.SimulationResults;
import ai.letitride.simulation.SimulationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LetItRide implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(LetItRide.class);

    private final LetItRideProperties properties;

    public LetItRide(LetItRideProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LetItRide.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint only logs the summary; tests and other harnesses
        // can call simulate() directly and use the returned results.
        simulate();
    }

    /**
     * Runs one simulation with the bound configuration and logs a summary.
     *
     * @return the full results of the run
     */
    public SimulationResults simulate() {
        SimulationSettings settings = properties.toSettings();
        if (log.isDebugEnabled()) {
            log.debug("Simulation settings: {}", settings);
        }
        SimulationResults results = new SimulationController(settings).run();
        AggregateStatistics stats = results.getStatistics();
        log.info("Seed {}: {} sessions, {} hands in {} ms", results.getSeed(), stats.getTotalSessions(),
                stats.getTotalHands(), results.getDuration().toMillis());
        log.info(String.format("Session win rate %.2f%%, net %.2f, EV/hand %.4f (main %.4f, bonus %.4f)",
                stats.getSessionWinRate() * 100.0, stats.getNetResult(), stats.getExpectedValuePerHand(),
                stats.getMainEvPerHand(), stats.getBonusEvPerHand()));
        log.info(String.format("Session profit mean %.2f, std %.2f, median %.2f, range [%.2f, %.2f]",
                stats.getSessionProfitMean(), stats.getSessionProfitStd(), stats.getSessionProfitMedian(),
                stats.getSessionProfitMin(), stats.getSessionProfitMax()));
        if (log.isDebugEnabled()) {
            log.debug("Hand frequencies: {}", stats.getHandFrequencyPct());
        }
        if (properties.getAnalytics().isEnabled()) {
            logAnalytics(settings, results);
        }
        return results;
    }

    private void logAnalytics(SimulationSettings settings, SimulationResults results) {
        LetItRideProperties.Analytics analytics = properties.getAnalytics();
        AggregateStatistics stats = results.getStatistics();
        DetailedStatistics detailed = StatisticsCalculator.calculate(stats, results.getSessionResults(),
                analytics.getConfidenceLevel());
        log.info("Session win rate {}, EV/hand {}", detailed.getSessionWinRateInterval(),
                detailed.getExpectedValueInterval());
        log.info("Session profits: {}", detailed.getSessionProfits());
        log.info("Loss risk: {}", detailed.getRisk());

        double baseBet = settings.getSessionConfig().getBaseBet();
        ValidationReport validation = new HandFrequencyValidator(0.05, baseBet).validate(stats);
        log.info("Hand distribution {}", validation.getChiSquare());
        for (String warning : validation.getWarnings()) {
            log.warn(warning);
        }

        if (results.getSessionResults().size() >= 10) {
            RiskOfRuinReport ruin = analytics.toRiskOfRuinCalculator(results.getSeed()).calculate(
                    results.getSessionResults());
            for (RiskOfRuinReport.Level level : ruin.getLevels()) {
                log.info("Risk of ruin at {}", level);
            }
        } else {
            log.info("Risk of ruin skipped, it needs at least 10 sessions");
        }

        if (!results.getTableResults().isEmpty() && settings.getSeats() > 1) {
            ChairPositionReport chairs = new ChairPositionAnalyzer(analytics.getConfidenceLevel(), 0.05)
                    .analyze(results.getTableResults());
            chairs.getSeats().forEach(seat -> log.info("Chair position {}", seat));
            log.info("Seat position independent: {} ({})", chairs.isPositionIndependent(), chairs.getIndependence());
        }
    }
}
