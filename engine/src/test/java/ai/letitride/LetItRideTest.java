package ai.letitride;

import static org.junit.jupiter.api.Assertions.*;

import ai.letitride.config.LetItRideProperties;
import ai.letitride.simulation.SimulationResults;
import org.junit.jupiter.api.Test;

class LetItRideTest {

    @Test
    void simulateRunsTheConfiguredSessions() {
        LetItRideProperties properties = new LetItRideProperties();
        properties.getSimulation().setSessions(4);
        properties.getSimulation().setHandsPerSession(25);
        properties.getSimulation().setSeed(7L);
        properties.getSimulation().setWorkers(2);

        SimulationResults results = new LetItRide(properties).simulate();

        assertEquals(4, results.getSessionResults().size());
        assertEquals(7L, results.getSeed());
        assertEquals(4, results.getStatistics().getTotalSessions());
        assertTrue(results.getTotalHands() <= 100);
    }

    @Test
    void runDelegatesToSimulate() {
        LetItRideProperties properties = new LetItRideProperties();
        properties.getSimulation().setSessions(1);
        properties.getSimulation().setHandsPerSession(5);
        properties.getSimulation().setWorkers(1);
        assertDoesNotThrow(() -> new LetItRide(properties).run());
    }

    @Test
    void analyticsCoverTableRuns() {
        LetItRideProperties properties = new LetItRideProperties();
        properties.getSimulation().setSessions(4);
        properties.getSimulation().setHandsPerSession(20);
        properties.getSimulation().setSeed(11L);
        properties.getSimulation().setWorkers(2);
        properties.getTable().setSeats(3);
        properties.getAnalytics().setRiskOfRuinSimulations(100);
        properties.getAnalytics().setRiskOfRuinMaxSessions(200);

        SimulationResults results = assertDoesNotThrow(() -> new LetItRide(properties).simulate());

        assertEquals(12, results.getSessionResults().size());
        assertEquals(4, results.getTableResults().size());
    }

    @Test
    void analyticsCanBeSwitchedOff() {
        LetItRideProperties properties = new LetItRideProperties();
        properties.getSimulation().setSessions(2);
        properties.getSimulation().setHandsPerSession(5);
        properties.getSimulation().setWorkers(1);
        properties.getAnalytics().setEnabled(false);
        properties.getAnalytics().setConfidenceLevel(2.0);
        // An invalid level is never read while analytics are off.
        assertDoesNotThrow(() -> new LetItRide(properties).simulate());
    }
}
