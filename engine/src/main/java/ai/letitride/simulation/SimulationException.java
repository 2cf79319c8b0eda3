package ai.letitride.simulation;

import java.util.OptionalInt;

/**
 * A simulation run was aborted. Carries the index of the failing unit when one failed.
 */
public class SimulationException extends RuntimeException {
    private final int unitIndex;

    public SimulationException(int unitIndex, Throwable cause) {
        super("Simulation unit " + unitIndex + " failed: " + cause.getMessage(), cause);
        this.unitIndex = unitIndex;
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
        this.unitIndex = -1;
    }

    public OptionalInt getUnitIndex() {
        return unitIndex < 0 ? OptionalInt.empty() : OptionalInt.of(unitIndex);
    }
}
