package ai.letitride.simulation;

import java.util.Objects;

/**
 * A session played from one seat (numbered from 1).
 */
public final class SeatSessionResult {
    private final int seatNumber;
    private final SessionResult sessionResult;

    public SeatSessionResult(int seatNumber, SessionResult sessionResult) {
        this.seatNumber = seatNumber;
        this.sessionResult = Objects.requireNonNull(sessionResult, "sessionResult");
    }

    public int getSeatNumber() {
        return seatNumber;
    }

    public SessionResult getSessionResult() {
        return sessionResult;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeatSessionResult)) {
            return false;
        }
        SeatSessionResult that = (SeatSessionResult) o;
        return seatNumber == that.seatNumber && sessionResult.equals(that.sessionResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seatNumber, sessionResult);
    }

    @Override
    public String toString() {
        return "Seat " + seatNumber + ": " + sessionResult;
    }
}
