package ai.letitride.analytics;

import java.util.List;
import java.util.Optional;

/**
 * Per-seat outcomes of a multi-seat run and the seat independence test. Built by
 * {@link ChairPositionAnalyzer}.
 */
public final class ChairPositionReport {
    private final List<SeatStatistics> seats;
    private final ChiSquareResult independence;

    ChairPositionReport(List<SeatStatistics> seats, ChiSquareResult independence) {
        this.seats = List.copyOf(seats);
        this.independence = independence;
    }

    /** One entry per seat, in seat order. */
    public List<SeatStatistics> getSeats() {
        return seats;
    }

    public Optional<SeatStatistics> seat(int seatNumber) {
        return seats.stream().filter(s -> s.getSeatNumber() == seatNumber).findFirst();
    }

    public ChiSquareResult getIndependence() {
        return independence;
    }

    /** True when the data gives no reason to think seat position affects winning. */
    public boolean isPositionIndependent() {
        return independence.isPassed();
    }

    @Override
    public String toString() {
        return "ChairPositionReport{seats=" + seats + ", independence=" + independence + '}';
    }

    public static final class SeatStatistics {
        private final int seatNumber;
        private final int wins;
        private final int losses;
        private final int pushes;
        private final ConfidenceInterval winRateInterval;
        private final double totalProfit;

        SeatStatistics(int seatNumber, int wins, int losses, int pushes, ConfidenceInterval winRateInterval,
                       double totalProfit) {
            this.seatNumber = seatNumber;
            this.wins = wins;
            this.losses = losses;
            this.pushes = pushes;
            this.winRateInterval = winRateInterval;
            this.totalProfit = totalProfit;
        }

        public int getSeatNumber() {
            return seatNumber;
        }

        public int getSessions() {
            return wins + losses + pushes;
        }

        public int getWins() {
            return wins;
        }

        public int getLosses() {
            return losses;
        }

        public int getPushes() {
            return pushes;
        }

        public double getWinRate() {
            return getSessions() == 0 ? 0.0 : wins / (double) getSessions();
        }

        public ConfidenceInterval getWinRateInterval() {
            return winRateInterval;
        }

        public double getTotalProfit() {
            return totalProfit;
        }

        /** Average profit per session at this seat. */
        public double getExpectedValue() {
            return getSessions() == 0 ? 0.0 : totalProfit / getSessions();
        }

        @Override
        public String toString() {
            return String.format("seat %d: %d/%d/%d win rate %.4f %s EV %.4f", seatNumber, wins, losses, pushes,
                    getWinRate(), winRateInterval, getExpectedValue());
        }
    }
}
