package ai.letitride.engine;

/**
 * A seat's hand within a table round. Seats are numbered from 1.
 */
public final class SeatRoundResult {
    private final int seatNumber;
    private final GameHandResult hand;

    public SeatRoundResult(int seatNumber, GameHandResult hand) {
        this.seatNumber = seatNumber;
        this.hand = hand;
    }

    public int getSeatNumber() {
        return seatNumber;
    }

    public GameHandResult getHand() {
        return hand;
    }

    public double getNetResult() {
        return hand.getNetResult();
    }
}
