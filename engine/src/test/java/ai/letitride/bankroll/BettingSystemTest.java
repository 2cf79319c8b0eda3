package ai.letitride.bankroll;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BettingSystemTest {

    private static BettingContext bankroll(double amount) {
        return new BettingContext(amount, 500, amount - 500, null, 0, 0);
    }

    @Test
    void flatBetIsCappedByBankroll() {
        FlatBetting flat = new FlatBetting(25);
        assertEquals(25, flat.nextBet(bankroll(500)));
        assertEquals(10, flat.nextBet(bankroll(10)));
        assertEquals(0, flat.nextBet(bankroll(0)));
        assertEquals(0, flat.nextBet(bankroll(-5)));
        assertThrows(IllegalArgumentException.class, () -> new FlatBetting(0));
    }

    @Test
    void martingaleDoublesAfterLossesAndResetsOnWin() {
        MartingaleBetting martingale = new MartingaleBetting(5, 2.0, 100, 3);
        assertEquals(5, martingale.nextBet(bankroll(500)));
        martingale.recordResult(-15);
        assertEquals(10, martingale.nextBet(bankroll(500)));
        martingale.recordResult(-30);
        assertEquals(20, martingale.nextBet(bankroll(500)));
        martingale.recordResult(0);
        assertEquals(20, martingale.nextBet(bankroll(500)));
        martingale.recordResult(-60);
        martingale.recordResult(-120);
        assertEquals(3, martingale.getProgressions());
        assertEquals(40, martingale.nextBet(bankroll(500)));
        assertEquals(30, martingale.nextBet(bankroll(30)));
        martingale.recordResult(40);
        assertEquals(5, martingale.nextBet(bankroll(500)));
    }

    @Test
    void martingaleRespectsTableMaximum() {
        MartingaleBetting martingale = new MartingaleBetting(10, 3.0, 50, 5);
        martingale.recordResult(-1);
        martingale.recordResult(-1);
        assertEquals(50, martingale.nextBet(bankroll(1000)));
        martingale.reset();
        assertEquals(10, martingale.nextBet(bankroll(1000)));
    }

    @Test
    void martingaleValidatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> new MartingaleBetting(5, 1.0, 100, 3));
        assertThrows(IllegalArgumentException.class, () -> new MartingaleBetting(5, 2.0, 100, 0));
        assertThrows(IllegalArgumentException.class, () -> new MartingaleBetting(0, 2.0, 100, 3));
    }

    @Test
    void reverseMartingaleBanksProfitAfterTheTargetStreak() {
        ReverseMartingaleBetting parlay = new ReverseMartingaleBetting(10, 2.0, 500, 3);
        assertEquals(10, parlay.nextBet(bankroll(1000)));
        parlay.recordResult(10);
        assertEquals(20, parlay.nextBet(bankroll(1000)));
        parlay.recordResult(20);
        assertEquals(40, parlay.nextBet(bankroll(1000)));
        parlay.recordResult(40);
        assertEquals(10, parlay.nextBet(bankroll(1000)));
        parlay.recordResult(10);
        parlay.recordResult(0);
        assertEquals(10, parlay.nextBet(bankroll(1000)));
    }

    @Test
    void reverseMartingaleRespectsTableMaximum() {
        ReverseMartingaleBetting parlay = new ReverseMartingaleBetting(100, 2.0, 150, 10);
        parlay.recordResult(100);
        assertEquals(150, parlay.nextBet(bankroll(10_000)));
        parlay.recordResult(-150);
        assertEquals(0, parlay.getWinStreak());
    }

    @Test
    void paroliResetsAfterLossOrCompletedRun() {
        ParoliBetting paroli = new ParoliBetting(10, 2.0, 500, 3);
        paroli.recordResult(10);
        paroli.recordResult(20);
        assertEquals(40, paroli.nextBet(bankroll(1000)));
        paroli.recordResult(0);
        assertEquals(40, paroli.nextBet(bankroll(1000)));
        paroli.recordResult(40);
        assertEquals(10, paroli.nextBet(bankroll(1000)));
        paroli.recordResult(10);
        paroli.recordResult(-20);
        assertEquals(10, paroli.nextBet(bankroll(1000)));
        assertThrows(IllegalArgumentException.class, () -> new ParoliBetting(10, 2.0, 500, 0));
    }

    @Test
    void dalembertMovesOneUnitWithinLimits() {
        DAlembertBetting dalembert = new DAlembertBetting(25, 5, 5, 35);
        assertEquals(25, dalembert.nextBet(bankroll(1000)));
        dalembert.recordResult(-25);
        dalembert.recordResult(-30);
        assertEquals(35, dalembert.nextBet(bankroll(1000)));
        dalembert.recordResult(-35);
        assertEquals(35, dalembert.nextBet(bankroll(1000)));
        dalembert.recordResult(0);
        assertEquals(35, dalembert.nextBet(bankroll(1000)));
        dalembert.recordResult(35);
        assertEquals(30, dalembert.nextBet(bankroll(1000)));
        assertEquals(12, dalembert.nextBet(bankroll(12)));
        for (int i = 0; i < 10; i++) {
            dalembert.recordResult(10);
        }
        assertEquals(5, dalembert.nextBet(bankroll(1000)));
        dalembert.reset();
        assertEquals(25, dalembert.nextBet(bankroll(1000)));
        assertThrows(IllegalArgumentException.class, () -> new DAlembertBetting(25, 5, 50, 10));
    }

    @Test
    void fibonacciAdvancesOnLossAndRegressesOnWin() {
        FibonacciBetting fibonacci = new FibonacciBetting(5, 500, 6, 2);
        List<Double> bets = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            bets.add(fibonacci.nextBet(bankroll(1000)));
            fibonacci.recordResult(-1);
        }
        assertEquals(List.of(5.0, 5.0, 10.0, 15.0, 25.0, 40.0), bets);
        assertEquals(6, fibonacci.getPosition());
        fibonacci.recordResult(-1);
        assertEquals(6, fibonacci.getPosition());
        fibonacci.recordResult(65);
        assertEquals(4, fibonacci.getPosition());
        assertEquals(25, fibonacci.nextBet(bankroll(1000)));
        fibonacci.recordResult(0);
        assertEquals(4, fibonacci.getPosition());
        fibonacci.recordResult(25);
        fibonacci.recordResult(10);
        fibonacci.recordResult(5);
        assertEquals(0, fibonacci.getPosition());
    }

    @Test
    void fibonacciRespectsTableMaximum() {
        FibonacciBetting fibonacci = new FibonacciBetting(100, 250, 10, 2);
        for (int i = 0; i < 3; i++) {
            fibonacci.recordResult(-100);
        }
        assertEquals(250, fibonacci.nextBet(bankroll(10_000)));
        assertEquals(0, fibonacci.nextBet(bankroll(0)));
    }

    @Test
    void factoryBuildsEveryNamedSystem() {
        BettingSystems systems = new BettingSystems();
        assertInstanceOf(FlatBetting.class, systems.create(null, 5));
        assertInstanceOf(MartingaleBetting.class, systems.create("martingale", 5));
        assertInstanceOf(ReverseMartingaleBetting.class, systems.create("Reverse-Martingale", 5));
        assertInstanceOf(ParoliBetting.class, systems.create("paroli", 5));
        assertInstanceOf(DAlembertBetting.class, systems.create("d_alembert", 5));
        assertInstanceOf(FibonacciBetting.class, systems.create("FIBONACCI", 5));
        assertThrows(IllegalArgumentException.class, () -> systems.create("proportional", 5));
    }
}
