package ai.letitride.game;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CardTest {

    @Test
    void textFormRoundTripsForEveryCard() {
        for (Card card : Card.canonicalOrder()) {
            assertSame(card, Card.parse(card.shortName()));
        }
        assertEquals("Ah", Card.of(Rank.ACE, Suit.HEARTS).toString());
        assertEquals("Tc", Card.of(Rank.TEN, Suit.CLUBS).toString());
    }

    @Test
    void parseAllAndFormat() {
        List<Card> cards = Card.parseAll("Ah Kd  Qs");
        assertEquals(List.of(Card.of(Rank.ACE, Suit.HEARTS), Card.of(Rank.KING, Suit.DIAMONDS),
                Card.of(Rank.QUEEN, Suit.SPADES)), cards);
        assertEquals("Ah Kd Qs", Card.format(cards));
        assertTrue(Card.parseAll(" ").isEmpty());
    }

    @Test
    void parseRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Card.parse("1h"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("Ax"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("10h"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse(null));
    }

    @Test
    void orderingIsByRankOnly() {
        Card aceHearts = Card.parse("Ah");
        Card aceSpades = Card.parse("As");
        assertEquals(0, Card.BY_RANK.compare(aceHearts, aceSpades));
        assertNotEquals(aceHearts, aceSpades);
        assertTrue(Card.BY_RANK.compare(Card.parse("Kc"), aceSpades) < 0);
    }

    @Test
    void aceLowComparisonOnlyMovesTheAce() {
        assertTrue(Rank.compareAceLow(Rank.ACE, Rank.TWO) < 0);
        assertTrue(Rank.compareAceLow(Rank.KING, Rank.QUEEN) > 0);
        assertEquals(1, Rank.ACE.getLowValue());
        assertEquals(14, Rank.ACE.getValue());
    }
}
