package org.dcbpoker.model.poker;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    public int value() {
        return rank.getValue();
    }

    /** Accepts "10♥", "A♠", "Th", "10h", "qd" (rank then suit letter or symbol). */
    public static Card parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Carte vide");
        String s = text.trim();
        String rankPart = s.substring(0, s.length() - 1);
        String suitPart = s.substring(s.length() - 1);
        return new Card(Rank.fromSymbol(rankPart), Suit.fromSymbol(suitPart));
    }

    @Override
    @JsonValue
    public String toString() {
        return rank.getSymbol() + suit.getSymbol();
    }

    @Getter
    public enum Suit {
        SPADES("♠", 's'), HEARTS("♥", 'h'), DIAMONDS("♦", 'd'), CLUBS("♣", 'c');

        private final String symbol;
        private final char letter;

        Suit(String symbol, char letter) { this.symbol = symbol; this.letter = letter; }

        static Suit fromSymbol(String s) {
            for (Suit suit : values()) {
                if (suit.symbol.equals(s) || Character.toLowerCase(s.charAt(0)) == suit.letter) return suit;
            }
            throw new IllegalArgumentException("Couleur inconnue: " + s);
        }
    }

    @Getter
    public enum Rank {
        TWO("2", 2), THREE("3", 3), FOUR("4", 4), FIVE("5", 5), SIX("6", 6), SEVEN("7", 7), EIGHT("8", 8),
        NINE("9", 9), TEN("10", 10), JACK("J", 11), QUEEN("Q", 12), KING("K", 13), ACE("A", 14);

        private final String symbol;
        private final int value;

        Rank(String symbol, int value) { this.symbol = symbol; this.value = value; }

        static Rank fromSymbol(String s) {
            String up = s.toUpperCase();
            if (up.equals("T")) return TEN;
            for (Rank r : values()) if (r.symbol.equals(up)) return r;
            throw new IllegalArgumentException("Rang inconnu: " + s);
        }
    }
}
