package org.dcbpoker.model.poker;

import java.util.*;

/** 52 cards for one hand, dealt from the end of the list. */
public class Deck {
    private final List<Card> cards;

    private Deck(List<Card> cards) {
        this.cards = cards;
    }

    /** Canonical order: suits ♠ ♥ ♦ ♣, ranks 2 to A inside each suit. */
    public static List<Card> createDeck() {
        List<Card> tmp = new ArrayList<>(52);
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
        }
        return tmp;
    }

    /** Fisher-Yates over a copy; the input list is left untouched. */
    public static List<Card> shuffleDeck(List<Card> deck, ShuffleSource source) {
        List<Card> d = new ArrayList<>(deck);
        for (int i = d.size() - 1; i > 0; i--) {
            int j = source.nextInt(i + 1);
            Collections.swap(d, i, j);
        }
        return d;
    }

    public static Deck shuffled(ShuffleSource source) {
        return new Deck(shuffleDeck(createDeck(), source));
    }

    public Card deal() {
        if (cards.isEmpty()) throw new IllegalStateException("Deck vide");
        return cards.remove(cards.size() - 1);
    }

    public void burn() {
        deal();
    }

    public int remaining() {
        return cards.size();
    }
}
