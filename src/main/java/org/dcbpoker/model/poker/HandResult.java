package org.dcbpoker.model.poker;

import java.util.List;

/**
 * Best five-card hand found for a set of cards. Ordering compares the category first,
 * then the kickers from most to least significant.
 */
public record HandResult(HandRank rank, List<Integer> kickers, List<Card> cards) implements Comparable<HandResult> {

    public HandResult {
        kickers = List.copyOf(kickers);
        cards = List.copyOf(cards);
    }

    public String name() {
        return rank.getLabel();
    }

    @Override
    public int compareTo(HandResult o) {
        if (rank != o.rank) return Integer.compare(rank.score(), o.rank.score());
        int n = Math.min(kickers.size(), o.kickers.size());
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(kickers.get(i), o.kickers.get(i));
            if (c != 0) return c;
        }
        return 0;
    }
}
