package org.dcbpoker.model.poker;

import java.util.List;

/**
 * Result of a finished hand. {@code showdown} is null when the hand ended because everybody else folded.
 */
public record HandOutcome(List<Winner> winners, List<ShowdownEntry> showdown) {

    public static final String EVERYONE_FOLDED = "Everyone folded";

    public record Winner(String playerId, String displayName, long amount, String hand, List<Card> cards) {
        public Winner withExtra(long extra) {
            return new Winner(playerId, displayName, amount + extra, hand, cards);
        }
    }

    public record ShowdownEntry(String playerId, String displayName, String hand, List<Card> holeCards) {}

    public long totalAwarded() {
        return winners.stream().mapToLong(Winner::amount).sum();
    }
}
