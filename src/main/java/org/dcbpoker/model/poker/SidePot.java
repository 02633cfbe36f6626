package org.dcbpoker.model.poker;

import java.util.List;

/** One pot tier; {@code eligible} holds seat indices of non-folded seats that reached the tier. */
public record SidePot(long amount, List<Integer> eligible) {
    public SidePot {
        eligible = List.copyOf(eligible);
    }
}
