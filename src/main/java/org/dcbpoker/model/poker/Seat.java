package org.dcbpoker.model.poker;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Seat {
    private String playerId;
    private String displayName;
    private long chips;
    private final List<Card> holeCards = new ArrayList<>();
    private long bet;               // mis sur le tour d'enchères courant
    private long totalBetThisHand;  // cumul sur la main
    private boolean folded;
    private boolean allIn;
    private String lastAction;
    private boolean sittingOut;

    public Seat(String playerId, String displayName, long chips) {
        this.playerId = playerId;
        this.displayName = displayName;
        this.chips = chips;
    }

    public boolean canAct() {
        return !folded && !allIn;
    }

    /** Moves chips from the stack into this round's wager; flags all-in when the stack is empty. */
    public long pay(long amount) {
        long actual = Math.min(amount, chips);
        chips -= actual;
        bet += actual;
        totalBetThisHand += actual;
        if (chips == 0) allIn = true;
        return actual;
    }

    public void resetForNextHand() {
        holeCards.clear();
        bet = 0;
        totalBetThisHand = 0;
        folded = false;
        allIn = false;
        lastAction = null;
    }
}
