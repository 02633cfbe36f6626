package org.dcbpoker.model.poker.rules;

import org.dcbpoker.model.poker.PokerTable;
import org.dcbpoker.model.poker.Seat;
import org.dcbpoker.model.poker.TablePhase;

public final class DealingRules {
    private DealingRules(){}

    public record BlindSeats(int smallBlind, int bigBlind) {}

    /** Heads-up the dealer posts the small blind; otherwise the two seats after the dealer post. */
    public static BlindSeats blindSeats(PokerTable t) {
        int n = t.getSeats().size();
        int dealer = t.getDealerIndex();
        if (n == 2) return new BlindSeats(dealer, (dealer + 1) % n);
        return new BlindSeats((dealer + 1) % n, (dealer + 2) % n);
    }

    /** A short stack posts what it has and goes all-in. */
    public static void postBlind(PokerTable t, int seatIndex, long amount) {
        Seat seat = t.getSeats().get(seatIndex);
        long actual = seat.pay(amount);
        t.setPot(t.getPot() + actual);
        seat.setLastAction(actual == amount ? "blind" : "blind (all-in)");
    }

    /** One card to each seat in order, twice. */
    public static void dealHoleCards(PokerTable t) {
        for (int i = 0; i < 2; i++) {
            for (Seat s : t.getSeats()) s.getHoleCards().add(t.getDeck().deal());
        }
    }

    /** Burns one card then deals the next street; returns the phase the table moved to. */
    public static TablePhase dealNextStreet(PokerTable t) {
        int onBoard = t.getCommunityCards().size();
        t.getDeck().burn();
        if (onBoard == 0) {
            for (int i = 0; i < 3; i++) t.getCommunityCards().add(t.getDeck().deal());
            t.setPhase(TablePhase.FLOP);
        } else if (onBoard == 3) {
            t.getCommunityCards().add(t.getDeck().deal());
            t.setPhase(TablePhase.TURN);
        } else if (onBoard == 4) {
            t.getCommunityCards().add(t.getDeck().deal());
            t.setPhase(TablePhase.RIVER);
        } else {
            throw new IllegalStateException("Board déjà complet");
        }
        return t.getPhase();
    }
}
