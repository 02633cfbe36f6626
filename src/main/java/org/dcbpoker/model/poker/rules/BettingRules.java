package org.dcbpoker.model.poker.rules;

import org.dcbpoker.model.poker.PlayerAction;
import org.dcbpoker.model.poker.PokerTable;
import org.dcbpoker.model.poker.Seat;

import java.util.ArrayList;
import java.util.List;

public final class BettingRules {
    private BettingRules(){}

    /**
     * Complete when every seat still able to act has acted this round and matched the current bet,
     * or when no seat is able to act.
     */
    public static boolean isRoundComplete(PokerTable t) {
        for (int i = 0; i < t.getSeats().size(); i++) {
            Seat s = t.getSeats().get(i);
            if (!s.canAct()) continue;
            if (!t.getPlayersActedThisRound().contains(i)) return false;
            if (s.getBet() < t.getCurrentBet()) return false;
        }
        return true;
    }

    /** Next seat after {@code from} that can act, wrapping; {@code from} itself is tried last. -1 if none. */
    public static int nextActor(PokerTable t, int from) {
        int n = t.getSeats().size();
        if (n == 0) return -1;
        int start = Math.max(from, -1);
        for (int k = 1; k <= n; k++) {
            int i = Math.floorMod(start + k, n);
            if (t.getSeats().get(i).canAct()) return i;
        }
        return -1;
    }

    public static int countCanAct(PokerTable t) {
        return (int) t.getSeats().stream().filter(Seat::canAct).count();
    }

    public static List<Integer> liveSeats(PokerTable t) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < t.getSeats().size(); i++) {
            if (!t.getSeats().get(i).isFolded()) out.add(i);
        }
        return out;
    }

    /** Actions the current actor may take. Empty when nobody is to act. */
    public static List<PlayerAction> validActions(PokerTable t) {
        if (!t.getPhase().isBetting()) return List.of();
        Seat seat = t.currentSeat();
        if (seat == null || !seat.canAct()) return List.of();

        long toCall = t.getCurrentBet() - seat.getBet();
        List<PlayerAction> actions = new ArrayList<>();
        actions.add(PlayerAction.FOLD);
        if (toCall <= 0) {
            actions.add(PlayerAction.CHECK);
            if (seat.getChips() > 0) actions.add(t.getCurrentBet() == 0 ? PlayerAction.BET : PlayerAction.RAISE);
        } else {
            actions.add(PlayerAction.CALL); // all-in si le tapis ne couvre pas
            if (seat.getChips() > toCall) actions.add(PlayerAction.RAISE);
        }
        if (seat.getChips() > 0) actions.add(PlayerAction.ALLIN);
        return actions;
    }
}
