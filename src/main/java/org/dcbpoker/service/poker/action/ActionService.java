package org.dcbpoker.service.poker.action;

import lombok.RequiredArgsConstructor;
import org.dcbpoker.model.poker.*;
import org.dcbpoker.service.poker.engine.HandEngine;
import org.springframework.stereotype.Service;

/**
 * Validates and applies one betting action. Every check happens before the first mutation, so
 * a rejected action leaves the table as it was.
 */
@Service
@RequiredArgsConstructor
public class ActionService {
    private final HandEngine hands;

    public EngineResult apply(PokerTable t, String playerId, String action, long amount) {
        return PlayerAction.fromTag(action)
                .map(a -> apply(t, playerId, a, amount))
                .orElseGet(() -> EngineResult.error(EngineError.UNKNOWN_ACTION));
    }

    public EngineResult apply(PokerTable t, String playerId, PlayerAction action, long amount) {
        int idx = t.seatIndexOf(playerId);
        if (idx < 0) return EngineResult.error(EngineError.NOT_SEATED);
        if (!t.getPhase().isBetting()) return EngineResult.error(EngineError.NO_ACTIVE_ROUND);
        if (t.getCurrentPlayerIndex() != idx) return EngineResult.error(EngineError.NOT_YOUR_TURN);
        Seat seat = t.getSeats().get(idx);
        if (!seat.canAct()) return EngineResult.error(EngineError.CANNOT_ACT);
        if (action == null) return EngineResult.error(EngineError.UNKNOWN_ACTION);

        long toCall = t.getCurrentBet() - seat.getBet();

        switch (action) {
            case FOLD -> {
                seat.setFolded(true);
                seat.setLastAction("Fold");
            }
            case CHECK -> {
                if (toCall > 0) return EngineResult.error(EngineError.MUST_CALL_OR_FOLD);
                seat.setLastAction("Check");
            }
            case CALL -> {
                if (toCall <= 0) return EngineResult.error(EngineError.NOTHING_TO_CALL);
                long paid = collect(t, seat, toCall);
                seat.setLastAction(seat.isAllIn() ? "All-In (Call)" : "Call " + paid);
            }
            case BET -> {
                if (t.getCurrentBet() > 0) return EngineResult.error(EngineError.BET_EXISTS);
                if (amount > seat.getChips()) return EngineResult.error(EngineError.NOT_ENOUGH_CHIPS);
                if (amount < Math.min(t.bigBlind(), seat.getChips())) return EngineResult.error(EngineError.BET_BELOW_MINIMUM);
                collect(t, seat, amount);
                t.setCurrentBet(seat.getBet());
                t.setMinRaise(Math.max(t.bigBlind(), amount));
                reopen(t, idx);
                seat.setLastAction(seat.isAllIn() ? "All-In " + amount : "Bet " + amount);
            }
            case RAISE -> {
                if (t.getCurrentBet() == 0) return EngineResult.error(EngineError.NO_BET_TO_RAISE);
                long minTotal = t.getCurrentBet() + t.getMinRaise();
                long stack = seat.getBet() + seat.getChips();
                if (stack < minTotal || amount >= stack) {
                    // ne couvre pas la relance mini (ou la dépasse) : tapis
                    pushAllIn(t, idx, seat);
                } else {
                    if (amount < minTotal) return EngineResult.error(EngineError.RAISE_BELOW_MINIMUM);
                    long previous = t.getCurrentBet();
                    collect(t, seat, amount - seat.getBet());
                    t.setMinRaise(Math.max(t.getMinRaise(), seat.getBet() - previous));
                    t.setCurrentBet(seat.getBet());
                    reopen(t, idx);
                    seat.setLastAction("Raise to " + seat.getBet());
                }
            }
            case ALLIN -> {
                if (seat.getChips() <= 0) return EngineResult.error(EngineError.NO_CHIPS);
                pushAllIn(t, idx, seat);
            }
        }

        t.getPlayersActedThisRound().add(idx);
        return hands.progress(t);
    }

    // tour expiré : fold face à une mise, check sinon
    public EngineResult forceTimeout(PokerTable t) {
        Seat seat = t.currentSeat();
        if (!t.getPhase().isBetting() || seat == null) return EngineResult.error(EngineError.NO_ACTIVE_ROUND);
        PlayerAction forced = t.getCurrentBet() - seat.getBet() > 0 ? PlayerAction.FOLD : PlayerAction.CHECK;
        EngineResult r = apply(t, seat.getPlayerId(), forced, 0);
        if (r.ok()) seat.setLastAction(seat.getLastAction() + " (timeout)");
        return r;
    }

    private long collect(PokerTable t, Seat seat, long amount) {
        long paid = seat.pay(amount);
        t.setPot(t.getPot() + paid);
        return paid;
    }

    private void pushAllIn(PokerTable t, int idx, Seat seat) {
        long paid = collect(t, seat, seat.getChips());
        if (seat.getBet() > t.getCurrentBet()) {
            t.setMinRaise(Math.max(t.getMinRaise(), seat.getBet() - t.getCurrentBet()));
            t.setCurrentBet(seat.getBet());
            reopen(t, idx);
        }
        seat.setLastAction("All-In " + paid);
    }

    private void reopen(PokerTable t, int idx) {
        t.setLastRaiserIndex(idx);
        t.getPlayersActedThisRound().clear();
        t.getPlayersActedThisRound().add(idx);
    }
}
