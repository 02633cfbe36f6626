package org.dcbpoker.service.poker.engine;

import lombok.RequiredArgsConstructor;
import org.dcbpoker.model.poker.*;
import org.dcbpoker.model.poker.rules.BettingRules;
import org.dcbpoker.model.poker.rules.DealingRules;
import org.dcbpoker.service.poker.showdown.ShowdownService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a hand from the deal to the end: blinds, hole cards, turn pointer, street changes
 * and the all-in run-out.
 */
@Service
@RequiredArgsConstructor
public class HandEngine {
    private final ShuffleSource shuffle;
    private final ShowdownService showdown;

    public EngineResult startHand(PokerTable t) {
        if (t.getPhase().isHandInProgress()) return EngineResult.error(EngineError.HAND_IN_PROGRESS);
        long funded = t.getSeats().stream().filter(s -> !s.isSittingOut() && s.getChips() > 0).count();
        if (funded < 2) return EngineResult.error(EngineError.NOT_ENOUGH_PLAYERS);

        // partis ou à sec : on libère le siège
        t.getSeats().removeIf(s -> s.isSittingOut() || s.getChips() <= 0);

        t.setHandNumber(t.getHandNumber() + 1);
        t.setPhase(TablePhase.PREFLOP);
        t.setDeck(Deck.shuffled(shuffle));
        t.getCommunityCards().clear();
        t.setPot(0);
        t.setSidePots(new ArrayList<>());
        t.setCurrentBet(0);
        t.setMinRaise(t.bigBlind());
        t.setLastResult(null);
        t.setLastRaiserIndex(-1);
        t.getPlayersActedThisRound().clear();
        for (Seat s : t.getSeats()) s.resetForNextHand();

        int n = t.getSeats().size();
        t.setDealerIndex(t.getDealerIndex() % n);

        DealingRules.BlindSeats blinds = DealingRules.blindSeats(t);
        DealingRules.postBlind(t, blinds.smallBlind(), t.smallBlind());
        DealingRules.postBlind(t, blinds.bigBlind(), t.bigBlind());
        t.setCurrentBet(t.bigBlind());
        t.setMinRaise(t.bigBlind());

        DealingRules.dealHoleCards(t);

        int first = n == 2 ? blinds.smallBlind() : (blinds.bigBlind() + 1) % n;
        t.setLastRaiserIndex(blinds.bigBlind());
        t.setCurrentPlayerIndex(t.getSeats().get(first).canAct() ? first : BettingRules.nextActor(t, first));

        if (t.getCurrentPlayerIndex() < 0 || BettingRules.isRoundComplete(t)) return advancePhase(t);
        return EngineResult.ok(t.getPhase());
    }

    public EngineResult progress(PokerTable t) {
        List<Integer> live = BettingRules.liveSeats(t);
        if (live.size() == 1) return showdown.awardUncontested(t, live.get(0));

        if (BettingRules.isRoundComplete(t)) return advancePhase(t);

        int next = BettingRules.nextActor(t, t.getCurrentPlayerIndex());
        if (next < 0) return runOut(t);
        t.setCurrentPlayerIndex(next);
        return EngineResult.ok(t.getPhase());
    }

    public EngineResult advancePhase(PokerTable t) {
        for (Seat s : t.getSeats()) s.setBet(0);
        t.setCurrentBet(0);
        t.setMinRaise(t.bigBlind());
        t.getPlayersActedThisRound().clear();
        t.setLastRaiserIndex(-1);
        t.setCurrentPlayerIndex(-1);

        if (t.getPhase() == TablePhase.RIVER) return showdown.resolve(t);
        if (BettingRules.countCanAct(t) <= 1) return runOut(t);

        DealingRules.dealNextStreet(t);
        t.setCurrentPlayerIndex(BettingRules.nextActor(t, t.getDealerIndex()));
        return EngineResult.ok(t.getPhase());
    }

    public EngineResult runOut(PokerTable t) {
        t.setCurrentPlayerIndex(-1);
        while (t.getCommunityCards().size() < 5) DealingRules.dealNextStreet(t);
        return showdown.resolve(t);
    }
}
