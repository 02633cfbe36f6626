package org.dcbpoker.service.poker.showdown;

import org.dcbpoker.model.poker.*;
import org.dcbpoker.model.poker.rules.HandRules;
import org.dcbpoker.model.poker.rules.SidePotRules;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Ends a hand: awards the pot to the last seat standing, or evaluates every live seat and pays
 * each side pot to its best eligible hand(s).
 */
@Service
public class ShowdownService {

    public EngineResult resolve(PokerTable t) {
        t.setPhase(TablePhase.SHOWDOWN);
        t.setCurrentPlayerIndex(-1);

        List<Seat> seats = t.getSeats();
        Map<Integer, HandResult> hands = new HashMap<>();
        for (int i = 0; i < seats.size(); i++) {
            Seat s = seats.get(i);
            if (s.isFolded()) continue;
            List<Card> all = new ArrayList<>(s.getHoleCards());
            all.addAll(t.getCommunityCards());
            hands.put(i, HandRules.evaluate(all));
        }

        List<SidePot> pots = SidePotRules.partition(seats);
        t.setSidePots(pots);

        Map<String, HandOutcome.Winner> winners = new LinkedHashMap<>();
        for (SidePot pot : pots) {
            HandResult best = null;
            List<Integer> potWinners = new ArrayList<>();
            for (int idx : pot.eligible()) {
                HandResult h = hands.get(idx);
                if (h == null) continue;
                int cmp = best == null ? 1 : HandRules.compare(h, best);
                if (cmp > 0) {
                    best = h;
                    potWinners.clear();
                    potWinners.add(idx);
                } else if (cmp == 0) {
                    potWinners.add(idx);
                }
            }
            SidePotRules.split(pot.amount(), potWinners).forEach((idx, amount) -> {
                Seat s = seats.get(idx);
                s.setChips(s.getChips() + amount);
                winners.merge(s.getPlayerId(),
                        new HandOutcome.Winner(s.getPlayerId(), s.getDisplayName(), amount,
                                hands.get(idx).name(), List.copyOf(s.getHoleCards())),
                        (prev, next) -> prev.withExtra(next.amount()));
            });
        }

        List<HandOutcome.ShowdownEntry> showdown = new ArrayList<>();
        hands.keySet().stream().sorted().forEach(idx -> {
            Seat s = seats.get(idx);
            showdown.add(new HandOutcome.ShowdownEntry(s.getPlayerId(), s.getDisplayName(),
                    hands.get(idx).name(), List.copyOf(s.getHoleCards())));
        });

        HandOutcome outcome = new HandOutcome(new ArrayList<>(winners.values()), showdown);
        finish(t, outcome);
        return EngineResult.ok(TablePhase.SHOWDOWN, outcome);
    }

    /** Everybody else folded: the whole pot goes to {@code winnerIndex}, no cards are shown. */
    public EngineResult awardUncontested(PokerTable t, int winnerIndex) {
        Seat w = t.getSeats().get(winnerIndex);
        long amount = t.getPot();
        w.setChips(w.getChips() + amount);
        HandOutcome outcome = new HandOutcome(List.of(new HandOutcome.Winner(w.getPlayerId(), w.getDisplayName(),
                amount, HandOutcome.EVERYONE_FOLDED, List.of())), null);
        t.setCurrentPlayerIndex(-1);
        finish(t, outcome);
        return EngineResult.ok(TablePhase.FINISHED, outcome);
    }

    private void finish(PokerTable t, HandOutcome outcome) {
        t.setPot(0);
        for (Seat s : t.getSeats()) s.setBet(0);
        t.setCurrentBet(0);
        t.getPlayersActedThisRound().clear();
        t.setLastResult(outcome);
        t.setPhase(TablePhase.FINISHED);
        // bouton pour la main suivante
        t.setDealerIndex((t.getDealerIndex() + 1) % t.getSeats().size());
    }
}
