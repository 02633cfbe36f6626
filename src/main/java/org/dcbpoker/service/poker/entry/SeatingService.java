package org.dcbpoker.service.poker.entry;

import lombok.RequiredArgsConstructor;
import org.dcbpoker.model.poker.*;
import org.dcbpoker.model.poker.rules.BettingRules;
import org.dcbpoker.service.poker.engine.HandEngine;
import org.dcbpoker.service.poker.showdown.ShowdownService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class SeatingService {
    private final HandEngine hands;
    private final ShowdownService showdown;

    public EngineResult addPlayer(PokerTable t, String playerId, String displayName) {
        if (t.getPhase().isHandInProgress()) return EngineResult.error(EngineError.JOIN_MID_HAND);
        // sièges quittés pendant la main précédente : libres dès qu'elle est terminée
        List<Seat> present = t.getSeats().stream().filter(s -> !s.isSittingOut()).toList();
        if (present.size() >= t.getConfig().maxPlayers()) return EngineResult.error(EngineError.TABLE_FULL);
        if (present.stream().anyMatch(s -> Objects.equals(s.getPlayerId(), playerId)))
            return EngineResult.error(EngineError.ALREADY_SEATED);

        t.getSeats().removeIf(Seat::isSittingOut);
        if (t.getDealerIndex() >= t.getSeats().size()) t.setDealerIndex(0);

        String name = (displayName != null && !displayName.isBlank()) ? displayName : playerId;
        Seat seat = new Seat(playerId, name, t.getConfig().startingBank());
        t.getSeats().add(seat);
        return EngineResult.seated(seat);
    }

    /**
     * Between hands the seat is deleted. During a hand it is folded and flagged sitting out so
     * seat indices stay stable until the next deal.
     */
    public EngineResult removePlayer(PokerTable t, String playerId) {
        int idx = t.seatIndexOf(playerId);
        if (idx < 0) return EngineResult.error(EngineError.NOT_SEATED);

        if (!t.getPhase().isHandInProgress()) {
            t.getSeats().remove(idx);
            if (t.getDealerIndex() >= t.getSeats().size()) t.setDealerIndex(0);
            return EngineResult.ok(t.getPhase());
        }

        Seat seat = t.getSeats().get(idx);
        seat.setFolded(true);
        seat.setSittingOut(true);
        seat.setLastAction("Fold (left)");

        if (t.getCurrentPlayerIndex() == idx) {
            t.getPlayersActedThisRound().add(idx);
            return hands.progress(t);
        }
        List<Integer> live = BettingRules.liveSeats(t);
        if (live.size() == 1 && t.getPhase().isBetting()) return showdown.awardUncontested(t, live.get(0));
        return EngineResult.ok(t.getPhase());
    }
}
