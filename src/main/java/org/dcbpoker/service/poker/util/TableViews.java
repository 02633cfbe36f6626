package org.dcbpoker.service.poker.util;

import org.dcbpoker.dto.poker.SeatView;
import org.dcbpoker.dto.poker.TableView;
import org.dcbpoker.model.poker.*;
import org.dcbpoker.model.poker.rules.BettingRules;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class TableViews {

    public TableView view(PokerTable t, String viewerId) {
        Set<String> shown = new HashSet<>();
        HandOutcome last = t.getLastResult();
        if (t.getPhase() == TablePhase.FINISHED && last != null && last.showdown() != null) {
            last.showdown().forEach(e -> shown.add(e.playerId()));
        }

        List<SeatView> seats = new ArrayList<>();
        for (int i = 0; i < t.getSeats().size(); i++) {
            Seat s = t.getSeats().get(i);
            boolean visible = Objects.equals(s.getPlayerId(), viewerId) || shown.contains(s.getPlayerId());
            seats.add(SeatView.builder()
                    .index(i)
                    .playerId(s.getPlayerId())
                    .displayName(s.getDisplayName())
                    .chips(s.getChips())
                    .bet(s.getBet())
                    .totalBetThisHand(s.getTotalBetThisHand())
                    .folded(s.isFolded())
                    .allIn(s.isAllIn())
                    .sittingOut(s.isSittingOut())
                    .lastAction(s.getLastAction())
                    .holeCards(visible ? cards(s.getHoleCards()) : List.of())
                    .cardCount(s.getHoleCards().size())
                    .dealer(i == t.getDealerIndex())
                    .build());
        }

        Seat current = t.currentSeat();
        boolean viewerToAct = current != null && Objects.equals(current.getPlayerId(), viewerId);
        return TableView.builder()
                .id(t.getId())
                .hostId(t.getHostId())
                .phase(t.getPhase().name().toLowerCase())
                .handNumber(t.getHandNumber())
                .maxPlayers(t.getConfig().maxPlayers())
                .smallBlind(t.smallBlind())
                .bigBlind(t.bigBlind())
                .turnTimerSeconds(t.getConfig().turnTimerSeconds())
                .pot(t.getPot())
                .currentBet(t.getCurrentBet())
                .minRaise(t.getMinRaise())
                .dealerIndex(t.getDealerIndex())
                .currentPlayerIndex(t.getCurrentPlayerIndex())
                .communityCards(cards(t.getCommunityCards()))
                .seats(seats)
                .validActions(viewerToAct ? BettingRules.validActions(t).stream().map(PlayerAction::tag).toList() : List.of())
                .lastResult(last)
                .build();
    }

    private List<String> cards(List<Card> cards) {
        return cards.stream().map(Card::toString).toList();
    }
}
