package org.dcbpoker.service.poker.engine;

import lombok.RequiredArgsConstructor;
import org.dcbpoker.model.poker.*;
import org.dcbpoker.model.poker.rules.BettingRules;
import org.dcbpoker.model.poker.rules.HandRules;
import org.dcbpoker.service.poker.action.ActionService;
import org.dcbpoker.service.poker.entry.SeatingService;
import org.dcbpoker.service.poker.showdown.ShowdownService;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the rules engine. Synchronous and free of I/O: each call mutates the given
 * table and reports success or a structured error. Callers serialize calls per table.
 */
@Service
@RequiredArgsConstructor
public class PokerEngine {
    private final SeatingService seating;
    private final HandEngine hands;
    private final ActionService actions;

    public PokerTable createTable(TableConfig config) {
        return new PokerTable(config);
    }

    public EngineResult addPlayer(PokerTable t, String playerId, String displayName) {
        return seating.addPlayer(t, playerId, displayName);
    }

    public EngineResult removePlayer(PokerTable t, String playerId) {
        return seating.removePlayer(t, playerId);
    }

    public EngineResult startHand(PokerTable t) {
        return hands.startHand(t);
    }

    public EngineResult playerAction(PokerTable t, String playerId, String action, long amount) {
        return actions.apply(t, playerId, action, amount);
    }

    public EngineResult playerAction(PokerTable t, String playerId, PlayerAction action, long amount) {
        return actions.apply(t, playerId, action, amount);
    }

    public EngineResult forceTimeout(PokerTable t) {
        return actions.forceTimeout(t);
    }

    public List<PlayerAction> getValidActions(PokerTable t) {
        return BettingRules.validActions(t);
    }

    public HandResult evaluateHand(List<Card> cards) {
        return HandRules.evaluate(cards);
    }

    /** Wires an engine by hand, outside of a Spring context. */
    public static PokerEngine create(ShuffleSource shuffle) {
        ShowdownService showdown = new ShowdownService();
        HandEngine hands = new HandEngine(shuffle, showdown);
        return new PokerEngine(new SeatingService(hands, showdown), hands, new ActionService(hands));
    }
}
