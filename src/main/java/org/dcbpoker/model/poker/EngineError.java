package org.dcbpoker.model.poker;

import lombok.Getter;

@Getter
public enum EngineError {
    // tour
    NOT_SEATED(Category.TURN, "not seated at this table"),
    NOT_YOUR_TURN(Category.TURN, "not your turn"),
    NO_ACTIVE_ROUND(Category.TURN, "no active betting round"),
    CANNOT_ACT(Category.TURN, "seat cannot act"),

    // montants
    MUST_CALL_OR_FOLD(Category.SIZING, "cannot check facing a bet: call, raise or fold"),
    NOTHING_TO_CALL(Category.SIZING, "nothing to call, check instead"),
    BET_EXISTS(Category.SIZING, "there is already a bet, use raise"),
    NO_BET_TO_RAISE(Category.SIZING, "no bet to raise, use bet"),
    BET_BELOW_MINIMUM(Category.SIZING, "bet below the big blind"),
    RAISE_BELOW_MINIMUM(Category.SIZING, "raise below the minimum raise"),
    NOT_ENOUGH_CHIPS(Category.SIZING, "not enough chips"),
    NO_CHIPS(Category.SIZING, "no chips left"),
    UNKNOWN_ACTION(Category.SIZING, "unknown action"),

    // cycle de vie
    TABLE_FULL(Category.LIFECYCLE, "table full"),
    ALREADY_SEATED(Category.LIFECYCLE, "already seated"),
    JOIN_MID_HAND(Category.LIFECYCLE, "cannot join mid-hand"),
    HAND_IN_PROGRESS(Category.LIFECYCLE, "a hand is already in progress"),
    NOT_ENOUGH_PLAYERS(Category.LIFECYCLE, "need at least 2 players with chips to start");

    private final Category category;
    private final String message;

    EngineError(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public enum Category { TURN, SIZING, LIFECYCLE }
}
