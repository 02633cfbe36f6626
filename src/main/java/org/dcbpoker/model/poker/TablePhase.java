package org.dcbpoker.model.poker;

public enum TablePhase {
    WAITING, PREFLOP, FLOP, TURN, RIVER, SHOWDOWN, FINISHED;

    public boolean isBetting() {
        return this == PREFLOP || this == FLOP || this == TURN || this == RIVER;
    }

    /** Between hands a table is either WAITING (never dealt) or FINISHED. */
    public boolean isHandInProgress() {
        return this != WAITING && this != FINISHED;
    }
}
