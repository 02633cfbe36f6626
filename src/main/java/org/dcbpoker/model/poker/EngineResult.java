package org.dcbpoker.model.poker;

/**
 * Success or failure of an engine operation. On failure only {@code error} is set and the
 * table was left untouched.
 */
public record EngineResult(boolean ok, EngineError error, TablePhase phase, Seat seat, HandOutcome outcome) {

    public static EngineResult ok(TablePhase phase) {
        return new EngineResult(true, null, phase, null, null);
    }

    public static EngineResult ok(TablePhase phase, HandOutcome outcome) {
        return new EngineResult(true, null, phase, null, outcome);
    }

    public static EngineResult seated(Seat seat) {
        return new EngineResult(true, null, null, seat, null);
    }

    public static EngineResult error(EngineError error) {
        return new EngineResult(false, error, null, null, null);
    }

    public boolean isError() {
        return !ok;
    }

    public boolean handEnded() {
        return outcome != null;
    }
}
