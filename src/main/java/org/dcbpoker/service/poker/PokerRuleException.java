package org.dcbpoker.service.poker;

import lombok.Getter;
import org.dcbpoker.model.poker.EngineError;

/** An engine error surfaced by the service layer. The table was not modified. */
@Getter
public class PokerRuleException extends IllegalStateException {
    private final EngineError error;

    public PokerRuleException(EngineError error) {
        super(error.getMessage());
        this.error = error;
    }
}
