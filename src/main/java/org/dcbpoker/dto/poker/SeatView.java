package org.dcbpoker.dto.poker;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SeatView {
    private int index;
    private String playerId;
    private String displayName;
    private long chips;
    private long bet;
    private long totalBetThisHand;
    private boolean folded;
    private boolean allIn;
    private boolean sittingOut;
    private String lastAction;
    private List<String> holeCards; // vide si non visible
    private int cardCount;
    private boolean dealer;
}
