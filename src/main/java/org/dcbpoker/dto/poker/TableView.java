package org.dcbpoker.dto.poker;

import lombok.Builder;
import lombok.Data;
import org.dcbpoker.model.poker.HandOutcome;

import java.util.List;

@Data
@Builder
public class TableView {
    private Long id;
    private String hostId;
    private String phase;
    private int handNumber;
    private int maxPlayers;
    private long smallBlind;
    private long bigBlind;
    private int turnTimerSeconds;
    private long pot;
    private long currentBet;
    private long minRaise;
    private int dealerIndex;
    private int currentPlayerIndex;
    private List<String> communityCards;
    private List<SeatView> seats;
    private List<String> validActions;
    private HandOutcome lastResult;
}
