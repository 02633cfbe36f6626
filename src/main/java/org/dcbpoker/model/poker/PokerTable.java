package org.dcbpoker.model.poker;

import lombok.Data;

import java.time.Instant;
import java.util.*;

@Data
public class PokerTable {
    private Long id;
    private final TableConfig config;

    private TablePhase phase = TablePhase.WAITING;
    private final List<Seat> seats = new ArrayList<>();
    private Deck deck;
    private final List<Card> communityCards = new ArrayList<>();
    private long pot;
    private List<SidePot> sidePots = new ArrayList<>();
    private long currentBet;
    private long minRaise;

    private int dealerIndex = 0;
    private int currentPlayerIndex = -1;
    private int lastRaiserIndex = -1;
    private final Set<Integer> playersActedThisRound = new HashSet<>();

    private int handNumber = 0;
    private HandOutcome lastResult;

    // tenu par la couche service, jamais par le moteur
    private String hostId;
    private Instant createdAt = Instant.now();
    private Instant lastActiveAt = Instant.now();

    public PokerTable(TableConfig config) {
        this.config = config;
    }

    public int seatIndexOf(String playerId) {
        for (int i = 0; i < seats.size(); i++) {
            if (Objects.equals(seats.get(i).getPlayerId(), playerId)) return i;
        }
        return -1;
    }

    public Seat currentSeat() {
        if (currentPlayerIndex < 0 || currentPlayerIndex >= seats.size()) return null;
        return seats.get(currentPlayerIndex);
    }

    public long bigBlind() { return config.bigBlind(); }

    public long smallBlind() { return config.smallBlind(); }

    /** Chips on the table: every stack plus the pot. Constant within a hand. */
    public long chipsInPlay() {
        return seats.stream().mapToLong(Seat::getChips).sum() + pot;
    }
}
