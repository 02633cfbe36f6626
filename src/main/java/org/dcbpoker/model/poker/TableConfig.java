package org.dcbpoker.model.poker;

/**
 * Table settings fixed at creation. {@code maxPlayers} is clamped into 2..8.
 * {@code turnTimerSeconds} is only read by whoever schedules forced moves.
 */
public record TableConfig(int maxPlayers, long startingBank, long smallBlind, long bigBlind, int turnTimerSeconds) {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 8;

    public TableConfig {
        maxPlayers = Math.min(Math.max(maxPlayers, MIN_PLAYERS), MAX_PLAYERS);
        if (startingBank <= 0) throw new IllegalArgumentException("startingBank doit être > 0");
        if (smallBlind <= 0 || bigBlind <= 0) throw new IllegalArgumentException("Les blinds doivent être > 0");
        if (smallBlind > bigBlind) throw new IllegalArgumentException("La small blind dépasse la big blind");
    }
}
