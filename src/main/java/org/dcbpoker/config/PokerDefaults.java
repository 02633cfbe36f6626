package org.dcbpoker.config;

import lombok.Getter;
import org.dcbpoker.model.poker.TableConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Table settings used when a create request leaves a field out. */
@Getter
@Component
public class PokerDefaults {
    private final int maxPlayers;
    private final long startingBank;
    private final long smallBlind;
    private final long bigBlind;
    private final int turnTimerSeconds;
    private final long idleTimeoutMs;

    public PokerDefaults(@Value("${poker.table.max-players:6}") int maxPlayers,
                         @Value("${poker.table.starting-bank:1000}") long startingBank,
                         @Value("${poker.table.small-blind:5}") long smallBlind,
                         @Value("${poker.table.big-blind:10}") long bigBlind,
                         @Value("${poker.table.turn-timer-seconds:30}") int turnTimerSeconds,
                         @Value("${poker.table.idle-timeout-ms:1800000}") long idleTimeoutMs) {
        this.maxPlayers = maxPlayers;
        this.startingBank = startingBank;
        this.smallBlind = smallBlind;
        this.bigBlind = bigBlind;
        this.turnTimerSeconds = turnTimerSeconds;
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public TableConfig toConfig() {
        return new TableConfig(maxPlayers, startingBank, smallBlind, bigBlind, turnTimerSeconds);
    }
}
