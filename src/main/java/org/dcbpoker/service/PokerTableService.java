package org.dcbpoker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dcbpoker.config.PokerDefaults;
import org.dcbpoker.dto.poker.CreateTableReq;
import org.dcbpoker.dto.poker.TableView;
import org.dcbpoker.model.poker.*;
import org.dcbpoker.service.poker.PokerRuleException;
import org.dcbpoker.service.poker.engine.PokerEngine;
import org.dcbpoker.service.poker.registry.TableRegistry;
import org.dcbpoker.service.poker.util.Locks;
import org.dcbpoker.service.poker.util.TableViews;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Registry-backed front of the engine. Every call on a table runs under that table's lock;
 * engine errors come back as {@link PokerRuleException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PokerTableService {

    private final PokerEngine engine;
    private final TableRegistry registry;
    private final Locks locks;
    private final TableViews views;
    private final PokerDefaults defaults;

    public PokerTable createTable(CreateTableReq req) {
        TableConfig d = defaults.toConfig();
        TableConfig config = new TableConfig(
                Optional.ofNullable(req.getMaxPlayers()).orElse(d.maxPlayers()),
                Optional.ofNullable(req.getStartingBank()).orElse(d.startingBank()),
                Optional.ofNullable(req.getSmallBlind()).orElse(d.smallBlind()),
                Optional.ofNullable(req.getBigBlind()).orElse(d.bigBlind()),
                Optional.ofNullable(req.getTurnTimerSeconds()).orElse(d.turnTimerSeconds()));

        PokerTable t = engine.createTable(config);
        t.setHostId(req.getHostId());
        registry.register(t);
        log.info("Table {} created by {} (blinds {}/{}, bank {}, max {})", t.getId(), req.getHostId(),
                config.smallBlind(), config.bigBlind(), config.startingBank(), config.maxPlayers());

        // l'hôte s'assoit d'office
        join(t.getId(), req.getHostId(), req.getHostName());
        return t;
    }

    public TableView view(Long tableId, String viewerId) {
        PokerTable t = registry.get(tableId);
        synchronized (locks.of(tableId)) {
            return views.view(t, viewerId);
        }
    }

    public Seat join(Long tableId, String playerId, String displayName) {
        EngineResult r = run(tableId, "join", t -> engine.addPlayer(t, playerId, displayName));
        log.info("Player {} joined table {}", playerId, tableId);
        return r.seat();
    }

    public EngineResult leave(Long tableId, String playerId) {
        EngineResult r = run(tableId, "leave", t -> engine.removePlayer(t, playerId));
        log.info("Player {} left table {}", playerId, tableId);
        return r;
    }

    public EngineResult startHand(Long tableId) {
        EngineResult r = run(tableId, "start", engine::startHand);
        PokerTable t = registry.get(tableId);
        log.info("Table {} hand #{} dealt ({} seats, dealer {})", tableId, t.getHandNumber(),
                t.getSeats().size(), t.getDealerIndex());
        return r;
    }

    public EngineResult act(Long tableId, String playerId, String action, long amount) {
        EngineResult r = run(tableId, action, t -> engine.playerAction(t, playerId, action, amount));
        log.debug("Table {}: {} -> {} {} (phase {})", tableId, playerId, action, amount, r.phase());
        return r;
    }

    /** Entry point for the external turn timer. */
    public EngineResult timeout(Long tableId) {
        EngineResult r = run(tableId, "timeout", engine::forceTimeout);
        log.debug("Table {}: turn timer expired, forced move applied", tableId);
        return r;
    }

    public List<String> validActions(Long tableId) {
        PokerTable t = registry.get(tableId);
        synchronized (locks.of(tableId)) {
            return engine.getValidActions(t).stream().map(PlayerAction::tag).toList();
        }
    }

    public HandResult evaluate(List<String> cards) {
        return engine.evaluateHand(cards.stream().map(Card::parse).toList());
    }

    /** Drops tables with no activity for longer than the configured idle timeout. */
    @Scheduled(fixedRate = 600_000)
    public void sweepIdleTables() {
        Instant now = Instant.now();
        List<Long> toRemove = new ArrayList<>();
        for (PokerTable t : registry.all()) {
            if (Duration.between(t.getLastActiveAt(), now).toMillis() > defaults.getIdleTimeoutMs()) {
                toRemove.add(t.getId());
            }
        }
        for (Long id : toRemove) {
            synchronized (locks.of(id)) {
                registry.remove(id);
            }
            log.info("Table {} removed after inactivity", id);
        }
    }

    private EngineResult run(Long tableId, String op, Function<PokerTable, EngineResult> call) {
        PokerTable t = registry.get(tableId);
        EngineResult r;
        synchronized (locks.of(tableId)) {
            r = call.apply(t);
            if (r.ok()) t.setLastActiveAt(Instant.now());
        }
        if (r.isError()) {
            log.warn("Table {}: {} rejected ({})", tableId, op, r.error());
            throw new PokerRuleException(r.error());
        }
        if (r.handEnded()) logOutcome(tableId, r.outcome());
        return r;
    }

    private void logOutcome(Long tableId, HandOutcome outcome) {
        for (HandOutcome.Winner w : outcome.winners()) {
            log.info("Table {}: {} wins {} with {}", tableId, w.displayName(), w.amount(), w.hand());
        }
    }
}
