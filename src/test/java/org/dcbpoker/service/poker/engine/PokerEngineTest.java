package org.dcbpoker.service.poker.engine;

import org.dcbpoker.model.poker.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Full hands played against an unshuffled deck: cards come off the end of the canonical order,
 * so A♣ K♣ Q♣ J♣ 10♣ ... are dealt first.
 */
class PokerEngineTest {

    PokerEngine engine;
    PokerTable table;

    @BeforeEach
    void setup() {
        engine = PokerEngine.create(bound -> bound - 1);
        table = engine.createTable(new TableConfig(6, 1000, 5, 10, 30));
    }

    private void seat(String... ids) {
        for (String id : ids) assertThat(engine.addPlayer(table, id, null).ok()).isTrue();
    }

    private EngineResult act(String id, String action, long amount) {
        EngineResult r = engine.playerAction(table, id, action, amount);
        assertThat(r.ok()).as("%s %s -> %s", id, action, r.error()).isTrue();
        return r;
    }

    private Seat seatOf(String id) {
        return table.getSeats().get(table.seatIndexOf(id));
    }

    // -------------------------------------------------------------------------
    // startHand()
    // -------------------------------------------------------------------------
    @Test
    void startHand_headsUp_leDealerPostePetiteBlindeEtParleEnPremier() {
        seat("a", "b");

        EngineResult r = engine.startHand(table);

        assertThat(r.ok()).isTrue();
        assertThat(r.phase()).isEqualTo(TablePhase.PREFLOP);
        assertThat(seatOf("a").getChips()).isEqualTo(995);
        assertThat(seatOf("b").getChips()).isEqualTo(990);
        assertThat(table.getPot()).isEqualTo(15);
        assertThat(table.getCurrentBet()).isEqualTo(10);
        assertThat(table.getCurrentPlayerIndex()).isZero();
        assertThat(seatOf("a").getHoleCards()).extracting(Card::toString).containsExactly("A♣", "Q♣");
        assertThat(seatOf("b").getHoleCards()).extracting(Card::toString).containsExactly("K♣", "J♣");
        assertThat(table.getDeck().remaining()).isEqualTo(48);
        assertThat(table.getHandNumber()).isEqualTo(1);
    }

    @Test
    void startHand_troisJoueurs_premierAParlerApresLaGrosseBlinde() {
        seat("x", "y", "z");

        engine.startHand(table);

        assertThat(seatOf("y").getBet()).isEqualTo(5);
        assertThat(seatOf("z").getBet()).isEqualTo(10);
        assertThat(seatOf("y").getLastAction()).isEqualTo("blind");
        assertThat(table.getCurrentPlayerIndex()).isZero();
        assertThat(table.getLastRaiserIndex()).isEqualTo(2);
    }

    @Test
    void startHand_refuseSansDeuxJoueursOuPendantUneMain() {
        seat("a");
        assertThat(engine.startHand(table).error()).isEqualTo(EngineError.NOT_ENOUGH_PLAYERS);
        assertThat(table.getPhase()).isEqualTo(TablePhase.WAITING);

        seat("b");
        engine.startHand(table);
        assertThat(engine.startHand(table).error()).isEqualTo(EngineError.HAND_IN_PROGRESS);
        assertThat(table.getHandNumber()).isEqualTo(1);
    }

    @Test
    void startHand_blindesAllInHeadsUp_deroulentLeBoardJusquauShowdown() {
        seat("a", "b");
        seatOf("a").setChips(5);
        seatOf("b").setChips(10);

        EngineResult r = engine.startHand(table);

        assertThat(r.ok()).isTrue();
        assertThat(r.phase()).isEqualTo(TablePhase.SHOWDOWN);
        assertThat(table.getPhase()).isEqualTo(TablePhase.FINISHED);
        assertThat(table.getCommunityCards()).hasSize(5);
        // a gagne la couleur à l'as sur le pot commun, b récupère son excédent
        assertThat(seatOf("a").getChips()).isEqualTo(10);
        assertThat(seatOf("b").getChips()).isEqualTo(5);
        assertThat(r.outcome().totalAwarded()).isEqualTo(15);
    }

    // -------------------------------------------------------------------------
    // Main complète
    // -------------------------------------------------------------------------
    @Test
    void mainHeadsUp_jusquauShowdown_couleurAlAsGagne() {
        seat("a", "b");
        engine.startHand(table);

        assertThat(engine.getValidActions(table))
                .containsExactly(PlayerAction.FOLD, PlayerAction.CALL, PlayerAction.RAISE, PlayerAction.ALLIN);
        act("a", "call", 0);
        assertThat(engine.getValidActions(table))
                .containsExactly(PlayerAction.FOLD, PlayerAction.CHECK, PlayerAction.RAISE, PlayerAction.ALLIN);
        act("b", "check", 0);

        assertThat(table.getPhase()).isEqualTo(TablePhase.FLOP);
        assertThat(table.getCommunityCards()).extracting(Card::toString).containsExactly("9♣", "8♣", "7♣");
        // après le flop, la grosse blinde parle en premier en heads-up
        assertThat(table.getCurrentPlayerIndex()).isEqualTo(1);
        assertThat(engine.getValidActions(table)).contains(PlayerAction.BET).doesNotContain(PlayerAction.RAISE);

        act("b", "check", 0);
        act("a", "check", 0);
        assertThat(table.getPhase()).isEqualTo(TablePhase.TURN);
        act("b", "check", 0);
        act("a", "check", 0);
        assertThat(table.getPhase()).isEqualTo(TablePhase.RIVER);
        act("b", "check", 0);
        EngineResult r = act("a", "check", 0);

        assertThat(r.phase()).isEqualTo(TablePhase.SHOWDOWN);
        assertThat(table.getPhase()).isEqualTo(TablePhase.FINISHED);
        assertThat(r.outcome().winners()).singleElement().satisfies(w -> {
            assertThat(w.playerId()).isEqualTo("a");
            assertThat(w.amount()).isEqualTo(20);
            assertThat(w.hand()).isEqualTo("Flush");
        });
        assertThat(r.outcome().showdown()).hasSize(2);
        assertThat(seatOf("a").getChips()).isEqualTo(1010);
        assertThat(seatOf("b").getChips()).isEqualTo(990);
        assertThat(table.getPot()).isZero();
        assertThat(table.getDealerIndex()).isEqualTo(1);
        assertThat(engine.getValidActions(table)).isEmpty();
    }

    @Test
    void tourDeMise_seFermeQuandToutLeMondeASuivi() {
        seat("x", "y", "z");
        engine.startHand(table);

        act("x", "call", 0);
        act("y", "call", 0);
        act("z", "check", 0);

        assertThat(table.getPhase()).isEqualTo(TablePhase.FLOP);
        assertThat(table.getCurrentPlayerIndex()).isEqualTo(1);
        assertThat(table.getPot()).isEqualTo(30);

        act("y", "bet", 10);
        act("z", "call", 0);
        act("x", "fold", 0);

        assertThat(table.getPhase()).isEqualTo(TablePhase.TURN);
        assertThat(table.getCommunityCards()).hasSize(4);
        assertThat(table.getPot()).isEqualTo(50);
        assertThat(table.getCurrentBet()).isZero();
        assertThat(table.getSeats()).allSatisfy(s -> assertThat(s.getBet()).isZero());
    }

    @Test
    void toutLeMondeSeCouche_laGrosseBlindeRemporteLePot() {
        seat("x", "y", "z");
        engine.startHand(table);

        act("x", "fold", 0);
        EngineResult r = act("y", "fold", 0);

        assertThat(r.phase()).isEqualTo(TablePhase.FINISHED);
        assertThat(r.outcome().showdown()).isNull();
        assertThat(r.outcome().winners()).singleElement().satisfies(w -> {
            assertThat(w.playerId()).isEqualTo("z");
            assertThat(w.amount()).isEqualTo(15);
            assertThat(w.hand()).isEqualTo(HandOutcome.EVERYONE_FOLDED);
        });
        assertThat(seatOf("z").getChips()).isEqualTo(1005);
        assertThat(table.getCommunityCards()).isEmpty();
        assertThat(table.getDealerIndex()).isEqualTo(1);
    }

    @Test
    void allInCourt_neRouvrePasLesEncheres() {
        seat("x", "y", "z");
        seatOf("y").setChips(10);
        engine.startHand(table);

        act("x", "raise", 20);
        act("y", "raise", 40);

        assertThat(seatOf("y").isAllIn()).isTrue();
        assertThat(seatOf("y").getBet()).isEqualTo(10);
        assertThat(table.getCurrentBet()).isEqualTo(20);
        assertThat(table.getMinRaise()).isEqualTo(10);
        assertThat(table.getCurrentPlayerIndex()).isEqualTo(2);

        act("z", "call", 0);

        // x n'a pas à reparler : l'all-in de y n'a pas relancé
        assertThat(table.getPhase()).isEqualTo(TablePhase.FLOP);
        assertThat(table.getPot()).isEqualTo(50);
    }

    @Test
    void allInMultiples_sidePotsEtConservationDesJetons() {
        seat("x", "y", "z");
        seatOf("x").setChips(150);
        seatOf("y").setChips(50);
        seatOf("z").setChips(100);
        engine.startHand(table);
        long before = table.chipsInPlay();

        act("x", "allin", 0);
        act("y", "call", 0);
        assertThat(seatOf("y").getLastAction()).isEqualTo("All-In (Call)");
        EngineResult r = act("z", "call", 0);

        assertThat(r.phase()).isEqualTo(TablePhase.SHOWDOWN);
        assertThat(table.getCommunityCards()).hasSize(5);
        assertThat(table.getSidePots()).containsExactly(
                new SidePot(150, List.of(0, 1, 2)),
                new SidePot(100, List.of(0, 2)),
                new SidePot(50, List.of(0)));
        assertThat(r.outcome().winners()).singleElement().satisfies(w -> {
            assertThat(w.playerId()).isEqualTo("x");
            assertThat(w.amount()).isEqualTo(300);
        });
        assertThat(table.chipsInPlay()).isEqualTo(before);

        // y et z sont à sec : plus de main possible
        assertThat(engine.startHand(table).error()).isEqualTo(EngineError.NOT_ENOUGH_PLAYERS);
    }

    @Test
    void mainSuivante_leBoutonTourneEtLesSiegesSontReinitialises() {
        seat("x", "y", "z");
        engine.startHand(table);
        act("x", "fold", 0);
        act("y", "fold", 0);

        EngineResult r = engine.startHand(table);

        assertThat(r.ok()).isTrue();
        assertThat(table.getDealerIndex()).isEqualTo(1);
        assertThat(seatOf("z").getBet()).isEqualTo(5);
        assertThat(seatOf("x").getBet()).isEqualTo(10);
        assertThat(seatOf("x").isFolded()).isFalse();
        assertThat(table.getCurrentPlayerIndex()).isEqualTo(1);
        assertThat(table.getHandNumber()).isEqualTo(2);
    }

    // -------------------------------------------------------------------------
    // evaluateHand()
    // -------------------------------------------------------------------------
    @Test
    void evaluateHand_delegueAuxReglesDeMain() {
        HandResult r = engine.evaluateHand(List.of(
                Card.parse("As"), Card.parse("Ks"), Card.parse("Qs"), Card.parse("Js"), Card.parse("Ts")));

        assertThat(r.rank()).isEqualTo(HandRank.ROYAL_FLUSH);
        assertThat(r.name()).isEqualTo("Royal Flush");
    }
}
