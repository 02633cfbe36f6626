package org.dcbpoker.model.poker.rules;

import org.dcbpoker.model.poker.Seat;
import org.dcbpoker.model.poker.SidePot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SidePotRulesTest {

    private static Seat seat(String id, long total, boolean folded, boolean allIn) {
        Seat s = new Seat(id, id, 0);
        s.setTotalBetThisHand(total);
        s.setFolded(folded);
        s.setAllIn(allIn);
        return s;
    }

    @Test
    void partition_troisTapisDifferents() {
        List<Seat> seats = List.of(
                seat("a", 50, false, true),
                seat("b", 100, false, true),
                seat("c", 150, false, false));

        List<SidePot> pots = SidePotRules.partition(seats);

        assertThat(pots).containsExactly(
                new SidePot(150, List.of(0, 1, 2)),
                new SidePot(100, List.of(1, 2)),
                new SidePot(50, List.of(2)));
        assertThat(pots.stream().mapToLong(SidePot::amount).sum()).isEqualTo(300);
    }

    @Test
    void partition_laMiseDUnJoueurCoucheResteDansLesPots() {
        List<Seat> seats = List.of(
                seat("a", 100, true, false),
                seat("b", 50, false, true),
                seat("c", 100, false, false));

        List<SidePot> pots = SidePotRules.partition(seats);

        assertThat(pots).containsExactly(
                new SidePot(150, List.of(1, 2)),
                new SidePot(100, List.of(2)));
    }

    @Test
    void partition_palierSansAyantDroit_fusionneAvecLePrecedent() {
        List<Seat> seats = List.of(
                seat("a", 100, true, false),
                seat("b", 60, false, true),
                seat("c", 60, false, true));

        List<SidePot> pots = SidePotRules.partition(seats);

        assertThat(pots).containsExactly(new SidePot(220, List.of(1, 2)));
    }

    @Test
    void split_restePourLePremierGagnant() {
        Map<Integer, Long> shares = SidePotRules.split(100, List.of(0, 2, 3));

        assertThat(shares).containsExactly(Map.entry(0, 34L), Map.entry(2, 33L), Map.entry(3, 33L));
        assertThat(SidePotRules.split(50, List.of())).isEmpty();
    }
}
