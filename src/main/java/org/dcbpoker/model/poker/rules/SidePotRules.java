package org.dcbpoker.model.poker.rules;

import org.dcbpoker.model.poker.Seat;
import org.dcbpoker.model.poker.SidePot;

import java.util.*;

public final class SidePotRules {
    private SidePotRules(){}

    /**
     * One tier per distinct {@code totalBetThisHand}, folded seats included. Only non-folded seats
     * may claim a tier; an unclaimed tier joins the previous pot, or the next one when lowest.
     */
    public static List<SidePot> partition(List<Seat> seats) {
        TreeSet<Long> tiers = new TreeSet<>();
        for (Seat s : seats) if (s.getTotalBetThisHand() > 0) tiers.add(s.getTotalBetThisHand());

        List<SidePot> pots = new ArrayList<>();
        long processed = 0;
        long carried = 0;
        for (long tier : tiers) {
            long amount = carried;
            for (Seat s : seats) {
                long contrib = Math.min(s.getTotalBetThisHand(), tier) - processed;
                if (contrib > 0) amount += contrib;
            }
            List<Integer> eligible = new ArrayList<>();
            for (int i = 0; i < seats.size(); i++) {
                Seat s = seats.get(i);
                if (!s.isFolded() && s.getTotalBetThisHand() >= tier) eligible.add(i);
            }
            processed = tier;

            if (!eligible.isEmpty()) {
                pots.add(new SidePot(amount, eligible));
                carried = 0;
            } else if (!pots.isEmpty()) {
                SidePot last = pots.remove(pots.size() - 1);
                pots.add(new SidePot(last.amount() + amount, last.eligible()));
                carried = 0;
            } else {
                carried = amount;
            }
        }
        return pots;
    }

    public static Map<Integer, Long> split(long amount, List<Integer> winners) {
        Map<Integer, Long> out = new LinkedHashMap<>();
        if (winners.isEmpty()) return out;
        long share = amount / winners.size();
        long remainder = amount - share * winners.size();
        for (int i = 0; i < winners.size(); i++) {
            out.put(winners.get(i), share + (i == 0 ? remainder : 0));
        }
        return out;
    }
}
