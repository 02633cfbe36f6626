package org.dcbpoker.model.poker.rules;

import org.dcbpoker.model.poker.Card;
import org.dcbpoker.model.poker.HandRank;
import org.dcbpoker.model.poker.HandResult;

import java.util.*;

public final class HandRules {
    private HandRules(){}

    private static final List<Integer> WHEEL = List.of(14, 5, 4, 3, 2);
    private static final List<Integer> WHEEL_KICKERS = List.of(5, 4, 3, 2, 1);

    /**
     * Best hand out of 5 to 7 cards. Every 5-card subset is scored and the strictly highest kept,
     * so with 7 cards the 21 combinations are all examined.
     */
    public static HandResult evaluate(List<Card> cards) {
        if (cards == null || cards.size() < 5 || cards.size() > 7)
            throw new IllegalArgumentException("Il faut entre 5 et 7 cartes");
        if (new HashSet<>(cards).size() != cards.size())
            throw new IllegalArgumentException("Cartes en double");

        int n = cards.size();
        HandResult best = null;
        for (int a = 0; a < n; a++)
            for (int b = a + 1; b < n; b++)
                for (int c = b + 1; c < n; c++)
                    for (int d = c + 1; d < n; d++)
                        for (int e = d + 1; e < n; e++) {
                            HandResult r = evaluateFive(List.of(cards.get(a), cards.get(b), cards.get(c), cards.get(d), cards.get(e)));
                            if (best == null || r.compareTo(best) > 0) best = r;
                        }
        return best;
    }

    public static int compare(HandResult a, HandResult b) {
        return a.compareTo(b);
    }

    static HandResult evaluateFive(List<Card> five) {
        List<Card> sorted = new ArrayList<>(five);
        sorted.sort(Comparator.comparingInt(Card::value).reversed());
        List<Integer> values = sorted.stream().map(Card::value).toList();

        boolean flush = sorted.stream().map(Card::getSuit).distinct().count() == 1;
        boolean straight = isStraight(values);
        boolean wheel = values.equals(WHEEL);

        // groupes de rangs: effectif décroissant puis rang décroissant
        Map<Integer, Integer> freq = new HashMap<>();
        for (int v : values) freq.merge(v, 1, Integer::sum);
        List<Map.Entry<Integer, Integer>> groups = new ArrayList<>(freq.entrySet());
        groups.sort((x, y) -> !x.getValue().equals(y.getValue())
                ? y.getValue() - x.getValue()
                : y.getKey() - x.getKey());
        int topCount = groups.get(0).getValue();
        int topValue = groups.get(0).getKey();

        if (flush && straight && values.get(0) == 14)
            return new HandResult(HandRank.ROYAL_FLUSH, values, sorted);
        if (flush && (straight || wheel))
            return new HandResult(HandRank.STRAIGHT_FLUSH, wheel ? WHEEL_KICKERS : values, sorted);
        if (topCount == 4)
            return new HandResult(HandRank.FOUR_OF_A_KIND, List.of(topValue, groups.get(1).getKey()), sorted);
        if (topCount == 3 && groups.get(1).getValue() == 2)
            return new HandResult(HandRank.FULL_HOUSE, List.of(topValue, groups.get(1).getKey()), sorted);
        if (flush)
            return new HandResult(HandRank.FLUSH, values, sorted);
        if (straight || wheel)
            return new HandResult(HandRank.STRAIGHT, wheel ? WHEEL_KICKERS : values, sorted);
        if (topCount == 3)
            return new HandResult(HandRank.THREE_OF_A_KIND, withKickers(topValue, values, 2), sorted);
        if (topCount == 2 && groups.get(1).getValue() == 2) {
            int high = groups.get(0).getKey();
            int low = groups.get(1).getKey();
            int kicker = values.stream().filter(v -> v != high && v != low).findFirst().orElseThrow();
            return new HandResult(HandRank.TWO_PAIR, List.of(high, low, kicker), sorted);
        }
        if (topCount == 2)
            return new HandResult(HandRank.ONE_PAIR, withKickers(topValue, values, 3), sorted);
        return new HandResult(HandRank.HIGH_CARD, values, sorted);
    }

    private static boolean isStraight(List<Integer> desc) {
        for (int i = 0; i < desc.size() - 1; i++) {
            if (desc.get(i) - desc.get(i + 1) != 1) return false;
        }
        return true;
    }

    private static List<Integer> withKickers(int made, List<Integer> desc, int count) {
        List<Integer> out = new ArrayList<>();
        out.add(made);
        desc.stream().filter(v -> v != made).limit(count).forEach(out::add);
        return out;
    }
}
