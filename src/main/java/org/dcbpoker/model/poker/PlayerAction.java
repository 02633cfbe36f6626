package org.dcbpoker.model.poker;

import java.util.Optional;

public enum PlayerAction {
    FOLD, CHECK, CALL, BET, RAISE, ALLIN;

    public String tag() {
        return name().toLowerCase();
    }

    public static Optional<PlayerAction> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim().replace("-", "").replace("_", "").toUpperCase();
        for (PlayerAction a : values()) if (a.name().equals(t)) return Optional.of(a);
        return Optional.empty();
    }
}
