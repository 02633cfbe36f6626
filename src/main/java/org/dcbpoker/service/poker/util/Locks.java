package org.dcbpoker.service.poker.util;

import org.springframework.stereotype.Component;

import java.util.Objects;

/** Striped monitors: two ids may share a stripe, one id always maps to the same one. */
@Component
public class Locks {
    private static final int STRIPES = 64;
    private final Object[] stripes = new Object[STRIPES];

    public Locks() {
        for (int i = 0; i < STRIPES; i++) stripes[i] = new Object();
    }

    public Object of(Long tableId) {
        return stripes[Math.floorMod(Objects.hashCode(tableId), STRIPES)];
    }
}
