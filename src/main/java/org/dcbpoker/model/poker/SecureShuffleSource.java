package org.dcbpoker.model.poker;

import java.security.SecureRandom;

public class SecureShuffleSource implements ShuffleSource {
    private final SecureRandom rnd = new SecureRandom();

    @Override
    public int nextInt(int bound) {
        return rnd.nextInt(bound);
    }
}
