package org.dcbpoker.model.poker;

/**
 * Source of randomness for deck shuffling. Implementations must return a uniformly
 * distributed value in {@code [0, bound)}.
 */
@FunctionalInterface
public interface ShuffleSource {
    int nextInt(int bound);
}
