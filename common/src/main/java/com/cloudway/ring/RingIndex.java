/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ring;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Index arithmetic shared by the array backed rings.
 */
final class RingIndex {
    private static final Logger logger = Logger.getLogger(RingIndex.class.getName());

    private RingIndex() {}

    /**
     * Reduce an arbitrary index into {@code [0, size)} using floored modulo.
     * The size must be positive.
     */
    static int normalize(int index, int size) {
        return Math.floorMod(index, size);
    }

    /**
     * Returns the focus index after the element at {@code removed} is taken out
     * of a ring that had {@code size} elements before the removal.
     *
     * <p>Removing the last element moves the focus one step backwards on the
     * shorter ring. Removing any other element keeps the numeric focus, which
     * may leave a different logical element focused. A focus that would fall
     * off the end of the shorter ring is pulled back to its last index.</p>
     */
    static int focusAfterRemoval(int focused, int removed, int size) {
        int newSize = size - 1;
        if (newSize == 0)
            return 0;
        if (removed == size - 1)
            return normalize(focused - 1, newSize);
        return Math.min(focused, newSize - 1);
    }

    /**
     * Returns the index of the first element matching the predicate.
     */
    static <T> OptionalInt firstMatching(List<T> elements, Predicate<? super T> p) {
        return scanForward(elements, 0, elements.size(), p, "firstMatching");
    }

    /**
     * Returns the index of the last element matching the predicate.
     */
    static <T> OptionalInt lastMatching(List<T> elements, Predicate<? super T> p) {
        return scanBackward(elements, elements.size() - 1, -1, p, "lastMatching");
    }

    /**
     * Search strictly after the focus, then wrap around and search from the
     * start up to and including the focus.
     */
    static <T> OptionalInt nextMatching(List<T> elements, int focused, Predicate<? super T> p) {
        for (int i = focused + 1; i < elements.size(); i++) {
            if (p.test(elements.get(i)))
                return OptionalInt.of(i);
        }
        return scanForward(elements, 0, focused + 1, p, "nextMatching");
    }

    /**
     * Search backwards from the focus (inclusive) to the start, then wrap
     * around and search backwards from the end down to just after the focus.
     */
    static <T> OptionalInt previousMatching(List<T> elements, int focused, Predicate<? super T> p) {
        for (int i = focused; i >= 0; i--) {
            if (p.test(elements.get(i)))
                return OptionalInt.of(i);
        }
        return scanBackward(elements, elements.size() - 1, focused, p, "previousMatching");
    }

    private static <T> OptionalInt scanForward(List<T> elements, int from, int to,
                                               Predicate<? super T> p, String operation) {
        for (int i = from; i < to; i++) {
            if (p.test(elements.get(i)))
                return OptionalInt.of(i);
        }
        return noMatch(operation);
    }

    private static <T> OptionalInt scanBackward(List<T> elements, int from, int downTo,
                                                Predicate<? super T> p, String operation) {
        for (int i = from; i > downTo; i--) {
            if (p.test(elements.get(i)))
                return OptionalInt.of(i);
        }
        return noMatch(operation);
    }

    private static OptionalInt noMatch(String operation) {
        logger.finest(() -> operation + ": no element matched");
        return OptionalInt.empty();
    }

    /**
     * Returns the given ring unchanged, tracing that the operation had
     * nothing to act on.
     */
    static <R> R ignored(String operation, R ring) {
        logger.finest(() -> operation + ": ring is empty, ignored");
        return ring;
    }

    static <T> ImmutableList<T> removeAt(ImmutableList<T> elements, int index) {
        return ImmutableList.<T>builder()
            .addAll(elements.subList(0, index))
            .addAll(elements.subList(index + 1, elements.size()))
            .build();
    }

    static <T> ImmutableList<T> replaceAt(ImmutableList<T> elements, int index, T value) {
        return ImmutableList.<T>builder()
            .addAll(elements.subList(0, index))
            .add(value)
            .addAll(elements.subList(index + 1, elements.size()))
            .build();
    }

    static <T> ImmutableList<T> concat(List<? extends T> front, List<? extends T> rear) {
        return ImmutableList.<T>builder().addAll(front).addAll(rear).build();
    }
}
