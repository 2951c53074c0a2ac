/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ring;

import java.util.function.UnaryOperator;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import static com.cloudway.ring.OptionalMatchers.just;
import static com.cloudway.ring.OptionalMatchers.nothing;

public class FocusRingTest {
    private FocusRing<String> abcd;

    @Before
    public void init() {
        abcd = FocusRing.fromArray("a", "b", "c", "d");
    }

    @Test
    public void fromListFocusesOnFirst() {
        FocusRing<String> ring = FocusRing.fromList(ImmutableList.of("x", "y"));
        assertEquals(0, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("x"));
        assertEquals(2, ring.size());
        assertEquals(ImmutableList.of("x", "y"), ring.toList());
    }

    @Test
    public void singleton() {
        FocusRing<String> ring = FocusRing.singleton("x");
        assertThat(ring.getFocused(), just("x"));
        assertThat(ring.focusOnNext().getFocused(), just("x"));
        assertThat(ring.focusOnPrevious().getFocused(), just("x"));
    }

    @Test
    public void emptyRingAccessors() {
        FocusRing<String> ring = FocusRing.empty();
        assertTrue(ring.isEmpty());
        assertEquals(0, ring.size());
        assertEquals(0, ring.getFocusedIndex());
        assertThat(ring.getFocused(), nothing());
        assertThat(ring.getFirst(), nothing());
        assertThat(ring.getLast(), nothing());
        assertThat(ring.get(3), nothing());
        assertThat(ring.get(-1), nothing());
        assertThat(ring.mapFocused(String::length), nothing());
        assertFalse(ring.isFocusedAt(0));
        assertFalse(ring.isFocusedMatching(x -> true));
        assertTrue(ring.toList().isEmpty());
        assertEquals(0, ring.toArray().length);
        assertTrue(ring.mapEachIntoList(x -> x, x -> x).isEmpty());
    }

    @Test
    public void emptyRingMutatorsKeepRingEmpty() {
        FocusRing<String> ring = FocusRing.empty();
        ImmutableList<UnaryOperator<FocusRing<String>>> ops = ImmutableList.of(
            r -> r.focusOn(5),
            r -> r.focusOn(-5),
            FocusRing::focusOnNext,
            FocusRing::focusOnPrevious,
            FocusRing::focusOnFirst,
            FocusRing::focusOnLast,
            r -> r.focusOnFirstMatching(x -> true),
            r -> r.focusOnLastMatching(x -> true),
            r -> r.focusOnNextMatching(x -> true),
            r -> r.focusOnPreviousMatching(x -> true),
            r -> r.removeAt(2),
            FocusRing::removeFirst,
            FocusRing::removeLast,
            FocusRing::removeFocused,
            r -> r.set(1, "x"),
            r -> r.setFocused("x")
        );
        for (UnaryOperator<FocusRing<String>> op : ops) {
            FocusRing<String> result = op.apply(ring);
            assertTrue(result.isEmpty());
            assertEquals(0, result.getFocusedIndex());
        }
    }

    @Test
    public void focusOnWrapsAround() {
        for (int n = 1; n <= 7; n++) {
            FocusRing<Integer> ring = FocusRing.fromList(
                ContiguousSet.create(Range.closedOpen(0, n), DiscreteDomain.integers()));
            for (int k = -20; k <= 20; k++) {
                assertEquals("focusOn " + k + " in ring of " + n,
                             ((k % n) + n) % n, ring.focusOn(k).getFocusedIndex());
            }
        }
    }

    @Test
    public void nextAndPreviousAreInverses() {
        for (int i = 0; i < abcd.size(); i++) {
            FocusRing<String> ring = abcd.focusOn(i);
            assertEquals(i, ring.focusOnNext().focusOnPrevious().getFocusedIndex());
            assertEquals(i, ring.focusOnPrevious().focusOnNext().getFocusedIndex());
        }
    }

    @Test
    public void nextWrapsAfterLast() {
        assertEquals(0, abcd.focusOnLast().focusOnNext().getFocusedIndex());
        assertEquals(3, abcd.focusOnFirst().focusOnPrevious().getFocusedIndex());
    }

    @Test
    public void fullCycleReturnsToStart() {
        for (int start = 0; start < abcd.size(); start++) {
            FocusRing<String> ring = abcd.focusOn(start);
            for (int i = 0; i < abcd.size(); i++) {
                ring = ring.focusOnNext();
            }
            assertEquals(start, ring.getFocusedIndex());
        }
    }

    @Test
    public void focusOnFirstAndLastMatching() {
        FocusRing<String> ring = FocusRing.fromArray("A", "B", "A", "B");
        assertEquals(1, ring.focusOnFirstMatching("B"::equals).getFocusedIndex());
        assertEquals(2, ring.focusOnLastMatching("A"::equals).getFocusedIndex());

        FocusRing<String> focused = ring.focusOn(2);
        assertSame(focused, focused.focusOnFirstMatching("C"::equals));
        assertSame(focused, focused.focusOnLastMatching("C"::equals));
    }

    @Test
    public void focusOnNextMatchingSearchesAfterFocusFirst() {
        FocusRing<String> ring = FocusRing.fromArray("A", "B", "A", "B");
        assertEquals(1, ring.focusOnNextMatching("B"::equals).getFocusedIndex());
        assertEquals(2, ring.focusOnNextMatching("A"::equals).getFocusedIndex());
    }

    @Test
    public void focusOnNextMatchingWrapsToStart() {
        FocusRing<String> ring = FocusRing.fromArray("A", "B", "A", "B").focusOn(3);
        assertEquals(0, ring.focusOnNextMatching("A"::equals).getFocusedIndex());
        assertEquals(1, ring.focusOnNextMatching("B"::equals).getFocusedIndex());
    }

    @Test
    public void focusOnNextMatchingFallsBackToFocus() {
        FocusRing<String> ring = FocusRing.fromArray("A", "B", "C").focusOn(1);
        assertEquals(1, ring.focusOnNextMatching("B"::equals).getFocusedIndex());
        assertSame(ring, ring.focusOnNextMatching("Z"::equals));
    }

    @Test
    public void focusOnPreviousMatchingConsidersFocusFirst() {
        FocusRing<String> ring = FocusRing.fromArray("A", "B", "A", "B");
        assertEquals(2, ring.focusOn(2).focusOnPreviousMatching("A"::equals).getFocusedIndex());
        assertEquals(0, ring.focusOn(1).focusOnPreviousMatching("A"::equals).getFocusedIndex());
        assertEquals(1, ring.focusOn(1).focusOnPreviousMatching("B"::equals).getFocusedIndex());
    }

    @Test
    public void focusOnPreviousMatchingWrapsToEnd() {
        FocusRing<String> ring = FocusRing.fromArray("A", "B", "A", "B");
        assertEquals(3, ring.focusOnPreviousMatching("B"::equals).getFocusedIndex());
        assertSame(ring, ring.focusOnPreviousMatching("Z"::equals));
    }

    @Test
    public void pushAndAppendKeepFocus() {
        FocusRing<String> ring = abcd.focusOn(2).push("e").append(ImmutableList.of("f", "g"));
        assertEquals(ImmutableList.of("a", "b", "c", "d", "e", "f", "g"), ring.toList());
        assertEquals(2, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("c"));
    }

    @Test
    public void pushOnEmptyRingFocusesNewElement() {
        FocusRing<String> ring = FocusRing.<String>empty().push("x");
        assertEquals(0, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("x"));
    }

    @Test
    public void prependKeepsFocusedElement() {
        FocusRing<String> ring = FocusRing.fromArray("c", "d").focusOn(1);
        FocusRing<String> result = ring.prepend(ImmutableList.of("a", "b"));
        assertEquals(ImmutableList.of("a", "b", "c", "d"), result.toList());
        assertEquals(3, result.getFocusedIndex());
        assertThat(result.getFocused(), just("d"));

        FocusRing<String> empty = FocusRing.<String>empty().prepend(ImmutableList.of("a", "b"));
        assertEquals(0, empty.getFocusedIndex());
    }

    @Test
    public void removeLastWhileFocusedOnLast() {
        FocusRing<String> ring = abcd.focusOnLast().removeLast();
        assertEquals(ImmutableList.of("a", "b", "c"), ring.toList());
        assertEquals(2, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("c"));
    }

    @Test
    public void removeLastAlwaysStepsFocusBack() {
        FocusRing<String> ring = abcd.focusOn(1).removeAt(3);
        assertEquals(ImmutableList.of("a", "b", "c"), ring.toList());
        assertEquals(0, ring.getFocusedIndex());

        ring = abcd.removeLast();
        assertEquals(2, ring.getFocusedIndex());
    }

    @Test
    public void removeEarlierElementKeepsNumericFocus() {
        // the focus index stays, so the focused element changes from "c" to "d"
        FocusRing<String> ring = abcd.focusOn(2).removeAt(0);
        assertEquals(ImmutableList.of("b", "c", "d"), ring.toList());
        assertEquals(2, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("d"));
    }

    @Test
    public void removeLaterElementKeepsFocus() {
        FocusRing<String> ring = abcd.focusOn(1).removeAt(2);
        assertEquals(ImmutableList.of("a", "b", "d"), ring.toList());
        assertEquals(1, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("b"));
    }

    @Test
    public void focusOnLastStaysInRangeAfterRemoval() {
        FocusRing<String> ring = abcd.focusOnLast().removeFirst();
        assertEquals(ImmutableList.of("b", "c", "d"), ring.toList());
        assertEquals(2, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just("d"));
    }

    @Test
    public void removeAtNormalizesIndex() {
        assertEquals(ImmutableList.of("a", "b", "c"), abcd.removeAt(-1).toList());
        assertEquals(ImmutableList.of("a", "c", "d"), abcd.removeAt(5).toList());
    }

    @Test
    public void removeFocused() {
        FocusRing<String> ring = FocusRing.fromArray("a", "b", "c").focusOn(1).removeFocused();
        assertEquals(ImmutableList.of("a", "c"), ring.toList());
        assertThat(ring.getFocused(), just("c"));
    }

    @Test
    public void removeOnlyElement() {
        FocusRing<String> ring = FocusRing.singleton("x").removeFocused();
        assertTrue(ring.isEmpty());
        assertEquals(0, ring.getFocusedIndex());
        assertThat(ring.getFocused(), nothing());
    }

    @Test
    public void getNormalizesIndex() {
        assertThat(abcd.get(0), just("a"));
        assertThat(abcd.get(4), just("a"));
        assertThat(abcd.get(-1), just("d"));
        assertThat(abcd.getFirst(), just("a"));
        assertThat(abcd.getLast(), just("d"));
    }

    @Test
    public void setReplacesElement() {
        FocusRing<String> ring = abcd.focusOn(1).set(-1, "z");
        assertEquals(ImmutableList.of("a", "b", "c", "z"), ring.toList());
        assertEquals(1, ring.getFocusedIndex());

        ring = ring.setFocused("y");
        assertEquals(ImmutableList.of("a", "y", "c", "z"), ring.toList());
    }

    @Test
    public void isFocused() {
        FocusRing<String> ring = abcd.focusOn(1);
        assertTrue(ring.isFocusedAt(1));
        assertTrue(ring.isFocusedAt(-3));
        assertTrue(ring.isFocusedAt(5));
        assertFalse(ring.isFocusedAt(2));
        assertTrue(ring.isFocusedMatching("b"::equals));
        assertFalse(ring.isFocusedMatching("a"::equals));
    }

    @Test
    public void mapKeepsFocus() {
        FocusRing<Integer> ring = abcd.focusOn(2).map(s -> (int)s.charAt(0));
        assertEquals(2, ring.getFocusedIndex());
        assertThat(ring.getFocused(), just((int)'c'));
        assertThat(abcd.focusOn(3).mapFocused(String::toUpperCase), just("D"));
    }

    @Test
    public void mapEachAppliesFocusedFunctionOnce() {
        FocusRing<String> ring = abcd.focusOn(1);
        assertEquals(ImmutableList.of("a", "[b]", "c", "d"),
                     ring.mapEachIntoList(x -> x, x -> "[" + x + "]"));
        assertArrayEquals(new String[] {"a", "b", "[c]", "d"},
                          ring.focusOnNext().mapEachIntoArray(x -> x, x -> "[" + x + "]", String[]::new));
    }

    @Test
    public void toArray() {
        assertArrayEquals(new String[] {"a", "b", "c", "d"}, abcd.toArray(String[]::new));
        assertArrayEquals(new Object[] {"a", "b", "c", "d"}, abcd.toArray());
    }

    @Test
    public void operationsDoNotModifyOriginal() {
        FocusRing<String> ring = abcd.focusOn(1);
        ring.focusOnNext();
        ring.removeAt(0);
        ring.push("e");
        ring.set(1, "z");
        assertEquals(ImmutableList.of("a", "b", "c", "d"), ring.toList());
        assertEquals(1, ring.getFocusedIndex());
    }

    @Test
    public void equality() {
        assertEquals(abcd, FocusRing.fromList(ImmutableList.of("a", "b", "c", "d")));
        assertEquals(abcd.hashCode(), FocusRing.fromArray("a", "b", "c", "d").hashCode());
        assertNotEquals(abcd, abcd.focusOnNext());
        assertEquals(abcd, abcd.focusOnNext().focusOnPrevious());
        assertEquals(FocusRing.empty(), FocusRing.fromList(ImmutableList.of()));
    }

    @Test
    public void iterationFollowsRingOrder() {
        StringBuilder buf = new StringBuilder();
        for (String x : abcd.focusOn(2)) {
            buf.append(x);
        }
        assertEquals("abcd", buf.toString());
        assertThat(abcd.stream().count(), is(4L));
    }

    @Test
    public void toStringShowsElementsAndFocus() {
        assertEquals("FocusRing{elements=[a, b], focused=1}",
                     FocusRing.fromArray("a", "b").focusOnLast().toString());
    }
}
