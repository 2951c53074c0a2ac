/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ring;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;

/**
 * An immutable focus ring that additionally marks any number of elements
 * as selected. Selected elements are tracked as a set of indexes, so
 * selecting an element twice has no further effect.
 *
 * @param <T> the type of ring elements
 * @see FocusRing
 */
public final class MultiSelectRing<T> implements Iterable<T> {
    private static final MultiSelectRing<?> EMPTY =
        new MultiSelectRing<>(FocusRing.empty(), ImmutableSortedSet.of());

    private final FocusRing<T> ring;
    private final ImmutableSortedSet<Integer> selected;

    private MultiSelectRing(FocusRing<T> ring, ImmutableSortedSet<Integer> selected) {
        this.ring = ring;
        this.selected = selected;
    }

    private MultiSelectRing<T> withRing(FocusRing<T> newRing) {
        return newRing == ring ? this : new MultiSelectRing<>(newRing, selected);
    }

    private MultiSelectRing<T> withSelected(ImmutableSortedSet<Integer> newSelected) {
        return newSelected.equals(selected) ? this : new MultiSelectRing<>(ring, newSelected);
    }

    // Construction

    /**
     * Returns an empty ring.
     */
    @SuppressWarnings("unchecked")
    public static <T> MultiSelectRing<T> empty() {
        return (MultiSelectRing<T>)EMPTY;
    }

    /**
     * Returns a ring containing a single focused element.
     */
    public static <T> MultiSelectRing<T> singleton(T x) {
        return new MultiSelectRing<>(FocusRing.singleton(x), ImmutableSortedSet.of());
    }

    /**
     * Returns a ring containing the given elements, focused on the first
     * one, with nothing selected.
     */
    public static <T> MultiSelectRing<T> fromList(Iterable<? extends T> items) {
        return new MultiSelectRing<>(FocusRing.fromList(items), ImmutableSortedSet.of());
    }

    /**
     * Returns a ring containing the given elements, focused on the first one.
     */
    @SafeVarargs
    public static <T> MultiSelectRing<T> fromArray(T... items) {
        return fromList(Arrays.asList(items));
    }

    // Query operations

    /**
     * Returns {@code true} if the ring has no elements.
     */
    public boolean isEmpty() {
        return ring.isEmpty();
    }

    /**
     * Returns the number of elements in the ring.
     */
    public int size() {
        return ring.size();
    }

    /**
     * Returns the element at the normalized index, or empty if the ring is
     * empty.
     */
    public Optional<T> get(int index) {
        return ring.get(index);
    }

    /**
     * Returns the first element, or empty if the ring is empty.
     */
    public Optional<T> getFirst() {
        return ring.getFirst();
    }

    /**
     * Returns the last element, or empty if the ring is empty.
     */
    public Optional<T> getLast() {
        return ring.getLast();
    }

    /**
     * Returns the focused element, or empty if the ring is empty.
     */
    public Optional<T> getFocused() {
        return ring.getFocused();
    }

    /**
     * Returns the index of the focused element, 0 for an empty ring.
     */
    public int getFocusedIndex() {
        return ring.getFocusedIndex();
    }

    /**
     * Returns {@code true} if the element at the normalized index is focused.
     */
    public boolean isFocusedAt(int index) {
        return ring.isFocusedAt(index);
    }

    /**
     * Returns {@code true} if the focused element matches the predicate.
     */
    public boolean isFocusedMatching(Predicate<? super T> p) {
        return ring.isFocusedMatching(p);
    }

    /**
     * Returns {@code true} if the focused element is also selected.
     */
    public boolean isFocusedSelected() {
        return !isEmpty() && selected.contains(getFocusedIndex());
    }

    /**
     * Returns {@code true} if no element is selected.
     */
    public boolean isNoneSelected() {
        return selected.isEmpty();
    }

    /**
     * Returns {@code true} if some element is selected.
     */
    public boolean isAnySelected() {
        return !selected.isEmpty();
    }

    /**
     * Returns {@code true} if every element is selected. Trivially true for
     * an empty ring.
     */
    public boolean isAllSelected() {
        return selected.size() == size();
    }

    /**
     * Returns {@code true} if the element at the normalized index is selected.
     */
    public boolean isSelectedAt(int index) {
        return !isEmpty() && selected.contains(normalize(index));
    }

    /**
     * Returns the number of selected elements.
     */
    public int countSelected() {
        return selected.size();
    }

    /**
     * Returns the number of elements that are not selected.
     */
    public int countDeselected() {
        return size() - selected.size();
    }

    /**
     * Returns the selected elements in ring order.
     */
    public ImmutableList<T> getSelected() {
        ImmutableList<T> elements = ring.toList();
        ImmutableList.Builder<T> result = ImmutableList.builder();
        for (int i : selected) {
            result.add(elements.get(i));
        }
        return result.build();
    }

    /**
     * Returns the indexes of the selected elements in ascending order.
     */
    public ImmutableSortedSet<Integer> getSelectedIndexes() {
        return selected;
    }

    // Modification operations

    /**
     * Adds an element to the end of the ring. The focus is not changed.
     */
    public MultiSelectRing<T> push(T x) {
        return withRing(ring.push(x));
    }

    /**
     * Adds the elements to the end of the ring. The focus is not changed.
     */
    public MultiSelectRing<T> append(Iterable<? extends T> xs) {
        return withRing(ring.append(xs));
    }

    /**
     * Adds the elements to the front of the ring. The focus and every
     * selected index are shifted to stay on the same elements.
     */
    public MultiSelectRing<T> prepend(Iterable<? extends T> xs) {
        FocusRing<T> newRing = ring.prepend(xs);
        int shift = newRing.size() - ring.size();
        ImmutableSortedSet.Builder<Integer> shifted = ImmutableSortedSet.naturalOrder();
        for (int i : selected) {
            shifted.add(i + shift);
        }
        return new MultiSelectRing<>(newRing, shifted.build());
    }

    /**
     * Removes the element at the normalized index. The focus follows the
     * rules of {@link FocusRing#removeAt(int)}. The removed index leaves the
     * selection and every selected index after it is shifted backwards.
     */
    public MultiSelectRing<T> removeAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("removeAt", this);

        int removed = normalize(index);
        ImmutableSortedSet.Builder<Integer> remaining = ImmutableSortedSet.naturalOrder();
        for (int i : selected) {
            if (i < removed) {
                remaining.add(i);
            } else if (i > removed) {
                remaining.add(i - 1);
            }
        }
        return new MultiSelectRing<>(ring.removeAt(removed), remaining.build());
    }

    /**
     * Removes the first element.
     */
    public MultiSelectRing<T> removeFirst() {
        return removeAt(0);
    }

    /**
     * Removes the last element.
     */
    public MultiSelectRing<T> removeLast() {
        return removeAt(size() - 1);
    }

    /**
     * Removes the focused element.
     */
    public MultiSelectRing<T> removeFocused() {
        return removeAt(getFocusedIndex());
    }

    /**
     * Removes every selected element, highest index first.
     */
    public MultiSelectRing<T> removeSelected() {
        MultiSelectRing<T> result = this;
        for (int i : selected.descendingSet()) {
            result = result.removeAt(i);
        }
        return result;
    }

    /**
     * Replaces the element at the normalized index. The focus is not changed.
     */
    public MultiSelectRing<T> set(int index, T x) {
        return withRing(ring.set(index, x));
    }

    /**
     * Replaces the focused element.
     */
    public MultiSelectRing<T> setFocused(T x) {
        return withRing(ring.setFocused(x));
    }

    // Focus operations

    /**
     * Moves the focus to the normalized index.
     */
    public MultiSelectRing<T> focusOn(int index) {
        return withRing(ring.focusOn(index));
    }

    /**
     * Moves the focus one step forward, wrapping around to the first element.
     */
    public MultiSelectRing<T> focusOnNext() {
        return withRing(ring.focusOnNext());
    }

    /**
     * Moves the focus one step backward, wrapping around to the last element.
     */
    public MultiSelectRing<T> focusOnPrevious() {
        return withRing(ring.focusOnPrevious());
    }

    /**
     * Moves the focus to the first element.
     */
    public MultiSelectRing<T> focusOnFirst() {
        return withRing(ring.focusOnFirst());
    }

    /**
     * Moves the focus to the last element.
     */
    public MultiSelectRing<T> focusOnLast() {
        return withRing(ring.focusOnLast());
    }

    /**
     * Focus on the first element matching the predicate, or leave the ring
     * unchanged if there is none.
     */
    public MultiSelectRing<T> focusOnFirstMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnFirstMatching(p));
    }

    /**
     * Focus on the last element matching the predicate, or leave the ring
     * unchanged if there is none.
     */
    public MultiSelectRing<T> focusOnLastMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnLastMatching(p));
    }

    /**
     * @see FocusRing#focusOnNextMatching(Predicate)
     */
    public MultiSelectRing<T> focusOnNextMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnNextMatching(p));
    }

    /**
     * @see FocusRing#focusOnPreviousMatching(Predicate)
     */
    public MultiSelectRing<T> focusOnPreviousMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnPreviousMatching(p));
    }

    // Selection operations

    /**
     * Adds the element at the normalized index to the selection.
     */
    public MultiSelectRing<T> selectAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("selectAt", this);
        return withSelected(union(selected, ImmutableSortedSet.of(normalize(index))));
    }

    /**
     * Selects the first element.
     */
    public MultiSelectRing<T> selectFirst() {
        return selectAt(0);
    }

    /**
     * Selects the last element.
     */
    public MultiSelectRing<T> selectLast() {
        return selectAt(size() - 1);
    }

    /**
     * Selects the focused element.
     */
    public MultiSelectRing<T> selectFocused() {
        return selectAt(getFocusedIndex());
    }

    /**
     * Selects every element.
     */
    public MultiSelectRing<T> selectAll() {
        return withSelected(allIndexes());
    }

    /**
     * Adds the normalized indexes to the selection.
     */
    public MultiSelectRing<T> selectMany(Iterable<Integer> indexes) {
        if (isEmpty())
            return RingIndex.ignored("selectMany", this);
        return withSelected(union(selected, normalizeAll(indexes)));
    }

    /**
     * Adds every element matching the predicate to the selection.
     */
    public MultiSelectRing<T> selectManyMatching(Predicate<? super T> p) {
        return withSelected(union(selected, matching(p)));
    }

    /**
     * Removes the element at the normalized index from the selection.
     */
    public MultiSelectRing<T> deselectAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("deselectAt", this);
        return withSelected(difference(selected, ImmutableSortedSet.of(normalize(index))));
    }

    /**
     * Deselects the first element.
     */
    public MultiSelectRing<T> deselectFirst() {
        return deselectAt(0);
    }

    /**
     * Deselects the last element.
     */
    public MultiSelectRing<T> deselectLast() {
        return deselectAt(size() - 1);
    }

    /**
     * Deselects the focused element.
     */
    public MultiSelectRing<T> deselectFocused() {
        return deselectAt(getFocusedIndex());
    }

    /**
     * Clears the selection.
     */
    public MultiSelectRing<T> deselectAll() {
        return withSelected(ImmutableSortedSet.of());
    }

    /**
     * Removes the normalized indexes from the selection.
     */
    public MultiSelectRing<T> deselectMany(Iterable<Integer> indexes) {
        if (isEmpty())
            return RingIndex.ignored("deselectMany", this);
        return withSelected(difference(selected, normalizeAll(indexes)));
    }

    /**
     * Removes every element matching the predicate from the selection.
     */
    public MultiSelectRing<T> deselectManyMatching(Predicate<? super T> p) {
        return withSelected(difference(selected, matching(p)));
    }

    /**
     * Flips the selection of the element at the normalized index.
     */
    public MultiSelectRing<T> toggleAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("toggleAt", this);
        return isSelectedAt(index) ? deselectAt(index) : selectAt(index);
    }

    /**
     * Toggles the selection of the first element.
     */
    public MultiSelectRing<T> toggleFirst() {
        return toggleAt(0);
    }

    /**
     * Toggles the selection of the last element.
     */
    public MultiSelectRing<T> toggleLast() {
        return toggleAt(size() - 1);
    }

    /**
     * Toggles the selection of the focused element.
     */
    public MultiSelectRing<T> toggleFocused() {
        return toggleAt(getFocusedIndex());
    }

    private ImmutableSortedSet<Integer> allIndexes() {
        return ContiguousSet.create(Range.closedOpen(0, size()), DiscreteDomain.integers());
    }

    private ImmutableSortedSet<Integer> normalizeAll(Iterable<Integer> indexes) {
        ImmutableSortedSet.Builder<Integer> result = ImmutableSortedSet.naturalOrder();
        for (int i : indexes) {
            result.add(normalize(i));
        }
        return result.build();
    }

    private ImmutableSortedSet<Integer> matching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        ImmutableList<T> elements = ring.toList();
        ImmutableSortedSet.Builder<Integer> result = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < elements.size(); i++) {
            if (p.test(elements.get(i)))
                result.add(i);
        }
        return result.build();
    }

    private static ImmutableSortedSet<Integer> union(ImmutableSortedSet<Integer> a, ImmutableSortedSet<Integer> b) {
        return ImmutableSortedSet.copyOf(Sets.union(a, b));
    }

    private static ImmutableSortedSet<Integer> difference(ImmutableSortedSet<Integer> a, ImmutableSortedSet<Integer> b) {
        return ImmutableSortedSet.copyOf(Sets.difference(a, b));
    }

    // Conversions

    /**
     * Returns the elements in ring order.
     */
    public ImmutableList<T> toList() {
        return ring.toList();
    }

    /**
     * Returns the elements in ring order as an array.
     */
    public Object[] toArray() {
        return ring.toArray();
    }

    /**
     * Returns the elements in ring order as an array.
     */
    public T[] toArray(IntFunction<T[]> generator) {
        return ring.toArray(generator);
    }

    /**
     * Transform every element, keeping the focus and the selection.
     */
    public <R> MultiSelectRing<R> map(Function<? super T, ? extends R> f) {
        return new MultiSelectRing<>(ring.map(f), selected);
    }

    /**
     * Apply the function to the focused element.
     */
    public <R> Optional<R> mapFocused(Function<? super T, ? extends R> f) {
        return ring.mapFocused(f);
    }

    /**
     * Produce one value per element. The focused element is always passed to
     * {@code focusedFn}, whether selected or not. Other selected elements are
     * passed to {@code selectedFn} and the rest to {@code basicFn}.
     */
    public <R> ImmutableList<R> mapEachIntoList(Function<? super T, ? extends R> basicFn,
                                                Function<? super T, ? extends R> focusedFn,
                                                Function<? super T, ? extends R> selectedFn) {
        Objects.requireNonNull(basicFn);
        Objects.requireNonNull(focusedFn);
        Objects.requireNonNull(selectedFn);

        ImmutableList<T> elements = ring.toList();
        int focused = ring.getFocusedIndex();
        ImmutableList.Builder<R> result = ImmutableList.builder();
        for (int i = 0; i < elements.size(); i++) {
            T x = elements.get(i);
            if (i == focused) {
                result.add(focusedFn.apply(x));
            } else if (selected.contains(i)) {
                result.add(selectedFn.apply(x));
            } else {
                result.add(basicFn.apply(x));
            }
        }
        return result.build();
    }

    /**
     * Like {@code mapEachIntoList} but collects the results into an array.
     */
    public <R> R[] mapEachIntoArray(Function<? super T, ? extends R> basicFn,
                                    Function<? super T, ? extends R> focusedFn,
                                    Function<? super T, ? extends R> selectedFn,
                                    IntFunction<R[]> generator) {
        return mapEachIntoList(basicFn, focusedFn, selectedFn).stream().toArray(generator);
    }

    @Override
    public Iterator<T> iterator() {
        return ring.iterator();
    }

    /**
     * Returns a sequential stream over the elements in ring order.
     */
    public Stream<T> stream() {
        return ring.stream();
    }

    private int normalize(int index) {
        return RingIndex.normalize(index, size());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof MultiSelectRing))
            return false;

        MultiSelectRing<?> other = (MultiSelectRing<?>)obj;
        return ring.equals(other.ring) && selected.equals(other.selected);
    }

    @Override
    public int hashCode() {
        return 31 * ring.hashCode() + selected.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("elements", ring.toList())
            .add("focused", ring.getFocusedIndex())
            .add("selected", selected)
            .toString();
    }
}
