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
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * An immutable focus ring that additionally marks at most one element as
 * selected. The selection is independent of the focus: the selected and
 * focused elements may be the same or different.
 *
 * @param <T> the type of ring elements
 * @see FocusRing
 */
public final class SelectRing<T> implements Iterable<T> {
    private static final SelectRing<?> EMPTY = new SelectRing<>(FocusRing.empty(), OptionalInt.empty());

    private final FocusRing<T> ring;
    private final OptionalInt selected;

    private SelectRing(FocusRing<T> ring, OptionalInt selected) {
        this.ring = ring;
        this.selected = selected;
    }

    private SelectRing<T> withRing(FocusRing<T> newRing) {
        return newRing == ring ? this : new SelectRing<>(newRing, selected);
    }

    private SelectRing<T> withSelected(OptionalInt newSelected) {
        return new SelectRing<>(ring, newSelected);
    }

    // Construction

    /**
     * Returns an empty ring.
     */
    @SuppressWarnings("unchecked")
    public static <T> SelectRing<T> empty() {
        return (SelectRing<T>)EMPTY;
    }

    /**
     * Returns a ring containing a single focused element.
     */
    public static <T> SelectRing<T> singleton(T x) {
        return new SelectRing<>(FocusRing.singleton(x), OptionalInt.empty());
    }

    /**
     * Returns a ring containing the given elements, focused on the first
     * one, with nothing selected.
     */
    public static <T> SelectRing<T> fromList(Iterable<? extends T> items) {
        return new SelectRing<>(FocusRing.fromList(items), OptionalInt.empty());
    }

    /**
     * Returns a ring containing the given elements, focused on the first one.
     */
    @SafeVarargs
    public static <T> SelectRing<T> fromArray(T... items) {
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
     * Returns the selected element, or empty if nothing is selected.
     */
    public Optional<T> getSelected() {
        return selected.isPresent() ? ring.get(selected.getAsInt()) : Optional.empty();
    }

    /**
     * Returns the index of the selected element, if any.
     */
    public OptionalInt getSelectedIndex() {
        return selected;
    }

    /**
     * Returns {@code true} if no element is selected.
     */
    public boolean isNoneSelected() {
        return !selected.isPresent();
    }

    /**
     * Returns {@code true} if some element is selected.
     */
    public boolean isAnySelected() {
        return selected.isPresent();
    }

    /**
     * Returns {@code true} if the element at the normalized index is selected.
     */
    public boolean isSelectedAt(int index) {
        return selected.isPresent() && selected.getAsInt() == normalize(index);
    }

    /**
     * Returns {@code true} if the selected element matches the predicate.
     */
    public boolean isSelectedMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        return getSelected().filter(p).isPresent();
    }

    // Modification operations

    /**
     * Adds an element to the end of the ring. The focus is not changed.
     */
    public SelectRing<T> push(T x) {
        return withRing(ring.push(x));
    }

    /**
     * Adds the elements to the end of the ring. The focus is not changed.
     */
    public SelectRing<T> append(Iterable<? extends T> xs) {
        return withRing(ring.append(xs));
    }

    /**
     * Adds the elements to the front of the ring. Both the focus and the
     * selection are shifted to stay on the same elements.
     */
    public SelectRing<T> prepend(Iterable<? extends T> xs) {
        FocusRing<T> newRing = ring.prepend(xs);
        int shift = newRing.size() - ring.size();
        return selected.isPresent()
            ? new SelectRing<>(newRing, OptionalInt.of(selected.getAsInt() + shift))
            : new SelectRing<>(newRing, selected);
    }

    /**
     * Removes the element at the normalized index. The focus follows the
     * rules of {@link FocusRing#removeAt(int)}. The selection is cleared if
     * the selected element is removed, and shifted backwards if an element
     * before it is removed.
     */
    public SelectRing<T> removeAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("removeAt", this);

        int i = normalize(index);
        OptionalInt newSelected = selected;
        if (selected.isPresent()) {
            int s = selected.getAsInt();
            if (s == i) {
                newSelected = OptionalInt.empty();
            } else if (s > i) {
                newSelected = OptionalInt.of(s - 1);
            }
        }
        return new SelectRing<>(ring.removeAt(i), newSelected);
    }

    /**
     * Removes the first element.
     */
    public SelectRing<T> removeFirst() {
        return removeAt(0);
    }

    /**
     * Removes the last element.
     */
    public SelectRing<T> removeLast() {
        return removeAt(size() - 1);
    }

    /**
     * Removes the focused element.
     */
    public SelectRing<T> removeFocused() {
        return removeAt(getFocusedIndex());
    }

    /**
     * Removes the selected element, if any.
     */
    public SelectRing<T> removeSelected() {
        return selected.isPresent() ? removeAt(selected.getAsInt()) : this;
    }

    /**
     * Replaces the element at the normalized index. The focus is not changed.
     */
    public SelectRing<T> set(int index, T x) {
        return withRing(ring.set(index, x));
    }

    /**
     * Replaces the focused element.
     */
    public SelectRing<T> setFocused(T x) {
        return withRing(ring.setFocused(x));
    }

    /**
     * Replaces the selected element, if any.
     */
    public SelectRing<T> setSelected(T x) {
        Objects.requireNonNull(x);
        return selected.isPresent() ? set(selected.getAsInt(), x) : this;
    }

    // Focus operations

    /**
     * Moves the focus to the normalized index.
     */
    public SelectRing<T> focusOn(int index) {
        return withRing(ring.focusOn(index));
    }

    /**
     * Moves the focus one step forward, wrapping around to the first element.
     */
    public SelectRing<T> focusOnNext() {
        return withRing(ring.focusOnNext());
    }

    /**
     * Moves the focus one step backward, wrapping around to the last element.
     */
    public SelectRing<T> focusOnPrevious() {
        return withRing(ring.focusOnPrevious());
    }

    /**
     * Moves the focus to the first element.
     */
    public SelectRing<T> focusOnFirst() {
        return withRing(ring.focusOnFirst());
    }

    /**
     * Moves the focus to the last element.
     */
    public SelectRing<T> focusOnLast() {
        return withRing(ring.focusOnLast());
    }

    /**
     * Focus on the first element matching the predicate, or leave the ring
     * unchanged if there is none.
     */
    public SelectRing<T> focusOnFirstMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnFirstMatching(p));
    }

    /**
     * Focus on the last element matching the predicate, or leave the ring
     * unchanged if there is none.
     */
    public SelectRing<T> focusOnLastMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnLastMatching(p));
    }

    /**
     * @see FocusRing#focusOnNextMatching(Predicate)
     */
    public SelectRing<T> focusOnNextMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnNextMatching(p));
    }

    /**
     * @see FocusRing#focusOnPreviousMatching(Predicate)
     */
    public SelectRing<T> focusOnPreviousMatching(Predicate<? super T> p) {
        return withRing(ring.focusOnPreviousMatching(p));
    }

    // Selection operations

    /**
     * Selects the element at the normalized index, replacing any previous
     * selection.
     */
    public SelectRing<T> selectAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("selectAt", this);
        return withSelected(OptionalInt.of(normalize(index)));
    }

    /**
     * Selects the first element.
     */
    public SelectRing<T> selectFirst() {
        return selectAt(0);
    }

    /**
     * Selects the last element.
     */
    public SelectRing<T> selectLast() {
        return selectAt(size() - 1);
    }

    /**
     * Selects the focused element.
     */
    public SelectRing<T> selectFocused() {
        return selectAt(getFocusedIndex());
    }

    /**
     * Selects the first element matching the predicate, or leaves the selection
     * unchanged if there is none.
     */
    public SelectRing<T> selectFirstMatching(Predicate<? super T> p) {
        return selectAt(RingIndex.firstMatching(ring.toList(), Objects.requireNonNull(p)));
    }

    /**
     * Selects the last element matching the predicate, or leaves the selection
     * unchanged if there is none.
     */
    public SelectRing<T> selectLastMatching(Predicate<? super T> p) {
        return selectAt(RingIndex.lastMatching(ring.toList(), Objects.requireNonNull(p)));
    }

    private SelectRing<T> selectAt(OptionalInt index) {
        return index.isPresent() ? selectAt(index.getAsInt()) : this;
    }

    /**
     * Clears the selection.
     */
    public SelectRing<T> clearSelected() {
        return selected.isPresent() ? withSelected(OptionalInt.empty()) : this;
    }

    /**
     * Clears the selection if the element at the normalized index is the
     * selected one.
     */
    public SelectRing<T> deselectAt(int index) {
        return isSelectedAt(index) ? clearSelected() : this;
    }

    /**
     * Deselects the first element.
     */
    public SelectRing<T> deselectFirst() {
        return deselectAt(0);
    }

    /**
     * Deselects the last element.
     */
    public SelectRing<T> deselectLast() {
        return deselectAt(size() - 1);
    }

    /**
     * Deselects the focused element.
     */
    public SelectRing<T> deselectFocused() {
        return deselectAt(getFocusedIndex());
    }

    /**
     * Clears the selection if the selected element matches the predicate.
     */
    public SelectRing<T> deselectMatching(Predicate<? super T> p) {
        return isSelectedMatching(p) ? clearSelected() : this;
    }

    /**
     * Selects the element at the normalized index, or clears the selection if
     * it is already the selected one.
     */
    public SelectRing<T> toggleAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("toggleAt", this);
        return isSelectedAt(index) ? clearSelected() : selectAt(index);
    }

    /**
     * Toggles the selection of the first element.
     */
    public SelectRing<T> toggleFirst() {
        return toggleAt(0);
    }

    /**
     * Toggles the selection of the last element.
     */
    public SelectRing<T> toggleLast() {
        return toggleAt(size() - 1);
    }

    /**
     * Toggles the selection of the focused element.
     */
    public SelectRing<T> toggleFocused() {
        return toggleAt(getFocusedIndex());
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
    public <R> SelectRing<R> map(Function<? super T, ? extends R> f) {
        return new SelectRing<>(ring.map(f), selected);
    }

    /**
     * Apply the function to the focused element.
     */
    public <R> Optional<R> mapFocused(Function<? super T, ? extends R> f) {
        return ring.mapFocused(f);
    }

    /**
     * Apply the function to the selected element.
     */
    public <R> Optional<R> mapSelected(Function<? super T, ? extends R> f) {
        Objects.requireNonNull(f);
        return getSelected().map(f);
    }

    /**
     * Produce one value per element. The focused element is passed to
     * {@code focusedFn} even when it is also selected, the selected element
     * to {@code selectedFn}, and every other element to {@code basicFn}.
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
            } else if (selected.isPresent() && selected.getAsInt() == i) {
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
        return isEmpty() ? 0 : RingIndex.normalize(index, size());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof SelectRing))
            return false;

        SelectRing<?> other = (SelectRing<?>)obj;
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
