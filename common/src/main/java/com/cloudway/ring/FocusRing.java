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
 * An immutable ring of elements with a single focused element.
 *
 * <p>Navigation wraps around at both ends: the element after the last one
 * is the first one, and the element before the first one is the last one.
 * Every index argument is normalized into the range of the ring, so no
 * index is ever out of bounds. Operations on an empty ring leave it
 * unchanged and accessors return an empty {@code Optional}.</p>
 *
 * <p>Elements must not be {@code null}.</p>
 *
 * @param <T> the type of ring elements
 */
public final class FocusRing<T> implements Iterable<T> {
    private static final FocusRing<?> EMPTY = new FocusRing<>(ImmutableList.of(), 0);

    private final ImmutableList<T> elements;
    private final int focused;

    private FocusRing(ImmutableList<T> elements, int focused) {
        this.elements = elements;
        this.focused = focused;
    }

    // Construction

    /**
     * Returns an empty ring.
     */
    @SuppressWarnings("unchecked")
    public static <T> FocusRing<T> empty() {
        return (FocusRing<T>)EMPTY;
    }

    /**
     * Returns a ring containing a single focused element.
     */
    public static <T> FocusRing<T> singleton(T x) {
        return new FocusRing<>(ImmutableList.of(x), 0);
    }

    /**
     * Returns a ring containing the given elements, focused on the first one.
     */
    public static <T> FocusRing<T> fromList(Iterable<? extends T> items) {
        return new FocusRing<>(ImmutableList.copyOf(items), 0);
    }

    /**
     * Returns a ring containing the given elements, focused on the first one.
     */
    @SafeVarargs
    public static <T> FocusRing<T> fromArray(T... items) {
        return fromList(Arrays.asList(items));
    }

    // Query operations

    /**
     * Returns {@code true} if the ring has no elements.
     */
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns the number of elements in the ring.
     */
    public int size() {
        return elements.size();
    }

    /**
     * Returns the element at the normalized index, or empty if the ring is empty.
     */
    public Optional<T> get(int index) {
        return isEmpty() ? Optional.empty() : Optional.of(elements.get(normalize(index)));
    }

    /**
     * Returns the first element, or empty if the ring is empty.
     */
    public Optional<T> getFirst() {
        return get(0);
    }

    /**
     * Returns the last element, or empty if the ring is empty.
     */
    public Optional<T> getLast() {
        return get(size() - 1);
    }

    /**
     * Returns the focused element, or empty if the ring is empty.
     */
    public Optional<T> getFocused() {
        return get(focused);
    }

    /**
     * Returns the index of the focused element, 0 for an empty ring.
     */
    public int getFocusedIndex() {
        return focused;
    }

    /**
     * Returns {@code true} if the element at the normalized index is focused.
     */
    public boolean isFocusedAt(int index) {
        return !isEmpty() && normalize(index) == focused;
    }

    /**
     * Returns {@code true} if the focused element matches the predicate.
     */
    public boolean isFocusedMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        return getFocused().filter(p).isPresent();
    }

    // Modification operations

    /**
     * Adds an element to the end of the ring. The focus is not changed.
     */
    public FocusRing<T> push(T x) {
        return new FocusRing<>(RingIndex.concat(elements, ImmutableList.of(x)), focused);
    }

    /**
     * Adds the elements to the end of the ring. The focus is not changed.
     */
    public FocusRing<T> append(Iterable<? extends T> xs) {
        return new FocusRing<>(RingIndex.concat(elements, ImmutableList.copyOf(xs)), focused);
    }

    /**
     * Adds the elements to the front of the ring. The focus index is shifted
     * so that the same element stays focused.
     */
    public FocusRing<T> prepend(Iterable<? extends T> xs) {
        ImmutableList<T> front = ImmutableList.copyOf(xs);
        if (isEmpty())
            return new FocusRing<>(front, 0);
        return new FocusRing<>(RingIndex.concat(front, elements), focused + front.size());
    }

    /**
     * Removes the element at the normalized index.
     *
     * <p>If the removed element was the last one the focus moves one step
     * backwards. Otherwise the focus index is kept as is, which means that
     * removing an element before the focus shifts the focus onto the next
     * element. A focus on the last element is kept on the last element.</p>
     */
    public FocusRing<T> removeAt(int index) {
        if (isEmpty())
            return RingIndex.ignored("removeAt", this);
        int i = normalize(index);
        return new FocusRing<>(RingIndex.removeAt(elements, i),
                               RingIndex.focusAfterRemoval(focused, i, size()));
    }

    /**
     * Removes the first element.
     */
    public FocusRing<T> removeFirst() {
        return removeAt(0);
    }

    /**
     * Removes the last element.
     */
    public FocusRing<T> removeLast() {
        return removeAt(size() - 1);
    }

    /**
     * Removes the focused element.
     */
    public FocusRing<T> removeFocused() {
        return removeAt(focused);
    }

    /**
     * Replaces the element at the normalized index. The focus is not changed.
     */
    public FocusRing<T> set(int index, T x) {
        Objects.requireNonNull(x);
        if (isEmpty())
            return RingIndex.ignored("set", this);
        return new FocusRing<>(RingIndex.replaceAt(elements, normalize(index), x), focused);
    }

    /**
     * Replaces the focused element.
     */
    public FocusRing<T> setFocused(T x) {
        return set(focused, x);
    }

    // Focus operations

    /**
     * Moves the focus to the normalized index.
     */
    public FocusRing<T> focusOn(int index) {
        if (isEmpty())
            return RingIndex.ignored("focusOn", this);
        return new FocusRing<>(elements, normalize(index));
    }

    /**
     * Moves the focus one step forward, wrapping around to the first element.
     */
    public FocusRing<T> focusOnNext() {
        return focusOn(focused + 1);
    }

    /**
     * Moves the focus one step backward, wrapping around to the last element.
     */
    public FocusRing<T> focusOnPrevious() {
        return focusOn(focused - 1);
    }

    /**
     * Moves the focus to the first element.
     */
    public FocusRing<T> focusOnFirst() {
        return focusOn(0);
    }

    /**
     * Moves the focus to the last element.
     */
    public FocusRing<T> focusOnLast() {
        return focusOn(size() - 1);
    }

    /**
     * Focus on the first element matching the predicate, or leave the ring
     * unchanged if there is none.
     */
    public FocusRing<T> focusOnFirstMatching(Predicate<? super T> p) {
        return focusOn(RingIndex.firstMatching(elements, Objects.requireNonNull(p)));
    }

    /**
     * Focus on the last element matching the predicate, or leave the ring
     * unchanged if there is none.
     */
    public FocusRing<T> focusOnLastMatching(Predicate<? super T> p) {
        return focusOn(RingIndex.lastMatching(elements, Objects.requireNonNull(p)));
    }

    /**
     * Focus on the nearest matching element after the focus. When nothing
     * after the focus matches the search wraps around to the start and ends
     * at the focused element itself.
     */
    public FocusRing<T> focusOnNextMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        if (isEmpty())
            return RingIndex.ignored("focusOnNextMatching", this);
        return focusOn(RingIndex.nextMatching(elements, focused, p));
    }

    /**
     * Focus on the nearest matching element searching backwards from the
     * focused element, which is considered first. When nothing matches the
     * search wraps around to the end and stops just after the focus.
     */
    public FocusRing<T> focusOnPreviousMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        if (isEmpty())
            return RingIndex.ignored("focusOnPreviousMatching", this);
        return focusOn(RingIndex.previousMatching(elements, focused, p));
    }

    private FocusRing<T> focusOn(OptionalInt index) {
        return index.isPresent() ? focusOn(index.getAsInt()) : this;
    }

    // Conversions

    /**
     * Returns the elements in ring order.
     */
    public ImmutableList<T> toList() {
        return elements;
    }

    /**
     * Returns the elements in ring order as an array.
     */
    public Object[] toArray() {
        return elements.toArray();
    }

    /**
     * Returns the elements in ring order as an array.
     */
    public T[] toArray(IntFunction<T[]> generator) {
        return elements.stream().toArray(generator);
    }

    /**
     * Transform every element, keeping the focus.
     */
    public <R> FocusRing<R> map(Function<? super T, ? extends R> f) {
        Objects.requireNonNull(f);
        return new FocusRing<>(elements.stream().map(f).collect(ImmutableList.toImmutableList()), focused);
    }

    /**
     * Apply the function to the focused element.
     */
    public <R> Optional<R> mapFocused(Function<? super T, ? extends R> f) {
        Objects.requireNonNull(f);
        return getFocused().map(f);
    }

    /**
     * Produce one value per element, applying {@code focusedFn} to the focused
     * element and {@code basicFn} to every other one.
     */
    public <R> ImmutableList<R> mapEachIntoList(Function<? super T, ? extends R> basicFn,
                                                Function<? super T, ? extends R> focusedFn) {
        Objects.requireNonNull(basicFn);
        Objects.requireNonNull(focusedFn);
        ImmutableList.Builder<R> result = ImmutableList.builder();
        for (int i = 0; i < elements.size(); i++) {
            T x = elements.get(i);
            result.add(i == focused ? focusedFn.apply(x) : basicFn.apply(x));
        }
        return result.build();
    }

    /**
     * Like {@code mapEachIntoList} but collects the results into an array.
     */
    public <R> R[] mapEachIntoArray(Function<? super T, ? extends R> basicFn,
                                    Function<? super T, ? extends R> focusedFn,
                                    IntFunction<R[]> generator) {
        return mapEachIntoList(basicFn, focusedFn).stream().toArray(generator);
    }

    @Override
    public Iterator<T> iterator() {
        return elements.iterator();
    }

    /**
     * Returns a sequential stream over the elements in ring order.
     */
    public Stream<T> stream() {
        return elements.stream();
    }

    private int normalize(int index) {
        return RingIndex.normalize(index, elements.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof FocusRing))
            return false;

        FocusRing<?> other = (FocusRing<?>)obj;
        return focused == other.focused && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return 31 * elements.hashCode() + focused;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("elements", elements)
            .add("focused", focused)
            .toString();
    }
}
