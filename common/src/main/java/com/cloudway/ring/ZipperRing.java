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
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A non-empty focus ring represented as a zipper: the elements before the
 * focus (nearest first), the focused element, and the elements after the
 * focus. Stepping the focus is O(1), jumping to either end is O(n).
 *
 * <p>Unlike {@link FocusRing} there is no indexed access, no removal and
 * no selection. A zipper ring can never be empty.</p>
 *
 * @param <T> the type of ring elements
 */
public final class ZipperRing<T> implements Iterable<T> {
    private final Chain<T> left;
    private final T focused;
    private final Chain<T> right;

    private ZipperRing(Chain<T> left, T focused, Chain<T> right) {
        this.left = left;
        this.focused = Objects.requireNonNull(focused);
        this.right = right;
    }

    // Construction

    public static <T> ZipperRing<T> singleton(T x) {
        return new ZipperRing<>(Chain.nil(), x, Chain.nil());
    }

    /**
     * Returns a ring focused on the first of the given elements, or empty if
     * there are no elements.
     */
    public static <T> Optional<ZipperRing<T>> fromList(Iterable<? extends T> items) {
        Iterator<? extends T> it = items.iterator();
        if (!it.hasNext())
            return Optional.empty();

        T first = it.next();
        ImmutableList.Builder<T> rest = ImmutableList.builder();
        it.forEachRemaining(rest::add);
        return Optional.of(new ZipperRing<T>(Chain.nil(), first, Chain.fromList(rest.build())));
    }

    @SafeVarargs
    public static <T> Optional<ZipperRing<T>> fromArray(T... items) {
        return fromList(Arrays.asList(items));
    }

    /**
     * Like {@link #fromList(Iterable)} but falls back to a singleton ring
     * holding the default element when there are no elements.
     */
    public static <T> ZipperRing<T> fromListWithDefault(T deflt, Iterable<? extends T> items) {
        Objects.requireNonNull(deflt);
        return ZipperRing.<T>fromList(items).orElseGet(() -> singleton(deflt));
    }

    // Query operations

    public int size() {
        return left.size() + 1 + right.size();
    }

    public T getFocused() {
        return focused;
    }

    /**
     * Returns the position of the focused element in ring order.
     */
    public int getFocusedIndex() {
        return left.size();
    }

    public boolean isFocusedMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        return p.test(focused);
    }

    // Modification operations

    /**
     * Adds an element to the end of the ring. The focus is not changed.
     */
    public ZipperRing<T> push(T x) {
        return new ZipperRing<>(left, focused, right.append(Chain.of(x)));
    }

    /**
     * Adds the elements to the end of the ring. The focus is not changed.
     */
    public ZipperRing<T> append(Iterable<? extends T> xs) {
        return new ZipperRing<>(left, focused, right.append(Chain.fromList(xs)));
    }

    /**
     * Adds an element to the front of the ring. The focus is not changed.
     */
    public ZipperRing<T> prepend(T x) {
        return new ZipperRing<>(left.append(Chain.of(x)), focused, right);
    }

    public ZipperRing<T> setFocused(T x) {
        return new ZipperRing<>(left, x, right);
    }

    // Focus operations

    public ZipperRing<T> focusOnFirst() {
        if (left.isEmpty())
            return this;
        return new ZipperRing<>(Chain.nil(), left.last(),
                                left.init().reverse().append(Chain.cons(focused, right)));
    }

    public ZipperRing<T> focusOnLast() {
        if (right.isEmpty())
            return this;
        return new ZipperRing<>(right.init().reverse().append(Chain.cons(focused, left)),
                                right.last(), Chain.nil());
    }

    /**
     * Moves the focus one step forward, wrapping around to the first element.
     */
    public ZipperRing<T> focusOnNext() {
        if (right.isEmpty())
            return focusOnFirst();
        return new ZipperRing<>(Chain.cons(focused, left), right.head(), right.tail());
    }

    /**
     * Moves the focus one step backward, wrapping around to the last element.
     */
    public ZipperRing<T> focusOnPrevious() {
        if (left.isEmpty())
            return focusOnLast();
        return new ZipperRing<>(left.tail(), left.head(), Chain.cons(focused, right));
    }

    /**
     * Focus on the first element matching the predicate.
     */
    public Optional<ZipperRing<T>> focusOnFirstMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        ZipperRing<T> z = focusOnFirst();
        for (int n = size(); n > 0; n--) {
            if (p.test(z.focused))
                return Optional.of(z);
            z = z.focusOnNext();
        }
        return Optional.empty();
    }

    /**
     * Focus on the last element matching the predicate.
     */
    public Optional<ZipperRing<T>> focusOnLastMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        ZipperRing<T> z = focusOnLast();
        for (int n = size(); n > 0; n--) {
            if (p.test(z.focused))
                return Optional.of(z);
            z = z.focusOnPrevious();
        }
        return Optional.empty();
    }

    /**
     * Focus on the nearest matching element after the focus, wrapping around.
     * The currently focused element is never a candidate.
     */
    public Optional<ZipperRing<T>> focusOnNextMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        // the whole zipper is compared, equal values elsewhere do not stop the search
        for (ZipperRing<T> z = focusOnNext(); !z.equals(this); z = z.focusOnNext()) {
            if (p.test(z.focused))
                return Optional.of(z);
        }
        return Optional.empty();
    }

    /**
     * Focus on the nearest matching element before the focus, wrapping around.
     * The currently focused element is never a candidate.
     */
    public Optional<ZipperRing<T>> focusOnPreviousMatching(Predicate<? super T> p) {
        Objects.requireNonNull(p);
        for (ZipperRing<T> z = focusOnPrevious(); !z.equals(this); z = z.focusOnPrevious()) {
            if (p.test(z.focused))
                return Optional.of(z);
        }
        return Optional.empty();
    }

    // Conversions

    /**
     * Returns the elements in ring order.
     */
    public ImmutableList<T> toList() {
        return ImmutableList.<T>builder()
            .addAll(left.reverse())
            .add(focused)
            .addAll(right)
            .build();
    }

    public <R> ZipperRing<R> map(Function<? super T, ? extends R> f) {
        Objects.requireNonNull(f);
        return new ZipperRing<R>(left.map(f), f.apply(focused), right.map(f));
    }

    /**
     * Transform the focused element only.
     */
    public ZipperRing<T> mapFocused(UnaryOperator<T> f) {
        Objects.requireNonNull(f);
        return setFocused(f.apply(focused));
    }

    @Override
    public Iterator<T> iterator() {
        return toList().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof ZipperRing))
            return false;

        ZipperRing<?> other = (ZipperRing<?>)obj;
        return focused.equals(other.focused)
            && left.equals(other.left)
            && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, focused, right);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("left", left)
            .add("focused", focused)
            .add("right", right)
            .toString();
    }
}
