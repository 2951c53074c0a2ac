/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.ring;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * A strict persistent cons list with O(1) cons, head and tail. Only used
 * as the two halves of a {@link ZipperRing}.
 *
 * @param <T> the type of list elements
 */
final class Chain<T> implements Iterable<T> {
    private static final Chain<?> NIL = new Chain<>(null, null, 0);

    private final T head;
    private final Chain<T> tail;
    private final int size;

    private Chain(T head, Chain<T> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    static <T> Chain<T> nil() {
        return (Chain<T>)NIL;
    }

    static <T> Chain<T> cons(T head, Chain<T> tail) {
        return new Chain<>(Objects.requireNonNull(head), tail, tail.size + 1);
    }

    static <T> Chain<T> of(T x) {
        return cons(x, nil());
    }

    /**
     * Construct a chain holding the elements in iteration order.
     */
    static <T> Chain<T> fromList(Iterable<? extends T> xs) {
        Chain<T> reversed = nil();
        for (T x : xs) {
            reversed = cons(x, reversed);
        }
        return reversed.reverse();
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    T head() {
        if (isEmpty())
            throw new NoSuchElementException();
        return head;
    }

    Chain<T> tail() {
        if (isEmpty())
            throw new NoSuchElementException();
        return tail;
    }

    T last() {
        Chain<T> c = this;
        while (c.tail().size > 0)
            c = c.tail;
        return c.head;
    }

    /**
     * Returns all elements except the last one.
     */
    Chain<T> init() {
        if (isEmpty())
            throw new NoSuchElementException();
        Chain<T> reversed = nil();
        for (Chain<T> c = this; c.size > 1; c = c.tail) {
            reversed = cons(c.head, reversed);
        }
        return reversed.reverse();
    }

    Chain<T> reverse() {
        Chain<T> result = nil();
        for (Chain<T> c = this; !c.isEmpty(); c = c.tail) {
            result = cons(c.head, result);
        }
        return result;
    }

    /**
     * Returns this chain followed by the other one. O(n) in the length of
     * this chain, the other chain is shared.
     */
    Chain<T> append(Chain<T> other) {
        Chain<T> result = other;
        for (Chain<T> c = reverse(); !c.isEmpty(); c = c.tail) {
            result = cons(c.head, result);
        }
        return result;
    }

    <R> Chain<R> map(Function<? super T, ? extends R> f) {
        Chain<R> reversed = nil();
        for (Chain<T> c = this; !c.isEmpty(); c = c.tail) {
            reversed = cons(f.apply(c.head), reversed);
        }
        return reversed.reverse();
    }

    ImmutableList<T> toList() {
        return ImmutableList.copyOf(this);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            Chain<T> current = Chain.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public T next() {
                T x = current.head();
                current = current.tail;
                return x;
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Chain))
            return false;

        Chain<?> a = this, b = (Chain<?>)obj;
        if (a.size != b.size)
            return false;
        for (; !a.isEmpty(); a = a.tail, b = b.tail) {
            if (!a.head.equals(b.head))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (T x : this) {
            hash = 31 * hash + x.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
