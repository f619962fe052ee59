/*
 * KeyRange.java
 *
 * This source file is part of the KeyScan open source project
 *
 * Copyright 2024 the KeyScan project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.keyscan.range;

import com.google.common.base.Verify;
import org.keyscan.KeyScanArgumentException;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Iterator;

/**
 * A single contiguous interval of keys, bounded by a lower and an upper {@link KeyBoundary}.
 *
 * <p>
 * There is no separate empty range: a range whose lower boundary lies above its upper boundary contains no keys,
 * and every operation here gives the right answer for such crossed ranges. The {@linkplain #openRange() open range}
 * contains every key. It is the identity of {@link #intersect} and absorbs everything under {@link #union}.
 * </p>
 *
 * <p>
 * Since a range can only describe one interval, {@link #union} returns the smallest interval enclosing both
 * operands. The union of {@code [1,1]} and {@code [9,9]} is {@code [1,9]}, which also contains {@code 2} through
 * {@code 8}. Ranges are meant to bound a scan whose results are filtered again, so a range may contain keys that
 * are not wanted but must never leave out a key that is.
 * </p>
 *
 * @param <T> the type of key values
 */
@API(API.Status.MAINTAINED)
public final class KeyRange<T extends Comparable<? super T>> {
    private static final KeyRange<?> OPEN = new KeyRange<String>(KeyBoundary.unbounded(), KeyBoundary.unbounded());

    @Nonnull
    private final KeyBoundary<T> lower;
    @Nonnull
    private final KeyBoundary<T> upper;

    public KeyRange(@Nonnull KeyBoundary<T> lower, @Nonnull KeyBoundary<T> upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Get the range of all keys.
     * @param <T> the type of key values
     * @return the open range
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T extends Comparable<? super T>> KeyRange<T> openRange() {
        return (KeyRange<T>)OPEN;
    }

    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> equalTo(@Nonnull T value) {
        final KeyBoundary<T> boundary = KeyBoundary.create(value, true);
        return new KeyRange<>(boundary, boundary);
    }

    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> lessThan(@Nonnull T value) {
        return new KeyRange<>(KeyBoundary.unbounded(), KeyBoundary.create(value, false));
    }

    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> lessThanOrEqualTo(@Nonnull T value) {
        return new KeyRange<>(KeyBoundary.unbounded(), KeyBoundary.create(value, true));
    }

    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> greaterThan(@Nonnull T value) {
        return new KeyRange<>(KeyBoundary.create(value, false), KeyBoundary.unbounded());
    }

    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> greaterThanOrEqualTo(@Nonnull T value) {
        return new KeyRange<>(KeyBoundary.create(value, true), KeyBoundary.unbounded());
    }

    /**
     * Get the range of all strings starting with a prefix.
     * @param domain the key domain, which must be a text domain
     * @param prefix the prefix
     * @param <T> the type of key values
     * @return a range from {@code prefix} inclusive to the prefix boundary of {@code prefix}
     * @throws UnsupportedKeyDomainException if {@code domain} is not a {@link TextKeyDomain}
     */
    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> prefixedBy(@Nonnull KeyDomain<T> domain, @Nonnull T prefix) {
        final KeyBoundary<T> upper = KeyBoundary.createPrefixBoundary(domain, prefix);
        return new KeyRange<>(KeyBoundary.create(prefix, true), upper);
    }

    @Nonnull
    public KeyBoundary<T> getLower() {
        return lower;
    }

    @Nonnull
    public KeyBoundary<T> getUpper() {
        return upper;
    }

    public boolean isOpen() {
        return lower.isUnbounded() && upper.isUnbounded();
    }

    /**
     * Whether this range contains no keys because its boundaries cross.
     * @return {@code true} if no key is in this range
     */
    public boolean isEmpty() {
        if (lower.isUnbounded() || upper.isUnbounded()) {
            return false;
        }
        final int cmp = Verify.verifyNotNull(lower.getComparand())
                .compareTo(Verify.verifyNotNull(upper.getComparand()));
        if (cmp != 0) {
            return cmp > 0;
        }
        return !(lower.isInclusiveAsLower() && upper.isInclusiveAsUpper());
    }

    /**
     * Whether this range contains exactly one key.
     * @return {@code true} if this range is {@code [v,v]} for some {@code v}
     */
    public boolean isEquality() {
        return lower.getEndpointType() == EndpointType.RANGE_INCLUSIVE &&
               upper.getEndpointType() == EndpointType.RANGE_INCLUSIVE &&
               Verify.verifyNotNull(lower.getValue()).compareTo(Verify.verifyNotNull(upper.getValue())) == 0;
    }

    /**
     * Whether a key lies within this range.
     * @param key the key
     * @return {@code true} if {@code key} is in this range
     */
    public boolean contains(@Nonnull T key) {
        if (key == null) {
            throw new KeyScanArgumentException("key ranges do not contain null keys", LogMessageKeys.KEY_RANGE, this);
        }
        return lower.admitsAsLower(key) && upper.admitsAsUpper(key);
    }

    /**
     * Intersect this range with another.
     * @param other the other range
     * @return the range of keys in both ranges, which is crossed if there are none
     */
    @Nonnull
    public KeyRange<T> intersect(@Nonnull KeyRange<T> other) {
        final KeyBoundary<T> newLower = KeyBoundary.compareLower(lower, other.lower) >= 0 ? lower : other.lower;
        final KeyBoundary<T> newUpper = KeyBoundary.compareUpper(upper, other.upper) <= 0 ? upper : other.upper;
        return new KeyRange<>(newLower, newUpper);
    }

    /**
     * Get the smallest range enclosing this range and another. This is not a set union: keys between two disjoint
     * operands are part of the result. An empty operand contributes nothing.
     * @param other the other range
     * @return a range containing every key of both ranges
     */
    @Nonnull
    public KeyRange<T> union(@Nonnull KeyRange<T> other) {
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        final KeyBoundary<T> newLower = KeyBoundary.compareLower(lower, other.lower) <= 0 ? lower : other.lower;
        final KeyBoundary<T> newUpper = KeyBoundary.compareUpper(upper, other.upper) >= 0 ? upper : other.upper;
        return new KeyRange<>(newLower, newUpper);
    }

    /**
     * Get a range containing every key not in this range. This is exact only for ranges bounded on one side, where
     * {@code (<,v)} becomes {@code [v,>)} and {@code (<,v]} becomes {@code (v,>)} and the other way around. The
     * complement of any other range is not a single interval, so the open range is returned.
     * @return a range containing the complement of this range
     */
    @Nonnull
    public KeyRange<T> invert() {
        if (lower.isUnbounded() && !upper.isUnbounded()) {
            final T comparand = Verify.verifyNotNull(upper.getComparand());
            return new KeyRange<>(KeyBoundary.create(comparand, !upper.isInclusiveAsUpper()), KeyBoundary.unbounded());
        }
        if (upper.isUnbounded() && !lower.isUnbounded()) {
            final T comparand = Verify.verifyNotNull(lower.getComparand());
            return new KeyRange<>(KeyBoundary.unbounded(), KeyBoundary.create(comparand, !lower.isInclusiveAsLower()));
        }
        return openRange();
    }

    /**
     * Intersect any number of ranges.
     * @param ranges the ranges
     * @param <T> the type of key values
     * @return the intersection of all of {@code ranges}, the open range if there are none
     */
    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> intersectAll(@Nonnull Iterable<KeyRange<T>> ranges) {
        KeyRange<T> result = openRange();
        for (KeyRange<T> range : ranges) {
            result = result.intersect(range);
        }
        return result;
    }

    /**
     * Get the smallest range enclosing any number of ranges.
     * @param ranges the ranges, at least one
     * @param <T> the type of key values
     * @return the union of all of {@code ranges}
     * @throws KeyScanArgumentException if there are no ranges
     */
    @Nonnull
    public static <T extends Comparable<? super T>> KeyRange<T> unionAll(@Nonnull Iterable<KeyRange<T>> ranges) {
        final Iterator<KeyRange<T>> iterator = ranges.iterator();
        if (!iterator.hasNext()) {
            throw new KeyScanArgumentException("cannot form the union of no key ranges");
        }
        KeyRange<T> result = iterator.next();
        while (iterator.hasNext()) {
            result = result.union(iterator.next());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final KeyRange<?> that = (KeyRange<?>)o;
        return lower.equals(that.lower) && upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return 31 * lower.hashCode() + upper.hashCode();
    }

    @Override
    public String toString() {
        return lower.toString(false) + "," + upper.toString(true);
    }
}
