/*
 * KeyBoundary.java
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

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One edge of a {@link KeyRange}: a key value that is either included or excluded, or no edge at all.
 *
 * <p>
 * A boundary does not know whether it is the lower or the upper edge of its range. The {@link #compareLower} and
 * {@link #compareUpper} orders interpret it for one side: an unbounded boundary is below every key as a lower
 * boundary and above every key as an upper boundary.
 * </p>
 *
 * <p>
 * A prefix boundary ({@link EndpointType#PREFIX_STRING}) is an exclusive upper boundary at the first string that
 * no longer starts with a given prefix. It keeps the prefix as its {@linkplain #getValue() value} and compares at
 * its {@linkplain #getComparand() comparand}, the successor computed by
 * {@link TextKeyDomain#prefixSuccessor(String)}.
 * </p>
 *
 * @param <T> the type of key values
 */
@API(API.Status.MAINTAINED)
public final class KeyBoundary<T extends Comparable<? super T>> {
    private static final KeyBoundary<?> UNBOUNDED = new KeyBoundary<>(null, null, EndpointType.UNBOUNDED);

    @Nullable
    private final T value;
    @Nullable
    private final T comparand;
    @Nonnull
    private final EndpointType endpointType;

    private KeyBoundary(@Nullable T value, @Nullable T comparand, @Nonnull EndpointType endpointType) {
        this.value = value;
        this.comparand = comparand;
        this.endpointType = endpointType;
    }

    /**
     * Create a boundary at the given value.
     * @param value the key value of the boundary
     * @param inclusive whether {@code value} itself is within the boundary
     * @param <T> the type of key values
     * @return a new boundary
     */
    @Nonnull
    public static <T extends Comparable<? super T>> KeyBoundary<T> create(@Nonnull T value, boolean inclusive) {
        return new KeyBoundary<>(Preconditions.checkNotNull(value), value,
                inclusive ? EndpointType.RANGE_INCLUSIVE : EndpointType.RANGE_EXCLUSIVE);
    }

    /**
     * Create the exclusive upper boundary just past all strings that start with {@code prefix}.
     * @param domain the key domain, which must be a text domain
     * @param prefix the prefix
     * @param <T> the type of key values
     * @return a prefix boundary, or an unbounded boundary if no string is greater than all strings with the prefix
     * @throws UnsupportedKeyDomainException if {@code domain} is not a {@link TextKeyDomain}
     */
    @Nonnull
    public static <T extends Comparable<? super T>> KeyBoundary<T> createPrefixBoundary(@Nonnull KeyDomain<T> domain,
                                                                                         @Nonnull T prefix) {
        if (!domain.isText()) {
            throw new UnsupportedKeyDomainException("prefix boundaries require a text key domain",
                    LogMessageKeys.KEY_TYPE, domain.getKeyType().getName(),
                    LogMessageKeys.PREFIX, prefix);
        }
        final String successor = domain.asText().prefixSuccessor((String)prefix);
        if (successor == null) {
            return unbounded();
        }
        return new KeyBoundary<>(prefix, domain.getKeyType().cast(successor), EndpointType.PREFIX_STRING);
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T extends Comparable<? super T>> KeyBoundary<T> unbounded() {
        return (KeyBoundary<T>)UNBOUNDED;
    }

    /**
     * The value this boundary was created from. For a prefix boundary this is the prefix.
     * @return the value or {@code null} if unbounded
     */
    @Nullable
    public T getValue() {
        return value;
    }

    /**
     * The value keys are compared against. For a prefix boundary this is the successor of the prefix, otherwise it
     * is the same as {@link #getValue()}.
     * @return the comparand or {@code null} if unbounded
     */
    @Nullable
    public T getComparand() {
        return comparand;
    }

    @Nonnull
    public EndpointType getEndpointType() {
        return endpointType;
    }

    public boolean isUnbounded() {
        return endpointType == EndpointType.UNBOUNDED;
    }

    public boolean isPrefix() {
        return endpointType == EndpointType.PREFIX_STRING;
    }

    /**
     * Whether the comparand itself is admitted when this is the lower boundary. A prefix boundary used as a lower
     * boundary starts at the successor of its prefix, so it includes its comparand.
     * @return whether the comparand is admitted
     */
    public boolean isInclusiveAsLower() {
        return endpointType == EndpointType.RANGE_INCLUSIVE || endpointType == EndpointType.PREFIX_STRING;
    }

    /**
     * Whether the comparand itself is admitted when this is the upper boundary.
     * @return whether the comparand is admitted
     */
    public boolean isInclusiveAsUpper() {
        return endpointType == EndpointType.RANGE_INCLUSIVE;
    }

    /**
     * Whether a key lies on the inner side of this boundary when it is a lower boundary.
     * @param key the key
     * @return {@code true} if {@code key} is not below this boundary
     */
    public boolean admitsAsLower(@Nonnull T key) {
        if (isUnbounded()) {
            return true;
        }
        final int cmp = key.compareTo(Verify.verifyNotNull(comparand));
        return cmp > 0 || (cmp == 0 && isInclusiveAsLower());
    }

    /**
     * Whether a key lies on the inner side of this boundary when it is an upper boundary.
     * @param key the key
     * @return {@code true} if {@code key} is not above this boundary
     */
    public boolean admitsAsUpper(@Nonnull T key) {
        if (isUnbounded()) {
            return true;
        }
        final int cmp = key.compareTo(Verify.verifyNotNull(comparand));
        return cmp < 0 || (cmp == 0 && isInclusiveAsUpper());
    }

    /**
     * Order two boundaries as lower boundaries. Unbounded is the least; at the same comparand an inclusive boundary
     * is less than an exclusive one, since it admits more keys.
     * @param a the first boundary
     * @param b the second boundary
     * @param <T> the type of key values
     * @return a negative number, zero or a positive number as {@code a} is less than, equivalent to, or greater than {@code b}
     */
    public static <T extends Comparable<? super T>> int compareLower(@Nonnull KeyBoundary<T> a, @Nonnull KeyBoundary<T> b) {
        if (a.isUnbounded() || b.isUnbounded()) {
            return Boolean.compare(!a.isUnbounded(), !b.isUnbounded());
        }
        final int cmp = Verify.verifyNotNull(a.comparand).compareTo(Verify.verifyNotNull(b.comparand));
        if (cmp != 0) {
            return cmp;
        }
        return Boolean.compare(!a.isInclusiveAsLower(), !b.isInclusiveAsLower());
    }

    /**
     * Order two boundaries as upper boundaries. Unbounded is the greatest; at the same comparand an exclusive
     * boundary is less than an inclusive one.
     * @param a the first boundary
     * @param b the second boundary
     * @param <T> the type of key values
     * @return a negative number, zero or a positive number as {@code a} is less than, equivalent to, or greater than {@code b}
     */
    public static <T extends Comparable<? super T>> int compareUpper(@Nonnull KeyBoundary<T> a, @Nonnull KeyBoundary<T> b) {
        if (a.isUnbounded() || b.isUnbounded()) {
            return Boolean.compare(a.isUnbounded(), b.isUnbounded());
        }
        final int cmp = Verify.verifyNotNull(a.comparand).compareTo(Verify.verifyNotNull(b.comparand));
        if (cmp != 0) {
            return cmp;
        }
        return Boolean.compare(a.isInclusiveAsUpper(), b.isInclusiveAsUpper());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final KeyBoundary<?> that = (KeyBoundary<?>)o;
        return endpointType == that.endpointType &&
               Objects.equals(value, that.value) &&
               Objects.equals(comparand, that.comparand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, comparand, endpointType);
    }

    /**
     * Render this boundary as it would appear on the given side of a range.
     * @param high whether this is the upper boundary
     * @return the string form of this boundary
     */
    @Nonnull
    public String toString(boolean high) {
        final String valueString = value == null ? "" : value.toString();
        return high ? valueString + endpointType.toString(true) : endpointType.toString(false) + valueString;
    }

    @Override
    public String toString() {
        return toString(false);
    }
}
