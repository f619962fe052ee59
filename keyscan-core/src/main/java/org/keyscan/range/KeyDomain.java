/*
 * KeyDomain.java
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

import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * An ordered domain of key values. The order is the natural order of {@code T}, which must be total and consistent
 * with the order of the index being scanned.
 *
 * <p>
 * String keys use the {@link TextKeyDomain} subclass, which adds what only makes sense for text: prefix boundaries
 * and the string comparison idioms. Everything else only needs this class.
 * </p>
 *
 * @param <T> the type of key values
 */
@API(API.Status.MAINTAINED)
public class KeyDomain<T extends Comparable<? super T>> {
    @Nonnull
    private final Class<T> keyType;

    protected KeyDomain(@Nonnull Class<T> keyType) {
        this.keyType = keyType;
    }

    /**
     * Get the domain of the given key type. {@code String.class} yields the {@link TextKeyDomain}.
     * @param keyType the class of key values
     * @param <T> the type of key values
     * @return the domain of {@code keyType}
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T extends Comparable<? super T>> KeyDomain<T> of(@Nonnull Class<T> keyType) {
        if (keyType == String.class) {
            return (KeyDomain<T>)(KeyDomain<?>)text();
        }
        return new KeyDomain<>(keyType);
    }

    @Nonnull
    public static TextKeyDomain text() {
        return TextKeyDomain.INSTANCE;
    }

    @Nonnull
    public Class<T> getKeyType() {
        return keyType;
    }

    /**
     * Convert an arbitrary object into a key value of this domain.
     * @param value a candidate value
     * @return the value as a key, or empty if {@code value} is {@code null} or not of the key type
     */
    @Nonnull
    public Optional<T> asKey(@Nullable Object value) {
        if (keyType.isInstance(value)) {
            return Optional.of(keyType.cast(value));
        }
        return Optional.empty();
    }

    /**
     * Whether this domain supports the text operations of {@link TextKeyDomain}.
     * @return {@code true} for string keys
     */
    public boolean isText() {
        return false;
    }

    /**
     * Get this domain as a text domain.
     * @return this domain
     * @throws UnsupportedKeyDomainException if this is not a text domain
     */
    @Nonnull
    public TextKeyDomain asText() {
        throw new UnsupportedKeyDomainException("key domain does not support text operations",
                LogMessageKeys.KEY_TYPE, keyType.getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return keyType.equals(((KeyDomain<?>)o).keyType);
    }

    @Override
    public int hashCode() {
        return keyType.hashCode();
    }

    @Override
    public String toString() {
        return "KeyDomain(" + keyType.getSimpleName() + ")";
    }
}
