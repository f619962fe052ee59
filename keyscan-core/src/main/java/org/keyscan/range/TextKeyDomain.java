/*
 * TextKeyDomain.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The domain of string keys, ordered by {@link String#compareTo(String)}, that is by UTF-16 code unit.
 */
@API(API.Status.MAINTAINED)
public final class TextKeyDomain extends KeyDomain<String> {
    static final TextKeyDomain INSTANCE = new TextKeyDomain();

    private TextKeyDomain() {
        super(String.class);
    }

    /**
     * Compute the smallest string that is greater than every string starting with {@code prefix}.
     *
     * <p>
     * Trailing {@code U+FFFF} units cannot be incremented, so they are dropped first and the last remaining unit is
     * incremented. For example {@code "ab"} yields {@code "ac"} and {@code "a" + U+FFFF} yields {@code "b"}.
     * </p>
     *
     * @param prefix the prefix
     * @return the successor of all strings with the prefix, or {@code null} if there is none, which is the case for
     * the empty prefix and for prefixes made up only of {@code U+FFFF}
     */
    @Nullable
    public String prefixSuccessor(@Nonnull String prefix) {
        int end = prefix.length();
        while (end > 0 && prefix.charAt(end - 1) == Character.MAX_VALUE) {
            end--;
        }
        if (end == 0) {
            return null;
        }
        final StringBuilder successor = new StringBuilder(end);
        successor.append(prefix, 0, end - 1);
        successor.append((char)(prefix.charAt(end - 1) + 1));
        return successor.toString();
    }

    @Override
    public boolean isText() {
        return true;
    }

    @Nonnull
    @Override
    public TextKeyDomain asText() {
        return this;
    }
}
