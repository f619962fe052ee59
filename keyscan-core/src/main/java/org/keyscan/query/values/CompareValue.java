/*
 * CompareValue.java
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

package org.keyscan.query.values;

import com.google.common.collect.ImmutableList;
import org.keyscan.EvaluationContext;
import org.keyscan.KeyScanException;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The result of the two-argument string comparison {@code compare(left, right)}, using the ordinal order of
 * {@link String#compareTo(String)}. It is {@code null} if either side is {@code null}.
 */
@API(API.Status.EXPERIMENTAL)
public class CompareValue implements Value {
    @Nonnull
    private final Value left;
    @Nonnull
    private final Value right;

    public CompareValue(@Nonnull Value left, @Nonnull Value right) {
        this.left = left;
        this.right = right;
    }

    @Nonnull
    public Value getLeft() {
        return left;
    }

    @Nonnull
    public Value getRight() {
        return right;
    }

    @Nullable
    @Override
    public Object eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        final Object l = left.eval(record, context);
        final Object r = right.eval(record, context);
        if (l == null || r == null) {
            return null;
        }
        return asString(l).compareTo(asString(r));
    }

    @Nonnull
    private static String asString(@Nonnull Object operand) {
        if (operand instanceof String) {
            return (String)operand;
        }
        throw new KeyScanException("string comparison of a value that is not a string",
                LogMessageKeys.VALUE_TYPE, operand.getClass().getName());
    }

    @Nonnull
    @Override
    public List<? extends Value> getChildren() {
        return ImmutableList.of(left, right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final CompareValue that = (CompareValue)o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "compare(" + left + ", " + right + ")";
    }
}
