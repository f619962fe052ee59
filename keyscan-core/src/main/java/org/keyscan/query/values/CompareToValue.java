/*
 * CompareToValue.java
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
import org.keyscan.annotation.API;
import org.keyscan.query.expressions.Comparisons;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The result of {@code receiver.compareTo(argument)}: an {@link Integer} that is negative, zero or positive. It is
 * {@code null} if either side is {@code null}.
 */
@API(API.Status.EXPERIMENTAL)
public class CompareToValue implements Value {
    @Nonnull
    private final Value receiver;
    @Nonnull
    private final Value argument;

    public CompareToValue(@Nonnull Value receiver, @Nonnull Value argument) {
        this.receiver = receiver;
        this.argument = argument;
    }

    @Nonnull
    public Value getReceiver() {
        return receiver;
    }

    @Nonnull
    public Value getArgument() {
        return argument;
    }

    @Nullable
    @Override
    public Object eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        final Object r = receiver.eval(record, context);
        final Object a = argument.eval(record, context);
        if (r == null || a == null) {
            return null;
        }
        return Comparisons.compare(r, a);
    }

    @Nonnull
    @Override
    public List<? extends Value> getChildren() {
        return ImmutableList.of(receiver, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final CompareToValue that = (CompareToValue)o;
        return receiver.equals(that.receiver) && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiver, argument);
    }

    @Override
    public String toString() {
        return receiver + ".compareTo(" + argument + ")";
    }
}
