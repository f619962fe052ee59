/*
 * ComparisonPredicate.java
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

package org.keyscan.query.predicates;

import org.keyscan.EvaluationContext;
import org.keyscan.annotation.API;
import org.keyscan.query.expressions.Comparisons;
import org.keyscan.query.values.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A predicate relating two values with a binary comparison operator, such as {@code $.k < 5}.
 */
@API(API.Status.EXPERIMENTAL)
public class ComparisonPredicate implements QueryPredicate {
    @Nonnull
    private final Value left;
    @Nonnull
    private final Comparisons.Type type;
    @Nonnull
    private final Value right;

    public ComparisonPredicate(@Nonnull Value left, @Nonnull Comparisons.Type type, @Nonnull Value right) {
        this.left = left;
        this.type = type;
        this.right = right;
    }

    @Nonnull
    public Value getLeft() {
        return left;
    }

    @Nonnull
    public Comparisons.Type getType() {
        return type;
    }

    @Nonnull
    public Value getRight() {
        return right;
    }

    @Nullable
    @Override
    public Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        return Comparisons.evalComparison(type, left.eval(record, context), right.eval(record, context));
    }

    @Nonnull
    @Override
    public List<QueryPredicate> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ComparisonPredicate that = (ComparisonPredicate)o;
        return type == that.type && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, type, right);
    }

    @Override
    public String toString() {
        return left + " " + type.getSymbol() + " " + right;
    }
}
