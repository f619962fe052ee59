/*
 * QueryPredicate.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A boolean filter over a single input record.
 *
 * <p>
 * Evaluation uses three-valued logic: {@code null} means the outcome is unknown, which happens when a compared value
 * is missing. A scan keeps a record only if its predicate evaluates to {@link Boolean#TRUE}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface QueryPredicate {

    /**
     * Evaluate this predicate against a record.
     * @param record the input record
     * @param context context holding the parameter bindings
     * @return {@code TRUE}, {@code FALSE} or {@code null} for unknown
     */
    @Nullable
    Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context);

    /**
     * The predicates this predicate combines. Leaf predicates have none.
     * @return the child predicates
     */
    @Nonnull
    List<? extends QueryPredicate> getChildren();

    /**
     * Whether a record satisfies this predicate.
     * @param record the input record
     * @param context context holding the parameter bindings
     * @return {@code true} if the predicate evaluates to {@code TRUE}
     */
    default boolean test(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        return Boolean.TRUE.equals(eval(record, context));
    }
}
