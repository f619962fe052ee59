/*
 * Value.java
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

import org.keyscan.EvaluationContext;
import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A scalar value computed from the input record, from parameters and from constants.
 *
 * <p>
 * The set of values is closed: {@link InputValue}, {@link FieldValue}, {@link LiteralValue}, {@link ParameterValue},
 * {@link ArithmeticValue}, {@link CompareToValue} and {@link CompareValue}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface Value {

    /**
     * Evaluate this value.
     * @param record the input record, a map from field name to field value
     * @param context context holding the parameter bindings
     * @return the value, {@code null} if it is missing or unknown
     */
    @Nullable
    Object eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context);

    /**
     * The values this value is computed from.
     * @return the children of this value
     */
    @Nonnull
    List<? extends Value> getChildren();

    /**
     * Whether this value depends on the input record. A value that does not can be computed before any record is
     * seen.
     * @return {@code true} if this value or any of its children reads the input record
     */
    default boolean isCorrelatedToInput() {
        for (Value child : getChildren()) {
            if (child.isCorrelatedToInput()) {
                return true;
            }
        }
        return false;
    }
}
