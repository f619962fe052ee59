/*
 * ConstantExtractor.java
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

package org.keyscan.query.plan;

import org.keyscan.EvaluationContext;
import org.keyscan.KeyScanException;
import org.keyscan.annotation.API;
import org.keyscan.logging.KeyValueLogMessage;
import org.keyscan.logging.LogMessageKeys;
import org.keyscan.query.expressions.Comparisons;
import org.keyscan.query.values.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Evaluates the parts of a predicate that do not depend on the input record.
 *
 * <p>
 * A value is a constant if no part of it reads the input record. Literals, parameters and arithmetic over them
 * qualify. Such a value can be computed once, before scanning, against the parameter bindings.
 * </p>
 */
@API(API.Status.INTERNAL)
public class ConstantExtractor {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(ConstantExtractor.class);

    @Nonnull
    private final EvaluationContext context;

    public ConstantExtractor(@Nonnull EvaluationContext context) {
        this.context = context;
    }

    /**
     * Whether a value can be computed without an input record.
     * @param value the value
     * @return {@code true} if {@code value} does not read the input record
     */
    public static boolean isConstant(@Nonnull Value value) {
        return !value.isCorrelatedToInput();
    }

    /**
     * Compute a value if it is a constant of the requested type.
     * @param value the value
     * @param type the class the result must be an instance of
     * @param <C> the requested type
     * @return the result, or empty if {@code value} reads the input record, cannot be evaluated, is {@code null}
     * or is not a {@code type}
     */
    @Nonnull
    public <C> Optional<C> tryEvaluateConstant(@Nonnull Value value, @Nonnull Class<C> type) {
        if (!isConstant(value)) {
            return Optional.empty();
        }
        final Object result;
        try {
            result = value.eval(null, context);
        } catch (KeyScanException | ArithmeticException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("could not evaluate constant",
                        LogMessageKeys.VALUE, value,
                        LogMessageKeys.MESSAGE, e.getMessage()), e);
            }
            return Optional.empty();
        }
        if (type.isInstance(result)) {
            return Optional.of(type.cast(result));
        }
        return Optional.empty();
    }

    /**
     * Whether a value is a constant integral zero.
     * @param value the value
     * @return {@code true} if {@code value} evaluates to an integral number equal to zero
     */
    public boolean isZero(@Nonnull Value value) {
        return tryEvaluateConstant(value, Number.class)
                .filter(Comparisons::isIntegral)
                .map(number -> number.longValue() == 0L)
                .orElse(false);
    }
}
