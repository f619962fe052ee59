/*
 * Comparisons.java
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

package org.keyscan.query.expressions;

import org.keyscan.KeyScanException;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Helper methods for comparison operators.
 */
@API(API.Status.UNSTABLE)
public class Comparisons {

    private Comparisons() {
    }

    /**
     * The comparison operators.
     */
    public enum Type {
        EQUALS("=", true),
        NOT_EQUALS("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">=");

        @Nonnull
        private final String symbol;
        private final boolean isEquality;

        Type(@Nonnull String symbol) {
            this(symbol, false);
        }

        Type(@Nonnull String symbol, boolean isEquality) {
            this.symbol = symbol;
            this.isEquality = isEquality;
        }

        @Nonnull
        public String getSymbol() {
            return symbol;
        }

        public boolean isEquality() {
            return isEquality;
        }

        /**
         * Apply this operator to the result of a three-way comparison of the left operand with the right operand.
         * @param comparison a negative number, zero or a positive number
         * @return whether the operands satisfy this operator
         */
        public boolean test(int comparison) {
            switch (this) {
                case EQUALS:
                    return comparison == 0;
                case NOT_EQUALS:
                    return comparison != 0;
                case LESS_THAN:
                    return comparison < 0;
                case LESS_THAN_OR_EQUALS:
                    return comparison <= 0;
                case GREATER_THAN:
                    return comparison > 0;
                case GREATER_THAN_OR_EQUALS:
                    return comparison >= 0;
                default:
                    throw new KeyScanException("unknown comparison type", LogMessageKeys.VALUE, this);
            }
        }
    }

    /**
     * Get the operator that holds for the swapped operands. {@code 3 < k} is the same as {@code k > 3}.
     * @param type the operator
     * @return the operator for swapped operands
     */
    @Nonnull
    public static Type swap(@Nonnull Type type) {
        switch (type) {
            case EQUALS:
            case NOT_EQUALS:
                return type;
            case LESS_THAN:
                return Type.GREATER_THAN;
            case LESS_THAN_OR_EQUALS:
                return Type.GREATER_THAN_OR_EQUALS;
            case GREATER_THAN:
                return Type.LESS_THAN;
            case GREATER_THAN_OR_EQUALS:
                return Type.LESS_THAN_OR_EQUALS;
            default:
                throw new KeyScanException("cannot swap comparison", LogMessageKeys.VALUE, type);
        }
    }

    /**
     * Get the operator that holds exactly when the given one does not. {@code !(k < 3)} is the same as {@code k >= 3}.
     * @param type the operator
     * @return the negated operator
     */
    @Nonnull
    public static Type invertComparisonType(@Nonnull Type type) {
        switch (type) {
            case EQUALS:
                return Type.NOT_EQUALS;
            case NOT_EQUALS:
                return Type.EQUALS;
            case LESS_THAN:
                return Type.GREATER_THAN_OR_EQUALS;
            case LESS_THAN_OR_EQUALS:
                return Type.GREATER_THAN;
            case GREATER_THAN:
                return Type.LESS_THAN_OR_EQUALS;
            case GREATER_THAN_OR_EQUALS:
                return Type.LESS_THAN;
            default:
                throw new KeyScanException("cannot invert comparison", LogMessageKeys.VALUE, type);
        }
    }

    /**
     * Compare two values by their natural order. Numbers of different classes are compared by value, as long as
     * both are integral or both are floating point.
     * @param left the left operand
     * @param right the right operand
     * @return a negative number, zero or a positive number as {@code left} is less than, equal to or greater than {@code right}
     * @throws KeyScanException if the values cannot be compared
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(@Nonnull Object left, @Nonnull Object right) {
        if (left instanceof Number && right instanceof Number && left.getClass() != right.getClass()) {
            final Number leftNumber = (Number)left;
            final Number rightNumber = (Number)right;
            if (isIntegral(leftNumber) && isIntegral(rightNumber)) {
                return Long.compare(leftNumber.longValue(), rightNumber.longValue());
            }
            if (!isIntegral(leftNumber) && !isIntegral(rightNumber)) {
                return Double.compare(leftNumber.doubleValue(), rightNumber.doubleValue());
            }
        }
        if (left instanceof Comparable && left.getClass().isInstance(right)) {
            return ((Comparable)left).compareTo(right);
        }
        throw new KeyScanException("values are not comparable",
                LogMessageKeys.EXPECTED, left.getClass().getName(),
                LogMessageKeys.ACTUAL, right.getClass().getName());
    }

    /**
     * Evaluate a comparison with three-valued logic.
     * @param type the operator
     * @param left the left operand
     * @param right the right operand
     * @return {@code null} if either operand is {@code null}, otherwise whether the comparison holds
     */
    @Nullable
    public static Boolean evalComparison(@Nonnull Type type, @Nullable Object left, @Nullable Object right) {
        if (left == null || right == null) {
            return null;
        }
        return type.test(compare(left, right));
    }

    /**
     * Whether a number is of one of the integral boxed types.
     * @param number the number
     * @return {@code true} for {@link Byte}, {@link Short}, {@link Integer} and {@link Long}
     */
    public static boolean isIntegral(@Nonnull Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte;
    }
}
