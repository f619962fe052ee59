/*
 * ArithmeticValue.java
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
import org.keyscan.query.expressions.Comparisons;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * A value that applies an arithmetic operator on its child values. Both operands must be integral numbers. The
 * result is an {@link Integer} when both operands are, otherwise a {@link Long}. Overflow and division by zero
 * raise {@link ArithmeticException}.
 */
@API(API.Status.EXPERIMENTAL)
public class ArithmeticValue implements Value {
    @Nonnull
    private final Operator operator;
    @Nonnull
    private final Value left;
    @Nonnull
    private final Value right;

    public ArithmeticValue(@Nonnull Operator operator, @Nonnull Value left, @Nonnull Value right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Nonnull
    public Operator getOperator() {
        return operator;
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
        final Number leftNumber = asIntegral(l);
        final Number rightNumber = asIntegral(r);
        if (leftNumber instanceof Integer && rightNumber instanceof Integer) {
            return operator.intOperator.apply((Integer)leftNumber, (Integer)rightNumber);
        }
        return operator.longOperator.apply(leftNumber.longValue(), rightNumber.longValue());
    }

    @Nonnull
    private Number asIntegral(@Nonnull Object operand) {
        if (operand instanceof Number && Comparisons.isIntegral((Number)operand)) {
            if (operand instanceof Short || operand instanceof Byte) {
                return ((Number)operand).intValue();
            }
            return (Number)operand;
        }
        throw new KeyScanException("arithmetic on a value that is not an integral number",
                LogMessageKeys.OPERATOR, operator.getSymbol(),
                LogMessageKeys.VALUE, operand,
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
        final ArithmeticValue that = (ArithmeticValue)o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }

    /**
     * The arithmetic operators.
     */
    public enum Operator {
        ADD("+", Math::addExact, Math::addExact),
        SUBTRACT("-", Math::subtractExact, Math::subtractExact),
        MULTIPLY("*", Math::multiplyExact, Math::multiplyExact),
        DIVIDE("/", (a, b) -> a / b, (a, b) -> a / b),
        MODULO("%", (a, b) -> a % b, (a, b) -> a % b);

        @Nonnull
        private final String symbol;
        @Nonnull
        private final BinaryOperator<Integer> intOperator;
        @Nonnull
        private final BinaryOperator<Long> longOperator;

        Operator(@Nonnull String symbol, @Nonnull BinaryOperator<Integer> intOperator,
                 @Nonnull BinaryOperator<Long> longOperator) {
            this.symbol = symbol;
            this.intOperator = intOperator;
            this.longOperator = longOperator;
        }

        @Nonnull
        public String getSymbol() {
            return symbol;
        }
    }
}
