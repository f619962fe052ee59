/*
 * Query.java
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

import org.keyscan.annotation.API;
import org.keyscan.query.predicates.AndPredicate;
import org.keyscan.query.predicates.ComparisonPredicate;
import org.keyscan.query.predicates.NotPredicate;
import org.keyscan.query.predicates.OrPredicate;
import org.keyscan.query.predicates.QueryPredicate;
import org.keyscan.query.values.ArithmeticValue;
import org.keyscan.query.values.CompareValue;
import org.keyscan.query.values.InputValue;
import org.keyscan.query.values.LiteralValue;
import org.keyscan.query.values.ParameterValue;
import org.keyscan.query.values.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Holder class for creating query predicates.
 */
@API(API.Status.UNSTABLE)
public class Query {

    /**
     * Creates a new Field context. This has a variety of methods for asserting about the value of the associated field.
     * @param name the name of the field
     * @return a new Field ready for matching
     */
    @Nonnull
    public static Field field(@Nonnull String name) {
        return new Field(name);
    }

    /**
     * Check that a set of predicates all evaluate to true for a given record.
     * @param first the first assertion
     * @param second the second assertion
     * @param operands any other assertions
     * @return a new predicate that will accept the record if all the children match
     */
    @Nonnull
    public static QueryPredicate and(@Nonnull QueryPredicate first, @Nonnull QueryPredicate second,
                                     @Nonnull QueryPredicate... operands) {
        return AndPredicate.and(toList(first, second, operands));
    }

    /**
     * Check that a set of predicates all evaluate to true for a given record.
     * @param operands assertions
     * @return a new predicate that will accept the record if all the children match
     */
    @Nonnull
    public static QueryPredicate and(@Nonnull List<? extends QueryPredicate> operands) {
        return AndPredicate.and(operands);
    }

    /**
     * Check that any of a set of predicates evaluate to true for a given record.
     * @param first the first assertion
     * @param second the second assertion
     * @param operands any other assertions
     * @return a new predicate that will accept the record if any of the children match
     */
    @Nonnull
    public static QueryPredicate or(@Nonnull QueryPredicate first, @Nonnull QueryPredicate second,
                                    @Nonnull QueryPredicate... operands) {
        return OrPredicate.or(toList(first, second, operands));
    }

    /**
     * Check that any of a set of predicates evaluate to true for a given record.
     * @param operands assertions
     * @return a new predicate that will accept the record if any of the children match
     */
    @Nonnull
    public static QueryPredicate or(@Nonnull List<? extends QueryPredicate> operands) {
        return OrPredicate.or(operands);
    }

    /**
     * Negate a predicate.
     * @param operand assertion to be negated
     * @return a new predicate that will accept the record if the child does not match
     */
    @Nonnull
    public static QueryPredicate not(@Nonnull QueryPredicate operand) {
        return new NotPredicate(operand);
    }

    /**
     * Relate two values with a comparison operator.
     * @param left the left operand, a {@link Value} or a plain object treated as a literal
     * @param type the operator
     * @param right the right operand, a {@link Value} or a plain object treated as a literal
     * @return a new comparison predicate
     */
    @Nonnull
    public static ComparisonPredicate comparison(@Nonnull Object left, @Nonnull Comparisons.Type type, @Nonnull Object right) {
        return new ComparisonPredicate(toValue(left), type, toValue(right));
    }

    /**
     * The two-argument string comparison {@code compare(left, right)}.
     * @param left the first string, a {@link Value} or a plain string
     * @param right the second string, a {@link Value} or a plain string
     * @return a value to compare against zero
     */
    @Nonnull
    public static CompareValue compare(@Nonnull Object left, @Nonnull Object right) {
        return new CompareValue(toValue(left), toValue(right));
    }

    @Nonnull
    public static <T> LiteralValue<T> literal(@Nullable T value) {
        return new LiteralValue<>(value);
    }

    /**
     * A value read from the bindings of the evaluation context.
     * @param name the name of the parameter
     * @return a new parameter value
     */
    @Nonnull
    public static ParameterValue parameter(@Nonnull String name) {
        return new ParameterValue(name);
    }

    @Nonnull
    public static InputValue input() {
        return InputValue.INSTANCE;
    }

    @Nonnull
    public static ArithmeticValue add(@Nonnull Object left, @Nonnull Object right) {
        return new ArithmeticValue(ArithmeticValue.Operator.ADD, toValue(left), toValue(right));
    }

    @Nonnull
    public static ArithmeticValue subtract(@Nonnull Object left, @Nonnull Object right) {
        return new ArithmeticValue(ArithmeticValue.Operator.SUBTRACT, toValue(left), toValue(right));
    }

    @Nonnull
    public static ArithmeticValue multiply(@Nonnull Object left, @Nonnull Object right) {
        return new ArithmeticValue(ArithmeticValue.Operator.MULTIPLY, toValue(left), toValue(right));
    }

    @Nonnull
    public static ArithmeticValue divide(@Nonnull Object left, @Nonnull Object right) {
        return new ArithmeticValue(ArithmeticValue.Operator.DIVIDE, toValue(left), toValue(right));
    }

    @Nonnull
    public static ArithmeticValue modulo(@Nonnull Object left, @Nonnull Object right) {
        return new ArithmeticValue(ArithmeticValue.Operator.MODULO, toValue(left), toValue(right));
    }

    @Nonnull
    static Value toValue(@Nonnull Object operand) {
        if (operand instanceof Value) {
            return (Value)operand;
        }
        return new LiteralValue<>(operand);
    }

    @Nonnull
    private static List<QueryPredicate> toList(@Nonnull QueryPredicate first, @Nonnull QueryPredicate second,
                                               @Nonnull QueryPredicate[] operands) {
        final List<QueryPredicate> children = new ArrayList<>(operands.length + 2);
        children.add(first);
        children.add(second);
        children.addAll(Arrays.asList(operands));
        return children;
    }

    private Query() {
    }
}
