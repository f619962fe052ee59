/*
 * Field.java
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
import org.keyscan.query.predicates.ComparisonPredicate;
import org.keyscan.query.predicates.EqualsPredicate;
import org.keyscan.query.predicates.QueryPredicate;
import org.keyscan.query.predicates.StartsWithPredicate;
import org.keyscan.query.values.CompareToValue;
import org.keyscan.query.values.FieldValue;
import org.keyscan.query.values.Value;

import javax.annotation.Nonnull;

/**
 * Class that provides context for asserting about a field value. Comparands may be plain objects, which are
 * treated as literals, or any {@link Value}.
 */
@API(API.Status.UNSTABLE)
public class Field {
    @Nonnull
    private final FieldValue fieldValue;

    public Field(@Nonnull String fieldName) {
        this(FieldValue.ofInput(fieldName));
    }

    private Field(@Nonnull FieldValue fieldValue) {
        this.fieldValue = fieldValue;
    }

    /**
     * Get the value of this field.
     * @return the field value
     */
    @Nonnull
    public FieldValue value() {
        return fieldValue;
    }

    /**
     * Refer to a field of the record held in this field.
     * @param fieldName the name of the nested field
     * @return a new Field for the nested field
     */
    @Nonnull
    public Field nest(@Nonnull String fieldName) {
        return new Field(new FieldValue(fieldValue, fieldName));
    }

    /**
     * Checks if the field has a value equal to the given comparand.
     * @param comparand the object to compare with the value in the field
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate equalsValue(@Nonnull Object comparand) {
        return compare(Comparisons.Type.EQUALS, comparand);
    }

    /**
     * Checks if the field has a value not equal to the given comparand.
     * @param comparand the object to compare with the value in the field
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate notEquals(@Nonnull Object comparand) {
        return compare(Comparisons.Type.NOT_EQUALS, comparand);
    }

    /**
     * Checks if the field has a value greater than the given comparand.
     * @param comparand the object to compare with the value in the field
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate greaterThan(@Nonnull Object comparand) {
        return compare(Comparisons.Type.GREATER_THAN, comparand);
    }

    /**
     * Checks if the field has a value greater than or equal to the given comparand.
     * @param comparand the object to compare with the value in the field
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate greaterThanOrEquals(@Nonnull Object comparand) {
        return compare(Comparisons.Type.GREATER_THAN_OR_EQUALS, comparand);
    }

    /**
     * Checks if the field has a value less than the given comparand.
     * @param comparand the object to compare with the value in the field
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate lessThan(@Nonnull Object comparand) {
        return compare(Comparisons.Type.LESS_THAN, comparand);
    }

    /**
     * Checks if the field has a value less than or equal to the given comparand.
     * @param comparand the object to compare with the value in the field
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate lessThanOrEquals(@Nonnull Object comparand) {
        return compare(Comparisons.Type.LESS_THAN_OR_EQUALS, comparand);
    }

    /**
     * Checks if the field equals the value of a parameter bound in the evaluation context.
     * @param param the name of the parameter
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public ComparisonPredicate equalsParameter(@Nonnull String param) {
        return compare(Comparisons.Type.EQUALS, Query.parameter(param));
    }

    /**
     * Checks if the field starts with the given string.
     * @param comparand the prefix, a string or a {@link Value}
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public QueryPredicate startsWith(@Nonnull Object comparand) {
        return new StartsWithPredicate(fieldValue, Query.toValue(comparand));
    }

    /**
     * Checks if calling {@code equals} on the field with the given comparand returns {@code true}.
     * @param comparand the argument of {@code equals}
     * @return a new predicate for doing the actual evaluation
     */
    @Nonnull
    public QueryPredicate equalsCall(@Nonnull Object comparand) {
        return new EqualsPredicate(fieldValue, Query.toValue(comparand));
    }

    /**
     * The result of calling {@code compareTo} on the field with the given comparand.
     * @param comparand the argument of {@code compareTo}
     * @return a value to compare against zero
     */
    @Nonnull
    public CompareToValue compareTo(@Nonnull Object comparand) {
        return new CompareToValue(fieldValue, Query.toValue(comparand));
    }

    @Nonnull
    private ComparisonPredicate compare(@Nonnull Comparisons.Type type, @Nonnull Object comparand) {
        return new ComparisonPredicate(fieldValue, type, Query.toValue(comparand));
    }

    @Override
    public String toString() {
        return fieldValue.toString();
    }
}
