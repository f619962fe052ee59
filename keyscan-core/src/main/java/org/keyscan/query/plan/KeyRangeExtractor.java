/*
 * KeyRangeExtractor.java
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
import org.keyscan.KeyScanArgumentException;
import org.keyscan.annotation.API;
import org.keyscan.logging.KeyValueLogMessage;
import org.keyscan.logging.LogMessageKeys;
import org.keyscan.query.expressions.Comparisons;
import org.keyscan.query.predicates.AndPredicate;
import org.keyscan.query.predicates.ComparisonPredicate;
import org.keyscan.query.predicates.EqualsPredicate;
import org.keyscan.query.predicates.NotPredicate;
import org.keyscan.query.predicates.OrPredicate;
import org.keyscan.query.predicates.QueryPredicate;
import org.keyscan.query.predicates.StartsWithPredicate;
import org.keyscan.query.values.CompareToValue;
import org.keyscan.query.values.CompareValue;
import org.keyscan.query.values.FieldValue;
import org.keyscan.query.values.Value;
import org.keyscan.range.KeyDomain;
import org.keyscan.range.KeyRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes the range of keys an index scan must cover to find every record satisfying a predicate.
 *
 * <p>
 * The key is a single field of the input record. The extractor walks the predicate tree and combines the ranges of
 * the parts it recognizes:
 * </p>
 * <ul>
 *     <li>AND intersects and OR takes the enclosing union of the ranges of the children.</li>
 *     <li>NOT is pushed down into its child, see {@link #negate}.</li>
 *     <li>A comparison between the key field and a constant of the key type, in either order. Constants are
 *     literals, parameters and arithmetic over them. {@code !=} does not restrict the range.</li>
 *     <li>{@code key.compareTo(c)} compared against zero, in either order.</li>
 *     <li>For string keys only, {@code compare(key, c)} and {@code compare(c, key)} compared against zero, in either
 *     order, as well as {@code key.equals(c)} and {@code key.startsWith(c)}.</li>
 * </ul>
 *
 * <p>
 * Anything else gets the open range. The result never leaves out a key of a record the predicate accepts, but may
 * well contain other keys, so the predicate must still be applied to every record the scan returns. The OR of two
 * equalities, for instance, gives the range between them.
 * </p>
 *
 * <p>
 * Instances are immutable and can be shared between threads.
 * </p>
 *
 * @param <T> the type of key values
 */
@API(API.Status.MAINTAINED)
public class KeyRangeExtractor<T extends Comparable<? super T>> {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyRangeExtractor.class);

    @Nonnull
    private final KeyDomain<T> domain;
    @Nonnull
    private final KeyRangeExtractorConfiguration configuration;

    public KeyRangeExtractor(@Nonnull KeyDomain<T> domain) {
        this(domain, KeyRangeExtractorConfiguration.defaultConfiguration());
    }

    public KeyRangeExtractor(@Nonnull KeyDomain<T> domain, @Nonnull KeyRangeExtractorConfiguration configuration) {
        this.domain = domain;
        this.configuration = configuration;
    }

    @Nonnull
    public KeyRangeExtractorConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Get the range of keys for a predicate without parameters.
     * @param predicate the predicate
     * @param keyField the name of the key field of the input record
     * @return a range containing the key of every record that satisfies {@code predicate}
     * @throws KeyScanArgumentException if either argument is {@code null}
     */
    @Nonnull
    public KeyRange<T> getKeyRange(@Nonnull QueryPredicate predicate, @Nonnull String keyField) {
        return getKeyRange(predicate, keyField, EvaluationContext.EMPTY);
    }

    /**
     * Get the range of keys for a predicate.
     * @param predicate the predicate
     * @param keyField the name of the key field of the input record
     * @param context the bindings of the parameters in {@code predicate}
     * @return a range containing the key of every record that satisfies {@code predicate}
     * @throws KeyScanArgumentException if any argument is {@code null}
     */
    @Nonnull
    public KeyRange<T> getKeyRange(@Nonnull QueryPredicate predicate, @Nonnull String keyField,
                                   @Nonnull EvaluationContext context) {
        return newExtraction(predicate, keyField, context).rangeOf(predicate, 1);
    }

    /**
     * Get the range of keys for the negation of a predicate without parameters.
     * @param predicate the predicate to negate
     * @param keyField the name of the key field of the input record
     * @return a range containing the key of every record that does not satisfy {@code predicate}
     * @throws KeyScanArgumentException if either argument is {@code null}
     */
    @Nonnull
    public KeyRange<T> negate(@Nonnull QueryPredicate predicate, @Nonnull String keyField) {
        return negate(predicate, keyField, EvaluationContext.EMPTY);
    }

    /**
     * Get the range of keys for the negation of a predicate. The negation is pushed down: a double negation
     * cancels, a negated AND becomes the union of the negated children and a negated OR their intersection. A
     * negated comparison gets the range of the opposite comparison, so that {@code NOT(k < 5)} becomes
     * {@code k >= 5}. Since the opposite of {@code =} is {@code !=}, a negated equality gets the open range.
     * @param predicate the predicate to negate
     * @param keyField the name of the key field of the input record
     * @param context the bindings of the parameters in {@code predicate}
     * @return a range containing the key of every record that does not satisfy {@code predicate}
     * @throws KeyScanArgumentException if any argument is {@code null}
     */
    @Nonnull
    public KeyRange<T> negate(@Nonnull QueryPredicate predicate, @Nonnull String keyField,
                              @Nonnull EvaluationContext context) {
        return newExtraction(predicate, keyField, context).negationOf(predicate, 1);
    }

    @Nonnull
    private Extraction newExtraction(@Nullable QueryPredicate predicate, @Nullable String keyField,
                                     @Nullable EvaluationContext context) {
        if (predicate == null) {
            throw new KeyScanArgumentException("predicate must not be null", LogMessageKeys.KEY_FIELD, keyField);
        }
        if (keyField == null) {
            throw new KeyScanArgumentException("key field must not be null", LogMessageKeys.PREDICATE, predicate);
        }
        if (context == null) {
            throw new KeyScanArgumentException("evaluation context must not be null", LogMessageKeys.PREDICATE, predicate);
        }
        return new Extraction(keyField, new ConstantExtractor(context));
    }

    /**
     * The state of a single call: the key field and the constants of one evaluation context.
     */
    private class Extraction {
        @Nonnull
        private final String keyField;
        @Nonnull
        private final ConstantExtractor constants;

        Extraction(@Nonnull String keyField, @Nonnull ConstantExtractor constants) {
            this.keyField = keyField;
            this.constants = constants;
        }

        @Nonnull
        KeyRange<T> rangeOf(@Nonnull QueryPredicate predicate, int depth) {
            if (depth > configuration.getMaxPredicateDepth()) {
                return tooDeep(predicate, depth);
            }
            if (predicate instanceof AndPredicate) {
                final List<KeyRange<T>> ranges = new ArrayList<>();
                for (QueryPredicate child : predicate.getChildren()) {
                    ranges.add(rangeOf(child, depth + 1));
                }
                return KeyRange.intersectAll(ranges);
            }
            if (predicate instanceof OrPredicate) {
                final List<KeyRange<T>> ranges = new ArrayList<>();
                for (QueryPredicate child : predicate.getChildren()) {
                    ranges.add(rangeOf(child, depth + 1));
                }
                return KeyRange.unionAll(ranges);
            }
            if (predicate instanceof NotPredicate) {
                return negationOf(((NotPredicate)predicate).getChild(), depth + 1);
            }
            if (predicate instanceof ComparisonPredicate) {
                final ComparisonPredicate comparison = (ComparisonPredicate)predicate;
                return comparisonRange(comparison.getLeft(), comparison.getType(), comparison.getRight(), predicate);
            }
            if (predicate instanceof EqualsPredicate && recognizesTextIdioms()) {
                final EqualsPredicate equals = (EqualsPredicate)predicate;
                if (isKeyAccess(equals.getReceiver())) {
                    final Optional<T> value = keyConstant(equals.getArgument());
                    if (value.isPresent()) {
                        return KeyRange.equalTo(value.get());
                    }
                }
            }
            if (predicate instanceof StartsWithPredicate && recognizesTextIdioms()) {
                final StartsWithPredicate startsWith = (StartsWithPredicate)predicate;
                if (isKeyAccess(startsWith.getReceiver())) {
                    final Optional<T> prefix = keyConstant(startsWith.getPrefix());
                    if (prefix.isPresent()) {
                        return KeyRange.prefixedBy(domain, prefix.get());
                    }
                }
            }
            return unrecognized(predicate);
        }

        @Nonnull
        KeyRange<T> negationOf(@Nonnull QueryPredicate predicate, int depth) {
            if (depth > configuration.getMaxPredicateDepth()) {
                return tooDeep(predicate, depth);
            }
            if (predicate instanceof NotPredicate) {
                return rangeOf(((NotPredicate)predicate).getChild(), depth + 1);
            }
            if (predicate instanceof AndPredicate) {
                final List<KeyRange<T>> ranges = new ArrayList<>();
                for (QueryPredicate child : predicate.getChildren()) {
                    ranges.add(negationOf(child, depth + 1));
                }
                return KeyRange.unionAll(ranges);
            }
            if (predicate instanceof OrPredicate) {
                final List<KeyRange<T>> ranges = new ArrayList<>();
                for (QueryPredicate child : predicate.getChildren()) {
                    ranges.add(negationOf(child, depth + 1));
                }
                return KeyRange.intersectAll(ranges);
            }
            if (predicate instanceof ComparisonPredicate) {
                final ComparisonPredicate comparison = (ComparisonPredicate)predicate;
                return comparisonRange(comparison.getLeft(), Comparisons.invertComparisonType(comparison.getType()),
                        comparison.getRight(), predicate);
            }
            return unrecognized(predicate);
        }

        @Nonnull
        private KeyRange<T> comparisonRange(@Nonnull Value left, @Nonnull Comparisons.Type type, @Nonnull Value right,
                                            @Nonnull QueryPredicate predicate) {
            if (isKeyAccess(left)) {
                final Optional<T> value = keyConstant(right);
                if (value.isPresent()) {
                    return rangeFor(type, value.get());
                }
            }
            if (isKeyAccess(right)) {
                final Optional<T> value = keyConstant(left);
                if (value.isPresent()) {
                    return rangeFor(Comparisons.swap(type), value.get());
                }
            }
            if (configuration.shouldRecognizeMethodIdioms()) {
                // c OP 0 for a three-way comparison c
                if (constants.isZero(right)) {
                    final Optional<KeyRange<T>> range = threeWayComparisonRange(left, type);
                    if (range.isPresent()) {
                        return range.get();
                    }
                }
                if (constants.isZero(left)) {
                    final Optional<KeyRange<T>> range = threeWayComparisonRange(right, Comparisons.swap(type));
                    if (range.isPresent()) {
                        return range.get();
                    }
                }
            }
            return unrecognized(predicate);
        }

        /**
         * Get the range for a three-way comparison of the key with a constant, compared against zero with the given
         * operator.
         */
        @Nonnull
        private Optional<KeyRange<T>> threeWayComparisonRange(@Nonnull Value comparison, @Nonnull Comparisons.Type type) {
            if (comparison instanceof CompareToValue) {
                final CompareToValue compareTo = (CompareToValue)comparison;
                if (isKeyAccess(compareTo.getReceiver())) {
                    return keyConstant(compareTo.getArgument()).map(value -> rangeFor(type, value));
                }
            } else if (comparison instanceof CompareValue && domain.isText()) {
                final CompareValue compare = (CompareValue)comparison;
                if (isKeyAccess(compare.getLeft())) {
                    return keyConstant(compare.getRight()).map(value -> rangeFor(type, value));
                }
                if (isKeyAccess(compare.getRight())) {
                    return keyConstant(compare.getLeft()).map(value -> rangeFor(Comparisons.swap(type), value));
                }
            }
            return Optional.empty();
        }

        @Nonnull
        private KeyRange<T> rangeFor(@Nonnull Comparisons.Type type, @Nonnull T value) {
            switch (type) {
                case EQUALS:
                    return KeyRange.equalTo(value);
                case LESS_THAN:
                    return KeyRange.lessThan(value);
                case LESS_THAN_OR_EQUALS:
                    return KeyRange.lessThanOrEqualTo(value);
                case GREATER_THAN:
                    return KeyRange.greaterThan(value);
                case GREATER_THAN_OR_EQUALS:
                    return KeyRange.greaterThanOrEqualTo(value);
                case NOT_EQUALS:
                default:
                    return KeyRange.openRange();
            }
        }

        private boolean isKeyAccess(@Nonnull Value value) {
            return value instanceof FieldValue && ((FieldValue)value).isInputField(keyField);
        }

        @Nonnull
        private Optional<T> keyConstant(@Nonnull Value value) {
            return constants.tryEvaluateConstant(value, Object.class).flatMap(domain::asKey);
        }

        private boolean recognizesTextIdioms() {
            return configuration.shouldRecognizeMethodIdioms() && domain.isText();
        }

        @Nonnull
        private KeyRange<T> unrecognized(@Nonnull QueryPredicate predicate) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("predicate does not restrict key range",
                        LogMessageKeys.KEY_FIELD, keyField,
                        LogMessageKeys.PREDICATE, predicate));
            }
            return KeyRange.openRange();
        }

        @Nonnull
        private KeyRange<T> tooDeep(@Nonnull QueryPredicate predicate, int depth) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("predicate nested too deeply for key range",
                        LogMessageKeys.KEY_FIELD, keyField,
                        LogMessageKeys.DEPTH, depth,
                        LogMessageKeys.MAX_DEPTH, configuration.getMaxPredicateDepth(),
                        LogMessageKeys.PREDICATE, predicate));
            }
            return KeyRange.openRange();
        }
    }
}
