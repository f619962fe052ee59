/*
 * KeyRangeExtractorTest.java
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
import org.keyscan.query.expressions.Comparisons;
import org.keyscan.query.expressions.Query;
import org.keyscan.query.predicates.ConstantPredicate;
import org.keyscan.query.predicates.QueryPredicate;
import org.keyscan.query.values.FieldValue;
import org.keyscan.range.KeyBoundary;
import org.keyscan.range.KeyDomain;
import org.keyscan.range.KeyRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link KeyRangeExtractor}.
 */
public class KeyRangeExtractorTest {
    private static final String KEY = "K";
    private static final KeyRangeExtractor<Integer> INTS = new KeyRangeExtractor<>(KeyDomain.of(Integer.class));
    private static final KeyRangeExtractor<String> STRINGS = new KeyRangeExtractor<>(KeyDomain.text());

    private static final FieldValue K = Query.field(KEY).value();

    @Test
    public void equality() {
        final KeyRange<Integer> range = INTS.getKeyRange(Query.field(KEY).equalsValue(5), KEY);
        assertEquals(KeyRange.equalTo(5), range);
        assertEquals("[5,5]", range.toString());
    }

    @Test
    public void conjunction() {
        final KeyRange<Integer> range = INTS.getKeyRange(
                Query.and(Query.field(KEY).lessThan(0), Query.field(KEY).greaterThan(-10)), KEY);
        assertEquals("(-10,0)", range.toString());
    }

    @Test
    public void negatedComparison() {
        final KeyRange<Integer> range = INTS.getKeyRange(Query.not(Query.field(KEY).lessThan(5)), KEY);
        assertEquals(KeyRange.greaterThanOrEqualTo(5), range);
        assertEquals("[5,>", range.toString());
    }

    @Test
    public void compareToIdiom() {
        assertEquals("<,7]", INTS.getKeyRange(
                Query.comparison(Query.field(KEY).compareTo(7), Comparisons.Type.LESS_THAN_OR_EQUALS, 0), KEY).toString());
        // zero on the left
        assertEquals("<,7]", INTS.getKeyRange(
                Query.comparison(0, Comparisons.Type.GREATER_THAN_OR_EQUALS, Query.field(KEY).compareTo(7)), KEY).toString());
        assertEquals(KeyRange.equalTo(7), INTS.getKeyRange(
                Query.comparison(Query.field(KEY).compareTo(7), Comparisons.Type.EQUALS, 0L), KEY));
        assertEquals(KeyRange.greaterThan(7), INTS.getKeyRange(
                Query.not(Query.comparison(Query.field(KEY).compareTo(7), Comparisons.Type.LESS_THAN_OR_EQUALS, 0)), KEY));
        // only a comparison against zero tells the direction
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(
                Query.comparison(Query.field(KEY).compareTo(7), Comparisons.Type.LESS_THAN, 1), KEY));
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(
                Query.comparison(Query.field(KEY).compareTo(7), Comparisons.Type.LESS_THAN, 0.0), KEY));
    }

    @Test
    public void startsWith() {
        final KeyRange<String> range = STRINGS.getKeyRange(Query.field(KEY).startsWith("ab"), KEY);
        assertEquals(KeyRange.prefixedBy(KeyDomain.text(), "ab"), range);
        assertEquals("[ab,ab}", range.toString());
        assertEquals(KeyRange.greaterThanOrEqualTo(""), STRINGS.getKeyRange(Query.field(KEY).startsWith(""), KEY));
    }

    @Test
    public void disjunctionOfEqualitiesIsWidened() {
        final KeyRange<String> range = STRINGS.getKeyRange(
                Query.or(Query.field(KEY).equalsCall("x"), Query.field(KEY).equalsCall("y")), KEY);
        assertEquals(new KeyRange<>(KeyBoundary.create("x", true), KeyBoundary.create("y", true)), range);
        // keys between the two values are scanned and filtered out later
        assertTrue(range.contains("xa"));
    }

    @Test
    public void contradiction() {
        final KeyRange<Integer> range = INTS.getKeyRange(
                Query.and(Query.field(KEY).equalsValue(5), Query.field(KEY).equalsValue(6)), KEY);
        assertTrue(range.isEmpty());
        // an empty branch does not widen a union
        assertEquals(KeyRange.equalTo(9), INTS.getKeyRange(
                Query.or(Query.and(Query.field(KEY).equalsValue(5), Query.field(KEY).equalsValue(6)),
                        Query.field(KEY).equalsValue(9)), KEY));
    }

    @Test
    public void keyOnTheRight() {
        assertEquals(KeyRange.greaterThan(5), INTS.getKeyRange(Query.comparison(5, Comparisons.Type.LESS_THAN, K), KEY));
        assertEquals(KeyRange.lessThanOrEqualTo(5), INTS.getKeyRange(Query.comparison(5, Comparisons.Type.GREATER_THAN_OR_EQUALS, K), KEY));
        assertEquals(KeyRange.equalTo(5), INTS.getKeyRange(Query.comparison(5, Comparisons.Type.EQUALS, K), KEY));
    }

    static Stream<Arguments> deMorgan() {
        final QueryPredicate a = Query.field(KEY).greaterThanOrEquals(0);
        final QueryPredicate b = Query.field(KEY).lessThan(10);
        final QueryPredicate c = Query.field(KEY).lessThan(0);
        final QueryPredicate d = Query.field(KEY).lessThan(5);
        return Stream.of(
                Arguments.of(Query.not(Query.and(a, b)), Query.or(Query.not(a), Query.not(b))),
                Arguments.of(Query.not(Query.or(c, d)), Query.and(Query.not(c), Query.not(d))),
                Arguments.of(Query.not(Query.and(c, d)), Query.or(Query.not(c), Query.not(d))),
                Arguments.of(Query.not(Query.or(a, b, c)), Query.and(Query.not(a), Query.not(b), Query.not(c)))
        );
    }

    @ParameterizedTest
    @MethodSource("deMorgan")
    public void deMorgan(QueryPredicate negated, QueryPredicate pushedDown) {
        assertEquals(INTS.getKeyRange(pushedDown, KEY), INTS.getKeyRange(negated, KEY));
    }

    @Test
    public void deMorganRanges() {
        assertEquals(KeyRange.greaterThanOrEqualTo(5), INTS.getKeyRange(
                Query.not(Query.or(Query.field(KEY).lessThan(0), Query.field(KEY).lessThan(5))), KEY));
        assertEquals(KeyRange.lessThan(5), INTS.getKeyRange(
                Query.not(Query.and(Query.field(KEY).greaterThanOrEquals(0), Query.field(KEY).greaterThanOrEquals(5))), KEY));
    }

    @Test
    public void doubleNegation() {
        final QueryPredicate predicate = Query.and(Query.field(KEY).greaterThan(1), Query.field(KEY).lessThanOrEquals(9));
        assertEquals(INTS.getKeyRange(predicate, KEY), INTS.getKeyRange(Query.not(Query.not(predicate)), KEY));
        assertEquals(INTS.getKeyRange(predicate, KEY), INTS.negate(Query.not(predicate), KEY));
    }

    @Test
    public void negate() {
        assertEquals(KeyRange.greaterThanOrEqualTo(5), INTS.negate(Query.field(KEY).lessThan(5), KEY));
        assertEquals(KeyRange.greaterThan(5), INTS.negate(Query.field(KEY).lessThanOrEquals(5), KEY));
        assertEquals(KeyRange.lessThanOrEqualTo(5), INTS.negate(Query.field(KEY).greaterThan(5), KEY));
        assertEquals(KeyRange.lessThan(5), INTS.negate(Query.field(KEY).greaterThanOrEquals(5), KEY));
        assertEquals(KeyRange.equalTo(5), INTS.negate(Query.field(KEY).notEquals(5), KEY));
        assertEquals(KeyRange.openRange(), INTS.negate(Query.field(KEY).equalsValue(5), KEY));
        assertEquals(KeyRange.lessThan(5), INTS.negate(Query.comparison(5, Comparisons.Type.LESS_THAN_OR_EQUALS, K), KEY));
        assertEquals(KeyRange.openRange(), STRINGS.negate(Query.field(KEY).startsWith("ab"), KEY));
        assertEquals(KeyRange.openRange(), STRINGS.negate(Query.field(KEY).equalsCall("ab"), KEY));
    }

    static Stream<Arguments> unrestricted() {
        return Stream.of(
                Arguments.of(Query.field(KEY).notEquals(5)),
                Arguments.of(Query.field("J").equalsValue(5)),
                Arguments.of(Query.field("other").nest(KEY).equalsValue(5)),
                Arguments.of(Query.field(KEY).lessThan(Query.field("J").value())),
                Arguments.of(Query.field(KEY).lessThan(Query.add(K, 1))),
                Arguments.of(Query.field(KEY).lessThan("five")),
                Arguments.of(Query.field(KEY).lessThan(5L)),
                Arguments.of(Query.field(KEY).lessThan(Query.literal(null))),
                Arguments.of(Query.comparison(3, Comparisons.Type.LESS_THAN, 5)),
                Arguments.of(Query.field(KEY).equalsCall(5)),
                Arguments.of(Query.field(KEY).startsWith("5")),
                Arguments.of(Query.comparison(Query.compare(K, 5), Comparisons.Type.LESS_THAN, 0)),
                Arguments.of(ConstantPredicate.TRUE),
                Arguments.of(ConstantPredicate.FALSE),
                Arguments.of(Query.not(Query.field(KEY).equalsValue(5))),
                Arguments.of(Query.or(Query.field(KEY).lessThan(5), Query.field("J").lessThan(5)))
        );
    }

    @ParameterizedTest
    @MethodSource("unrestricted")
    public void unrecognizedShapes(QueryPredicate predicate) {
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(predicate, KEY));
    }

    @Test
    public void unrecognizedPartOfConjunction() {
        assertEquals(KeyRange.lessThan(5), INTS.getKeyRange(
                Query.and(Query.field(KEY).lessThan(5), Query.field("J").lessThan(5), Query.field(KEY).notEquals(3)), KEY));
    }

    static Stream<Arguments> stringCompare() {
        final String m = "m";
        return Stream.of(
                Arguments.of(Query.comparison(Query.compare(K, m), Comparisons.Type.LESS_THAN, 0), KeyRange.lessThan(m)),
                Arguments.of(Query.comparison(Query.compare(m, K), Comparisons.Type.LESS_THAN, 0), KeyRange.greaterThan(m)),
                Arguments.of(Query.comparison(0, Comparisons.Type.LESS_THAN, Query.compare(K, m)), KeyRange.greaterThan(m)),
                Arguments.of(Query.comparison(0, Comparisons.Type.LESS_THAN, Query.compare(m, K)), KeyRange.lessThan(m)),
                Arguments.of(Query.comparison(Query.compare(K, m), Comparisons.Type.GREATER_THAN_OR_EQUALS, 0), KeyRange.greaterThanOrEqualTo(m)),
                Arguments.of(Query.comparison(Query.compare(m, K), Comparisons.Type.EQUALS, 0), KeyRange.equalTo(m)),
                Arguments.of(Query.comparison(Query.compare(K, m), Comparisons.Type.NOT_EQUALS, 0), KeyRange.openRange()),
                Arguments.of(Query.not(Query.comparison(Query.compare(m, K), Comparisons.Type.LESS_THAN, 0)), KeyRange.lessThanOrEqualTo(m))
        );
    }

    @ParameterizedTest
    @MethodSource("stringCompare")
    public void stringCompareIdiom(QueryPredicate predicate, KeyRange<String> expected) {
        assertEquals(expected, STRINGS.getKeyRange(predicate, KEY));
    }

    @Test
    public void stringComparisons() {
        assertEquals(KeyRange.lessThan("m"), STRINGS.getKeyRange(Query.field(KEY).lessThan("m"), KEY));
        assertEquals(KeyRange.equalTo("m"), STRINGS.getKeyRange(Query.field(KEY).equalsCall("m"), KEY));
        assertEquals(KeyRange.lessThan("m"), STRINGS.getKeyRange(
                Query.comparison(Query.field(KEY).compareTo("m"), Comparisons.Type.LESS_THAN, 0), KEY));
        assertEquals(new KeyRange<>(KeyBoundary.create("ab", true), KeyBoundary.create("ab", true)), STRINGS.getKeyRange(
                Query.and(Query.field(KEY).startsWith("a"), Query.field(KEY).equalsCall("ab")), KEY));
        assertTrue(STRINGS.getKeyRange(
                Query.and(Query.field(KEY).startsWith("a"), Query.field(KEY).equalsCall("b")), KEY).isEmpty());
        assertEquals(KeyRange.openRange(), STRINGS.getKeyRange(Query.field(KEY).startsWith(5), KEY));
    }

    @Test
    public void constantsMustBeKeys() {
        final QueryPredicate equalsParam = Query.field(KEY).equalsParameter("p");
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(equalsParam, KEY, EvaluationContext.forBinding("p", 5L)));
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(equalsParam, KEY, EvaluationContext.forBinding("p", "5")));
        assertEquals(KeyRange.equalTo("5"), STRINGS.getKeyRange(equalsParam, KEY, EvaluationContext.forBinding("p", "5")));
        assertEquals(KeyRange.openRange(), STRINGS.getKeyRange(Query.field(KEY).startsWith(Query.parameter("p")), KEY,
                EvaluationContext.forBinding("p", 5)));
        // Long arithmetic does not narrow back to an Integer key
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(Query.field(KEY).lessThan(Query.add(1, 2L)), KEY));
        assertEquals(KeyRange.lessThan(3), INTS.getKeyRange(Query.field(KEY).lessThan(Query.add(1, 2)), KEY));
    }

    @Test
    public void parameters() {
        final QueryPredicate equalsParam = Query.field(KEY).equalsParameter("p");
        assertEquals(KeyRange.equalTo(5), INTS.getKeyRange(equalsParam, KEY, EvaluationContext.forBinding("p", 5)));
        // no binding, no restriction
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(equalsParam, KEY));
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(equalsParam, KEY, EvaluationContext.forBinding("p", null)));

        final QueryPredicate lessThanSum = Query.field(KEY).lessThan(Query.add(Query.parameter("p"), 1));
        assertEquals(KeyRange.lessThan(5), INTS.getKeyRange(lessThanSum, KEY, EvaluationContext.forBinding("p", 4)));
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(Query.field(KEY).lessThan(Query.divide(1, 0)), KEY));
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(
                Query.field(KEY).lessThan(Query.add(Query.parameter("p"), 1)), KEY, EvaluationContext.forBinding("p", Integer.MAX_VALUE)));
    }

    @Test
    public void methodIdiomsSwitchedOff() {
        final KeyRangeExtractorConfiguration configuration = KeyRangeExtractorConfiguration.builder()
                .setRecognizeMethodIdioms(false)
                .build();
        final KeyRangeExtractor<String> strings = new KeyRangeExtractor<>(KeyDomain.text(), configuration);
        assertEquals(KeyRange.openRange(), strings.getKeyRange(Query.field(KEY).startsWith("ab"), KEY));
        assertEquals(KeyRange.openRange(), strings.getKeyRange(Query.field(KEY).equalsCall("ab"), KEY));
        assertEquals(KeyRange.openRange(), strings.getKeyRange(
                Query.comparison(Query.field(KEY).compareTo("m"), Comparisons.Type.LESS_THAN, 0), KEY));
        assertEquals(KeyRange.openRange(), strings.getKeyRange(
                Query.comparison(Query.compare(K, "m"), Comparisons.Type.LESS_THAN, 0), KEY));
        // plain comparisons are still recognized
        assertEquals(KeyRange.lessThan("m"), strings.getKeyRange(Query.field(KEY).lessThan("m"), KEY));
    }

    @Test
    public void depthLimit() {
        final QueryPredicate conjunction = Query.and(Query.field(KEY).greaterThan(0), Query.field(KEY).lessThan(5));
        final KeyRangeExtractor<Integer> shallow = new KeyRangeExtractor<>(KeyDomain.of(Integer.class),
                KeyRangeExtractorConfiguration.builder().setMaxPredicateDepth(1).build());
        assertEquals(KeyRange.openRange(), shallow.getKeyRange(conjunction, KEY));
        assertEquals(KeyRange.lessThan(5), shallow.getKeyRange(Query.field(KEY).lessThan(5), KEY));

        final KeyRangeExtractor<Integer> deeper = new KeyRangeExtractor<>(KeyDomain.of(Integer.class),
                shallow.getConfiguration().asBuilder().setMaxPredicateDepth(2).build());
        assertEquals(new KeyRange<>(KeyBoundary.create(0, false), KeyBoundary.create(5, false)), deeper.getKeyRange(conjunction, KEY));
    }

    @Test
    public void deeplyNested() {
        QueryPredicate shallow = Query.field(KEY).lessThan(5);
        for (int i = 0; i < 10; i++) {
            shallow = Query.not(Query.not(shallow));
        }
        assertEquals(KeyRange.lessThan(5), INTS.getKeyRange(shallow, KEY));

        QueryPredicate deep = Query.field(KEY).lessThan(5);
        for (int i = 0; i < KeyRangeExtractorConfiguration.DEFAULT_MAX_PREDICATE_DEPTH; i++) {
            deep = Query.not(Query.not(deep));
        }
        assertEquals(KeyRange.openRange(), INTS.getKeyRange(deep, KEY));
    }

    @Test
    public void configuration() {
        final KeyRangeExtractorConfiguration defaults = KeyRangeExtractorConfiguration.defaultConfiguration();
        assertEquals(KeyRangeExtractorConfiguration.DEFAULT_MAX_PREDICATE_DEPTH, defaults.getMaxPredicateDepth());
        assertTrue(defaults.shouldRecognizeMethodIdioms());
        assertEquals(defaults.getMaxPredicateDepth(), defaults.asBuilder().build().getMaxPredicateDepth());
        assertThrows(KeyScanArgumentException.class, () -> KeyRangeExtractorConfiguration.builder().setMaxPredicateDepth(0));
    }

    @Test
    public void nullArguments() {
        assertThrows(KeyScanArgumentException.class, () -> INTS.getKeyRange(null, KEY));
        assertThrows(KeyScanArgumentException.class, () -> INTS.getKeyRange(Query.field(KEY).lessThan(5), null));
        assertThrows(KeyScanArgumentException.class, () -> INTS.getKeyRange(Query.field(KEY).lessThan(5), KEY, null));
        assertThrows(KeyScanArgumentException.class, () -> INTS.negate(null, KEY));
    }
}
