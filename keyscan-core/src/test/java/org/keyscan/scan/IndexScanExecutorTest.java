/*
 * IndexScanExecutorTest.java
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

package org.keyscan.scan;

import com.google.common.collect.ImmutableMap;
import org.keyscan.EvaluationContext;
import org.keyscan.KeyScanArgumentException;
import org.keyscan.query.expressions.Query;
import org.keyscan.query.plan.KeyRangeExtractor;
import org.keyscan.range.KeyBoundary;
import org.keyscan.range.KeyDomain;
import org.keyscan.range.KeyRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link IndexScanExecutor}.
 */
public class IndexScanExecutorTest {
    private static final String KEY = "K";

    private NavigableMap<Integer, Map<String, Object>> index;
    private IndexScanExecutor<Integer> executor;

    @BeforeEach
    public void setUp() {
        index = new TreeMap<>();
        for (int key = 0; key < 10; key++) {
            index.put(key, ImmutableMap.of(KEY, key, "V", key * 10, "even", key % 2 == 0));
        }
        executor = new IndexScanExecutor<>(new KeyRangeExtractor<>(KeyDomain.of(Integer.class)), KEY);
    }

    @Test
    public void seek() {
        assertEquals(Arrays.asList(3, 4, 5), keys(IndexScanExecutor.seek(index,
                new KeyRange<>(KeyBoundary.create(3, true), KeyBoundary.create(6, false)))));
        assertEquals(Arrays.asList(4, 5, 6), keys(IndexScanExecutor.seek(index,
                new KeyRange<>(KeyBoundary.create(3, false), KeyBoundary.create(6, true)))));
        assertEquals(Arrays.asList(0, 1), keys(IndexScanExecutor.seek(index, KeyRange.lessThan(2))));
        assertEquals(Arrays.asList(8, 9), keys(IndexScanExecutor.seek(index, KeyRange.greaterThanOrEqualTo(8))));
        assertEquals(Collections.singletonList(7), keys(IndexScanExecutor.seek(index, KeyRange.equalTo(7))));
        assertSame(index, IndexScanExecutor.seek(index, KeyRange.openRange()));
        assertTrue(IndexScanExecutor.seek(index, KeyRange.<Integer>equalTo(5).intersect(KeyRange.equalTo(6))).isEmpty());
        assertTrue(IndexScanExecutor.seek(index, KeyRange.<Integer>greaterThan(5).intersect(KeyRange.lessThan(5))).isEmpty());
    }

    @Test
    public void seekPrefix() {
        final NavigableMap<String, String> names = new TreeMap<>();
        for (String name : new String[] {"aa", "ab", "abc", "ab" + Character.MAX_VALUE, "ac", "b"}) {
            names.put(name, name);
        }
        assertEquals(Arrays.asList("ab", "abc", "ab" + Character.MAX_VALUE),
                new ArrayList<>(IndexScanExecutor.seek(names, KeyRange.prefixedBy(KeyDomain.text(), "ab")).keySet()));
    }

    @Test
    public void seekNeedsNaturalOrder() {
        final NavigableMap<Integer, String> reversed = new TreeMap<>(Collections.reverseOrder());
        assertThrows(KeyScanArgumentException.class, () -> IndexScanExecutor.seek(reversed, KeyRange.lessThan(3)));
    }

    @Test
    public void execute() {
        final List<Map<String, Object>> results = executor.execute(index,
                Query.and(Query.field(KEY).greaterThanOrEquals(3), Query.field(KEY).lessThan(6)), EvaluationContext.EMPTY);
        assertEquals(Arrays.asList(3, 4, 5), keysOf(results));
    }

    @Test
    public void executeFiltersWidenedRange() {
        // the range is [1,8] but only the two ends match
        final List<Map<String, Object>> results = executor.execute(index,
                Query.or(Query.field(KEY).equalsValue(1), Query.field(KEY).equalsValue(8)), EvaluationContext.EMPTY);
        assertEquals(Arrays.asList(1, 8), keysOf(results));
    }

    @Test
    public void executeWithResidualPredicate() {
        final List<Map<String, Object>> results = executor.execute(index,
                Query.and(Query.field(KEY).lessThanOrEquals(Query.parameter("max")), Query.field("even").equalsValue(true)),
                EvaluationContext.forBinding("max", 5));
        assertEquals(Arrays.asList(0, 2, 4), keysOf(results));
    }

    @Test
    public void executeDropsUnknown() {
        assertEquals(Collections.emptyList(), executor.execute(index,
                Query.field("missing").equalsValue(1), EvaluationContext.EMPTY));
        assertEquals(Collections.emptyList(), executor.execute(index,
                Query.not(Query.field("missing").equalsValue(1)), EvaluationContext.EMPTY));
    }

    @Test
    public void executeContradiction() {
        assertEquals(Collections.emptyList(), executor.execute(index,
                Query.and(Query.field(KEY).equalsValue(5), Query.field(KEY).equalsValue(6)), EvaluationContext.EMPTY));
    }

    private static List<Integer> keys(NavigableMap<Integer, ?> map) {
        return new ArrayList<>(map.keySet());
    }

    private static List<Object> keysOf(List<Map<String, Object>> records) {
        final List<Object> keys = new ArrayList<>();
        for (Map<String, Object> record : records) {
            keys.add(record.get(KEY));
        }
        return keys;
    }
}
