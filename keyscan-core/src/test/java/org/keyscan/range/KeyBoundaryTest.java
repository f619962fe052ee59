/*
 * KeyBoundaryTest.java
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

package org.keyscan.range;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link KeyBoundary}.
 */
public class KeyBoundaryTest {

    @Test
    public void lowerOrder() {
        final KeyBoundary<Integer> inclusive = KeyBoundary.create(5, true);
        final KeyBoundary<Integer> exclusive = KeyBoundary.create(5, false);
        assertTrue(KeyBoundary.compareLower(inclusive, exclusive) < 0);
        assertTrue(KeyBoundary.compareLower(exclusive, inclusive) > 0);
        assertTrue(KeyBoundary.compareLower(KeyBoundary.unbounded(), inclusive) < 0);
        assertTrue(KeyBoundary.compareLower(exclusive, KeyBoundary.create(6, true)) < 0);
        assertEquals(0, KeyBoundary.compareLower(KeyBoundary.<Integer>unbounded(), KeyBoundary.unbounded()));
    }

    @Test
    public void upperOrder() {
        final KeyBoundary<Integer> inclusive = KeyBoundary.create(5, true);
        final KeyBoundary<Integer> exclusive = KeyBoundary.create(5, false);
        assertTrue(KeyBoundary.compareUpper(exclusive, inclusive) < 0);
        assertTrue(KeyBoundary.compareUpper(inclusive, exclusive) > 0);
        assertTrue(KeyBoundary.compareUpper(KeyBoundary.unbounded(), inclusive) > 0);
        assertTrue(KeyBoundary.compareUpper(inclusive, KeyBoundary.create(6, false)) < 0);
        assertEquals(0, KeyBoundary.compareUpper(KeyBoundary.<Integer>unbounded(), KeyBoundary.unbounded()));
    }

    @Test
    public void prefixBoundary() {
        final KeyBoundary<String> boundary = KeyBoundary.createPrefixBoundary(KeyDomain.text(), "ab");
        assertTrue(boundary.isPrefix());
        assertEquals("ab", boundary.getValue());
        assertEquals("ac", boundary.getComparand());
        assertTrue(boundary.admitsAsUpper("ab" + Character.MAX_VALUE));
        assertFalse(boundary.admitsAsUpper("ac"));
        assertFalse(boundary.isInclusiveAsUpper());
        // tighter than an inclusive boundary at the successor, looser than an exclusive one at the prefix
        assertTrue(KeyBoundary.compareUpper(boundary, KeyBoundary.create("ac", true)) < 0);
        assertTrue(KeyBoundary.compareUpper(boundary, KeyBoundary.create("ab", false)) > 0);
        assertEquals("ab}", boundary.toString(true));
    }

    @Test
    public void prefixWithoutSuccessor() {
        final String allMax = String.valueOf(Character.MAX_VALUE) + Character.MAX_VALUE;
        assertTrue(KeyBoundary.createPrefixBoundary(KeyDomain.text(), allMax).isUnbounded());
        assertTrue(KeyBoundary.createPrefixBoundary(KeyDomain.text(), "").isUnbounded());
    }

    @Test
    public void boundaryNeedsValue() {
        assertThrows(NullPointerException.class, () -> KeyBoundary.create((Integer)null, true));
        assertThrows(NullPointerException.class, () -> KeyBoundary.create((String)null, false));
    }

    @Test
    public void prefixBoundaryNeedsText() {
        assertThrows(UnsupportedKeyDomainException.class,
                () -> KeyBoundary.createPrefixBoundary(KeyDomain.of(Long.class), 10L));
    }

    @Test
    public void admits() {
        final KeyBoundary<Integer> inclusive = KeyBoundary.create(5, true);
        final KeyBoundary<Integer> exclusive = KeyBoundary.create(5, false);
        assertTrue(inclusive.admitsAsLower(5));
        assertTrue(inclusive.admitsAsUpper(5));
        assertFalse(exclusive.admitsAsLower(5));
        assertFalse(exclusive.admitsAsUpper(5));
        assertTrue(exclusive.admitsAsLower(6));
        assertTrue(exclusive.admitsAsUpper(4));
        assertTrue(KeyBoundary.<Integer>unbounded().admitsAsLower(Integer.MIN_VALUE));
        assertTrue(KeyBoundary.<Integer>unbounded().admitsAsUpper(Integer.MAX_VALUE));
    }

    @Test
    public void render() {
        assertEquals("[5", KeyBoundary.create(5, true).toString(false));
        assertEquals("5)", KeyBoundary.create(5, false).toString(true));
        assertEquals("<", KeyBoundary.unbounded().toString(false));
        assertEquals(">", KeyBoundary.unbounded().toString(true));
    }
}
