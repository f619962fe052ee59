/*
 * IndexScanExecutor.java
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

import com.google.common.base.Verify;
import org.keyscan.EvaluationContext;
import org.keyscan.KeyScanArgumentException;
import org.keyscan.annotation.API;
import org.keyscan.logging.KeyValueLogMessage;
import org.keyscan.logging.LogMessageKeys;
import org.keyscan.query.plan.KeyRangeExtractor;
import org.keyscan.query.predicates.QueryPredicate;
import org.keyscan.range.KeyBoundary;
import org.keyscan.range.KeyRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Runs a filtered scan over an in-memory index, a {@link NavigableMap} from key to record in the natural order of
 * the keys.
 *
 * <p>
 * Only the part of the index inside the key range of the predicate is visited. Since that range can contain keys
 * of records the predicate rejects, every visited record is checked against the predicate, and only records for
 * which it is {@code TRUE} are returned.
 * </p>
 *
 * @param <T> the type of key values
 */
@API(API.Status.EXPERIMENTAL)
public class IndexScanExecutor<T extends Comparable<? super T>> {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(IndexScanExecutor.class);

    @Nonnull
    private final KeyRangeExtractor<T> extractor;
    @Nonnull
    private final String keyField;

    public IndexScanExecutor(@Nonnull KeyRangeExtractor<T> extractor, @Nonnull String keyField) {
        this.extractor = extractor;
        this.keyField = keyField;
    }

    /**
     * Get the part of an index within a key range.
     * @param index the index, ordered by the natural order of its keys
     * @param range the range of keys
     * @param <T> the type of key values
     * @param <V> the type of index entries
     * @return a view of the entries of {@code index} whose keys are in {@code range}
     * @throws KeyScanArgumentException if {@code index} has its own comparator
     */
    @Nonnull
    public static <T extends Comparable<? super T>, V> NavigableMap<T, V> seek(@Nonnull NavigableMap<T, V> index,
                                                                               @Nonnull KeyRange<T> range) {
        if (index.comparator() != null) {
            throw new KeyScanArgumentException("index must be in the natural order of its keys",
                    LogMessageKeys.KEY_RANGE, range);
        }
        if (range.isEmpty()) {
            return Collections.emptyNavigableMap();
        }
        final KeyBoundary<T> lower = range.getLower();
        final KeyBoundary<T> upper = range.getUpper();
        if (lower.isUnbounded() && upper.isUnbounded()) {
            return index;
        }
        if (lower.isUnbounded()) {
            return index.headMap(Verify.verifyNotNull(upper.getComparand()), upper.isInclusiveAsUpper());
        }
        if (upper.isUnbounded()) {
            return index.tailMap(Verify.verifyNotNull(lower.getComparand()), lower.isInclusiveAsLower());
        }
        return index.subMap(Verify.verifyNotNull(lower.getComparand()), lower.isInclusiveAsLower(),
                Verify.verifyNotNull(upper.getComparand()), upper.isInclusiveAsUpper());
    }

    /**
     * Find the records of an index that satisfy a predicate.
     * @param index the index, ordered by the natural order of its keys
     * @param predicate the predicate
     * @param context the bindings of the parameters in {@code predicate}
     * @param <R> the type of records
     * @return the records for which {@code predicate} is {@code TRUE}, in key order
     */
    @Nonnull
    public <R extends Map<String, ?>> List<R> execute(@Nonnull NavigableMap<T, R> index,
                                                      @Nonnull QueryPredicate predicate,
                                                      @Nonnull EvaluationContext context) {
        final KeyRange<T> range = extractor.getKeyRange(predicate, keyField, context);
        final NavigableMap<T, R> candidates = seek(index, range);
        final List<R> results = new ArrayList<>();
        int scanned = 0;
        for (R record : candidates.values()) {
            scanned++;
            if (predicate.test(record, context)) {
                results.add(record);
            }
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("executed index scan",
                    LogMessageKeys.KEY_FIELD, keyField,
                    LogMessageKeys.KEY_RANGE, range,
                    LogMessageKeys.PREDICATE, predicate,
                    LogMessageKeys.SCANNED_COUNT, scanned,
                    LogMessageKeys.MATCHED_COUNT, results.size()));
        }
        return results;
    }
}
