/*
 * StartsWithPredicate.java
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

package org.keyscan.query.predicates;

import org.keyscan.EvaluationContext;
import org.keyscan.KeyScanException;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;
import org.keyscan.query.values.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The method call {@code receiver.startsWith(prefix)} on strings. Unknown if either side is {@code null}.
 */
@API(API.Status.EXPERIMENTAL)
public class StartsWithPredicate implements QueryPredicate {
    @Nonnull
    private final Value receiver;
    @Nonnull
    private final Value prefix;

    public StartsWithPredicate(@Nonnull Value receiver, @Nonnull Value prefix) {
        this.receiver = receiver;
        this.prefix = prefix;
    }

    @Nonnull
    public Value getReceiver() {
        return receiver;
    }

    @Nonnull
    public Value getPrefix() {
        return prefix;
    }

    @Nullable
    @Override
    public Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        final Object r = receiver.eval(record, context);
        final Object p = prefix.eval(record, context);
        if (r == null || p == null) {
            return null;
        }
        if (!(r instanceof String) || !(p instanceof String)) {
            throw new KeyScanException("startsWith requires string operands",
                    LogMessageKeys.EXPECTED, r.getClass().getName(),
                    LogMessageKeys.ACTUAL, p.getClass().getName());
        }
        return ((String)r).startsWith((String)p);
    }

    @Nonnull
    @Override
    public List<QueryPredicate> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final StartsWithPredicate that = (StartsWithPredicate)o;
        return receiver.equals(that.receiver) && prefix.equals(that.prefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiver, prefix);
    }

    @Override
    public String toString() {
        return receiver + ".startsWith(" + prefix + ")";
    }
}
