/*
 * NotPredicate.java
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
import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A {@link QueryPredicate} that is satisfied when its child component is not satisfied.
 *
 * <p>
 * For tri-valued logic, if the child evaluates to {@code null}, the {@code not} does, too.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class NotPredicate implements QueryPredicate {
    @Nonnull
    private final QueryPredicate child;

    public NotPredicate(@Nonnull QueryPredicate child) {
        this.child = child;
    }

    @Nonnull
    public QueryPredicate getChild() {
        return child;
    }

    @Nullable
    @Override
    public Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        final Boolean val = child.eval(record, context);
        return val == null ? null : !val;
    }

    @Nonnull
    @Override
    public List<QueryPredicate> getChildren() {
        return Collections.singletonList(child);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return child.equals(((NotPredicate)o).child);
    }

    @Override
    public int hashCode() {
        return 31 * child.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "Not(" + child + ")";
    }
}
