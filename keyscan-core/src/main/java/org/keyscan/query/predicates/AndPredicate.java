/*
 * AndPredicate.java
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
import org.keyscan.KeyScanArgumentException;
import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A {@link QueryPredicate} that is satisfied when all of its child components are.
 *
 * <p>
 * For tri-valued logic, if any child is {@code FALSE} the result is {@code FALSE}; otherwise, if any child is
 * {@code null}, so is the result.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class AndPredicate extends AndOrPredicate {

    public AndPredicate(@Nonnull List<? extends QueryPredicate> children) {
        super(children);
    }

    /**
     * Combine predicates with AND. A single predicate is returned as is.
     * @param children the predicates, at least one
     * @return a predicate satisfied when all of {@code children} are
     */
    @Nonnull
    public static QueryPredicate and(@Nonnull List<? extends QueryPredicate> children) {
        if (children.isEmpty()) {
            throw new KeyScanArgumentException("AND requires at least one child");
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return new AndPredicate(children);
    }

    @Nullable
    @Override
    public Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        Boolean defaultValue = Boolean.TRUE;
        for (QueryPredicate child : getChildren()) {
            final Boolean val = child.eval(record, context);
            if (val == null) {
                defaultValue = null;
            } else if (!val) {
                return false;
            }
        }
        return defaultValue;
    }

    @Nonnull
    @Override
    protected String getOperatorName() {
        return "And";
    }
}
