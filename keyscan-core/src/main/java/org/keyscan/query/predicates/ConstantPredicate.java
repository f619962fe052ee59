/*
 * ConstantPredicate.java
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
 * A predicate with a constant boolean value.
 */
@API(API.Status.EXPERIMENTAL)
public final class ConstantPredicate implements QueryPredicate {
    public static final ConstantPredicate TRUE = new ConstantPredicate(Boolean.TRUE);
    public static final ConstantPredicate FALSE = new ConstantPredicate(Boolean.FALSE);
    public static final ConstantPredicate NULL = new ConstantPredicate(null);

    @Nullable
    private final Boolean value;

    private ConstantPredicate(@Nullable Boolean value) {
        this.value = value;
    }

    @Nullable
    public Boolean getValue() {
        return value;
    }

    @Nullable
    @Override
    public Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        return value;
    }

    @Nonnull
    @Override
    public List<QueryPredicate> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
