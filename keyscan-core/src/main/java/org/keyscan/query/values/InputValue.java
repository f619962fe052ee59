/*
 * InputValue.java
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

package org.keyscan.query.values;

import org.keyscan.EvaluationContext;
import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The record a predicate is evaluated against.
 */
@API(API.Status.EXPERIMENTAL)
public final class InputValue implements Value {
    public static final InputValue INSTANCE = new InputValue();

    private InputValue() {
    }

    @Nullable
    @Override
    public Object eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        return record;
    }

    @Nonnull
    @Override
    public List<? extends Value> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public boolean isCorrelatedToInput() {
        return true;
    }

    @Override
    public String toString() {
        return "$";
    }
}
