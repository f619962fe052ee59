/*
 * ParameterValue.java
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
 * A value captured by the predicate from its surroundings and supplied through the bindings of the
 * {@link EvaluationContext}. It does not depend on the input record.
 */
@API(API.Status.EXPERIMENTAL)
public class ParameterValue implements Value {
    @Nonnull
    private final String parameterName;

    public ParameterValue(@Nonnull String parameterName) {
        this.parameterName = parameterName;
    }

    @Nonnull
    public String getParameterName() {
        return parameterName;
    }

    @Nullable
    @Override
    public Object eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        return context.getBinding(parameterName);
    }

    @Nonnull
    @Override
    public List<? extends Value> getChildren() {
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
        return parameterName.equals(((ParameterValue)o).parameterName);
    }

    @Override
    public int hashCode() {
        return parameterName.hashCode();
    }

    @Override
    public String toString() {
        return "$" + parameterName;
    }
}
