/*
 * EvaluationContext.java
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

package org.keyscan;

import com.google.common.collect.ImmutableMap;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A context for predicate evaluation.
 * <p>
 * The state of an evaluation context is a set of named parameter bindings. A parameter stands for a value that the
 * predicate captured from its surroundings: it is fixed for the whole evaluation and never depends on the record
 * being evaluated.
 * </p>
 * @see org.keyscan.query.values.ParameterValue
 */
@API(API.Status.MAINTAINED)
public class EvaluationContext {
    public static final EvaluationContext EMPTY = new EvaluationContext(Collections.emptyMap());

    @Nonnull
    private final Map<String, Object> bindings;

    private EvaluationContext(@Nonnull Map<String, Object> bindings) {
        this.bindings = bindings;
    }

    /**
     * Get an empty evaluation context.
     * @return an evaluation context with no bindings
     */
    @Nonnull
    public static EvaluationContext empty() {
        return EMPTY;
    }

    /**
     * Create a new <code>EvaluationContext</code> with a single binding.
     *
     * @param bindingName the binding name to add
     * @param value the value to bind the name to
     * @return a new <code>EvaluationContext</code> with the new binding
     */
    @Nonnull
    public static EvaluationContext forBinding(@Nonnull String bindingName, @Nullable Object value) {
        return newBuilder().setBinding(bindingName, value).build();
    }

    /**
     * Create a new <code>EvaluationContext</code> around a map from parameter names to values.
     * @param bindings the parameter values
     * @return a new evaluation context with the bindings
     */
    @Nonnull
    public static EvaluationContext forBindings(@Nonnull Map<String, ?> bindings) {
        final Builder builder = newBuilder();
        bindings.forEach(builder::setBinding);
        return builder.build();
    }

    /**
     * Whether a parameter has a binding in this context. A parameter can be bound to {@code null}.
     * @param name the name of the parameter
     * @return {@code true} if the parameter is bound
     */
    public boolean hasBinding(@Nonnull String name) {
        return bindings.containsKey(name);
    }

    /**
     * Get the value bound to a single parameter.
     *
     * @param name the name of the parameter to retrieve the binding of
     * @return the value bound to the given parameter
     * @throws KeyScanException if the parameter is not bound
     */
    @Nullable
    public Object getBinding(@Nonnull String name) {
        if (!bindings.containsKey(name)) {
            throw new KeyScanException("Missing binding for parameter", LogMessageKeys.PARAMETER, name);
        }
        return bindings.get(name);
    }

    @Nonnull
    public Map<String, Object> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EvaluationContext" + bindings;
    }

    /**
     * A builder for {@link EvaluationContext}.
     */
    public static class Builder {
        @Nonnull
        private final Map<String, Object> bindings = new HashMap<>();

        private Builder() {
        }

        @Nonnull
        public Builder setBinding(@Nonnull String name, @Nullable Object value) {
            bindings.put(name, value);
            return this;
        }

        @Nonnull
        public EvaluationContext build() {
            if (bindings.isEmpty()) {
                return EMPTY;
            }
            if (bindings.containsValue(null)) {
                return new EvaluationContext(Collections.unmodifiableMap(new HashMap<>(bindings)));
            }
            return new EvaluationContext(ImmutableMap.copyOf(bindings));
        }
    }
}
