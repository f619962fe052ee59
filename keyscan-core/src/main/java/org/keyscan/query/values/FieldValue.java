/*
 * FieldValue.java
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
import org.keyscan.KeyScanException;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value representing the contents of a field of a record. The record is usually the {@link InputValue}, but
 * fields of nested records are read by a field value over another field value.
 */
@API(API.Status.EXPERIMENTAL)
public class FieldValue implements Value {
    @Nonnull
    private final Value child;
    @Nonnull
    private final String fieldName;

    public FieldValue(@Nonnull Value child, @Nonnull String fieldName) {
        this.child = child;
        this.fieldName = fieldName;
    }

    /**
     * Create a value for a field of the input record.
     * @param fieldName the name of the field
     * @return a new field value
     */
    @Nonnull
    public static FieldValue ofInput(@Nonnull String fieldName) {
        return new FieldValue(InputValue.INSTANCE, fieldName);
    }

    @Nonnull
    public Value getChild() {
        return child;
    }

    @Nonnull
    public String getFieldName() {
        return fieldName;
    }

    /**
     * Whether this value reads the named field directly off the input record.
     * @param name the field name
     * @return {@code true} if this is {@code $.name}
     */
    public boolean isInputField(@Nonnull String name) {
        return child instanceof InputValue && fieldName.equals(name);
    }

    @Nullable
    @Override
    public Object eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        final Object parent = child.eval(record, context);
        if (parent == null) {
            return null;
        }
        if (!(parent instanceof Map)) {
            throw new KeyScanException("field of a value that is not a record",
                    LogMessageKeys.FIELD_NAME, fieldName,
                    LogMessageKeys.VALUE_TYPE, parent.getClass().getName());
        }
        return ((Map<?, ?>)parent).get(fieldName);
    }

    @Nonnull
    @Override
    public List<? extends Value> getChildren() {
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
        final FieldValue that = (FieldValue)o;
        return child.equals(that.child) && fieldName.equals(that.fieldName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, fieldName);
    }

    @Override
    public String toString() {
        return child + "." + fieldName;
    }
}
