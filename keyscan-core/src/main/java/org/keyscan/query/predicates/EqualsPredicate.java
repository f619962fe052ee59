/*
 * EqualsPredicate.java
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
import org.keyscan.query.values.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The method call {@code receiver.equals(argument)}. Unknown if the receiver is {@code null}; a {@code null}
 * argument is never equal.
 */
@API(API.Status.EXPERIMENTAL)
public class EqualsPredicate implements QueryPredicate {
    @Nonnull
    private final Value receiver;
    @Nonnull
    private final Value argument;

    public EqualsPredicate(@Nonnull Value receiver, @Nonnull Value argument) {
        this.receiver = receiver;
        this.argument = argument;
    }

    @Nonnull
    public Value getReceiver() {
        return receiver;
    }

    @Nonnull
    public Value getArgument() {
        return argument;
    }

    @Nullable
    @Override
    public Boolean eval(@Nullable Map<String, ?> record, @Nonnull EvaluationContext context) {
        final Object r = receiver.eval(record, context);
        if (r == null) {
            return null;
        }
        return r.equals(argument.eval(record, context));
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
        final EqualsPredicate that = (EqualsPredicate)o;
        return receiver.equals(that.receiver) && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiver, argument);
    }

    @Override
    public String toString() {
        return receiver + ".equals(" + argument + ")";
    }
}
