/*
 * AndOrPredicate.java
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

import com.google.common.collect.ImmutableList;
import org.keyscan.KeyScanArgumentException;
import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Common base class for predicates with many children, such as {@link AndPredicate} and {@link OrPredicate}.
 */
@API(API.Status.EXPERIMENTAL)
public abstract class AndOrPredicate implements QueryPredicate {
    @Nonnull
    private final List<QueryPredicate> children;

    protected AndOrPredicate(@Nonnull List<? extends QueryPredicate> children) {
        if (children.size() < 2) {
            throw new KeyScanArgumentException(getClass().getSimpleName() + " must have at least two children");
        }
        this.children = ImmutableList.copyOf(children);
    }

    @Nonnull
    @Override
    public List<QueryPredicate> getChildren() {
        return children;
    }

    @Nonnull
    protected abstract String getOperatorName();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((AndOrPredicate)o).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), children);
    }

    @Override
    public String toString() {
        final StringBuilder str = new StringBuilder(getOperatorName()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                str.append(", ");
            }
            str.append(children.get(i));
        }
        return str.append(')').toString();
    }
}
