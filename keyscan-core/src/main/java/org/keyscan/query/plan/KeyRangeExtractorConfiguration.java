/*
 * KeyRangeExtractorConfiguration.java
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

package org.keyscan.query.plan;

import org.keyscan.KeyScanArgumentException;
import org.keyscan.annotation.API;
import org.keyscan.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * A set of configuration options for the {@link KeyRangeExtractor}.
 */
@API(API.Status.MAINTAINED)
public class KeyRangeExtractorConfiguration {
    /**
     * The default limit on the nesting depth of the predicates the extractor analyzes.
     */
    public static final int DEFAULT_MAX_PREDICATE_DEPTH = 1000;

    @Nonnull
    private static final KeyRangeExtractorConfiguration DEFAULT_CONFIGURATION = builder().build();

    private final int maxPredicateDepth;
    private final boolean recognizeMethodIdioms;

    private KeyRangeExtractorConfiguration(@Nonnull Builder builder) {
        this.maxPredicateDepth = builder.maxPredicateDepth;
        this.recognizeMethodIdioms = builder.recognizeMethodIdioms;
    }

    /**
     * Get the deepest level of nested predicates that is analyzed. Subtrees below it get no restriction at all, so
     * the range stays correct but may be wider.
     * @return the maximum predicate depth, where the root predicate is at depth one
     */
    public int getMaxPredicateDepth() {
        return maxPredicateDepth;
    }

    /**
     * Get whether the method call idioms are recognized: {@code key.compareTo(c)} and {@code compare(key, c)}
     * compared against zero, {@code key.equals(c)} and {@code key.startsWith(c)}. When this is off, only plain
     * comparisons restrict the range.
     * @return whether method call idioms are recognized
     */
    public boolean shouldRecognizeMethodIdioms() {
        return recognizeMethodIdioms;
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public static KeyRangeExtractorConfiguration defaultConfiguration() {
        return DEFAULT_CONFIGURATION;
    }

    @Override
    public String toString() {
        return "KeyRangeExtractorConfiguration{maxPredicateDepth=" + maxPredicateDepth +
               ", recognizeMethodIdioms=" + recognizeMethodIdioms + "}";
    }

    /**
     * A builder for {@link KeyRangeExtractorConfiguration}.
     */
    public static class Builder {
        private int maxPredicateDepth = DEFAULT_MAX_PREDICATE_DEPTH;
        private boolean recognizeMethodIdioms = true;

        public Builder(@Nonnull KeyRangeExtractorConfiguration configuration) {
            this.maxPredicateDepth = configuration.maxPredicateDepth;
            this.recognizeMethodIdioms = configuration.recognizeMethodIdioms;
        }

        public Builder() {
        }

        /**
         * Set the deepest level of nested predicates that is analyzed.
         * @param maxPredicateDepth the maximum depth, which must be positive
         * @return this builder
         * @throws KeyScanArgumentException if {@code maxPredicateDepth} is not positive
         */
        @Nonnull
        public Builder setMaxPredicateDepth(int maxPredicateDepth) {
            if (maxPredicateDepth <= 0) {
                throw new KeyScanArgumentException("maximum predicate depth must be positive",
                        LogMessageKeys.MAX_DEPTH, maxPredicateDepth);
            }
            this.maxPredicateDepth = maxPredicateDepth;
            return this;
        }

        @Nonnull
        public Builder setRecognizeMethodIdioms(boolean recognizeMethodIdioms) {
            this.recognizeMethodIdioms = recognizeMethodIdioms;
            return this;
        }

        @Nonnull
        public KeyRangeExtractorConfiguration build() {
            return new KeyRangeExtractorConfiguration(this);
        }
    }
}
