/*
 * RandomSeedProvider.java
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

package org.keyscan.test;

import org.junit.jupiter.api.Named;
import org.junit.jupiter.api.extension.ExtensionConfigurationException;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.support.AnnotationConsumer;

import java.lang.reflect.Method;
import java.util.stream.Stream;

/**
 * Feeds the seeds named by {@link RandomSeedSource} to a test method taking a single {@code long}.
 * Each invocation is named after its seed in hex so that a failing run can be pinned with the same seed.
 */
public class RandomSeedProvider implements ArgumentsProvider, AnnotationConsumer<RandomSeedSource> {
    private long[] fixedSeeds = new long[0];
    private int randomCount;

    @Override
    public void accept(final RandomSeedSource annotation) {
        if (annotation.randomCount() < 0) {
            throw new ExtensionConfigurationException("randomCount must not be negative: " + annotation.randomCount());
        }
        fixedSeeds = annotation.value();
        randomCount = annotation.randomCount();
    }

    @Override
    public Stream<? extends Arguments> provideArguments(final ExtensionContext extensionContext) {
        final Method method = extensionContext.getRequiredTestMethod();
        final Class<?>[] parameterTypes = method.getParameterTypes();
        if (parameterTypes.length != 1 || (parameterTypes[0] != long.class && parameterTypes[0] != Long.class)) {
            throw new ExtensionConfigurationException(method.getName() + " must take a single long seed");
        }
        return RandomizedTestUtils.randomSeeds(randomCount, fixedSeeds)
                .map(seed -> Arguments.of(Named.of(RandomizedTestUtils.describeSeed(seed), seed)));
    }
}
