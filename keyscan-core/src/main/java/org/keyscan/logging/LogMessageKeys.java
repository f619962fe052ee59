/*
 * LogMessageKeys.java
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

package org.keyscan.logging;

import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} and {@link org.keyscan.util.LoggableException} keys logged by KeyScan.
 * All keys are kept here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    MESSAGE,
    VALUE,
    EXPECTED,
    ACTUAL,
    // key ranges
    KEY_FIELD,
    KEY_TYPE,
    KEY_RANGE,
    PREFIX,
    // predicates
    PREDICATE,
    VALUE_TYPE,
    OPERATOR,
    DEPTH,
    MAX_DEPTH,
    PARAMETER,
    FIELD_NAME,
    // scans
    SCANNED_COUNT("scanned"),
    MATCHED_COUNT("matched"),
    ;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
