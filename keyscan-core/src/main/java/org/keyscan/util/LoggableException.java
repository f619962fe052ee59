/*
 * LoggableException.java
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

package org.keyscan.util;

import org.keyscan.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception type with support for adding keys and values to its log info. The keys and values are kept apart from
 * the message so that the exception can be logged in a form that is easy to search.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    @Nonnull
    private final Map<String, Object> logInfo = new LinkedHashMap<>();

    /**
     * Create an exception with the given message and a flattened sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if <code>keyValues</code> has odd length
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Get the log information associated with this exception.
     *
     * @return an unmodifiable view of the log information in insertion order
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description the key
     * @param object the value
     * @return this <code>LoggableException</code>
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object object) {
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a flattened list of key/value pairs to the log information. Every even element is a key and the
     * element after it is its value, so <code>["k0", "v0", "k1", "v1"]</code> adds two pairs. This is the same format
     * that {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened key-value pairs
     * @return this <code>LoggableException</code>
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValue) {
        if (keyValue.length % 2 != 0) {
            throw new IllegalArgumentException("Tried to add log info with odd number of keys and values");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            logInfo.put(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information as a flattened array of alternating keys and values.
     *
     * @return the flattened key-value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Object[] flattened = new Object[logInfo.size() * 2];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }
}
