/*
 * EndpointType.java
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

package org.keyscan.range;

import org.keyscan.annotation.API;

import javax.annotation.Nonnull;

/**
 * How the endpoint value of a {@link KeyBoundary} is to be interpreted.
 */
@API(API.Status.UNSTABLE)
public enum EndpointType {
    /**
     * No endpoint: the start of the index as a lower boundary, the end of it as an upper boundary.
     */
    UNBOUNDED,
    RANGE_INCLUSIVE,
    RANGE_EXCLUSIVE,
    /**
     * Just past every string that starts with the endpoint value.
     */
    PREFIX_STRING;

    @Nonnull
    public String toString(boolean high) {
        switch (this) {
            case UNBOUNDED:
                return (high) ? ">" : "<";
            case RANGE_INCLUSIVE:
                return (high) ? "]" : "[";
            case RANGE_EXCLUSIVE:
                return (high) ? ")" : "(";
            case PREFIX_STRING:
                return (high) ? "}" : "{";
            default:
                return "?";
        }
    }
}
