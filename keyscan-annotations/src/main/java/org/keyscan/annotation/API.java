/*
 * API.java
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

package org.keyscan.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public type, method, constructor or field with how stable it is for code outside of KeyScan.
 *
 * <p>
 * Members of an annotated type inherit the status of the type unless they carry their own annotation. A status may
 * move towards {@link Status#STABLE} at any time, but it only moves the other way as described on each status.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other KeyScan packages can reach it. Not for use by callers and may change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. May disappear in the next minor release.
         */
        DEPRECATED,

        /**
         * A feature whose shape is still being worked out. May change or vanish without notice.
         */
        EXPERIMENTAL,

        /**
         * May change incompatibly in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Changes in the same way as {@link #UNSTABLE}, but is relied upon by callers and changes are avoided where possible.
         */
        MAINTAINED,

        /**
         * Only changes incompatibly with a new major release.
         */
        STABLE
    }
}
