/*
 * KeyScanException.java
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

import org.keyscan.annotation.API;
import org.keyscan.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An exception thrown by KeyScan. Additional context is attached as structured log info.
 */
@API(API.Status.STABLE)
public class KeyScanException extends LoggableException {
    private static final long serialVersionUID = 1;

    public KeyScanException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public KeyScanException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
