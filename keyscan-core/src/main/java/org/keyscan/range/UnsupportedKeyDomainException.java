/*
 * UnsupportedKeyDomainException.java
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

import org.keyscan.KeyScanException;
import org.keyscan.annotation.API;

import javax.annotation.Nonnull;

/**
 * Thrown when an operation that only makes sense for string keys, such as building a prefix boundary, is asked of
 * a {@link KeyDomain} that is not a {@link TextKeyDomain}. This is a programming error, never a data problem.
 */
@API(API.Status.STABLE)
public class UnsupportedKeyDomainException extends KeyScanException {
    private static final long serialVersionUID = 1;

    public UnsupportedKeyDomainException(@Nonnull String msg, @Nonnull Object... keyValues) {
        super(msg, keyValues);
    }
}
