/*
 * package-info.java
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

/**
 * Key ranges over an ordered key domain.
 *
 * <p>
 * A {@link org.keyscan.range.KeyRange} is a pair of {@link org.keyscan.range.KeyBoundary} objects. Ranges combine
 * with intersection and with an enclosing union, and a range that is bounded on one side only can be inverted.
 * The algebra never loses a key: every operation returns a range that contains at least the keys it should.
 * </p>
 */
package org.keyscan.range;
