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
 * Root package of KeyScan: the exception hierarchy and the evaluation context.
 *
 * <p>
 * The interesting code lives in {@link org.keyscan.range}, which holds the key range algebra, and in
 * {@link org.keyscan.query.plan}, which turns a {@link org.keyscan.query.predicates.QueryPredicate} into the
 * {@link org.keyscan.range.KeyRange} an index scan has to cover.
 * </p>
 */
package org.keyscan;
