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
 * A fluent API for building predicates: {@link org.keyscan.query.expressions.Query} and
 * {@link org.keyscan.query.expressions.Field}, along with the comparison operators in
 * {@link org.keyscan.query.expressions.Comparisons}.
 */
package org.keyscan.query.expressions;
