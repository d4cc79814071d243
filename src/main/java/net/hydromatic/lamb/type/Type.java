/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lamb.type;

import net.hydromatic.lamb.ast.Op;

/**
 * Type.
 *
 * <p>Types are scoped the same way as expressions: a type variable is a de
 * Bruijn index, and every type knows how many free type variables it may
 * reference. Expressions only rely on {@link #free()} and on structural
 * equality; the other methods are for debugging.
 *
 * <p>Types are immutable, so a copy is the same reference.
 *
 * @param <N> Type of names carried on binders
 */
public interface Type<N> {
  /** Returns the number of free type variables in scope of this type. */
  int free();

  /** Type operator. */
  Op op();

  /** Writes a description of this type to a string builder. */
  StringBuilder describe(StringBuilder buf);
}

// End Type.java
