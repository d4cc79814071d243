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

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.lamb.ast.Op;

/**
 * Type variable.
 *
 * <p>The variable is identified by its de Bruijn index: 0 is the innermost
 * type binder in scope. Printed as {@code 't0}, {@code 't1}, etc.
 */
public class TypeVar<N> extends BaseType<N> {
  public final int index;

  TypeVar(int free, int index) {
    super(Op.TY_VAR, free);
    this.index = index;
    checkArgument(
        index >= 0 && index < free,
        "type variable %s out of range; %s free type variables",
        index,
        free);
  }

  /** Creates a type variable in a scope of {@code free} type variables. */
  public static <N> TypeVar<N> of(int free, int index) {
    return new TypeVar<>(free, index);
  }

  @Override
  public int hashCode() {
    return index * 31 + free + 6563;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeVar
            && index == ((TypeVar<?>) obj).index
            && free == ((TypeVar<?>) obj).free;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("'t").append(index);
  }
}

// End TypeVar.java
