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

/** The type of the unit value. */
public class UnitType<N> extends BaseType<N> {
  UnitType(int free) {
    super(Op.UNIT_TYPE, free);
  }

  /** Creates a unit type in a scope of {@code free} type variables. */
  public static <N> UnitType<N> of(int free) {
    return new UnitType<>(free);
  }

  @Override
  public int hashCode() {
    return free + 1789;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof UnitType && free == ((UnitType<?>) obj).free;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("unit");
  }
}

// End UnitType.java
