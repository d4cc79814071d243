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
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.lamb.ast.Op;

/** The type of a pair value. Both components share one scope. */
public class PairType<N> extends BaseType<N> {
  public final Type<N> left;
  public final Type<N> right;

  PairType(Type<N> left, Type<N> right) {
    super(Op.PAIR_TYPE, left.free());
    this.left = left;
    this.right = requireNonNull(right);
    checkArgument(
        left.free() == right.free(),
        "free type variables do not match: %s vs %s",
        left.free(),
        right.free());
  }

  /** Creates a pair type. */
  public static <N> PairType<N> of(Type<N> left, Type<N> right) {
    return new PairType<>(requireNonNull(left), right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, left, right);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof PairType
            && left.equals(((PairType<?>) obj).left)
            && right.equals(((PairType<?>) obj).right);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    left.describe(buf).append(" * ");
    return right.describe(buf).append(')');
  }
}

// End PairType.java
