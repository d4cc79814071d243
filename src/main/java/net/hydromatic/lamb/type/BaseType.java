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

import net.hydromatic.lamb.ast.Op;

/** Abstract implementation of Type. */
abstract class BaseType<N> implements Type<N> {
  final Op op;
  final int free;

  protected BaseType(Op op, int free) {
    this.op = requireNonNull(op);
    this.free = free;
    checkArgument(free >= 0, "negative free type count %s", free);
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public int free() {
    return free;
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }
}

// End BaseType.java
