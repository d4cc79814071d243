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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.lamb.ast.Op;

/**
 * The type of a function value, optionally polymorphic.
 *
 * <p>The parameter and result types are both in the inner scope, where the
 * function's type parameters are in view. The function type itself has {@code
 * typeParams.size()} fewer free type variables than its parameter type.
 */
public class FnType<N> extends BaseType<N> {
  public final ImmutableList<TypeParam<N>> typeParams;
  public final Type<N> paramType;
  public final Type<N> resultType;

  FnType(
      ImmutableList<TypeParam<N>> typeParams,
      Type<N> paramType,
      Type<N> resultType) {
    super(Op.FN_TYPE, paramType.free() - typeParams.size());
    this.typeParams = typeParams;
    this.paramType = paramType;
    this.resultType = requireNonNull(resultType);
    checkArgument(
        paramType.free() == resultType.free(),
        "free type variables do not match: %s vs %s",
        paramType.free(),
        resultType.free());
  }

  /** Creates a monomorphic function type. */
  public static <N> FnType<N> of(Type<N> paramType, Type<N> resultType) {
    return of(ImmutableList.of(), paramType, resultType);
  }

  /** Creates a function type that binds a list of type parameters. */
  public static <N> FnType<N> of(
      List<TypeParam<N>> typeParams, Type<N> paramType, Type<N> resultType) {
    return new FnType<>(
        ImmutableList.copyOf(typeParams), requireNonNull(paramType), resultType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, typeParams, paramType, resultType);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof FnType
            && typeParams.equals(((FnType<?>) obj).typeParams)
            && paramType.equals(((FnType<?>) obj).paramType)
            && resultType.equals(((FnType<?>) obj).resultType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    if (!typeParams.isEmpty()) {
      buf.append("forall ");
      Joiner.on(", ").appendTo(buf, typeParams).append(". ");
    }
    paramType.describe(buf).append(" -> ");
    return resultType.describe(buf).append(')');
  }
}

// End FnType.java
