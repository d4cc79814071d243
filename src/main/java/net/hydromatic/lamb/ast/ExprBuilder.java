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
package net.hydromatic.lamb.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.lamb.type.Type;
import net.hydromatic.lamb.type.TypeParam;

/**
 * Builds expressions.
 *
 * <p>Each method assembles the corresponding {@link ExprContent} and passes it
 * to {@link Expr#fromContent}, so each method throws {@link ScopeException}
 * under the same conditions.
 */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Creates a unit value in a scope. */
  public <N> Expr<N> unit(int freeVars, int freeTypes) {
    return Expr.fromContent(new ExprContent.Unit<>(freeVars, freeTypes));
  }

  /** Creates a variable occurrence. */
  public <N> Expr<N> var(VarUsage usage, int freeVars, int freeTypes,
      int index) {
    return Expr.fromContent(
        new ExprContent.Var<>(usage, freeVars, freeTypes, index));
  }

  /** Creates a variable occurrence that consumes its binding. */
  public <N> Expr<N> move(int freeVars, int freeTypes, int index) {
    return var(VarUsage.MOVE, freeVars, freeTypes, index);
  }

  /** Creates a variable occurrence that copies its binding. */
  public <N> Expr<N> copy(int freeVars, int freeTypes, int index) {
    return var(VarUsage.COPY, freeVars, freeTypes, index);
  }

  /** Creates a monomorphic abstraction. */
  public <N> Expr<N> abs(N argName, Type<N> argType, Expr<N> body) {
    return abs(ImmutableList.of(), argName, argType, body);
  }

  /** Creates an abstraction that binds type parameters. */
  public <N> Expr<N> abs(List<TypeParam<N>> typeParams, N argName,
      Type<N> argType, Expr<N> body) {
    return Expr.fromContent(
        new ExprContent.Abs<>(typeParams, argName, argType, body));
  }

  /** Creates an application without type arguments. */
  public <N> Expr<N> app(Expr<N> callee, Expr<N> arg) {
    return app(callee, ImmutableList.of(), arg);
  }

  /** Creates an application. */
  public <N> Expr<N> app(Expr<N> callee, List<Type<N>> typeArgs,
      Expr<N> arg) {
    return Expr.fromContent(new ExprContent.App<>(callee, typeArgs, arg));
  }

  /** Creates a pair. */
  public <N> Expr<N> pair(Expr<N> left, Expr<N> right) {
    return Expr.fromContent(new ExprContent.Pair<>(left, right));
  }

  /** Creates a let that binds one or more variables. */
  public <N> Expr<N> let(List<N> names, Expr<N> val, Expr<N> body) {
    return Expr.fromContent(new ExprContent.Let<>(names, val, body));
  }

  /** Creates an unpacking of an existential. */
  public <N> Expr<N> letExists(List<N> typeNames, N valName, Expr<N> val,
      Expr<N> body) {
    return Expr.fromContent(
        new ExprContent.LetExists<>(typeNames, valName, val, body));
  }

  /** Creates a packing of an existential. */
  public <N> Expr<N> makeExists(List<Map.Entry<N, Type<N>>> params,
      Type<N> typeBody, Expr<N> body) {
    return Expr.fromContent(
        new ExprContent.MakeExists<>(params, typeBody, body));
  }

  /** Creates a parameter of {@link #makeExists}. */
  public <N> Map.Entry<N, Type<N>> param(N name, Type<N> type) {
    return Maps.immutableEntry(name, type);
  }
}

// End ExprBuilder.java
