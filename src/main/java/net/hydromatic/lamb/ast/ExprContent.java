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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.lamb.type.Type;
import net.hydromatic.lamb.type.TypeParam;

/**
 * One level of an {@link Expr}, exposed.
 *
 * <p>There is one sub-class per shape. Every child is itself a complete
 * {@link Expr}, with free-variable counts already adjusted for the scope it
 * lives in. Contents are transient: build one and pass it to {@link
 * Expr#fromContent}, or get one from {@link Expr#toContent()} and read it.
 *
 * <p>Constructors do not check scopes; {@link Expr#fromContent} does.
 *
 * @param <N> Type of names carried on binders
 */
public abstract class ExprContent<N> {
  public final Op op;

  ExprContent(Op op) {
    this.op = requireNonNull(op);
  }

  /** Returns a description of this content, for debugging. */
  @Override
  public String toString() {
    return new ExprWriter().append(this).toString();
  }

  /** The unit value, in a given scope. */
  public static final class Unit<N> extends ExprContent<N> {
    public final int freeVars;
    public final int freeTypes;

    public Unit(int freeVars, int freeTypes) {
      super(Op.UNIT);
      this.freeVars = freeVars;
      this.freeTypes = freeTypes;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, freeVars, freeTypes);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Unit
              && freeVars == ((Unit<?>) obj).freeVars
              && freeTypes == ((Unit<?>) obj).freeTypes;
    }
  }

  /** Occurrence of the variable with de Bruijn index {@code index}. */
  public static final class Var<N> extends ExprContent<N> {
    public final VarUsage usage;
    public final int freeVars;
    public final int freeTypes;
    public final int index;

    public Var(VarUsage usage, int freeVars, int freeTypes, int index) {
      super(Op.VAR);
      this.usage = requireNonNull(usage);
      this.freeVars = freeVars;
      this.freeTypes = freeTypes;
      this.index = index;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, usage, freeVars, freeTypes, index);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Var
              && usage == ((Var<?>) obj).usage
              && freeVars == ((Var<?>) obj).freeVars
              && freeTypes == ((Var<?>) obj).freeTypes
              && index == ((Var<?>) obj).index;
    }
  }

  /**
   * Abstraction, "{@code fn [typeParams] (argName : argType) => body}".
   *
   * <p>Binds the type parameters and one term variable. The argument type is
   * in the inner scope, so it may mention the type parameters; it must have
   * exactly {@code body.freeTypes()} free type variables.
   */
  public static final class Abs<N> extends ExprContent<N> {
    public final ImmutableList<TypeParam<N>> typeParams;
    public final N argName;
    public final Type<N> argType;
    public final Expr<N> body;

    public Abs(List<TypeParam<N>> typeParams, N argName, Type<N> argType,
        Expr<N> body) {
      super(Op.ABS);
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.argName = requireNonNull(argName, "argName");
      this.argType = requireNonNull(argType, "argType");
      this.body = requireNonNull(body, "body");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, typeParams, argName, argType, body);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Abs
              && typeParams.equals(((Abs<?>) obj).typeParams)
              && argName.equals(((Abs<?>) obj).argName)
              && argType.equals(((Abs<?>) obj).argType)
              && body.equals(((Abs<?>) obj).body);
    }
  }

  /**
   * Application, "{@code callee [typeArgs] arg}".
   *
   * <p>The type arguments instantiate the callee's type parameters; this
   * layer carries them but does not check them.
   */
  public static final class App<N> extends ExprContent<N> {
    public final Expr<N> callee;
    public final ImmutableList<Type<N>> typeArgs;
    public final Expr<N> arg;

    public App(Expr<N> callee, List<Type<N>> typeArgs, Expr<N> arg) {
      super(Op.APP);
      this.callee = requireNonNull(callee, "callee");
      this.typeArgs = ImmutableList.copyOf(typeArgs);
      this.arg = requireNonNull(arg, "arg");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, callee, typeArgs, arg);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof App
              && callee.equals(((App<?>) obj).callee)
              && typeArgs.equals(((App<?>) obj).typeArgs)
              && arg.equals(((App<?>) obj).arg);
    }
  }

  /** Pair, "{@code (left, right)}". */
  public static final class Pair<N> extends ExprContent<N> {
    public final Expr<N> left;
    public final Expr<N> right;

    public Pair(Expr<N> left, Expr<N> right) {
      super(Op.PAIR);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Pair
              && left.equals(((Pair<?>) obj).left)
              && right.equals(((Pair<?>) obj).right);
    }
  }

  /**
   * Let, "{@code let names = val in body}".
   *
   * <p>Binds all of {@code names} at once; the body has {@code names.size()}
   * more free term variables than {@code val}.
   */
  public static final class Let<N> extends ExprContent<N> {
    public final ImmutableList<N> names;
    public final Expr<N> val;
    public final Expr<N> body;

    public Let(List<N> names, Expr<N> val, Expr<N> body) {
      super(Op.LET);
      this.names = ImmutableList.copyOf(names);
      this.val = requireNonNull(val, "val");
      this.body = requireNonNull(body, "body");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, names, val, body);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Let
              && names.equals(((Let<?>) obj).names)
              && val.equals(((Let<?>) obj).val)
              && body.equals(((Let<?>) obj).body);
    }
  }

  /**
   * Unpacking of an existential, "{@code let exists [typeNames] valName = val
   * in body}".
   *
   * <p>Binds the hidden types and the underlying value; the body has {@code
   * typeNames.size()} more free type variables and one more free term variable
   * than {@code val}.
   */
  public static final class LetExists<N> extends ExprContent<N> {
    public final ImmutableList<N> typeNames;
    public final N valName;
    public final Expr<N> val;
    public final Expr<N> body;

    public LetExists(List<N> typeNames, N valName, Expr<N> val,
        Expr<N> body) {
      super(Op.LET_EXISTS);
      this.typeNames = ImmutableList.copyOf(typeNames);
      this.valName = requireNonNull(valName, "valName");
      this.val = requireNonNull(val, "val");
      this.body = requireNonNull(body, "body");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, typeNames, valName, val, body);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof LetExists
              && typeNames.equals(((LetExists<?>) obj).typeNames)
              && valName.equals(((LetExists<?>) obj).valName)
              && val.equals(((LetExists<?>) obj).val)
              && body.equals(((LetExists<?>) obj).body);
    }
  }

  /**
   * Packing of an existential, "{@code pack [name = type, ...] body as
   * typeBody}".
   *
   * <p>Each param gives a name and the concrete type for one hidden slot, in
   * the scope of {@code body}. {@code typeBody} is the abstract scheme, with
   * {@code params.size()} more free type variables than {@code body}.
   */
  public static final class MakeExists<N> extends ExprContent<N> {
    public final ImmutableList<Map.Entry<N, Type<N>>> params;
    public final Type<N> typeBody;
    public final Expr<N> body;

    public MakeExists(List<Map.Entry<N, Type<N>>> params, Type<N> typeBody,
        Expr<N> body) {
      super(Op.MAKE_EXISTS);
      final ImmutableList.Builder<Map.Entry<N, Type<N>>> b =
          ImmutableList.builder();
      for (Map.Entry<N, Type<N>> param : params) {
        // copy each entry; the caller's may be mutable
        b.add(
            Maps.immutableEntry(requireNonNull(param.getKey(), "name"),
                requireNonNull(param.getValue(), "type")));
      }
      this.params = b.build();
      this.typeBody = requireNonNull(typeBody, "typeBody");
      this.body = requireNonNull(body, "body");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, params, typeBody, body);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof MakeExists
              && params.equals(((MakeExists<?>) obj).params)
              && typeBody.equals(((MakeExists<?>) obj).typeBody)
              && body.equals(((MakeExists<?>) obj).body);
    }
  }
}

// End ExprContent.java
