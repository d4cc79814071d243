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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.lamb.type.Type;
import net.hydromatic.lamb.type.TypeParam;

/**
 * Raw expression tree.
 *
 * <p>A node does not know its own free-variable counts; those are cached in
 * the {@link Expr} that points to it and re-derived for each child by {@link
 * Expr#toContent()}. Nodes are immutable and may be shared by any number of
 * expressions. Structural hash codes are computed once, at construction, from
 * the already-computed hash codes of the children. Equality is checked
 * without recursion, so arbitrarily deep trees can be compared.
 *
 * <p>Only {@link ExprFactory} creates nodes.
 *
 * @param <N> Type of names carried on binders
 */
abstract class Node<N> {
  final Op op;
  private final int hash;

  Node(Op op, int hash) {
    this.op = requireNonNull(op);
    this.hash = hash;
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  @Override
  public final boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    final Deque<Node<?>> pending = new ArrayDeque<>();
    push(pending, this, (Node<?>) obj);
    while (!pending.isEmpty()) {
      final Node<?> right = pending.pop();
      final Node<?> left = pending.pop();
      if (left != right
          && (left.hash != right.hash
              || left.op != right.op
              || !left.sameContent(right, pending))) {
        return false;
      }
    }
    return true;
  }

  /** Schedules a pair of child nodes for comparison. */
  static void push(Deque<Node<?>> pending, Node<?> left, Node<?> right) {
    pending.push(left);
    pending.push(right);
  }

  /**
   * Returns whether this node has the same local content as another node of
   * the same op, and pushes pairs of children onto {@code pending} to be
   * compared later.
   */
  abstract boolean sameContent(Node<?> node, Deque<Node<?>> pending);

  /** Leaf for the unit value. All unit nodes are the same node. */
  static final class Unit<N> extends Node<N> {
    @SuppressWarnings("rawtypes")
    private static final Unit INSTANCE = new Unit<>();

    private Unit() {
      super(Op.UNIT, Op.UNIT.hashCode());
    }

    @SuppressWarnings("unchecked")
    static <N> Unit<N> instance() {
      return (Unit<N>) INSTANCE;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      return true;
    }
  }

  /** Leaf for a variable occurrence. */
  static final class Var<N> extends Node<N> {
    final VarUsage usage;
    final int index;

    Var(VarUsage usage, int index) {
      super(Op.VAR, Objects.hash(Op.VAR, usage, index));
      this.usage = requireNonNull(usage);
      this.index = index;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final Var<?> var = (Var<?>) node;
      return usage == var.usage && index == var.index;
    }
  }

  /** Abstraction node. */
  static final class Abs<N> extends Node<N> {
    final ImmutableList<TypeParam<N>> typeParams;
    final N argName;
    final Type<N> argType;
    final Node<N> body;

    Abs(
        ImmutableList<TypeParam<N>> typeParams,
        N argName,
        Type<N> argType,
        Node<N> body) {
      super(Op.ABS, Objects.hash(Op.ABS, typeParams, argName, argType, body));
      this.typeParams = typeParams;
      this.argName = argName;
      this.argType = argType;
      this.body = body;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final Abs<?> abs = (Abs<?>) node;
      if (!typeParams.equals(abs.typeParams)
          || !argName.equals(abs.argName)
          || !argType.equals(abs.argType)) {
        return false;
      }
      push(pending, body, abs.body);
      return true;
    }
  }

  /** Application node. */
  static final class App<N> extends Node<N> {
    final Node<N> callee;
    final ImmutableList<Type<N>> typeArgs;
    final Node<N> arg;

    App(Node<N> callee, ImmutableList<Type<N>> typeArgs, Node<N> arg) {
      super(Op.APP, Objects.hash(Op.APP, callee, typeArgs, arg));
      this.callee = callee;
      this.typeArgs = typeArgs;
      this.arg = arg;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final App<?> app = (App<?>) node;
      if (!typeArgs.equals(app.typeArgs)) {
        return false;
      }
      push(pending, callee, app.callee);
      push(pending, arg, app.arg);
      return true;
    }
  }

  /** Pair node. */
  static final class Pair<N> extends Node<N> {
    final Node<N> left;
    final Node<N> right;

    Pair(Node<N> left, Node<N> right) {
      super(Op.PAIR, Objects.hash(Op.PAIR, left, right));
      this.left = left;
      this.right = right;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final Pair<?> pair = (Pair<?>) node;
      push(pending, left, pair.left);
      push(pending, right, pair.right);
      return true;
    }
  }

  /** Let node; binds {@code names.size()} term variables in the body. */
  static final class Let<N> extends Node<N> {
    final ImmutableList<N> names;
    final Node<N> val;
    final Node<N> body;

    Let(ImmutableList<N> names, Node<N> val, Node<N> body) {
      super(Op.LET, Objects.hash(Op.LET, names, val, body));
      this.names = names;
      this.val = val;
      this.body = body;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final Let<?> let = (Let<?>) node;
      if (!names.equals(let.names)) {
        return false;
      }
      push(pending, val, let.val);
      push(pending, body, let.body);
      return true;
    }
  }

  /**
   * Existential unpacking node; binds {@code typeNames.size()} type variables
   * and one term variable in the body.
   */
  static final class LetExists<N> extends Node<N> {
    final ImmutableList<N> typeNames;
    final N valName;
    final Node<N> val;
    final Node<N> body;

    LetExists(ImmutableList<N> typeNames, N valName, Node<N> val,
        Node<N> body) {
      super(Op.LET_EXISTS,
          Objects.hash(Op.LET_EXISTS, typeNames, valName, val, body));
      this.typeNames = typeNames;
      this.valName = valName;
      this.val = val;
      this.body = body;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final LetExists<?> letExists = (LetExists<?>) node;
      if (!typeNames.equals(letExists.typeNames)
          || !valName.equals(letExists.valName)) {
        return false;
      }
      push(pending, val, letExists.val);
      push(pending, body, letExists.body);
      return true;
    }
  }

  /** Existential packing node. */
  static final class MakeExists<N> extends Node<N> {
    final ImmutableList<Map.Entry<N, Type<N>>> params;
    final Type<N> typeBody;
    final Node<N> body;

    MakeExists(ImmutableList<Map.Entry<N, Type<N>>> params, Type<N> typeBody,
        Node<N> body) {
      super(Op.MAKE_EXISTS,
          Objects.hash(Op.MAKE_EXISTS, params, typeBody, body));
      this.params = params;
      this.typeBody = typeBody;
      this.body = body;
    }

    @Override
    boolean sameContent(Node<?> node, Deque<Node<?>> pending) {
      final MakeExists<?> makeExists = (MakeExists<?>) node;
      if (!params.equals(makeExists.params)
          || !typeBody.equals(makeExists.typeBody)) {
        return false;
      }
      push(pending, body, makeExists.body);
      return true;
    }
  }
}

// End Node.java
