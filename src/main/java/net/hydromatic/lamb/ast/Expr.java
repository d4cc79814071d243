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

/**
 * Expression.
 *
 * <p>An expression is a handle: the number of free term variables and free
 * type variables in its scope, plus a shared reference to a raw tree. It is
 * well scoped by construction. Every variable reachable from the root refers
 * to a binder inside the expression or to one of the {@link #freeVars()}
 * slots of its scope, and every type mentions only the type variables in
 * scope at that point.
 *
 * <p>The only way to build an expression is {@link #fromContent} (or one of
 * the methods of {@link ExprBuilder} and {@link ExprFactory} that call it); the
 * only way to look inside one is {@link #toContent()}, which unfolds a single
 * level. The two are inverses:
 *
 * <ul>
 *   <li>{@code Expr.fromContent(e.toContent()).equals(e)} for every
 *       expression {@code e};
 *   <li>{@code Expr.fromContent(c).toContent().equals(c)} for every content
 *       {@code c} that {@link #fromContent} accepts.
 * </ul>
 *
 * <p>Expressions are immutable. Copying one is copying the reference; the
 * tree underneath is never copied.
 *
 * <p>Equality is structural and deep, and includes the names on binders. Two
 * expressions that differ only in the spelling of bound names are not equal.
 *
 * @param <N> Type of names carried on binders
 */
public final class Expr<N> {
  private final int freeVars;
  private final int freeTypes;
  final Node<N> node;

  Expr(int freeVars, int freeTypes, Node<N> node) {
    this.freeVars = freeVars;
    this.freeTypes = freeTypes;
    this.node = requireNonNull(node);
  }

  /** Returns the number of free term variables in scope. */
  public int freeVars() {
    return freeVars;
  }

  /** Returns the number of free type variables in scope. */
  public int freeTypes() {
    return freeTypes;
  }

  /** Returns the shape of this expression. */
  public Op op() {
    return node.op;
  }

  /**
   * Creates an expression from its content, using the default {@link
   * ExprFactory}.
   *
   * @throws ScopeException if the counts of the parts are inconsistent
   */
  public static <N> Expr<N> fromContent(ExprContent<N> content) {
    return ExprFactory.DEFAULT.fromContent(content);
  }

  /**
   * Unfolds one level of this expression.
   *
   * <p>Each child in the result is a complete expression whose counts are
   * those of this expression plus whatever the binder between them
   * introduces. Never fails.
   */
  public ExprContent<N> toContent() {
    switch (node.op) {
    case UNIT:
      return new ExprContent.Unit<>(freeVars, freeTypes);

    case VAR:
      final Node.Var<N> v = (Node.Var<N>) node;
      return new ExprContent.Var<>(v.usage, freeVars, freeTypes, v.index);

    case ABS:
      final Node.Abs<N> abs = (Node.Abs<N>) node;
      return new ExprContent.Abs<>(abs.typeParams, abs.argName, abs.argType,
          child(1, abs.typeParams.size(), abs.body));

    case APP:
      final Node.App<N> app = (Node.App<N>) node;
      return new ExprContent.App<>(child(0, 0, app.callee), app.typeArgs,
          child(0, 0, app.arg));

    case PAIR:
      final Node.Pair<N> pair = (Node.Pair<N>) node;
      return new ExprContent.Pair<>(child(0, 0, pair.left),
          child(0, 0, pair.right));

    case LET:
      final Node.Let<N> let = (Node.Let<N>) node;
      return new ExprContent.Let<>(let.names, child(0, 0, let.val),
          child(let.names.size(), 0, let.body));

    case LET_EXISTS:
      final Node.LetExists<N> letExists = (Node.LetExists<N>) node;
      return new ExprContent.LetExists<>(letExists.typeNames,
          letExists.valName, child(0, 0, letExists.val),
          child(1, letExists.typeNames.size(), letExists.body));

    case MAKE_EXISTS:
      final Node.MakeExists<N> makeExists = (Node.MakeExists<N>) node;
      return new ExprContent.MakeExists<>(makeExists.params,
          makeExists.typeBody, child(0, 0, makeExists.body));

    default:
      throw new AssertionError("unexpected " + node.op);
    }
  }

  /**
   * Wraps a child node in an expression whose scope is this expression's scope
   * extended by {@code vars} term variables and {@code types} type variables.
   */
  private Expr<N> child(int vars, int types, Node<N> child) {
    return new Expr<>(freeVars + vars, freeTypes + types, child);
  }

  @Override
  public int hashCode() {
    return (freeVars * 31 + freeTypes) * 31 + node.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Expr
            && freeVars == ((Expr<?>) obj).freeVars
            && freeTypes == ((Expr<?>) obj).freeTypes
            && node.equals(((Expr<?>) obj).node);
  }

  /**
   * Returns a description of this expression, for debugging.
   *
   * @see ExprWriter
   */
  @Override
  public String toString() {
    return new ExprWriter().append(this).toString();
  }
}

// End Expr.java
