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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.lamb.type.Type;
import net.hydromatic.lamb.util.Prop;
import net.hydromatic.lamb.util.Tracer;
import net.hydromatic.lamb.util.Tracers;

/**
 * Builds expressions from their content, checking that the parts are
 * consistently scoped.
 *
 * <p>Each check is local to one level; the children were checked when they
 * were built. A failed check throws {@link ScopeException}, after reporting it
 * to the tracer, and no expression is produced.
 *
 * <p>A factory is immutable, and may be shared between threads if its tracer
 * may.
 */
public class ExprFactory {
  /** Factory with default properties and no tracing. */
  public static final ExprFactory DEFAULT =
      new ExprFactory(ImmutableMap.of(), Tracers.empty());

  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private final boolean checkAppScope;

  private ExprFactory(ImmutableMap<Prop, Object> props, Tracer tracer) {
    this.props = props;
    this.tracer = requireNonNull(tracer);
    this.checkAppScope = Prop.CHECK_APP_SCOPE.booleanValue(props);
  }

  /** Creates a factory with the given properties and tracer. */
  public static ExprFactory create(Map<Prop, Object> props, Tracer tracer) {
    return new ExprFactory(ImmutableMap.copyOf(props), tracer);
  }

  /** Returns a copy of this factory with a different tracer. */
  public ExprFactory withTracer(Tracer tracer) {
    return tracer == this.tracer ? this : new ExprFactory(props, tracer);
  }

  /** Returns the properties of this factory. */
  public ImmutableMap<Prop, Object> props() {
    return props;
  }

  /**
   * Creates an expression from its content.
   *
   * @throws ScopeException if the counts of the parts are inconsistent
   */
  public <N> Expr<N> fromContent(ExprContent<N> content) {
    final Expr<N> expr = build(requireNonNull(content, "content"));
    tracer.onExpr(expr);
    return expr;
  }

  private <N> Expr<N> build(ExprContent<N> content) {
    switch (content.op) {
    case UNIT:
      final ExprContent.Unit<N> unit = (ExprContent.Unit<N>) content;
      checkCounts(unit.freeVars, unit.freeTypes);
      return new Expr<>(unit.freeVars, unit.freeTypes, Node.Unit.instance());

    case VAR:
      final ExprContent.Var<N> v = (ExprContent.Var<N>) content;
      checkCounts(v.freeVars, v.freeTypes);
      if (v.index < 0 || v.index >= v.freeVars) {
        throw fail(ScopeException.Kind.INDEX_OUT_OF_RANGE, content.op,
            "variable index %s out of range; %s free term variables",
            v.index, v.freeVars);
      }
      return new Expr<>(v.freeVars, v.freeTypes,
          new Node.Var<>(v.usage, v.index));

    case ABS:
      return abs((ExprContent.Abs<N>) content);

    case APP:
      final ExprContent.App<N> app = (ExprContent.App<N>) content;
      if (checkAppScope) {
        checkSameScope(content.op, app.callee, app.arg);
      }
      return new Expr<>(app.arg.freeVars(), app.arg.freeTypes(),
          new Node.App<>(app.callee.node, app.typeArgs, app.arg.node));

    case PAIR:
      final ExprContent.Pair<N> pair = (ExprContent.Pair<N>) content;
      checkSameScope(content.op, pair.left, pair.right);
      return new Expr<>(pair.left.freeVars(), pair.left.freeTypes(),
          new Node.Pair<>(pair.left.node, pair.right.node));

    case LET:
      return let((ExprContent.Let<N>) content);

    case LET_EXISTS:
      return letExists((ExprContent.LetExists<N>) content);

    case MAKE_EXISTS:
      return makeExists((ExprContent.MakeExists<N>) content);

    default:
      throw new AssertionError("unexpected " + content.op);
    }
  }

  private <N> Expr<N> abs(ExprContent.Abs<N> abs) {
    final Expr<N> body = abs.body;
    if (abs.argType.free() != body.freeTypes()) {
      throw fail(ScopeException.Kind.TYPE_ARITY_MISMATCH, abs.op,
          "free type variables do not match: argument type has %s, "
              + "body has %s",
          abs.argType.free(), body.freeTypes());
    }
    if (abs.typeParams.size() > body.freeTypes()) {
      throw fail(ScopeException.Kind.BINDER_ARITY_MISMATCH, abs.op,
          "must have at least %s free type variables; body has %s",
          abs.typeParams.size(), body.freeTypes());
    }
    if (body.freeVars() < 1) {
      throw fail(ScopeException.Kind.BINDER_ARITY_MISMATCH, abs.op,
          "must have at least one free term variable; body has %s",
          body.freeVars());
    }
    return new Expr<>(body.freeVars() - 1,
        body.freeTypes() - abs.typeParams.size(),
        new Node.Abs<>(abs.typeParams, abs.argName, abs.argType, body.node));
  }

  private <N> Expr<N> let(ExprContent.Let<N> let) {
    if (let.names.isEmpty()) {
      throw fail(ScopeException.Kind.EMPTY_BINDER_LIST, let.op,
          "must bind at least one variable");
    }
    if (let.val.freeTypes() != let.body.freeTypes()) {
      throw fail(ScopeException.Kind.BINDER_ARITY_MISMATCH, let.op,
          "free type variables do not match: value has %s, body has %s",
          let.val.freeTypes(), let.body.freeTypes());
    }
    if (let.val.freeVars() + let.names.size() != let.body.freeVars()) {
      throw fail(ScopeException.Kind.BINDER_ARITY_MISMATCH, let.op,
          "free term variables do not match: value has %s and %s names "
              + "are bound, but body has %s",
          let.val.freeVars(), let.names.size(), let.body.freeVars());
    }
    return new Expr<>(let.val.freeVars(), let.val.freeTypes(),
        new Node.Let<>(let.names, let.val.node, let.body.node));
  }

  private <N> Expr<N> letExists(ExprContent.LetExists<N> letExists) {
    final Expr<N> val = letExists.val;
    final Expr<N> body = letExists.body;
    if (letExists.typeNames.isEmpty()) {
      throw fail(ScopeException.Kind.EMPTY_BINDER_LIST, letExists.op,
          "must bind at least one type");
    }
    if (val.freeTypes() + letExists.typeNames.size() != body.freeTypes()) {
      throw fail(ScopeException.Kind.BINDER_ARITY_MISMATCH, letExists.op,
          "free type variables do not match: value has %s and %s types "
              + "are bound, but body has %s",
          val.freeTypes(), letExists.typeNames.size(), body.freeTypes());
    }
    if (val.freeVars() + 1 != body.freeVars()) {
      throw fail(ScopeException.Kind.BINDER_ARITY_MISMATCH, letExists.op,
          "free term variables do not match: value has %s, body has %s",
          val.freeVars(), body.freeVars());
    }
    return new Expr<>(val.freeVars(), val.freeTypes(),
        new Node.LetExists<>(letExists.typeNames, letExists.valName,
            val.node, body.node));
  }

  private <N> Expr<N> makeExists(ExprContent.MakeExists<N> makeExists) {
    final Expr<N> body = makeExists.body;
    if (makeExists.params.isEmpty()) {
      throw fail(ScopeException.Kind.EMPTY_BINDER_LIST, makeExists.op,
          "must bind at least one type");
    }
    if (body.freeTypes() + makeExists.params.size()
        != makeExists.typeBody.free()) {
      throw fail(ScopeException.Kind.TYPE_ARITY_MISMATCH, makeExists.op,
          "free type variables do not match: body has %s and %s types "
              + "are hidden, but type body has %s",
          body.freeTypes(), makeExists.params.size(),
          makeExists.typeBody.free());
    }
    for (Map.Entry<N, Type<N>> param : makeExists.params) {
      if (param.getValue().free() != body.freeTypes()) {
        throw fail(ScopeException.Kind.TYPE_ARITY_MISMATCH, makeExists.op,
            "free type variables do not match: type of %s has %s, "
                + "body has %s",
            param.getKey(), param.getValue().free(), body.freeTypes());
      }
    }
    return new Expr<>(body.freeVars(), body.freeTypes(),
        new Node.MakeExists<>(makeExists.params, makeExists.typeBody,
            body.node));
  }

  /** Checks that two sibling expressions are in the same scope. */
  private void checkSameScope(Op op, Expr<?> left, Expr<?> right) {
    if (left.freeVars() != right.freeVars()) {
      throw fail(ScopeException.Kind.SCOPE_MISMATCH, op,
          "free term variables do not match: %s vs %s",
          left.freeVars(), right.freeVars());
    }
    if (left.freeTypes() != right.freeTypes()) {
      throw fail(ScopeException.Kind.SCOPE_MISMATCH, op,
          "free type variables do not match: %s vs %s",
          left.freeTypes(), right.freeTypes());
    }
  }

  private static void checkCounts(int freeVars, int freeTypes) {
    checkArgument(freeVars >= 0, "negative free term count %s", freeVars);
    checkArgument(freeTypes >= 0, "negative free type count %s", freeTypes);
  }

  /** Creates a scope exception and reports it to the tracer. */
  private ScopeException fail(ScopeException.Kind kind, Op op,
      String format, Object... args) {
    final ScopeException e =
        new ScopeException(kind, op, String.format(format, args));
    tracer.onScopeException(e);
    return e;
  }
}

// End ExprFactory.java
