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

import static net.hydromatic.lamb.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lamb.type.UnitType;
import net.hydromatic.lamb.util.Prop;
import net.hydromatic.lamb.util.Tracer;
import net.hydromatic.lamb.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExprFactory}. */
public class ExprFactoryTest {
  @Test
  void testTracerSeesEachExpr() {
    final List<Expr<?>> built = new ArrayList<>();
    final ExprFactory factory =
        ExprFactory.DEFAULT.withTracer(
            Tracers.withOnExpr(Tracers.empty(), built::add));
    final Expr<String> x =
        factory.fromContent(new ExprContent.Var<>(VarUsage.MOVE, 1, 0, 0));
    final Expr<String> f =
        factory.fromContent(
            new ExprContent.Abs<>(ImmutableList.of(), "x", UnitType.of(0), x));
    assertThat(built, hasSize(2));
    assertThat(built.get(0), sameInstance(x));
    assertThat(built.get(1), sameInstance(f));
  }

  @Test
  void testTracerSeesScopeException() {
    final List<ScopeException> failures = new ArrayList<>();
    final List<Expr<?>> built = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnExpr(
            Tracers.withOnScopeException(Tracers.empty(), failures::add),
            built::add);
    final ExprFactory factory = ExprFactory.DEFAULT.withTracer(tracer);
    final ScopeException e =
        assertThrows(ScopeException.class,
            () -> factory.fromContent(
                new ExprContent.Let<>(ImmutableList.of("x", "y"),
                    expr.<String>unit(2, 0), expr.<String>unit(3, 0))));
    assertThat(e.kind, is(ScopeException.Kind.BINDER_ARITY_MISMATCH));
    assertThat(e.op, is(Op.LET));
    assertThat(failures, hasSize(1));
    assertThat(failures.get(0), sameInstance(e));
    assertThat(built, hasSize(0));
  }

  @Test
  void testPrintTracer() {
    final StringWriter sw = new StringWriter();
    final ExprFactory factory =
        ExprFactory.DEFAULT.withTracer(
            Tracers.printTracer(Tracers.empty(), new PrintWriter(sw)));
    assertThrows(ScopeException.class,
        () -> factory.fromContent(
            new ExprContent.Var<String>(VarUsage.COPY, 3, 0, 3)));
    assertThat(sw.toString().trim(),
        is("VAR Error: variable index 3 out of range; "
            + "3 free term variables"));
  }

  /** When the application check is off, the callee's scope is not checked,
   * and the application takes the argument's counts. */
  @Test
  void testUncheckedApp() {
    final ExprFactory factory =
        ExprFactory.create(
            ImmutableMap.<Prop, Object>of(Prop.CHECK_APP_SCOPE, false),
            Tracers.empty());
    assertThat(Prop.CHECK_APP_SCOPE.booleanValue(factory.props()), is(false));
    final Expr<String> callee = expr.move(1, 0, 0);
    final Expr<String> arg = expr.unit(2, 0);
    final Expr<String> app =
        factory.fromContent(
            new ExprContent.App<>(callee, ImmutableList.of(), arg));
    assertThat(app.freeVars(), is(2));
    assertThat(app.freeTypes(), is(0));

    // The callee comes back in the application's scope, not its own
    final ExprContent.App<String> content =
        (ExprContent.App<String>) app.toContent();
    assertThat(content.arg, is(arg));
    assertThat(content.callee, not(is(callee)));
    assertThat(content.callee.freeVars(), is(2));

    // The default factory rejects the same content
    final ScopeException e =
        assertThrows(ScopeException.class,
            () -> Expr.fromContent(
                new ExprContent.App<>(callee, ImmutableList.of(), arg)));
    assertThat(e.kind, is(ScopeException.Kind.SCOPE_MISMATCH));
  }

  @Test
  void testWithSameTracer() {
    final ExprFactory factory = ExprFactory.DEFAULT;
    assertThat(factory.withTracer(Tracers.empty()), sameInstance(factory));
  }

  @Test
  void testNullContent() {
    assertThrows(NullPointerException.class,
        () -> ExprFactory.DEFAULT.fromContent(null));
  }
}

// End ExprFactoryTest.java
