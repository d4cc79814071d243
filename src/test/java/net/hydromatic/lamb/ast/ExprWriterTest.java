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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.lamb.type.ExistsType;
import net.hydromatic.lamb.type.FnType;
import net.hydromatic.lamb.type.Type;
import net.hydromatic.lamb.type.TypeParam;
import net.hydromatic.lamb.type.TypeVar;
import net.hydromatic.lamb.type.UnitType;
import net.hydromatic.lamb.util.Prop;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExprWriter}. */
public class ExprWriterTest {
  private static final Type<String> UNIT0 = UnitType.of(0);

  @Test
  void testLeaves() {
    assertThat(expr.<String>unit(0, 0), hasToString("()"));
    assertThat(expr.<String>move(2, 0, 1), hasToString("#1"));
    assertThat(expr.<String>copy(2, 0, 0), hasToString("copy #0"));
  }

  @Test
  void testAbs() {
    final Expr<String> id = expr.abs("x", UNIT0, expr.copy(1, 0, 0));
    assertThat(id, hasToString("fn (x : unit) => copy #0"));

    final Expr<String> poly =
        expr.abs(ImmutableList.of(TypeParam.of("a"), TypeParam.of("b")), "f",
            FnType.of(TypeVar.of(2, 0), TypeVar.of(2, 1)),
            expr.move(1, 2, 0));
    assertThat(poly, hasToString("fn [a, b] (f : ('t0 -> 't1)) => #0"));
  }

  @Test
  void testApp() {
    final Expr<String> id = expr.abs("x", UNIT0, expr.copy(1, 0, 0));
    assertThat(expr.app(id, expr.unit(0, 0)),
        hasToString("(fn (x : unit) => copy #0) (())"));

    final Expr<String> f = expr.move(1, 1, 0);
    final Expr<String> call =
        expr.app(f,
            ImmutableList.<Type<String>>of(UnitType.of(1), TypeVar.of(1, 0)),
            expr.unit(1, 1));
    assertThat(call, hasToString("#0 [unit, 't0] (())"));
    assertThat(expr.app(call, expr.unit(1, 1)),
        hasToString("#0 [unit, 't0] (()) (())"));
  }

  @Test
  void testLet() {
    final Expr<String> e =
        expr.let(ImmutableList.of("a", "b"),
            expr.pair(expr.copy(1, 0, 0), expr.move(1, 0, 0)),
            expr.move(3, 0, 1));
    assertThat(e, hasToString("let a, b = (copy #0, #0) in #1"));
  }

  @Test
  void testExists() {
    final Type<String> typeBody =
        ExistsType.of(ImmutableList.of("t"), TypeVar.of(1, 0));
    assertThat(typeBody, hasToString("(exists t. 't0)"));

    final Expr<String> packed =
        expr.makeExists(ImmutableList.of(expr.param("t", UNIT0)),
            TypeVar.of(1, 0), expr.unit(0, 0));
    assertThat(packed, hasToString("pack [t = unit] () as 't0"));

    final Expr<String> unpacked =
        expr.letExists(ImmutableList.of("t"), "p", packed, expr.move(1, 1, 0));
    assertThat(unpacked,
        hasToString("let exists [t] p = pack [t = unit] () as 't0 in #0"));
  }

  @Test
  void testContent() {
    final Expr<String> e = expr.pair(expr.unit(1, 0), expr.move(1, 0, 0));
    assertThat(e.toContent(), hasToString("((), #0)"));
  }

  @Test
  void testPrintDepth() {
    Expr<String> e = expr.unit(0, 0);
    for (int i = 0; i < 5; i++) {
      e = expr.pair(e, e);
    }
    final String s =
        new ExprWriter(ImmutableMap.<Prop, Object>of(Prop.PRINT_DEPTH, 2))
            .append(e)
            .toString();
    assertThat(s, is("((..., ...), (..., ...))"));

    final String s0 =
        new ExprWriter(ImmutableMap.<Prop, Object>of(Prop.PRINT_DEPTH, 0))
            .append(e)
            .toString();
    assertThat(s0, is("..."));
  }
}

// End ExprWriterTest.java
