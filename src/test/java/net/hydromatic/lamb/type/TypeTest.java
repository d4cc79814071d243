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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.lamb.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for types. */
public class TypeTest {
  @Test
  void testFree() {
    assertThat(UnitType.of(3).free(), is(3));
    assertThat(TypeVar.of(3, 2).free(), is(3));
    assertThat(PairType.of(TypeVar.of(2, 0), UnitType.of(2)).free(), is(2));

    // forall a, b. 't0 -> 't2 has one free type variable
    final FnType<String> fn =
        FnType.of(ImmutableList.of(TypeParam.of("a"), TypeParam.of("b")),
            TypeVar.of(3, 0), TypeVar.of(3, 2));
    assertThat(fn.free(), is(1));
    assertThat(fn.op(), is(Op.FN_TYPE));
    assertThat(fn.op().isExpr(), is(false));
    assertThat(fn, hasToString("(forall a, b. 't0 -> 't2)"));

    final ExistsType<String> exists =
        ExistsType.of(ImmutableList.of("t"), PairType.of(TypeVar.of(2, 0),
            TypeVar.of(2, 1)));
    assertThat(exists.free(), is(1));
    assertThat(exists, hasToString("(exists t. ('t0 * 't1))"));
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> UnitType.of(-1));
    assertThrows(IllegalArgumentException.class, () -> TypeVar.of(2, 2));
    assertThrows(IllegalArgumentException.class, () -> TypeVar.of(2, -1));
    assertThrows(IllegalArgumentException.class,
        () -> PairType.of(UnitType.of(1), UnitType.of(2)));
    assertThrows(IllegalArgumentException.class,
        () -> FnType.of(UnitType.of(1), UnitType.of(0)));
    assertThrows(IllegalArgumentException.class,
        () -> FnType.of(ImmutableList.of(TypeParam.of("a")), UnitType.of(0),
            UnitType.of(0)));
    assertThrows(IllegalArgumentException.class,
        () -> ExistsType.of(ImmutableList.of(), UnitType.of(0)));
    assertThrows(NullPointerException.class, () -> TypeParam.of(null));
  }

  @Test
  void testEquals() {
    assertThat(TypeVar.of(2, 1), is(TypeVar.of(2, 1)));
    assertThat(TypeVar.of(2, 1), not(is(TypeVar.of(3, 1))));
    assertThat(UnitType.of(0), not(is(UnitType.of(1))));
    assertThat(FnType.of(UnitType.of(0), UnitType.of(0)),
        is(FnType.of(UnitType.of(0), UnitType.of(0))));
    assertThat(
        ExistsType.of(ImmutableList.of("s"), TypeVar.of(1, 0)),
        not(is(ExistsType.of(ImmutableList.of("t"), TypeVar.of(1, 0)))));
    assertThat(
        ExistsType.of(ImmutableList.of("t"), TypeVar.of(1, 0)).hashCode(),
        is(ExistsType.of(ImmutableList.of("t"), TypeVar.of(1, 0)).hashCode()));
  }
}

// End TypeTest.java
