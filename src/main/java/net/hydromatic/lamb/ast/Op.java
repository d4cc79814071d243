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

/**
 * Shapes of expressions and of types.
 *
 * <p>Every {@link Expr}, every {@link ExprContent} and every {@link
 * net.hydromatic.lamb.type.Type} has exactly one op. Consumers generally
 * switch on it rather than using {@code instanceof}.
 */
public enum Op {
  // expressions
  UNIT,
  VAR,
  /** Binds a block of type parameters and one term variable. */
  ABS,
  APP,
  PAIR,
  /** Binds a block of term variables; type scope unchanged. */
  LET,
  /** Binds one term variable and a block of type variables. */
  LET_EXISTS,
  /**
   * Packs a value; the hidden types are bound in the type body only, so the
   * body of the expression sees no new variables.
   */
  MAKE_EXISTS,

  // types
  TY_VAR,
  UNIT_TYPE,
  PAIR_TYPE,
  FN_TYPE,
  EXISTS_TYPE;

  /** Returns whether this is an expression op (as opposed to a type op). */
  public boolean isExpr() {
    return ordinal() <= MAKE_EXISTS.ordinal();
  }
}

// End Op.java
