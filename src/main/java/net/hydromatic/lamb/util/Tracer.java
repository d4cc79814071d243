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
package net.hydromatic.lamb.util;

import net.hydromatic.lamb.ast.Expr;
import net.hydromatic.lamb.ast.ScopeException;

/** Called on various events while building expressions. */
public interface Tracer {
  /** Called when an expression has been built. */
  void onExpr(Expr<?> expr);

  /**
   * Called with the exception about to be thrown because an expression's parts
   * are not consistently scoped. The exception is thrown regardless.
   */
  void onScopeException(ScopeException e);
}

// End Tracer.java
