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
 * Thrown when an expression cannot be built because the free-variable counts
 * of its parts are inconsistent.
 *
 * <p>These are contract violations of the producer (usually an elaborator),
 * not errors in user input. The {@link #kind} allows callers such as test
 * harnesses to assert on which check failed.
 */
public class ScopeException extends RuntimeException {
  public final Kind kind;
  public final Op op;

  public ScopeException(Kind kind, Op op, String message) {
    super(message);
    this.kind = requireNonNull(kind);
    this.op = requireNonNull(op);
  }

  @Override
  public String toString() {
    return super.toString() + " [" + kind + " in " + op + "]";
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(op).append(" Error: ").append(getMessage());
  }

  /** Which check failed. */
  public enum Kind {
    /** A variable's index is not less than the free-variable count. */
    INDEX_OUT_OF_RANGE,
    /**
     * A type's free-type-variable count disagrees with the scope it is checked
     * against.
     */
    TYPE_ARITY_MISMATCH,
    /**
     * A binder's count of bound names does not match the difference between
     * the inner and outer free-variable counts.
     */
    BINDER_ARITY_MISMATCH,
    /** A binding form that requires at least one name was given none. */
    EMPTY_BINDER_LIST,
    /** Children of a form that binds nothing are in different scopes. */
    SCOPE_MISMATCH
  }
}

// End ScopeException.java
