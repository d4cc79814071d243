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

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.function.Consumer;
import net.hydromatic.lamb.ast.Expr;
import net.hydromatic.lamb.ast.ScopeException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each expression built,
   * then calls the underlying tracer.
   */
  public static Tracer withOnExpr(Tracer tracer, Consumer<Expr<?>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onExpr(Expr<?> expr) {
        consumer.accept(expr);
        super.onExpr(expr);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each scope exception,
   * then calls the underlying tracer.
   */
  public static Tracer withOnScopeException(
      Tracer tracer, Consumer<ScopeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onScopeException(ScopeException e) {
        consumer.accept(e);
        super.onScopeException(e);
      }
    };
  }

  /**
   * Returns a tracer that writes a line to a writer for each scope exception,
   * then calls the underlying tracer.
   */
  public static Tracer printTracer(Tracer tracer, PrintWriter w) {
    requireNonNull(w);
    return withOnScopeException(
        tracer,
        e -> {
          w.println(e.describeTo(new StringBuilder()));
          w.flush();
        });
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onExpr(Expr<?> expr) {}

    @Override
    public void onScopeException(ScopeException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onExpr(Expr<?> expr) {
      tracer.onExpr(expr);
    }

    @Override
    public void onScopeException(ScopeException e) {
      tracer.onScopeException(e);
    }
  }
}

// End Tracers.java
