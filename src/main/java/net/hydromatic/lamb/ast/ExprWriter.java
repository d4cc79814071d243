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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lamb.type.Type;
import net.hydromatic.lamb.util.Prop;

/**
 * Context for writing an expression out as a string, for debugging.
 *
 * <p>Examples:
 *
 * <ul>
 *   <li>{@code fn (x : unit) => #0}
 *   <li>{@code let a, b = (copy #0, #0) in #1}
 *   <li>{@code pack [t = unit] () as (exists t. 't0)}
 * </ul>
 *
 * <p>Variables are printed as de Bruijn indices; {@code copy} marks a copy
 * occurrence. Binder names are printed where they are bound.
 */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();
  private final int printDepth;

  /** Creates a writer with default properties. */
  public ExprWriter() {
    this(ImmutableMap.of());
  }

  /** Creates a writer. */
  public ExprWriter(Map<Prop, Object> props) {
    this.printDepth = Prop.PRINT_DEPTH.intValue(props);
  }

  /** Appends a string to the output. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression. */
  public ExprWriter append(Expr<?> expr) {
    return append(expr, 0);
  }

  /** Appends the content of an expression. */
  public ExprWriter append(ExprContent<?> content) {
    return append(content, 0);
  }

  private ExprWriter append(Expr<?> expr, int depth) {
    if (depth >= printDepth) {
      return append("...");
    }
    return append(expr.toContent(), depth);
  }

  private ExprWriter append(ExprContent<?> content, int depth) {
    final int d = depth + 1;
    switch (content.op) {
    case UNIT:
      return append("()");

    case VAR:
      final ExprContent.Var<?> v = (ExprContent.Var<?>) content;
      if (v.usage == VarUsage.COPY) {
        append("copy ");
      }
      b.append('#').append(v.index);
      return this;

    case ABS:
      final ExprContent.Abs<?> abs = (ExprContent.Abs<?>) content;
      append("fn ");
      if (!abs.typeParams.isEmpty()) {
        list(abs.typeParams).append(" ");
      }
      b.append('(').append(abs.argName).append(" : ");
      type(abs.argType).append(") => ");
      return append(abs.body, d);

    case APP:
      final ExprContent.App<?> app = (ExprContent.App<?>) content;
      if (app.callee.op() == Op.VAR || app.callee.op() == Op.APP) {
        append(app.callee, d);
      } else {
        append("(").append(app.callee, d).append(")");
      }
      if (!app.typeArgs.isEmpty()) {
        append(" [");
        for (int i = 0; i < app.typeArgs.size(); i++) {
          if (i > 0) {
            append(", ");
          }
          type(app.typeArgs.get(i));
        }
        append("]");
      }
      return append(" (").append(app.arg, d).append(")");

    case PAIR:
      final ExprContent.Pair<?> pair = (ExprContent.Pair<?>) content;
      return append("(").append(pair.left, d).append(", ")
          .append(pair.right, d).append(")");

    case LET:
      final ExprContent.Let<?> let = (ExprContent.Let<?>) content;
      append("let ");
      names(let.names).append(" = ").append(let.val, d).append(" in ");
      return append(let.body, d);

    case LET_EXISTS:
      final ExprContent.LetExists<?> letExists =
          (ExprContent.LetExists<?>) content;
      append("let exists ");
      list(letExists.typeNames);
      b.append(' ').append(letExists.valName);
      append(" = ").append(letExists.val, d).append(" in ");
      return append(letExists.body, d);

    case MAKE_EXISTS:
      final ExprContent.MakeExists<?> makeExists =
          (ExprContent.MakeExists<?>) content;
      append("pack [");
      for (int i = 0; i < makeExists.params.size(); i++) {
        if (i > 0) {
          append(", ");
        }
        final Map.Entry<?, ? extends Type<?>> param =
            makeExists.params.get(i);
        b.append(param.getKey()).append(" = ");
        type(param.getValue());
      }
      append("] ").append(makeExists.body, d).append(" as ");
      return type(makeExists.typeBody);

    default:
      throw new AssertionError("unexpected " + content.op);
    }
  }

  private ExprWriter type(Type<?> type) {
    type.describe(b);
    return this;
  }

  /** Appends a comma-separated list of names. */
  private ExprWriter names(List<?> names) {
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      b.append(names.get(i));
    }
    return this;
  }

  /** Appends a comma-separated list of names in brackets. */
  private ExprWriter list(List<?> names) {
    return append("[").names(names).append("]");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
