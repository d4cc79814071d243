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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.lamb.ast.Op;

/**
 * Existential type, "{@code exists a, b. body}".
 *
 * <p>The body has {@code names.size()} more free type variables than the
 * existential type itself. Values of this type are built by {@link
 * net.hydromatic.lamb.ast.ExprContent.MakeExists} and taken apart by {@link
 * net.hydromatic.lamb.ast.ExprContent.LetExists}.
 */
public class ExistsType<N> extends BaseType<N> {
  public final ImmutableList<N> names;
  public final Type<N> body;

  ExistsType(ImmutableList<N> names, Type<N> body) {
    super(Op.EXISTS_TYPE, body.free() - names.size());
    this.names = names;
    this.body = body;
    checkArgument(!names.isEmpty(), "must bind at least one type");
  }

  /** Creates an existential type. */
  public static <N> ExistsType<N> of(List<N> names, Type<N> body) {
    return new ExistsType<>(ImmutableList.copyOf(names), requireNonNull(body));
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, names, body);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ExistsType
            && names.equals(((ExistsType<?>) obj).names)
            && body.equals(((ExistsType<?>) obj).body);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("(exists ");
    Joiner.on(", ").appendTo(buf, names).append(". ");
    return body.describe(buf).append(')');
  }
}

// End ExistsType.java
