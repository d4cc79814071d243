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

import static java.util.Objects.requireNonNull;

/**
 * Declaration of a type parameter, as bound by a polymorphic function.
 *
 * <p>The name is for display only; references to the parameter are de Bruijn
 * indices.
 */
public class TypeParam<N> {
  public final N name;

  TypeParam(N name) {
    this.name = requireNonNull(name, "name");
  }

  /** Creates a type parameter. */
  public static <N> TypeParam<N> of(N name) {
    return new TypeParam<>(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeParam && name.equals(((TypeParam<?>) obj).name);
  }

  @Override
  public String toString() {
    return String.valueOf(name);
  }
}

// End TypeParam.java
