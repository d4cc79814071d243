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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is
 * absent from the map has its default value.
 *
 * @see net.hydromatic.lamb.ast.ExprFactory
 * @see net.hydromatic.lamb.ast.ExprWriter
 */
public enum Prop {
  /**
   * Boolean property "checkAppScope" controls whether building an application
   * checks that the callee and the argument are in the same scope. If false,
   * the callee's counts are not checked and the application takes the
   * argument's counts; an expression built that way may not survive a round
   * trip through its content. Default is true.
   */
  CHECK_APP_SCOPE("checkAppScope", Boolean.class, true),

  /**
   * Integer property "printDepth" controls printing. The depth of nesting at
   * which the debug writer prints an ellipsis instead of a sub-expression.
   * Default is 40.
   */
  PRINT_DEPTH("printDepth", Integer.class, 40);

  /** Prefix of the system properties read by {@link #fromSystemProperties}. */
  public static final String SYSTEM_PREFIX = "lamb.";

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Returns a map containing the properties set in the system properties, for
   * example "{@code -Dlamb.printDepth=10}".
   */
  public static Map<Prop, Object> fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /**
   * Returns a map containing the properties whose names, after {@link
   * #SYSTEM_PREFIX}, are those of a property. Other keys are ignored.
   */
  public static Map<Prop, Object> fromProperties(Properties properties) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    for (Prop prop : values()) {
      final String value =
          properties.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.set(map, prop.parse(value));
      }
    }
    return map;
  }

  /**
   * Converts a string to a value of this property's type.
   *
   * <p>For boolean properties, values "", "true", "TRUE" and "1" are treated
   * as true; "false", "FALSE" and "0" treated as false; other values are
   * invalid.
   */
  private Object parse(String value) {
    if (type == Boolean.class) {
      final String low = value.toLowerCase(Locale.ROOT);
      if (low.equals("true") || low.equals("1") || low.isEmpty()) {
        return true;
      }
      if (low.equals("false") || low.equals("0")) {
        return false;
      }
      throw new RuntimeException(
          "invalid value '" + value + "' for boolean property " + camelName);
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new RuntimeException(
          "invalid value '" + value + "' for integer property " + camelName, e);
    }
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A null value
   * removes the property, so that it reverts to its default.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
