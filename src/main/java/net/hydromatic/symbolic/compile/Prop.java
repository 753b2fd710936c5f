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
package net.hydromatic.symbolic.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a {@link Calculator}.
 *
 * @see Calculator#set(Prop, Object)
 */
public enum Prop {
  /**
   * Boolean property "forceReal" controls whether the calculator works over
   * the real numbers. If true, operations whose result is not real, such as
   * the square root of a negative number, throw {@link ArithmeticException}.
   * If false, they may produce complex results. Default is false.
   */
  FORCE_REAL("forceReal", Boolean.class, true, false),

  /**
   * Integer property "maxPasses" is the maximum number of rewrite passes that
   * {@link Calculator#reduce} makes before it gives up looking for a fixed
   * point. Must be positive. Default is 1,000.
   */
  MAX_PASSES("maxPasses", Integer.class, true, 1_000),

  /**
   * Integer property "defaultDepth" is the depth to which
   * {@link Calculator#reduce(net.hydromatic.symbolic.ast.Expr.Node)} applies
   * rules. Default is unlimited.
   */
  DEFAULT_DEPTH("defaultDepth", Integer.class, true, Integer.MAX_VALUE),

  /**
   * Property "onPassLimit" controls what happens when reduction reaches
   * {@link #MAX_PASSES}. Default is "return", which returns the current
   * expression.
   */
  ON_PASS_LIMIT("onPassLimit", PassLimit.class, true, PassLimit.RETURN);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(validValue(type, defaultValue));
  }

  private static boolean validValue(Class<?> type, Object value) {
    if (type == Boolean.class
        || type == Integer.class
        || type == String.class
        || type.isEnum()) {
      return type.isInstance(value);
    }
    return false;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
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

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /** Sets the value of a property, allowing strings for other types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent(
                (Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(e -> e.name().toLowerCase(Locale.ROOT))
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be one of: "
                  + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Boolean.class) {
        set(map, Boolean.valueOf(s.trim()));
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s.trim()));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(
            "property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must have type " + type);
      }
      validate(value);
      map.put(this, value);
    }
  }

  private void validate(Object value) {
    switch (this) {
      case MAX_PASSES:
        checkArgument((Integer) value > 0,
            "value for property %s must be positive", camelName);
        break;
      case DEFAULT_DEPTH:
        checkArgument((Integer) value >= 0,
            "value for property %s must not be negative", camelName);
        break;
      default:
        break;
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }

  /** Allowed values for {@link #ON_PASS_LIMIT} property. */
  public enum PassLimit {
    /** Return the current expression. The default. */
    RETURN,
    /** Throw {@link IllegalStateException}. */
    FAIL
  }
}

// End Prop.java
