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
package net.hydromatic.stencil.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls bounds inference.
 *
 * @see BoundsInference#inferBounds(net.hydromatic.stencil.ast.Ir.Stmt, List,
 *     List, List, Map, Map, net.hydromatic.stencil.pipeline.Target, Map,
 *     Tracer)
 */
public enum Prop {
  /**
   * Boolean property "assertDeclaredBounds" controls whether to check, when
   * the pipeline runs, that the region a function is required to compute lies
   * within the bounds the user declared for it. Default is true.
   *
   * <p>Applies to outputs and to functions whose bounds are declared; the
   * check is emitted only if the required region is bounded.
   */
  ASSERT_DECLARED_BOUNDS("assertDeclaredBounds", Boolean.class, true),

  /**
   * Boolean property "inferInputBounds" controls whether to compute the region
   * of each input image that the pipeline reads, and to bind it to the
   * variables "img.min.i.required" and "img.extent.i.required". Default is
   * true.
   */
  INFER_INPUT_BOUNDS("inferInputBounds", Boolean.class, true),

  /**
   * Boolean property "simplify" controls whether to simplify the expressions
   * of computed bounds. Default is true. Without simplification, bounds are
   * correct but large.
   */
  SIMPLIFY("simplify", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
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
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkArgument(
        type == Boolean.class,
        "invalid type %s for property %s",
        Boolean.class,
        camelName);
    return (Boolean) get(map);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. Every
   * property has a value, so null is not allowed.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      throw new IllegalArgumentException(
          "property " + camelName + " is required");
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must have type " + type);
    }
    map.put(this, value);
  }
}

// End Prop.java
