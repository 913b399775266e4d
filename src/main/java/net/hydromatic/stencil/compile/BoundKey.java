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
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Key of a user-supplied bound: a function and one of its dimensions. */
public class BoundKey {
  public final String func;
  public final int dim;

  private BoundKey(String func, int dim) {
    this.func = requireNonNull(func);
    this.dim = dim;
    checkArgument(dim >= 0, "negative dimension");
  }

  public static BoundKey of(String func, int dim) {
    return new BoundKey(func, dim);
  }

  @Override
  public int hashCode() {
    return Objects.hash(func, dim);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BoundKey
            && ((BoundKey) o).func.equals(func)
            && ((BoundKey) o).dim == dim;
  }

  @Override
  public String toString() {
    return func + "." + dim;
  }
}

// End BoundKey.java
