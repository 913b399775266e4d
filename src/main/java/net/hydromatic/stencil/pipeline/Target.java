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
package net.hydromatic.stencil.pipeline;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Description of the machine that the pipeline will be compiled for, for
 * example "x86-64-linux-avx2".
 *
 * <p>Bounds inference does not depend on the target; it passes the target
 * through to the passes that do.
 */
public class Target {
  /** A 64-bit x86 Linux target with no optional features. */
  public static final Target HOST = parse("x86-64-linux");

  public final String arch;
  public final int bits;
  public final String os;
  public final Set<String> features;

  private Target(String arch, int bits, String os, Set<String> features) {
    this.arch = arch;
    this.bits = bits;
    this.os = os;
    this.features = ImmutableSortedSet.copyOf(features);
  }

  /** Parses a target string of the form "arch-bits-os[-feature]...". */
  public static Target parse(String s) {
    final List<String> parts = Splitter.on('-').splitToList(s);
    checkArgument(parts.size() >= 3, "invalid target '%s'", s);
    final int bits;
    try {
      bits = Integer.parseInt(parts.get(1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid target '" + s + "'", e);
    }
    checkArgument(bits == 32 || bits == 64, "invalid bits in target '%s'", s);
    return new Target(
        parts.get(0),
        bits,
        parts.get(2),
        ImmutableSortedSet.copyOf(parts.subList(3, parts.size())));
  }

  /** Returns whether this target has a given feature. */
  public boolean has(String feature) {
    return features.contains(feature);
  }

  @Override
  public int hashCode() {
    return Objects.hash(arch, bits, os, features);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Target
            && ((Target) o).arch.equals(arch)
            && ((Target) o).bits == bits
            && ((Target) o).os.equals(os)
            && ((Target) o).features.equals(features);
  }

  @Override
  public String toString() {
    return String.join(
        "-",
        ImmutableList.<String>builder()
            .add(arch, Integer.toString(bits), os)
            .addAll(features)
            .build());
  }
}

// End Target.java
