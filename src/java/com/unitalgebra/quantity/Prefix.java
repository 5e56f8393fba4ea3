// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.unitalgebra.quantity;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

/**
 * The SI magnitude prefixes.  Each prefix carries its symbol (as written in unit text), its name
 * (as written in spelled out unit aliases; eg: kilogram) and its decimal magnitude.
 */
public enum Prefix {
  NONE("", "", 1),
  YOCTO("y", "yocto", 1e-24),
  ZEPTO("z", "zepto", 1e-21),
  ATTO("a", "atto", 1e-18),
  FEMTO("f", "femto", 1e-15),
  PICO("p", "pico", 1e-12),
  NANO("n", "nano", 1e-9),
  MICRO("u", "micro", 1e-6),
  MILLI("m", "milli", 1e-3),
  CENTI("c", "centi", 1e-2),
  DECI("d", "deci", 1e-1),
  DECA("da", "deca", 1e1),
  HECTO("h", "hecto", 1e2),
  KILO("k", "kilo", 1e3),
  MEGA("M", "mega", 1e6),
  GIGA("G", "giga", 1e9),
  TERA("T", "tera", 1e12),
  PETA("P", "peta", 1e15),
  EXA("E", "exa", 1e18),
  ZETTA("Z", "zetta", 1e21),
  YOTTA("Y", "yotta", 1e24);

  private static final Map<String, Prefix> BY_SYMBOL;
  static {
    ImmutableMap.Builder<String, Prefix> bySymbol = ImmutableMap.builder();
    for (Prefix prefix : magnitudes()) {
      bySymbol.put(prefix.symbol, prefix);
    }
    BY_SYMBOL = bySymbol.build();
  }

  private final String symbol;
  private final String display;
  private final double magnitude;

  private Prefix(String symbol, String display, double magnitude) {
    this.symbol = symbol;
    this.display = display;
    this.magnitude = magnitude;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getName() {
    return display;
  }

  public double magnitude() {
    return magnitude;
  }

  /**
   * Returns the 20 real magnitude prefixes, ie: every prefix but {@link #NONE}.
   */
  public static Set<Prefix> magnitudes() {
    return Sets.immutableEnumSet(EnumSet.complementOf(EnumSet.of(NONE)));
  }

  /**
   * Looks up a prefix by its symbol.
   *
   * @param symbol a prefix symbol such as {@code k} or {@code da}
   * @return the matching prefix, or {@code null} if there is none
   */
  @Nullable
  public static Prefix forSymbol(String symbol) {
    return BY_SYMBOL.get(symbol);
  }
}
