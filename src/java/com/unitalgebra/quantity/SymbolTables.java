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

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Factories for {@link SymbolTable}s.
 */
public final class SymbolTables {

  private static final SymbolTable STANDARD = builder()
      .add(Dimension.TIME, "s", "min", "hr", "day")
      .add(Dimension.LENGTH, "m", "ft", "yd", "mi", "inch", "rod", "fathom", "chain", "link", "ly",
          "pc", "au", "ang", "fermi")
      .add(Dimension.MASS, "g", "tonne", "oz", "lb", "gr", "stone", "carat")
      .add(Dimension.CURRENT, "A")
      .add(Dimension.TEMPERATURE, "K", "k", "c", "f", "r")
      .add(Dimension.AMOUNT_OF_SUBSTANCE, "mol")
      .add(Dimension.LUMINOUS_INTENSITY, "cd", "cp", "hk")
      .siPrefixable("g", "m", "s", "A", "K", "mol", "cd")
      .build();

  private SymbolTables() {
    // utility
  }

  /**
   * Returns the table the default {@link UnitParser} uses.  Every symbol the renderer emits is
   * part of it.
   */
  public static SymbolTable standard() {
    return STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Assembles an immutable symbol table.
   */
  public static final class Builder {
    private final ImmutableMap.Builder<String, Dimension> dimensions = ImmutableMap.builder();
    private final ImmutableSet.Builder<String> prefixable = ImmutableSet.builder();

    private Builder() {
      // use SymbolTables.builder()
    }

    public Builder add(Dimension dimension, String... symbols) {
      Preconditions.checkNotNull(dimension);
      Preconditions.checkArgument(dimension != Dimension.RECIPROCAL,
          "The reciprocal marker is spelled 1 and cannot be given symbols");
      for (String symbol : symbols) {
        dimensions.put(symbol, dimension);
      }
      return this;
    }

    public Builder siPrefixable(String... symbols) {
      prefixable.add(symbols);
      return this;
    }

    public SymbolTable build() {
      ImmutableMap<String, Dimension> table = dimensions.build();
      ImmutableSet<String> prefixableSymbols = prefixable.build();
      for (String symbol : prefixableSymbols) {
        Preconditions.checkArgument(table.containsKey(symbol),
            "Prefixable symbol %s has no dimension", symbol);
      }
      return new MapSymbolTable(table, prefixableSymbols);
    }
  }

  private static final class MapSymbolTable implements SymbolTable {
    private final Map<String, Dimension> dimensions;
    private final Set<String> prefixable;

    MapSymbolTable(Map<String, Dimension> dimensions, Set<String> prefixable) {
      this.dimensions = dimensions;
      this.prefixable = prefixable;
    }

    @Nullable
    @Override
    public Dimension dimensionOf(String symbol) {
      return dimensions.get(symbol);
    }

    @Override
    public boolean isSiPrefixable(String symbol) {
      return prefixable.contains(symbol);
    }

    @Override
    public String toString() {
      return dimensions.keySet().toString();
    }
  }
}
