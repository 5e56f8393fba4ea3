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

package com.unitalgebra.quantity.conversion;

import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import com.unitalgebra.quantity.ConversionException;
import com.unitalgebra.quantity.Prefix;

/**
 * Converts values between the named units of one family.
 *
 * <p>A resolver holds the family's multiplier and alias tables expanded with every SI prefix of
 * the prefixable units, so a mass family listing only {@code g} also resolves {@code kg},
 * {@code mg} and, through the alias {@code gram}, {@code kilogram}.
 */
public class ConversionResolver {

  private static final Logger LOG = Logger.getLogger(ConversionResolver.class.getName());

  private final String familyName;
  private final ImmutableMap<String, Double> multipliers;
  private final ImmutableMap<String, String> aliases;

  /**
   * Creates a resolver for a family.
   *
   * @param family the family whose tables to expand
   */
  public ConversionResolver(UnitFamily family) {
    this(family.getName(), family.getMultipliers(), family.getAliases(),
        family.getSiPrefixableSymbols());
  }

  ConversionResolver(String familyName, Map<String, Double> baseTable,
      Map<String, String> aliasTable, Set<String> siPrefixableSymbols) {
    this.familyName = Preconditions.checkNotNull(familyName);
    this.multipliers = expandTable(baseTable, siPrefixableSymbols);
    this.aliases = expandAliases(aliasTable, siPrefixableSymbols);
    LOG.fine(String.format("Resolving %s with %d units and %d aliases", familyName,
        multipliers.size(), aliases.size()));
  }

  /**
   * Adds an entry for every SI prefix of every prefixable symbol: {@code g -> 1.0} gains
   * {@code kg -> 1000.0}, {@code mg -> 0.001} and so on.  Entries already in the base table are
   * kept as they are.
   *
   * @param baseTable unit names mapped to their size in the family's standard unit
   * @param siPrefixableSymbols the names in {@code baseTable} SI prefixes apply to
   * @return the expanded table
   * @throws IllegalArgumentException if a prefixable symbol is missing from the base table
   */
  public static ImmutableMap<String, Double> expandTable(Map<String, Double> baseTable,
      Set<String> siPrefixableSymbols) {
    Preconditions.checkNotNull(baseTable);
    Preconditions.checkNotNull(siPrefixableSymbols);

    Map<String, Double> expanded = Maps.newLinkedHashMap(baseTable);
    for (String symbol : siPrefixableSymbols) {
      Double multiplier = baseTable.get(symbol);
      Preconditions.checkArgument(multiplier != null,
          "SI prefixable unit %s has no multiplier", symbol);
      for (Prefix prefix : Prefix.magnitudes()) {
        String prefixed = prefix.getSymbol() + symbol;
        if (!expanded.containsKey(prefixed)) {
          expanded.put(prefixed, multiplier * prefix.magnitude());
        }
      }
    }
    return ImmutableMap.copyOf(expanded);
  }

  /**
   * Adds a spelled out alias for every SI prefix of every alias of a prefixable symbol:
   * {@code gram -> g} gains {@code kilogram -> kg}, {@code milligram -> mg} and so on.
   *
   * @param aliasTable aliases mapped to the unit names they stand for
   * @param siPrefixableSymbols the unit names SI prefixes apply to
   * @return the expanded aliases
   */
  public static ImmutableMap<String, String> expandAliases(Map<String, String> aliasTable,
      Set<String> siPrefixableSymbols) {
    Preconditions.checkNotNull(aliasTable);
    Preconditions.checkNotNull(siPrefixableSymbols);

    Map<String, String> expanded = Maps.newLinkedHashMap(aliasTable);
    for (Map.Entry<String, String> alias : aliasTable.entrySet()) {
      if (siPrefixableSymbols.contains(alias.getValue())) {
        for (Prefix prefix : Prefix.magnitudes()) {
          String prefixed = prefix.getName() + alias.getKey();
          if (!expanded.containsKey(prefixed)) {
            expanded.put(prefixed, prefix.getSymbol() + alias.getValue());
          }
        }
      }
    }
    return ImmutableMap.copyOf(expanded);
  }

  /**
   * Scales a value by {@code multiplier(toName) / multiplier(fromName)}.  Identical names return
   * the value untouched without looking either name up.
   *
   * <p>The shipped tables hold each unit's size in the standard unit, so with them this gives the
   * number of {@code fromName} units in {@code value} {@code toName} units.
   * {@link UnitFamily#convert} passes its names in that order.
   *
   * @param value the value to scale
   * @param fromName the unit or alias whose multiplier divides
   * @param toName the unit or alias whose multiplier multiplies
   * @return the scaled value
   * @throws ConversionException if either name is unknown
   */
  public double convert(double value, String fromName, String toName) {
    Preconditions.checkNotNull(fromName);
    Preconditions.checkNotNull(toName);

    if (fromName.equals(toName)) {
      return value;
    }
    return value * (multiplier(toName) / multiplier(fromName));
  }

  /**
   * Returns the size of a unit in the family's standard unit.
   *
   * @throws ConversionException if the name is unknown
   */
  public double multiplier(String name) {
    Double multiplier = multipliers.get(canonicalName(name));
    if (multiplier == null) {
      throw new ConversionException(
          String.format("Invalid unit %s entered for a %s value.", name, familyName));
    }
    return multiplier;
  }

  /**
   * Resolves an alias to the unit name it stands for.  Names that are not aliases resolve to
   * themselves, whether or not they are known units.
   */
  public String canonicalName(String name) {
    String canonical = aliases.get(name);
    return canonical == null ? name : canonical;
  }

  public boolean isKnown(String name) {
    return multipliers.containsKey(canonicalName(name));
  }

  public Map<String, Double> getMultipliers() {
    return multipliers;
  }

  public Map<String, String> getAliases() {
    return aliases;
  }
}
