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

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.lang.StringUtils;

import com.unitalgebra.quantity.ConversionException;
import com.unitalgebra.quantity.Quantity;
import com.unitalgebra.quantity.QuantityConfig;
import com.unitalgebra.quantity.UnitAlgebra;
import com.unitalgebra.quantity.UnitMismatchException;
import com.unitalgebra.quantity.UnitParser;
import com.unitalgebra.quantity.UnitTerms;

/**
 * The named units of one physical quantity, such as mass or distance, and the multipliers that
 * relate them.  Every multiplier gives the size of its unit in the family's standard unit, so in a
 * mass family standardized on grams {@code oz} maps to {@code 28.3495}.
 *
 * <p>Families let quantities be created from and read out in any of their units, while the
 * quantities themselves always hold the standard unit.
 */
public final class UnitFamily {

  private final String name;
  private final String standardUnit;
  private final String standardExpression;
  private final ImmutableMap<String, Double> multipliers;
  private final ImmutableMap<String, String> aliases;
  private final ImmutableSet<String> siPrefixableSymbols;
  private final Supplier<ConversionResolver> resolver;
  private final UnitTerms standardTerms;

  private UnitFamily(Builder builder) {
    this.name = builder.name;
    this.standardUnit = builder.standardUnit;
    this.standardExpression = builder.standardExpression;
    this.multipliers = builder.multipliers.build();
    this.aliases = builder.aliases.build();
    this.siPrefixableSymbols = builder.siPrefixableSymbols.build();
    this.standardTerms = UnitAlgebra.normalize(new UnitParser().parse(standardExpression));
    this.resolver = Suppliers.memoize(new Supplier<ConversionResolver>() {
      @Override public ConversionResolver get() {
        return new ConversionResolver(UnitFamily.this);
      }
    });
  }

  public String getName() {
    return name;
  }

  /**
   * The unit quantities of this family are held in; eg: {@code g} for mass.
   */
  public String getStandardUnit() {
    return standardUnit;
  }

  /**
   * The standard unit spelled in base dimension unit text; eg: {@code kg*m^2/s^2} for joules.
   */
  public String getStandardExpression() {
    return standardExpression;
  }

  public Map<String, Double> getMultipliers() {
    return multipliers;
  }

  public Map<String, String> getAliases() {
    return aliases;
  }

  public Set<String> getSiPrefixableSymbols() {
    return siPrefixableSymbols;
  }

  /**
   * Returns the resolver over this family's tables expanded with SI prefixes.
   */
  public ConversionResolver resolver() {
    return resolver.get();
  }

  /**
   * Converts a value between two units of this family.
   *
   * @throws ConversionException if either unit is unknown
   */
  public double convert(double value, String fromUnit, String toUnit) {
    // The resolver scales by its second name's multiplier over its first's.
    return resolver().convert(value, toUnit, fromUnit);
  }

  public Quantity quantity(double value, String unit) {
    return quantity(value, unit, QuantityConfig.DEFAULT);
  }

  /**
   * Creates a quantity from a value in any unit of this family.  The quantity holds the value in
   * the standard unit.
   *
   * @param value the number of {@code unit}s
   * @param unit a unit name or alias of this family; eg: {@code lb} or {@code kilogram}
   * @param config the config for the quantity
   * @return the quantity, in this family's standard unit
   * @throws ConversionException if the unit is unknown
   */
  public Quantity quantity(double value, String unit, QuantityConfig config) {
    return Quantity.of(convert(value, unit, standardUnit), standardTerms, config);
  }

  /**
   * Reads a quantity out in a unit of this family.
   *
   * @param quantity a quantity in this family's standard unit
   * @param unit the unit name or alias to express the value in
   * @return the number of {@code unit}s in the quantity
   * @throws UnitMismatchException if the quantity is not of this family's dimensions
   * @throws ConversionException if the unit is unknown
   */
  public double valueIn(Quantity quantity, String unit) {
    Preconditions.checkNotNull(quantity);
    if (!UnitAlgebra.sameDimensions(standardTerms, quantity.getUnits())) {
      throw new UnitMismatchException(String.format(
          "Can not read %s in %s, it is not a %s value.", quantity, unit, name));
    }
    return convert(quantity.getValue(), standardUnit, unit);
  }

  @Override
  public String toString() {
    return name;
  }

  public static Builder builder(String name, String standardUnit, String standardExpression) {
    return new Builder(name, standardUnit, standardExpression);
  }

  /**
   * Assembles a {@link UnitFamily}.
   */
  public static final class Builder {
    private final String name;
    private final String standardUnit;
    private final String standardExpression;
    private final ImmutableMap.Builder<String, Double> multipliers = ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> aliases = ImmutableMap.builder();
    private final ImmutableSet.Builder<String> siPrefixableSymbols = ImmutableSet.builder();

    private Builder(String name, String standardUnit, String standardExpression) {
      Preconditions.checkArgument(!StringUtils.isBlank(name), "Family name cannot be blank");
      Preconditions.checkArgument(!StringUtils.isBlank(standardUnit),
          "Standard unit cannot be blank");
      Preconditions.checkArgument(!StringUtils.isBlank(standardExpression),
          "Standard expression cannot be blank");
      this.name = name;
      this.standardUnit = standardUnit;
      this.standardExpression = standardExpression;
    }

    public Builder unit(String unit, double multiplier) {
      Preconditions.checkArgument(multiplier > 0, "Multiplier for %s must be positive", unit);
      multipliers.put(unit, multiplier);
      return this;
    }

    public Builder alias(String alias, String unit) {
      aliases.put(alias, unit);
      return this;
    }

    public Builder siPrefixable(String... units) {
      siPrefixableSymbols.add(units);
      return this;
    }

    public UnitFamily build() {
      UnitFamily family = new UnitFamily(this);
      Preconditions.checkArgument(family.multipliers.containsKey(standardUnit),
          "Standard unit %s of %s has no multiplier", standardUnit, name);
      return family;
    }
  }
}
