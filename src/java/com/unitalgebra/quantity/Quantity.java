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

import java.math.BigDecimal;
import java.math.RoundingMode;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A numeric value carrying a compound unit, such as {@code 9.8 m/s^2}.  Arithmetic between
 * quantities combines their units and refuses operations that are dimensionally meaningless.
 *
 * <ul>
 *   <li>Addition and subtraction require both sides to have the same unit.</li>
 *   <li>Multiplication and division combine units; {@code kg/m^3} times {@code m^3/s} is
 *       {@code kg/s}.</li>
 *   <li>Raising to a power scales every exponent of the unit.</li>
 *   <li>Comparisons between different units, or with anything that is not a quantity, are
 *       {@code false} rather than errors, so quantities are safe to sort and filter
 *       generically.</li>
 * </ul>
 *
 * <p>SI prefixes only affect how a unit is written: {@code kg} and {@code g} are the same unit,
 * so {@code 1 kg} plus {@code 1 g} is {@code 2.0 kg} and {@code 1 kg} equals {@code 1 g}.
 *
 * <p>Bare numbers may only multiply or divide a quantity if the quantity's
 * {@link QuantityConfig#isImplicitDimensionless() config} allows it.  Complex numbers are never
 * accepted.
 *
 * <p>Operations return new quantities.  The {@code *Assign} operations instead update this
 * quantity in place and return it; a quantity is therefore not thread safe, and its hash code
 * changes when it is updated.
 */
public final class Quantity {

  private double value;
  private UnitTerms units;
  private Notation notation;
  private final QuantityConfig config;

  private Quantity(double value, UnitTerms units, Notation notation, QuantityConfig config) {
    this.value = value;
    this.units = units;
    this.notation = notation;
    this.config = config;
  }

  /**
   * Creates a quantity with the {@link QuantityConfig#DEFAULT default} config.
   *
   * @param value the number of units
   * @param unitText the unit, in fractional or exponential notation
   * @return a quantity of {@code value} {@code unitText}
   * @throws UnitParseException if the unit text is malformed
   */
  public static Quantity of(double value, String unitText) {
    return of(value, unitText, QuantityConfig.DEFAULT);
  }

  public static Quantity of(double value, String unitText, QuantityConfig config) {
    Preconditions.checkNotNull(config);
    return of(value, config.newParser().parse(unitText), config);
  }

  public static Quantity of(double value, UnitTerms units) {
    return of(value, units, QuantityConfig.DEFAULT);
  }

  /**
   * Creates a quantity from unit terms.  Repeated dimensions are folded together and the terms
   * are rectified.
   *
   * @param value the number of units
   * @param units the unit terms
   * @param config the config the quantity and the results of its arithmetic use
   * @return a quantity of {@code value} {@code units}
   */
  public static Quantity of(double value, UnitTerms units, QuantityConfig config) {
    Preconditions.checkNotNull(units);
    Preconditions.checkNotNull(config);
    return new Quantity(value, UnitAlgebra.normalize(units), config.getNotation(), config);
  }

  public double getValue() {
    return value;
  }

  public UnitTerms getUnits() {
    return units;
  }

  public Notation getNotation() {
    return notation;
  }

  public QuantityConfig getConfig() {
    return config;
  }

  /**
   * Switches the notation this quantity renders its unit in.
   */
  public void setNotation(Notation notation) {
    this.notation = Preconditions.checkNotNull(notation);
  }

  public Quantity withNotation(Notation newNotation) {
    Preconditions.checkNotNull(newNotation);
    return new Quantity(value, units, newNotation, config);
  }

  /**
   * Returns the unit rendered in this quantity's notation.
   */
  public String toUnitString() {
    return notation.render(units);
  }

  public boolean hasSameUnits(Quantity other) {
    return UnitAlgebra.sameDimensions(units, other.units);
  }

  // Binary arithmetic

  /**
   * Adds a quantity of the same unit.
   *
   * @throws UnitMismatchException if {@code other} has a different unit
   * @throws UnitlessNumberException if {@code other} is a bare number
   * @throws NotSupportedException if {@code other} is neither a quantity nor a number
   */
  public Quantity add(Object other) {
    return new Quantity(value + sameUnitValue(other, "add"), units, notation, config);
  }

  /**
   * Subtracts a quantity of the same unit.
   *
   * @throws UnitMismatchException if {@code other} has a different unit
   * @throws UnitlessNumberException if {@code other} is a bare number
   * @throws NotSupportedException if {@code other} is neither a quantity nor a number
   */
  public Quantity subtract(Object other) {
    return new Quantity(value - sameUnitValue(other, "subtract"), units, notation, config);
  }

  /**
   * Multiplies by another quantity, adding up the exponents of their units.  A bare number is
   * accepted only if this quantity's config is implicitly dimensionless, and leaves the unit as
   * it is.
   *
   * @throws UnitlessNumberException if {@code other} is a bare number that is not allowed
   * @throws NotSupportedException if {@code other} is neither a quantity nor a real number
   */
  public Quantity multiply(Object other) {
    Operand operand = Operand.classify(other);
    switch (operand.getKind()) {
      case QUANTITY:
        Quantity quantity = operand.asQuantity();
        return combined(value * quantity.value, quantity, UnitAlgebra.MULTIPLY);
      case SCALAR:
        checkImplicitDimensionless("multiply");
        return new Quantity(value * operand.asScalar(), units, notation, config);
      default:
        throw unsupported("multiply", operand);
    }
  }

  /**
   * Divides by another quantity, subtracting the exponents of its unit.  A bare number is
   * accepted only if this quantity's config is implicitly dimensionless, and leaves the unit as
   * it is.
   *
   * @throws UnitlessNumberException if {@code other} is a bare number that is not allowed
   * @throws NotSupportedException if {@code other} is neither a quantity nor a real number
   */
  public Quantity divide(Object other) {
    Operand operand = Operand.classify(other);
    switch (operand.getKind()) {
      case QUANTITY:
        Quantity quantity = operand.asQuantity();
        return combined(value / quantity.value, quantity, UnitAlgebra.DIVIDE);
      case SCALAR:
        checkImplicitDimensionless("divide");
        return new Quantity(value / operand.asScalar(), units, notation, config);
      default:
        throw unsupported("divide", operand);
    }
  }

  /**
   * Divides as {@link #divide(Object)} does and rounds the value down to an integer.
   */
  public Quantity floorDivide(Object other) {
    Quantity quotient = divide(other);
    quotient.value = Math.floor(quotient.value);
    return quotient;
  }

  /**
   * Raises to a power, multiplying every exponent of the unit by it.  Fractional powers give
   * fractional exponents; {@code m^2} to the power 0.5 is {@code m}.
   *
   * @param power a real number
   * @throws NotSupportedException if {@code power} is a quantity, a complex number or not a
   *     number at all
   */
  public Quantity pow(Object power) {
    Operand operand = Operand.classify(power);
    if (operand.getKind() != Operand.Kind.SCALAR) {
      throw new NotSupportedException(
          "Exponents must be real numbers without units, got " + operand.describe());
    }
    double exponent = operand.asScalar();
    return new Quantity(Math.pow(value, exponent),
        UnitAlgebra.rectify(UnitAlgebra.scaleExponents(units, exponent)), notation, config);
  }

  public Quantity mod(Object other) {
    throw new NotSupportedException("Modulo is not supported for quantities.");
  }

  public Quantity divmod(Object other) {
    throw new NotSupportedException("Divmod is not supported for quantities.");
  }

  // In place arithmetic

  public Quantity addAssign(Object other) {
    return assign(add(other));
  }

  public Quantity subtractAssign(Object other) {
    return assign(subtract(other));
  }

  public Quantity multiplyAssign(Object other) {
    return assign(multiply(other));
  }

  public Quantity divideAssign(Object other) {
    return assign(divide(other));
  }

  public Quantity floorDivideAssign(Object other) {
    return assign(floorDivide(other));
  }

  public Quantity powAssign(Object power) {
    return assign(pow(power));
  }

  // Unary arithmetic, which never touches the unit

  public Quantity negate() {
    return withValue(-value);
  }

  /**
   * Returns an equal copy of this quantity.
   */
  public Quantity plus() {
    return withValue(value);
  }

  public Quantity abs() {
    return withValue(Math.abs(value));
  }

  /**
   * Rounds to the nearest integer, ties to even.
   */
  public Quantity round() {
    return withValue(Math.rint(value));
  }

  /**
   * Rounds to a number of decimal places, ties to even.  Negative places round to tens,
   * hundreds and so on.
   */
  public Quantity round(int places) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return withValue(value);
    }
    // The exact binary value, so 2.675 (really 2.67499...) rounds down.
    return withValue(new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN)
        .doubleValue());
  }

  /**
   * Drops the fractional part, rounding towards zero.
   */
  public Quantity trunc() {
    return withValue(value < 0 ? Math.ceil(value) : Math.floor(value));
  }

  public Quantity floor() {
    return withValue(Math.floor(value));
  }

  public Quantity ceil() {
    return withValue(Math.ceil(value));
  }

  // Comparison

  public boolean isLessThan(@Nullable Object other) {
    Double otherValue = comparableValue(other);
    return otherValue != null && value < otherValue;
  }

  public boolean isAtMost(@Nullable Object other) {
    Double otherValue = comparableValue(other);
    return otherValue != null && value <= otherValue;
  }

  public boolean isGreaterThan(@Nullable Object other) {
    Double otherValue = comparableValue(other);
    return otherValue != null && value > otherValue;
  }

  public boolean isAtLeast(@Nullable Object other) {
    Double otherValue = comparableValue(other);
    return otherValue != null && value >= otherValue;
  }

  // Conversions

  public int intValue() {
    return (int) value;
  }

  public double doubleValue() {
    return value;
  }

  public boolean isZero() {
    return value == 0;
  }

  /**
   * Two quantities are equal when they have the same unit and the same value.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    Double otherValue = comparableValue(obj);
    return otherValue != null && value == otherValue;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value == 0 ? 0.0 : value, units);
  }

  @Override
  public String toString() {
    return value + " " + toUnitString();
  }

  @Nullable
  private Double comparableValue(@Nullable Object other) {
    Operand operand = Operand.classify(other);
    if (operand.getKind() != Operand.Kind.QUANTITY) {
      return null;
    }
    Quantity quantity = operand.asQuantity();
    return hasSameUnits(quantity) ? quantity.value : null;
  }

  private double sameUnitValue(Object other, String operation) {
    Operand operand = Operand.classify(other);
    switch (operand.getKind()) {
      case QUANTITY:
        Quantity quantity = operand.asQuantity();
        if (!hasSameUnits(quantity)) {
          throw new UnitMismatchException(String.format("Can not %s %s and %s, units differ.",
              operation, Notation.FRACTIONAL.render(units),
              Notation.FRACTIONAL.render(quantity.units)));
        }
        return quantity.value;
      case SCALAR:
        throw new UnitlessNumberException(String.format(
            "Can not %s a dimensionless value and a value with units.", operation));
      default:
        throw unsupported(operation, operand);
    }
  }

  private Quantity combined(double newValue, Quantity other, int sign) {
    UnitTerms merged = UnitAlgebra.rectify(UnitAlgebra.merge(units, other.units, sign));
    return new Quantity(newValue, merged, notation, config);
  }

  private void checkImplicitDimensionless(String operation) {
    if (!config.isImplicitDimensionless()) {
      throw new UnitlessNumberException(String.format("Can not %s by a dimensionless number "
          + "without wrapping it in a quantity or enabling implicit dimensionless arithmetic.",
          operation));
    }
  }

  private static NotSupportedException unsupported(String operation, Operand operand) {
    return new NotSupportedException(
        String.format("Can not %s a quantity and %s.", operation, operand.describe()));
  }

  private Quantity withValue(double newValue) {
    return new Quantity(newValue, units, notation, config);
  }

  private Quantity assign(Quantity result) {
    value = result.value;
    units = result.units;
    return this;
  }
}
