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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A single factor of a compound unit: a dimension raised to an exponent, optionally carrying an
 * SI prefix.  {@code kg^3} is the term {@code (MASS, 3, KILO)}.
 *
 * <p>Equality only considers dimension and exponent.  Prefixes are a rendering concern and
 * {@code g^2} and {@code kg^2} are interchangeable for the purposes of unit algebra.
 */
public final class UnitTerm {

  private static final UnitTerm RECIPROCAL_MARKER =
      new UnitTerm(Dimension.RECIPROCAL, 1, Prefix.NONE);

  private final Dimension dimension;
  private final double exponent;
  private final Prefix prefix;

  private UnitTerm(Dimension dimension, double exponent, Prefix prefix) {
    this.dimension = Preconditions.checkNotNull(dimension);
    this.exponent = exponent;
    this.prefix = Preconditions.checkNotNull(prefix);
  }

  public static UnitTerm of(Dimension dimension, double exponent) {
    return of(dimension, exponent, Prefix.NONE);
  }

  public static UnitTerm of(Dimension dimension, double exponent, Prefix prefix) {
    Preconditions.checkArgument(!Double.isNaN(exponent) && !Double.isInfinite(exponent),
        "Exponent must be finite, got %s", exponent);
    return new UnitTerm(dimension, exponent, prefix);
  }

  /**
   * Returns the synthetic {@code 1} numerator term.
   */
  public static UnitTerm reciprocalMarker() {
    return RECIPROCAL_MARKER;
  }

  public Dimension getDimension() {
    return dimension;
  }

  public double getExponent() {
    return exponent;
  }

  public Prefix getPrefix() {
    return prefix;
  }

  public boolean isReciprocalMarker() {
    return dimension == Dimension.RECIPROCAL;
  }

  /**
   * Returns a copy of this term raised to a new exponent, keeping dimension and prefix.
   */
  public UnitTerm withExponent(double newExponent) {
    return of(dimension, newExponent, prefix);
  }

  /**
   * Returns the symbol this term renders with, ignoring the exponent.
   */
  public String symbol() {
    return dimension.symbol(prefix);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof UnitTerm)) {
      return false;
    }
    UnitTerm other = (UnitTerm) obj;
    return dimension == other.dimension && exponent == other.exponent;
  }

  @Override
  public int hashCode() {
    // -0.0 == 0.0 in equals, so both must hash alike.
    return Objects.hashCode(dimension, exponent == 0 ? 0.0 : exponent);
  }

  @Override
  public String toString() {
    return String.format("%s^%s", symbol(), UnitRenderer.formatExponent(exponent));
  }
}
