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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Combines, normalizes and compares {@link UnitTerms}.  All functions are pure: operands are
 * never modified and results never share state with them.
 */
public final class UnitAlgebra {

  /**
   * The merge sign for multiplication, where exponents add.
   */
  public static final int MULTIPLY = 1;

  /**
   * The merge sign for division, where the divisor's exponents subtract.
   */
  public static final int DIVIDE = -1;

  private UnitAlgebra() {
    // utility
  }

  /**
   * Merges two term sequences keyed by dimension.  Each dimension present in either operand
   * yields exactly one term with exponent {@code a + sign * b}, where an absent term counts as
   * exponent 0.  The prefix comes from {@code a} when it has the dimension, otherwise from
   * {@code b}.
   *
   * <p>The result keeps zero exponents so that its dimensions are the union of the operands'
   * dimensions; pass it through {@link #rectify(UnitTerms)} to normalize.
   *
   * @param a the left operand
   * @param b the right operand
   * @param sign {@link #MULTIPLY} or {@link #DIVIDE}
   * @return a new term sequence ordered by first appearance in {@code a}, then in {@code b}
   */
  public static UnitTerms merge(UnitTerms a, UnitTerms b, int sign) {
    Preconditions.checkNotNull(a);
    Preconditions.checkNotNull(b);
    Preconditions.checkArgument(sign == MULTIPLY || sign == DIVIDE,
        "Merge sign must be 1 or -1, got %s", sign);

    Map<Dimension, UnitTerm> merged = Maps.newLinkedHashMap();
    accumulate(merged, a, 1);
    accumulate(merged, b, sign);
    return UnitTerms.copyOf(merged.values());
  }

  private static void accumulate(Map<Dimension, UnitTerm> merged, UnitTerms terms, int sign) {
    for (UnitTerm term : terms) {
      UnitTerm existing = merged.get(term.getDimension());
      if (existing == null) {
        merged.put(term.getDimension(), term.withExponent(sign * term.getExponent()));
      } else {
        merged.put(term.getDimension(),
            existing.withExponent(existing.getExponent() + sign * term.getExponent()));
      }
    }
  }

  /**
   * Normalizes a term sequence: zero exponent terms are dropped, and the {@code 1} numerator
   * marker is added when no positive exponent remains or removed when a real numerator exists.
   * Rectifying an already rectified sequence returns an equal sequence.
   *
   * @param terms the terms to normalize
   * @return the normalized terms
   */
  public static UnitTerms rectify(UnitTerms terms) {
    Preconditions.checkNotNull(terms);

    ImmutableList.Builder<UnitTerm> kept = ImmutableList.builder();
    boolean hasNumerator = false;
    for (UnitTerm term : terms) {
      if (term.isReciprocalMarker() || term.getExponent() == 0) {
        continue;
      }
      if (term.getExponent() > 0) {
        hasNumerator = true;
      }
      kept.add(term);
    }
    if (!hasNumerator) {
      kept.add(UnitTerm.reciprocalMarker());
    }
    return UnitTerms.copyOf(kept.build());
  }

  /**
   * Folds repeated dimensions into a single term and then {@link #rectify(UnitTerms) rectifies},
   * so {@code m*m/s} becomes {@code m^2/s}.
   */
  public static UnitTerms normalize(UnitTerms terms) {
    return rectify(merge(terms, UnitTerms.empty(), MULTIPLY));
  }

  /**
   * Checks whether two term sequences describe the same unit: they must be the same size and
   * every term of {@code b} must have a term of equal dimension and exponent in {@code a}.
   */
  public static boolean sameDimensions(UnitTerms a, UnitTerms b) {
    Preconditions.checkNotNull(a);
    Preconditions.checkNotNull(b);

    if (a.size() != b.size()) {
      return false;
    }
    for (UnitTerm term : b) {
      if (!a.contains(term)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Multiplies every exponent by {@code factor}, as when raising a quantity to a power.
   * Non-integral results are kept as they are.  The {@code 1} numerator marker is not scaled.
   *
   * @param terms the terms to scale
   * @param factor the power
   * @return the scaled terms, not yet rectified
   */
  public static UnitTerms scaleExponents(UnitTerms terms, double factor) {
    Preconditions.checkNotNull(terms);
    Preconditions.checkArgument(!Double.isNaN(factor) && !Double.isInfinite(factor),
        "Power must be finite, got %s", factor);

    ImmutableList.Builder<UnitTerm> scaled = ImmutableList.builder();
    for (UnitTerm term : terms) {
      scaled.add(term.isReciprocalMarker() ? term : term.withExponent(term.getExponent() * factor));
    }
    return UnitTerms.copyOf(scaled.build());
  }
}
