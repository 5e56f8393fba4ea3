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
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Renders {@link UnitTerms} as unit text.
 *
 * <p>Fractional text puts positive exponents over negative ones, {@code kg*s/m^6}.  Exponential
 * text spells every exponent out, {@code kg*s*m^-6}.  Both forms parse back through
 * {@link UnitParser} as long as every exponent is integral.
 */
public final class UnitRenderer {

  private static final Joiner TERM_JOINER = Joiner.on('*');

  private UnitRenderer() {
    // utility
  }

  /**
   * Renders terms as {@code numerator/denominator}.  The numerator is {@code 1} when the only
   * positive term is the reciprocal marker.  The slash is always present, so a unit without a
   * denominator renders with a trailing slash; eg: {@code m/}.
   *
   * @param terms the terms to render
   * @return the fractional unit text
   */
  public static String toFractionalString(UnitTerms terms) {
    Preconditions.checkNotNull(terms);

    List<String> numerator = Lists.newArrayList();
    List<String> denominator = Lists.newArrayList();
    boolean reciprocal = false;
    for (UnitTerm term : terms) {
      if (term.isReciprocalMarker()) {
        reciprocal = true;
      } else if (term.getExponent() > 0) {
        numerator.add(render(term.symbol(), term.getExponent()));
      } else if (term.getExponent() < 0) {
        denominator.add(render(term.symbol(), -term.getExponent()));
      }
    }
    if (numerator.isEmpty() && reciprocal) {
      numerator.add(Dimension.RECIPROCAL.getRootSymbol());
    }
    return TERM_JOINER.join(numerator) + "/" + TERM_JOINER.join(denominator);
  }

  /**
   * Renders every term with its signed exponent, joined by {@code *}.  Zero exponents are
   * skipped; the reciprocal marker renders as {@code 1}.
   *
   * @param terms the terms to render
   * @return the exponential unit text
   */
  public static String toExponentialString(UnitTerms terms) {
    Preconditions.checkNotNull(terms);

    List<String> rendered = Lists.newArrayList();
    for (UnitTerm term : terms) {
      if (term.getExponent() != 0) {
        rendered.add(render(term.symbol(), term.getExponent()));
      }
    }
    return TERM_JOINER.join(rendered);
  }

  private static String render(String symbol, double exponent) {
    return exponent == 1 ? symbol : symbol + "^" + formatExponent(exponent);
  }

  /**
   * Formats an exponent without a trailing {@code .0} when it is integral.
   */
  static String formatExponent(double exponent) {
    if (exponent == Math.rint(exponent) && Math.abs(exponent) < Long.MAX_VALUE) {
      return Long.toString((long) exponent);
    }
    return BigDecimal.valueOf(exponent).stripTrailingZeros().toPlainString();
  }
}
