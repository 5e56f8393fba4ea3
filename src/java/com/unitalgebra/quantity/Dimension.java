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

/**
 * The SI base dimensions a unit term can quantify, plus the {@link #RECIPROCAL} marker that stands
 * in for a bare {@code 1} numerator in units like {@code 1/s}.
 */
public enum Dimension {
  TIME("s"),
  LENGTH("m"),
  // The kilogram is the SI base unit, but prefixes attach to the gram.
  MASS("g"),
  CURRENT("A"),
  TEMPERATURE("K"),
  AMOUNT_OF_SUBSTANCE("mol"),
  LUMINOUS_INTENSITY("cd"),
  RECIPROCAL("1");

  private final String rootSymbol;

  private Dimension(String rootSymbol) {
    this.rootSymbol = rootSymbol;
  }

  /**
   * Returns the unprefixed SI symbol for this dimension; eg: {@code g} for mass.
   */
  public String getRootSymbol() {
    return rootSymbol;
  }

  /**
   * Returns the symbol to render for a term of this dimension carrying the given prefix.
   *
   * @param prefix the SI prefix of the term
   * @return the prefix symbol followed by the root symbol; eg: {@code kg} or {@code ms}
   */
  public String symbol(Prefix prefix) {
    return prefix.getSymbol() + rootSymbol;
  }

  @Override
  public String toString() {
    return rootSymbol;
  }
}
