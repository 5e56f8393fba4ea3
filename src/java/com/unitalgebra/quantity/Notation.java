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
 * The text forms a {@link Quantity} can render its unit in.
 */
public enum Notation {
  /**
   * Positive exponents over negative ones; eg: {@code kg/m*s}.
   */
  FRACTIONAL {
    @Override public String render(UnitTerms terms) {
      return UnitRenderer.toFractionalString(terms);
    }
  },

  /**
   * Every exponent spelled out; eg: {@code kg*m^-1*s^-1}.
   */
  EXPONENTIAL {
    @Override public String render(UnitTerms terms) {
      return UnitRenderer.toExponentialString(terms);
    }
  };

  public abstract String render(UnitTerms terms);
}
