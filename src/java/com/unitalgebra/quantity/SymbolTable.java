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

import javax.annotation.Nullable;

/**
 * Maps the unit symbols allowed in unit text to the dimension they quantify.
 */
public interface SymbolTable {

  /**
   * Looks up the dimension of a bare (unprefixed) symbol.
   *
   * @param symbol a unit symbol such as {@code g} or {@code ft}
   * @return the dimension, or {@code null} if the symbol is unknown
   */
  @Nullable
  Dimension dimensionOf(String symbol);

  /**
   * Checks whether a symbol may be written with an SI prefix; eg: {@code g} as {@code kg}.
   */
  boolean isSiPrefixable(String symbol);
}
