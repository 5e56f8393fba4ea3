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

import com.google.common.base.Preconditions;

import org.apache.commons.numbers.complex.Complex;

/**
 * The right hand side of a {@link Quantity} operation, classified once so that each operation can
 * switch on its {@link Kind}.
 */
final class Operand {

  enum Kind {
    /**
     * Another quantity.
     */
    QUANTITY,

    /**
     * A plain real number, any {@link Number}.
     */
    SCALAR,

    /**
     * A complex number, which no quantity operation accepts.
     */
    COMPLEX,

    /**
     * Anything else, including {@code null}.
     */
    UNSUPPORTED
  }

  private final Kind kind;
  @Nullable private final Object value;

  private Operand(Kind kind, @Nullable Object value) {
    this.kind = kind;
    this.value = value;
  }

  static Operand classify(@Nullable Object value) {
    if (value instanceof Quantity) {
      return new Operand(Kind.QUANTITY, value);
    } else if (value instanceof Number) {
      return new Operand(Kind.SCALAR, value);
    } else if (value instanceof Complex) {
      return new Operand(Kind.COMPLEX, value);
    } else {
      return new Operand(Kind.UNSUPPORTED, value);
    }
  }

  Kind getKind() {
    return kind;
  }

  Quantity asQuantity() {
    Preconditions.checkState(kind == Kind.QUANTITY, "Operand is a %s, not a quantity", kind);
    return (Quantity) value;
  }

  double asScalar() {
    Preconditions.checkState(kind == Kind.SCALAR, "Operand is a %s, not a scalar", kind);
    return ((Number) value).doubleValue();
  }

  /**
   * Describes the operand for error messages.
   */
  String describe() {
    return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
  }
}
