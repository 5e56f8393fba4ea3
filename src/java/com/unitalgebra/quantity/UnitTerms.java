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

import java.util.Iterator;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;

/**
 * An immutable sequence of {@link UnitTerm}s describing a compound unit.
 *
 * <p>The encounter order of terms is preserved so that rendering is stable, but it carries no
 * meaning: two sequences are equal when they hold the same (dimension, exponent) pairs the same
 * number of times, in any arrangement.  {@code kg*m} equals {@code m*kg}, and {@code m} never
 * equals {@code m*s}.
 */
public final class UnitTerms implements Iterable<UnitTerm> {

  private static final UnitTerms EMPTY = new UnitTerms(ImmutableList.<UnitTerm>of());

  private final ImmutableList<UnitTerm> terms;

  private UnitTerms(ImmutableList<UnitTerm> terms) {
    this.terms = terms;
  }

  public static UnitTerms empty() {
    return EMPTY;
  }

  public static UnitTerms of(UnitTerm... terms) {
    return copyOf(ImmutableList.copyOf(terms));
  }

  public static UnitTerms copyOf(Iterable<UnitTerm> terms) {
    Preconditions.checkNotNull(terms);
    if (terms instanceof UnitTerms) {
      return (UnitTerms) terms;
    }
    ImmutableList<UnitTerm> copy = ImmutableList.copyOf(terms);
    return copy.isEmpty() ? EMPTY : new UnitTerms(copy);
  }

  public int size() {
    return terms.size();
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  public UnitTerm get(int index) {
    return terms.get(index);
  }

  public List<UnitTerm> asList() {
    return terms;
  }

  /**
   * Checks whether a term with the same dimension and exponent is part of this sequence.
   */
  public boolean contains(UnitTerm term) {
    return terms.contains(term);
  }

  /**
   * Finds the first term for a dimension.
   *
   * @param dimension the dimension to look for
   * @return the term, or {@code null} if the dimension is absent
   */
  @Nullable
  public UnitTerm find(Dimension dimension) {
    for (UnitTerm term : terms) {
      if (term.getDimension() == dimension) {
        return term;
      }
    }
    return null;
  }

  /**
   * Returns the distinct dimensions present, in encounter order.
   */
  public ImmutableSet<Dimension> dimensions() {
    ImmutableSet.Builder<Dimension> dimensions = ImmutableSet.builder();
    for (UnitTerm term : terms) {
      dimensions.add(term.getDimension());
    }
    return dimensions.build();
  }

  @Override
  public Iterator<UnitTerm> iterator() {
    return terms.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof UnitTerms)) {
      return false;
    }
    UnitTerms other = (UnitTerms) obj;
    return terms.size() == other.terms.size()
        && ImmutableMultiset.copyOf(terms).equals(ImmutableMultiset.copyOf(other.terms));
  }

  @Override
  public int hashCode() {
    return ImmutableMultiset.copyOf(terms).hashCode();
  }

  @Override
  public String toString() {
    return UnitRenderer.toExponentialString(this);
  }
}
