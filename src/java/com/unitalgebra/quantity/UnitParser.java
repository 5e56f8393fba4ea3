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

import java.util.List;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;

/**
 * Unit text parser.
 *
 * <p>Accepts fractional text such as {@code kg*m^2/s^2} and exponential text such as
 * {@code kg*m^2*s^-2}.  At most one {@code /} may separate numerator from denominator, terms are
 * joined with {@code *} and exponents are signed integers following {@code ^}.  Brackets of any
 * kind are dropped before parsing and do not group.  An empty denominator, as in {@code m/}, is
 * the same as none.  A lone {@code 1} in the numerator stands for a unit with nothing but a
 * denominator, as in {@code 1/s}.
 *
 * <p>Symbols are matched (case sensitively) against a {@link SymbolTable}.  A symbol that is not
 * itself in the table may start with an SI prefix if the rest of it is an SI prefixable symbol;
 * eg: {@code kg} or {@code dam}.
 */
public class UnitParser {

  private static final Logger LOG = Logger.getLogger(UnitParser.class.getName());

  private static final String GROUPING_CHARS = "()[]{}";
  private static final String RECIPROCAL = Dimension.RECIPROCAL.getRootSymbol();

  private static final Splitter FRACTION_SPLITTER = Splitter.on('/');
  private static final Splitter TERM_SPLITTER = Splitter.on('*');
  private static final Splitter EXPONENT_SPLITTER = Splitter.on('^');

  private final SymbolTable symbols;

  /**
   * Creates a parser over the {@link SymbolTables#standard() standard} symbols.
   */
  public UnitParser() {
    this(SymbolTables.standard());
  }

  public UnitParser(SymbolTable symbols) {
    this.symbols = Preconditions.checkNotNull(symbols);
  }

  /**
   * Parses unit text into terms in the order they appear.  Denominator exponents are negated.
   * The result is not rectified, so repeated dimensions and zero exponents are passed through.
   *
   * @param text the unit text
   * @return the parsed terms
   * @throws UnitParseException if the text is malformed or names an unknown unit
   */
  public UnitTerms parse(String text) {
    if (StringUtils.isBlank(text)) {
      throw new UnitParseException("Unit text cannot be blank.");
    }

    String stripped = StringUtils.replaceChars(text.trim(), GROUPING_CHARS, "");
    List<String> segments = FRACTION_SPLITTER.splitToList(stripped);
    if (segments.size() > 2) {
      throw new UnitParseException("More than one divisor '/' is not allowed: " + text);
    }

    ImmutableList.Builder<UnitTerm> terms = ImmutableList.builder();
    parseSegment(text, segments.get(0), 1, terms);
    // A trailing slash, as fractional text renders units without a denominator, is allowed.
    if (segments.size() == 2 && !segments.get(1).isEmpty()) {
      parseSegment(text, segments.get(1), -1, terms);
    }

    UnitTerms parsed = UnitTerms.copyOf(terms.build());
    LOG.fine("Parsed unit " + text + " as " + parsed.asList());
    return parsed;
  }

  private void parseSegment(String text, String segment, int sign,
      ImmutableList.Builder<UnitTerm> terms) {
    for (String token : TERM_SPLITTER.split(segment)) {
      terms.add(parseTerm(text, token, sign));
    }
  }

  private UnitTerm parseTerm(String text, String token, int sign) {
    if (token.isEmpty()) {
      throw new UnitParseException("Missing unit term in: " + text);
    }

    List<String> parts = EXPONENT_SPLITTER.splitToList(token);
    if (parts.size() > 2) {
      throw new UnitParseException(
          String.format("Unit term %s has more than one exponent in: %s", token, text));
    }

    String symbol = parts.get(0);
    if (RECIPROCAL.equals(symbol)) {
      if (sign < 0 || parts.size() > 1) {
        throw new UnitParseException(
            "1 may only appear alone in the numerator, as in 1/m, but found: " + text);
      }
      return UnitTerm.reciprocalMarker();
    }
    if (!StringUtils.isAlpha(symbol)) {
      throw new UnitParseException(String.format(
          "Numbers are only allowed in exponents (m^2) and reciprocal units (1/m), found %s in: %s",
          token, text));
    }

    double exponent = sign * (parts.size() == 2 ? parseExponent(text, token, parts.get(1)) : 1);
    return resolve(text, symbol, exponent);
  }

  private static int parseExponent(String text, String token, String exponent) {
    if (exponent.isEmpty()) {
      throw new UnitParseException(
          String.format("Unit term %s has '^' but no exponent in: %s", token, text));
    }
    try {
      return Integer.parseInt(exponent);
    } catch (NumberFormatException e) {
      throw new UnitParseException(String.format(
          "Exponents must be integers (m^2, not m^2.5 or m^k), found %s in: %s", token, text), e);
    }
  }

  private UnitTerm resolve(String text, String symbol, double exponent) {
    Dimension dimension = symbols.dimensionOf(symbol);
    if (dimension != null) {
      return UnitTerm.of(dimension, exponent);
    }

    Prefix prefix = splitPrefix(symbol);
    if (prefix != null) {
      Dimension prefixed = symbols.dimensionOf(symbol.substring(prefix.getSymbol().length()));
      if (prefixed != null) {
        return UnitTerm.of(prefixed, exponent, prefix);
      }
    }
    throw new UnitParseException(
        String.format("No unit found matching %s in: %s, options: %s", symbol, text, symbols));
  }

  @Nullable
  private Prefix splitPrefix(String symbol) {
    // Two letter prefix first, so that dam is a decametre rather than a deci-am.
    for (int length = 2; length >= 1; length--) {
      if (symbol.length() > length) {
        Prefix prefix = Prefix.forSymbol(symbol.substring(0, length));
        if (prefix != null && symbols.isSiPrefixable(symbol.substring(length))) {
          return prefix;
        }
      }
    }
    return null;
  }
}
