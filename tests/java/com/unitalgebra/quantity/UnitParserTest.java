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

import org.easymock.IMocksControl;
import org.junit.Before;
import org.junit.Test;

import static org.easymock.EasyMock.createControl;
import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class UnitParserTest {

  private UnitParser parser;

  @Before
  public void setUp() {
    parser = new UnitParser();
  }

  @Test
  public void testFractional() {
    UnitTerms terms = parser.parse("kg^3/m*s");

    assertEquals(UnitTerms.of(
        UnitTerm.of(Dimension.MASS, 3),
        UnitTerm.of(Dimension.LENGTH, -1),
        UnitTerm.of(Dimension.TIME, -1)), terms);
    assertEquals(Dimension.MASS, terms.get(0).getDimension());
    assertSame(Prefix.KILO, terms.get(0).getPrefix());
    assertSame(Prefix.NONE, terms.get(1).getPrefix());
  }

  @Test
  public void testExponential() {
    assertEquals(parser.parse("kg*m^2/s^2"), parser.parse("kg*m^2*s^-2"));
    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.LENGTH, 2)), parser.parse("m^+2"));
  }

  @Test
  public void testRepeatsAndZerosPassThrough() {
    UnitTerms terms = parser.parse("m*m^0/m");
    assertEquals(3, terms.size());
    assertEquals(0.0, terms.get(1).getExponent(), 0);
    assertEquals(-1.0, terms.get(2).getExponent(), 0);
  }

  @Test
  public void testReciprocal() {
    UnitTerms terms = parser.parse("1/s");
    assertEquals(2, terms.size());
    assertTrue(terms.get(0).isReciprocalMarker());
    assertEquals(UnitTerm.of(Dimension.TIME, -1), terms.get(1));
  }

  @Test
  public void testTrailingSlash() {
    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.LENGTH, 1)), parser.parse("m/"));
  }

  @Test
  public void testBracketsIgnored() {
    assertEquals(parser.parse("kg/m*s"), parser.parse("(kg)/[m*s]"));
    assertEquals(parser.parse("1/s^2*A"), parser.parse(" {1}/(s^2*A) "));
  }

  @Test
  public void testPrefixes() {
    assertPrefixed(Dimension.LENGTH, Prefix.MILLI, "mm");
    assertPrefixed(Dimension.LENGTH, Prefix.CENTI, "cm");
    assertPrefixed(Dimension.LENGTH, Prefix.DECA, "dam");
    assertPrefixed(Dimension.TIME, Prefix.MEGA, "Ms");
    assertPrefixed(Dimension.TIME, Prefix.MICRO, "us");
    assertPrefixed(Dimension.CURRENT, Prefix.MILLI, "mA");
    assertPrefixed(Dimension.AMOUNT_OF_SUBSTANCE, Prefix.KILO, "kmol");
    assertPrefixed(Dimension.LUMINOUS_INTENSITY, Prefix.NANO, "ncd");
  }

  @Test
  public void testTableSymbolsWinOverPrefixes() {
    // min is minutes, not a milli-in.
    assertPrefixed(Dimension.TIME, Prefix.NONE, "min");
    assertPrefixed(Dimension.LUMINOUS_INTENSITY, Prefix.NONE, "cd");
    assertPrefixed(Dimension.TEMPERATURE, Prefix.NONE, "k");
    assertPrefixed(Dimension.LENGTH, Prefix.NONE, "ft");
  }

  @Test
  public void testNonSiUnits() {
    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.LENGTH, 1), UnitTerm.of(Dimension.TIME, -1)),
        parser.parse("mi/hr"));
    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.MASS, 1)), parser.parse("lb"));
  }

  @Test(expected = UnitParseException.class)
  public void testBlank() {
    parser.parse(" ");
  }

  @Test(expected = UnitParseException.class)
  public void testNull() {
    parser.parse(null);
  }

  @Test(expected = UnitParseException.class)
  public void testTwoDivisors() {
    parser.parse("m/s/s");
  }

  @Test(expected = UnitParseException.class)
  public void testFractionalExponent() {
    parser.parse("m^2.5");
  }

  @Test(expected = UnitParseException.class)
  public void testSymbolicExponent() {
    parser.parse("m^k");
  }

  @Test(expected = UnitParseException.class)
  public void testMissingExponent() {
    parser.parse("m^");
  }

  @Test(expected = UnitParseException.class)
  public void testDoubleExponent() {
    parser.parse("m^2^3");
  }

  @Test(expected = UnitParseException.class)
  public void testMissingTerm() {
    parser.parse("m**s");
  }

  @Test(expected = UnitParseException.class)
  public void testMissingNumerator() {
    parser.parse("/s");
  }

  @Test(expected = UnitParseException.class)
  public void testNumberInSymbol() {
    parser.parse("2m");
  }

  @Test(expected = UnitParseException.class)
  public void testReciprocalInDenominator() {
    parser.parse("m/1");
  }

  @Test(expected = UnitParseException.class)
  public void testReciprocalWithExponent() {
    parser.parse("1^2/s");
  }

  @Test(expected = UnitParseException.class)
  public void testUnknownSymbol() {
    parser.parse("furlong");
  }

  @Test(expected = UnitParseException.class)
  public void testPrefixOnUnprefixableSymbol() {
    parser.parse("kft");
  }

  @Test(expected = UnitParseException.class)
  public void testSymbolsAreCaseSensitive() {
    parser.parse("KG");
  }

  @Test
  public void testCustomSymbolTable() {
    IMocksControl control = createControl();
    SymbolTable symbols = control.createMock(SymbolTable.class);

    expect(symbols.dimensionOf("furlong")).andReturn(Dimension.LENGTH);
    expect(symbols.dimensionOf("kfurlong")).andReturn(null);
    expect(symbols.isSiPrefixable("furlong")).andReturn(true);
    expect(symbols.dimensionOf("furlong")).andReturn(Dimension.LENGTH);

    control.replay();

    UnitParser custom = new UnitParser(symbols);
    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.LENGTH, 1)), custom.parse("furlong"));
    UnitTerms prefixed = custom.parse("kfurlong^2");
    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.LENGTH, 2)), prefixed);
    assertSame(Prefix.KILO, prefixed.get(0).getPrefix());

    control.verify();
  }

  @Test
  public void testBuiltSymbolTable() {
    SymbolTable symbols = SymbolTables.builder()
        .add(Dimension.LENGTH, "furlong", "league")
        .add(Dimension.TIME, "fortnight")
        .siPrefixable("league")
        .build();
    UnitParser custom = new UnitParser(symbols);

    assertEquals(UnitTerms.of(UnitTerm.of(Dimension.LENGTH, 1), UnitTerm.of(Dimension.TIME, -1)),
        custom.parse("furlong/fortnight"));
    assertSame(Prefix.MEGA, custom.parse("Mleague").get(0).getPrefix());
  }

  @Test(expected = UnitParseException.class)
  public void testBuiltSymbolTableReplacesStandard() {
    new UnitParser(SymbolTables.builder().add(Dimension.LENGTH, "furlong").build()).parse("m");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPrefixableSymbolMustBeInTable() {
    SymbolTables.builder().add(Dimension.LENGTH, "furlong").siPrefixable("league").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testReciprocalTakesNoSymbols() {
    SymbolTables.builder().add(Dimension.RECIPROCAL, "one");
  }

  private void assertPrefixed(Dimension dimension, Prefix prefix, String text) {
    UnitTerms terms = parser.parse(text);
    assertEquals(1, terms.size());
    assertEquals(dimension, terms.get(0).getDimension());
    assertSame(prefix, terms.get(0).getPrefix());
  }
}
