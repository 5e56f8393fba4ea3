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

import com.google.common.testing.EqualsTester;

import org.apache.commons.numbers.complex.Complex;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class QuantityTest {

  private static final QuantityConfig IMPLICIT =
      QuantityConfig.builder().implicitDimensionless(true).build();

  @Test
  public void testCreation() {
    Quantity quantity = Quantity.of(10, "kg^3/m*s");

    assertEquals(10.0, quantity.getValue(), 0);
    assertEquals(new UnitParser().parse("kg^3/m*s"), quantity.getUnits());
    assertEquals("kg^3/m*s", quantity.toUnitString());
    assertSame(Notation.FRACTIONAL, quantity.getNotation());
    assertSame(QuantityConfig.DEFAULT, quantity.getConfig());
  }

  @Test
  public void testCreationNormalizes() {
    assertEquals("m^2/s", Quantity.of(1, "m*m/s").toUnitString());
    assertEquals("1/s", Quantity.of(1, "1/s").toUnitString());
    assertEquals("m^2/", Quantity.of(1, UnitTerms.of(
        UnitTerm.of(Dimension.LENGTH, 1), UnitTerm.of(Dimension.LENGTH, 1))).toUnitString());
  }

  @Test(expected = UnitParseException.class)
  public void testCreationBadUnit() {
    Quantity.of(1, "m/s/s");
  }

  @Test
  public void testAdd() {
    Quantity sum = Quantity.of(10, "kg^3/m*s").add(Quantity.of(25.5, "kg^3/m*s"));

    assertEquals(35.5, sum.getValue(), 0);
    assertEquals("kg^3/m*s", sum.toUnitString());
    assertEquals("kg^3*m^-1*s^-1", sum.withNotation(Notation.EXPONENTIAL).toUnitString());
    assertEquals("35.5 kg^3/m*s", sum.toString());
  }

  @Test
  public void testAddReorderedUnit() {
    assertEquals(Quantity.of(3, "m*kg"), Quantity.of(1, "kg*m").add(Quantity.of(2, "m*kg")));
  }

  @Test
  public void testPrefixesDoNotChangeTheUnit() {
    Quantity sum = Quantity.of(1, "kg").add(Quantity.of(1, "g"));

    assertEquals(2.0, sum.getValue(), 0);
    assertEquals("kg/", sum.toUnitString());
    assertEquals(Quantity.of(1, "kg"), Quantity.of(1, "g"));
  }

  @Test
  public void testSubtract() {
    Quantity difference = Quantity.of(10, "m/s").subtract(Quantity.of(2.5, "m/s"));
    assertEquals(7.5, difference.getValue(), 0);
    assertEquals("m/s", difference.toUnitString());
  }

  @Test
  public void testMultiply() {
    Quantity product = Quantity.of(10, "kg/m^3").multiply(Quantity.of(25.5, "m^3/s"));

    assertEquals(255.0, product.getValue(), 0);
    assertEquals("kg/s", product.toUnitString());
  }

  @Test
  public void testDivide() {
    Quantity quotient = Quantity.of(10, "kg/m^3").divide(Quantity.of(25.5, "m^3/s"));

    assertEquals(0.3922, quotient.getValue(), 1e-4);
    assertEquals("kg*s/m^6", quotient.toUnitString());
  }

  @Test
  public void testDivideToDimensionless() {
    Quantity ratio = Quantity.of(10, "m/s").divide(Quantity.of(5, "m/s"));

    assertEquals(2.0, ratio.getValue(), 0);
    assertEquals("1/", ratio.toUnitString());
    assertEquals("1", ratio.withNotation(Notation.EXPONENTIAL).toUnitString());
  }

  @Test
  public void testFloorDivide() {
    Quantity quotient = Quantity.of(10, "kg/m^3").floorDivide(Quantity.of(25.5, "m^3/s"));
    assertEquals(0.0, quotient.getValue(), 0);
    assertEquals("kg*s/m^6", quotient.toUnitString());

    assertEquals(3.0, Quantity.of(10, "m").floorDivide(Quantity.of(3, "s")).getValue(), 0);
    assertEquals(-4.0, Quantity.of(-10, "m").floorDivide(Quantity.of(3, "s")).getValue(), 0);
  }

  @Test
  public void testMismatchedUnits() {
    try {
      Quantity.of(1, "m").add(Quantity.of(1, "s"));
      fail("Units differ");
    } catch (UnitMismatchException e) {
      // expected
    }
    try {
      Quantity.of(1, "m").subtract(Quantity.of(1, "m^2"));
      fail("Units differ");
    } catch (UnitMismatchException e) {
      // expected
    }
  }

  @Test(expected = UnitlessNumberException.class)
  public void testAddScalar() {
    Quantity.of(1, "m").add(5);
  }

  @Test(expected = UnitlessNumberException.class)
  public void testAddScalarIsNeverImplicit() {
    Quantity.of(1, "m", IMPLICIT).subtract(5.0);
  }

  @Test(expected = UnitlessNumberException.class)
  public void testMultiplyScalar() {
    Quantity.of(1, "m").multiply(2);
  }

  @Test(expected = UnitlessNumberException.class)
  public void testDivideScalar() {
    Quantity.of(1, "m").divide(2);
  }

  @Test
  public void testImplicitDimensionless() {
    Quantity quantity = Quantity.of(10, "m/s", IMPLICIT);

    assertEquals(Quantity.of(20, "m/s"), quantity.multiply(2));
    assertEquals(Quantity.of(2.5, "m/s"), quantity.divide(4L));
    assertEquals(Quantity.of(15, "m/s"), quantity.multiply(new BigDecimal("1.5")));
    assertEquals(Quantity.of(3, "m/s"), quantity.floorDivide(3));
  }

  @Test
  public void testResultsKeepConfig() {
    Quantity product = Quantity.of(2, "m", IMPLICIT).multiply(Quantity.of(3, "s"));
    assertSame(IMPLICIT, product.getConfig());
    assertEquals(Quantity.of(12, "m*s"), product.multiply(2));
  }

  @Test
  public void testUnsupportedOperands() {
    Quantity quantity = Quantity.of(1, "m", IMPLICIT);
    Object[] operands = { Complex.ofCartesian(2, 0), "2", null, new Object() };
    for (Object operand : operands) {
      assertNotSupported(quantity, "add", operand);
      assertNotSupported(quantity, "subtract", operand);
      assertNotSupported(quantity, "multiply", operand);
      assertNotSupported(quantity, "divide", operand);
      assertNotSupported(quantity, "pow", operand);
    }
  }

  @Test
  public void testPow() {
    Quantity squared = Quantity.of(3, "m/s").pow(2);
    assertEquals(9.0, squared.getValue(), 0);
    assertEquals("m^2/s^2", squared.toUnitString());

    assertEquals(Quantity.of(2, "m"), Quantity.of(4, "m^2").pow(0.5));
    assertEquals("1/s^2", Quantity.of(2, "1/s").pow(2).toUnitString());
    assertEquals("m^-2*1", Quantity.of(2, "m").pow(-2)
        .withNotation(Notation.EXPONENTIAL).toUnitString());
  }

  @Test
  public void testPowZero() {
    Quantity one = Quantity.of(5, "kg*m").pow(0);
    assertEquals(1.0, one.getValue(), 0);
    assertEquals("1/", one.toUnitString());
  }

  @Test
  public void testPowFractionalExponents() {
    Quantity root = Quantity.of(9, "m").pow(0.5);
    assertEquals(3.0, root.getValue(), 0);
    assertEquals("m^0.5/", root.toUnitString());
    assertEquals(Quantity.of(9, "m"), root.pow(2));
  }

  @Test(expected = NotSupportedException.class)
  public void testPowQuantity() {
    Quantity.of(2, "m").pow(Quantity.of(2, "m"));
  }

  @Test(expected = NotSupportedException.class)
  public void testMod() {
    Quantity.of(5, "m").mod(Quantity.of(2, "m"));
  }

  @Test(expected = NotSupportedException.class)
  public void testDivmod() {
    Quantity.of(5, "m").divmod(Quantity.of(2, "m"));
  }

  @Test
  public void testInPlace() {
    Quantity quantity = Quantity.of(10, "m");

    assertSame(quantity, quantity.addAssign(Quantity.of(5, "m")));
    assertEquals(15.0, quantity.getValue(), 0);

    assertSame(quantity, quantity.subtractAssign(Quantity.of(3, "m")));
    assertEquals(12.0, quantity.getValue(), 0);

    assertSame(quantity, quantity.multiplyAssign(Quantity.of(2, "s")));
    assertEquals(Quantity.of(24, "m*s"), quantity);

    assertSame(quantity, quantity.powAssign(2));
    assertEquals(Quantity.of(576, "m^2*s^2"), quantity);

    assertSame(quantity, quantity.divideAssign(Quantity.of(4, "m*s^2")));
    assertEquals(Quantity.of(144, "m"), quantity);

    assertSame(quantity, quantity.floorDivideAssign(Quantity.of(5, "m")));
    assertEquals(28.0, quantity.getValue(), 0);
    assertEquals("1/", quantity.toUnitString());
  }

  @Test
  public void testFailedInPlaceLeavesQuantity() {
    Quantity quantity = Quantity.of(10, "m");
    try {
      quantity.addAssign(Quantity.of(5, "s"));
      fail("Units differ");
    } catch (UnitMismatchException e) {
      // expected
    }
    assertEquals(Quantity.of(10, "m"), quantity);
  }

  @Test
  public void testUnary() {
    Quantity quantity = Quantity.of(-2.5, "m/s");

    assertEquals(Quantity.of(2.5, "m/s"), quantity.negate());
    assertEquals(Quantity.of(2.5, "m/s"), quantity.abs());
    assertEquals(quantity, quantity.plus());
    assertNotSame(quantity, quantity.plus());
    assertEquals("m/s", quantity.negate().toUnitString());
  }

  @Test
  public void testRounding() {
    assertEquals(2.0, Quantity.of(2.5, "m").round().getValue(), 0);
    assertEquals(4.0, Quantity.of(3.5, "m").round().getValue(), 0);
    assertEquals(2.2, Quantity.of(2.25, "m").round(1).getValue(), 0);
    assertEquals(2.4, Quantity.of(2.35, "m").round(1).getValue(), 0);
    assertEquals(120.0, Quantity.of(125, "m").round(-1).getValue(), 0);
    assertEquals(2.67, Quantity.of(2.675, "m").round(2).getValue(), 0);
    assertEquals(0.1, Quantity.of(0.15, "m").round(1).getValue(), 0);
    assertTrue(Double.isNaN(Quantity.of(Double.NaN, "m").round(2).getValue()));

    assertEquals(-2.0, Quantity.of(-2.7, "m").trunc().getValue(), 0);
    assertEquals(2.0, Quantity.of(2.7, "m").trunc().getValue(), 0);
    assertEquals(-3.0, Quantity.of(-2.5, "m").floor().getValue(), 0);
    assertEquals(-2.0, Quantity.of(-2.5, "m").ceil().getValue(), 0);
    assertEquals("m/", Quantity.of(2.7, "m").floor().toUnitString());
  }

  @Test
  public void testComparison() {
    Quantity one = Quantity.of(1, "m");
    Quantity two = Quantity.of(2, "m");

    assertTrue(one.isLessThan(two));
    assertTrue(one.isAtMost(two));
    assertTrue(one.isAtMost(Quantity.of(1, "m")));
    assertTrue(two.isGreaterThan(one));
    assertTrue(two.isAtLeast(one));
    assertTrue(two.isAtLeast(Quantity.of(2, "m")));
    assertFalse(two.isLessThan(one));
    assertFalse(one.isGreaterThan(one));
  }

  @Test
  public void testComparisonAcrossUnitsIsFalse() {
    Quantity metre = Quantity.of(1, "m");
    Quantity seconds = Quantity.of(2, "s");

    assertFalse(metre.isLessThan(seconds));
    assertFalse(metre.isAtMost(seconds));
    assertFalse(metre.isGreaterThan(seconds));
    assertFalse(metre.isAtLeast(seconds));
    assertFalse(metre.isLessThan(5));
    assertFalse(metre.isAtLeast(null));
    assertFalse(metre.isGreaterThan("0"));
  }

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(Quantity.of(1, "kg*m"), Quantity.of(1, "m*kg"),
            Quantity.of(1, "kg*m^2/m"))
        .addEqualityGroup(Quantity.of(2, "kg*m"))
        .addEqualityGroup(Quantity.of(1, "m"))
        .addEqualityGroup(Quantity.of(0, "m"), Quantity.of(-0.0, "m"))
        .addEqualityGroup(1.0)
        .testEquals();
  }

  @Test
  public void testNotation() {
    Quantity quantity = Quantity.of(10, "kg^3/m*s");
    Quantity exponential = quantity.withNotation(Notation.EXPONENTIAL);

    assertEquals("10.0 kg^3*m^-1*s^-1", exponential.toString());
    assertEquals("10.0 kg^3/m*s", quantity.toString());
    assertEquals(quantity, exponential);

    quantity.setNotation(Notation.EXPONENTIAL);
    assertEquals("10.0 kg^3*m^-1*s^-1", quantity.toString());
  }

  @Test
  public void testConfiguredNotation() {
    QuantityConfig config = QuantityConfig.builder().notation(Notation.EXPONENTIAL).build();
    Quantity quantity = Quantity.of(2, "m/s", config);

    assertSame(Notation.EXPONENTIAL, quantity.getNotation());
    assertEquals("m^2*s^-2", quantity.multiply(quantity).toUnitString());
  }

  @Test
  public void testCustomSymbols() {
    QuantityConfig config = QuantityConfig.builder()
        .symbols(SymbolTables.builder()
            .add(Dimension.LENGTH, "furlong")
            .add(Dimension.TIME, "fortnight")
            .build())
        .build();

    Quantity speed = Quantity.of(3, "furlong/fortnight", config);
    assertTrue(speed.hasSameUnits(Quantity.of(3, "m/s")));
  }

  @Test
  public void testNumberConversions() {
    assertEquals(2, Quantity.of(2.9, "m").intValue());
    assertEquals(-2, Quantity.of(-2.9, "m").intValue());
    assertEquals(2.9, Quantity.of(2.9, "m").doubleValue(), 0);
    assertTrue(Quantity.of(0, "m").isZero());
    assertFalse(Quantity.of(0.1, "m").isZero());
  }

  private static void assertNotSupported(Quantity quantity, String operation, Object operand) {
    try {
      if (operation.equals("add")) {
        quantity.add(operand);
      } else if (operation.equals("subtract")) {
        quantity.subtract(operand);
      } else if (operation.equals("multiply")) {
        quantity.multiply(operand);
      } else if (operation.equals("divide")) {
        quantity.divide(operand);
      } else {
        quantity.pow(operand);
      }
      fail(String.format("Expected %s with %s to be unsupported", operation, operand));
    } catch (NotSupportedException e) {
      // expected
    }
  }
}
