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

package com.unitalgebra.quantity.conversion;

/**
 * The unit families that ship with the library.
 *
 * <p>Multipliers give the size of each unit in the family's standard unit.  Units that take SI
 * prefixes are listed once, unprefixed; {@link ConversionResolver} derives the prefixed forms.
 */
public final class Families {

  /**
   * Mass, standardized on grams.
   */
  public static final UnitFamily MASS = UnitFamily.builder("mass", "g", "g")
      .unit("g", 1.0)
      .unit("tonne", 1000000.0)
      .unit("oz", 28.3495)
      .unit("troy_oz", 31.10348) // precious metals
      .unit("lb", 453.592)
      .unit("short_ton", 907185.0)
      .unit("long_ton", 1016000.0)
      .unit("gr", 0.0647989)
      .unit("stone", 6350.29) // 14 lb
      .unit("carat", 0.2)
      .unit("solar_mass", 2E33)
      .unit("earth_mass", 5.9722E27)
      .alias("mcg", "ug")
      .alias("μg", "ug")
      .alias("gram", "g")
      .alias("gm", "g")
      .alias("ton", "short_ton")
      .alias("short ton", "short_ton")
      .alias("metric tonne", "tonne")
      .alias("metric ton", "tonne")
      .alias("ounce", "oz")
      .alias("pound", "lb")
      .alias("lbs", "lb")
      .alias("st", "stone")
      .alias("long ton", "long_ton")
      .alias("weight ton", "long_ton")
      .alias("imperial ton", "long_ton")
      .alias("imp_ton", "long_ton")
      .alias("ct", "carat")
      .alias("sm", "solar_mass")
      .alias("suns", "solar_mass")
      .alias("em", "earth_mass")
      .alias("earths", "earth_mass")
      .siPrefixable("g")
      .build();

  /**
   * Distance, standardized on metres.
   */
  public static final UnitFamily DISTANCE = UnitFamily.builder("distance", "m", "m")
      .unit("chain", 20.1168)
      .unit("chain_benoit", 20.116782)
      .unit("chain_sears", 20.1167645)
      .unit("british_chain_benoit", 20.1167824944)
      .unit("british_chain_sears", 20.1167651216)
      .unit("british_chain_sears_truncated", 20.116756)
      .unit("british_ft", 0.304799471539)
      .unit("british_yd", 0.914398414616)
      .unit("clarke_ft", 0.3047972654)
      .unit("clarke_link", 0.201166195164)
      .unit("fathom", 1.8288)
      .unit("ft", 0.3048)
      .unit("german_m", 1.0000135965)
      .unit("gold_coast_ft", 0.304799710181508)
      .unit("indian_yd", 0.914398530744)
      .unit("inch", 0.0254)
      .unit("link", 0.201168)
      .unit("link_benoit", 0.20116782)
      .unit("link_sears", 0.20116765)
      .unit("m", 1.0)
      .unit("mi", 1609.344)
      .unit("naut_mi", 1852)
      .unit("naut_mi_uk", 1853.184)
      .unit("rod", 5.029210)
      .unit("sears_yd", 0.91439841)
      .unit("survey_ft", 0.304800609601)
      .unit("yd", 0.9144)
      .unit("ly", 9.46073E15)
      .unit("pc", 3.085678E16)
      .unit("lm", 1.799E10)
      .unit("ls", 2.998E8)
      .unit("ang", 1E-10)
      .unit("au", 1.495979E11)
      .unit("fermi", 1E-15)
      .alias("foot", "ft")
      .alias("inches", "inch")
      .alias("in", "inch")
      .alias("meter", "m")
      .alias("metre", "m")
      .alias("mile", "mi")
      .alias("yard", "yd")
      .alias("british chain (benoit 1895 b)", "british_chain_benoit")
      .alias("british chain 1895", "british_chain_benoit")
      .alias("british chain (sears 1922)", "british_chain_sears")
      .alias("british chain 1922", "british_chain_sears")
      .alias("british chain 1922 trunc", "british_chain_sears_truncated")
      .alias("british chain", "british_chain_sears_truncated")
      .alias("british foot (sears 1922)", "british_ft")
      .alias("british foot 1922", "british_ft")
      .alias("british foot", "british_ft")
      .alias("british yard (sears 1922)", "british_yd")
      .alias("british yard", "british_yd")
      .alias("clarke's foot", "clarke_ft")
      .alias("clarke's link", "clarke_link")
      .alias("chain (benoit)", "chain_benoit")
      .alias("chain (sears)", "chain_sears")
      .alias("foot (international)", "ft")
      .alias("german legal metre", "german_m")
      .alias("gold coast foot", "gold_coast_ft")
      .alias("link (benoit)", "link_benoit")
      .alias("link (sears)", "link_sears")
      .alias("nautical mile", "naut_mi")
      .alias("nautical mile (uk)", "naut_mi_uk")
      .alias("us survey foot", "survey_ft")
      .alias("u.s. foot", "survey_ft")
      .alias("yard (indian)", "indian_yd")
      .alias("indian yard", "indian_yd")
      .alias("yard (sears)", "sears_yd")
      .alias("sears yard", "sears_yd")
      .alias("light year", "ly")
      .alias("light-year", "ly")
      .alias("l.y.", "ly")
      .alias("parsec", "pc")
      .alias("light-minute", "lm")
      .alias("light minute", "lm")
      .alias("l.m.", "lm")
      .alias("light-second", "ls")
      .alias("light second", "ls")
      .alias("l.s.", "ls")
      .alias("angstrom", "ang")
      .alias("ångström", "ang")
      .siPrefixable("m")
      .build();

  /**
   * Time, standardized on seconds.
   */
  public static final UnitFamily TIME = UnitFamily.builder("time", "s", "s")
      .unit("s", 1.0)
      .unit("min", 60.0)
      .unit("hr", 3600.0)
      .unit("day", 86400.0)
      .unit("week", 604800.0)
      .alias("sec", "s")
      .alias("second", "s")
      .alias("seconds", "s")
      .alias("minute", "min")
      .alias("minutes", "min")
      .alias("hour", "hr")
      .alias("hours", "hr")
      .alias("days", "day")
      .alias("weeks", "week")
      .siPrefixable("s")
      .build();

  /**
   * Electric current, standardized on amperes.
   */
  public static final UnitFamily CURRENT = UnitFamily.builder("current", "A", "A")
      .unit("A", 1.0)
      .alias("amp", "A")
      .alias("amps", "A")
      .alias("ampere", "A")
      .siPrefixable("A")
      .build();

  /**
   * Energy, standardized on joules.
   *
   * <p>Electronvolts use the NIST conversion 1 eV = 1.6021766208E-19 J and hartrees the 2014 CODATA
   * value 1 hartree = 4.359744650E-18 J.  Hertz converts through the Planck constant (E = hf).
   * Natural gas volumes use the US annual average heat content.  Unqualified {@code btu} is the ISO
   * BTU and unqualified {@code cal} the thermochemical calorie; {@code Cal} is the nutritional
   * kilocalorie.
   */
  public static final UnitFamily ENERGY = UnitFamily.builder("energy", "J", "kg*m^2/s^2")
      .unit("J", 1.0)
      .unit("foot_pound", 1.355818)
      .unit("foot_poundal", 0.0421401100938048)
      .unit("watt_hour", 3600.0)
      .unit("watt_min", 60.0)
      .unit("eV", 1.6021766208E-19)
      .unit("hartree", 4.359744650E-18)
      .unit("erg", 1.0E-7)
      .unit("hertz", 6.62607015E-34)
      .unit("m3_ng", 38637896.84)
      .unit("cm3_ng", 38.63753164)
      .unit("ft3_ng", 1094093.072)
      .unit("in3_ng", 633.155713)
      .unit("tonne_tnt", 4.184E9)
      .unit("therm_ec", 1.05506E8)
      .unit("therm_us", 1.054804E8)
      .unit("btu_it", 1.05505585262E3)
      .unit("btu_iso", 1.05506E3)
      .unit("btu_th", 1.054350E3)
      .unit("btu_mean", 1.05587E3)
      .unit("btu_39", 1.05967E3) // 39F, water at maximum density
      .unit("btu_59", 1.05480E3) // 59F, US natural gas pricing
      .unit("btu_60", 1.05468E3) // 60F, mostly Canada
      .unit("cal_th", 4.184)
      .unit("cal_it", 4.1868)
      .unit("cal_mean", 4.19002)
      .unit("cal_15", 4.18580)
      .unit("cal_20", 4.18190)
      .unit("cal_nutrition", 4184.0)
      .alias("joule", "J")
      .alias("j", "J")
      .alias("ftlb", "foot_pound")
      .alias("ft-lb", "foot_pound")
      .alias("ft_lb", "foot_pound")
      .alias("ftlbs", "foot_pound")
      .alias("ft-lbs", "foot_pound")
      .alias("ft_lbs", "foot_pound")
      .alias("ftlbf", "foot_pound")
      .alias("ft-lbf", "foot_pound")
      .alias("ft_lbf", "foot_pound")
      .alias("ft_pdl", "foot_poundal")
      .alias("ft-pdl", "foot_poundal")
      .alias("ftpdl", "foot_poundal")
      .alias("watt_hr", "watt_hour")
      .alias("watt_h", "watt_hour")
      .alias("watt_minute", "watt_min")
      .alias("watt_sec", "J")
      .alias("watt_s", "J")
      .alias("ev", "eV")
      .alias("electronvolt", "eV")
      .alias("ha", "hartree")
      .alias("hz", "hertz")
      .alias("ton_tnt", "tonne_tnt")
      .alias("tontnt", "tonne_tnt")
      .alias("tons_tnt", "tonne_tnt")
      .alias("tonstnt", "tonne_tnt")
      .alias("tnt", "tonne_tnt")
      .alias("btu", "btu_iso")
      .alias("BTU", "btu_iso")
      .alias("british_thermal_unit", "btu_iso")
      .alias("cal", "cal_th")
      .alias("calorie", "cal_th")
      .alias("Calorie", "cal_nutrition")
      .alias("Cal", "cal_nutrition")
      .siPrefixable("J", "eV", "tonne_tnt")
      .build();

  /**
   * Volume, standardized on cubic metres.
   */
  public static final UnitFamily VOLUME = UnitFamily.builder("volume", "cubic_meter", "m^3")
      .unit("us_g", 0.00378541)
      .unit("us_qt", 0.000946353)
      .unit("us_pint", 0.000473176)
      .unit("us_cup", 0.000236588)
      .unit("us_oz", 2.9574e-5)
      .unit("us_tbsp", 1.4787e-5)
      .unit("us_tsp", 4.9289e-6)
      .unit("cubic_millimeter", 0.000000001)
      .unit("cubic_centimeter", 0.000001)
      .unit("cubic_decimeter", 0.001)
      .unit("cubic_meter", 1.0)
      .unit("l", 0.001)
      .unit("cubic_foot", 0.0283168)
      .unit("cubic_inch", 1.6387e-5)
      .unit("imperial_g", 0.00454609)
      .unit("imperial_qt", 0.00113652)
      .unit("imperial_pint", 0.000568261)
      .unit("imperial_oz", 2.8413e-5)
      .unit("imperial_tbsp", 1.7758e-5)
      .unit("imperial_tsp", 5.9194e-6)
      .unit("tonnage", 2.83168)
      .alias("US Gallon", "us_g")
      .alias("gallon", "us_g")
      .alias("gal", "us_g")
      .alias("US Quart", "us_qt")
      .alias("quart", "us_qt")
      .alias("qt", "us_qt")
      .alias("US Pint", "us_pint")
      .alias("US Cup", "us_cup")
      .alias("cup", "us_cup")
      .alias("US Ounce", "us_oz")
      .alias("oz", "us_oz")
      .alias("US Fluid Ounce", "us_oz")
      .alias("US Tablespoon", "us_tbsp")
      .alias("tbsp", "us_tbsp")
      .alias("US Teaspoon", "us_tsp")
      .alias("tsp", "us_tsp")
      .alias("cubic millimeter", "cubic_millimeter")
      .alias("mm3", "cubic_millimeter")
      .alias("cubic centimeter", "cubic_centimeter")
      .alias("cm3", "cubic_centimeter")
      .alias("ml", "cubic_centimeter")
      .alias("cubic decimeter", "cubic_decimeter")
      .alias("dm3", "cubic_decimeter")
      .alias("cubic meter", "cubic_meter")
      .alias("m3", "cubic_meter")
      .alias("liter", "l")
      .alias("litre", "l")
      .alias("cubic foot", "cubic_foot")
      .alias("ft3", "cubic_foot")
      .alias("cubic inch", "cubic_inch")
      .alias("in3", "cubic_inch")
      .alias("Imperial Gallon", "imperial_g")
      .alias("imp_g", "imperial_g")
      .alias("Imperial Quart", "imperial_qt")
      .alias("imp_qt", "imperial_qt")
      .alias("Imperial Pint", "imperial_pint")
      .alias("imp_pint", "imperial_pint")
      .alias("Imperial Ounce", "imperial_oz")
      .alias("imp_oz", "imperial_oz")
      .alias("Imperial Tablespoon", "imperial_tbsp")
      .alias("imp_tbsp", "imperial_tbsp")
      .alias("Imperial Teaspoon", "imperial_tsp")
      .alias("imp_tsp", "imperial_tsp")
      .alias("tnge", "tonnage")
      .siPrefixable("l")
      .build();

  private Families() {
    // utility
  }
}
