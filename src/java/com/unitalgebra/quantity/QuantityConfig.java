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

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.io.Closeables;

import org.apache.commons.lang.StringUtils;

/**
 * Settings a {@link Quantity} is created with and hands down to the results of its arithmetic.
 *
 * <p>Configs are immutable, so quantities created with different configs never interfere with
 * each other.  Configs can be assembled with a {@link #builder() builder} or read from
 * properties:
 * <pre>
 *   unitalgebra.implicit_dimensionless=true
 *   unitalgebra.notation=exponential
 * </pre>
 */
public final class QuantityConfig {

  private static final Logger LOG = Logger.getLogger(QuantityConfig.class.getName());

  public static final String IMPLICIT_DIMENSIONLESS_KEY = "unitalgebra.implicit_dimensionless";
  public static final String NOTATION_KEY = "unitalgebra.notation";

  /**
   * Bare numbers are rejected in multiplication and division, and units render as fractions.
   */
  public static final QuantityConfig DEFAULT = builder().build();

  private final boolean implicitDimensionless;
  private final Notation notation;
  private final SymbolTable symbols;

  private QuantityConfig(boolean implicitDimensionless, Notation notation, SymbolTable symbols) {
    this.implicitDimensionless = implicitDimensionless;
    this.notation = notation;
    this.symbols = symbols;
  }

  /**
   * Whether a bare number may multiply or divide a quantity as if it were dimensionless.  When
   * {@code false} such arithmetic throws {@link UnitlessNumberException}.
   */
  public boolean isImplicitDimensionless() {
    return implicitDimensionless;
  }

  /**
   * The notation new quantities render their units in.
   */
  public Notation getNotation() {
    return notation;
  }

  /**
   * The symbols unit text is parsed against.
   */
  public SymbolTable getSymbols() {
    return symbols;
  }

  UnitParser newParser() {
    return new UnitParser(symbols);
  }

  public Builder toBuilder() {
    return new Builder()
        .implicitDimensionless(implicitDimensionless)
        .notation(notation)
        .symbols(symbols);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a config from properties, using defaults for absent keys.
   *
   * @param properties the properties to read
   * @return the config described by the properties
   * @throws IllegalArgumentException if a property holds a value that is not understood
   */
  public static QuantityConfig fromProperties(Properties properties) {
    Preconditions.checkNotNull(properties);

    Builder builder = builder();
    String implicit = properties.getProperty(IMPLICIT_DIMENSIONLESS_KEY);
    if (implicit != null) {
      String flag = implicit.trim().toLowerCase(Locale.ENGLISH);
      Preconditions.checkArgument(flag.equals("true") || flag.equals("false"),
          "%s must be true or false, got: %s", IMPLICIT_DIMENSIONLESS_KEY, implicit);
      builder.implicitDimensionless(Boolean.parseBoolean(flag));
    }
    String notation = properties.getProperty(NOTATION_KEY);
    if (notation != null) {
      try {
        builder.notation(Notation.valueOf(notation.trim().toUpperCase(Locale.ENGLISH)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(String.format(
            "%s must be fractional or exponential, got: %s", NOTATION_KEY, notation), e);
      }
    }
    return builder.build();
  }

  /**
   * Reads a config from a properties file on the classpath.  A missing or unreadable file is
   * logged and yields {@link #DEFAULT}.
   *
   * @param resourcePath the classpath resource to load
   * @return the loaded config
   * @throws IllegalArgumentException if the file holds a value that is not understood
   */
  public static QuantityConfig load(String resourcePath) {
    Preconditions.checkArgument(!StringUtils.isBlank(resourcePath),
        "Resource path cannot be blank");

    LOG.info("Fetching quantity config from " + resourcePath);
    InputStream in = QuantityConfig.class.getClassLoader().getResourceAsStream(resourcePath);
    if (in == null) {
      LOG.warning("Failed to fetch quantity config from " + resourcePath + ", using defaults");
      return DEFAULT;
    }

    Properties properties = new Properties();
    try {
      properties.load(in);
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Failed to load quantity config " + resourcePath, e);
      return DEFAULT;
    } finally {
      Closeables.closeQuietly(in);
    }
    return fromProperties(properties);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof QuantityConfig)) {
      return false;
    }
    QuantityConfig other = (QuantityConfig) obj;
    return implicitDimensionless == other.implicitDimensionless
        && notation == other.notation
        && symbols.equals(other.symbols);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(implicitDimensionless, notation, symbols);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("implicitDimensionless", implicitDimensionless)
        .add("notation", notation)
        .toString();
  }

  /**
   * Assembles a {@link QuantityConfig}.
   */
  public static final class Builder {
    private boolean implicitDimensionless = false;
    private Notation notation = Notation.FRACTIONAL;
    private SymbolTable symbols = SymbolTables.standard();

    private Builder() {
      // use QuantityConfig.builder()
    }

    public Builder implicitDimensionless(boolean implicitDimensionless) {
      this.implicitDimensionless = implicitDimensionless;
      return this;
    }

    public Builder notation(Notation notation) {
      this.notation = Preconditions.checkNotNull(notation);
      return this;
    }

    public Builder symbols(SymbolTable symbols) {
      this.symbols = Preconditions.checkNotNull(symbols);
      return this;
    }

    public QuantityConfig build() {
      return new QuantityConfig(implicitDimensionless, notation, symbols);
    }
  }
}
