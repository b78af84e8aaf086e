// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import static io.github.simbo1905.symbolic.Expr.LOGGER;

/// Simplification mode. Set via system property `io.github.simbo1905.symbolic.Simplification`. The default is
/// EXTENDED.
///
/// Both modes apply the identity rules on construction: `A+0`, `A+A`, `c*A+A`, `A-0`, `A-A`, `A*0`, `A*1`, `A/A`,
/// `A/1`, `0/A`, `b^0` and `b^1`.
/// EXTENDED additionally merges powers of equal bases: `b^m * b^n` becomes `b^(m+n)`, `b^m / b^n` becomes `b^(m-n)`
/// and any other `A*A` becomes `A^2`.
public enum SimplificationMode {
  /// Identity rules only
  BASIC,

  /// Identity rules plus exponent merging
  EXTENDED;

  public static final String PROPERTY = "io.github.simbo1905.symbolic.Simplification";

  /// Resolve the mode from the system property, falling back to EXTENDED when it is unset
  static SimplificationMode configured() {
    final String value = System.getProperty(PROPERTY);
    if (value == null || value.isBlank()) {
      return EXTENDED;
    }
    final var mode = parse(value);
    LOGGER.fine(() -> PROPERTY + "=" + value + " resolved to " + mode);
    return mode;
  }

  static SimplificationMode parse(String value) {
    final String normalized = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(mode -> mode.name().equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown simplification mode '" + value + "' for "
            + PROPERTY + ", expected one of " + Arrays.stream(values()).map(Enum::name)
            .collect(Collectors.joining(", "))));
  }
}
