// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import io.github.simbo1905.symbolic.Expr.Binary;
import io.github.simbo1905.symbolic.Expr.BinaryKind;

/// Syntactic divisibility used to decide whether a quotient is a polynomial.
///
/// A sum or difference is divisible when both of its operands are; any other numerator is divisible when its degree
/// is at least the degree of the denominator. This is a degree comparison and not polynomial division, so it can
/// answer yes for quotients that leave a remainder (`(x^2 + x) / (x + 5)`) and can report a degree that the
/// simplified numerator does not have (`(x^2 - x^2) / x` has degree 1 here).
final class Divisibility {

  private Divisibility() {
  }

  static boolean divides(Expr numerator, Expr denominator) {
    if (numerator instanceof Binary binary
        && (binary.kind() == BinaryKind.ADD || binary.kind() == BinaryKind.SUB)) {
      return divides(binary.left(), denominator) && divides(binary.right(), denominator);
    }
    return numerator.polynomialDegree() >= denominator.polynomialDegree();
  }

  /// Degree of `numerator / denominator`, 0 when the quotient is not a polynomial
  static int quotientDegree(Expr numerator, Expr denominator) {
    if (!divides(numerator, denominator) || !numerator.isPolynomial() || !denominator.isPolynomial()) {
      return 0;
    }
    return Math.max(0, numerator.polynomialDegree() - denominator.polynomialDegree());
  }
}
