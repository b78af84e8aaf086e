// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import io.github.simbo1905.symbolic.Expr.*;

import java.util.Objects;

import static io.github.simbo1905.symbolic.Expr.LOGGER;

/// Peephole rewriter applied to a single freshly built node. It only inspects the top of the node it is given and
/// never walks into the children, which were simplified when they were built. Rules are tried in order and the first
/// match wins; the node a rule produces is not rewritten again, so `(-1*A)+A` becomes `0*A`. Merged exponents are the
/// one exception: `b^m*b^n` only consults the power rules, so `x^2/x` becomes `x` and not `x^1`.
///
/// The identities assume no division by zero at runtime: `A/A` is rewritten to `1` without checking that `A` is
/// non-zero.
final class Simplifier {

  private final SimplificationMode mode;

  Simplifier(SimplificationMode mode) {
    this.mode = Objects.requireNonNull(mode, "Simplification mode cannot be null");
  }

  SimplificationMode mode() {
    return mode;
  }

  Expr simplify(Expr expr) {
    if (expr instanceof Binary binary) {
      return switch (binary.kind()) {
        case ADD -> simplifyAdd(binary);
        case SUB -> simplifySub(binary);
        case MUL -> simplifyMul(binary);
        case DIV -> simplifyDiv(binary);
      };
    }
    if (expr instanceof Power power) {
      return simplifyPower(power);
    }
    return expr;
  }

  private Expr simplifyAdd(Binary node) {
    final Expr a = node.left();
    final Expr b = node.right();
    if (isZero(b)) {
      return rewrite("A+0", node, a);
    }
    if (isZero(a)) {
      return rewrite("0+A", node, b);
    }
    if (a.equals(b)) {
      return rewrite("A+A", node, new Binary(BinaryKind.MUL, new Constant(2), a));
    }
    if (a instanceof Binary scaled && isScaled(scaled) && scaled.right().equals(b)) {
      return rewrite("cA+A", node, new Binary(BinaryKind.MUL, increment(scaled.left()), b));
    }
    if (b instanceof Binary scaled && isScaled(scaled) && scaled.right().equals(a)) {
      return rewrite("A+cA", node, new Binary(BinaryKind.MUL, increment(scaled.left()), a));
    }
    return node;
  }

  private Expr simplifySub(Binary node) {
    final Expr a = node.left();
    final Expr b = node.right();
    if (isZero(b)) {
      return rewrite("A-0", node, a);
    }
    if (a.equals(b)) {
      return rewrite("A-A", node, Constant.ZERO);
    }
    return node;
  }

  private Expr simplifyMul(Binary node) {
    final Expr a = node.left();
    final Expr b = node.right();
    if (isZero(b)) {
      return rewrite("A*0", node, Constant.ZERO);
    }
    if (isZero(a)) {
      return rewrite("0*A", node, Constant.ZERO);
    }
    if (isOne(a)) {
      return rewrite("1*A", node, b);
    }
    if (isOne(b)) {
      return rewrite("A*1", node, a);
    }
    if (mode == SimplificationMode.BASIC) {
      return node;
    }
    if (a instanceof Power left && b instanceof Power right && left.base().equals(right.base())) {
      return rewrite("b^m*b^n", node,
          simplifyPower(new Power(left.base(), exponentSum(left.exponent(), right.exponent()))));
    }
    if (a instanceof Power left && left.base().equals(b)) {
      return rewrite("b^m*b", node, simplifyPower(new Power(b, exponentSum(left.exponent(), Constant.ONE))));
    }
    if (b instanceof Power right && right.base().equals(a)) {
      return rewrite("b*b^m", node, simplifyPower(new Power(a, exponentSum(right.exponent(), Constant.ONE))));
    }
    if (a.equals(b)) {
      return rewrite("A*A", node, new Power(a, new Constant(2)));
    }
    return node;
  }

  private Expr simplifyDiv(Binary node) {
    final Expr a = node.left();
    final Expr b = node.right();
    if (a.equals(b)) {
      return rewrite("A/A", node, Constant.ONE);
    }
    if (isOne(b)) {
      return rewrite("A/1", node, a);
    }
    if (isZero(a)) {
      return rewrite("0/A", node, Constant.ZERO);
    }
    if (mode == SimplificationMode.BASIC) {
      return node;
    }
    if (a instanceof Power left && b instanceof Power right && left.base().equals(right.base())) {
      return rewrite("b^m/b^n", node,
          simplifyPower(new Power(left.base(), exponentDifference(left.exponent(), right.exponent()))));
    }
    if (a instanceof Power left && left.base().equals(b)) {
      return rewrite("b^m/b", node,
          simplifyPower(new Power(b, exponentDifference(left.exponent(), Constant.ONE))));
    }
    return node;
  }

  private Expr simplifyPower(Power node) {
    if (isOne(node.exponent())) {
      return rewrite("b^1", node, node.base());
    }
    if (isZero(node.exponent())) {
      return rewrite("b^0", node, Constant.ONE);
    }
    return node;
  }

  private Expr exponentSum(Expr m, Expr n) {
    if (m instanceof Constant left && n instanceof Constant right) {
      return new Constant(left.value() + right.value());
    }
    return simplify(new Binary(BinaryKind.ADD, m, n));
  }

  private Expr exponentDifference(Expr m, Expr n) {
    if (m instanceof Constant left && n instanceof Constant right) {
      return new Constant(left.value() - right.value());
    }
    return simplify(new Binary(BinaryKind.SUB, m, n));
  }

  /// `c*A` with a constant coefficient on the left
  private static boolean isScaled(Binary binary) {
    return binary.kind() == BinaryKind.MUL && binary.left() instanceof Constant;
  }

  private static Constant increment(Expr coefficient) {
    return new Constant(((Constant) coefficient).value() + 1);
  }

  private static boolean isZero(Expr expr) {
    return expr instanceof Constant c && c.is(0);
  }

  private static boolean isOne(Expr expr) {
    return expr instanceof Constant c && c.is(1);
  }

  private static Expr rewrite(String rule, Expr before, Expr after) {
    LOGGER.finer(() -> "simplify - rule " + rule + ": " + before.render() + " -> " + after.render());
    return after;
  }
}
