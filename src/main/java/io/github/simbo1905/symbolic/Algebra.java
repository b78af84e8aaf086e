// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import io.github.simbo1905.symbolic.Expr.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.util.Objects;

import static io.github.simbo1905.symbolic.Expr.LOGGER;

/// Combinators bound to one [Simplifier]. Every composite node built here is passed through the simplifier before it
/// is returned, and differentiation builds its result with the same combinators so derivatives are simplified too.
/// Instances are immutable and may be shared between threads.
public final class Algebra {

  private static final Algebra STANDARD = new Algebra(new Simplifier(SimplificationMode.configured()));

  private final Simplifier simplifier;

  private Algebra(Simplifier simplifier) {
    this.simplifier = simplifier;
  }

  /// The algebra used by the static methods on [Expr], configured from the system property
  /// [SimplificationMode#PROPERTY] when this class is first loaded
  public static Algebra standard() {
    return STANDARD;
  }

  public static Algebra of(SimplificationMode mode) {
    Objects.requireNonNull(mode, "Simplification mode cannot be null");
    return new Algebra(new Simplifier(mode));
  }

  public SimplificationMode mode() {
    return simplifier.mode();
  }

  @TestOnly
  Simplifier simplifier() {
    return simplifier;
  }

  public @NotNull Expr add(@NotNull Expr left, @NotNull Expr right) {
    return simplifier.simplify(new Binary(BinaryKind.ADD, left, right));
  }

  public @NotNull Expr add(@NotNull Expr left, double right) {
    return add(left, new Constant(right));
  }

  public @NotNull Expr add(double left, @NotNull Expr right) {
    return add(new Constant(left), right);
  }

  public @NotNull Expr sub(@NotNull Expr left, @NotNull Expr right) {
    return simplifier.simplify(new Binary(BinaryKind.SUB, left, right));
  }

  public @NotNull Expr sub(@NotNull Expr left, double right) {
    return sub(left, new Constant(right));
  }

  public @NotNull Expr sub(double left, @NotNull Expr right) {
    return sub(new Constant(left), right);
  }

  public @NotNull Expr mul(@NotNull Expr left, @NotNull Expr right) {
    return simplifier.simplify(new Binary(BinaryKind.MUL, left, right));
  }

  public @NotNull Expr mul(@NotNull Expr left, double right) {
    return mul(left, new Constant(right));
  }

  public @NotNull Expr mul(double left, @NotNull Expr right) {
    return mul(new Constant(left), right);
  }

  public @NotNull Expr div(@NotNull Expr left, @NotNull Expr right) {
    return simplifier.simplify(new Binary(BinaryKind.DIV, left, right));
  }

  public @NotNull Expr div(@NotNull Expr left, double right) {
    return div(left, new Constant(right));
  }

  public @NotNull Expr div(double left, @NotNull Expr right) {
    return div(new Constant(left), right);
  }

  public @NotNull Expr pow(@NotNull Expr base, @NotNull Expr exponent) {
    return simplifier.simplify(new Power(base, exponent));
  }

  public @NotNull Expr pow(@NotNull Expr base, double exponent) {
    return pow(base, new Constant(exponent));
  }

  public @NotNull Expr negate(@NotNull Expr operand) {
    return simplifier.simplify(new Unary(UnaryKind.MINUS, operand));
  }

  /// Unary plus
  public @NotNull Expr identity(@NotNull Expr operand) {
    return simplifier.simplify(new Unary(UnaryKind.PLUS, operand));
  }

  public @NotNull Expr sqrt(@NotNull Expr operand) {
    return new Function(FunctionKind.SQRT, operand);
  }

  public @NotNull Expr sin(@NotNull Expr operand) {
    return new Function(FunctionKind.SIN, operand);
  }

  public @NotNull Expr cos(@NotNull Expr operand) {
    return new Function(FunctionKind.COS, operand);
  }

  public @NotNull Expr tan(@NotNull Expr operand) {
    return new Function(FunctionKind.TAN, operand);
  }

  public @NotNull Expr cot(@NotNull Expr operand) {
    return new Function(FunctionKind.COT, operand);
  }

  public @NotNull Expr ln(@NotNull Expr operand) {
    return new Function(FunctionKind.LN, operand);
  }

  /// Differentiate with the combinators of this algebra. Subtrees that do not mention the variable are replaced by
  /// zero without being traversed, so this never fails.
  /// @param expression the expression to differentiate
  /// @param withRespectTo the variable
  /// @return the derivative tree
  public @NotNull Expr differentiate(@NotNull Expr expression, @NotNull Variable withRespectTo) {
    Objects.requireNonNull(expression, "Expression cannot be null");
    Objects.requireNonNull(withRespectTo, "Variable cannot be null");
    if (!expression.freeVariables().contains(withRespectTo.name())) {
      return Constant.ZERO;
    }
    final Expr result = expression.differentiate(withRespectTo, this);
    LOGGER.finer(() -> "differentiate - d/d" + withRespectTo.name() + "(" + expression.render() + ") = "
        + result.render());
    return result;
  }

  public @NotNull Expr differentiate(@NotNull Expr expression, @NotNull String withRespectTo) {
    return differentiate(expression, new Variable(withRespectTo));
  }

  @Override
  public String toString() {
    return "Algebra[" + mode() + "]";
  }
}
