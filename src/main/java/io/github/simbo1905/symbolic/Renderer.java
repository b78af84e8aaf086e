// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import io.github.simbo1905.symbolic.Expr.*;

import java.util.Optional;

/// Infix rendering. A node renders without outer parentheses; an operand that is itself a binary operation or a
/// negation is wrapped in parentheses. Signs are normalised at render time only: `A + (-B)` renders `A - B`,
/// `A - (-B)` renders `A + B` and `-(-B)` renders `B`.
final class Renderer {

  private Renderer() {
  }

  static String number(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  static String unary(Unary node) {
    return switch (node.kind()) {
      case PLUS -> node.operand().render();
      case MINUS -> negated(node.operand())
          .map(Expr::render)
          .orElseGet(() -> "-" + operand(node.operand()));
    };
  }

  static String binary(Binary node) {
    final String left = operand(node.left());
    final Optional<Expr> negatedRight = negated(node.right());
    return switch (node.kind()) {
      case ADD -> negatedRight
          .map(b -> left + " - " + operand(b))
          .orElseGet(() -> left + " + " + operand(node.right()));
      case SUB -> negatedRight
          .map(b -> left + " + " + operand(b))
          .orElseGet(() -> left + " - " + operand(node.right()));
      case MUL -> left + " * " + operand(node.right());
      case DIV -> left + " / " + operand(node.right());
    };
  }

  static String power(Power node) {
    return powerOperand(node.base()) + "^" + powerOperand(node.exponent());
  }

  /// The positive counterpart of a node that renders with a leading minus sign
  static Optional<Expr> negated(Expr expr) {
    if (expr instanceof Unary unary) {
      return switch (unary.kind()) {
        case MINUS -> Optional.of(unary.operand());
        case PLUS -> negated(unary.operand());
      };
    }
    if (expr instanceof Constant constant && constant.value() < 0) {
      return Optional.of(new Constant(-constant.value()));
    }
    return Optional.empty();
  }

  private static String operand(Expr expr) {
    final String text = expr.render();
    return needsParentheses(expr) ? "(" + text + ")" : text;
  }

  private static String powerOperand(Expr expr) {
    return expr instanceof Power ? "(" + expr.render() + ")" : operand(expr);
  }

  private static boolean needsParentheses(Expr expr) {
    if (expr instanceof Binary) {
      return true;
    }
    if (expr instanceof Unary unary) {
      return switch (unary.kind()) {
        case PLUS -> needsParentheses(unary.operand());
        // a double negation renders as its inner operand
        case MINUS -> negated(unary.operand()).map(Renderer::needsParentheses).orElse(true);
      };
    }
    return expr instanceof Constant constant && constant.value() < 0;
  }
}
