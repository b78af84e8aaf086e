// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

/// Failures raised by [Expr#compute(java.util.Map)]. Construction, differentiation and rendering never raise these;
/// they only surface when a tree is evaluated against concrete bindings.
public abstract sealed class EvaluationException extends RuntimeException permits
    EvaluationException.UndefinedVariable, EvaluationException.DivisionByZero,
    EvaluationException.NegativeRadicand, EvaluationException.LogarithmDomain {

  EvaluationException(String message) {
    super(message);
  }

  public static final class UndefinedVariable extends EvaluationException {
    private final String name;

    public UndefinedVariable(String name) {
      super("Variable " + name + " is not defined");
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  public static final class DivisionByZero extends EvaluationException {
    public DivisionByZero(String divisor) {
      super("Division by zero: divisor " + divisor + " evaluated to 0");
    }
  }

  public static final class NegativeRadicand extends EvaluationException {
    private final double radicand;

    public NegativeRadicand(double radicand) {
      super("Square root of negative value " + radicand);
      this.radicand = radicand;
    }

    public double radicand() {
      return radicand;
    }
  }

  public static final class LogarithmDomain extends EvaluationException {
    private final double argument;

    public LogarithmDomain(double argument) {
      super("Logarithm of non-positive value " + argument);
      this.argument = argument;
    }

    public double argument() {
      return argument;
    }
  }
}
