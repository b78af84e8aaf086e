// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import java.util.Map;
import java.util.Objects;

/// Typed outcome of evaluating an expression: either a value or the failure that aborted the evaluation
public sealed interface Evaluation permits Evaluation.Value, Evaluation.Failure {

  static Evaluation of(Expr expr, Map<String, Double> bindings) {
    Objects.requireNonNull(expr, "Expression cannot be null");
    Objects.requireNonNull(bindings, "Bindings cannot be null");
    try {
      return new Value(expr.compute(bindings));
    } catch (EvaluationException e) {
      return new Failure(e);
    }
  }

  boolean isSuccess();

  double orElse(double fallback);

  /// @return the value
  /// @throws EvaluationException the failure that was captured
  double valueOrThrow();

  record Value(double value) implements Evaluation {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public double orElse(double fallback) {
      return value;
    }

    @Override
    public double valueOrThrow() {
      return value;
    }
  }

  record Failure(EvaluationException error) implements Evaluation {
    public Failure {
      Objects.requireNonNull(error, "Failure error cannot be null");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public double orElse(double fallback) {
      return fallback;
    }

    @Override
    public double valueOrThrow() {
      throw error;
    }
  }
}
