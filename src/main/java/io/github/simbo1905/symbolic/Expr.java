// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.symbolic;

import java.util.*;
import java.util.logging.Logger;

import static io.github.simbo1905.symbolic.EvaluationException.*;

/// Public sealed interface for symbolic expression trees.
/// All expression nodes are records nested within this interface so the set of variants is closed. Every capability
/// is an abstract method, which means the compiler rejects a new variant that forgets one of them.
///
/// Trees are immutable and have no identity beyond structural equality, so subtrees may be shared freely. The static
/// methods are the public entry points: leaves via [#constant(double)] and [#variable(String)], composites via the
/// combinators which run each new node through the [Simplifier] of the [Algebra#standard()] instance.
public sealed interface Expr permits
    Expr.Constant, Expr.Variable, Expr.Unary, Expr.Binary, Expr.Power, Expr.Function, Expr.Derivative {

  Logger LOGGER = Logger.getLogger(Expr.class.getName());

  /// The names of the variables this expression depends on, sorted and unmodifiable
  Set<String> freeVariables();

  boolean isConstant();

  boolean isPolynomial();

  /// The total degree, or 0 by convention when the expression is not a polynomial. Degrees too large for an `int`
  /// saturate at [Integer#MAX_VALUE].
  int polynomialDegree();

  /// Evaluate the tree against the supplied bindings.
  /// @param bindings variable name to value
  /// @return the numeric value
  /// @throws EvaluationException when a variable is unbound, a divisor is zero or a function argument is out of domain
  double compute(Map<String, Double> bindings);

  /// Apply the calculus rule of this node kind. Children are differentiated through
  /// [Algebra#differentiate(Expr, Variable)] which substitutes zero for subtrees that do not mention the variable.
  Expr differentiate(Variable withRespectTo, Algebra algebra);

  /// Infix text of this node without outer parentheses
  String render();

  default Evaluation tryCompute(Map<String, Double> bindings) {
    return Evaluation.of(this, bindings);
  }

  default Expr differentiate(Variable withRespectTo) {
    return Algebra.standard().differentiate(this, withRespectTo);
  }

  default Expr differentiate(String withRespectTo) {
    return differentiate(new Variable(withRespectTo));
  }

  static Constant constant(double value) {
    return new Constant(value);
  }

  static Variable variable(String name) {
    return new Variable(name);
  }

  static Expr add(Expr left, Expr right) {
    return Algebra.standard().add(left, right);
  }

  static Expr add(Expr left, double right) {
    return Algebra.standard().add(left, right);
  }

  static Expr add(double left, Expr right) {
    return Algebra.standard().add(left, right);
  }

  static Expr sub(Expr left, Expr right) {
    return Algebra.standard().sub(left, right);
  }

  static Expr sub(Expr left, double right) {
    return Algebra.standard().sub(left, right);
  }

  static Expr sub(double left, Expr right) {
    return Algebra.standard().sub(left, right);
  }

  static Expr mul(Expr left, Expr right) {
    return Algebra.standard().mul(left, right);
  }

  static Expr mul(Expr left, double right) {
    return Algebra.standard().mul(left, right);
  }

  static Expr mul(double left, Expr right) {
    return Algebra.standard().mul(left, right);
  }

  static Expr div(Expr left, Expr right) {
    return Algebra.standard().div(left, right);
  }

  static Expr div(Expr left, double right) {
    return Algebra.standard().div(left, right);
  }

  static Expr div(double left, Expr right) {
    return Algebra.standard().div(left, right);
  }

  static Expr pow(Expr base, Expr exponent) {
    return Algebra.standard().pow(base, exponent);
  }

  static Expr pow(Expr base, double exponent) {
    return Algebra.standard().pow(base, exponent);
  }

  static Expr negate(Expr operand) {
    return Algebra.standard().negate(operand);
  }

  static Expr identity(Expr operand) {
    return Algebra.standard().identity(operand);
  }

  static Expr sqrt(Expr operand) {
    return Algebra.standard().sqrt(operand);
  }

  static Expr sin(Expr operand) {
    return Algebra.standard().sin(operand);
  }

  static Expr cos(Expr operand) {
    return Algebra.standard().cos(operand);
  }

  static Expr tan(Expr operand) {
    return Algebra.standard().tan(operand);
  }

  static Expr cot(Expr operand) {
    return Algebra.standard().cot(operand);
  }

  static Expr ln(Expr operand) {
    return Algebra.standard().ln(operand);
  }

  /// Lazy derivative node that differentiates only when queried or computed
  static Derivative derivative(Expr expression, String withRespectTo) {
    return new Derivative(expression, new Variable(withRespectTo));
  }

  private static Set<String> union(Expr first, Expr second) {
    final var names = new TreeSet<>(first.freeVariables());
    names.addAll(second.freeVariables());
    return Collections.unmodifiableSortedSet(names);
  }

  private static int saturatedDegree(long degree) {
    if (degree > Integer.MAX_VALUE) {
      LOGGER.fine(() -> "polynomialDegree - degree " + degree + " saturated at " + Integer.MAX_VALUE);
      return Integer.MAX_VALUE;
    }
    return (int) degree;
  }

  private static double lookup(Map<String, Double> bindings, String name) {
    final Double value = bindings.get(name);
    if (value == null) {
      LOGGER.fine(() -> "compute - no binding for variable " + name + " in " + bindings.keySet());
      throw new UndefinedVariable(name);
    }
    return value;
  }

  enum UnaryKind {
    PLUS, MINUS
  }

  enum BinaryKind {
    ADD, SUB, MUL, DIV
  }

  /// Named functions with the label used when rendering
  enum FunctionKind {
    SQRT("sqrt"), SIN("sin"), COS("cos"), TAN("tan"), COT("cot"), LN("ln");

    final String label;

    FunctionKind(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  /// Numeric leaf. Equality is by numeric value so that `0.0` and `-0.0` are the same constant.
  record Constant(double value) implements Expr {
    public static final Constant ZERO = new Constant(0);
    public static final Constant ONE = new Constant(1);

    @Override
    public Set<String> freeVariables() {
      return Collections.emptySortedSet();
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public boolean isPolynomial() {
      return true;
    }

    @Override
    public int polynomialDegree() {
      return 0;
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      return value;
    }

    @Override
    public Expr differentiate(Variable withRespectTo, Algebra algebra) {
      return ZERO;
    }

    @Override
    public String render() {
      return Renderer.number(value);
    }

    boolean is(double other) {
      return value == other;
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (!(other instanceof Constant that)) {
        return false;
      }
      return value == that.value || (Double.isNaN(value) && Double.isNaN(that.value));
    }

    @Override
    public int hashCode() {
      // -0.0 must hash like 0.0
      return Double.hashCode(value == 0.0 ? 0.0 : value);
    }

    @Override
    public String toString() {
      return render();
    }
  }

  record Variable(String name) implements Expr {
    public Variable {
      Objects.requireNonNull(name, "Variable name cannot be null");
      if (name.isBlank()) {
        throw new IllegalArgumentException("Variable name cannot be blank");
      }
    }

    @Override
    public Set<String> freeVariables() {
      return Collections.unmodifiableSortedSet(new TreeSet<>(Set.of(name)));
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public boolean isPolynomial() {
      return true;
    }

    @Override
    public int polynomialDegree() {
      return 1;
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      return lookup(bindings, name);
    }

    @Override
    public Expr differentiate(Variable withRespectTo, Algebra algebra) {
      return name.equals(withRespectTo.name()) ? Constant.ONE : Constant.ZERO;
    }

    @Override
    public String render() {
      return name;
    }

    @Override
    public String toString() {
      return render();
    }
  }

  record Unary(UnaryKind kind, Expr operand) implements Expr {
    public Unary {
      Objects.requireNonNull(kind, "Unary kind cannot be null");
      Objects.requireNonNull(operand, "Unary operand cannot be null");
    }

    @Override
    public Set<String> freeVariables() {
      return operand.freeVariables();
    }

    @Override
    public boolean isConstant() {
      return operand.isConstant();
    }

    @Override
    public boolean isPolynomial() {
      return operand.isPolynomial();
    }

    @Override
    public int polynomialDegree() {
      return operand.polynomialDegree();
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      final double value = operand.compute(bindings);
      return switch (kind) {
        case PLUS -> value;
        case MINUS -> -value;
      };
    }

    @Override
    public Expr differentiate(Variable withRespectTo, Algebra algebra) {
      final Expr inner = algebra.differentiate(operand, withRespectTo);
      return switch (kind) {
        case PLUS -> inner;
        case MINUS -> algebra.negate(inner);
      };
    }

    @Override
    public String render() {
      return Renderer.unary(this);
    }

    @Override
    public String toString() {
      return render();
    }
  }

  record Binary(BinaryKind kind, Expr left, Expr right) implements Expr {
    public Binary {
      Objects.requireNonNull(kind, "Binary kind cannot be null");
      Objects.requireNonNull(left, "Binary left operand cannot be null");
      Objects.requireNonNull(right, "Binary right operand cannot be null");
    }

    @Override
    public Set<String> freeVariables() {
      return union(left, right);
    }

    @Override
    public boolean isConstant() {
      return left.isConstant() && right.isConstant();
    }

    @Override
    public boolean isPolynomial() {
      return switch (kind) {
        case ADD, SUB -> left.isPolynomial() && right.isPolynomial();
        // a product is reported polynomial when either factor is
        case MUL -> left.isPolynomial() || right.isPolynomial();
        case DIV -> Divisibility.divides(left, right);
      };
    }

    @Override
    public int polynomialDegree() {
      return switch (kind) {
        case ADD, SUB -> left.isPolynomial() && right.isPolynomial()
            ? Math.max(left.polynomialDegree(), right.polynomialDegree())
            : 0;
        case MUL -> saturatedDegree((long) left.polynomialDegree() + right.polynomialDegree());
        case DIV -> Divisibility.quotientDegree(left, right);
      };
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      final double l = left.compute(bindings);
      final double r = right.compute(bindings);
      return switch (kind) {
        case ADD -> l + r;
        case SUB -> l - r;
        case MUL -> l * r;
        case DIV -> {
          if (r == 0) {
            LOGGER.fine(() -> "compute - divisor " + right.render() + " evaluated to zero");
            throw new DivisionByZero(right.render());
          }
          yield l / r;
        }
      };
    }

    @Override
    public Expr differentiate(Variable withRespectTo, Algebra algebra) {
      final Expr dl = algebra.differentiate(left, withRespectTo);
      final Expr dr = algebra.differentiate(right, withRespectTo);
      return switch (kind) {
        case ADD -> algebra.add(dl, dr);
        case SUB -> algebra.sub(dl, dr);
        case MUL -> algebra.add(algebra.mul(dl, right), algebra.mul(dr, left));
        case DIV -> algebra.div(
            algebra.sub(algebra.mul(dl, right), algebra.mul(dr, left)),
            algebra.mul(right, right));
      };
    }

    @Override
    public String render() {
      return Renderer.binary(this);
    }

    @Override
    public String toString() {
      return render();
    }
  }

  record Power(Expr base, Expr exponent) implements Expr {
    public Power {
      Objects.requireNonNull(base, "Power base cannot be null");
      Objects.requireNonNull(exponent, "Power exponent cannot be null");
    }

    /// The exponent as a non-negative integer when it is a constant with such a value
    OptionalInt naturalExponent() {
      if (!exponent.isConstant()) {
        return OptionalInt.empty();
      }
      final double value;
      try {
        value = exponent.compute(Map.of());
      } catch (EvaluationException e) {
        LOGGER.fine(() -> "naturalExponent - constant exponent " + exponent.render() + " has no value: "
            + e.getMessage());
        return OptionalInt.empty();
      }
      if (value < 0 || value != Math.rint(value) || value > Integer.MAX_VALUE) {
        return OptionalInt.empty();
      }
      return OptionalInt.of((int) value);
    }

    @Override
    public Set<String> freeVariables() {
      return union(base, exponent);
    }

    @Override
    public boolean isConstant() {
      return base.isConstant() && exponent.isConstant();
    }

    @Override
    public boolean isPolynomial() {
      return naturalExponent().isPresent();
    }

    @Override
    public int polynomialDegree() {
      final OptionalInt n = naturalExponent();
      return n.isPresent() ? saturatedDegree((long) base.polynomialDegree() * n.getAsInt()) : 0;
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      return Math.pow(base.compute(bindings), exponent.compute(bindings));
    }

    @Override
    public Expr differentiate(Variable withRespectTo, Algebra algebra) {
      if (!exponent.freeVariables().contains(withRespectTo.name())) {
        final Expr reduced = exponent instanceof Constant c
            ? new Constant(c.value() - 1)
            : algebra.sub(exponent, Constant.ONE);
        return algebra.mul(
            algebra.mul(exponent, algebra.pow(base, reduced)),
            algebra.differentiate(base, withRespectTo));
      }
      // d(b^e) = b^e * (e' * ln(b) + e * b' / b)
      final Expr logarithmic = algebra.mul(algebra.differentiate(exponent, withRespectTo), algebra.ln(base));
      final Expr algebraic = algebra.div(
          algebra.mul(exponent, algebra.differentiate(base, withRespectTo)), base);
      return algebra.mul(algebra.pow(base, exponent), algebra.add(logarithmic, algebraic));
    }

    @Override
    public String render() {
      return Renderer.power(this);
    }

    @Override
    public String toString() {
      return render();
    }
  }

  /// Named function application such as `sin(x)`
  record Function(FunctionKind kind, Expr operand) implements Expr {
    public Function {
      Objects.requireNonNull(kind, "Function kind cannot be null");
      Objects.requireNonNull(operand, "Function operand cannot be null");
    }

    private boolean isEvenDegreePolynomialRoot() {
      return kind == FunctionKind.SQRT && operand.isPolynomial() && operand.polynomialDegree() % 2 == 0;
    }

    @Override
    public Set<String> freeVariables() {
      return operand.freeVariables();
    }

    @Override
    public boolean isConstant() {
      return operand.isConstant();
    }

    @Override
    public boolean isPolynomial() {
      if (kind == FunctionKind.SQRT) {
        return isEvenDegreePolynomialRoot();
      }
      // transcendental unless applied to a constant
      return operand.isConstant();
    }

    @Override
    public int polynomialDegree() {
      return isEvenDegreePolynomialRoot() ? operand.polynomialDegree() / 2 : 0;
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      final double value = operand.compute(bindings);
      return switch (kind) {
        case SQRT -> {
          if (value < 0) {
            LOGGER.fine(() -> "compute - radicand " + operand.render() + " evaluated to " + value);
            throw new NegativeRadicand(value);
          }
          yield Math.sqrt(value);
        }
        case SIN -> Math.sin(value);
        case COS -> Math.cos(value);
        case TAN -> Math.tan(value);
        case COT -> 1 / Math.tan(value);
        case LN -> {
          if (value <= 0) {
            LOGGER.fine(() -> "compute - logarithm argument " + operand.render() + " evaluated to " + value);
            throw new LogarithmDomain(value);
          }
          yield Math.log(value);
        }
      };
    }

    @Override
    public Expr differentiate(Variable withRespectTo, Algebra algebra) {
      final Expr inner = algebra.differentiate(operand, withRespectTo);
      return switch (kind) {
        case SQRT -> algebra.div(inner, algebra.mul(2, algebra.sqrt(operand)));
        case SIN -> algebra.mul(algebra.cos(operand), inner);
        case COS -> algebra.mul(algebra.negate(algebra.sin(operand)), inner);
        case TAN -> algebra.div(inner, algebra.mul(algebra.cos(operand), algebra.cos(operand)));
        case COT -> algebra.div(algebra.negate(inner), algebra.mul(algebra.sin(operand), algebra.sin(operand)));
        case LN -> algebra.div(inner, operand);
      };
    }

    @Override
    public String render() {
      return kind.label() + "(" + operand.render() + ")";
    }

    @Override
    public String toString() {
      return render();
    }
  }

  /// Lazy derivative. Every query differentiates the wrapped expression afresh with the standard algebra.
  record Derivative(Expr expression, Variable withRespectTo) implements Expr {
    public Derivative {
      Objects.requireNonNull(expression, "Derivative expression cannot be null");
      Objects.requireNonNull(withRespectTo, "Derivative variable cannot be null");
    }

    public Expr materialize() {
      return Algebra.standard().differentiate(expression, withRespectTo);
    }

    @Override
    public Set<String> freeVariables() {
      return expression.freeVariables();
    }

    @Override
    public boolean isConstant() {
      return materialize().isConstant();
    }

    @Override
    public boolean isPolynomial() {
      return materialize().isPolynomial();
    }

    @Override
    public int polynomialDegree() {
      return materialize().polynomialDegree();
    }

    @Override
    public double compute(Map<String, Double> bindings) {
      lookup(bindings, withRespectTo.name());
      return materialize().compute(bindings);
    }

    @Override
    public Expr differentiate(Variable variable, Algebra algebra) {
      return new Derivative(algebra.differentiate(expression, withRespectTo), variable);
    }

    @Override
    public String render() {
      return "d/d" + withRespectTo.name() + "(" + expression.render() + ")";
    }

    @Override
    public String toString() {
      return render();
    }
  }
}
