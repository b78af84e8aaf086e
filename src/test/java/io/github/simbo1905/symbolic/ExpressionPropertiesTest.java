package io.github.simbo1905.symbolic;

import io.github.simbo1905.symbolic.EvaluationException.*;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Map;
import java.util.stream.Stream;

import static io.github.simbo1905.symbolic.Expr.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/// End to end behaviour of the public API through the standard algebra
class ExpressionPropertiesTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static Stream<Expr> anyExpressions() {
    final var x = variable("x");
    final var y = variable("y");
    return Stream.of(
        constant(3),
        x,
        negate(y),
        add(x, y),
        mul(sin(x), add(y, 2)),
        div(sqrt(x), cot(y)),
        pow(add(x, 1), y),
        derivative(mul(x, y), "x")
    );
  }

  @ParameterizedTest
  @MethodSource("anyExpressions")
  void subtractingAnExpressionFromItselfGivesZero(Expr a) {
    final Expr difference = sub(a, a);
    assertEquals("0", difference.render());
    assertTrue(difference.isConstant());
    assertEquals(0, difference.polynomialDegree());
  }

  @Test
  void multiplicativeIdentity() {
    assertEquals("x", mul(variable("x"), constant(1)).render());
    assertEquals("x", mul(constant(1), variable("x")).render());
  }

  @Test
  void additiveIdentity() {
    assertEquals("x", add(variable("x"), constant(0)).render());
    assertEquals("x", add(constant(0), variable("x")).render());
  }

  @Test
  void multiplicationByZero() {
    assertEquals("0", mul(variable("x"), constant(0)).render());
    assertEquals("0", mul(constant(0), variable("x")).render());
  }

  @Test
  void selfQuotient() {
    assertEquals("1", div(variable("x"), variable("x")).render());
  }

  @Test
  void polynomialInTwoVariables() {
    final var x = variable("x");
    final var y = variable("y");
    final Expr e = div(mul(sub(x, constant(4)), add(mul(constant(3), x), mul(y, y))), constant(5));
    assertFalse(e.isConstant());
    assertTrue(e.isPolynomial());
    assertEquals(3, e.polynomialDegree());
    assertEquals(-4.2, e.compute(Map.of("x", 1.0, "y", 2.0)));
    assertThat(e.freeVariables()).containsExactly("x", "y");
  }

  @Test
  void constantExpressionWithRoot() {
    final Expr e2 = mul(
        sub(constant(5), mul(constant(3), constant(3))),
        sqrt(add(constant(16), mul(constant(3), constant(3)))));
    assertTrue(e2.isConstant());
    assertTrue(e2.isPolynomial());
    assertEquals(0, e2.polynomialDegree());
    assertEquals(-20.0, e2.compute(Map.of("x", 1.0, "y", 2.0)));
    assertEquals(-20.0, e2.compute(Map.of()));
  }

  @Test
  void derivativeOfIndependentFunctionIsZero() {
    final Expr derivative = cos(variable("y")).differentiate("x");
    assertEquals(constant(0), derivative);
    assertEquals(0.0, derivative.compute(Map.of("x", 3.0, "y", 2.0)));
  }

  @Test
  void divisionByZeroFails() {
    assertThrows(DivisionByZero.class, () -> div(variable("x"), constant(0)).compute(Map.of("x", 5.0)));
  }

  @Test
  void negativeRadicandFails() {
    assertThrows(NegativeRadicand.class, () -> sqrt(variable("x")).compute(Map.of("x", -1.0)));
  }

  @Test
  void rendersTheTwoVariablePolynomialWithFullParentheses() {
    final Algebra algebra = Algebra.of(SimplificationMode.BASIC);
    final var x = variable("x");
    final var y = variable("y");
    final Expr e = algebra.div(algebra.mul(algebra.sub(x, 4), algebra.add(algebra.mul(3, x), algebra.mul(y, y))), 5);
    assertEquals("((x - 4) * ((3 * x) + (y * y))) / 5", e.render());
  }
}
