package io.github.simbo1905.symbolic;

import io.github.simbo1905.symbolic.Expr.*;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/// Peephole rules applied by the combinators
class SimplifierTest {

  static final Variable X = Expr.variable("x");
  static final Variable Y = Expr.variable("y");

  final Algebra basic = Algebra.of(SimplificationMode.BASIC);
  final Algebra extended = Algebra.of(SimplificationMode.EXTENDED);

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Nested
  @DisplayName("Addition")
  class Addition {

    @Test
    void zeroOnEitherSide() {
      assertEquals(X, basic.add(X, 0));
      assertEquals(X, basic.add(0, X));
    }

    @Test
    void equalTermsDouble() {
      assertEquals(new Binary(BinaryKind.MUL, Expr.constant(2), X), basic.add(X, X));
      final Expr term = basic.sin(basic.add(X, Y));
      assertEquals(new Binary(BinaryKind.MUL, Expr.constant(2), term), basic.add(term, basic.sin(basic.add(X, Y))));
    }

    @Test
    void scaledTermAbsorbsItsTwin() {
      assertEquals(new Binary(BinaryKind.MUL, Expr.constant(4), X), basic.add(basic.mul(3, X), X));
      assertEquals(new Binary(BinaryKind.MUL, Expr.constant(4), X), basic.add(X, basic.mul(3, X)));
    }

    @Test
    void cancellingCoefficientIsNotRewrittenAgain() {
      final Expr sum = basic.add(basic.mul(-1, X), X);
      assertEquals(new Binary(BinaryKind.MUL, Constant.ZERO, X), sum);
      assertEquals("0 * x", sum.render());
    }

    @Test
    void doubledConstantStaysAProductInExtendedMode() {
      final Expr sum = extended.add(Expr.constant(2), Expr.constant(2));
      assertEquals(new Binary(BinaryKind.MUL, Expr.constant(2), Expr.constant(2)), sum);
      assertEquals("2 * 2", sum.render());
      assertEquals("2 * 1", extended.add(1, Constant.ONE).render());
    }

    @Test
    void unrelatedTermsAreKept() {
      assertEquals(new Binary(BinaryKind.ADD, X, Y), basic.add(X, Y));
      assertEquals(new Binary(BinaryKind.ADD, basic.mul(3, X), Y), basic.add(basic.mul(3, X), Y));
    }
  }

  @Nested
  @DisplayName("Subtraction")
  class Subtraction {

    @Test
    void zeroOnTheRight() {
      assertEquals(X, basic.sub(X, 0));
    }

    @Test
    void zeroOnTheLeftIsKept() {
      assertEquals(new Binary(BinaryKind.SUB, Constant.ZERO, X), basic.sub(0, X));
    }

    @Test
    void equalCompositeOperandsCancel() {
      final Expr a = basic.div(basic.cos(X), basic.add(Y, 2));
      final Expr b = basic.div(basic.cos(X), basic.add(Y, 2));
      assertEquals(Constant.ZERO, basic.sub(a, b));
    }
  }

  @Nested
  @DisplayName("Multiplication")
  class Multiplication {

    @Test
    void zeroAndOneIdentities() {
      assertEquals(Constant.ZERO, basic.mul(X, 0));
      assertEquals(Constant.ZERO, basic.mul(0, X));
      assertEquals(X, basic.mul(1, X));
      assertEquals(X, basic.mul(X, 1));
    }

    @Test
    void squaringOnlyInExtendedMode() {
      assertEquals(new Binary(BinaryKind.MUL, X, X), basic.mul(X, X));
      assertEquals(new Power(X, Expr.constant(2)), extended.mul(X, X));
    }

    @Test
    void exponentsOfEqualBasesAdd() {
      assertEquals(new Power(X, Expr.constant(5)), extended.mul(extended.pow(X, 2), extended.pow(X, 3)));
      assertEquals(new Power(X, Expr.constant(3)), extended.mul(extended.pow(X, 2), X));
      assertEquals(new Power(X, Expr.constant(3)), extended.mul(X, extended.pow(X, 2)));
    }

    @Test
    void equalPowersMergeBeforeSquaring() {
      assertEquals(new Power(X, Expr.constant(4)), extended.mul(extended.pow(X, 2), extended.pow(X, 2)));
      assertEquals("x^4", extended.mul(extended.pow(X, 2), extended.pow(X, 2)).render());
    }

    @Test
    void symbolicExponentsAreSummedAsNodes() {
      final Expr merged = extended.mul(extended.pow(X, Y), extended.pow(X, 2));
      assertEquals(new Power(X, new Binary(BinaryKind.ADD, Y, Expr.constant(2))), merged);
    }

    @Test
    void oppositeExponentsCollapseToOne() {
      assertEquals(Constant.ONE, extended.mul(extended.pow(X, 2), extended.pow(X, -2)));
    }

    @Test
    void differentBasesAreKept() {
      assertEquals(new Binary(BinaryKind.MUL, new Power(X, Expr.constant(2)), new Power(Y, Expr.constant(2))),
          extended.mul(extended.pow(X, 2), extended.pow(Y, 2)));
    }
  }

  @Nested
  @DisplayName("Division")
  class Division {

    @Test
    void identities() {
      assertEquals(Constant.ONE, basic.div(X, X));
      assertEquals(X, basic.div(X, 1));
      assertEquals(Constant.ZERO, basic.div(0, X));
    }

    @Test
    void selfQuotientWinsOverZeroNumerator() {
      assertEquals(Constant.ONE, basic.div(Constant.ZERO, Constant.ZERO));
    }

    @Test
    void exponentsOfEqualBasesSubtractOnlyInExtendedMode() {
      assertEquals(new Power(X, Expr.constant(3)), extended.div(extended.pow(X, 5), extended.pow(X, 2)));
      assertEquals(X, extended.div(extended.pow(X, 2), X));
      assertEquals(new Binary(BinaryKind.DIV, new Power(X, Expr.constant(2)), X),
          basic.div(basic.pow(X, 2), X));
    }
  }

  @Nested
  @DisplayName("Powers")
  class Powers {

    @Test
    void unitAndZeroExponents() {
      assertEquals(X, basic.pow(X, 1));
      assertEquals(Constant.ONE, basic.pow(X, 0));
      assertEquals(new Power(X, Expr.constant(3)), basic.pow(X, 3));
    }
  }

  @Test
  void rewriteLooksOnlyAtTheTopNode() {
    final Expr inner = new Binary(BinaryKind.ADD, X, Constant.ZERO);
    final Expr outer = new Binary(BinaryKind.MUL, inner, Expr.constant(3));
    assertSame(outer, basic.simplifier().simplify(outer));
  }

  @Test
  void unaryNodesAreReturnedUnchanged() {
    final Expr node = new Unary(UnaryKind.MINUS, new Unary(UnaryKind.MINUS, X));
    assertSame(node, extended.simplifier().simplify(node));
    assertEquals(node, extended.negate(extended.negate(X)));
  }

  @Test
  void functionsAreNotRewritten() {
    assertEquals(new Function(FunctionKind.SQRT, Constant.ZERO), extended.sqrt(Constant.ZERO));
  }

  @Test
  void algebraReportsItsMode() {
    assertEquals(SimplificationMode.BASIC, basic.mode());
    assertEquals(SimplificationMode.EXTENDED, extended.mode());
    assertEquals("Algebra[BASIC]", basic.toString());
  }
}
