package exm.wdlparse.frontend.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.wdlparse.ast.LiteralKind;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.common.exceptions.WdlRuntimeError;
import exm.wdlparse.frontend.TreeWalker;
import exm.wdlparse.frontend.tree.Expression.ExprKind;
import exm.wdlparse.parser.WdlParser;

public class ExpressionTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ExpressionTest.wdlparse.log", true);
  }

  @Rule
  public ExpectedException exception = ExpectedException.none();

  /**
   * Parse one workflow-level declaration and return its value
   */
  private static Expression expr(String decl) {
    return declaration(decl).getExpression();
  }

  private static Declaration declaration(String decl) {
    String src = "version 1.0\nworkflow w {\n  " + decl + "\n}\n";
    Diagnostics diags = new Diagnostics(Settings.defaults());
    Document doc = TreeWalker.walk(WdlParser.parse(src, diags), diags);
    assertEquals("Diagnostics: " + diags.list(), 0, diags.size());
    WorkflowElement elem = doc.getWorkflow("w").getBody().get(0);
    return elem.getDeclaration();
  }

  @Test
  public void testArithmetic() {
    Expression e = expr("Int a = -1 + 2 * 3");
    assertEquals(ExprKind.BINARY_OP, e.getKind());
    assertEquals("+", e.getOperator());
    assertEquals("-1 + 2 * 3", e.getText());

    Expression neg = e.getLeft();
    assertEquals(ExprKind.UNARY_OP, neg.getKind());
    assertEquals("-", neg.getOperator());
    assertEquals("1", neg.getOperand().getLiteralValue());
    assertTrue(neg.isConstant());

    Expression product = e.getRight();
    assertEquals("*", product.getOperator());
    assertEquals("2 * 3", product.getText());
    assertFalse(e.isConstant());
  }

  @Test
  public void testParenthesesUnwrapped() {
    Expression e = expr("Int a = (1 + 2) * 3");
    assertEquals(ExprKind.BINARY_OP, e.getLeft().getKind());
    assertEquals("1 + 2", e.getLeft().getText());
  }

  @Test
  public void testAccessAndCalls() {
    Expression index = expr("Int b = xs[0]");
    assertEquals(ExprKind.INDEX, index.getKind());
    assertEquals("xs", index.getBase().getName());
    assertEquals(LiteralKind.INT, index.getIndex().getLiteralKind());

    Expression call = expr("Int c = length(select_first([xs, ys]))");
    assertEquals(ExprKind.FUNCTION_CALL, call.getKind());
    assertEquals("length", call.getFunctionName());
    assertEquals(1, call.getArgs().size());
    Expression inner = call.getArgs().get(0);
    assertEquals("select_first", inner.getFunctionName());
    assertEquals(2, inner.getArgs().get(0).getElements().size());

    Expression noArgs = expr("String d = stdout()");
    assertEquals(0, noArgs.getArgs().size());
  }

  @Test
  public void testTernary() {
    Expression e = expr("Int d = if a > 1 then a else 0");
    assertEquals(ExprKind.TERNARY_IF, e.getKind());
    assertEquals(">", e.getCondition().getOperator());
    assertEquals("a", e.getThen().getName());
    assertEquals("0", e.getElse().getLiteralValue());
  }

  @Test
  public void testCompoundLiterals() {
    Expression map = expr("Map[String, Int] m = {\"k\": 1, \"j\": 2}");
    List<Map.Entry<Expression, Expression>> entries = map.getMapEntries();
    assertEquals(2, entries.size());
    assertEquals("k", entries.get(0).getKey().getLiteralValue());
    assertEquals("2", entries.get(1).getValue().getLiteralValue());
    assertTrue(map.isConstant());

    Expression pair = expr("Pair[Int, String] p = (1, \"x\")");
    assertEquals(ExprKind.PAIR_LITERAL, pair.getKind());
    assertEquals("1", pair.getLeft().getLiteralValue());
    assertEquals(LiteralKind.STRING, pair.getRight().getLiteralKind());

    Expression obj = expr("Object o = object {f: 1, g: [1, 2]}");
    assertEquals(ExprKind.OBJECT_LITERAL, obj.getKind());
    assertEquals(2, obj.getFields().size());
    assertEquals(ExprKind.ARRAY_LITERAL, obj.getFields().get("g").getKind());
    assertTrue(obj.isConstant());
  }

  @Test
  public void testInterpolation() {
    Expression s = expr("String s = \"n=~{a + 1} done\"");
    assertEquals(ExprKind.STRING_INTERPOLATION, s.getKind());
    assertEquals(3, s.getParts().size());
    assertEquals("n=", s.getParts().get(0).getText());
    assertTrue(s.getParts().get(1).isPlaceholder());
    assertEquals(1, s.getOperands().size());
    assertEquals("+", s.getOperands().get(0).getOperator());
    assertFalse(s.isLiteral());

    Expression plain = expr("String t = \"plain text\"");
    assertTrue(plain.isLiteral());
    assertEquals("plain text", plain.getLiteralValue());
  }

  @Test
  public void testTypes() {
    TypeDescriptor t = declaration("Array[Int]+ ne = [1]").getType();
    assertEquals("Array", t.getBaseName());
    assertTrue(t.isNonEmpty());
    assertFalse(t.isOptional());
    assertFalse(t.isPrimitive());
    assertTrue(t.isBuiltin());
    assertEquals(1, t.getParameters().size());
    assertTrue(t.getParameters().get(0).isPrimitive());

    TypeDescriptor m = declaration("Map[String, Int]? om = None").getType();
    assertTrue(m.isOptional());
    assertEquals("Map[String, Int]?", m.getText());
    assertEquals(2, m.getParameters().size());
  }

  @Test
  public void testWrongKindAccessor() {
    Expression lit = expr("Int a = 1");
    exception.expect(WdlRuntimeError.class);
    lit.getName();
  }
}
