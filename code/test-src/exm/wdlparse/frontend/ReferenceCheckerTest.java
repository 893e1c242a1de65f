package exm.wdlparse.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.wdlparse.WdlFixtures;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.Diagnostic;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.parser.WdlParser;

public class ReferenceCheckerTest {

  private static final String V = "version 1.0\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ReferenceCheckerTest.wdlparse.log", true);
  }

  private Diagnostics diags;

  private void check(String src) {
    diags = new Diagnostics(Settings.defaults());
    SyntaxNode root = WdlParser.parse(src, diags);
    Document doc = TreeWalker.walk(root, diags);
    ReferenceChecker.check(doc, diags);
  }

  private List<Diagnostic> withCode(DiagnosticCode code) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: diags.list()) {
      if (d.getCode() == code) {
        result.add(d);
      }
    }
    return result;
  }

  @Test
  public void testWellFormed() {
    check(WdlFixtures.load(WdlFixtures.PIPELINE));
    assertEquals("Diagnostics: " + diags.list(), 0, diags.size());
  }

  @Test
  public void testDuplicateDefinition() {
    check(V + "struct Foo {\n  Int a\n}\n" +
              "task Foo {\n  command {}\n}\n" +
              "workflow Foo {\n}\n");
    List<Diagnostic> found = withCode(DiagnosticCode.DUPLICATE_DEFINITION);
    assertEquals(2, found.size());
    assertEquals("Later definition is reported", 5,
                 found.get(0).getSpan().startLine);
    assertTrue(found.get(0).getMessage(),
               found.get(0).getMessage().contains("line 2"));
    assertEquals(8, found.get(1).getSpan().startLine);
    assertTrue(found.get(0).isError());
  }

  @Test
  public void testDuplicateDeclaration() {
    check(V + "task t {\n" +
              "  input {\n    Int x\n  }\n" +
              "  String x = \"again\"\n" +
              "  command {}\n" +
              "}\n");
    List<Diagnostic> found = withCode(DiagnosticCode.DUPLICATE_DECLARATION);
    assertEquals("Diagnostics: " + diags.list(), 1, found.size());
    assertEquals(6, found.get(0).getSpan().startLine);
  }

  @Test
  public void testDeclarationsOfDifferentTasksDoNotClash() {
    check(V + "task a {\n  input { Int x }\n  command {}\n}\n" +
              "task b {\n  input { Int x }\n  command {}\n}\n");
    assertEquals("Diagnostics: " + diags.list(), 0, diags.size());
  }

  @Test
  public void testDuplicateCallAlias() {
    check(V + "task t {\n  command {}\n}\n" +
              "workflow w {\n" +
              "  call t\n" +
              "  if (true) {\n" +
              "    call t\n" +
              "  }\n" +
              "  call t as t2\n" +
              "}\n");
    List<Diagnostic> found = withCode(DiagnosticCode.DUPLICATE_CALL_ALIAS);
    assertEquals("Aliases are unique across nested blocks", 1, found.size());
    assertEquals(8, found.get(0).getSpan().startLine);
  }

  @Test
  public void testCallAliasSeparateFromDeclaration() {
    check(V + "task t {\n  command {}\n}\n" +
              "workflow w {\n" +
              "  Int t = 1\n" +
              "  call t\n" +
              "}\n");
    assertEquals(0, withCode(DiagnosticCode.DUPLICATE_CALL_ALIAS).size());
    assertEquals(0, withCode(DiagnosticCode.DUPLICATE_DECLARATION).size());
  }

  @Test
  public void testUnresolvedReference() {
    check(V + "task t {\n" +
              "  input { Int a }\n" +
              "  command <<<\n    echo ~{a} ~{b}\n  >>>\n" +
              "  output {\n    String out = \"~{a}-~{c}\"\n  }\n" +
              "}\n");
    List<Diagnostic> found = withCode(DiagnosticCode.UNRESOLVED_REFERENCE);
    assertEquals("Diagnostics: " + diags.list(), 2, found.size());
    assertEquals("Unresolved reference to c", found.get(0).getMessage());
    assertEquals(8, found.get(0).getSpan().startLine);
    assertEquals("Unresolved reference to b", found.get(1).getMessage());
    assertEquals(5, found.get(1).getSpan().startLine);
  }

  @Test
  public void testTaskNameIsNotAValue() {
    check(V + "task t {\n  command {}\n}\n" +
              "workflow w {\n  Int x = t\n}\n");
    assertEquals(1, withCode(DiagnosticCode.UNRESOLVED_REFERENCE).size());
  }

  @Test
  public void testUnresolvedCallTarget() {
    String src = V + "workflow w {\n  call missing_task\n}\n";
    check(src);
    List<Diagnostic> found = withCode(DiagnosticCode.UNRESOLVED_CALL_TARGET);
    assertEquals(1, found.size());
    int start = src.indexOf("missing_task");
    assertEquals(start, found.get(0).getSpan().start);
    assertEquals(start + "missing_task".length(), found.get(0).getSpan().end);
  }

  @Test
  public void testQualifiedCallTargetIsNotChecked() {
    check(V + "import \"lib.wdl\" as lib\n" +
              "workflow w {\n  call lib.tool\n}\n");
    assertEquals("Diagnostics: " + diags.list(), 0, diags.size());
  }

  @Test
  public void testUnknownType() {
    check(V + "struct S {\n  Int a\n}\n" +
              "workflow w {\n" +
              "  input {\n" +
              "    missing_type variable_name\n" +
              "    S ok\n" +
              "    Array[Nope] xs\n" +
              "  }\n" +
              "}\n");
    List<Diagnostic> found = withCode(DiagnosticCode.UNKNOWN_TYPE);
    assertEquals("Diagnostics: " + diags.list(), 2, found.size());
    assertEquals("Unknown type missing_type", found.get(0).getMessage());
    assertEquals("Unknown type Nope", found.get(1).getMessage());
  }

  @Test
  public void testImportedStructAlias() {
    check(V + "import \"lib.wdl\" alias Sample as LibSample\n" +
              "workflow w {\n  input {\n    LibSample s\n  }\n}\n");
    assertEquals(0, withCode(DiagnosticCode.UNKNOWN_TYPE).size());
  }

  @Test
  public void testScatterVariableScope() {
    check(V + "task t {\n  input { Int n }\n  command {}\n}\n" +
              "workflow w {\n" +
              "  scatter (i in [1, 2, 3]) {\n" +
              "    call t { input: n = i }\n" +
              "  }\n" +
              "  Int after = i\n" +
              "  output {\n    Array[Int] ns = [t.n]\n  }\n" +
              "}\n");
    List<Diagnostic> found = withCode(DiagnosticCode.UNRESOLVED_REFERENCE);
    assertEquals("Diagnostics: " + diags.list(), 1, found.size());
    assertEquals("Scatter variable is not visible outside the block",
                 10, found.get(0).getSpan().startLine);
  }

  @Test
  public void testCallOutputsVisibleBeforeCall() {
    check(V + "task t {\n  command {}\n  output { Int n = 1 }\n}\n" +
              "workflow w {\n" +
              "  Int early = t.n\n" +
              "  call t\n" +
              "}\n");
    assertEquals(0, withCode(DiagnosticCode.UNRESOLVED_REFERENCE).size());
  }
}
