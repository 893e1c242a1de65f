package exm.wdlparse.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.wdlparse.WdlFixtures;
import exm.wdlparse.ast.LiteralKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.Diagnostic;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.frontend.tree.CallStatement;
import exm.wdlparse.frontend.tree.CallStatement.TargetKind;
import exm.wdlparse.frontend.tree.CommandTemplate;
import exm.wdlparse.frontend.tree.ConditionalBlock;
import exm.wdlparse.frontend.tree.Declaration;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.frontend.tree.Expression;
import exm.wdlparse.frontend.tree.Expression.ExprKind;
import exm.wdlparse.frontend.tree.ImportRef;
import exm.wdlparse.frontend.tree.ScatterBlock;
import exm.wdlparse.frontend.tree.Struct;
import exm.wdlparse.frontend.tree.Task;
import exm.wdlparse.frontend.tree.Workflow;
import exm.wdlparse.frontend.tree.WorkflowElement;
import exm.wdlparse.frontend.tree.WorkflowElement.ElementKind;
import exm.wdlparse.parser.WdlParser;

public class TreeWalkerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TreeWalkerTest.wdlparse.log", true);
  }

  private Diagnostics diags;

  private Document walk(String src) {
    diags = new Diagnostics(Settings.defaults());
    SyntaxNode root = WdlParser.parse(src, diags);
    return TreeWalker.walk(root, diags);
  }

  private static List<String> names(List<Declaration> decls) {
    List<String> result = new ArrayList<String>();
    for (Declaration d: decls) {
      result.add(d.getName());
    }
    return result;
  }

  @Test
  public void testPipelineDocument() {
    Document doc = walk(WdlFixtures.load(WdlFixtures.PIPELINE));
    assertEquals("1.0", doc.getVersion());
    assertEquals(0, doc.getImports().size());
    assertEquals(1, doc.getStructs().size());
    assertEquals(2, doc.getTasks().size());
    assertEquals(1, doc.getWorkflows().size());

    Struct sample = doc.getStruct("Sample");
    assertEquals(Arrays.asList("name", "reads"), names(sample.getFields()));
    assertEquals("File", sample.getField("reads").getType().getText());
    assertNull(sample.getField("missing"));
  }

  @Test
  public void testTaskModel() {
    Document doc = walk(WdlFixtures.load(WdlFixtures.PIPELINE));
    Task align = doc.getTask("align");
    assertEquals(Arrays.asList("reads", "threads", "tag"),
                 names(align.getInputs()));

    Declaration threads = align.getInputs().get(1);
    assertTrue(threads.hasExpression());
    assertEquals(ExprKind.LITERAL, threads.getExpression().getKind());
    assertEquals(LiteralKind.INT, threads.getExpression().getLiteralKind());
    assertEquals("4", threads.getExpression().getLiteralValue());

    Declaration tag = align.getInputs().get(2);
    assertTrue(tag.isOptional());
    assertFalse(tag.hasExpression());

    CommandTemplate cmd = align.getCommand();
    assertEquals(CommandTemplate.Style.HEREDOC, cmd.getStyle());
    assertEquals(2, cmd.getPlaceholders().size());
    assertTrue(cmd.render().contains("bwa mem -t ~{threads} ~{reads}"));

    assertTrue(align.getPrivateDeclarations().isEmpty());
    assertEquals(Arrays.asList("bam"), names(align.getOutputs()));
    Expression bam = align.getOutputs().get(0).getExpression();
    assertEquals(LiteralKind.STRING, bam.getLiteralKind());
    assertEquals("out.sam", bam.getLiteralValue());

    assertEquals(Arrays.asList("docker", "memory", "cpu"),
                 new ArrayList<String>(align.getRuntime().keySet()));
    assertEquals(ExprKind.IDENTIFIER, align.getRuntime().get("cpu").getKind());
    assertEquals("\"lab\"", align.getMeta().get("author").getText());
    assertEquals("2", align.getMeta().get("version").getText());
  }

  @Test
  public void testTaskPrivateDeclarations() {
    Document doc = walk("version 1.0\n" +
        "task t {\n" +
        "  input {\n    Int n\n  }\n" +
        "  Int doubled = n * 2\n" +
        "  String label = \"run\"\n" +
        "  command <<< echo ~{label} ~{doubled} >>>\n" +
        "}\n");
    assertEquals(0, diags.size());
    Task t = doc.getTask("t");
    assertEquals(Arrays.asList("n"), names(t.getInputs()));
    assertEquals(Arrays.asList("doubled", "label"),
                 names(t.getPrivateDeclarations()));
    assertEquals(ExprKind.BINARY_OP,
        t.getPrivateDeclarations().get(0).getExpression().getKind());
  }

  @Test
  public void testBraceCommandOptions() {
    Document doc = walk(WdlFixtures.load(WdlFixtures.PIPELINE));
    CommandTemplate cmd = doc.getTask("merge").getCommand();
    assertEquals(CommandTemplate.Style.BRACE, cmd.getStyle());
    assertTrue(cmd.render(), cmd.render().contains("~{sep=\" \" bams}"));
    // Option value and the expression itself
    assertEquals(2, cmd.getPlaceholders().size());
  }

  @Test
  public void testWorkflowModel() {
    Document doc = walk(WdlFixtures.load(WdlFixtures.PIPELINE));
    Workflow wf = doc.getWorkflow("pipeline");
    assertEquals(Arrays.asList("samples", "do_merge"), names(wf.getInputs()));
    assertEquals("Array[Sample]", wf.getInputs().get(0).getType().getText());
    assertEquals(2, wf.getBody().size());

    WorkflowElement first = wf.getBody().get(0);
    assertEquals(ElementKind.SCATTER, first.getKind());
    ScatterBlock scatter = first.getScatter();
    assertEquals("scatter_1", scatter.getId());
    assertEquals("s", scatter.getVariable());
    assertEquals("samples", scatter.getCollection().getText());
    assertEquals(1, scatter.getBody().size());

    WorkflowElement second = wf.getBody().get(1);
    assertEquals(ElementKind.CONDITIONAL, second.getKind());
    ConditionalBlock cond = second.getConditional();
    assertEquals("conditional_1", cond.getId());
    assertEquals("do_merge", cond.getCondition().getText());

    assertEquals(4, wf.getAllElements().size());
    assertEquals(2, wf.getAllCalls().size());
    assertEquals(1, wf.countElements(ElementKind.SCATTER));
    assertEquals(1, wf.countElements(ElementKind.CONDITIONAL));
    assertEquals(0, wf.countElements(ElementKind.DECLARATION));

    CallStatement align = wf.getCall("align");
    assertEquals(TargetKind.TASK, align.getTargetKind());
    assertNull(align.getExplicitAlias());
    Expression reads = align.getInputs().get("reads");
    assertEquals(ExprKind.MEMBER_ACCESS, reads.getKind());
    assertEquals("s", reads.getBase().getName());
    assertEquals("reads", reads.getField());

    assertEquals("merge.merged",
                 wf.getOutputs().get(0).getExpression().getText());
    assertEquals("\"Align and merge\"",
                 wf.getMeta().get("description").getText());
  }

  @Test
  public void testCallTargets() {
    Document doc = walk("version 1.0\n" +
        "import \"lib.wdl\" as lib\n" +
        "task t {\n  command {}\n}\n" +
        "workflow inner {\n}\n" +
        "workflow w {\n" +
        "  call t as t2 { input: x = 1, y }\n" +
        "  call inner\n" +
        "  call lib.tool\n" +
        "  call nowhere\n" +
        "}\n");
    Workflow wf = doc.getWorkflow("w");
    List<CallStatement> calls = wf.getAllCalls();
    assertEquals(4, calls.size());

    CallStatement t2 = calls.get(0);
    assertEquals("t", t2.getTarget());
    assertEquals("t2", t2.getAlias());
    assertEquals(TargetKind.TASK, t2.getTargetKind());
    assertFalse(t2.isQualified());
    assertEquals(Arrays.asList("x", "y"),
                 new ArrayList<String>(t2.getInputs().keySet()));
    assertEquals("Shorthand input binds the same name", "y",
                 t2.getInputs().get("y").getName());

    assertEquals(TargetKind.WORKFLOW, calls.get(1).getTargetKind());

    CallStatement qualified = calls.get(2);
    assertEquals(TargetKind.IMPORTED, qualified.getTargetKind());
    assertTrue(qualified.isQualified());
    assertEquals("lib", qualified.getQualifier());
    assertEquals("tool", qualified.getAlias());

    assertEquals(TargetKind.UNRESOLVED, calls.get(3).getTargetKind());
  }

  @Test
  public void testRepeatedCallInput() {
    Document doc = walk("version 1.0\n" +
        "task t {\n  input { Int x }\n  command {}\n}\n" +
        "workflow w {\n" +
        "  call t { input: x = 1, x = 2 }\n" +
        "}\n");
    assertEquals(1, diags.size());
    Diagnostic d = diags.list().get(0);
    assertEquals(DiagnosticCode.DUPLICATE_DECLARATION, d.getCode());
    assertTrue(d.isError());
    assertEquals(7, d.getSpan().startLine);
    assertEquals(26, d.getSpan().startColumn);

    CallStatement call = doc.getWorkflow("w").getAllCalls().get(0);
    assertEquals(1, call.getInputs().size());
    assertEquals("First binding is kept", "1",
                 call.getInputs().get("x").getLiteralValue());
  }

  @Test
  public void testImportModel() {
    Document doc = walk("version 1.0\n" +
        "import \"https://example.org/tools/lib.wdl\"\n" +
        "import \"other.wdl\" as o alias Sample as OtherSample\n");
    assertEquals(2, doc.getImports().size());
    ImportRef implicit = doc.getImports().get(0);
    assertNull(implicit.getAlias());
    assertEquals("Namespace derived from the file name", "lib",
                 implicit.getNamespace());
    ImportRef aliased = doc.getImports().get(1);
    assertEquals("o", aliased.getNamespace());
    assertEquals("OtherSample", aliased.getStructAliases().get("Sample"));
  }

  @Test
  public void testBlockCounters() {
    Document doc = walk("version 1.0\n" +
        "workflow w {\n" +
        "  scatter (i in [1, 2]) {\n" +
        "    scatter (j in [3]) {\n" +
        "      Int k = i + j\n" +
        "    }\n" +
        "  }\n" +
        "  if (true) {\n" +
        "    if (false) {}\n" +
        "  }\n" +
        "}\n");
    Workflow wf = doc.getWorkflow("w");
    ScatterBlock outer = wf.getBody().get(0).getScatter();
    ScatterBlock inner = outer.getBody().get(0).getScatter();
    assertEquals("scatter_1", outer.getId());
    assertEquals("scatter_2", inner.getId());
    assertEquals(ElementKind.DECLARATION, inner.getBody().get(0).getKind());

    ConditionalBlock c1 = wf.getBody().get(1).getConditional();
    assertEquals("Conditionals are numbered separately from scatters",
                 "conditional_1", c1.getId());
    assertEquals("conditional_2", c1.getBody().get(0).getConditional().getId());
  }

  @Test
  public void testIncompleteSource() {
    Document doc = walk(WdlFixtures.load(WdlFixtures.BROKEN));
    assertTrue(diags.hasErrors());
    assertNotNull("Model is built despite errors", doc.getWorkflow("flow"));
    assertEquals(2, doc.getTasks().size());
    assertEquals(2, doc.getWorkflow("flow").getAllCalls().size());
  }

  @Test
  public void testEmptyDocument() {
    Document doc = walk("");
    assertNull(doc.getVersion());
    assertTrue(doc.getTasks().isEmpty());
    assertTrue(doc.getWorkflows().isEmpty());
  }
}
