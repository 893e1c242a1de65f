package exm.wdlparse.diagram;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.wdlparse.WdlFixtures;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.deps.DependencyAnalyzer;
import exm.wdlparse.frontend.TreeWalker;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.parser.WdlParser;

public class DiagramBuilderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/DiagramBuilderTest.wdlparse.log", true);
  }

  private static DiagramGraph build(String src) {
    Settings settings = Settings.defaults();
    Diagnostics diags = new Diagnostics(settings);
    Document doc = TreeWalker.walk(WdlParser.parse(src, diags), diags);
    return new DiagramBuilder().build(doc,
                      new DependencyAnalyzer(settings).analyze(doc));
  }

  private static int countFrom(List<DiagramEdge> edges, String source,
                               EdgeKind kind) {
    int count = 0;
    for (DiagramEdge e: edges) {
      if (e.getSource().equals(source) && e.getKind() == kind) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testScatterWithDependentCalls() {
    DiagramGraph g = build("version 1.0\n" +
        "task first_task {\n  command {}\n  output { Int out = 1 }\n}\n" +
        "task second_task {\n  input { Int x }\n  command {}\n}\n" +
        "workflow w {\n" +
        "  scatter (i in [1, 2]) {\n" +
        "    call first_task\n" +
        "    call second_task { input: x = first_task.out }\n" +
        "  }\n" +
        "}\n");
    assertEquals(1, g.getNodes(NodeKind.SCATTER).size());
    assertEquals(2, g.getNodes(NodeKind.CALL).size());

    String scatter = "workflow_w_scatter_1";
    String first = "workflow_w_call_first_task";
    String second = "workflow_w_call_second_task";
    assertEquals("scatter i", g.getNode(scatter).getLabel());
    for (String call: new String[] {first, second}) {
      List<DiagramEdge> in = g.getEdgesTo(call);
      boolean fromScatter = false;
      for (DiagramEdge e: in) {
        if (e.getSource().equals(scatter) &&
            e.getKind() == EdgeKind.STRUCTURAL_FLOW) {
          fromScatter = true;
        }
      }
      assertEquals("Scatter contains " + call, true, fromScatter);
    }

    List<DiagramEdge> deps = g.getEdges(EdgeKind.DEPENDENCY);
    assertEquals(1, deps.size());
    assertEquals(first, deps.get(0).getSource());
    assertEquals(second, deps.get(0).getTarget());
    assertEquals("out", deps.get(0).getLabel());
  }

  @Test
  public void testDeclarationsOnly() {
    DiagramGraph g = build("version 1.0\n" +
        "workflow decls {\n" +
        "  Int a = 1\n" +
        "  String b = \"x\"\n" +
        "}\n");
    assertEquals(1, g.getNodes(NodeKind.WORKFLOW).size());
    assertEquals(0, g.getNodes(NodeKind.CALL).size());
    assertEquals("Body declarations are not drawn", 1, g.getNodes().size());
    assertEquals(0, g.getEdges().size());
  }

  @Test
  public void testPipeline() {
    DiagramGraph g = build(WdlFixtures.load(WdlFixtures.PIPELINE));
    assertEquals(16, g.getNodes().size());
    assertEquals(2, g.getNodes(NodeKind.TASK).size());
    assertEquals(1, g.getNodes(NodeKind.WORKFLOW).size());
    assertEquals(2, g.getNodes(NodeKind.CALL).size());
    assertEquals(1, g.getNodes(NodeKind.SCATTER).size());
    assertEquals(1, g.getNodes(NodeKind.CONDITIONAL).size());
    assertEquals(6, g.getNodes(NodeKind.INPUT).size());
    assertEquals(3, g.getNodes(NodeKind.OUTPUT).size());

    assertEquals("Tasks come first", NodeKind.TASK,
                 g.getNodes().get(0).getKind());
    assertEquals("task_align", g.getNodes().get(0).getId());

    assertEquals("Input: reads",
                 g.getNode("task_align_input_reads").getLabel());
    assertEquals("Output: result",
                 g.getNode("workflow_pipeline_output_result").getLabel());
    assertEquals("if (do_merge)",
                 g.getNode("workflow_pipeline_conditional_1").getLabel());
    assertEquals("call align",
                 g.getNode("workflow_pipeline_call_align").getLabel());

    List<DiagramEdge> edges = g.getEdges();
    assertEquals(15, g.getEdges(EdgeKind.STRUCTURAL_FLOW).size());
    assertEquals(3, countFrom(edges, "workflow_pipeline",
                              EdgeKind.STRUCTURAL_FLOW));
    assertEquals(1, countFrom(edges, "workflow_pipeline_call_align",
                              EdgeKind.STRUCTURAL_FLOW));
    assertEquals("workflow_pipeline_call_align",
                 g.getEdgesTo("task_align").get(3).getSource());

    List<DiagramEdge> deps = g.getEdges(EdgeKind.DEPENDENCY);
    assertEquals(1, deps.size());
    assertEquals("workflow_pipeline_call_align", deps.get(0).getSource());
    assertEquals("workflow_pipeline_call_merge", deps.get(0).getTarget());
    assertEquals("bam", deps.get(0).getLabel());
  }

  @Test
  public void testAliasesAndUnresolvedTargets() {
    DiagramGraph g = build("version 1.0\n" +
        "task t {\n  command {}\n}\n" +
        "workflow w {\n" +
        "  call t as renamed\n" +
        "  call elsewhere\n" +
        "}\n");
    DiagramNode renamed = g.getNode("workflow_w_call_renamed");
    assertNotNull(renamed);
    assertEquals("call t as renamed", renamed.getLabel());
    assertEquals(1, countFrom(g.getEdges(), "workflow_w_call_renamed",
                              EdgeKind.STRUCTURAL_FLOW));
    assertEquals("Unresolved call has no edge to a task", 0,
        countFrom(g.getEdges(), "workflow_w_call_elsewhere",
                  EdgeKind.STRUCTURAL_FLOW));
    assertNull(g.getNode("task_elsewhere"));
  }

  @Test
  public void testConditionalAsConsumer() {
    DiagramGraph g = build("version 1.0\n" +
        "task t {\n  command {}\n  output { Boolean ok = true }\n}\n" +
        "workflow w {\n" +
        "  call t\n" +
        "  if (t.ok) {\n  }\n" +
        "}\n");
    List<DiagramEdge> deps = g.getEdges(EdgeKind.DEPENDENCY);
    assertEquals(1, deps.size());
    assertEquals("workflow_w_call_t", deps.get(0).getSource());
    assertEquals("workflow_w_conditional_1", deps.get(0).getTarget());
  }

  @Test
  public void testDuplicateDefinitionsKeepFirst() {
    DiagramGraph g = build("version 1.0\n" +
        "task t {\n  input { Int a }\n  command {}\n}\n" +
        "task t {\n  input { Int b }\n  command {}\n" +
        "  output { Int c = 1 }\n}\n" +
        "workflow w {\n  call t\n}\n" +
        "workflow w {\n  input { Int x }\n  call t as other\n}\n");
    assertNotNull(g.getNode("task_t_input_a"));
    assertNull(g.getNode("task_t_input_b"));
    assertNull(g.getNode("task_t_output_c"));
    assertEquals("Input a and call t", 2, g.getEdgesTo("task_t").size());

    assertNotNull(g.getNode("workflow_w_call_t"));
    assertNull(g.getNode("workflow_w_call_other"));
    assertNull(g.getNode("workflow_w_input_x"));
    assertEquals(1, g.getNodes(NodeKind.TASK).size());
    assertEquals(1, g.getNodes(NodeKind.WORKFLOW).size());
    assertEquals(1, g.getNodes(NodeKind.CALL).size());
  }

  @Test
  public void testDuplicateIdsKeepFirst() {
    DiagramGraph g = new DiagramGraph();
    assertEquals(true, g.addNode("a", "first", NodeKind.TASK));
    assertFalse(g.addNode("a", "second", NodeKind.CALL));
    assertEquals(1, g.getNodes().size());
    assertEquals("first", g.getNode("a").getLabel());
  }
}
