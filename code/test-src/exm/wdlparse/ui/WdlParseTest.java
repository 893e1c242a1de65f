package exm.wdlparse.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.wdlparse.WdlFixtures;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.diagnostics.Diagnostic;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Severity;
import exm.wdlparse.deps.DependencyGraph;
import exm.wdlparse.diagram.DiagramGraph;
import exm.wdlparse.diagram.EdgeKind;
import exm.wdlparse.diagram.NodeKind;
import exm.wdlparse.info.DocumentInfo;

public class WdlParseTest {

  private static final String SIMPLE = "version 1.0\n" +
      "task hello {\n" +
      "  input {\n    String name\n  }\n" +
      "  command <<<\n    echo \"Hello ~{name}\"\n  >>>\n" +
      "  output {\n    String greeting = read_string(stdout())\n  }\n" +
      "}\n" +
      "workflow greet {\n" +
      "  input {\n    String who = \"world\"\n  }\n" +
      "  call hello { input: name = who }\n" +
      "  output {\n    String out = hello.greeting\n  }\n" +
      "}\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/WdlParseTest.wdlparse.log", true);
  }

  private final WdlParse wdl = new WdlParse();

  @Test
  public void testWellFormed() {
    ParseResult r = wdl.parse(SIMPLE);
    assertEquals("Diagnostics: " + r.getDiagnostics(), 0, r.countErrors());
    assertFalse(r.hasErrors());
    assertEquals(0, r.countWarnings());
    assertEquals(1, r.getDocument().getTasks().size());
    assertEquals(1, r.getDocument().getWorkflow("greet").getAllCalls().size());
  }

  @Test
  public void testLossless() {
    String[] inputs = {
      SIMPLE,
      WdlFixtures.load(WdlFixtures.PIPELINE),
      WdlFixtures.load(WdlFixtures.BROKEN),
      "",
      "version 1.0\n\ttask { ] ) \"unterminated\n  <<< ~{ é中\n",
      "workflow w { scatter ( { if } call . } } }",
    };
    for (String src: inputs) {
      ParseResult r = wdl.parse(src);
      assertEquals(src, r.getTree().getText());
      assertEquals(src.length(), r.getTree().getSpan().end);
    }
  }

  @Test
  public void testReparseIdempotent() {
    String src = WdlFixtures.load(WdlFixtures.BROKEN);
    ParseResult first = wdl.parse(src);
    ParseResult second = wdl.parse(first.getTree().getText());
    assertEquals(first.getTree().printTree(), second.getTree().printTree());
    assertTrue(second.getDiagnostics().size() <=
               first.getDiagnostics().size());
  }

  @Test
  public void testIntFromString() {
    String src = "version 1.0\nworkflow w {\n  Int count = \"three\"\n}\n";
    ParseResult r = wdl.parse(src);
    assertTrue(r.hasErrors());
    int start = src.indexOf("\"three\"");
    boolean covered = false;
    for (Diagnostic d: r.getDiagnostics()) {
      if (d.isError() && d.getSpan().start <= start &&
          d.getSpan().end >= start + "\"three\"".length()) {
        covered = true;
      }
    }
    assertTrue("Error covers the initializer: " + r.getDiagnostics(),
               covered);
  }

  @Test
  public void testUnresolvedIdentifier() {
    ParseResult r = wdl.parse("version 1.0\n" +
        "workflow w {\n  Int x = nonexistent_variable + 1\n}\n");
    boolean named = false;
    for (Diagnostic d: r.getDiagnostics()) {
      if (d.getMessage().contains("nonexistent_variable")) {
        named = true;
        assertEquals(Severity.WARNING, d.getSeverity());
        assertEquals(DiagnosticCode.UNRESOLVED_REFERENCE, d.getCode());
      }
    }
    assertTrue(named);
  }

  @Test
  public void testBrokenDocument() {
    ParseResult r = wdl.parse(WdlFixtures.load(WdlFixtures.BROKEN));
    assertTrue(r.hasErrors());
    List<DiagnosticCode> codes = new ArrayList<DiagnosticCode>();
    for (Diagnostic d: r.getDiagnostics()) {
      codes.add(d.getCode());
    }
    assertTrue(codes.toString(),
               codes.contains(DiagnosticCode.LITERAL_TYPE_MISMATCH));
    assertTrue(codes.toString(),
               codes.contains(DiagnosticCode.UNRESOLVED_REFERENCE));
    assertTrue(codes.toString(),
               codes.contains(DiagnosticCode.UNTERMINATED_BLOCK));

    DependencyGraph deps = wdl.dependencyGraph(r.getDocument());
    assertEquals("Partial model still yields edges", 1, deps.size());
    assertEquals("first", deps.edges().get(0).getTarget());
  }

  @Test
  public void testUtf8Bytes() {
    ParseResult r = wdl.parse(SIMPLE.getBytes(StandardCharsets.UTF_8));
    assertFalse(r.hasErrors());
    assertEquals(SIMPLE, r.getTree().getText());
  }

  @Test
  public void testInvalidUtf8() {
    byte[] bytes = { 'v', 'e', 'r', (byte) 0xC3, (byte) 0x28, '\n' };
    ParseResult r = wdl.parse(bytes);
    assertEquals(1, r.getDiagnostics().size());
    Diagnostic d = r.getDiagnostics().get(0);
    assertEquals(DiagnosticCode.UNSUPPORTED_ENCODING, d.getCode());
    assertTrue(d.isError());
    assertEquals("", r.getTree().getText());
    assertTrue(r.getTree().children().isEmpty());
    assertNull(r.getDocument().getVersion());
  }

  @Test
  public void testQueries() {
    ParseResult r = wdl.parse(SIMPLE);
    DocumentInfo info = wdl.info(r.getDocument());
    assertEquals("hello", info.tasks.get(0).name);
    assertEquals("\"world\"", info.workflows.get(0).inputs.get(0).expression);

    DiagramGraph diagram = wdl.diagram(r.getDocument());
    assertEquals(1, diagram.getNodes(NodeKind.WORKFLOW).size());
    assertEquals(1, diagram.getNodes(NodeKind.CALL).size());
    assertEquals(0, diagram.getEdges(EdgeKind.DEPENDENCY).size());
  }

  @Test
  public void testConcurrentParses() throws Exception {
    final String src = WdlFixtures.load(WdlFixtures.PIPELINE) +
                       WdlFixtures.load(WdlFixtures.BROKEN);
    final String expectedTree = wdl.parse(src).getTree().printTree();
    final int expectedDiags = wdl.parse(src).getDiagnostics().size();

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<ParseResult>> futures = new ArrayList<Future<ParseResult>>();
      for (int i = 0; i < 16; i++) {
        futures.add(pool.submit(new Callable<ParseResult>() {
          @Override
          public ParseResult call() {
            return wdl.parse(src);
          }
        }));
      }
      for (Future<ParseResult> f: futures) {
        ParseResult r = f.get();
        assertEquals(expectedTree, r.getTree().printTree());
        assertEquals(expectedDiags, r.getDiagnostics().size());
      }
    } finally {
      pool.shutdown();
    }
  }
}
