package exm.wdlparse.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.wdlparse.ast.Span;
import exm.wdlparse.common.diagnostics.Diagnostic;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.common.diagnostics.Severity;
import exm.wdlparse.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings s = Settings.defaults();
    assertEquals(Severity.WARNING,
                 s.getSeverity(DiagnosticCode.UNRESOLVED_REFERENCE));
    assertEquals(Severity.ERROR,
                 s.getSeverity(DiagnosticCode.LITERAL_TYPE_MISMATCH));
    assertEquals(Severity.ERROR,
                 s.getSeverity(DiagnosticCode.UNTERMINATED_STRING));
    assertEquals("", s.get(Settings.LOG_FILE));
    assertFalse(s.getBoolean(Settings.LOG_TRACE));
    assertTrue(s.getKeys().contains(
                  "wdlparse.severity.unresolved-call-target"));
  }

  @Test
  public void testOverrides() throws InvalidOptionException {
    Properties p = new Properties();
    p.setProperty("wdlparse.severity.unresolved-reference", "error");
    p.setProperty("wdlparse.severity.missing-type", "Warning");
    p.setProperty(Settings.LOG_TRACE, "TRUE");
    Settings s = Settings.create(p);
    assertEquals(Severity.ERROR,
                 s.getSeverity(DiagnosticCode.UNRESOLVED_REFERENCE));
    assertEquals(Severity.WARNING,
                 s.getSeverity(DiagnosticCode.MISSING_TYPE));
    assertTrue(s.getBoolean(Settings.LOG_TRACE));
    assertEquals("Others keep their defaults", Severity.ERROR,
                 s.getSeverity(DiagnosticCode.UNKNOWN_TYPE));
  }

  @Test
  public void testWithSeverity() throws InvalidOptionException {
    Settings base = Settings.defaults();
    Settings relaxed = base.withSeverity(
        DiagnosticCode.LITERAL_TYPE_MISMATCH, Severity.WARNING);
    assertEquals(Severity.WARNING,
                 relaxed.getSeverity(DiagnosticCode.LITERAL_TYPE_MISMATCH));
    assertEquals("Original is unchanged", Severity.ERROR,
                 base.getSeverity(DiagnosticCode.LITERAL_TYPE_MISMATCH));

    Diagnostics diags = new Diagnostics(relaxed);
    Diagnostic d = diags.add(DiagnosticCode.LITERAL_TYPE_MISMATCH,
                             Span.point(0, 1, 1), "mismatch");
    assertFalse(d.isError());
    assertFalse(diags.hasErrors());
  }

  @Test
  public void testSystemProperties() throws InvalidOptionException {
    String key = "wdlparse.severity.non-literal-meta";
    System.setProperty(key, "warning");
    try {
      Settings s = Settings.fromSystemProperties();
      assertEquals(Severity.WARNING,
                   s.getSeverity(DiagnosticCode.NON_LITERAL_META));

      Properties p = new Properties();
      p.setProperty(key, "error");
      assertEquals("Explicit overrides win", Severity.ERROR,
          Settings.create(p).getSeverity(DiagnosticCode.NON_LITERAL_META));
    } finally {
      System.clearProperty(key);
    }
  }

  @Test
  public void testUnknownOption() throws InvalidOptionException {
    Properties p = new Properties();
    p.setProperty("wdlparse.no.such.option", "1");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Unknown option");
    Settings.create(p);
  }

  @Test
  public void testBadSeverity() throws InvalidOptionException {
    Properties p = new Properties();
    p.setProperty("wdlparse.severity.unknown-type", "fatal");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("'fatal'");
    Settings.create(p);
  }

  @Test
  public void testNotConfigurable() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("cannot be configured");
    Settings.defaults().withSeverity(DiagnosticCode.UNTERMINATED_STRING,
                                     Severity.WARNING);
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Properties p = new Properties();
    p.setProperty(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.create(p);
  }
}
