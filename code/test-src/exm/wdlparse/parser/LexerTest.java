package exm.wdlparse.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.Diagnostic;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;

public class LexerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/LexerTest.wdlparse.log", true);
  }

  private static List<Token> lex(String src, Diagnostics diags) {
    return Lexer.tokenize(src, diags);
  }

  private static List<Token> lex(String src) {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    List<Token> tokens = lex(src, diags);
    assertEquals("Unexpected diagnostics: " + diags.list(), 0, diags.size());
    return tokens;
  }

  private static List<TokenKind> kinds(List<Token> tokens) {
    List<TokenKind> result = new ArrayList<TokenKind>();
    for (Token t: tokens) {
      result.add(t.getKind());
    }
    return result;
  }

  private static List<Token> significant(List<Token> tokens) {
    List<Token> result = new ArrayList<Token>();
    for (Token t: tokens) {
      if (!t.isTrivia()) {
        result.add(t);
      }
    }
    return result;
  }

  private static String concat(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    for (Token t: tokens) {
      sb.append(t.getText());
    }
    return sb.toString();
  }

  @Test
  public void testVersionLine() {
    List<Token> tokens = lex("version 1.0\n");
    assertEquals(Arrays.asList(TokenKind.VERSION, TokenKind.WHITESPACE,
        TokenKind.VERSION_TEXT, TokenKind.WHITESPACE, TokenKind.EOF),
        kinds(tokens));
    assertEquals("1.0", tokens.get(2).getText());
  }

  @Test
  public void testVersionKeywordOnlyFirst() {
    List<Token> sig = significant(lex("version 1.0\ntask version {}"));
    assertEquals(TokenKind.VERSION, sig.get(0).getKind());
    assertEquals(TokenKind.TASK, sig.get(2).getKind());
    assertEquals("Later 'version' is a plain name",
                 TokenKind.IDENT, sig.get(3).getKind());
  }

  @Test
  public void testCommentIsTrivia() {
    List<Token> tokens = lex("# header\nversion 1.1");
    assertEquals(TokenKind.COMMENT, tokens.get(0).getKind());
    assertEquals("# header", tokens.get(0).getText());
    assertTrue(tokens.get(0).isTrivia());
    assertEquals("version still counts as first",
                 TokenKind.VERSION, significant(tokens).get(0).getKind());
  }

  @Test
  public void testNumberWithUnitIsOneToken() {
    List<Token> sig = significant(lex("memory: 1GB"));
    assertEquals(4, sig.size());
    assertEquals(TokenKind.INTEGER, sig.get(2).getKind());
    assertEquals("1GB", sig.get(2).getText());
  }

  @Test
  public void testNumbers() {
    List<Token> sig = significant(lex("1.5e3 2.0 7 0x1F"));
    assertEquals(Arrays.asList(TokenKind.FLOAT, TokenKind.FLOAT,
        TokenKind.INTEGER, TokenKind.INTEGER, TokenKind.EOF), kinds(sig));
    assertEquals("0x1F", sig.get(3).getText());
  }

  @Test
  public void testTwoCharOperators() {
    List<Token> sig = significant(lex("a <= b && c != d || !e == f"));
    assertEquals(Arrays.asList(TokenKind.IDENT, TokenKind.LTE,
        TokenKind.IDENT, TokenKind.AND, TokenKind.IDENT, TokenKind.NEQ,
        TokenKind.IDENT, TokenKind.OR, TokenKind.NOT, TokenKind.IDENT,
        TokenKind.EQ, TokenKind.IDENT, TokenKind.EOF), kinds(sig));
  }

  @Test
  public void testLossless() {
    String[] inputs = {
      "",
      "version 1.0\n\ntask t {\n  command { echo ${x} }\n}\n",
      "\"unterminated\n   Int x = 1GB @@ $",
      "command <<< a ~{b + \"c ~{d}\"} >>>",
      "workflow w { call t { input: x = \"a\\qb\" } ",
    };
    for (String src: inputs) {
      Diagnostics diags = new Diagnostics(Settings.defaults());
      List<Token> tokens = lex(src, diags);
      assertEquals("Tokens of <" + src + ">", src, concat(tokens));
      Token eof = tokens.get(tokens.size() - 1);
      assertEquals(TokenKind.EOF, eof.getKind());
      assertEquals(0, eof.getSpan().length());
      assertEquals(src.length(), eof.getSpan().start);
    }
  }

  @Test
  public void testInvalidEscape() {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    List<Token> tokens = lex("\"a\\qb\"", diags);
    assertEquals(Arrays.asList(TokenKind.QUOTE, TokenKind.STRING_TEXT,
        TokenKind.QUOTE, TokenKind.EOF), kinds(tokens));
    assertEquals(1, diags.size());
    Diagnostic d = diags.list().get(0);
    assertEquals(DiagnosticCode.INVALID_ESCAPE, d.getCode());
    assertEquals("Span covers the escape", 2, d.getSpan().start);
    assertEquals(4, d.getSpan().end);
  }

  @Test
  public void testValidEscapes() {
    List<Token> tokens = lex("\"\\n\\t\\u00e9\\x41\\101\\~\\{\\\"\"");
    assertEquals(Arrays.asList(TokenKind.QUOTE, TokenKind.STRING_TEXT,
        TokenKind.QUOTE, TokenKind.EOF), kinds(tokens));
  }

  @Test
  public void testShortHexEscape() {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    lex("\"\\x4\"", diags);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.INVALID_ESCAPE, diags.list().get(0).getCode());
  }

  @Test
  public void testUnterminatedString() {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    List<Token> tokens = lex("String s = \"abc\nInt x = 1", diags);
    assertEquals(1, diags.size());
    Diagnostic d = diags.list().get(0);
    assertEquals(DiagnosticCode.UNTERMINATED_STRING, d.getCode());
    assertTrue(d.isError());
    assertEquals("Starts at the opening quote", 11, d.getSpan().start);

    // Lexing resumes normally on the next line
    Token intType = null;
    for (Token t: tokens) {
      if (t.getText().equals("Int")) {
        intType = t;
      }
    }
    assertEquals(TokenKind.TYPE_NAME, intType.getKind());
    assertEquals(2, intType.getLine());
    assertEquals(1, intType.getColumn());
  }

  @Test
  public void testBraceCommandNesting() {
    List<Token> sig = significant(
                lex("command { if [ x ]; then { echo; }; fi }"));
    assertEquals(Arrays.asList(TokenKind.COMMAND, TokenKind.COMMAND_OPEN,
        TokenKind.COMMAND_TEXT, TokenKind.COMMAND_CLOSE, TokenKind.EOF),
        kinds(sig));
    assertEquals(" if [ x ]; then { echo; }; fi ", sig.get(2).getText());
  }

  @Test
  public void testBraceCommandPlaceholders() {
    List<Token> sig = significant(lex("command { echo ${x} ~{y} }"));
    assertEquals(Arrays.asList(TokenKind.COMMAND, TokenKind.COMMAND_OPEN,
        TokenKind.COMMAND_TEXT, TokenKind.PLACEHOLDER_OPEN, TokenKind.IDENT,
        TokenKind.PLACEHOLDER_CLOSE, TokenKind.COMMAND_TEXT,
        TokenKind.PLACEHOLDER_OPEN, TokenKind.IDENT,
        TokenKind.PLACEHOLDER_CLOSE, TokenKind.COMMAND_TEXT,
        TokenKind.COMMAND_CLOSE, TokenKind.EOF), kinds(sig));
    assertEquals("${", sig.get(3).getText());
    assertEquals("~{", sig.get(7).getText());
  }

  @Test
  public void testHeredocDollarIsLiteral() {
    List<Token> sig = significant(lex("command <<< echo ${HOME} ~{x} >>>"));
    assertEquals(Arrays.asList(TokenKind.COMMAND, TokenKind.HEREDOC_OPEN,
        TokenKind.COMMAND_TEXT, TokenKind.PLACEHOLDER_OPEN, TokenKind.IDENT,
        TokenKind.PLACEHOLDER_CLOSE, TokenKind.COMMAND_TEXT,
        TokenKind.HEREDOC_CLOSE, TokenKind.EOF), kinds(sig));
    assertEquals(" echo ${HOME} ", sig.get(2).getText());
  }

  @Test
  public void testPlaceholderBraceNesting() {
    List<Token> sig = significant(lex("command <<< ~{ {\"a\": 1}[\"a\"] } >>>"));
    int closes = 0;
    for (Token t: sig) {
      if (t.is(TokenKind.PLACEHOLDER_CLOSE)) {
        closes++;
      }
    }
    assertEquals(1, closes);
    assertEquals(TokenKind.HEREDOC_CLOSE, sig.get(sig.size() - 2).getKind());
  }

  @Test
  public void testUnterminatedCommand() {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    lex("command {\n echo hi\n", diags);
    assertEquals(1, diags.size());
    Diagnostic d = diags.list().get(0);
    assertEquals(DiagnosticCode.UNTERMINATED_COMMAND, d.getCode());
    assertEquals(8, d.getSpan().start);
  }

  @Test
  public void testUnterminatedPlaceholderInString() {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    lex("\"a ~{b", diags);
    assertEquals(2, diags.size());
    assertEquals("Innermost first", DiagnosticCode.UNTERMINATED_PLACEHOLDER,
                 diags.list().get(0).getCode());
    assertEquals(DiagnosticCode.UNTERMINATED_STRING,
                 diags.list().get(1).getCode());
  }

  @Test
  public void testStringInPlaceholderInString() {
    List<Token> tokens = lex("\"a ~{if b then \"x\" else \"y\"} c\"");
    int quotes = 0;
    for (Token t: tokens) {
      if (t.is(TokenKind.QUOTE)) {
        quotes++;
      }
    }
    assertEquals(6, quotes);
    assertEquals(TokenKind.QUOTE, tokens.get(tokens.size() - 2).getKind());
  }

  @Test
  public void testUnexpectedCharacters() {
    Diagnostics diags = new Diagnostics(Settings.defaults());
    List<Token> sig = significant(lex("Int x = @@ 1", diags));
    assertEquals(1, diags.size());
    assertEquals(DiagnosticCode.UNEXPECTED_CHARACTER,
                 diags.list().get(0).getCode());
    assertEquals(TokenKind.ERROR, sig.get(3).getKind());
    assertEquals("@@", sig.get(3).getText());
    assertEquals(TokenKind.INTEGER, sig.get(4).getKind());
  }

  @Test
  public void testLineAndColumn() {
    List<Token> sig = significant(lex("version 1.0\n  task t"));
    Token task = sig.get(2);
    assertEquals(TokenKind.TASK, task.getKind());
    assertEquals(14, task.getSpan().start);
    assertEquals(2, task.getLine());
    assertEquals(3, task.getColumn());
    assertEquals(2, task.getSpan().endLine);
    assertEquals(7, task.getSpan().endColumn);
  }

  @Test
  public void testNewlineToken() {
    List<Token> tokens = lex("a \n b");
    assertTrue(tokens.get(1).isNewline());
    assertFalse(tokens.get(0).isNewline());
  }
}
