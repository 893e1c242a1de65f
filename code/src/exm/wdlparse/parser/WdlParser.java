/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.wdlparse.parser;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.LiteralKind;
import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenCategory;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.common.exceptions.WdlRuntimeError;

/**
 * Recursive descent parser building a lossless syntax tree.
 *
 * Problems are reported to the Diagnostics object and never thrown:
 * the parser always returns a tree covering the whole input.  After an
 * unexpected token it reports once, then skips tokens into an ERROR
 * node until a statement starter at the beginning of a line or the
 * closing brace of the enclosing block.  Each recovery consumes at
 * least one token, so parsing always terminates.
 *
 * The structural checks done here only look at the shape of the source
 * (declarations without types, literals that cannot have the declared
 * type, and so on).  Name resolution happens later, on the model.
 */
public class WdlParser {

  /** Where a declaration appears, which decides whether it needs a value */
  private static enum DeclContext {
    INPUT,
    PRIVATE,
    OUTPUT,
    STRUCT_FIELD,
  }

  /** What the parser learned about an expression it just built */
  private static class Parsed {
    final SyntaxKind kind;
    final Span span;
    /** Token of a single-token literal */
    final Token literal;
    /** String literal containing placeholders */
    final boolean interpolated;

    Parsed(SyntaxKind kind, Span span, Token literal, boolean interpolated) {
      this.kind = kind;
      this.span = span;
      this.literal = literal;
      this.interpolated = interpolated;
    }
  }

  private static class TypeShape {
    String base;
    boolean parameterized = false;
    boolean optional = false;
  }

  /**
   * Tracks sections seen in a task or workflow to enforce their order
   */
  private class SectionTracker {
    private final Set<SyntaxKind> seen = EnumSet.noneOf(SyntaxKind.class);
    private boolean bodySeen = false;

    void section(Token keyword, SyntaxKind kind) {
      String name = keyword.getText();
      if (seen.contains(kind)) {
        diagnostics.add(DiagnosticCode.DUPLICATE_SECTION, keyword.getSpan(),
                        "Duplicate " + name + " section");
      }
      if (kind == SyntaxKind.INPUT_SECTION &&
          (seen.contains(SyntaxKind.COMMAND_SECTION) ||
           seen.contains(SyntaxKind.OUTPUT_SECTION) || bodySeen)) {
        diagnostics.add(DiagnosticCode.OUT_OF_ORDER_SECTION,
            keyword.getSpan(), "The input section must come before " +
            "command, output and workflow body elements");
      }
      seen.add(kind);
    }

    void bodyElement(Token first) {
      if (seen.contains(SyntaxKind.OUTPUT_SECTION)) {
        diagnostics.add(DiagnosticCode.OUT_OF_ORDER_SECTION, first.getSpan(),
            "Workflow body elements must come before the output section");
      }
      bodySeen = true;
    }

    boolean seen(SyntaxKind kind) {
      return seen.contains(kind);
    }
  }

  private static final Set<TokenKind> DOC_STARTERS = EnumSet.of(
      TokenKind.IMPORT, TokenKind.STRUCT, TokenKind.TASK, TokenKind.WORKFLOW);

  /** Tokens that can begin a statement inside a block */
  private static final Set<TokenKind> BLOCK_STARTERS = EnumSet.of(
      TokenKind.IMPORT, TokenKind.STRUCT, TokenKind.TASK, TokenKind.WORKFLOW,
      TokenKind.INPUT, TokenKind.OUTPUT, TokenKind.COMMAND,
      TokenKind.RUNTIME, TokenKind.META, TokenKind.PARAMETER_META,
      TokenKind.CALL, TokenKind.SCATTER, TokenKind.IF,
      TokenKind.TYPE_NAME, TokenKind.IDENT);

  private static final TokenKind[][] BINARY_LEVELS = {
    { TokenKind.OR },
    { TokenKind.AND },
    { TokenKind.EQ, TokenKind.NEQ },
    { TokenKind.LT, TokenKind.LTE, TokenKind.GT, TokenKind.GTE },
    { TokenKind.PLUS, TokenKind.MINUS },
    { TokenKind.STAR, TokenKind.SLASH, TokenKind.PERCENT },
  };

  /** Runtime attributes whose values are conventionally strings */
  private static final Set<String> STRING_RUNTIME_KEYS = new HashSet<String>(
      Arrays.asList("docker", "container", "memory", "disks", "zones",
                    "cpuPlatform", "gpuType"));

  private static final Set<String> PLACEHOLDER_OPTIONS = new HashSet<String>(
      Arrays.asList("sep", "default", "true", "false"));

  private static final Pattern INT_PATTERN =
      Pattern.compile("[0-9]+|0[xX][0-9a-fA-F]+");
  private static final Pattern FLOAT_PATTERN =
      Pattern.compile("[0-9]+\\.[0-9]*([eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+");

  private final Logger logger = Logging.getWdlLogger();

  private final List<Token> tokens;
  private final Diagnostics diagnostics;
  private final TreeBuilder builder = new TreeBuilder();

  /** Index of next unconsumed token, trivia included */
  private int pos = 0;
  private Token lastToken = null;
  /** Offset of last unexpected-token report, to report each spot once */
  private int lastErrorOffset = -1;
  private boolean reportedUnterminated = false;
  private boolean suppressMalformedNumber = false;

  public WdlParser(List<Token> tokens, Diagnostics diagnostics) {
    if (tokens.isEmpty() ||
        !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
      throw new WdlRuntimeError("Token list must end with EOF");
    }
    this.tokens = tokens;
    this.diagnostics = diagnostics;
  }

  /**
   * Lex and parse a complete document
   */
  public static SyntaxNode parse(String src, Diagnostics diagnostics) {
    List<Token> tokens = Lexer.tokenize(src, diagnostics);
    return new WdlParser(tokens, diagnostics).parseDocument();
  }

  public SyntaxNode parseDocument() {
    builder.startNode(SyntaxKind.DOCUMENT);
    if (at(TokenKind.EOF)) {
      flushTrivia();
      Span whole = Span.cover(tokens.get(0).getSpan(),
                              tokens.get(tokens.size() - 1).getSpan());
      diagnostics.add(DiagnosticCode.EMPTY_DOCUMENT, whole,
                      "Document is empty");
      return builder.finish();
    }

    if (at(TokenKind.VERSION)) {
      parseVersion();
    } else {
      diagnostics.add(DiagnosticCode.MISSING_VERSION, peek().getSpan(),
                      "Document must begin with a version statement");
    }

    boolean seenStruct = false;
    boolean seenDefinition = false;
    while (!at(TokenKind.EOF)) {
      Token t = peek();
      switch (t.getKind()) {
        case IMPORT:
          if (seenStruct || seenDefinition) {
            diagnostics.add(DiagnosticCode.OUT_OF_ORDER_SECTION, t.getSpan(),
                "Imports must come before struct, task and workflow " +
                "definitions");
          }
          parseImport();
          break;
        case STRUCT:
          if (seenDefinition) {
            diagnostics.add(DiagnosticCode.OUT_OF_ORDER_SECTION, t.getSpan(),
                "Structs must come before task and workflow definitions");
          }
          seenStruct = true;
          parseStruct();
          break;
        case TASK:
          seenDefinition = true;
          parseTask();
          break;
        case WORKFLOW:
          seenDefinition = true;
          parseWorkflow();
          break;
        default:
          recover("import, struct, task or workflow", DOC_STARTERS, false);
      }
    }
    flushTrivia();
    SyntaxNode root = builder.finish();
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + tokens.size() + " tokens into " +
                   root.childNodes().size() + " top-level nodes, " +
                   diagnostics.size() + " diagnostics");
    }
    return root;
  }

  /* ---------------- token stream ---------------- */

  private int significantIndex(int n) {
    int seen = 0;
    for (int i = pos; ; i++) {
      Token t = tokens.get(i);
      if (t.is(TokenKind.EOF)) {
        return i;
      }
      if (!t.isTrivia()) {
        if (seen == n) {
          return i;
        }
        seen++;
      }
    }
  }

  private Token peek() {
    return tokens.get(significantIndex(0));
  }

  private TokenKind nth(int n) {
    return tokens.get(significantIndex(n)).getKind();
  }

  private boolean at(TokenKind kind) {
    return peek().is(kind);
  }

  private boolean atAny(TokenKind[] kinds) {
    TokenKind k = peek().getKind();
    for (TokenKind kind: kinds) {
      if (k == kind) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return kind of the next token, without skipping trivia
   */
  private TokenKind rawKind() {
    return tokens.get(pos).getKind();
  }

  private void flushTrivia() {
    while (tokens.get(pos).isTrivia()) {
      builder.token(tokens.get(pos));
      pos++;
    }
  }

  private Token bump() {
    flushTrivia();
    Token t = tokens.get(pos);
    if (t.is(TokenKind.EOF)) {
      throw new WdlRuntimeError("Cannot consume end of input");
    }
    builder.token(t);
    pos++;
    lastToken = t;
    return t;
  }

  private boolean eat(TokenKind kind) {
    if (at(kind)) {
      bump();
      return true;
    }
    return false;
  }

  private boolean expect(TokenKind kind, String what) {
    if (eat(kind)) {
      return true;
    }
    unexpected(what);
    return false;
  }

  private void startNode(SyntaxKind kind) {
    flushTrivia();
    builder.startNode(kind);
  }

  private int checkpoint() {
    flushTrivia();
    return builder.checkpoint();
  }

  private void finishNode() {
    builder.finishNode();
  }

  /**
   * @return true if the next significant token is the first on its line
   */
  private boolean atLineStart() {
    for (int i = significantIndex(0) - 1; i >= 0; i--) {
      Token t = tokens.get(i);
      if (!t.isTrivia()) {
        return false;
      }
      if (t.isNewline()) {
        return true;
      }
    }
    return true;
  }

  private Span spanFrom(Token first) {
    return Span.cover(first.getSpan(), lastToken.getSpan());
  }

  /* ---------------- error reporting and recovery ---------------- */

  private void unexpected(String expected) {
    Token t = peek();
    if (t.getSpan().start == lastErrorOffset) {
      return;
    }
    lastErrorOffset = t.getSpan().start;
    diagnostics.add(DiagnosticCode.UNEXPECTED_TOKEN, t.getSpan(),
                    "Expected " + expected + " but found " + describe(t));
  }

  private static String describe(Token t) {
    switch (t.getKind()) {
      case IDENT:
      case TYPE_NAME:
      case INTEGER:
      case FLOAT:
      case VERSION_TEXT:
      case ERROR:
        return t.getKind().describe() + " '" + t.getText() + "'";
      default:
        return t.getKind().describe();
    }
  }

  /**
   * Report an unexpected token and skip into an ERROR node.  The caller
   * guarantees the next token is not EOF, and not the closing brace of
   * the enclosing block.
   * @param inBlock stop before an unbalanced '}'
   */
  private void recover(String expected, Set<TokenKind> starters,
                       boolean inBlock) {
    unexpected(expected);
    startNode(SyntaxKind.ERROR);
    int depth = 0;
    boolean first = true;
    while (!at(TokenKind.EOF)) {
      TokenKind k = peek().getKind();
      if (!first && depth == 0) {
        if (inBlock && k == TokenKind.RBRACE) {
          break;
        }
        if (starters.contains(k) && atLineStart()) {
          break;
        }
      }
      if (k == TokenKind.LBRACE) {
        depth++;
      } else if (k == TokenKind.RBRACE && depth > 0) {
        depth--;
      }
      bump();
      first = false;
    }
    finishNode();
  }

  private Token openBlock() {
    if (at(TokenKind.LBRACE)) {
      return bump();
    }
    unexpected("'{'");
    return null;
  }

  private boolean atBlockEnd() {
    return at(TokenKind.RBRACE) || at(TokenKind.EOF);
  }

  private void closeBlock(Token open, String what) {
    if (eat(TokenKind.RBRACE)) {
      return;
    }
    assert(at(TokenKind.EOF));
    if (!reportedUnterminated) {
      reportedUnterminated = true;
      diagnostics.add(DiagnosticCode.UNTERMINATED_BLOCK, open.getSpan(),
          "Unterminated " + what + ": end of input reached before '}'");
    }
  }

  /* ---------------- top level ---------------- */

  private void parseVersion() {
    startNode(SyntaxKind.VERSION_STMT);
    bump();
    expect(TokenKind.VERSION_TEXT, "version number");
    finishNode();
  }

  private void parseImport() {
    startNode(SyntaxKind.IMPORT_STMT);
    bump();
    if (at(TokenKind.QUOTE)) {
      parseString();
    } else {
      unexpected("import URI");
    }
    if (eat(TokenKind.AS)) {
      expect(TokenKind.IDENT, "namespace name");
    }
    while (at(TokenKind.ALIAS)) {
      startNode(SyntaxKind.IMPORT_ALIAS);
      bump();
      expect(TokenKind.IDENT, "struct name");
      expect(TokenKind.AS, "'as'");
      expect(TokenKind.IDENT, "struct alias");
      finishNode();
    }
    finishNode();
  }

  private void parseStruct() {
    startNode(SyntaxKind.STRUCT_DECL);
    bump();
    expect(TokenKind.IDENT, "struct name");
    Token open = openBlock();
    if (open != null) {
      while (!atBlockEnd()) {
        if (atDeclarationStart()) {
          parseDeclaration(DeclContext.STRUCT_FIELD);
        } else {
          recover("struct member", BLOCK_STARTERS, true);
        }
      }
      closeBlock(open, "struct");
    }
    finishNode();
  }

  private void parseTask() {
    startNode(SyntaxKind.TASK_DECL);
    Token keyword = bump();
    Token name = at(TokenKind.IDENT) ? bump() : null;
    if (name == null) {
      unexpected("task name");
    }
    Token open = openBlock();
    if (open != null) {
      SectionTracker sections = new SectionTracker();
      while (!atBlockEnd()) {
        Token t = peek();
        switch (t.getKind()) {
          case INPUT:
            sections.section(t, SyntaxKind.INPUT_SECTION);
            parseDeclSection(SyntaxKind.INPUT_SECTION, DeclContext.INPUT);
            break;
          case OUTPUT:
            sections.section(t, SyntaxKind.OUTPUT_SECTION);
            parseDeclSection(SyntaxKind.OUTPUT_SECTION, DeclContext.OUTPUT);
            break;
          case COMMAND:
            sections.section(t, SyntaxKind.COMMAND_SECTION);
            parseCommand();
            break;
          case RUNTIME:
            sections.section(t, SyntaxKind.RUNTIME_SECTION);
            parseRuntime();
            break;
          case META:
            sections.section(t, SyntaxKind.META_SECTION);
            parseMeta(SyntaxKind.META_SECTION);
            break;
          case PARAMETER_META:
            sections.section(t, SyntaxKind.PARAMETER_META_SECTION);
            parseMeta(SyntaxKind.PARAMETER_META_SECTION);
            break;
          default:
            if (atDeclarationStart()) {
              parseDeclaration(DeclContext.PRIVATE);
            } else {
              recover("task section or declaration", BLOCK_STARTERS, true);
            }
        }
      }
      closeBlock(open, "task");
      if (!sections.seen(SyntaxKind.COMMAND_SECTION)) {
        Token where = name != null ? name : keyword;
        diagnostics.add(DiagnosticCode.MISSING_SECTION, where.getSpan(),
            "Task " + (name != null ? "'" + name.getText() + "' " : "") +
            "has no command section");
      }
    }
    finishNode();
  }

  private void parseWorkflow() {
    startNode(SyntaxKind.WORKFLOW_DECL);
    bump();
    expect(TokenKind.IDENT, "workflow name");
    Token open = openBlock();
    if (open != null) {
      SectionTracker sections = new SectionTracker();
      while (!atBlockEnd()) {
        Token t = peek();
        switch (t.getKind()) {
          case INPUT:
            sections.section(t, SyntaxKind.INPUT_SECTION);
            parseDeclSection(SyntaxKind.INPUT_SECTION, DeclContext.INPUT);
            break;
          case OUTPUT:
            sections.section(t, SyntaxKind.OUTPUT_SECTION);
            parseDeclSection(SyntaxKind.OUTPUT_SECTION, DeclContext.OUTPUT);
            break;
          case META:
            sections.section(t, SyntaxKind.META_SECTION);
            parseMeta(SyntaxKind.META_SECTION);
            break;
          case PARAMETER_META:
            sections.section(t, SyntaxKind.PARAMETER_META_SECTION);
            parseMeta(SyntaxKind.PARAMETER_META_SECTION);
            break;
          default:
            if (atWorkflowElementStart()) {
              sections.bodyElement(t);
              parseWorkflowElement();
            } else {
              recover("workflow section or element", BLOCK_STARTERS, true);
            }
        }
      }
      closeBlock(open, "workflow");
    }
    finishNode();
  }

  /* ---------------- declarations ---------------- */

  private boolean atDeclarationStart() {
    return at(TokenKind.TYPE_NAME) || at(TokenKind.IDENT);
  }

  private void parseDeclSection(SyntaxKind kind, DeclContext context) {
    startNode(kind);
    Token keyword = bump();
    Token open = openBlock();
    if (open != null) {
      while (!atBlockEnd()) {
        if (atDeclarationStart()) {
          parseDeclaration(context);
        } else {
          recover("declaration", BLOCK_STARTERS, true);
        }
      }
      closeBlock(open, keyword.getText() + " section");
    }
    finishNode();
  }

  private static boolean continuesType(TokenKind next) {
    return next == TokenKind.IDENT || next == TokenKind.LBRACKET ||
           next == TokenKind.QUESTION || next == TokenKind.PLUS;
  }

  private void parseDeclaration(DeclContext context) {
    Token first = peek();
    startNode(SyntaxKind.DECLARATION);
    TypeShape type = null;
    Token name = null;
    if (at(TokenKind.IDENT) && !continuesType(nth(1))) {
      name = bump();
      diagnostics.add(DiagnosticCode.MISSING_TYPE, name.getSpan(),
          "Declaration of '" + name.getText() + "' has no type");
    } else {
      type = parseType();
      if (at(TokenKind.IDENT)) {
        name = bump();
      } else {
        unexpected("declaration name");
      }
    }

    if (at(TokenKind.ASSIGN)) {
      Token assign = bump();
      Parsed init = parseExpr();
      if (context == DeclContext.STRUCT_FIELD) {
        diagnostics.add(DiagnosticCode.BOUND_STRUCT_FIELD, spanFrom(assign),
            "Struct member " + nameOf(name) + " cannot have a value");
      } else if (type != null && init != null && name != null) {
        checkLiteralType(type, name, init);
      }
    } else if (type != null && name != null &&
               (context == DeclContext.PRIVATE ||
                context == DeclContext.OUTPUT)) {
      diagnostics.add(DiagnosticCode.UNBOUND_DECLARATION, spanFrom(first),
          "Declaration " + nameOf(name) + " must be given a value");
    }
    finishNode();
  }

  private static String nameOf(Token name) {
    return name == null ? "" : "'" + name.getText() + "'";
  }

  /**
   * Parse a type reference, e.g. Map[String, Array[File]]+?.
   * The next token must be a type name or identifier.
   */
  private TypeShape parseType() {
    TypeShape shape = new TypeShape();
    startNode(SyntaxKind.TYPE_REF);
    shape.base = bump().getText();
    if (eat(TokenKind.LBRACKET)) {
      shape.parameterized = true;
      do {
        if (atDeclarationStart()) {
          parseType();
        } else {
          unexpected("type parameter");
        }
      } while (eat(TokenKind.COMMA));
      expect(TokenKind.RBRACKET, "']'");
    }
    while (at(TokenKind.PLUS) || at(TokenKind.QUESTION)) {
      if (bump().is(TokenKind.QUESTION)) {
        shape.optional = true;
      }
    }
    finishNode();
    return shape;
  }

  private void checkLiteralType(TypeShape type, Token name, Parsed init) {
    LiteralKind lit = literalKindOf(init);
    if (lit == null || type.parameterized) {
      return;
    }
    boolean ok;
    if (lit == LiteralKind.NONE) {
      ok = type.optional;
    } else if (type.base.equals("Int")) {
      ok = lit == LiteralKind.INT;
    } else if (type.base.equals("Float")) {
      ok = lit == LiteralKind.INT || lit == LiteralKind.FLOAT;
    } else if (type.base.equals("Boolean")) {
      ok = lit == LiteralKind.BOOLEAN;
    } else if (type.base.equals("String") || type.base.equals("File") ||
               type.base.equals("Directory")) {
      ok = lit == LiteralKind.STRING;
    } else {
      return;
    }
    if (!ok) {
      diagnostics.add(DiagnosticCode.LITERAL_TYPE_MISMATCH, init.span,
          "Cannot initialize " + type.base + (type.optional ? "?" : "") +
          " declaration '" + name.getText() + "' with a " +
          lit.typeName() + " literal");
    }
  }

  private static LiteralKind literalKindOf(Parsed p) {
    if (p.kind == SyntaxKind.STRING_EXPR) {
      return LiteralKind.STRING;
    } else if (p.kind == SyntaxKind.LITERAL_EXPR && p.literal != null) {
      if ((p.literal.is(TokenKind.INTEGER) || p.literal.is(TokenKind.FLOAT))
          && !isValidNumber(p.literal)) {
        return null;
      }
      return LiteralKind.forToken(p.literal.getKind());
    }
    return null;
  }

  /**
   * @return true if the token text is a well-formed Int or Float literal
   */
  public static boolean isValidNumber(Token t) {
    String text = t.getText();
    if (t.is(TokenKind.INTEGER)) {
      if (!INT_PATTERN.matcher(text).matches()) {
        return false;
      }
      try {
        if (text.startsWith("0x") || text.startsWith("0X")) {
          Long.parseLong(text.substring(2), 16);
        } else {
          Long.parseLong(text);
        }
        return true;
      } catch (NumberFormatException e) {
        // Out of range
        return false;
      }
    } else if (t.is(TokenKind.FLOAT)) {
      return FLOAT_PATTERN.matcher(text).matches();
    }
    return false;
  }

  /* ---------------- task sections ---------------- */

  private void parseCommand() {
    startNode(SyntaxKind.COMMAND_SECTION);
    bump();
    if (at(TokenKind.COMMAND_OPEN) || at(TokenKind.HEREDOC_OPEN)) {
      TokenKind close = at(TokenKind.COMMAND_OPEN) ?
                TokenKind.COMMAND_CLOSE : TokenKind.HEREDOC_CLOSE;
      bump();
      while (true) {
        TokenKind k = rawKind();
        if (k == TokenKind.COMMAND_TEXT) {
          bump();
        } else if (k == TokenKind.PLACEHOLDER_OPEN) {
          parsePlaceholder();
        } else if (k == close) {
          bump();
          break;
        } else {
          // End of input: the lexer reported the unterminated command
          break;
        }
      }
    } else {
      unexpected("'{' or '<<<'");
    }
    finishNode();
  }

  private void parsePlaceholder() {
    startNode(SyntaxKind.PLACEHOLDER);
    bump();
    while (atPlaceholderOption()) {
      startNode(SyntaxKind.PLACEHOLDER_OPTION);
      bump();
      bump();
      parseExpr();
      finishNode();
    }
    parseExpr();
    if (!eat(TokenKind.PLACEHOLDER_CLOSE) && !at(TokenKind.EOF)) {
      unexpected("'}'");
      skipToPlaceholderClose();
    }
    finishNode();
  }

  private boolean atPlaceholderOption() {
    Token t = peek();
    return (t.is(TokenKind.IDENT) || t.is(TokenKind.TRUE) ||
            t.is(TokenKind.FALSE)) &&
           PLACEHOLDER_OPTIONS.contains(t.getText()) &&
           nth(1) == TokenKind.ASSIGN;
  }

  private void skipToPlaceholderClose() {
    startNode(SyntaxKind.ERROR);
    int depth = 0;
    while (!at(TokenKind.EOF)) {
      TokenKind k = peek().getKind();
      if (k == TokenKind.PLACEHOLDER_OPEN) {
        depth++;
      } else if (k == TokenKind.PLACEHOLDER_CLOSE) {
        if (depth == 0) {
          break;
        }
        depth--;
      }
      bump();
    }
    finishNode();
    eat(TokenKind.PLACEHOLDER_CLOSE);
  }

  private static boolean isKey(Token t) {
    return t.is(TokenKind.IDENT) ||
           (t.getCategory() == TokenCategory.KEYWORD &&
            !t.is(TokenKind.VERSION));
  }

  private void parseRuntime() {
    startNode(SyntaxKind.RUNTIME_SECTION);
    bump();
    Token open = openBlock();
    if (open != null) {
      while (!atBlockEnd()) {
        if (isKey(peek())) {
          parseRuntimeItem();
          eat(TokenKind.COMMA);
        } else {
          recover("runtime attribute", BLOCK_STARTERS, true);
        }
      }
      closeBlock(open, "runtime section");
    }
    finishNode();
  }

  private void parseRuntimeItem() {
    startNode(SyntaxKind.RUNTIME_ITEM);
    Token key = bump();
    if (expect(TokenKind.COLON, "':'")) {
      boolean stringKey = STRING_RUNTIME_KEYS.contains(key.getText());
      suppressMalformedNumber = stringKey;
      Parsed value = parseExpr();
      suppressMalformedNumber = false;
      if (stringKey && value != null &&
          value.kind == SyntaxKind.LITERAL_EXPR &&
          (value.literal.is(TokenKind.INTEGER) ||
           value.literal.is(TokenKind.FLOAT))) {
        diagnostics.add(DiagnosticCode.UNQUOTED_RUNTIME_VALUE, value.span,
            "Runtime attribute '" + key.getText() + "' expects a string: " +
            "write \"" + value.literal.getText() + "\"");
      }
    }
    finishNode();
  }

  private void parseMeta(SyntaxKind kind) {
    startNode(kind);
    Token keyword = bump();
    Token open = openBlock();
    if (open != null) {
      while (!atBlockEnd()) {
        if (isKey(peek())) {
          startNode(SyntaxKind.META_ITEM);
          bump();
          if (expect(TokenKind.COLON, "':'")) {
            parseMetaValue();
          }
          finishNode();
          eat(TokenKind.COMMA);
        } else {
          recover("metadata key", BLOCK_STARTERS, true);
        }
      }
      closeBlock(open, keyword.getText() + " section");
    }
    finishNode();
  }

  /**
   * Metadata values are literals, or arrays and objects of them.
   * Objects here take the form { key: value } with no object keyword.
   */
  private void parseMetaValue() {
    Token first = peek();
    switch (first.getKind()) {
      case LBRACE:
        startNode(SyntaxKind.OBJECT_LITERAL);
        bump();
        while (!atBlockEnd() && isKey(peek())) {
          startNode(SyntaxKind.OBJECT_FIELD);
          bump();
          if (expect(TokenKind.COLON, "':'")) {
            parseMetaValue();
          }
          finishNode();
          eat(TokenKind.COMMA);
        }
        expect(TokenKind.RBRACE, "'}'");
        finishNode();
        return;
      case LBRACKET:
        startNode(SyntaxKind.ARRAY_LITERAL);
        bump();
        while (!at(TokenKind.RBRACKET) && !at(TokenKind.EOF)) {
          int before = pos;
          parseMetaValue();
          if (pos == before) {
            break;
          }
          eat(TokenKind.COMMA);
        }
        expect(TokenKind.RBRACKET, "']'");
        finishNode();
        return;
      case QUOTE: {
        Parsed s = parseString();
        if (s.interpolated) {
          nonLiteralMeta(s);
        }
        return;
      }
      case INTEGER:
      case FLOAT:
      case TRUE:
      case FALSE:
      case NULL:
      case NONE:
        parsePrimary();
        return;
      case MINUS:
        if (nth(1) == TokenKind.INTEGER || nth(1) == TokenKind.FLOAT) {
          parseUnary();
          return;
        }
        break;
      default:
        break;
    }
    Parsed p = parseExpr();
    if (p != null) {
      nonLiteralMeta(p);
    }
  }

  private void nonLiteralMeta(Parsed p) {
    diagnostics.add(DiagnosticCode.NON_LITERAL_META, p.span,
        "Metadata values must be literals, or arrays and objects of literals");
  }

  /* ---------------- workflow elements ---------------- */

  private boolean atWorkflowElementStart() {
    return at(TokenKind.CALL) || at(TokenKind.SCATTER) ||
           at(TokenKind.IF) || atDeclarationStart();
  }

  private void parseWorkflowElement() {
    switch (peek().getKind()) {
      case CALL:
        parseCall();
        break;
      case SCATTER:
        parseScatter();
        break;
      case IF:
        parseConditional();
        break;
      default:
        parseDeclaration(DeclContext.PRIVATE);
    }
  }

  private void parseBody(Token open, String what) {
    while (!atBlockEnd()) {
      if (atWorkflowElementStart()) {
        parseWorkflowElement();
      } else {
        recover("call, scatter, if or declaration", BLOCK_STARTERS, true);
      }
    }
    closeBlock(open, what);
  }

  private void parseCall() {
    startNode(SyntaxKind.CALL_STMT);
    bump();
    if (at(TokenKind.IDENT)) {
      startNode(SyntaxKind.CALL_TARGET);
      bump();
      while (at(TokenKind.DOT) && nth(1) == TokenKind.IDENT) {
        bump();
        bump();
      }
      finishNode();
    } else {
      unexpected("call target");
    }
    if (at(TokenKind.AS)) {
      startNode(SyntaxKind.CALL_ALIAS);
      bump();
      expect(TokenKind.IDENT, "call alias");
      finishNode();
    }
    if (at(TokenKind.LBRACE)) {
      Token open = bump();
      if (at(TokenKind.INPUT) && nth(1) == TokenKind.COLON) {
        bump();
        bump();
      }
      while (!atBlockEnd()) {
        if (at(TokenKind.IDENT)) {
          startNode(SyntaxKind.CALL_INPUT_ITEM);
          bump();
          if (eat(TokenKind.ASSIGN)) {
            parseExpr();
          }
          finishNode();
          eat(TokenKind.COMMA);
        } else {
          recover("call input", BLOCK_STARTERS, true);
        }
      }
      closeBlock(open, "call");
    }
    finishNode();
  }

  private void parseScatter() {
    startNode(SyntaxKind.SCATTER_BLOCK);
    bump();
    expect(TokenKind.LPAREN, "'('");
    expect(TokenKind.IDENT, "scatter variable");
    expect(TokenKind.IN, "'in'");
    parseExpr();
    expect(TokenKind.RPAREN, "')'");
    Token open = openBlock();
    if (open != null) {
      parseBody(open, "scatter block");
    }
    finishNode();
  }

  private void parseConditional() {
    startNode(SyntaxKind.CONDITIONAL_BLOCK);
    bump();
    expect(TokenKind.LPAREN, "'('");
    parseExpr();
    expect(TokenKind.RPAREN, "')'");
    Token open = openBlock();
    if (open != null) {
      parseBody(open, "if block");
    }
    finishNode();
  }

  /* ---------------- expressions ---------------- */

  /**
   * @return null if no expression could be parsed; nothing was consumed
   *         and an error was reported
   */
  private Parsed parseExpr() {
    return parseBinary(0);
  }

  private Parsed parseBinary(int level) {
    if (level == BINARY_LEVELS.length) {
      return parseUnary();
    }
    int cp = checkpoint();
    Parsed left = parseBinary(level + 1);
    if (left == null) {
      return null;
    }
    while (atAny(BINARY_LEVELS[level])) {
      builder.startNodeAt(cp, SyntaxKind.BINARY_EXPR);
      bump();
      parseBinary(level + 1);
      finishNode();
      left = new Parsed(SyntaxKind.BINARY_EXPR,
                        Span.cover(left.span, lastToken.getSpan()),
                        null, false);
    }
    return left;
  }

  private Parsed parseUnary() {
    if (at(TokenKind.NOT) || at(TokenKind.MINUS) || at(TokenKind.PLUS)) {
      Token first = peek();
      startNode(SyntaxKind.UNARY_EXPR);
      bump();
      parseUnary();
      finishNode();
      return new Parsed(SyntaxKind.UNARY_EXPR, spanFrom(first), null, false);
    }
    return parsePostfix();
  }

  private Parsed parsePostfix() {
    Token first = peek();
    int cp = checkpoint();
    Parsed p = parsePrimary();
    if (p == null) {
      return null;
    }
    while (true) {
      SyntaxKind kind;
      if (at(TokenKind.DOT)) {
        kind = SyntaxKind.MEMBER_ACCESS_EXPR;
        builder.startNodeAt(cp, kind);
        bump();
        expect(TokenKind.IDENT, "member name");
        finishNode();
      } else if (at(TokenKind.LBRACKET)) {
        kind = SyntaxKind.INDEX_EXPR;
        builder.startNodeAt(cp, kind);
        bump();
        parseExpr();
        expect(TokenKind.RBRACKET, "']'");
        finishNode();
      } else {
        break;
      }
      p = new Parsed(kind, spanFrom(first), null, false);
    }
    return p;
  }

  private Parsed parsePrimary() {
    Token first = peek();
    switch (first.getKind()) {
      case INTEGER:
      case FLOAT:
        startNode(SyntaxKind.LITERAL_EXPR);
        bump();
        finishNode();
        if (!suppressMalformedNumber && !isValidNumber(first)) {
          diagnostics.add(DiagnosticCode.MALFORMED_NUMBER, first.getSpan(),
              "Malformed number '" + first.getText() + "'");
        }
        return new Parsed(SyntaxKind.LITERAL_EXPR, first.getSpan(), first,
                          false);
      case TRUE:
      case FALSE:
      case NONE:
      case NULL:
        startNode(SyntaxKind.LITERAL_EXPR);
        bump();
        finishNode();
        return new Parsed(SyntaxKind.LITERAL_EXPR, first.getSpan(), first,
                          false);
      case QUOTE:
        return parseString();
      case IDENT:
        if (nth(1) == TokenKind.LPAREN) {
          return parseFunctionCall();
        }
        startNode(SyntaxKind.NAME_REF_EXPR);
        bump();
        finishNode();
        return new Parsed(SyntaxKind.NAME_REF_EXPR, first.getSpan(), null,
                          false);
      case LPAREN:
        return parseParenOrPair();
      case LBRACKET:
        return parseArrayLiteral();
      case LBRACE:
        return parseMapLiteral();
      case OBJECT:
        return parseObjectLiteral();
      case IF:
        return parseTernary();
      default:
        unexpected("expression");
        return null;
    }
  }

  private Parsed parseString() {
    Token first = peek();
    boolean interpolated = false;
    startNode(SyntaxKind.STRING_EXPR);
    bump();
    while (true) {
      TokenKind k = rawKind();
      if (k == TokenKind.STRING_TEXT) {
        bump();
      } else if (k == TokenKind.PLACEHOLDER_OPEN) {
        parsePlaceholder();
        interpolated = true;
      } else if (k == TokenKind.QUOTE) {
        bump();
        break;
      } else {
        // Unterminated, already reported by the lexer
        break;
      }
    }
    finishNode();
    return new Parsed(SyntaxKind.STRING_EXPR, spanFrom(first), null,
                      interpolated);
  }

  private Parsed parseFunctionCall() {
    Token first = peek();
    startNode(SyntaxKind.CALL_EXPR);
    bump();
    startNode(SyntaxKind.ARG_LIST);
    bump();
    while (!at(TokenKind.RPAREN) && !at(TokenKind.EOF)) {
      if (parseExpr() == null || !eat(TokenKind.COMMA)) {
        break;
      }
    }
    expect(TokenKind.RPAREN, "')'");
    finishNode();
    finishNode();
    return new Parsed(SyntaxKind.CALL_EXPR, spanFrom(first), null, false);
  }

  private Parsed parseParenOrPair() {
    Token first = peek();
    int cp = checkpoint();
    bump();
    parseExpr();
    SyntaxKind kind = SyntaxKind.PAREN_EXPR;
    if (eat(TokenKind.COMMA)) {
      kind = SyntaxKind.PAIR_EXPR;
      parseExpr();
    }
    expect(TokenKind.RPAREN, "')'");
    builder.startNodeAt(cp, kind);
    finishNode();
    return new Parsed(kind, spanFrom(first), null, false);
  }

  private Parsed parseArrayLiteral() {
    Token first = peek();
    startNode(SyntaxKind.ARRAY_LITERAL);
    bump();
    while (!at(TokenKind.RBRACKET) && !at(TokenKind.EOF)) {
      if (parseExpr() == null || !eat(TokenKind.COMMA)) {
        break;
      }
    }
    expect(TokenKind.RBRACKET, "']'");
    finishNode();
    return new Parsed(SyntaxKind.ARRAY_LITERAL, spanFrom(first), null, false);
  }

  private Parsed parseMapLiteral() {
    Token first = peek();
    startNode(SyntaxKind.MAP_LITERAL);
    bump();
    while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
      int cp = checkpoint();
      if (parseExpr() == null) {
        break;
      }
      builder.startNodeAt(cp, SyntaxKind.MAP_ENTRY);
      if (expect(TokenKind.COLON, "':'")) {
        parseExpr();
      }
      finishNode();
      if (!eat(TokenKind.COMMA)) {
        break;
      }
    }
    expect(TokenKind.RBRACE, "'}'");
    finishNode();
    return new Parsed(SyntaxKind.MAP_LITERAL, spanFrom(first), null, false);
  }

  private Parsed parseObjectLiteral() {
    Token first = peek();
    startNode(SyntaxKind.OBJECT_LITERAL);
    bump();
    if (expect(TokenKind.LBRACE, "'{'")) {
      while (isKey(peek())) {
        startNode(SyntaxKind.OBJECT_FIELD);
        bump();
        if (expect(TokenKind.COLON, "':'")) {
          parseExpr();
        }
        finishNode();
        if (!eat(TokenKind.COMMA)) {
          break;
        }
      }
      expect(TokenKind.RBRACE, "'}'");
    }
    finishNode();
    return new Parsed(SyntaxKind.OBJECT_LITERAL, spanFrom(first), null,
                      false);
  }

  private Parsed parseTernary() {
    Token first = peek();
    startNode(SyntaxKind.TERNARY_EXPR);
    bump();
    parseExpr();
    expect(TokenKind.THEN, "'then'");
    parseExpr();
    expect(TokenKind.ELSE, "'else'");
    parseExpr();
    finishNode();
    return new Parsed(SyntaxKind.TERNARY_EXPR, spanFrom(first), null, false);
  }
}
