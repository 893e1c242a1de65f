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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;

/**
 * Hand-written scanner for WDL source text.
 *
 * The lexer keeps a stack of modes, since the token set depends on the
 * context: ordinary code, the inside of a string literal, an opaque
 * command body, or an expression placeholder embedded in one of those.
 * Every character of the input ends up in exactly one token, so
 * concatenating the token text reproduces the source.  The token list
 * always ends with a zero-width EOF token.
 *
 * A lexer instance scans one source text once.
 */
public class Lexer {

  private static enum ModeKind {
    NORMAL,
    STRING,
    COMMAND_BRACE,
    HEREDOC,
    PLACEHOLDER,
  }

  private static class Mode {
    final ModeKind kind;
    /** Offset of the token that opened this mode */
    final int openOffset;
    /** Quote character for STRING mode */
    final char quote;
    /** Unbalanced { count for COMMAND_BRACE and PLACEHOLDER modes */
    int depth = 0;

    Mode(ModeKind kind, int openOffset, char quote) {
      this.kind = kind;
      this.openOffset = openOffset;
      this.quote = quote;
    }
  }

  private final Logger logger = Logging.getWdlLogger();

  private final String src;
  private final Diagnostics diagnostics;
  private final LineMap lines;

  private final List<Token> tokens = new ArrayList<Token>();
  private final ArrayList<Mode> modes = new ArrayList<Mode>();
  private int pos = 0;

  /** Whether any non-trivia token has been emitted */
  private boolean sawSignificant = false;
  /** Just after the version keyword, on the same line */
  private boolean afterVersion = false;
  /** Last significant token was the command keyword */
  private boolean afterCommand = false;

  public Lexer(String src, Diagnostics diagnostics) {
    this.src = src;
    this.diagnostics = diagnostics;
    this.lines = new LineMap(src);
    modes.add(new Mode(ModeKind.NORMAL, 0, '\0'));
  }

  /**
   * Scan the whole input.
   * @return tokens in source order, terminated by EOF
   */
  public List<Token> tokenize() {
    while (pos < src.length()) {
      int before = pos;
      int depthBefore = modes.size();
      switch (mode().kind) {
        case NORMAL:
        case PLACEHOLDER:
          lexCode();
          break;
        case STRING:
          lexString();
          break;
        case COMMAND_BRACE:
          lexBraceCommand();
          break;
        case HEREDOC:
          lexHeredoc();
          break;
        default:
          throw new IllegalStateException("Unknown mode " + mode().kind);
      }
      assert(pos > before || modes.size() != depthBefore) :
        "No progress at " + pos;
    }
    closeModesAtEof();
    tokens.add(new Token(TokenKind.EOF, "", lines.span(pos, pos)));
    if (logger.isTraceEnabled()) {
      logger.trace("Lexed " + tokens.size() + " tokens");
    }
    return tokens;
  }

  /**
   * Convenience wrapper
   */
  public static List<Token> tokenize(String src, Diagnostics diagnostics) {
    return new Lexer(src, diagnostics).tokenize();
  }

  private Mode mode() {
    return modes.get(modes.size() - 1);
  }

  private void pushMode(ModeKind kind, int openOffset, char quote) {
    modes.add(new Mode(kind, openOffset, quote));
  }

  private void popMode() {
    assert(modes.size() > 1);
    modes.remove(modes.size() - 1);
  }

  private char peek(int ahead) {
    int i = pos + ahead;
    return i < src.length() ? src.charAt(i) : '\0';
  }

  private boolean lookingAt(String s) {
    return src.startsWith(s, pos);
  }

  private void emit(TokenKind kind, int start) {
    Token t = new Token(kind, src.substring(start, pos),
                        lines.span(start, pos));
    tokens.add(t);
    if (!t.isTrivia()) {
      sawSignificant = true;
      afterCommand = (kind == TokenKind.COMMAND);
    }
  }

  private void error(DiagnosticCode code, int start, int end, String msg) {
    diagnostics.add(code, lines.span(start, end), msg);
  }

  /* ---------------- ordinary code and placeholder expressions -------- */

  private void lexCode() {
    int start = pos;
    char c = src.charAt(pos);

    if (isWhitespace(c)) {
      while (pos < src.length() && isWhitespace(src.charAt(pos))) {
        if (src.charAt(pos) == '\n') {
          afterVersion = false;
        }
        pos++;
      }
      emit(TokenKind.WHITESPACE, start);
      return;
    }

    if (c == '#') {
      while (pos < src.length() && src.charAt(pos) != '\n') {
        pos++;
      }
      afterVersion = false;
      emit(TokenKind.COMMENT, start);
      return;
    }

    if (afterVersion) {
      while (pos < src.length() && !isWhitespace(src.charAt(pos))) {
        pos++;
      }
      afterVersion = false;
      emit(TokenKind.VERSION_TEXT, start);
      return;
    }

    if (isIdentStart(c)) {
      lexWord(start);
      return;
    }

    if (isDigit(c)) {
      lexNumber(start);
      return;
    }

    if (c == '"' || c == '\'') {
      pos++;
      emit(TokenKind.QUOTE, start);
      pushMode(ModeKind.STRING, start, c);
      return;
    }

    if (afterCommand && c == '{') {
      pos++;
      emit(TokenKind.COMMAND_OPEN, start);
      pushMode(ModeKind.COMMAND_BRACE, start, '\0');
      return;
    }
    if (afterCommand && lookingAt("<<<")) {
      pos += 3;
      emit(TokenKind.HEREDOC_OPEN, start);
      pushMode(ModeKind.HEREDOC, start, '\0');
      return;
    }

    if (c == '{') {
      pos++;
      if (mode().kind == ModeKind.PLACEHOLDER) {
        mode().depth++;
      }
      emit(TokenKind.LBRACE, start);
      return;
    }
    if (c == '}') {
      pos++;
      if (mode().kind == ModeKind.PLACEHOLDER) {
        if (mode().depth == 0) {
          emit(TokenKind.PLACEHOLDER_CLOSE, start);
          popMode();
          return;
        }
        mode().depth--;
      }
      emit(TokenKind.RBRACE, start);
      return;
    }

    TokenKind op = operator();
    if (op != null) {
      pos += op.spelling.length();
      emit(op, start);
      return;
    }

    // Group a run of unknown characters into one error token
    while (pos < src.length() && isUnexpected(src.charAt(pos))) {
      pos += Character.charCount(src.codePointAt(pos));
    }
    if (pos == start) {
      pos += Character.charCount(src.codePointAt(pos));
    }
    error(DiagnosticCode.UNEXPECTED_CHARACTER, start, pos,
          "Unexpected character " + quoteForMessage(src.substring(start, pos)));
    emit(TokenKind.ERROR, start);
  }

  private void lexWord(int start) {
    while (pos < src.length() && isIdentPart(src.charAt(pos))) {
      pos++;
    }
    String word = src.substring(start, pos);
    TokenKind kind = TokenKind.keyword(word);
    if (kind == TokenKind.VERSION) {
      if (sawSignificant) {
        kind = TokenKind.IDENT;
      } else {
        afterVersion = true;
      }
    }
    emit(kind == null ? TokenKind.IDENT : kind, start);
  }

  /**
   * Digits with an optional fraction and exponent.  Any identifier
   * characters directly following are absorbed into the same token,
   * e.g. 1GB, so the parser can report it as a malformed number.
   */
  private void lexNumber(int start) {
    boolean isFloat = false;
    if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      pos += 2;
    } else {
      while (isDigit(peek(0))) {
        pos++;
      }
      if (peek(0) == '.' && isDigit(peek(1))) {
        isFloat = true;
        pos++;
        while (isDigit(peek(0))) {
          pos++;
        }
      }
      if ((peek(0) == 'e' || peek(0) == 'E') &&
          (isDigit(peek(1)) ||
           ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
        isFloat = true;
        pos += 2;
        while (isDigit(peek(0))) {
          pos++;
        }
      }
    }
    while (pos < src.length() && isIdentPart(src.charAt(pos))) {
      pos++;
    }
    emit(isFloat ? TokenKind.FLOAT : TokenKind.INTEGER, start);
  }

  private TokenKind operator() {
    char c = peek(0);
    char d = peek(1);
    switch (c) {
      case '(': return TokenKind.LPAREN;
      case ')': return TokenKind.RPAREN;
      case '[': return TokenKind.LBRACKET;
      case ']': return TokenKind.RBRACKET;
      case ',': return TokenKind.COMMA;
      case ':': return TokenKind.COLON;
      case '.': return TokenKind.DOT;
      case '?': return TokenKind.QUESTION;
      case '+': return TokenKind.PLUS;
      case '-': return TokenKind.MINUS;
      case '*': return TokenKind.STAR;
      case '/': return TokenKind.SLASH;
      case '%': return TokenKind.PERCENT;
      case '=': return d == '=' ? TokenKind.EQ : TokenKind.ASSIGN;
      case '!': return d == '=' ? TokenKind.NEQ : TokenKind.NOT;
      case '<': return d == '=' ? TokenKind.LTE : TokenKind.LT;
      case '>': return d == '=' ? TokenKind.GTE : TokenKind.GT;
      case '&': return d == '&' ? TokenKind.AND : null;
      case '|': return d == '|' ? TokenKind.OR : null;
      default:
        return null;
    }
  }

  private static boolean isUnexpected(char c) {
    if (isWhitespace(c) || isIdentPart(c)) {
      return false;
    }
    switch (c) {
      case '#': case '"': case '\'': case '{': case '}':
      case '(': case ')': case '[': case ']': case ',': case ':': case '.':
      case '?': case '+': case '-': case '*': case '/': case '%': case '=':
      case '!': case '<': case '>':
        return false;
      default:
        return true;
    }
  }

  /* ---------------- string literals ---------------- */

  private void lexString() {
    int start = pos;
    Mode m = mode();
    char c = src.charAt(pos);

    if (c == m.quote) {
      pos++;
      emit(TokenKind.QUOTE, start);
      popMode();
      return;
    }
    if (c == '\n') {
      error(DiagnosticCode.UNTERMINATED_STRING, m.openOffset, pos,
            "Unterminated string literal");
      popMode();
      return;
    }
    if (isPlaceholderOpen(true)) {
      pos += 2;
      emit(TokenKind.PLACEHOLDER_OPEN, start);
      pushMode(ModeKind.PLACEHOLDER, start, '\0');
      return;
    }

    while (pos < src.length()) {
      c = src.charAt(pos);
      if (c == m.quote || c == '\n' || isPlaceholderOpen(true)) {
        break;
      }
      if (c == '\\') {
        lexEscape();
      } else {
        pos++;
      }
    }
    emit(TokenKind.STRING_TEXT, start);
  }

  /**
   * Consume one backslash escape, reporting it if invalid
   */
  private void lexEscape() {
    int start = pos;
    pos++; // backslash
    if (pos >= src.length()) {
      return;
    }
    char c = src.charAt(pos);
    switch (c) {
      case '\\': case 'n': case 't': case 'r': case '"': case '\'':
      case '~': case '$': case '{': case '}': case '\n':
        pos++;
        return;
      case 'x':
        pos++;
        expectDigits(start, 2, 16);
        return;
      case 'u':
        pos++;
        expectDigits(start, 4, 16);
        return;
      case 'U':
        pos++;
        expectDigits(start, 8, 16);
        return;
      default:
        if (c >= '0' && c <= '7') {
          expectDigits(start, 3, 8);
          return;
        }
        pos += Character.charCount(src.codePointAt(pos));
        error(DiagnosticCode.INVALID_ESCAPE, start, pos,
              "Invalid escape sequence " + src.substring(start, pos));
    }
  }

  private void expectDigits(int escapeStart, int count, int radix) {
    int n = 0;
    while (n < count && pos < src.length() &&
           Character.digit(src.charAt(pos), radix) >= 0) {
      pos++;
      n++;
    }
    if (n < count) {
      error(DiagnosticCode.INVALID_ESCAPE, escapeStart, pos,
            "Invalid escape sequence " + src.substring(escapeStart, pos) +
            ": expected " + count + " digits");
    }
  }

  /* ---------------- command bodies ---------------- */

  private void lexBraceCommand() {
    int start = pos;
    Mode m = mode();
    if (isPlaceholderOpen(true)) {
      pos += 2;
      emit(TokenKind.PLACEHOLDER_OPEN, start);
      pushMode(ModeKind.PLACEHOLDER, start, '\0');
      return;
    }
    if (src.charAt(pos) == '}' && m.depth == 0) {
      pos++;
      emit(TokenKind.COMMAND_CLOSE, start);
      popMode();
      return;
    }
    while (pos < src.length() && !isPlaceholderOpen(true)) {
      char c = src.charAt(pos);
      if (c == '}') {
        if (m.depth == 0) {
          break;
        }
        m.depth--;
      } else if (c == '{') {
        m.depth++;
      } else if (c == '\\' && pos + 1 < src.length()) {
        // Escaped character is literal shell text
        pos++;
      }
      pos++;
    }
    emit(TokenKind.COMMAND_TEXT, start);
  }

  private void lexHeredoc() {
    int start = pos;
    if (isPlaceholderOpen(false)) {
      pos += 2;
      emit(TokenKind.PLACEHOLDER_OPEN, start);
      pushMode(ModeKind.PLACEHOLDER, start, '\0');
      return;
    }
    if (lookingAt(">>>")) {
      pos += 3;
      emit(TokenKind.HEREDOC_CLOSE, start);
      popMode();
      return;
    }
    while (pos < src.length() && !isPlaceholderOpen(false) &&
           !lookingAt(">>>")) {
      if (src.charAt(pos) == '\\' && pos + 1 < src.length()) {
        pos++;
      }
      pos++;
    }
    emit(TokenKind.COMMAND_TEXT, start);
  }

  /**
   * @param allowDollar true if ${ opens a placeholder as well as ~{
   */
  private boolean isPlaceholderOpen(boolean allowDollar) {
    if (peek(1) != '{' || pos + 1 >= src.length()) {
      return false;
    }
    char c = peek(0);
    return c == '~' || (allowDollar && c == '$');
  }

  /**
   * Report every mode still open at the end of input, innermost first
   */
  private void closeModesAtEof() {
    while (modes.size() > 1) {
      Mode m = mode();
      switch (m.kind) {
        case STRING:
          error(DiagnosticCode.UNTERMINATED_STRING, m.openOffset, pos,
                "Unterminated string literal");
          break;
        case COMMAND_BRACE:
        case HEREDOC:
          error(DiagnosticCode.UNTERMINATED_COMMAND, m.openOffset, pos,
                "Unterminated command section");
          break;
        case PLACEHOLDER:
          error(DiagnosticCode.UNTERMINATED_PLACEHOLDER, m.openOffset, pos,
                "Unterminated placeholder");
          break;
        default:
          throw new IllegalStateException("Unexpected mode " + m.kind);
      }
      popMode();
    }
  }

  /* ---------------- character classes ---------------- */

  static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
  }

  static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isIdentStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c);
  }

  private static String quoteForMessage(String s) {
    return "'" + s + "'";
  }

  /**
   * Maps offsets to 1-based line and column numbers
   */
  static class LineMap {
    private final int[] lineStarts;
    private final int length;

    LineMap(String text) {
      int count = 1;
      for (int i = 0; i < text.length(); i++) {
        if (text.charAt(i) == '\n') {
          count++;
        }
      }
      lineStarts = new int[count];
      int line = 1;
      for (int i = 0; i < text.length(); i++) {
        if (text.charAt(i) == '\n') {
          lineStarts[line++] = i + 1;
        }
      }
      length = text.length();
    }

    int line(int offset) {
      int lo = 0;
      int hi = lineStarts.length - 1;
      while (lo < hi) {
        int mid = (lo + hi + 1) / 2;
        if (lineStarts[mid] <= offset) {
          lo = mid;
        } else {
          hi = mid - 1;
        }
      }
      return lo + 1;
    }

    int column(int offset, int line) {
      return offset - lineStarts[line - 1] + 1;
    }

    Span span(int start, int end) {
      assert(end <= length);
      int sl = line(start);
      int el = line(end);
      return new Span(start, end, sl, column(start, sl), el, column(end, el));
    }
  }
}
