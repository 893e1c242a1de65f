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
package exm.wdlparse.ui;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxElement;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.deps.DependencyAnalyzer;
import exm.wdlparse.deps.DependencyGraph;
import exm.wdlparse.diagram.DiagramBuilder;
import exm.wdlparse.diagram.DiagramGraph;
import exm.wdlparse.frontend.ReferenceChecker;
import exm.wdlparse.frontend.TreeWalker;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.info.DocumentInfo;
import exm.wdlparse.info.InfoBuilder;
import exm.wdlparse.parser.WdlParser;

/**
 * Entry point: runs the lexer, parser, extractor and reference checker
 * over a document and answers queries on the result.
 *
 * Holds only immutable settings, so one instance can serve several
 * threads at once.
 */
public class WdlParse {

  private static final Logger logger = Logging.getWdlLogger();

  private final Settings settings;

  public WdlParse() {
    this(Settings.defaults());
  }

  public WdlParse(Settings settings) {
    this.settings = settings;
  }

  public Settings getSettings() {
    return settings;
  }

  public ParseResult parse(String text) {
    Diagnostics diagnostics = new Diagnostics(settings);
    SyntaxNode tree = WdlParser.parse(text, diagnostics);
    Document doc = TreeWalker.walk(tree, diagnostics);
    ReferenceChecker.check(doc, diagnostics);
    ParseResult result = new ParseResult(tree, doc, diagnostics);
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + text.length() + " chars: " + result);
    }
    return result;
  }

  /**
   * Decode strictly as UTF-8, then parse.  Undecodable input gives an
   * empty tree and a single unsupported-encoding error.
   */
  public ParseResult parse(byte[] utf8) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
    String text;
    try {
      CharBuffer chars = decoder.decode(ByteBuffer.wrap(utf8));
      text = chars.toString();
    } catch (CharacterCodingException e) {
      logger.debug("Input is not valid UTF-8: " + e);
      Diagnostics diagnostics = new Diagnostics(settings);
      Span start = Span.point(0, 1, 1);
      diagnostics.add(DiagnosticCode.UNSUPPORTED_ENCODING, start,
                      "Input is not valid UTF-8");
      SyntaxNode empty = new SyntaxNode(SyntaxKind.DOCUMENT,
                            new ArrayList<SyntaxElement>(), start);
      return new ParseResult(empty, Document.empty(), diagnostics);
    }
    return parse(text);
  }

  public DocumentInfo info(Document doc) {
    return InfoBuilder.build(doc);
  }

  public DependencyGraph dependencyGraph(Document doc) {
    return new DependencyAnalyzer(settings).analyze(doc);
  }

  public DiagramGraph diagram(Document doc) {
    return new DiagramBuilder().build(doc, dependencyGraph(doc));
  }
}
