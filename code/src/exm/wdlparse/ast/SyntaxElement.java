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
package exm.wdlparse.ast;

import java.util.List;

import exm.wdlparse.common.exceptions.WdlRuntimeError;

/**
 * A child of a syntax node: either a nested node or a token
 */
public abstract class SyntaxElement {

  public abstract Span getSpan();

  public abstract boolean isToken();

  /**
   * @return the exact source text covered by this element
   */
  public abstract String getText();

  /**
   * Append all tokens under this element, in source order
   */
  public abstract void collectTokens(List<Token> out);

  public Token asToken() {
    if (!isToken()) {
      throw new WdlRuntimeError("Not a token: " + this);
    }
    return (Token)this;
  }

  public SyntaxNode asNode() {
    if (isToken()) {
      throw new WdlRuntimeError("Not a node: " + this);
    }
    return (SyntaxNode)this;
  }
}
