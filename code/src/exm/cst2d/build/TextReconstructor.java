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
package exm.cst2d.build;

import exm.cst2d.syntax.Syntax2D;

/**
 * Renders a token stream as indented text.
 *
 * Indentation is written lazily: a newline only marks indentation as
 * pending, and the next text token writes the indentation current at
 * that point.  Indents and dedents between a newline and the following
 * text therefore take effect on that text's line.
 *
 * Text content is appended as is.  Checking it for line breaks is up
 * to the caller.
 */
public class TextReconstructor {

  public static final String DEFAULT_LINE_TERMINATOR = "\n";

  private final IndentationStack stack;
  private final String lineTerminator;
  private final StringBuilder output = new StringBuilder();
  private boolean pendingIndentation = false;

  public TextReconstructor(IndentationStack stack) {
    this(stack, DEFAULT_LINE_TERMINATOR);
  }

  public TextReconstructor(IndentationStack stack, String lineTerminator) {
    this.stack = stack;
    this.lineTerminator = lineTerminator;
  }

  /**
   * Apply one token of the stream
   * @param kind
   * @param text token text: the fragment for indents, the content for
   *             text tokens, ignored otherwise
   */
  public void apply(Syntax2D<?> kind, String text) {
    switch (kind.tag()) {
      case INDENT:
        indent(text);
        break;
      case DEDENT:
        dedent();
        break;
      case NEWLINE:
        newline(false);
        break;
      case TEXT:
        text(text);
        break;
      default:
        throw new IllegalStateException("Unknown tag " + kind.tag());
    }
  }

  public void indent(String fragment) {
    stack.push(fragment);
  }

  /**
   * @return popped fragment, or null if there was no indentation
   */
  public String dedent() {
    return stack.pop();
  }

  /**
   * Write a line terminator.
   * @param withIndent if true write the current indentation right away,
   *        otherwise leave it pending for the next text token
   */
  public void newline(boolean withIndent) {
    output.append(lineTerminator);
    if (withIndent) {
      output.append(stack.current());
      pendingIndentation = false;
    } else {
      pendingIndentation = true;
    }
  }

  public void text(String content) {
    if (pendingIndentation) {
      output.append(stack.current());
      pendingIndentation = false;
    }
    output.append(content);
  }

  public boolean isPendingIndentation() {
    return pendingIndentation;
  }

  public String lineTerminator() {
    return lineTerminator;
  }

  public int length() {
    return output.length();
  }

  public String output() {
    return output.toString();
  }

  @Override
  public String toString() {
    return output();
  }
}
