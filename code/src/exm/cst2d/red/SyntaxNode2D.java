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
package exm.cst2d.red;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.cst2d.build.TextReconstructor;
import exm.cst2d.green.GreenElement;
import exm.cst2d.green.GreenNode;
import exm.cst2d.green.GreenToken;
import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;
import exm.cst2d.syntax.SyntaxDecoder;
import exm.cst2d.text.TextExtractor;

/**
 * Positioned view of a green node: knows its parent and its offset in
 * the literal text of the whole tree.  Children are created on first
 * access.
 *
 * {@link #toString()} gives the indented text the tree represents,
 * with the line terminator the view was created with;
 * {@link #text()} gives the literal text.
 */
public class SyntaxNode2D<S extends Syntax> extends SyntaxElement2D<S> {

  private final GreenNode green;
  private final SyntaxDecoder<S> decoder;
  private final String lineTerminator;
  private List<SyntaxElement2D<S>> children = null;

  private SyntaxNode2D(GreenNode green, SyntaxNode2D<S> parent, int offset,
                       SyntaxDecoder<S> decoder, String lineTerminator) {
    super(parent, offset);
    this.green = green;
    this.decoder = decoder;
    this.lineTerminator = lineTerminator;
  }

  public static <S extends Syntax> SyntaxNode2D<S> createRoot(
                          GreenNode root, SyntaxDecoder<S> decoder) {
    return createRoot(root, decoder,
                      TextReconstructor.DEFAULT_LINE_TERMINATOR);
  }

  /**
   * @param lineTerminator written for each newline by {@link #toString()}
   */
  public static <S extends Syntax> SyntaxNode2D<S> createRoot(
      GreenNode root, SyntaxDecoder<S> decoder, String lineTerminator) {
    return new SyntaxNode2D<S>(root, null, 0, decoder, lineTerminator);
  }

  @Override
  public Syntax2D<S> kind() {
    return Syntax2D.fromRaw(green.kind(), decoder);
  }

  @Override
  public TextRange textRange() {
    return TextRange.at(offset, green.textLength());
  }

  @Override
  public String text() {
    return green.text();
  }

  @Override
  public boolean isNode() {
    return true;
  }

  public GreenNode green() {
    return green;
  }

  SyntaxDecoder<S> decoder() {
    return decoder;
  }

  public List<SyntaxElement2D<S>> childrenWithTokens() {
    if (children == null) {
      List<SyntaxElement2D<S>> result =
          new ArrayList<SyntaxElement2D<S>>(green.childCount());
      int childOffset = offset;
      for (GreenElement child: green.children()) {
        if (child.isNode()) {
          result.add(new SyntaxNode2D<S>((GreenNode)child, this,
                                         childOffset, decoder,
                                         lineTerminator));
        } else {
          result.add(new SyntaxToken2D<S>((GreenToken)child, this,
                                          childOffset));
        }
        childOffset += child.textLength();
      }
      children = Collections.unmodifiableList(result);
    }
    return children;
  }

  /**
   * @return child nodes, skipping tokens
   */
  public List<SyntaxNode2D<S>> children() {
    List<SyntaxNode2D<S>> result = new ArrayList<SyntaxNode2D<S>>();
    for (SyntaxElement2D<S> child: childrenWithTokens()) {
      if (child.isNode()) {
        result.add(child.asNode());
      }
    }
    return result;
  }

  /**
   * @return all tokens in this subtree in text order
   */
  public List<SyntaxToken2D<S>> tokens() {
    List<SyntaxToken2D<S>> result = new ArrayList<SyntaxToken2D<S>>();
    addTokens(result);
    return result;
  }

  private void addTokens(List<SyntaxToken2D<S>> result) {
    for (SyntaxElement2D<S> child: childrenWithTokens()) {
      if (child.isNode()) {
        child.asNode().addTokens(result);
      } else {
        result.add(child.asToken());
      }
    }
  }

  /**
   * Dump of the tree structure, one element per line
   * @param recursive if false only describe this node
   */
  public String debug(boolean recursive) {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0, recursive);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent, boolean recursive) {
    indent(writer, indent);
    writer.println(kind() + "@" + textRange());
    if (!recursive)
      return;
    for (SyntaxElement2D<S> child: childrenWithTokens()) {
      if (child.isNode()) {
        child.asNode().printTree(writer, indent + 2, true);
      } else {
        indent(writer, indent + 2);
        writer.println(child + " \"" +
              escape(child.text()) + "\"");
      }
    }
  }

  private static String escape(String text) {
    return StringUtils.replaceEach(text,
        new String[] {"\\", "\"", "\r", "\n", "\t"},
        new String[] {"\\\\", "\\\"", "\\r", "\\n", "\\t"});
  }

  private static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  @Override
  public String toString() {
    return TextExtractor.extractText(green, lineTerminator);
  }
}
