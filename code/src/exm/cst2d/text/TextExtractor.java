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
package exm.cst2d.text;

import exm.cst2d.build.IndentationStack;
import exm.cst2d.build.TextReconstructor;
import exm.cst2d.green.GreenElement;
import exm.cst2d.green.GreenNode;
import exm.cst2d.green.GreenToken;
import exm.cst2d.syntax.Syntax2D;

/**
 * Renders a finished green tree as indented text by replaying its
 * tokens, in order, through a fresh {@link TextReconstructor}.
 *
 * The result matches the builder's own output as long as indentation
 * was only changed through Indent and Dedent tokens, and newlines left
 * their indentation pending.
 */
public class TextExtractor {

  public static String extractText(GreenNode root) {
    return extractText(root, TextReconstructor.DEFAULT_LINE_TERMINATOR);
  }

  public static String extractText(GreenNode root, String lineTerminator) {
    TextReconstructor reconstructor =
        new TextReconstructor(new IndentationStack(), lineTerminator);
    walk(root, reconstructor);
    return reconstructor.output();
  }

  private static void walk(GreenNode node, TextReconstructor reconstructor) {
    for (GreenElement child: node.children()) {
      if (child.isNode()) {
        walk((GreenNode)child, reconstructor);
        continue;
      }
      GreenToken token = (GreenToken)child;
      switch (token.kind()) {
        case Syntax2D.RAW_INDENT:
          reconstructor.indent(token.text());
          break;
        case Syntax2D.RAW_DEDENT:
          reconstructor.dedent();
          break;
        case Syntax2D.RAW_NEWLINE:
          reconstructor.newline(false);
          break;
        default:
          reconstructor.text(token.text());
          break;
      }
    }
  }
}
