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

import exm.cst2d.green.GreenToken;
import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;

public class SyntaxToken2D<S extends Syntax> extends SyntaxElement2D<S> {

  private final GreenToken green;

  SyntaxToken2D(GreenToken green, SyntaxNode2D<S> parent, int offset) {
    super(parent, offset);
    this.green = green;
  }

  @Override
  public Syntax2D<S> kind() {
    return Syntax2D.fromRaw(green.kind(), parent.decoder());
  }

  @Override
  public String text() {
    return green.text();
  }

  @Override
  public TextRange textRange() {
    return TextRange.at(offset, green.textLength());
  }

  @Override
  public boolean isNode() {
    return false;
  }

  public GreenToken green() {
    return green;
  }

  @Override
  public String toString() {
    return kind() + "@" + textRange();
  }
}
