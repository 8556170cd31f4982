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

import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;

/**
 * Node or token of a positioned tree.
 */
public abstract class SyntaxElement2D<S extends Syntax> {

  protected final SyntaxNode2D<S> parent;
  protected final int offset;

  protected SyntaxElement2D(SyntaxNode2D<S> parent, int offset) {
    this.parent = parent;
    this.offset = offset;
  }

  public abstract Syntax2D<S> kind();

  public abstract TextRange textRange();

  /**
   * @return literal text as recorded in the tree
   */
  public abstract String text();

  public abstract boolean isNode();

  /**
   * @return parent node, or null for the root
   */
  public SyntaxNode2D<S> parent() {
    return parent;
  }

  @SuppressWarnings("unchecked")
  public SyntaxNode2D<S> asNode() {
    return (SyntaxNode2D<S>)this;
  }

  @SuppressWarnings("unchecked")
  public SyntaxToken2D<S> asToken() {
    return (SyntaxToken2D<S>)this;
  }
}
