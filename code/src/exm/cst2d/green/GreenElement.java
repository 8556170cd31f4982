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
package exm.cst2d.green;

/**
 * Immutable, position-independent element of a green tree: either a
 * node or a token.  Elements hold raw kinds and may be shared between
 * trees through a {@link NodeCache}.
 */
public abstract class GreenElement {

  protected final int kind;

  protected GreenElement(int kind) {
    this.kind = kind;
  }

  /**
   * @return raw kind
   */
  public int kind() {
    return kind;
  }

  /**
   * @return length of the literal text covered, in chars
   */
  public abstract int textLength();

  public abstract boolean isNode();

  /**
   * Append the literal text of this element
   */
  public abstract void appendText(StringBuilder sb);

  public String text() {
    StringBuilder sb = new StringBuilder(textLength());
    appendText(sb);
    return sb.toString();
  }
}
