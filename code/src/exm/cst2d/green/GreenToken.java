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

public class GreenToken extends GreenElement {

  private final String text;

  public GreenToken(int kind, String text) {
    super(kind);
    if (text == null) {
      throw new NullPointerException("text");
    }
    this.text = text;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public int textLength() {
    return text.length();
  }

  @Override
  public boolean isNode() {
    return false;
  }

  @Override
  public void appendText(StringBuilder sb) {
    sb.append(text);
  }

  @Override
  public int hashCode() {
    return 31 * kind + text.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof GreenToken))
      return false;
    GreenToken other = (GreenToken) obj;
    return kind == other.kind && text.equals(other.text);
  }

  @Override
  public String toString() {
    return Integer.toUnsignedString(kind) + "@\"" + text + "\"";
  }
}
