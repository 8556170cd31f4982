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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Interior node of a green tree.  Length and hash are computed once at
 * construction since nodes never change.
 */
public class GreenNode extends GreenElement {

  private final ImmutableList<GreenElement> children;
  private final int textLength;
  private final int hash;

  public GreenNode(int kind, List<? extends GreenElement> children) {
    super(kind);
    this.children = ImmutableList.copyOf(children);
    int len = 0;
    int h = kind;
    for (GreenElement child: this.children) {
      len += child.textLength();
      h = 31 * h + child.hashCode();
    }
    this.textLength = len;
    this.hash = h;
  }

  public ImmutableList<GreenElement> children() {
    return children;
  }

  public int childCount() {
    return children.size();
  }

  public GreenElement child(int i) {
    return children.get(i);
  }

  /**
   * @return number of tokens in this subtree
   */
  public int tokenCount() {
    int count = 0;
    for (GreenElement child: children) {
      if (child.isNode()) {
        count += ((GreenNode)child).tokenCount();
      } else {
        count++;
      }
    }
    return count;
  }

  /**
   * @return number of nodes in this subtree, including this one
   */
  public int nodeCount() {
    int count = 1;
    for (GreenElement child: children) {
      if (child.isNode()) {
        count += ((GreenNode)child).nodeCount();
      }
    }
    return count;
  }

  @Override
  public int textLength() {
    return textLength;
  }

  @Override
  public boolean isNode() {
    return true;
  }

  @Override
  public void appendText(StringBuilder sb) {
    for (GreenElement child: children) {
      child.appendText(sb);
    }
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof GreenNode))
      return false;
    GreenNode other = (GreenNode) obj;
    return kind == other.kind && hash == other.hash
        && children.equals(other.children);
  }

  @Override
  public String toString() {
    return Integer.toUnsignedString(kind) + "@" + textLength + children;
  }
}
