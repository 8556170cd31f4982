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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stack of indentation fragments, innermost on top.  The current
 * indentation is the concatenation of all fragments, outermost first.
 *
 * Popping an empty stack does nothing: partial or truncated token
 * streams must not break the builder.
 */
public class IndentationStack {

  private final ArrayList<String> fragments = new ArrayList<String>();

  public void push(String fragment) {
    if (fragment == null) {
      throw new NullPointerException("fragment");
    }
    fragments.add(fragment);
  }

  /**
   * @return the removed fragment, or null if the stack was empty
   */
  public String pop() {
    if (fragments.isEmpty()) {
      return null;
    }
    return fragments.remove(fragments.size() - 1);
  }

  public String current() {
    if (fragments.size() == 1) {
      return fragments.get(0);
    }
    StringBuilder sb = new StringBuilder();
    for (String fragment: fragments) {
      sb.append(fragment);
    }
    return sb.toString();
  }

  public int depth() {
    return fragments.size();
  }

  public boolean isEmpty() {
    return fragments.isEmpty();
  }

  public void clear() {
    fragments.clear();
  }

  /**
   * @return read-only view of the fragments, outermost first
   */
  public List<String> fragments() {
    return Collections.unmodifiableList(fragments);
  }

  @Override
  public String toString() {
    return fragments.toString();
  }
}
