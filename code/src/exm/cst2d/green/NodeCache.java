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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Deduplicates green tokens and small green nodes, so that identical
 * subtrees built by one or several builders share one instance.
 *
 * The interners tolerate concurrent use, so one cache may be shared
 * by builders running on different threads.
 */
public class NodeCache {

  /** Nodes with more children than this are not deduplicated */
  static final int MAX_CACHED_CHILDREN = 3;

  private final Interner<GreenToken> tokens = Interners.newWeakInterner();
  private final Interner<GreenNode> nodes = Interners.newWeakInterner();

  public GreenToken token(int kind, String text) {
    return tokens.intern(new GreenToken(kind, text));
  }

  public GreenNode node(int kind, List<GreenElement> children) {
    GreenNode node = new GreenNode(kind, children);
    if (children.size() > MAX_CACHED_CHILDREN) {
      return node;
    }
    return nodes.intern(node);
  }
}
