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

import java.util.ArrayList;
import java.util.List;

import exm.cst2d.common.exceptions.CSTRuntimeError;
import exm.cst2d.common.exceptions.UnbalancedNodeException;
import exm.cst2d.syntax.Syntax;

/**
 * Builds a green tree bottom-up from a stream of start node, token and
 * finish node events.
 *
 * Children of all open nodes are kept on one flat list; each open node
 * remembers where its children begin.
 *
 * @param <K> kind type
 */
public class GreenNodeBuilder<K extends Syntax> {

  private final NodeCache cache;
  private final boolean ownsCache;

  /** Open nodes: kind and index of first child in children */
  private final List<int[]> parents = new ArrayList<int[]>();
  private final List<GreenElement> children = new ArrayList<GreenElement>();

  public GreenNodeBuilder() {
    this.cache = new NodeCache();
    this.ownsCache = true;
  }

  /**
   * Builder that deduplicates through a shared cache
   * @param cache
   */
  public GreenNodeBuilder(NodeCache cache) {
    if (cache == null) {
      throw new NullPointerException("cache");
    }
    this.cache = cache;
    this.ownsCache = false;
  }

  public NodeCache cache() {
    return cache;
  }

  /**
   * @return true if the cache was created by this builder
   */
  public boolean ownsCache() {
    return ownsCache;
  }

  public void startNode(K kind) {
    parents.add(new int[] {kind.toRaw(), children.size()});
  }

  public void finishNode() {
    if (parents.isEmpty()) {
      throw new UnbalancedNodeException("finishNode() called with no open node");
    }
    int[] parent = parents.remove(parents.size() - 1);
    List<GreenElement> nodeChildren = children.subList(parent[1],
                                                       children.size());
    GreenNode node = cache.node(parent[0], new ArrayList<GreenElement>(
                                                            nodeChildren));
    nodeChildren.clear();
    children.add(node);
  }

  public void token(K kind, String text) {
    children.add(cache.token(kind.toRaw(), text));
  }

  /**
   * Add a token whose text is fixed by its kind
   */
  public void staticToken(K kind) {
    String text = kind.staticText();
    if (text == null) {
      throw new CSTRuntimeError("Kind " + kind + " has no static text");
    }
    token(kind, text);
  }

  /**
   * @return number of currently open nodes
   */
  public int depth() {
    return parents.size();
  }

  /**
   * @return the single root node
   * @throws UnbalancedNodeException if nodes are still open, or the
   *       builder does not hold exactly one finished root node
   */
  public GreenNode finish() {
    if (!parents.isEmpty()) {
      throw new UnbalancedNodeException("finish() called with " +
                              parents.size() + " unfinished node(s)");
    }
    if (children.size() != 1 || !children.get(0).isNode()) {
      throw new UnbalancedNodeException("Expected a single root node " +
          "but found " + children.size() + " top-level element(s)");
    }
    return (GreenNode)children.remove(0);
  }
}
