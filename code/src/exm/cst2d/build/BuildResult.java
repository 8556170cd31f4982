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

import exm.cst2d.green.GreenNode;
import exm.cst2d.green.NodeCache;

/**
 * Everything a finished builder produces.
 */
public class BuildResult {
  /** Root of the green tree, holding the literal token text */
  public final GreenNode root;
  /** Cache created by the builder, or null if the caller supplied one */
  public final NodeCache cache;
  /** Reconstructed, indented text */
  public final String text;

  public BuildResult(GreenNode root, NodeCache cache, String text) {
    this.root = root;
    this.cache = cache;
    this.text = text;
  }

  @Override
  public String toString() {
    return text;
  }
}
