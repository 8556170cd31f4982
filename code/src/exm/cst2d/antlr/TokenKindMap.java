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
package exm.cst2d.antlr;

import org.antlr.runtime.Token;

import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;

/**
 * Decides how a lexer token is recorded in an indentation-aware tree.
 */
public interface TokenKindMap<S extends Syntax> {

  /**
   * @return kind to record the token as, or null to skip it
   */
  public Syntax2D<S> kindOf(Token token);
}
