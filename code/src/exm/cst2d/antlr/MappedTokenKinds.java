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

import java.util.HashMap;
import java.util.Map;

import org.antlr.runtime.Token;

import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;

/**
 * Table from ANTLR token types to kinds.  Token types not in the table
 * map to the default kind, if one is set, and are skipped otherwise.
 * Tokens off the default channel are skipped unless
 * {@link #includeHidden(boolean)} is set.
 */
public class MappedTokenKinds<S extends Syntax> implements TokenKindMap<S> {

  private final Map<Integer, Syntax2D<S>> kinds =
                                new HashMap<Integer, Syntax2D<S>>();
  private Syntax2D<S> defaultKind = null;
  private boolean includeHidden = false;

  public MappedTokenKinds<S> text(int tokenType, S kind) {
    kinds.put(tokenType, Syntax2D.text(kind));
    return this;
  }

  public MappedTokenKinds<S> indent(int tokenType) {
    kinds.put(tokenType, Syntax2D.<S>indent());
    return this;
  }

  public MappedTokenKinds<S> dedent(int tokenType) {
    kinds.put(tokenType, Syntax2D.<S>dedent());
    return this;
  }

  public MappedTokenKinds<S> newline(int tokenType) {
    kinds.put(tokenType, Syntax2D.<S>newline());
    return this;
  }

  public MappedTokenKinds<S> otherwise(S kind) {
    defaultKind = kind == null ? null : Syntax2D.text(kind);
    return this;
  }

  public MappedTokenKinds<S> includeHidden(boolean include) {
    includeHidden = include;
    return this;
  }

  @Override
  public Syntax2D<S> kindOf(Token token) {
    if (!includeHidden && token.getChannel() != Token.DEFAULT_CHANNEL) {
      return null;
    }
    Syntax2D<S> kind = kinds.get(token.getType());
    if (kind == null) {
      return defaultKind;
    }
    return kind;
  }
}
