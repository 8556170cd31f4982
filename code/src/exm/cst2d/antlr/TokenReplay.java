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
import org.antlr.runtime.TokenSource;
import org.apache.log4j.Logger;

import exm.cst2d.build.Builder2D;
import exm.cst2d.common.Logging;
import exm.cst2d.common.exceptions.InvalidTokenTextException;
import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;

/**
 * Feeds the tokens of an ANTLR lexer into a {@link Builder2D}.
 *
 * Only tokens are replayed: the caller opens and closes nodes around
 * the replay, or between replays of parts of the stream.
 */
public class TokenReplay<S extends Syntax> {

  private static final Logger logger = Logging.getLogger();

  private final Builder2D<S> builder;
  private final TokenKindMap<S> kinds;

  public TokenReplay(Builder2D<S> builder, TokenKindMap<S> kinds) {
    this.builder = builder;
    this.kinds = kinds;
  }

  /**
   * Replay tokens until end of input
   * @return number of tokens added to the builder
   * @throws InvalidTokenTextException with the token position if a
   *        token's text is rejected
   */
  public int replay(TokenSource source) {
    int fed = 0;
    int skipped = 0;
    for (Token token = source.nextToken(); token.getType() != Token.EOF;
         token = source.nextToken()) {
      Syntax2D<S> kind = kinds.kindOf(token);
      if (kind == null) {
        skipped++;
        continue;
      }
      String text = token.getText();
      try {
        builder.token(kind, text == null ? "" : text);
      } catch (InvalidTokenTextException e) {
        throw new InvalidTokenTextException(source.getSourceName(),
            token.getLine(), token.getCharPositionInLine(), e.getMessage(),
            e);
      }
      fed++;
    }
    logger.debug("Replayed " + fed + " tokens from " +
                 source.getSourceName() + ", skipped " + skipped);
    return fed;
  }
}
