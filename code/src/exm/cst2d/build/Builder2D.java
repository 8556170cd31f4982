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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.cst2d.common.Logging;
import exm.cst2d.common.Settings;
import exm.cst2d.common.exceptions.BuilderFinishedException;
import exm.cst2d.common.exceptions.CSTRuntimeError;
import exm.cst2d.common.exceptions.InvalidOptionException;
import exm.cst2d.common.exceptions.InvalidTokenTextException;
import exm.cst2d.green.GreenNode;
import exm.cst2d.green.GreenNodeBuilder;
import exm.cst2d.green.NodeCache;
import exm.cst2d.red.SyntaxNode2D;
import exm.cst2d.syntax.Syntax;
import exm.cst2d.syntax.Syntax2D;
import exm.cst2d.syntax.SyntaxDecoder;

/**
 * Builds an indentation-aware syntax tree and, at the same time, the
 * indented text that the tree represents.
 *
 * Every token goes both into the green tree, with its literal text,
 * and through a {@link TextReconstructor}:
 * <ul>
 * <li>text tokens are written, preceded by the current indentation if
 *     a newline came before them</li>
 * <li>indent tokens push their text onto the indentation stack</li>
 * <li>dedent tokens pop the stack; on an empty stack this does nothing</li>
 * <li>newline tokens write the line terminator whatever their literal
 *     text, and leave indentation pending</li>
 * </ul>
 *
 * The indentation recorded in the tree is relative, so the tree stays
 * the same when a whole block is shifted left or right.
 *
 * Note the difference between the two ways of changing indentation:
 * {@code token(Syntax2D.indent(), f)} and {@code token(Syntax2D.dedent(), "")}
 * record an Indent or Dedent token in the tree, while {@link #indent(String)}
 * and {@link #dedent()} only change the indentation stack and leave no
 * trace in the tree.
 *
 * Line breaks are only written by newlines: text tokens and indentation
 * fragments that contain one are rejected, unless the settings allow
 * them, in which case they are written as they are with a warning.
 *
 * Once {@link #finish()} has been called the builder only answers
 * queries: anything that would change it throws
 * {@link BuilderFinishedException}.
 *
 * @param <S> caller kind type
 */
public class Builder2D<S extends Syntax> {

  private static final Logger logger = Logging.getLogger();

  private final GreenNodeBuilder<Syntax2D<S>> inner;
  private final IndentationStack stack = new IndentationStack();
  private final TextReconstructor reconstructor;

  /** Whether text tokens with line breaks are rejected */
  private final boolean rejectLineBreaks;

  /** Warnings this builder has logged */
  private final Set<Pair<Level, String>> emitted =
      new HashSet<Pair<Level, String>>();

  private boolean finished = false;

  public Builder2D() {
    this(new GreenNodeBuilder<Syntax2D<S>>(), true,
         TextReconstructor.DEFAULT_LINE_TERMINATOR);
  }

  /**
   * Builder that deduplicates tree elements through a shared cache.
   * {@link #finish()} will not return the cache.
   */
  public Builder2D(NodeCache cache) {
    this(new GreenNodeBuilder<Syntax2D<S>>(cache), true,
         TextReconstructor.DEFAULT_LINE_TERMINATOR);
  }

  public Builder2D(Settings settings) throws InvalidOptionException {
    this(new GreenNodeBuilder<Syntax2D<S>>(),
         settings.getBoolean(Settings.REJECT_LINE_BREAKS),
         settings.lineTerminator());
  }

  public Builder2D(NodeCache cache, Settings settings)
                                    throws InvalidOptionException {
    this(new GreenNodeBuilder<Syntax2D<S>>(cache),
         settings.getBoolean(Settings.REJECT_LINE_BREAKS),
         settings.lineTerminator());
  }

  private Builder2D(GreenNodeBuilder<Syntax2D<S>> inner,
                    boolean rejectLineBreaks, String lineTerminator) {
    this.inner = inner;
    this.rejectLineBreaks = rejectLineBreaks;
    this.reconstructor = new TextReconstructor(stack, lineTerminator);
    if (logger.isDebugEnabled()) {
      logger.debug("New builder: shared cache=" + !inner.ownsCache() +
          " rejectLineBreaks=" + rejectLineBreaks + " lineTerminator=" +
          escapeLineBreaks(lineTerminator));
    }
  }

  public void startNode(S kind) {
    checkOpen("start node");
    inner.startNode(Syntax2D.text(kind));
  }

  public void finishNode() {
    checkOpen("finish node");
    inner.finishNode();
  }

  /**
   * Add a text token of a caller kind
   */
  public void token(S kind, String text) {
    token(Syntax2D.text(kind), text);
  }

  /**
   * Add a token of any kind.  See class comment for the effect of each
   * kind on the reconstructed text.
   * @throws InvalidTokenTextException if a text or indent token
   *          contains a line break and line breaks are rejected
   */
  public void token(Syntax2D<S> kind, String text) {
    checkOpen("add token");
    if (kind.isText() || kind.tag() == Syntax2D.Tag.INDENT) {
      checkText(kind + " token", text);
    }
    if (logger.isTraceEnabled()) {
      logger.trace("token " + kind + " \"" +
                   StringUtils.abbreviate(escapeLineBreaks(text), 40) + "\"");
    }
    inner.token(kind, text);
    if (kind.tag() == Syntax2D.Tag.DEDENT && stack.isEmpty()) {
      logger.debug("Dedent token with no indentation: ignored");
    }
    reconstructor.apply(kind, text);
  }

  /**
   * Add a token of a caller kind that has fixed text
   */
  public void staticToken(S kind) {
    checkOpen("add token");
    Syntax2D<S> kind2D = Syntax2D.text(kind);
    String text = kind.staticText();
    if (text == null) {
      throw new CSTRuntimeError("Kind " + kind + " has no static text");
    }
    checkText(kind2D + " token", text);
    inner.staticToken(kind2D);
    reconstructor.text(text);
  }

  /**
   * Push an indentation fragment without adding a token to the tree.
   * @throws InvalidTokenTextException if the fragment contains a line
   *          break and line breaks are rejected
   */
  public void indent(String fragment) {
    checkOpen("indent");
    checkText("indentation fragment", fragment);
    reconstructor.indent(fragment);
  }

  /**
   * Pop the innermost indentation fragment without adding a token to
   * the tree.  Does nothing if there is no indentation.
   */
  public void dedent() {
    checkOpen("dedent");
    if (reconstructor.dedent() == null) {
      logger.debug("Dedent with no indentation: ignored");
    }
  }

  /**
   * Pop several indentation fragments, as {@link #dedent()}
   */
  public void dedents(int count) {
    for (int i = 0; i < count; i++) {
      dedent();
    }
  }

  /**
   * Start a new line, indenting lazily
   */
  public void newline() {
    newline(false);
  }

  /**
   * Start a new line.  A Newline token is always added to the tree.
   * @param withIndent if true write the current indentation now,
   *       otherwise write it just before the next text token
   */
  public void newline(boolean withIndent) {
    checkOpen("add newline");
    inner.token(Syntax2D.<S>newline(), reconstructor.lineTerminator());
    reconstructor.newline(withIndent);
  }

  public String currentIndentation() {
    return stack.current();
  }

  public int indentationLevel() {
    return stack.depth();
  }

  /**
   * @return read-only view of the indentation fragments, outermost first
   */
  public List<String> indentationStack() {
    return stack.fragments();
  }

  /**
   * Drop all indentation.  Text already written is not changed.
   */
  public void clearIndentation() {
    checkOpen("clear indentation");
    stack.clear();
  }

  /**
   * @return text reconstructed so far
   */
  public String textOutput() {
    return reconstructor.output();
  }

  /**
   * @return number of nodes currently open
   */
  public int nodeDepth() {
    return inner.depth();
  }

  public boolean isFinished() {
    return finished;
  }

  /**
   * Finish the tree.  The builder can't be changed afterwards.
   * @throws exm.cst2d.common.exceptions.UnbalancedNodeException if the
   *          nodes do not form a single complete tree
   */
  public BuildResult finish() {
    checkOpen("finish");
    GreenNode root = inner.finish();
    finished = true;
    String text = reconstructor.output();
    if (logger.isDebugEnabled()) {
      logger.debug("Finished tree: " + root.nodeCount() + " nodes, " +
                   root.tokenCount() + " tokens, " + text.length() +
                   " chars of text");
    }
    return new BuildResult(root, inner.ownsCache() ? inner.cache() : null,
                           text);
  }

  /**
   * Finish the tree and return a positioned view of its root
   */
  public SyntaxNode2D<S> red(SyntaxDecoder<S> decoder) {
    BuildResult result = finish();
    return SyntaxNode2D.createRoot(result.root, decoder,
                                   reconstructor.lineTerminator());
  }

  private void checkText(String what, String text) {
    if (!StringUtils.containsAny(text, '\n', '\r')) {
      return;
    }
    String msg = "Line break in " + what + ": use a newline token";
    if (rejectLineBreaks) {
      throw new InvalidTokenTextException(msg);
    }
    Logging.uniqueWarn(emitted, msg);
  }

  private static String escapeLineBreaks(String s) {
    return StringUtils.replaceEach(s, new String[] {"\r", "\n"},
                                   new String[] {"\\r", "\\n"});
  }

  private void checkOpen(String operation) {
    if (finished) {
      throw new BuilderFinishedException(operation);
    }
  }
}
