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
package exm.cst2d.syntax;

import exm.cst2d.common.exceptions.InvalidTokenTextException;

/**
 * Kinds of an indentation-aware syntax tree: the three control kinds
 * plus any caller kind wrapped as text.
 *
 * Control kinds take the three highest unsigned raw values so that
 * they can be recognised in a green tree without knowing the caller's
 * kind type.
 *
 * @param <S> caller kind type
 */
public final class Syntax2D<S extends Syntax> implements Syntax {

  public static enum Tag {
    /** Pushes its token text as an indentation fragment, e.g. "    " or "# " */
    INDENT,
    /** Pops the innermost indentation fragment */
    DEDENT,
    /** Line break; the only kind that may carry one */
    NEWLINE,
    /** Ordinary token of a caller kind.  Text must not contain line breaks */
    TEXT;
  }

  public static final int RAW_INDENT = 0xFFFFFFFD;
  public static final int RAW_DEDENT = 0xFFFFFFFE;
  public static final int RAW_NEWLINE = 0xFFFFFFFF;

  @SuppressWarnings("rawtypes")
  private static final Syntax2D INDENT = new Syntax2D(Tag.INDENT, null);
  @SuppressWarnings("rawtypes")
  private static final Syntax2D DEDENT = new Syntax2D(Tag.DEDENT, null);
  @SuppressWarnings("rawtypes")
  private static final Syntax2D NEWLINE = new Syntax2D(Tag.NEWLINE, null);

  private final Tag tag;
  private final S kind;

  private Syntax2D(Tag tag, S kind) {
    this.tag = tag;
    this.kind = kind;
  }

  @SuppressWarnings("unchecked")
  public static <S extends Syntax> Syntax2D<S> indent() {
    return INDENT;
  }

  @SuppressWarnings("unchecked")
  public static <S extends Syntax> Syntax2D<S> dedent() {
    return DEDENT;
  }

  @SuppressWarnings("unchecked")
  public static <S extends Syntax> Syntax2D<S> newline() {
    return NEWLINE;
  }

  /**
   * Wrap a caller kind
   * @throws InvalidTokenTextException if the raw value of the kind is
   *          reserved for a control kind
   */
  public static <S extends Syntax> Syntax2D<S> text(S kind) {
    if (kind == null) {
      throw new NullPointerException("kind");
    }
    if (isControlRaw(kind.toRaw())) {
      throw new InvalidTokenTextException("Raw value " +
          Integer.toUnsignedString(kind.toRaw()) + " of kind " + kind +
          " is reserved for indentation control kinds");
    }
    return new Syntax2D<S>(Tag.TEXT, kind);
  }

  public static boolean isControlRaw(int raw) {
    return raw == RAW_INDENT || raw == RAW_DEDENT || raw == RAW_NEWLINE;
  }

  /**
   * Decode a raw value: control kinds are recognised directly, anything
   * else is passed to the decoder.
   */
  public static <S extends Syntax> Syntax2D<S> fromRaw(int raw,
                                            SyntaxDecoder<S> decoder) {
    switch (raw) {
      case RAW_INDENT:
        return indent();
      case RAW_DEDENT:
        return dedent();
      case RAW_NEWLINE:
        return newline();
      default:
        return text(decoder.fromRaw(raw));
    }
  }

  public Tag tag() {
    return tag;
  }

  /**
   * @return wrapped caller kind, or null for control kinds
   */
  public S kind() {
    return kind;
  }

  public boolean isText() {
    return tag == Tag.TEXT;
  }

  @Override
  public int toRaw() {
    switch (tag) {
      case INDENT:
        return RAW_INDENT;
      case DEDENT:
        return RAW_DEDENT;
      case NEWLINE:
        return RAW_NEWLINE;
      default:
        return kind.toRaw();
    }
  }

  @Override
  public String staticText() {
    if (tag == Tag.TEXT) {
      return kind.staticText();
    }
    return null;
  }

  @Override
  public int hashCode() {
    return 31 * tag.hashCode() + (kind == null ? 0 : kind.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Syntax2D)) {
      return false;
    }
    Syntax2D<?> other = (Syntax2D<?>) obj;
    if (tag != other.tag)
      return false;
    if (kind == null)
      return other.kind == null;
    return kind.equals(other.kind);
  }

  @Override
  public String toString() {
    switch (tag) {
      case INDENT:
        return "Indent";
      case DEDENT:
        return "Dedent";
      case NEWLINE:
        return "Newline";
      default:
        return "Text(" + kind + ")";
    }
  }
}
