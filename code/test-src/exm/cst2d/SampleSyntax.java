package exm.cst2d;

import exm.cst2d.syntax.EnumSyntaxDecoder;
import exm.cst2d.syntax.Syntax;

/**
 * Kinds used across the tests
 */
public enum SampleSyntax implements Syntax {
  ROOT,
  BLOCK,
  TEXT,
  COLON;

  public static final EnumSyntaxDecoder<SampleSyntax> DECODER =
                          EnumSyntaxDecoder.create(SampleSyntax.class);

  @Override
  public int toRaw() {
    return ordinal();
  }

  @Override
  public String staticText() {
    if (this == COLON) {
      return ":";
    }
    return null;
  }
}
