package exm.cst2d.build;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.cst2d.SampleSyntax;
import exm.cst2d.common.Logging;
import exm.cst2d.common.Settings;
import exm.cst2d.common.exceptions.BuilderFinishedException;
import exm.cst2d.common.exceptions.CSTRuntimeError;
import exm.cst2d.common.exceptions.InvalidTokenTextException;
import exm.cst2d.common.exceptions.UnbalancedNodeException;
import exm.cst2d.green.GreenNode;
import exm.cst2d.green.GreenToken;
import exm.cst2d.green.NodeCache;
import exm.cst2d.syntax.Syntax2D;

public class Builder2DTest {

  private static final Syntax2D<SampleSyntax> INDENT = Syntax2D.indent();
  private static final Syntax2D<SampleSyntax> DEDENT = Syntax2D.dedent();
  private static final Syntax2D<SampleSyntax> NEWLINE = Syntax2D.newline();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Builder2D<SampleSyntax> rootBuilder() {
    Builder2D<SampleSyntax> builder = new Builder2D<SampleSyntax>();
    builder.startNode(SampleSyntax.ROOT);
    return builder;
  }

  private static void text(Builder2D<SampleSyntax> builder, String text) {
    builder.token(SampleSyntax.TEXT, text);
  }

  @Test
  public void testBasicIndentation() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "line1");
    builder.token(NEWLINE, "\n");
    builder.token(INDENT, "    ");
    text(builder, "indented");
    builder.token(NEWLINE, "\n");
    text(builder, "still_indented");
    builder.token(DEDENT, "");
    builder.finishNode();

    BuildResult result = builder.finish();
    assertEquals("line1\n    indented\n    still_indented", result.text);
    assertEquals(7, result.root.childCount());
    assertEquals("Tree keeps literal text",
                 "line1\n    indented\nstill_indented", result.root.text());
  }

  @Test
  public void testSameLineTokens() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "hello");
    text(builder, " ");
    text(builder, "world");
    builder.finishNode();
    assertEquals("hello world", builder.finish().text);
  }

  @Test
  public void testNestedIndentation() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "start");
    builder.newline();
    builder.token(INDENT, "  ");
    text(builder, "level1");
    builder.newline();
    builder.token(INDENT, "  ");
    text(builder, "level2");
    builder.newline();
    text(builder, "still_level2");
    builder.token(DEDENT, "");
    builder.newline();
    text(builder, "back_to_level1");
    builder.token(DEDENT, "");
    builder.newline();
    text(builder, "end");
    builder.finishNode();

    assertEquals("start\n" +
                 "  level1\n" +
                 "    level2\n" +
                 "    still_level2\n" +
                 "  back_to_level1\n" +
                 "end", builder.finish().text);
  }

  @Test
  public void testMixedIndentationStyles() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "start");
    builder.token(NEWLINE, "\n");
    builder.token(INDENT, "    ");
    builder.token(INDENT, "# ");
    assertEquals("    # ", builder.currentIndentation());
    text(builder, "c");
    assertTrue(builder.textOutput().endsWith("    # c"));

    builder.token(DEDENT, "");
    builder.token(DEDENT, "");
    assertEquals("", builder.currentIndentation());
    builder.finishNode();
    assertEquals("start\n    # c", builder.finish().text);
  }

  @Test
  public void testCurrentIndentationFollowsStack() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    List<String> fragments = Arrays.asList("\t", "  ", "// ", "    ");
    StringBuilder expected = new StringBuilder();
    for (String f: fragments) {
      builder.token(INDENT, f);
      expected.append(f);
      assertEquals(expected.toString(), builder.currentIndentation());
    }
    assertEquals(4, builder.indentationLevel());
    assertEquals(fragments, builder.indentationStack());

    builder.token(DEDENT, "");
    assertEquals("\t  // ", builder.currentIndentation());
  }

  @Test
  public void testDedentOnEmptyStack() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    builder.dedent();
    builder.token(DEDENT, "");
    builder.dedents(3);
    assertEquals(0, builder.indentationLevel());
    assertEquals("", builder.currentIndentation());

    builder.token(INDENT, "  ");
    assertEquals(1, builder.indentationLevel());
  }

  @Test
  public void testIndentationChangeAfterNewline() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    builder.token(INDENT, "    ");
    text(builder, "a");
    builder.token(NEWLINE, "\n");
    builder.token(DEDENT, "");
    builder.token(INDENT, "\t");
    text(builder, "b");
    assertEquals("a\n\tb", builder.textOutput());
  }

  @Test
  public void testConvenienceIndentNotInTree() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "a");
    builder.newline();
    builder.indent("  ");
    text(builder, "b");
    builder.dedent();
    builder.finishNode();
    BuildResult result = builder.finish();

    assertEquals("a\n  b", result.text);
    assertEquals("Only text and newline tokens", 3, result.root.childCount());
    for (int i = 0; i < result.root.childCount(); i++) {
      int kind = result.root.child(i).kind();
      assertFalse(kind == Syntax2D.RAW_INDENT || kind == Syntax2D.RAW_DEDENT);
    }
  }

  @Test
  public void testNewlineAlwaysInTree() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    builder.indent("  ");
    text(builder, "a");
    builder.newline(true);
    assertEquals("a\n  ", builder.textOutput());
    text(builder, "b");
    builder.newline(false);
    builder.finishNode();
    BuildResult result = builder.finish();

    assertEquals("a\n  b\n", result.text);
    GreenNode root = result.root;
    assertEquals(4, root.childCount());
    assertEquals(Syntax2D.RAW_NEWLINE, root.child(1).kind());
    assertEquals(Syntax2D.RAW_NEWLINE, root.child(3).kind());
    assertEquals("\n", root.child(3).text());
  }

  @Test
  public void testNewlineTextNormalised() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "a");
    builder.token(NEWLINE, "\r\n");
    text(builder, "b");
    builder.finishNode();
    BuildResult result = builder.finish();
    assertEquals("a\nb", result.text);
    assertEquals("Literal text kept in tree", "a\r\nb", result.root.text());
  }

  @Test
  public void testIndentFragmentKeptVerbatim() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    builder.token(INDENT, " \t ");
    builder.newline();
    text(builder, "x");
    assertEquals("\n \t x", builder.textOutput());
  }

  @Test
  public void testClearIndentation() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "x");
    builder.newline();
    builder.indent("  ");
    builder.indent("  ");
    text(builder, "y");
    builder.clearIndentation();
    assertEquals(0, builder.indentationLevel());
    assertEquals("x\n    y", builder.textOutput());
    builder.newline();
    text(builder, "z");
    assertEquals("x\n    y\nz", builder.textOutput());
  }

  @Test
  public void testTextOutputIdempotent() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "a");
    builder.newline();
    builder.indent("  ");
    String first = builder.textOutput();
    String second = builder.textOutput();
    assertEquals(first, second);
    assertEquals("a\n", second);
  }

  @Test
  public void testLineBreakInTextRejected() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "a");
    try {
      text(builder, "b\nc");
      fail("Expected line break to be rejected");
    } catch (InvalidTokenTextException e) {
      assertTrue(e.getMessage().contains("Line break"));
    }
    try {
      text(builder, "b\r");
      fail("Expected carriage return to be rejected");
    } catch (InvalidTokenTextException e) {
      // expected
    }
    assertEquals("Rejected tokens leave no trace", "a", builder.textOutput());
    builder.finishNode();
    assertEquals(1, builder.finish().root.childCount());
  }

  @Test
  public void testLineBreakInTextAllowed() throws Exception {
    Settings settings = new Settings();
    settings.set(Settings.REJECT_LINE_BREAKS, "false");
    Builder2D<SampleSyntax> builder = new Builder2D<SampleSyntax>(settings);
    builder.startNode(SampleSyntax.ROOT);
    text(builder, "a\nb");
    builder.finishNode();
    assertEquals("a\nb", builder.finish().text);
  }

  /** Counts warnings logged while attached */
  private static class WarnCounter extends AppenderSkeleton {
    int warnings = 0;

    @Override
    protected void append(LoggingEvent event) {
      if (event.getLevel().equals(Level.WARN)) {
        warnings++;
      }
    }

    @Override
    public void close() {
    }

    @Override
    public boolean requiresLayout() {
      return false;
    }
  }

  private static Builder2D<SampleSyntax> lenientBuilder() throws Exception {
    Settings settings = new Settings();
    settings.set(Settings.REJECT_LINE_BREAKS, "false");
    Builder2D<SampleSyntax> builder = new Builder2D<SampleSyntax>(settings);
    builder.startNode(SampleSyntax.ROOT);
    return builder;
  }

  @Test
  public void testLineBreakWarningPerBuilder() throws Exception {
    Logger logger = Logging.getLogger();
    Level saved = logger.getLevel();
    WarnCounter counter = new WarnCounter();
    logger.setLevel(Level.WARN);
    logger.addAppender(counter);
    try {
      Builder2D<SampleSyntax> first = lenientBuilder();
      text(first, "x\ny");
      text(first, "x\ny");
      assertEquals("Warned once per builder", 1, counter.warnings);

      Builder2D<SampleSyntax> second = lenientBuilder();
      text(second, "x\ny");
      assertEquals("Other builders still warn", 2, counter.warnings);
    } finally {
      logger.removeAppender(counter);
      logger.setLevel(saved);
    }
  }

  @Test
  public void testLineBreakInIndentRejected() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    try {
      builder.token(INDENT, "  \n");
      fail("Expected line break in indent token to be rejected");
    } catch (InvalidTokenTextException e) {
      assertTrue(e.getMessage().contains("Indent token"));
    }
    try {
      builder.indent("\r  ");
      fail("Expected line break in indentation fragment to be rejected");
    } catch (InvalidTokenTextException e) {
      assertTrue(e.getMessage().contains("indentation fragment"));
    }
    assertEquals(0, builder.indentationLevel());
    builder.finishNode();
    assertEquals("Rejected indent leaves no token",
                 0, builder.finish().root.childCount());
  }

  @Test
  public void testLineBreakInIndentAllowed() throws Exception {
    Builder2D<SampleSyntax> builder = lenientBuilder();
    builder.token(INDENT, "#\n");
    builder.newline();
    text(builder, "a");
    assertEquals("\n#\na", builder.textOutput());
  }

  @Test
  public void testCrlfSetting() throws Exception {
    Settings settings = new Settings();
    settings.set(Settings.LINE_TERMINATOR, "crlf");
    Builder2D<SampleSyntax> builder = new Builder2D<SampleSyntax>(settings);
    builder.startNode(SampleSyntax.ROOT);
    text(builder, "a");
    builder.token(INDENT, "  ");
    builder.token(NEWLINE, "\n");
    text(builder, "b");
    builder.newline();
    builder.finishNode();
    BuildResult result = builder.finish();
    assertEquals("a\r\n  b\r\n", result.text);
    assertEquals("newline() records the configured terminator",
                 "\r\n", result.root.child(4).text());
  }

  @Test
  public void testStaticToken() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "if x");
    builder.staticToken(SampleSyntax.COLON);
    builder.finishNode();
    BuildResult result = builder.finish();
    assertEquals("if x:", result.text);
    assertEquals(SampleSyntax.COLON.toRaw(), result.root.child(1).kind());
  }

  @Test
  public void testStaticTokenWithoutText() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    exception.expect(CSTRuntimeError.class);
    builder.staticToken(SampleSyntax.TEXT);
  }

  @Test
  public void testFinishReturnsOwnedCache() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    builder.finishNode();
    assertNotNull(builder.finish().cache);
  }

  @Test
  public void testSharedCache() {
    NodeCache cache = new NodeCache();
    BuildResult r1 = buildSmall(new Builder2D<SampleSyntax>(cache));
    BuildResult r2 = buildSmall(new Builder2D<SampleSyntax>(cache));
    assertNull("Shared cache not handed back", r1.cache);
    assertSame("Identical trees share nodes", r1.root, r2.root);
  }

  private static BuildResult buildSmall(Builder2D<SampleSyntax> builder) {
    builder.startNode(SampleSyntax.ROOT);
    text(builder, "x");
    builder.newline();
    builder.finishNode();
    return builder.finish();
  }

  @Test
  public void testNodesNest() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "def f()");
    builder.staticToken(SampleSyntax.COLON);
    builder.startNode(SampleSyntax.BLOCK);
    assertEquals(2, builder.nodeDepth());
    builder.newline();
    builder.token(INDENT, "    ");
    text(builder, "pass");
    builder.token(DEDENT, "");
    builder.finishNode();
    builder.finishNode();
    assertEquals(0, builder.nodeDepth());

    BuildResult result = builder.finish();
    assertEquals("def f():\n    pass", result.text);
    assertEquals(3, result.root.childCount());
    GreenNode block = (GreenNode)result.root.child(2);
    assertEquals(SampleSyntax.BLOCK.toRaw(), block.kind());
    assertEquals("pass", ((GreenToken)block.child(2)).text());
  }

  @Test
  public void testUnbalancedFinishNode() {
    Builder2D<SampleSyntax> builder = new Builder2D<SampleSyntax>();
    exception.expect(UnbalancedNodeException.class);
    builder.finishNode();
  }

  @Test
  public void testFinishWithOpenNode() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "a");
    try {
      builder.finish();
      fail("Expected unbalanced nodes to be reported");
    } catch (UnbalancedNodeException e) {
      // expected
    }
    assertFalse(builder.isFinished());
    builder.finishNode();
    assertEquals("a", builder.finish().text);
  }

  @Test
  public void testFinishIsTerminal() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    text(builder, "a");
    builder.newline();
    builder.indent("  ");
    builder.finishNode();
    BuildResult result = builder.finish();
    assertTrue(builder.isFinished());

    try {
      text(builder, "b");
      fail("Expected BuilderFinishedException");
    } catch (BuilderFinishedException e) {
      assertTrue(e.getMessage().contains("already finished"));
    }
    try {
      builder.indent("  ");
      fail("Expected BuilderFinishedException");
    } catch (BuilderFinishedException e) {
      // expected
    }
    try {
      builder.newline();
      fail("Expected BuilderFinishedException");
    } catch (BuilderFinishedException e) {
      // expected
    }
    try {
      builder.startNode(SampleSyntax.BLOCK);
      fail("Expected BuilderFinishedException");
    } catch (BuilderFinishedException e) {
      // expected
    }

    assertEquals("a\n", result.text);
    assertEquals("Queries still answer", result.text, builder.textOutput());
    assertEquals("  ", builder.currentIndentation());
    assertEquals(2, result.root.childCount());
  }

  @Test
  public void testFinishTwice() {
    Builder2D<SampleSyntax> builder = rootBuilder();
    builder.finishNode();
    builder.finish();
    exception.expect(BuilderFinishedException.class);
    builder.finish();
  }
}
