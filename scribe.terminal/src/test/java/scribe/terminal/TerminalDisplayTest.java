package scribe.terminal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import scribe.Buffer;
import scribe.Damage;
import scribe.Editor;
import scribe.EditorSettings;
import scribe.Keymap;
import scribe.text.Text;

import java.io.ByteArrayInputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class TerminalDisplayTest {

  private static final EditorSettings SETTINGS = new EditorSettings(5, 1, 4);
  private static final int WIDTH = 40;

  private StringWriter out;

  @BeforeEach
  public void setUp() {
    out = new StringWriter();
  }

  private TerminalDisplay display(String input) {
    KeyDecoder keys = new KeyDecoder(new ByteArrayInputStream(input.getBytes(StandardCharsets.ISO_8859_1)));
    return new TerminalDisplay(keys, out, SETTINGS, WIDTH);
  }

  private static Buffer numberedLines(int n) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < n; i++) {
      if (i > 0) {
        sb.append('\n');
      }
      sb.append("line").append(i);
    }
    return new Buffer(Text.makeText(sb.toString()));
  }

  private String takeOutput() {
    String s = out.toString();
    out.getBuffer().setLength(0);
    return s;
  }

  @Test
  public void rewriteDrawsTextStatusAndCursor() {
    TerminalDisplay display = display("");
    Buffer buffer = new Buffer(Text.makeText("a\tb\nsecond\n"));
    display.show(buffer);
    display.refresh(Damage.REWRITE, 0, 2);

    String screen = takeOutput();
    assertTrue(screen.contains("a   b"), screen);
    assertTrue(screen.contains("second"), screen);
    assertTrue(screen.contains("\033[4;1H\033[K~"), screen);
    assertTrue(screen.contains(" [no file]  line 1, col 3"), screen);
    assertTrue(screen.endsWith("\033[1;5H"), screen);
  }

  @Test
  public void rewriteLineDrawsOnlyCursorRow() {
    TerminalDisplay display = display("");
    Buffer buffer = new Buffer(Text.makeText("first\nsecond"));
    display.show(buffer);
    display.refresh(Damage.REWRITE, 0, 0);
    takeOutput();

    display.refresh(Damage.REWRITE_LINE, 1, 0);
    String screen = takeOutput();
    assertTrue(screen.contains("second"), screen);
    assertFalse(screen.contains("first"), screen);

    display.refresh(Damage.CLEAN, 0, 0);
    screen = takeOutput();
    assertFalse(screen.contains("first"), screen);
    assertFalse(screen.contains("second"), screen);
  }

  @Test
  public void statusShowsFileAndModified() {
    TerminalDisplay display = display("");
    Buffer buffer = new Buffer(Text.makeText("x"));
    display.show(buffer);
    buffer.insert(0, 'y');
    display.refresh(Damage.REWRITE, 0, 1);
    assertTrue(takeOutput().contains(" [no file] *  line 1, col 2"));
  }

  @Test
  public void originFollowsCursor() {
    TerminalDisplay display = display("");
    display.show(numberedLines(20));
    display.refresh(Damage.CLEAN, 0, 0);
    assertEquals(0, display.getOrigin());

    takeOutput();
    display.refresh(Damage.CLEAN, 10, 0);
    assertEquals(6, display.getOrigin());
    assertTrue(takeOutput().contains("line6"));

    display.refresh(Damage.CLEAN, 2, 0);
    assertEquals(2, display.getOrigin());
  }

  @Test
  public void chooseOriginCentresCursorRow() {
    TerminalDisplay display = display("");
    display.show(numberedLines(20));
    display.chooseOrigin();
    display.refresh(Damage.CLEAN, 10, 0);
    assertEquals(8, display.getOrigin());
  }

  @Test
  public void scrollStaysInsideText() {
    TerminalDisplay display = display("");
    display.show(numberedLines(20));
    display.scroll(3);
    assertEquals(3, display.getOrigin());
    display.scroll(-10);
    assertEquals(0, display.getOrigin());
    display.scroll(100);
    assertEquals(19, display.getOrigin());
  }

  @Test
  public void tabsAndLongLines() {
    TerminalDisplay display = display("");
    assertEquals(4, display.screenColumn("a\tb", 2));
    assertEquals(5, display.screenColumn("a\tb", 3));
    assertEquals(8, display.screenColumn("\t\t", 2));
    String digits = "0123456789";
    assertEquals(digits.repeat(4), display.expand(digits.repeat(5)));
    assertEquals("x?y", display.expand("x\033y"));
  }

  @Test
  public void askWaitsForYesOrNo() {
    TerminalDisplay yes = display("qy");
    assertTrue(yes.ask("Buffer modified -- really quit?"));
    String screen = takeOutput();
    assertTrue(screen.contains("Buffer modified -- really quit? (y/n) "), screen);
    assertTrue(screen.contains("\007"), screen);

    assertFalse(display("n").ask("Overwrite?"));
    assertFalse(display("").ask("Overwrite?"));
    assertFalse(display("\007").ask("Overwrite?"));
  }

  @Test
  public void readStringEditsLine() {
    assertEquals("fac", display("ab\177c\r").readString("Write file", "f"));
    assertEquals("name.txt", display("\r").readString("Write file", "name.txt"));
    assertEquals("", display("\177\177\r").readString("Write file", "x"));
  }

  @Test
  public void readStringCancels() {
    assertNull(display("abc\007").readString("Read file", ""));
    assertNull(display("abc").readString("Read file", ""));
  }

  @Test
  public void ctrlSpaceSetsMarkFromTerminal() {
    TerminalDisplay display = display("abcdef\001\033[C\033[C\000\005\017");
    Editor editor = new Editor(display, Keymap.standard(), SETTINGS);
    editor.activate();
    editor.commandLoop();

    assertEquals("abcdef", editor.getBuffer().contents());
    assertEquals(2, editor.getBuffer().getPoint());
    assertEquals(6, editor.getBuffer().getMark());
  }
}
