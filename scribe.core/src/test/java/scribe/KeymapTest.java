package scribe;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static scribe.Keys.ctrl;

public class KeymapTest {

  @Test
  public void printableKeysInsertThemselves() {
    RecordingDisplay display = new RecordingDisplay();
    Editor editor = new Editor(display, Keymap.empty(), EditorSettings.defaults());
    Command command = Keymap.empty().find('q');
    assertNotNull(command);
    editor.perform(command);
    assertEquals("q", editor.getBuffer().contents());
  }

  @Test
  public void controlAndUnknownKeysAreUnbound() {
    assertNull(Keymap.empty().find(ctrl('T')));
    assertNull(Keymap.standard().find(ctrl('C')));
    assertNull(Keymap.standard().find(Keys.UNKNOWN));
    assertNull(Keymap.standard().find(200));
  }

  @Test
  public void bindReturnsNewKeymap() {
    Keymap base = Keymap.empty();
    Keymap bound = base.bind(ctrl('C'), Editor::quit);
    assertEquals(0, base.size());
    assertEquals(1, bound.size());
    assertNotNull(bound.find(ctrl('C')));
    assertNull(base.find(ctrl('C')));
  }

  @Test
  public void bindingOverridesSelfInsertion() {
    RecordingDisplay display = new RecordingDisplay();
    Keymap keymap = Keymap.standard().bind('!', Editor::beepCommand);
    Editor editor = new Editor(display, keymap, EditorSettings.defaults());
    display.type("a!b");
    editor.commandLoop();
    assertEquals("ab", editor.getBuffer().contents());
    assertEquals(1, display.beeps);
  }

  @Test
  public void standardBindings() {
    Keymap keymap = Keymap.standard();
    int[] bound = {
      Keys.RETURN, Keys.TAB, Keys.UP, Keys.DOWN, Keys.LEFT, Keys.RIGHT, Keys.HOME, Keys.END,
      Keys.PAGEUP, Keys.PAGEDOWN, Keys.CTRLHOME, Keys.CTRLEND, Keys.BACKSPACE, Keys.DEL, Keys.EOF,
      ctrl('@'), ctrl('A'), ctrl('B'), ctrl('D'), ctrl('E'), ctrl('F'), ctrl('G'), ctrl('K'), ctrl('L'), ctrl('M'),
      ctrl('N'), ctrl('O'), ctrl('P'), ctrl('Q'), ctrl('R'), ctrl('T'), ctrl('U'), ctrl('W'), ctrl('Y'),
      ctrl('Z')
    };
    for (int key : bound) {
      assertNotNull(keymap.find(key), "key " + key);
    }
    assertEquals(bound.length, keymap.size());
  }

  @Test
  public void controlCodes() {
    assertEquals(0, ctrl('@'));
    assertEquals(1, ctrl('A'));
    assertEquals(26, ctrl('Z'));
    assertEquals(Keys.BACKSPACE, ctrl('?'));
    assertTrue(Keys.isPrintable(' '));
    assertFalse(Keys.isPrintable(Keys.BACKSPACE));
    assertFalse(Keys.isPrintable(Keys.RETURN));
  }
}
