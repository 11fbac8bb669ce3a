package scribe;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class EditorSettingsTest {

  private static Properties props(String... keyValues) {
    Properties props = new Properties();
    for (int i = 0; i < keyValues.length; i += 2) {
      props.setProperty(keyValues[i], keyValues[i + 1]);
    }
    return props;
  }

  @Test
  public void bundledDefaults() {
    EditorSettings settings = EditorSettings.load();
    assertEquals(EditorSettings.defaults(), settings);
    assertEquals(21, settings.pageSize());
  }

  @Test
  public void overridesWinOverDefaults() {
    EditorSettings settings = EditorSettings.fromProperties(
      props(EditorSettings.HEIGHT, "40", EditorSettings.TAB_WIDTH, "4"),
      props(EditorSettings.HEIGHT, "30"));
    assertEquals(new EditorSettings(30, 3, 4), settings);
  }

  @Test
  public void badValuesFallBack() {
    EditorSettings settings = EditorSettings.fromProperties(
      props(EditorSettings.HEIGHT, "tall", EditorSettings.SCROLL_MARGIN, "-2", EditorSettings.TAB_WIDTH, " 2 "),
      new Properties());
    assertEquals(24, settings.height);
    assertEquals(3, settings.scrollMargin);
    assertEquals(2, settings.tabWidth);
  }

  @Test
  public void pageIsAtLeastOneRow() {
    assertEquals(1, new EditorSettings(2, 5, 8).pageSize());
  }

  @Test
  public void invalidConstruction() {
    assertThrows(IllegalArgumentException.class, () -> new EditorSettings(0, 3, 8));
    assertThrows(IllegalArgumentException.class, () -> new EditorSettings(24, 3, 0));
  }
}
