package scribe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Screen geometry used by the commands and the display.
 * <p>
 * {@link #load()} reads {@code scribe.properties} from the classpath and lets system properties with the
 * same keys override it:
 * <ul>
 *   <li>{@code scribe.height}: text rows on screen</li>
 *   <li>{@code scribe.scrollMargin}: rows kept from the previous screen by PAGEUP and PAGEDOWN</li>
 *   <li>{@code scribe.tabWidth}: columns per tab stop</li>
 * </ul>
 */
public final class EditorSettings {

  private static final Logger LOG = LogManager.getLogger(EditorSettings.class);

  public static final String RESOURCE = "scribe.properties";
  public static final String HEIGHT = "scribe.height";
  public static final String SCROLL_MARGIN = "scribe.scrollMargin";
  public static final String TAB_WIDTH = "scribe.tabWidth";

  private static final EditorSettings DEFAULTS = new EditorSettings(24, 3, 8);

  public final int height;
  public final int scrollMargin;
  public final int tabWidth;

  public EditorSettings(int height, int scrollMargin, int tabWidth) {
    if (height < 1 || scrollMargin < 0 || tabWidth < 1) {
      throw new IllegalArgumentException("bad settings: height=" + height + ", scrollMargin=" + scrollMargin + ", tabWidth=" + tabWidth);
    }
    this.height = height;
    this.scrollMargin = scrollMargin;
    this.tabWidth = tabWidth;
  }

  public static EditorSettings defaults() {
    return DEFAULTS;
  }

  public static EditorSettings load() {
    Properties props = new Properties();
    try (InputStream in = EditorSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    }
    catch (IOException e) {
      LOG.warn("Couldn't read {}, using defaults", RESOURCE, e);
    }
    return fromProperties(props, System.getProperties());
  }

  /** Settings from {@code defaults}, with any key present in {@code overrides} taking precedence. */
  public static EditorSettings fromProperties(Properties defaults, Properties overrides) {
    int height = intValue(HEIGHT, defaults, overrides, DEFAULTS.height, 1);
    int margin = intValue(SCROLL_MARGIN, defaults, overrides, DEFAULTS.scrollMargin, 0);
    int tabWidth = intValue(TAB_WIDTH, defaults, overrides, DEFAULTS.tabWidth, 1);
    return new EditorSettings(height, margin, tabWidth);
  }

  /** Rows moved by PAGEUP and PAGEDOWN. */
  public int pageSize() {
    return Math.max(1, height - scrollMargin);
  }

  private static int intValue(String key, Properties defaults, Properties overrides, int fallback, int min) {
    String raw = overrides.getProperty(key, defaults.getProperty(key));
    if (raw == null) {
      return fallback;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      if (value < min) {
        LOG.warn("{}={} is below {}, using {}", key, value, min, fallback);
        return fallback;
      }
      return value;
    }
    catch (NumberFormatException e) {
      LOG.warn("{}={} is not a number, using {}", key, raw, fallback);
      return fallback;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EditorSettings settings = (EditorSettings)o;
    return height == settings.height &&
           scrollMargin == settings.scrollMargin &&
           tabWidth == settings.tabWidth;
  }

  @Override
  public int hashCode() {
    return Objects.hash(height, scrollMargin, tabWidth);
  }

  @Override
  public String toString() {
    return "EditorSettings{" +
           "height=" + height +
           ", scrollMargin=" + scrollMargin +
           ", tabWidth=" + tabWidth +
           '}';
  }
}
