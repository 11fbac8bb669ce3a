package scribe.terminal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import scribe.Editor;
import scribe.EditorSettings;
import scribe.Keymap;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Command line entry point: {@code scribe [file]}.
 */
public final class Scribe {
  private Scribe() {}

  private static final Logger LOG = LogManager.getLogger(Scribe.class);

  /** System property naming the terminal device, {@value RawMode#DEFAULT_DEVICE} by default. */
  public static final String TTY = "scribe.tty";

  static final int USAGE = 2;
  static final int FAILED = 1;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    return run(args, System.getProperty(TTY, RawMode.DEFAULT_DEVICE));
  }

  static int run(String[] args, String device) {
    if (args.length > 1) {
      System.err.println("Usage: scribe [file]");
      return USAGE;
    }

    EditorSettings settings = EditorSettings.load();
    LOG.debug("starting with {}", settings);
    try (RawMode raw = RawMode.enable(device)) {
      Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      TerminalDisplay display = new TerminalDisplay(new KeyDecoder(System.in), out, settings, raw.columns(80));
      try {
        Editor editor = new Editor(display, Keymap.standard(), settings);
        editor.activate();
        if (args.length == 1) {
          editor.loadFile(args[0]);
        }
        editor.commandLoop();
      }
      finally {
        display.close();
      }
      return 0;
    }
    catch (IOException | RuntimeException e) {
      LOG.error("scribe failed", e);
      System.err.println("scribe: " + e.getMessage());
      return FAILED;
    }
  }
}
