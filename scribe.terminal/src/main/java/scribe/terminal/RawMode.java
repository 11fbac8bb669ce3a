package scribe.terminal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * The controlling terminal switched to raw mode with {@code stty}; closing puts back the settings it had.
 */
public class RawMode implements AutoCloseable {

  private static final Logger LOG = LogManager.getLogger(RawMode.class);

  public static final String DEFAULT_DEVICE = "/dev/tty";

  private final String device;
  private final String saved;

  private RawMode(String device, String saved) {
    this.device = device;
    this.saved = saved;
  }

  public static RawMode enable() throws IOException {
    return enable(DEFAULT_DEVICE);
  }

  /** Switch the terminal at {@code device}; fails if it is not a terminal. */
  public static RawMode enable(String device) throws IOException {
    String saved = stty(device, "-g").trim();
    stty(device, "raw -echo");
    LOG.debug("{} in raw mode, saved settings {}", device, saved);
    return new RawMode(device, saved);
  }

  /** Terminal width in columns, or {@code fallback} if stty cannot tell. */
  public int columns(int fallback) {
    try {
      String[] size = stty(device, "size").trim().split("\\s+");
      return size.length == 2 ? Integer.parseInt(size[1]) : fallback;
    }
    catch (IOException | NumberFormatException e) {
      LOG.warn("Couldn't get the terminal size, assuming {} columns", fallback, e);
      return fallback;
    }
  }

  @Override
  public void close() throws IOException {
    stty(device, saved);
    LOG.debug("terminal settings restored");
  }

  private static String stty(String device, String args) throws IOException {
    ProcessBuilder pb = new ProcessBuilder("sh", "-c", "stty " + args + " < '" + device + "'");
    pb.redirectErrorStream(true);
    Process p = pb.start();

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (InputStream in = p.getInputStream()) {
      byte[] buf = new byte[1024];
      int r;
      while ((r = in.read(buf)) != -1) {
        out.write(buf, 0, r);
      }
    }

    int code;
    try {
      code = p.waitFor();
    }
    catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted waiting for stty", e);
    }
    String output = new String(out.toByteArray(), StandardCharsets.UTF_8);
    if (code != 0) {
      throw new IOException("stty " + args + " exited with code " + code + ": " + output.trim());
    }
    return output;
  }
}
