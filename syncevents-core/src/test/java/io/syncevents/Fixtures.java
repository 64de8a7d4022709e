package io.syncevents;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads JSON fixtures from the test classpath.
 */
public final class Fixtures {
  private Fixtures() {}

  public static String load(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/sync/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing fixture " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
