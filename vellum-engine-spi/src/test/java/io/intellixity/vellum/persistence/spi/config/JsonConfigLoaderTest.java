package io.intellixity.vellum.persistence.spi.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class JsonConfigLoaderTest {

  record Pool(int size, String name) {}

  record Settings(String url, boolean verbose, Pool pool) {
    Settings {
      if (url == null || url.isBlank()) throw new IllegalArgumentException("url is required");
    }
  }

  private static final Settings DEFAULTS = new Settings("jdbc:x", false, new Pool(4, "main"));

  private final JsonConfigLoader loader = JsonConfigLoader.defaults();

  @Test
  void nestedObjectsMergeFieldByField() {
    Settings s = loader.load("{\"settings\": {\"POOL\": {\"size\": 16}}}", DEFAULTS, Settings.class, "settings");
    assertEquals(new Settings("jdbc:x", false, new Pool(16, "main")), s);
  }

  @Test
  void explicitNullKeepsTheDefault() {
    Settings s = loader.load("{\"url\": null, \"verbose\": true}", DEFAULTS, Settings.class, "settings");
    assertEquals("jdbc:x", s.url());
    assertTrue(s.verbose());
  }

  @Test
  void blankDocumentYieldsDefaults() {
    assertSame(DEFAULTS, loader.load("  ", DEFAULTS, Settings.class, null));
    assertSame(DEFAULTS, loader.load("null", DEFAULTS, Settings.class, null));
  }

  @Test
  void malformedDocumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> loader.load("{", DEFAULTS, Settings.class, null));
    assertThrows(IllegalArgumentException.class, () -> loader.load("[1, 2]", DEFAULTS, Settings.class, null));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> loader.load("{\"url\": \"\"}", DEFAULTS, Settings.class, null));
    assertEquals("url is required", e.getMessage());
  }

  @Test
  void streamsAndFiles(@TempDir Path dir) {
    Settings s = loader.load(new ByteArrayInputStream("{\"verbose\": true}".getBytes(StandardCharsets.UTF_8)),
        DEFAULTS, Settings.class, null);
    assertTrue(s.verbose());

    assertSame(DEFAULTS, loader.load(dir.resolve("absent.json"), DEFAULTS, Settings.class, null));
    assertThrows(IllegalArgumentException.class,
        () -> loader.loadRequired(dir.resolve("absent.json"), DEFAULTS, Settings.class, null));
  }
}
