package io.intellixity.vellum.persistence.spi.resilience;

import io.intellixity.vellum.persistence.spi.config.JsonConfigLoader;

import java.nio.file.Path;

/** Reads {@link RetryConfiguration} from {@code {"retry": {...}}} or a root-level object. */
public final class RetryConfigurationLoader {
  public static final String SECTION = "retry";

  private RetryConfigurationLoader() {}

  public static RetryConfiguration fromJson(String json) {
    return fromJson(json, RetryConfiguration.defaults());
  }

  public static RetryConfiguration fromJson(String json, RetryConfiguration defaults) {
    return JsonConfigLoader.defaults().load(json, defaults, RetryConfiguration.class, SECTION);
  }

  public static RetryConfiguration fromFile(Path file) {
    return JsonConfigLoader.defaults().load(file, RetryConfiguration.defaults(), RetryConfiguration.class, SECTION);
  }
}
