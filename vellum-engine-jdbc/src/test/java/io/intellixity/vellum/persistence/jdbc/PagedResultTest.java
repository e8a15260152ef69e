package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.spi.resilience.RetryConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PagedResultTest {

  @Test
  void pageArithmetic() {
    PagedResult<String> first = new PagedResult<>(List.of("a", "b"), 5, 1, 2);
    assertEquals(3, first.totalPages());
    assertTrue(first.hasNext());
    assertFalse(first.hasPrevious());

    PagedResult<String> last = new PagedResult<>(List.of("e"), 5, 3, 2);
    assertFalse(last.hasNext());
    assertTrue(last.hasPrevious());

    assertEquals(0, new PagedResult<String>(List.of(), 0, 1, 10).totalPages());
  }

  @Test
  void rejectsInvalidPaging() {
    assertThrows(IllegalArgumentException.class, () -> new PagedResult<>(List.of(), 0, 0, 10));
    assertThrows(IllegalArgumentException.class, () -> new PagedResult<>(List.of(), 0, 1, 0));
  }

  @Test
  void storeSettingsValidate() {
    StoreSettings s = StoreSettings.defaults().withBatchSize(10).withRetry(RetryConfiguration.noRetry());
    assertEquals(10, s.batchSize());
    assertFalse(s.retry().enabled());
    assertEquals(Duration.ofSeconds(30), s.commandTimeout());
    assertThrows(IllegalArgumentException.class, () -> s.withBatchSize(0));
    assertThrows(IllegalArgumentException.class, () -> s.withCommandTimeout(Duration.ofMillis(-1)));
  }
}
