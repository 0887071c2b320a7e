package com.flamingo.ai.researchchat.service.generation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContentBatcher")
class ContentBatcherTest {

  private final AtomicLong clock = new AtomicLong();
  private final List<String> writes = new ArrayList<>();
  private ContentBatcher batcher;

  @BeforeEach
  void setUp() {
    batcher = new ContentBatcher(Duration.ofMillis(100), clock::get, writes::add);
  }

  @Test
  @DisplayName("Should write the first snapshot immediately and coalesce the rest")
  void shouldCoalesceWithinInterval() {
    // when
    batcher.offer("H");
    clock.addAndGet(Duration.ofMillis(10).toNanos());
    batcher.offer("He");
    batcher.offer("Hel");

    // then
    assertThat(writes).containsExactly("H");
    assertThat(batcher.hasPending()).isTrue();
  }

  @Test
  @DisplayName("Should write the newest snapshot once the interval has passed")
  void shouldWriteAfterInterval() {
    batcher.offer("H");
    batcher.offer("He");
    clock.addAndGet(Duration.ofMillis(100).toNanos());
    batcher.offer("Hello");

    assertThat(writes).containsExactly("H", "Hello");
    assertThat(batcher.hasPending()).isFalse();
  }

  @Test
  @DisplayName("Should flush the pending snapshot and nothing when idle")
  void shouldFlushPending() {
    batcher.offer("Hello");
    batcher.offer("Hello world");

    batcher.flush();
    batcher.flush();

    assertThat(writes).containsExactly("Hello", "Hello world");
  }
}
