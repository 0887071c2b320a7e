package com.flamingo.ai.researchchat.service.generation;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Rate-limits writes of a growing text.
 *
 * <p>The first snapshot is written immediately; later ones at most once per interval, keeping only
 * the newest pending snapshot. {@link #flush()} writes whatever is pending. Snapshots are whole
 * texts, so every write is a prefix-consistent extension of the previous one.
 */
public class ContentBatcher {

  private final long intervalNanos;
  private final LongSupplier nanoClock;
  private final Consumer<String> writer;

  private String pending;
  private boolean written;
  private long lastWriteNanos;

  public ContentBatcher(Duration interval, LongSupplier nanoClock, Consumer<String> writer) {
    this.intervalNanos = interval.toNanos();
    this.nanoClock = nanoClock;
    this.writer = writer;
  }

  /** Offers the latest full text. */
  public synchronized void offer(String snapshot) {
    pending = snapshot;
    if (!written || nanoClock.getAsLong() - lastWriteNanos >= intervalNanos) {
      flush();
    }
  }

  public synchronized void flush() {
    if (pending == null) {
      return;
    }
    writer.accept(pending);
    pending = null;
    written = true;
    lastWriteNanos = nanoClock.getAsLong();
  }

  public synchronized boolean hasPending() {
    return pending != null;
  }
}
