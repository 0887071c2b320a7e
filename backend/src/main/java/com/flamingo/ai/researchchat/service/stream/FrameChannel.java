package com.flamingo.ai.researchchat.service.stream;

import com.flamingo.ai.researchchat.api.dto.response.StreamFrame;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Bounded, single-subscriber channel between the generation producer and the transport writer.
 *
 * <p>Frames are delivered in emission order and never skipped. A full buffer blocks the producer
 * until the reader makes room. When the reader cancels, or makes no room within the stall timeout,
 * the channel fails: the reader gets the frames already buffered followed by completion, and every
 * later frame is refused. What the reader saw is therefore always a prefix of what was emitted.
 */
@Slf4j
public class FrameChannel {

  private static final long PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

  private final Sinks.Many<StreamFrame> sink;
  private final long stallTimeoutNanos;
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  private volatile boolean failed;

  private FrameChannel(Sinks.Many<StreamFrame> sink, Duration stallTimeout) {
    this.sink = sink;
    this.stallTimeoutNanos = stallTimeout.toNanos();
  }

  /**
   * Creates a channel buffering at most {@code capacity} undelivered frames.
   *
   * @param stallTimeout how long the producer waits on a full buffer before the channel fails
   */
  public static FrameChannel bounded(int capacity, Duration stallTimeout) {
    Sinks.Many<StreamFrame> sink =
        Sinks.many().unicast().onBackpressureBuffer(Queues.<StreamFrame>get(capacity).get());
    return new FrameChannel(sink, stallTimeout);
  }

  /** Creates a channel without a reader; frames are discarded. */
  public static FrameChannel detached() {
    return new FrameChannel(null, Duration.ZERO);
  }

  public Flux<StreamFrame> frames() {
    if (sink == null) {
      return Flux.empty();
    }
    return sink.asFlux();
  }

  public boolean isTerminated() {
    return terminated.get();
  }

  /** Whether the reader went away or stalled, so nothing more reaches it. */
  public boolean isFailed() {
    return failed;
  }

  /** Emits a non-terminal frame. Returns {@code false} when the frame was not delivered. */
  public boolean emit(StreamFrame frame) {
    if (terminated.get()) {
      log.debug("Dropping {} frame after terminal frame", frame.getType());
      return false;
    }
    return offer(frame);
  }

  /**
   * Emits the terminal frames and closes the channel. Only the first call has any effect.
   *
   * @return whether this call handed every terminal frame to the reader; {@code false} for a later
   *     call and for a channel that failed before or during the write
   */
  public boolean emitTerminal(List<StreamFrame> frames) {
    if (!terminated.compareAndSet(false, true)) {
      return false;
    }
    for (StreamFrame frame : frames) {
      if (!offer(frame)) {
        return false;
      }
    }
    close();
    return true;
  }

  private synchronized boolean offer(StreamFrame frame) {
    if (sink == null) {
      return true;
    }
    if (failed) {
      return false;
    }
    long deadline = System.nanoTime() + stallTimeoutNanos;
    while (true) {
      Sinks.EmitResult result = sink.tryEmitNext(frame);
      if (result.isSuccess()) {
        return true;
      }
      boolean waitable =
          result == Sinks.EmitResult.FAIL_OVERFLOW
              || result == Sinks.EmitResult.FAIL_NON_SERIALIZED;
      if (!waitable || System.nanoTime() >= deadline) {
        fail(frame, result);
        return false;
      }
      LockSupport.parkNanos(PARK_NANOS);
    }
  }

  private void fail(StreamFrame frame, Sinks.EmitResult result) {
    failed = true;
    log.warn(
        "Stream reader gone or stalled at {} frame ({}); detaching channel",
        frame.getType(),
        result);
    sink.tryEmitComplete();
  }

  private synchronized void close() {
    if (sink != null) {
      sink.tryEmitComplete();
    }
  }
}
