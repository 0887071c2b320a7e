package com.flamingo.ai.researchchat.service.collaborator;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Schedules background work on the generation thread pool. */
@Component
@Slf4j
public class ExecutorBackgroundTaskScheduler implements BackgroundTaskScheduler {

  private final Executor executor;

  public ExecutorBackgroundTaskScheduler(@Qualifier("generationExecutor") Executor executor) {
    this.executor = executor;
  }

  @Override
  public void schedule(String taskName, Runnable task) {
    log.debug("Scheduling background task {}", taskName);
    try {
      executor.execute(
          () -> {
            try {
              task.run();
            } catch (RuntimeException e) {
              log.error("Background task {} failed: {}", taskName, e.getMessage(), e);
            }
          });
    } catch (RejectedExecutionException e) {
      log.error("Background task {} rejected, pool saturated", taskName);
      throw e;
    }
  }
}
