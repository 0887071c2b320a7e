package com.flamingo.ai.researchchat.service.collaborator;

/** Runs work outside the request that triggered it. */
public interface BackgroundTaskScheduler {

  void schedule(String taskName, Runnable task);
}
