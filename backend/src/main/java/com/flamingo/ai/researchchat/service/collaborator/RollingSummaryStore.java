package com.flamingo.ai.researchchat.service.collaborator;

import java.util.Optional;
import java.util.UUID;

/** Reads and writes the rolling summary of a conversation. */
public interface RollingSummaryStore {

  Optional<String> read(UUID conversationId);

  void write(UUID conversationId, String summary);
}
