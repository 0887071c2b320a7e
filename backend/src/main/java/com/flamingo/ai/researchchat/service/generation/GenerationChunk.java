package com.flamingo.ai.researchchat.service.generation;

/**
 * One piece of streamed model output.
 *
 * @param type whether the text belongs to the answer or to the reasoning trace
 * @param text the delta
 */
public record GenerationChunk(Type type, String text) {

  /** Kind of streamed text. */
  public enum Type {
    CONTENT,
    REASONING
  }

  public static GenerationChunk content(String text) {
    return new GenerationChunk(Type.CONTENT, text);
  }

  public static GenerationChunk reasoning(String text) {
    return new GenerationChunk(Type.REASONING, text);
  }
}
