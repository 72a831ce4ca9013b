package com.scholary.video.transcriber.transcription;

/**
 * Per-request hints passed to every speech backend.
 *
 * @param model model size hint (tiny, base, small, medium, large); backends without model
 *     choice ignore it
 * @param language preferred language code, or null for the backend's default
 */
public record TranscriptionOptions(String model, String language) {

  public static TranscriptionOptions ofModel(String model) {
    return new TranscriptionOptions(model, null);
  }
}
