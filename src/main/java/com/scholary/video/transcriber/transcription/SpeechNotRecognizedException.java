package com.scholary.video.transcriber.transcription;

/** The backend processed the audio but recognized no speech in it. */
public class SpeechNotRecognizedException extends SpeechBackendException {

  public SpeechNotRecognizedException(String message) {
    super(message);
  }
}
