package com.scholary.video.transcriber.download;

/** Outcome of an external process run: exit code, captured stdout and stderr. */
public record ProcessResult(int exitCode, String output, String errorOutput, boolean timedOut) {

  public boolean succeeded() {
    return !timedOut && exitCode == 0;
  }
}
