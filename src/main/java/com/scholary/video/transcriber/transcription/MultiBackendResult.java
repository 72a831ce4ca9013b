package com.scholary.video.transcriber.transcription;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of running several speech backends on the same audio.
 *
 * <p>Serialized with one property per backend name next to {@code success} and {@code method},
 * e.g. {@code {"whisper": {...}, "google": {...}, "success": true, "method": "both"}}. A backend
 * failure is reported inside its nested result; the outer {@code success} describes the dispatch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MultiBackendResult implements TranscriptionResult {

  private final String method;
  private final Map<String, BackendResult> results;
  private final boolean success;
  private final String error;

  public MultiBackendResult(
      String method, Map<String, BackendResult> results, boolean success, String error) {
    this.method = method;
    this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    this.success = success;
    this.error = error;
  }

  @JsonAnyGetter
  public Map<String, BackendResult> results() {
    return results;
  }

  public BackendResult result(String backendName) {
    return results.get(backendName);
  }

  public boolean anyBackendSucceeded() {
    return results.values().stream().anyMatch(BackendResult::success);
  }

  @Override
  @JsonProperty("success")
  public boolean success() {
    return success;
  }

  @Override
  @JsonProperty("method")
  public String method() {
    return method;
  }

  @Override
  @JsonProperty("error")
  public String error() {
    return error;
  }
}
