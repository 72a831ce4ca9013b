package com.scholary.video.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scholary.video.transcriber.transcription.TranscriptSegment;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains a list of segments, the detected language and, depending on the service version,
 * the full text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<TranscriptSegment> segments, String language, String text) {}
