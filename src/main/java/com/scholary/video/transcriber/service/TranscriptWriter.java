package com.scholary.video.transcriber.service;

import com.scholary.video.transcriber.transcription.BackendResult;
import com.scholary.video.transcriber.transcription.MultiBackendResult;
import com.scholary.video.transcriber.transcription.TranscriptSegment;
import com.scholary.video.transcriber.transcription.TranscriptionResult;
import com.scholary.video.transcriber.whisper.WhisperClient;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes transcripts in downloadable formats.
 *
 * <p>Supports plain text (one section per backend for multi-backend results) and SRT (SubRip
 * subtitle format) built from timed segments.
 */
@Component
public class TranscriptWriter {

  static final String FAILED_MARKER = "변환 실패";

  /**
   * Write transcript as plain text.
   *
   * <p>A multi-backend result gets one labelled section per backend:
   *
   * <pre>
   * Whisper 결과:
   * 안녕하세요 ...
   *
   * Google 결과:
   * 변환 실패
   * </pre>
   */
  public String writeText(TranscriptionResult result) {
    if (result instanceof MultiBackendResult multi) {
      StringBuilder text = new StringBuilder();
      for (Map.Entry<String, BackendResult> entry : multi.results().entrySet()) {
        if (text.length() > 0) {
          text.append("\n");
        }
        text.append(displayName(entry.getKey())).append(" 결과:\n");
        text.append(textOrFailure(entry.getValue())).append("\n");
      }
      return text.toString();
    }
    if (result instanceof BackendResult single) {
      return textOrFailure(single) + "\n";
    }
    throw new IllegalArgumentException("Unsupported result type: " + result.getClass());
  }

  /**
   * The timed segments to build subtitles from: the result's own for a single backend, the
   * Whisper backend's for a multi-backend result.
   */
  public List<TranscriptSegment> segmentsOf(TranscriptionResult result) {
    BackendResult source =
        result instanceof MultiBackendResult multi
            ? multi.result(WhisperClient.NAME)
            : (BackendResult) result;
    if (source == null || !source.success() || source.segments() == null) {
      return List.of();
    }
    return source.segments();
  }

  /**
   * Write transcript as SRT (SubRip subtitle format).
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * 안녕하세요
   *
   * 2
   * 00:00:05,200 --> 00:00:10,300
   * 오늘은
   * </pre>
   */
  public String writeSrt(List<TranscriptSegment> segments) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < segments.size(); i++) {
      TranscriptSegment segment = segments.get(i);

      srt.append(i + 1).append("\n");
      srt.append(formatSrtTime(segment.start()))
          .append(" --> ")
          .append(formatSrtTime(segment.end()))
          .append("\n");
      srt.append(segment.text() == null ? "" : segment.text().trim()).append("\n");
      srt.append("\n");
    }

    return srt.toString();
  }

  /** HH:MM:SS,mmm */
  static String formatSrtTime(double seconds) {
    long totalMillis = Math.round(seconds * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  private static String textOrFailure(BackendResult result) {
    return result.success() ? result.text() : FAILED_MARKER;
  }

  private static String displayName(String backend) {
    if (backend.isEmpty()) {
      return backend;
    }
    return backend.substring(0, 1).toUpperCase(Locale.ROOT) + backend.substring(1);
  }
}
