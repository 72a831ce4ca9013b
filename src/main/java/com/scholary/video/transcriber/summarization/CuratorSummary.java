package com.scholary.video.transcriber.summarization;

import java.util.List;

/**
 * Editor-style digest of a text: a title, a one-line summary and a few key points.
 *
 * @param title short title, usually taken from the opening sentence
 * @param oneLineSummary the gist in one line
 * @param keyPoints distinct key points, most informative first
 */
public record CuratorSummary(String title, String oneLineSummary, List<String> keyPoints) {

  public CuratorSummary {
    keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
  }
}
