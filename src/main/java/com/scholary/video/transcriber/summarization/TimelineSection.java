package com.scholary.video.transcriber.summarization;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One section of a timeline summary.
 *
 * @param timestamp approximate position in the video, e.g. {@code 1-3분}
 * @param subtitle short heading for the section
 * @param summary what the section says
 * @param keywords recurring words of the section, most frequent first
 * @param onelineSummary casual one-line restatement of the section's opening
 */
public record TimelineSection(
    String timestamp,
    String subtitle,
    String summary,
    Set<String> keywords,
    String onelineSummary) {

  public TimelineSection {
    keywords =
        keywords == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
  }
}
