package com.scholary.video.transcriber.summarization;

import java.util.List;
import java.util.Optional;

/**
 * One way of producing summaries, used as a tier of the {@link SummarizationFallbackChain}.
 *
 * <p>An empty result means the strategy could not produce a usable summary and the next tier
 * should be tried. Strategies may also throw; the chain treats that the same way for every tier
 * except the last.
 */
public interface SummaryStrategy {

  /** Short name used in logs. */
  String name();

  /** Whether the strategy is configured and may be tried at all. */
  boolean isAvailable();

  Optional<List<KeySummaryItem>> keySummary(String text);

  Optional<CuratorSummary> curator(String text);

  Optional<List<TimelineSection>> timeline(String text);
}
