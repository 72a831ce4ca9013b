package com.scholary.video.transcriber.summarization;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Summarizes with a locally served model, one paragraph at a time.
 *
 * <p>The local model only writes free text, so the structure comes from the rule-based
 * summarizer: paragraphs and timeline groups are cut by its rules, and the curator title and key
 * points are taken from it. The model writes the paragraph summaries, the curator one-liner and
 * each timeline section's summary. If the model answers any of those with nothing, the whole
 * tier reports empty.
 */
@Component
public class LocalGenerativeSummaryStrategy implements SummaryStrategy {

  public static final String NAME = "local_generative";

  private final LocalModelClient client;
  private final RuleBasedSummaryStrategy rules;

  public LocalGenerativeSummaryStrategy(LocalModelClient client, RuleBasedSummaryStrategy rules) {
    this.client = client;
    this.rules = rules;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return client.isEnabled();
  }

  @Override
  public Optional<List<KeySummaryItem>> keySummary(String text) {
    List<String> paragraphs = RuleBasedSummaryStrategy.segmentParagraphs(text);
    if (paragraphs.isEmpty()) {
      return Optional.empty();
    }
    List<KeySummaryItem> items = new ArrayList<>();
    for (String paragraph : paragraphs) {
      Optional<String> summary = client.summarizeParagraph(paragraph);
      if (summary.isEmpty()) {
        return Optional.empty();
      }
      items.add(new KeySummaryItem(summary.get()));
    }
    return Optional.of(items);
  }

  @Override
  public Optional<CuratorSummary> curator(String text) {
    CuratorSummary base = rules.curatorSummary(text);
    return client
        .summarizeParagraph(text)
        .map(oneLine -> new CuratorSummary(base.title(), oneLine, base.keyPoints()));
  }

  @Override
  public Optional<List<TimelineSection>> timeline(String text) {
    List<List<String>> groups = RuleBasedSummaryStrategy.timelineGroups(text);
    if (groups.isEmpty()) {
      return Optional.empty();
    }
    List<TimelineSection> sections = new ArrayList<>();
    for (int i = 0; i < groups.size(); i++) {
      List<String> group = groups.get(i);
      Optional<String> summary = client.summarizeParagraph(String.join(" ", group));
      if (summary.isEmpty()) {
        return Optional.empty();
      }
      sections.add(RuleBasedSummaryStrategy.timelineSection(i, group, summary.get()));
    }
    return Optional.of(sections);
  }
}
