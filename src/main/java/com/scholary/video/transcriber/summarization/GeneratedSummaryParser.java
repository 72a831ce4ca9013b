package com.scholary.video.transcriber.summarization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the JSON a generative model wrote into summary types.
 *
 * <p>Models sometimes wrap JSON in a Markdown code fence or return a bare array instead of the
 * requested object; both are tolerated. Anything structurally incomplete is rejected as a whole
 * and reported as empty.
 */
@Component
public class GeneratedSummaryParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeneratedSummaryParser.class);

  private static final Pattern CODE_FENCE =
      Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  public GeneratedSummaryParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Accepts {@code {"summaries": [...]}} or a bare array of objects or strings. */
  public Optional<List<KeySummaryItem>> parseKeySummary(String content) {
    return readTree(content)
        .flatMap(
            root -> {
              JsonNode array = root.isArray() ? root : root.path("summaries");
              if (!array.isArray()) {
                return Optional.empty();
              }
              List<KeySummaryItem> items = new ArrayList<>();
              for (JsonNode node : array) {
                String summary =
                    node.isTextual() ? node.asText() : text(node, "paragraph_summary");
                if (summary != null) {
                  items.add(new KeySummaryItem(summary));
                }
              }
              return items.isEmpty() ? Optional.empty() : Optional.of(items);
            });
  }

  public Optional<CuratorSummary> parseCurator(String content) {
    return readTree(content)
        .flatMap(
            root -> {
              String title = text(root, "title");
              String oneLine = text(root, "one_line_summary");
              List<String> keyPoints = new ArrayList<>();
              for (JsonNode point : root.path("key_points")) {
                if (point.isTextual() && !point.asText().isBlank()) {
                  keyPoints.add(point.asText().trim());
                }
              }
              if (title == null || oneLine == null || keyPoints.isEmpty()) {
                return Optional.empty();
              }
              return Optional.of(new CuratorSummary(title, oneLine, keyPoints));
            });
  }

  /**
   * Accepts {@code {"sections": [...]}} or a bare array. Keeps at most {@code maxSections}
   * sections. Timestamps are renumbered by position and keywords capped, whatever the model
   * wrote.
   */
  public Optional<List<TimelineSection>> parseTimeline(String content, int maxSections) {
    return readTree(content)
        .flatMap(
            root -> {
              JsonNode array = root.isArray() ? root : root.path("sections");
              if (!array.isArray() || array.isEmpty()) {
                return Optional.empty();
              }
              List<TimelineSection> sections = new ArrayList<>();
              for (JsonNode node : array) {
                if (sections.size() == maxSections) {
                  break;
                }
                Optional<TimelineSection> section = parseSection(node, sections.size());
                if (section.isEmpty()) {
                  return Optional.empty();
                }
                sections.add(section.get());
              }
              return Optional.of(sections);
            });
  }

  private Optional<TimelineSection> parseSection(JsonNode node, int index) {
    String subtitle = text(node, "subtitle");
    String summary = text(node, "summary");
    if (subtitle == null || summary == null) {
      return Optional.empty();
    }
    Set<String> keywords = new LinkedHashSet<>();
    for (JsonNode keyword : node.path("keywords")) {
      if (keywords.size() == RuleBasedSummaryStrategy.MAX_KEYWORDS) {
        break;
      }
      if (keyword.isTextual() && !keyword.asText().isBlank()) {
        keywords.add(keyword.asText().trim());
      }
    }
    String oneline = text(node, "oneline_summary");
    return Optional.of(
        new TimelineSection(
            RuleBasedSummaryStrategy.timestamp(index),
            subtitle,
            summary,
            keywords,
            oneline != null ? oneline : summary));
  }

  private Optional<JsonNode> readTree(String content) {
    if (content == null || content.isBlank()) {
      return Optional.empty();
    }
    String json = content.trim();
    Matcher fence = CODE_FENCE.matcher(json);
    if (fence.matches()) {
      json = fence.group(1);
    }
    try {
      return Optional.ofNullable(objectMapper.readTree(json));
    } catch (JsonProcessingException e) {
      LOGGER.debug("Generated summary is not valid JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText().trim();
  }
}
