package com.scholary.video.transcriber.summarization;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Deterministic summarizer built from sentence-selection rules.
 *
 * <p>This is the last tier of the fallback chain: it needs no model and produces a result for any
 * non-empty input. Input shorter than {@value #MIN_INPUT_LENGTH} characters yields a placeholder
 * (key summary, curator) or an empty timeline.
 *
 * <p>The generative tiers reuse the paragraph segmentation and the timeline grouping so that
 * their output lines up with this one.
 */
@Component
public class RuleBasedSummaryStrategy implements SummaryStrategy {

  public static final String NAME = "rule_based";

  static final int MIN_INPUT_LENGTH = 20;
  static final int MAX_TIMELINE_SECTIONS = 8;

  static final String PLACEHOLDER_SUMMARY = "요약할 내용이 충분하지 않습니다.";
  static final String PLACEHOLDER_TITLE = "요약";
  static final String PLACEHOLDER_KEY_POINT = "텍스트가 너무 짧아 핵심 내용을 추출할 수 없습니다.";

  private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
  private static final Pattern NEWLINE = Pattern.compile("\\r?\\n");
  private static final Pattern PERIOD = Pattern.compile("\\.");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  private static final int MIN_LINE_LENGTH = 10;
  private static final int SHORT_PARAGRAPH_LENGTH = 30;
  private static final int MIN_PARAGRAPH_SUMMARY_LENGTH = 6;

  private static final int MIN_CURATOR_SENTENCE_LENGTH = 10;
  private static final int MAX_TITLE_LENGTH = 100;
  private static final int TITLE_WORDS = 10;
  private static final int ONE_LINE_WINDOW = 5;
  private static final int KEY_POINTS = 3;
  private static final double MAX_WORD_OVERLAP = 0.5;

  private static final int MIN_TIMELINE_SENTENCE_LENGTH = 15;
  private static final int GROUP_MAX_SENTENCES = 4;
  private static final int GROUP_MAX_CHARS = 300;
  private static final int MAX_SUBTITLE_LENGTH = 60;
  private static final int SUBTITLE_WORDS = 8;
  static final int MAX_KEYWORDS = 4;

  private static final Set<String> STOP_WORDS =
      Set.of(
          "그리고", "그러나", "하지만", "그런데", "그래서", "또한", "그러면", "따라서",
          "이것", "그것", "저것", "이런", "그런", "저런", "이번", "우리", "여러분",
          "정말", "진짜", "아주", "매우", "너무", "조금", "많이", "있는", "없는",
          "하는", "되는", "같은", "있습니다", "없습니다", "합니다", "됩니다", "입니다",
          "the", "and", "for", "that", "this", "with", "are", "was", "you", "have",
          "not", "but", "from", "they", "will", "can", "is", "it", "to", "of", "in", "on");

  // more specific endings first: 있습니다 and 없습니다 also end in 습니다
  private static final Map<String, String> CASUAL_ENDINGS = new LinkedHashMap<>();

  static {
    CASUAL_ENDINGS.put("있습니다", "있어요");
    CASUAL_ENDINGS.put("없습니다", "없어요");
    CASUAL_ENDINGS.put("입니다", "이에요");
    CASUAL_ENDINGS.put("합니다", "해요");
    CASUAL_ENDINGS.put("됩니다", "돼요");
    CASUAL_ENDINGS.put("습니다", "어요");
  }

  private static final String CASUAL_SUFFIX = "라는 내용이에요.";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public Optional<List<KeySummaryItem>> keySummary(String text) {
    return Optional.of(keySummaryItems(text));
  }

  @Override
  public Optional<CuratorSummary> curator(String text) {
    return Optional.of(curatorSummary(text));
  }

  @Override
  public Optional<List<TimelineSection>> timeline(String text) {
    return Optional.of(timelineSections(text));
  }

  /** One summary per paragraph, or a single placeholder when nothing usable remains. */
  List<KeySummaryItem> keySummaryItems(String text) {
    List<KeySummaryItem> items = new ArrayList<>();
    if (!isTooShort(text)) {
      for (String paragraph : segmentParagraphs(text)) {
        String summary = summarizeParagraph(paragraph);
        if (summary.length() >= MIN_PARAGRAPH_SUMMARY_LENGTH) {
          items.add(new KeySummaryItem(summary));
        }
      }
    }
    if (items.isEmpty()) {
      items.add(new KeySummaryItem(PLACEHOLDER_SUMMARY));
    }
    return items;
  }

  CuratorSummary curatorSummary(String text) {
    List<String> sentences =
        isTooShort(text) ? List.of() : sentences(text, PERIOD, MIN_CURATOR_SENTENCE_LENGTH);
    if (sentences.isEmpty()) {
      return new CuratorSummary(
          PLACEHOLDER_TITLE, PLACEHOLDER_SUMMARY, List.of(PLACEHOLDER_KEY_POINT));
    }

    String first = sentences.get(0);
    String title = first.length() > MAX_TITLE_LENGTH ? truncateWords(first, TITLE_WORDS) : first;

    List<String> window = sentences.subList(0, Math.min(ONE_LINE_WINDOW, sentences.size()));
    String oneLine = joinSentences(longestInOrder(window, 2));

    return new CuratorSummary(title, oneLine, keyPoints(sentences));
  }

  List<TimelineSection> timelineSections(String text) {
    List<List<String>> groups = timelineGroups(text);
    List<TimelineSection> sections = new ArrayList<>();
    for (int i = 0; i < groups.size(); i++) {
      List<String> group = groups.get(i);
      sections.add(timelineSection(i, group, joinSentences(longestInOrder(group, 2))));
    }
    return sections;
  }

  /**
   * Split text into paragraphs on blank lines.
   *
   * <p>Text without blank lines is split on single newlines instead, dropping fragments shorter
   * than {@value #MIN_LINE_LENGTH} characters.
   */
  static List<String> segmentParagraphs(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String[] blocks = BLANK_LINE.split(text.trim());
    if (blocks.length > 1) {
      return Arrays.stream(blocks)
          .map(String::trim)
          .filter(block -> !block.isEmpty())
          .collect(Collectors.toList());
    }
    return Arrays.stream(NEWLINE.split(text.trim()))
        .map(String::trim)
        .filter(line -> line.length() >= MIN_LINE_LENGTH)
        .collect(Collectors.toList());
  }

  /**
   * Group sentences into timeline paragraphs of at most {@value #GROUP_MAX_SENTENCES} sentences
   * or {@value #GROUP_MAX_CHARS} characters, capped at {@value #MAX_TIMELINE_SECTIONS} groups.
   */
  static List<List<String>> timelineGroups(String text) {
    if (isTooShort(text)) {
      return List.of();
    }
    List<String> sentences = sentences(text, SENTENCE_END, MIN_TIMELINE_SENTENCE_LENGTH);
    if (sentences.isEmpty()) {
      sentences = List.of(text.trim());
    }

    List<List<String>> groups = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentChars = 0;
    for (String sentence : sentences) {
      if (!current.isEmpty()
          && (current.size() == GROUP_MAX_SENTENCES
              || currentChars + sentence.length() > GROUP_MAX_CHARS)) {
        groups.add(current);
        current = new ArrayList<>();
        currentChars = 0;
      }
      current.add(sentence);
      currentChars += sentence.length();
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    return groups.size() > MAX_TIMELINE_SECTIONS
        ? groups.subList(0, MAX_TIMELINE_SECTIONS)
        : groups;
  }

  /** Build the section for group {@code index} around an already produced summary. */
  static TimelineSection timelineSection(int index, List<String> group, String summary) {
    String first = group.get(0);
    String subtitle =
        first.length() > MAX_SUBTITLE_LENGTH ? truncateWords(first, SUBTITLE_WORDS) : first;
    return new TimelineSection(
        timestamp(index), subtitle, summary, keywords(group), toCasual(first));
  }

  /** {@code (3i+1)-(3(i+1))분}: each section stands for roughly three minutes. */
  static String timestamp(int index) {
    return (3 * index + 1) + "-" + (3 * (index + 1)) + "분";
  }

  /** Rewrite formal sentence endings to casual ones, or append a casual suffix. */
  static String toCasual(String sentence) {
    String casual = sentence;
    for (Map.Entry<String, String> ending : CASUAL_ENDINGS.entrySet()) {
      casual = casual.replace(ending.getKey(), ending.getValue());
    }
    if (casual.equals(sentence)) {
      return stripTrailingPunctuation(sentence) + CASUAL_SUFFIX;
    }
    return endWithPeriod(casual);
  }

  static Set<String> keywords(List<String> sentences) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String sentence : sentences) {
      for (String word : NON_WORD.split(sentence.toLowerCase(Locale.ROOT))) {
        if (word.length() > 1 && !STOP_WORDS.contains(word)) {
          counts.merge(word, 1, Integer::sum);
        }
      }
    }
    // stable sort keeps first-seen order among equal counts
    return counts.entrySet().stream()
        .filter(entry -> entry.getValue() > 1)
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
        .limit(MAX_KEYWORDS)
        .map(Map.Entry::getKey)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static String summarizeParagraph(String paragraph) {
    if (paragraph.length() < SHORT_PARAGRAPH_LENGTH) {
      return paragraph;
    }
    List<String> sentences = sentences(paragraph, PERIOD, 0);
    if (sentences.size() <= 2) {
      return paragraph;
    }
    String first = sentences.get(0);
    String longest =
        sentences.subList(1, sentences.size()).stream()
            .max(Comparator.comparingInt(String::length))
            .orElse("");
    return joinSentences(List.of(first, longest));
  }

  /** The three longest sentences, skipping any that repeat the words of an earlier pick. */
  private static List<String> keyPoints(List<String> sentences) {
    List<String> byLength = new ArrayList<>(sentences);
    byLength.sort(Comparator.comparingInt(String::length).reversed());

    List<String> points = new ArrayList<>();
    List<Set<String>> chosenWords = new ArrayList<>();
    for (String candidate : byLength) {
      if (points.size() == KEY_POINTS) {
        break;
      }
      Set<String> words = words(candidate);
      boolean similar = chosenWords.stream().anyMatch(chosen -> overlaps(words, chosen));
      if (!similar) {
        points.add(endWithPeriod(candidate));
        chosenWords.add(words);
      }
    }
    return points;
  }

  private static boolean overlaps(Set<String> candidate, Set<String> chosen) {
    if (candidate.isEmpty()) {
      return false;
    }
    Set<String> common = new HashSet<>(candidate);
    common.retainAll(chosen);
    return common.size() > candidate.size() * MAX_WORD_OVERLAP;
  }

  private static Set<String> words(String sentence) {
    return Arrays.stream(WHITESPACE.split(sentence.trim()))
        .filter(word -> !word.isEmpty())
        .collect(Collectors.toSet());
  }

  /** The {@code n} longest sentences, in their original order. */
  private static List<String> longestInOrder(List<String> sentences, int n) {
    return IntStream.range(0, sentences.size())
        .boxed()
        .sorted(
            Comparator.<Integer>comparingInt(i -> sentences.get(i).length())
                .reversed()
                .thenComparing(Comparator.naturalOrder()))
        .limit(n)
        .sorted()
        .map(sentences::get)
        .collect(Collectors.toList());
  }

  private static List<String> sentences(String text, Pattern delimiter, int minLength) {
    return Arrays.stream(delimiter.split(text))
        .map(sentence -> WHITESPACE.matcher(sentence).replaceAll(" ").trim())
        .filter(sentence -> !sentence.isEmpty() && sentence.length() > minLength)
        .collect(Collectors.toList());
  }

  private static String truncateWords(String sentence, int maxWords) {
    String[] words = WHITESPACE.split(sentence.trim());
    int kept = Math.min(words.length, maxWords);
    return String.join(" ", Arrays.asList(words).subList(0, kept)) + "...";
  }

  private static String joinSentences(List<String> sentences) {
    return sentences.stream()
        .map(RuleBasedSummaryStrategy::endWithPeriod)
        .collect(Collectors.joining(" "));
  }

  private static String endWithPeriod(String sentence) {
    String trimmed = sentence.trim();
    if (trimmed.endsWith(".") || trimmed.endsWith("!") || trimmed.endsWith("?")) {
      return trimmed;
    }
    return trimmed + ".";
  }

  private static String stripTrailingPunctuation(String sentence) {
    String trimmed = sentence.trim();
    while (!trimmed.isEmpty() && ".!?".indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static boolean isTooShort(String text) {
    return text == null || text.trim().length() < MIN_INPUT_LENGTH;
  }
}
