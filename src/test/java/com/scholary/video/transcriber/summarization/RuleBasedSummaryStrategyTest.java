package com.scholary.video.transcriber.summarization;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class RuleBasedSummaryStrategyTest {

  private final RuleBasedSummaryStrategy strategy = new RuleBasedSummaryStrategy();

  @Test
  void keySummary_singleBlockShouldCombineFirstAndLongestSentence() {
    String text =
        "첫 번째 문장은 꽤 길게 작성된 소개 문장입니다. "
            + "두 번째 문장도 스무 글자를 넘는 설명입니다. "
            + "세 번째 문장은 가장 길고 자세한 내용을 담고 있는 문장입니다. "
            + "네 번째 문장 역시 충분히 긴 문장입니다. "
            + "다섯 번째 문장으로 글을 마무리합니다.";

    List<KeySummaryItem> items = strategy.keySummaryItems(text);

    assertThat(items)
        .containsExactly(
            new KeySummaryItem(
                "첫 번째 문장은 꽤 길게 작성된 소개 문장입니다. 세 번째 문장은 가장 길고 자세한 내용을 담고 있는 문장입니다."));
  }

  @Test
  void keySummary_shouldKeepShortParagraphsVerbatim() {
    String text = "짧은 첫 문단입니다\n\n두 번째 문단은 한 문장입니다. 그리고 두 번째 문장입니다.";

    List<KeySummaryItem> items = strategy.keySummaryItems(text);

    assertThat(items)
        .extracting(KeySummaryItem::paragraphSummary)
        .containsExactly("짧은 첫 문단입니다", "두 번째 문단은 한 문장입니다. 그리고 두 번째 문장입니다.");
  }

  @Test
  void keySummary_shouldDropTinyParagraphs() {
    String text = "좋아요\n\n이 문단은 충분히 길어서 요약 결과로 남습니다.";

    List<KeySummaryItem> items = strategy.keySummaryItems(text);

    assertThat(items)
        .extracting(KeySummaryItem::paragraphSummary)
        .containsExactly("이 문단은 충분히 길어서 요약 결과로 남습니다.");
  }

  @Test
  void keySummary_shortInputShouldYieldPlaceholder() {
    assertThat(strategy.keySummaryItems("짧은 글"))
        .containsExactly(new KeySummaryItem(RuleBasedSummaryStrategy.PLACEHOLDER_SUMMARY));
    assertThat(strategy.keySummaryItems(""))
        .containsExactly(new KeySummaryItem(RuleBasedSummaryStrategy.PLACEHOLDER_SUMMARY));
  }

  @Test
  void segmentParagraphs_shouldFallBackToLinesAndDropShortFragments() {
    String text = "첫 번째 줄은 충분히 깁니다\n짧음\n세 번째 줄도 충분히 깁니다";

    assertThat(RuleBasedSummaryStrategy.segmentParagraphs(text))
        .containsExactly("첫 번째 줄은 충분히 깁니다", "세 번째 줄도 충분히 깁니다");
  }

  @Test
  void curator_shouldBuildTitleOneLinerAndDistinctKeyPoints() {
    String s1 = "파이썬은 배우기 쉬운 프로그래밍 언어입니다";
    String s2 = "파이썬은 배우기 쉬운 프로그래밍 언어라서 인기가 많습니다";
    String s3 = "데이터 분석 분야에서는 판다스 라이브러리를 널리 사용합니다";
    String text = s1 + ". " + s2 + ". " + s3 + ".";

    CuratorSummary summary = strategy.curatorSummary(text);

    assertThat(summary.title()).isEqualTo(s1);
    assertThat(summary.oneLineSummary()).isEqualTo(s2 + ". " + s3 + ".");
    // s1 repeats most of s2's words
    assertThat(summary.keyPoints()).containsExactlyInAnyOrder(s2 + ".", s3 + ".");
  }

  @Test
  void curator_keyPointsShouldNeverShareMoreThanHalfTheirWords() {
    String text =
        "인공지능 모델은 많은 데이터를 학습해서 성능이 좋아집니다. "
            + "인공지능 모델은 많은 데이터를 학습해서 성능이 크게 좋아집니다. "
            + "클라우드 비용은 사용량에 따라 달라지므로 주의가 필요합니다. "
            + "클라우드 비용은 사용량에 따라 달라지므로 항상 주의가 필요합니다. "
            + "좋은 개발 습관은 테스트를 먼저 작성하는 것에서 시작합니다.";

    List<String> points = strategy.curatorSummary(text).keyPoints();

    assertThat(points).hasSize(3);
    for (int i = 0; i < points.size(); i++) {
      for (int j = 0; j < points.size(); j++) {
        if (i != j) {
          Set<String> a = words(points.get(i));
          Set<String> common = new HashSet<>(a);
          common.retainAll(words(points.get(j)));
          assertThat(common.size()).isLessThanOrEqualTo(a.size() / 2);
        }
      }
    }
  }

  @Test
  void curator_longFirstSentenceShouldBeTruncatedToTenWords() {
    String first = String.join(" ", Collections.nCopies(30, "단어입니다"));
    String text = first + ". 두 번째 문장은 평범한 길이의 문장입니다.";

    CuratorSummary summary = strategy.curatorSummary(text);

    assertThat(summary.title())
        .isEqualTo(String.join(" ", Collections.nCopies(10, "단어입니다")) + "...");
  }

  @Test
  void curator_longFirstSentenceWithFewWordsShouldStillGetEllipsis() {
    String first = String.join(" ", Collections.nCopies(5, "가".repeat(25)));
    String text = first + ". 두 번째 문장은 평범한 길이의 문장입니다.";

    CuratorSummary summary = strategy.curatorSummary(text);

    assertThat(first).hasSizeGreaterThan(100);
    assertThat(summary.title()).isEqualTo(first + "...");
  }

  @Test
  void curator_shortInputShouldYieldPlaceholder() {
    CuratorSummary summary = strategy.curatorSummary("안녕하세요");

    assertThat(summary.title()).isEqualTo(RuleBasedSummaryStrategy.PLACEHOLDER_TITLE);
    assertThat(summary.keyPoints()).containsExactly(RuleBasedSummaryStrategy.PLACEHOLDER_KEY_POINT);
  }

  @Test
  void timeline_shouldCapSectionsAndNumberTimestamps() {
    List<String> sentences = new ArrayList<>();
    for (int i = 1; i <= 40; i++) {
      sentences.add("이것은 타임라인 테스트를 위한 문장 번호 " + i + "입니다");
    }
    String text = String.join(". ", sentences) + ".";

    List<TimelineSection> sections = strategy.timelineSections(text);

    assertThat(sections).hasSize(RuleBasedSummaryStrategy.MAX_TIMELINE_SECTIONS);
    Pattern timestamp = Pattern.compile("(\\d+)-(\\d+)분");
    for (int i = 0; i < sections.size(); i++) {
      Matcher matcher = timestamp.matcher(sections.get(i).timestamp());
      assertThat(matcher.matches()).isTrue();
      int start = Integer.parseInt(matcher.group(1));
      int end = Integer.parseInt(matcher.group(2));
      assertThat(start).isEqualTo(3 * i + 1);
      assertThat(end).isEqualTo(start + 2);
    }
    assertThat(sections.get(0).subtitle()).isEqualTo("이것은 타임라인 테스트를 위한 문장 번호 1입니다");
    assertThat(sections.get(1).subtitle()).isEqualTo("이것은 타임라인 테스트를 위한 문장 번호 5입니다");
  }

  @Test
  void timeline_shouldCloseGroupsAtThreeHundredCharacters() {
    String longSentence = String.join(" ", Collections.nCopies(20, "가나다라마")) + " 입니다";
    String text = String.join(". ", Collections.nCopies(5, longSentence)) + ".";

    List<List<String>> groups = RuleBasedSummaryStrategy.timelineGroups(text);

    assertThat(longSentence.length()).isGreaterThan(100).isLessThan(150);
    assertThat(groups).extracting(List::size).containsExactly(2, 2, 1);
  }

  @Test
  void timeline_shortInputShouldBeEmpty() {
    assertThat(strategy.timelineSections("너무 짧은 입력")).isEmpty();
    assertThat(strategy.timelineSections(null)).isEmpty();
  }

  @Test
  void timeline_inputWithOnlyShortSentencesShouldBecomeOneSection() {
    String text = "짧은 문장. 또 짧은 문장. 마지막 문장.";

    List<TimelineSection> sections = strategy.timelineSections(text);

    assertThat(sections).hasSize(1);
    assertThat(sections.get(0).timestamp()).isEqualTo("1-3분");
    assertThat(sections.get(0).subtitle()).isEqualTo(text);
  }

  @Test
  void toCasual_shouldRewriteFormalEndings() {
    assertThat(RuleBasedSummaryStrategy.toCasual("오늘은 자바를 공부합니다")).isEqualTo("오늘은 자바를 공부해요.");
    assertThat(RuleBasedSummaryStrategy.toCasual("시간이 없습니다")).isEqualTo("시간이 없어요.");
    assertThat(RuleBasedSummaryStrategy.toCasual("좋은 방법이 있습니다")).isEqualTo("좋은 방법이 있어요.");
    assertThat(RuleBasedSummaryStrategy.toCasual("이것은 예시입니다")).isEqualTo("이것은 예시이에요.");
    assertThat(RuleBasedSummaryStrategy.toCasual("잘 됩니다")).isEqualTo("잘 돼요.");
    assertThat(RuleBasedSummaryStrategy.toCasual("결과를 얻었습니다")).isEqualTo("결과를 얻었어요.");
  }

  @Test
  void toCasual_shouldAppendSuffixWhenNoFormalEnding() {
    assertThat(RuleBasedSummaryStrategy.toCasual("새로운 기능 소개!")).isEqualTo("새로운 기능 소개라는 내용이에요.");
  }

  @Test
  void keywords_shouldKeepRepeatedWordsByFrequency() {
    Set<String> keywords =
        RuleBasedSummaryStrategy.keywords(
            List.of("자바 스프링 자바 그리고", "스프링 자바 부트 그리고 그리고 Java java"));

    assertThat(keywords).containsExactly("자바", "스프링", "java");
  }

  @Test
  void strategy_shouldAlwaysBeAvailable() {
    assertThat(strategy.isAvailable()).isTrue();
    assertThat(strategy.keySummary("짧음")).isPresent();
    assertThat(strategy.curator("짧음")).isPresent();
    assertThat(strategy.timeline("짧음")).contains(List.of());
  }

  private static Set<String> words(String sentence) {
    return new HashSet<>(List.of(sentence.replace(".", "").split("\\s+")));
  }
}
