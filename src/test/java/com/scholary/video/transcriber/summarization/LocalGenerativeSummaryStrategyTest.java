package com.scholary.video.transcriber.summarization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LocalGenerativeSummaryStrategyTest {

  private static final String TWO_PARAGRAPHS =
      "첫 번째 문단은 자바 언어의 역사를 소개합니다.\n\n두 번째 문단은 스프링 프레임워크를 설명합니다.";

  @Mock private LocalModelClient client;

  private final RuleBasedSummaryStrategy rules = new RuleBasedSummaryStrategy();

  @Test
  void keySummary_shouldSummarizeEachParagraph() {
    when(client.summarizeParagraph(contains("자바"))).thenReturn(Optional.of("자바의 역사"));
    when(client.summarizeParagraph(contains("스프링"))).thenReturn(Optional.of("스프링 소개"));
    LocalGenerativeSummaryStrategy strategy = new LocalGenerativeSummaryStrategy(client, rules);

    assertThat(strategy.keySummary(TWO_PARAGRAPHS))
        .contains(List.of(new KeySummaryItem("자바의 역사"), new KeySummaryItem("스프링 소개")));
  }

  @Test
  void keySummary_shouldBeEmptyWhenAnyParagraphGetsNoAnswer() {
    when(client.summarizeParagraph(contains("자바"))).thenReturn(Optional.of("자바의 역사"));
    when(client.summarizeParagraph(contains("스프링"))).thenReturn(Optional.empty());
    LocalGenerativeSummaryStrategy strategy = new LocalGenerativeSummaryStrategy(client, rules);

    assertThat(strategy.keySummary(TWO_PARAGRAPHS)).isEmpty();
  }

  @Test
  void curator_shouldKeepRuleBasedTitleAndPoints() {
    when(client.summarizeParagraph(anyString())).thenReturn(Optional.of("자바와 스프링 이야기"));
    LocalGenerativeSummaryStrategy strategy = new LocalGenerativeSummaryStrategy(client, rules);

    CuratorSummary summary = strategy.curator(TWO_PARAGRAPHS).orElseThrow();
    CuratorSummary base = rules.curatorSummary(TWO_PARAGRAPHS);

    assertThat(summary.title()).isEqualTo(base.title());
    assertThat(summary.keyPoints()).isEqualTo(base.keyPoints());
    assertThat(summary.oneLineSummary()).isEqualTo("자바와 스프링 이야기");
  }

  @Test
  void timeline_shouldUseModelSummaryPerSection() {
    when(client.summarizeParagraph(anyString())).thenReturn(Optional.of("구간 요약입니다"));
    LocalGenerativeSummaryStrategy strategy = new LocalGenerativeSummaryStrategy(client, rules);

    List<TimelineSection> sections = strategy.timeline(TWO_PARAGRAPHS).orElseThrow();

    assertThat(sections).isNotEmpty();
    assertThat(sections).allSatisfy(section -> assertThat(section.summary()).isEqualTo("구간 요약입니다"));
    assertThat(sections.get(0).timestamp()).isEqualTo("1-3분");
  }

  @Test
  void availability_shouldFollowClient() {
    when(client.isEnabled()).thenReturn(false);

    assertThat(new LocalGenerativeSummaryStrategy(client, rules).isAvailable()).isFalse();
  }
}
