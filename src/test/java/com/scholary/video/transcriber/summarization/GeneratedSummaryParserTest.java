package com.scholary.video.transcriber.summarization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeneratedSummaryParserTest {

  private final GeneratedSummaryParser parser = new GeneratedSummaryParser(new ObjectMapper());

  @Test
  void parseKeySummary_shouldAcceptWrappedObject() {
    String content =
        "{\"summaries\": [{\"paragraph_summary\": \"첫 문단 요약\"}, {\"paragraph_summary\": \" \"}]}";

    assertThat(parser.parseKeySummary(content))
        .contains(List.of(new KeySummaryItem("첫 문단 요약")));
  }

  @Test
  void parseKeySummary_shouldAcceptFencedBareArrayOfStrings() {
    String content = "```json\n[\"하나\", \"둘\"]\n```";

    assertThat(parser.parseKeySummary(content))
        .contains(List.of(new KeySummaryItem("하나"), new KeySummaryItem("둘")));
  }

  @Test
  void parseKeySummary_shouldRejectInvalidJson() {
    assertThat(parser.parseKeySummary("요약: 첫 문단은...")).isEmpty();
    assertThat(parser.parseKeySummary("")).isEmpty();
    assertThat(parser.parseKeySummary("{\"summaries\": []}")).isEmpty();
  }

  @Test
  void parseCurator_shouldReadAllFields() {
    String content =
        "{\"title\": \"제목\", \"one_line_summary\": \"한 줄\", \"key_points\": [\"가\", \"나\", 3]}";

    assertThat(parser.parseCurator(content))
        .contains(new CuratorSummary("제목", "한 줄", List.of("가", "나")));
  }

  @Test
  void parseCurator_shouldRejectMissingFields() {
    assertThat(parser.parseCurator("{\"title\": \"제목\", \"key_points\": [\"가\"]}")).isEmpty();
    assertThat(parser.parseCurator("{\"title\": \"제목\", \"one_line_summary\": \"한 줄\"}"))
        .isEmpty();
  }

  @Test
  void parseTimeline_shouldCapSectionsAndDefaultOneliner() {
    StringBuilder content = new StringBuilder("{\"sections\": [");
    for (int i = 0; i < 10; i++) {
      if (i > 0) {
        content.append(",");
      }
      content
          .append("{\"timestamp\": \"")
          .append(3 * i + 1)
          .append("-")
          .append(3 * i + 3)
          .append("분\", \"subtitle\": \"소제목\", \"summary\": \"요약\", \"keywords\": [\"키워드\"]}");
    }
    content.append("]}");

    List<TimelineSection> sections = parser.parseTimeline(content.toString(), 8).orElseThrow();

    assertThat(sections).hasSize(8);
    assertThat(sections.get(7).timestamp()).isEqualTo("22-24분");
    assertThat(sections.get(0).keywords()).containsExactly("키워드");
    assertThat(sections.get(0).onelineSummary()).isEqualTo("요약");
  }

  @Test
  void parseTimeline_shouldRenumberTimestampsAndCapKeywords() {
    String content =
        "{\"sections\": ["
            + "{\"timestamp\": \"00:00-05:00\", \"subtitle\": \"도입\", \"summary\": \"요약\","
            + " \"keywords\": [\"a\", \"b\", \"c\", \"d\", \"e\", \"f\"]},"
            + "{\"subtitle\": \"본론\", \"summary\": \"요약\"}]}";

    List<TimelineSection> sections = parser.parseTimeline(content, 8).orElseThrow();

    assertThat(sections).extracting(TimelineSection::timestamp).containsExactly("1-3분", "4-6분");
    assertThat(sections.get(0).keywords()).containsExactly("a", "b", "c", "d");
    assertThat(sections.get(1).keywords()).isEmpty();
  }

  @Test
  void parseTimeline_shouldRejectSectionWithoutSummary() {
    String content =
        "[{\"timestamp\": \"1-3분\", \"subtitle\": \"소제목\", \"summary\": \"요약\"},"
            + " {\"timestamp\": \"4-6분\", \"subtitle\": \"소제목\"}]";

    assertThat(parser.parseTimeline(content, 8)).isEmpty();
  }
}
