package com.scholary.video.transcriber.api;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.video.transcriber.summarization.CuratorSummary;
import com.scholary.video.transcriber.summarization.KeySummaryItem;
import com.scholary.video.transcriber.summarization.SummarizationException;
import com.scholary.video.transcriber.summarization.SummarizationFallbackChain;
import com.scholary.video.transcriber.summarization.TimelineSection;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SummaryController.class)
class SummaryControllerTest {

  private static final String BODY = "{\"text\": \"요약할 스크립트 내용입니다\"}";

  @Autowired private MockMvc mockMvc;

  @MockBean private SummarizationFallbackChain summarizationChain;

  @Test
  void summarize_shouldReturnKeySummaryArray() throws Exception {
    when(summarizationChain.keySummary("요약할 스크립트 내용입니다"))
        .thenReturn(List.of(new KeySummaryItem("첫 문단 요약")));

    mockMvc
        .perform(
            post("/summarize/key_summary").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].paragraph_summary").value("첫 문단 요약"));
  }

  @Test
  void summarize_shouldReturnCuratorObject() throws Exception {
    when(summarizationChain.curator(anyString()))
        .thenReturn(new CuratorSummary("제목", "한 줄 요약", List.of("포인트 하나", "포인트 둘")));

    mockMvc
        .perform(post("/summarize/curator").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("제목"))
        .andExpect(jsonPath("$.one_line_summary").value("한 줄 요약"))
        .andExpect(jsonPath("$.key_points[1]").value("포인트 둘"));
  }

  @Test
  void summarize_shouldAcceptTimelineAlias() throws Exception {
    when(summarizationChain.timeline(anyString()))
        .thenReturn(
            List.of(new TimelineSection("1-3분", "소제목", "요약", Set.of("자바"), "자바 얘기예요.")));

    mockMvc
        .perform(post("/summarize/timeline").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].timestamp").value("1-3분"))
        .andExpect(jsonPath("$[0].keywords[0]").value("자바"))
        .andExpect(jsonPath("$[0].oneline_summary").value("자바 얘기예요."));
  }

  @Test
  void summarize_shouldRejectUnknownMode() throws Exception {
    mockMvc
        .perform(post("/summarize/bullet").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("지원하지 않는 요약 방식입니다: bullet"));

    verify(summarizationChain, never()).keySummary(anyString());
  }

  @Test
  void summarize_shouldRejectMissingText() throws Exception {
    mockMvc
        .perform(post("/summarize/curator").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("요약할 텍스트를 입력해주세요"));
  }

  @Test
  void summarize_shouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(
            post("/summarize/curator").contentType(MediaType.APPLICATION_JSON).content("{text"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void summarize_shouldReturn500WhenRulesFail() throws Exception {
    when(summarizationChain.keySummary(anyString()))
        .thenThrow(new SummarizationException("요약 처리 중 오류가 발생했습니다: boom"));

    mockMvc
        .perform(
            post("/summarize/key_summary").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.detail").value("요약 처리 중 오류가 발생했습니다: boom"));
  }
}
