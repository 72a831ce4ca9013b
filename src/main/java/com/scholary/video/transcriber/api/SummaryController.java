package com.scholary.video.transcriber.api;

import com.scholary.video.transcriber.summarization.SummarizationFallbackChain;
import com.scholary.video.transcriber.summarization.SummaryMode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for summarizing text.
 *
 * <p>Summaries are produced synchronously. The response shape depends on the mode: a list of
 * paragraph summaries ({@code key_summary}), a single digest ({@code curator}) or a list of
 * timeline sections ({@code timeline_summary}).
 */
@RestController
@Tag(name = "Summarization", description = "Transcript summarization API")
public class SummaryController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryController.class);

  private final SummarizationFallbackChain summarizationChain;

  public SummaryController(SummarizationFallbackChain summarizationChain) {
    this.summarizationChain = summarizationChain;
  }

  @PostMapping("/summarize/{mode}")
  @Operation(
      summary = "Summarize text",
      description = "Summarize text as key_summary, curator or timeline_summary (alias timeline)")
  public Object summarize(@PathVariable String mode, @Valid @RequestBody SummarizeRequest request) {
    SummaryMode summaryMode;
    try {
      summaryMode = SummaryMode.fromValue(mode);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("지원하지 않는 요약 방식입니다: " + mode, e);
    }

    LOGGER.info("Summary request: mode={}, length={}", summaryMode.value(), request.text().length());

    switch (summaryMode) {
      case KEY_SUMMARY:
        return summarizationChain.keySummary(request.text());
      case CURATOR:
        return summarizationChain.curator(request.text());
      case TIMELINE_SUMMARY:
        return summarizationChain.timeline(request.text());
      default:
        throw new IllegalStateException("Unhandled summary mode: " + summaryMode);
    }
  }
}
