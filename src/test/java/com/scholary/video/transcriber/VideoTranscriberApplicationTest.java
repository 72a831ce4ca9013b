package com.scholary.video.transcriber;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.video.transcriber.summarization.LocalGenerativeSummaryStrategy;
import com.scholary.video.transcriber.summarization.RemoteGenerativeSummaryStrategy;
import com.scholary.video.transcriber.summarization.SummarizationFallbackChain;
import com.scholary.video.transcriber.transcription.SpeechBackend;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class VideoTranscriberApplicationTest {

  @Autowired private List<SpeechBackend> speechBackends;
  @Autowired private SummarizationFallbackChain summarizationChain;
  @Autowired private RemoteGenerativeSummaryStrategy remote;
  @Autowired private LocalGenerativeSummaryStrategy local;

  @Test
  void contextLoads_shouldWireBackendsAndSummarizers() {
    assertThat(speechBackends).extracting(SpeechBackend::name).containsExactlyInAnyOrder("whisper", "google");
    assertThat(summarizationChain).isNotNull();
    assertThat(remote.isAvailable()).isFalse();
    assertThat(local.isAvailable()).isFalse();
  }
}
