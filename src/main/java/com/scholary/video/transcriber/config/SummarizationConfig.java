package com.scholary.video.transcriber.config;

import com.scholary.video.transcriber.summarization.LocalGenerativeSummaryStrategy;
import com.scholary.video.transcriber.summarization.RemoteGenerativeSummaryStrategy;
import com.scholary.video.transcriber.summarization.RuleBasedSummaryStrategy;
import com.scholary.video.transcriber.summarization.SummarizationFallbackChain;
import com.scholary.video.transcriber.summarization.SummarizationProperties;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for summarization.
 *
 * <p>Wires the fallback chain in its fixed tier order: remote model, local model, rules.
 */
@Configuration
@EnableConfigurationProperties(SummarizationProperties.class)
public class SummarizationConfig {

  @Bean
  public SummarizationFallbackChain summarizationFallbackChain(
      RemoteGenerativeSummaryStrategy remote,
      LocalGenerativeSummaryStrategy local,
      RuleBasedSummaryStrategy ruleBased) {
    return new SummarizationFallbackChain(List.of(remote, local), ruleBased);
  }
}
