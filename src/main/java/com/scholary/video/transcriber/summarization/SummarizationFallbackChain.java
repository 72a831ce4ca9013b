package com.scholary.video.transcriber.summarization;

import com.scholary.video.transcriber.logging.StructuredLogger;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces summaries by trying strategies in priority order.
 *
 * <p>Generative tiers are tried first. A tier that is unavailable, returns nothing usable, or
 * throws is skipped. The rule-based tier always answers last; a fault inside it is the only
 * failure that escapes, as a {@link SummarizationException}.
 *
 * <p>Input shorter than 20 characters goes straight to the rule-based tier.
 */
public class SummarizationFallbackChain {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummarizationFallbackChain.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final List<SummaryStrategy> generativeTiers;
  private final RuleBasedSummaryStrategy ruleBased;

  public SummarizationFallbackChain(
      List<SummaryStrategy> generativeTiers, RuleBasedSummaryStrategy ruleBased) {
    this.generativeTiers = List.copyOf(generativeTiers);
    this.ruleBased = ruleBased;
  }

  public List<KeySummaryItem> keySummary(String text) {
    return summarize(
        SummaryMode.KEY_SUMMARY,
        text,
        strategy -> strategy.keySummary(text),
        items -> !items.isEmpty());
  }

  public CuratorSummary curator(String text) {
    return summarize(
        SummaryMode.CURATOR,
        text,
        strategy -> strategy.curator(text),
        summary ->
            summary.title() != null
                && !summary.title().isBlank()
                && !summary.keyPoints().isEmpty());
  }

  public List<TimelineSection> timeline(String text) {
    return summarize(
        SummaryMode.TIMELINE_SUMMARY,
        text,
        strategy -> strategy.timeline(text),
        sections -> !sections.isEmpty());
  }

  private <T> T summarize(
      SummaryMode mode,
      String text,
      Function<SummaryStrategy, Optional<T>> attempt,
      Predicate<T> usable) {
    if (text != null && text.trim().length() >= RuleBasedSummaryStrategy.MIN_INPUT_LENGTH) {
      for (SummaryStrategy tier : generativeTiers) {
        Optional<T> result = tryTier(mode, tier, attempt, usable);
        if (result.isPresent()) {
          return result.get();
        }
      }
    } else {
      structuredLogger.logSummaryTier(mode.value(), "generative", "skipped_short_input");
    }

    try {
      T result =
          attempt
              .apply(ruleBased)
              .orElseThrow(() -> new SummarizationException("요약 결과를 만들 수 없습니다"));
      structuredLogger.logSummaryTier(mode.value(), ruleBased.name(), "answered");
      return result;
    } catch (SummarizationException e) {
      throw e;
    } catch (RuntimeException e) {
      LOGGER.error("Rule-based summarizer failed for mode {}", mode.value(), e);
      throw new SummarizationException("요약 처리 중 오류가 발생했습니다: " + e.getMessage(), e);
    }
  }

  private <T> Optional<T> tryTier(
      SummaryMode mode,
      SummaryStrategy tier,
      Function<SummaryStrategy, Optional<T>> attempt,
      Predicate<T> usable) {
    if (!tier.isAvailable()) {
      structuredLogger.logSummaryTier(mode.value(), tier.name(), "unavailable");
      return Optional.empty();
    }
    try {
      Optional<T> result = attempt.apply(tier).filter(usable);
      structuredLogger.logSummaryTier(
          mode.value(), tier.name(), result.isPresent() ? "answered" : "empty");
      return result;
    } catch (RuntimeException e) {
      LOGGER.warn("Summary tier {} failed for mode {}: {}", tier.name(), mode.value(), e.getMessage());
      structuredLogger.logSummaryTier(mode.value(), tier.name(), "fault");
      return Optional.empty();
    }
  }
}
