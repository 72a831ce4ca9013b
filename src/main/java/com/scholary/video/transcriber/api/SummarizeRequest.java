package com.scholary.video.transcriber.api;

import jakarta.validation.constraints.NotNull;

/** Text to summarize, usually a transcript. */
public record SummarizeRequest(@NotNull(message = "요약할 텍스트를 입력해주세요") String text) {}
