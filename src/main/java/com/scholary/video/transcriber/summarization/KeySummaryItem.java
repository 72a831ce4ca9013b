package com.scholary.video.transcriber.summarization;

/** Summary of one paragraph of the input. */
public record KeySummaryItem(String paragraphSummary) {}
