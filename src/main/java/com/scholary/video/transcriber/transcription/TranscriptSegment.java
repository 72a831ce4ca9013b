package com.scholary.video.transcriber.transcription;

/**
 * A timed piece of a transcript.
 *
 * @param start start offset in seconds
 * @param end end offset in seconds
 * @param text recognized text
 */
public record TranscriptSegment(double start, double end, String text) {}
