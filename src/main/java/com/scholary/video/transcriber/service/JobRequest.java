package com.scholary.video.transcriber.service;

import com.scholary.video.transcriber.download.AudioFormat;
import com.scholary.video.transcriber.transcription.TranscriptionMethod;

/**
 * A validated transcription request.
 *
 * @param url video URL
 * @param format audio format to extract
 * @param method speech backend(s) to run
 * @param model model size hint for backends that support it
 */
public record JobRequest(
    String url, AudioFormat format, TranscriptionMethod method, String model) {}
