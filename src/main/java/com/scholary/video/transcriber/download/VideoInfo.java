package com.scholary.video.transcriber.download;

/**
 * Metadata of a remote video.
 *
 * @param title video title
 * @param duration duration in seconds
 * @param uploader channel or uploader name
 * @param viewCount number of views
 */
public record VideoInfo(String title, long duration, String uploader, long viewCount) {}
