package com.scholary.video.transcriber.download;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates remote videos and pulls their audio track to local disk.
 *
 * <p>Both operations report failure as an empty result rather than an exception; the caller turns
 * an empty result into a failed job.
 */
public interface VideoDownloader {

  /**
   * Fetch the video's metadata without downloading it.
   *
   * @param url the video URL
   * @return the metadata, or empty if it could not be fetched
   */
  Optional<VideoInfo> fetchMetadata(String url);

  /**
   * Download the video's audio and convert it to the requested format.
   *
   * @param url the video URL
   * @param format the target audio format
   * @param title the video title, used to name the file (may be null)
   * @return path of the extracted audio file, or empty if extraction failed
   */
  Optional<Path> extractAudio(String url, AudioFormat format, String title);
}
