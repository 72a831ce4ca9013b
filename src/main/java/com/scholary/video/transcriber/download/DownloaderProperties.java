package com.scholary.video.transcriber.download;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the yt-dlp based downloader.
 *
 * @param ytdlpBinary yt-dlp executable name or path
 * @param outputDir directory that receives extracted audio files
 * @param audioQuality yt-dlp audio quality argument, e.g. {@code 192K}
 * @param metadataTimeoutSeconds time limit for a metadata lookup
 * @param downloadTimeoutMinutes time limit for a download plus conversion
 */
@ConfigurationProperties(prefix = "downloader")
@Validated
public record DownloaderProperties(
    @NotBlank String ytdlpBinary,
    @NotBlank String outputDir,
    @NotBlank String audioQuality,
    @Positive int metadataTimeoutSeconds,
    @Positive int downloadTimeoutMinutes) {}
