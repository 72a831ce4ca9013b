package com.scholary.video.transcriber.download;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloader backed by the yt-dlp command line tool.
 *
 * <p>Metadata comes from {@code yt-dlp --dump-single-json}. Audio is extracted with yt-dlp's
 * ffmpeg post-processor straight into the configured output directory. Every extraction gets a
 * file stem made of the sanitized title plus a random suffix, so jobs for the same video never
 * write to the same path.
 */
@Component
public class YtDlpVideoDownloader implements VideoDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpVideoDownloader.class);

  static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "wav", "m4a", "ogg", "flac");

  private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^\\w\\s\\-가-힣]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int MAX_FILENAME_LENGTH = 200;
  private static final int LOG_SNIPPET_MAX = 2_000;

  private final DownloaderProperties properties;
  private final ObjectMapper objectMapper;
  private final Path outputDir;

  public YtDlpVideoDownloader(DownloaderProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.outputDir = Paths.get(properties.outputDir()).toAbsolutePath().normalize();

    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create download directory: " + outputDir, e);
    }

    LOGGER.info(
        "Initialized yt-dlp downloader: binary={}, outputDir={}",
        properties.ytdlpBinary(),
        outputDir);
  }

  @Override
  public Optional<VideoInfo> fetchMetadata(String url) {
    List<String> cmd =
        List.of(properties.ytdlpBinary(), "--dump-single-json", "--no-playlist", "--no-warnings", url);

    try {
      ProcessResult result =
          runProcess(cmd, TimeUnit.SECONDS.toMillis(properties.metadataTimeoutSeconds()));
      if (!result.succeeded()) {
        LOGGER.warn(
            "yt-dlp metadata lookup failed: url={}, exit={}, timedOut={}, log={}",
            url,
            result.exitCode(),
            result.timedOut(),
            truncateLog(result.errorOutput()));
        return Optional.empty();
      }
      return Optional.of(parseMetadata(result.output()));
    } catch (IOException e) {
      LOGGER.warn("Failed to fetch video metadata: url={}, error={}", url, e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Metadata lookup interrupted: url={}", url);
      return Optional.empty();
    }
  }

  @Override
  public Optional<Path> extractAudio(String url, AudioFormat format, String title) {
    String stem = sanitizeFilename(title) + "-" + UUID.randomUUID().toString().substring(0, 8);
    Path expected = outputDir.resolve(stem + "." + format.value());

    List<String> cmd = new ArrayList<>();
    cmd.add(properties.ytdlpBinary());
    cmd.addAll(
        List.of(
            "-f", "bestaudio/best",
            "-x",
            "--audio-format", format.value(),
            "--audio-quality", properties.audioQuality(),
            "--no-playlist",
            "--no-progress",
            "-o", outputDir.resolve(stem + ".%(ext)s").toString()));
    cmd.add(url);

    LOGGER.info("Extracting audio: url={}, format={}, target={}", url, format.value(), expected);

    try {
      ProcessResult result =
          runProcess(cmd, TimeUnit.MINUTES.toMillis(properties.downloadTimeoutMinutes()));

      if (result.timedOut()) {
        LOGGER.warn(
            "yt-dlp timed out after {}m: url={}", properties.downloadTimeoutMinutes(), url);
        deleteStemFiles(stem);
        return Optional.empty();
      }

      Optional<Path> audio = locateAudio(stem, expected);
      if (result.exitCode() != 0) {
        // yt-dlp may report an error from a post-processing step after the audio was written
        LOGGER.warn(
            "yt-dlp exited with {}: url={}, audioPresent={}, log={}",
            result.exitCode(),
            url,
            audio.isPresent(),
            truncateLog(result.errorOutput()));
      }
      if (audio.isEmpty()) {
        deleteStemFiles(stem);
      } else {
        LOGGER.info("Audio extracted: {}", audio.get());
      }
      return audio;
    } catch (IOException e) {
      LOGGER.warn("Audio extraction failed: url={}, error={}", url, e.getMessage());
      deleteStemFiles(stem);
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Audio extraction interrupted: url={}", url);
      deleteStemFiles(stem);
      return Optional.empty();
    }
  }

  /** Map yt-dlp's JSON dump to {@link VideoInfo}, defaulting missing fields. */
  VideoInfo parseMetadata(String json) throws IOException {
    JsonNode node = objectMapper.readTree(json);
    if (node == null || !node.isObject()) {
      throw new IOException("yt-dlp returned no metadata object");
    }
    return new VideoInfo(
        node.path("title").asText("Unknown"),
        node.path("duration").asLong(0),
        node.path("uploader").asText("Unknown"),
        node.path("view_count").asLong(0));
  }

  /**
   * Make a title safe to use as a file name.
   *
   * <p>Keeps word characters, whitespace, hyphens and Hangul, collapses whitespace and caps the
   * length. Falls back to {@code audio} when nothing is left.
   */
  static String sanitizeFilename(String title) {
    if (title == null) {
      return "audio";
    }
    String safe = UNSAFE_FILENAME_CHARS.matcher(title).replaceAll("");
    safe = WHITESPACE.matcher(safe).replaceAll(" ").trim();
    if (safe.length() > MAX_FILENAME_LENGTH) {
      safe = safe.substring(0, MAX_FILENAME_LENGTH).trim();
    }
    return safe.isEmpty() ? "audio" : safe;
  }

  /** The expected file, or any audio file that yt-dlp wrote with our stem. */
  private Optional<Path> locateAudio(String stem, Path expected) throws IOException {
    if (Files.isRegularFile(expected)) {
      return Optional.of(expected);
    }
    try (Stream<Path> files = Files.list(outputDir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().startsWith(stem + "."))
          .filter(path -> AUDIO_EXTENSIONS.contains(extension(path)))
          .findFirst();
    }
  }

  /** Remove whatever yt-dlp left under this stem: partial downloads, fragments, audio. */
  private void deleteStemFiles(String stem) {
    List<Path> leftovers;
    try (Stream<Path> files = Files.list(outputDir)) {
      leftovers =
          files
              .filter(path -> path.getFileName().toString().startsWith(stem))
              .collect(Collectors.toList());
    } catch (IOException e) {
      LOGGER.warn("Failed to list download directory {}: {}", outputDir, e.getMessage());
      return;
    }
    for (Path leftover : leftovers) {
      try {
        Files.deleteIfExists(leftover);
        LOGGER.debug("Deleted leftover download file {}", leftover);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete leftover download file {}: {}", leftover, e.getMessage());
      }
    }
  }

  private static String extension(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * Run an external command, capturing stdout and stderr separately.
   *
   * <p>Each stream is read by its own thread for the lifetime of the process. The process and
   * anything it spawned are killed when it exceeds the timeout or the calling thread is
   * interrupted.
   */
  protected ProcessResult runProcess(List<String> cmd, long timeoutMillis)
      throws IOException, InterruptedException {
    LOGGER.debug("Executing: {}", String.join(" ", cmd));

    Process process = new ProcessBuilder(cmd).start();
    ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    Thread stdoutReader = startReader(process.getInputStream(), stdout, "yt-dlp-stdout");
    Thread stderrReader = startReader(process.getErrorStream(), stderr, "yt-dlp-stderr");

    boolean finished = false;
    try {
      finished = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
    } finally {
      if (!finished) {
        kill(process);
      }
    }
    if (!finished) {
      process.waitFor(5, TimeUnit.SECONDS);
    }
    stdoutReader.join();
    stderrReader.join();

    int exitCode = finished ? process.exitValue() : -1;
    return new ProcessResult(
        exitCode,
        stdout.toString(StandardCharsets.UTF_8),
        stderr.toString(StandardCharsets.UTF_8),
        !finished);
  }

  private static void kill(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private static Thread startReader(InputStream stream, ByteArrayOutputStream sink, String name) {
    Thread reader =
        new Thread(
            () -> {
              try (InputStream in = stream) {
                in.transferTo(sink);
              } catch (IOException e) {
                // a killed process closes its pipes; keep what was read so far
                LOGGER.debug("Process stream closed early: {}", e.getMessage());
              }
            },
            name);
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  private static String truncateLog(String output) {
    if (output == null || output.isBlank()) {
      return "<no output>";
    }
    return output.length() <= LOG_SNIPPET_MAX ? output : output.substring(0, LOG_SNIPPET_MAX) + "...";
  }
}
