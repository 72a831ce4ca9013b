package com.scholary.video.transcriber.transcription;

import com.scholary.video.transcriber.config.TranscriberProperties;
import com.scholary.video.transcriber.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the speech backends a request asks for and shapes their outcomes into a {@link
 * TranscriptionResult}.
 *
 * <p>The audio file is checked once before any backend runs. Backend faults never escape this
 * class: each one becomes a failed {@link BackendResult}. When several backends are requested
 * they run concurrently on the backend executor and a failure in one has no effect on the others.
 */
@Service
public class TranscriptionCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionCoordinator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Set<String> LISTED_AUDIO_EXTENSIONS = Set.of("mp3", "wav", "m4a", "ogg");
  private static final int MAX_LISTED_FILES = 5;

  private final Map<String, SpeechBackend> backends;
  private final Executor backendExecutor;
  private final boolean requireAnyBackendSuccess;

  public TranscriptionCoordinator(
      List<SpeechBackend> backends,
      @Qualifier("backendExecutor") Executor backendExecutor,
      TranscriberProperties properties) {
    this.backends =
        backends.stream()
            .collect(
                Collectors.toMap(
                    SpeechBackend::name,
                    Function.identity(),
                    (first, second) -> first,
                    LinkedHashMap::new));
    this.backendExecutor = backendExecutor;
    this.requireAnyBackendSuccess = properties.requireAnyBackendSuccess();

    LOGGER.info(
        "Initialized transcription coordinator: backends={}, requireAnyBackendSuccess={}",
        this.backends.keySet(),
        requireAnyBackendSuccess);
  }

  /**
   * Transcribe an audio file with the requested method.
   *
   * @param audioFile the local audio file
   * @param method which backend(s) to run
   * @param options hints passed to every backend
   * @return a single-backend result, or a multi-backend result for {@link
   *     TranscriptionMethod#BOTH}
   */
  public TranscriptionResult transcribe(
      Path audioFile, TranscriptionMethod method, TranscriptionOptions options) {
    Optional<String> problem = checkAudioFile(audioFile);
    if (problem.isPresent()) {
      LOGGER.warn("Audio file check failed: {}", problem.get());
      return BackendResult.failure(method.value(), problem.get());
    }

    List<String> names = method.backendNames();
    if (names.size() == 1) {
      return runBackend(names.get(0), audioFile, options);
    }
    return runAll(method, names, audioFile, options);
  }

  private MultiBackendResult runAll(
      TranscriptionMethod method, List<String> names, Path audioFile, TranscriptionOptions options) {
    Map<String, CompletableFuture<BackendResult>> futures = new LinkedHashMap<>();
    for (String name : names) {
      futures.put(name, dispatch(name, audioFile, options));
    }

    Map<String, BackendResult> results = new LinkedHashMap<>();
    for (Map.Entry<String, CompletableFuture<BackendResult>> entry : futures.entrySet()) {
      results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
    }

    MultiBackendResult dispatched = new MultiBackendResult(method.value(), results, true, null);
    if (dispatched.anyBackendSucceeded()) {
      return dispatched;
    }

    LOGGER.warn("All backends failed for method {}: {}", method.value(), results.keySet());
    if (!requireAnyBackendSuccess) {
      return dispatched;
    }
    return new MultiBackendResult(method.value(), results, false, "모든 음성 인식 방법이 실패했습니다");
  }

  private CompletableFuture<BackendResult> dispatch(
      String name, Path audioFile, TranscriptionOptions options) {
    try {
      return CompletableFuture.supplyAsync(
          () -> runBackend(name, audioFile, options), backendExecutor);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Backend executor saturated, running {} on the caller thread", name);
      return CompletableFuture.completedFuture(runBackend(name, audioFile, options));
    }
  }

  private BackendResult await(String name, CompletableFuture<BackendResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return BackendResult.failure(name, "음성 인식이 중단되었습니다");
    } catch (ExecutionException e) {
      // runBackend converts faults itself; reaching this means the task could not run at all
      String cause = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
      return BackendResult.failure(name, cause);
    }
  }

  /** Run one backend, converting every fault into a failed result. */
  BackendResult runBackend(String name, Path audioFile, TranscriptionOptions options) {
    SpeechBackend backend = backends.get(name);
    if (backend == null) {
      return BackendResult.failure(name, "지원하지 않는 방법: " + name);
    }

    long startMs = System.currentTimeMillis();
    BackendResult result;
    try {
      result = BackendResult.of(name, backend.transcribe(audioFile, options));
    } catch (SpeechBackendException e) {
      result = BackendResult.failure(name, e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected fault in backend {}", name, e);
      result = BackendResult.failure(name, describe(e));
    }

    structuredLogger.logBackendResult(
        name, result.success(), System.currentTimeMillis() - startMs, result.error());
    return result;
  }

  /**
   * Check that the audio file exists and has content.
   *
   * <p>When the file is missing, the message lists the audio files that do exist in the same
   * directory.
   *
   * @return a description of the problem, or empty if the file is usable
   */
  static Optional<String> checkAudioFile(Path audioFile) {
    if (audioFile == null || audioFile.toString().isBlank()) {
      return Optional.of("오디오 파일 경로가 제공되지 않았습니다.");
    }

    if (!Files.exists(audioFile)) {
      Path directory = audioFile.toAbsolutePath().getParent();
      if (directory != null && Files.isDirectory(directory)) {
        return Optional.of(
            "파일을 찾을 수 없습니다: "
                + audioFile
                + "\n디렉토리 "
                + directory
                + "의 오디오 파일들: "
                + listAudioFiles(directory));
      }
      return Optional.of(
          "파일을 찾을 수 없습니다: " + audioFile + "\n디렉토리도 존재하지 않습니다: " + directory);
    }

    try {
      long size = Files.size(audioFile);
      if (size == 0) {
        return Optional.of("오디오 파일이 비어있습니다: " + audioFile);
      }
      LOGGER.info(
          "Audio file size: {} bytes ({} MB)", size, String.format("%.2f", size / 1024.0 / 1024.0));
    } catch (IOException e) {
      return Optional.of("파일 접근 오류: " + audioFile + " - " + e.getMessage());
    }
    return Optional.empty();
  }

  private static String listAudioFiles(Path directory) {
    List<String> names;
    try (Stream<Path> files = Files.list(directory)) {
      names =
          files
              .map(path -> path.getFileName().toString())
              .filter(name -> LISTED_AUDIO_EXTENSIONS.contains(extension(name)))
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException e) {
      return "(목록을 읽을 수 없습니다: " + e.getMessage() + ")";
    }

    String listed = String.join(", ", names.subList(0, Math.min(MAX_LISTED_FILES, names.size())));
    if (names.size() > MAX_LISTED_FILES) {
      listed += " (그 외 " + (names.size() - MAX_LISTED_FILES) + "개 더)";
    }
    return listed;
  }

  private static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
