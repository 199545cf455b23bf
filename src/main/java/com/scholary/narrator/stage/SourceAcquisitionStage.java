package com.scholary.narrator.stage;

import com.scholary.narrator.job.JobParameters;
import com.scholary.narrator.job.SourceSpec;
import com.scholary.narrator.tool.ToolInvocationException;
import com.scholary.narrator.tool.ToolResult;
import com.scholary.narrator.tool.ToolService;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places the job's source audio in its run directory.
 *
 * <p>Local files are copied, direct links are downloaded, and video pages are handed to the
 * acquisition service's {@code extract_audio_to_file} tool, which writes the file itself.
 */
public class SourceAcquisitionStage implements Stage<SourceSpec, AcquiredAudio> {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceAcquisitionStage.class);

  static final String SERVICE = "acquisition";
  static final String TOOL = "extract_audio_to_file";
  private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (narrator)";

  private final ToolService toolService;
  private final HttpClient downloadClient;
  private final Duration downloadTimeout;

  public SourceAcquisitionStage(
      ToolService toolService, HttpClient downloadClient, Duration downloadTimeout) {
    this.toolService = toolService;
    this.downloadClient = downloadClient;
    this.downloadTimeout = downloadTimeout;
  }

  @Override
  public AcquiredAudio invoke(SourceSpec source, StageContext context) {
    try {
      Files.createDirectories(context.runDir());
      return switch (source.kind()) {
        case AUDIO_PATH -> copyLocal(Path.of(source.audioPath()), context);
        case AUDIO_URL -> download(source.audioUrl(), context);
        case YOUTUBE -> extract(source.youtubeUrl(), context);
      };
    } catch (IOException e) {
      throw new StageException("Could not prepare audio source: " + e.getMessage(), e);
    }
  }

  private AcquiredAudio copyLocal(Path source, StageContext context) throws IOException {
    Path absolute = source.toAbsolutePath().normalize();
    if (!Files.isRegularFile(absolute) || !isAudioName(absolute.getFileName().toString())) {
      throw new StageException("audio_path must be an existing .mp3 or .wav file: " + source);
    }
    Path target = context.resolve(sanitizeFileName(absolute.getFileName().toString()));
    Files.copy(absolute, target, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.info("Copied local audio: {} -> {}", absolute, target);
    return new AcquiredAudio(target, "Copied local audio");
  }

  private AcquiredAudio download(String url, StageContext context) throws IOException {
    URI uri = URI.create(url);
    String urlPath = uri.getPath() == null ? "" : uri.getPath();
    String fileName = sanitizeFileName(urlPath.substring(urlPath.lastIndexOf('/') + 1));
    Path target = context.resolve(isAudioName(fileName) ? fileName : "audio.mp3");
    JobParameters parameters = context.parameters();
    String userAgent =
        parameters.ytUserAgent() == null ? DEFAULT_USER_AGENT : parameters.ytUserAgent();

    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(downloadTimeout)
            .header("User-Agent", userAgent)
            .GET()
            .build();

    LOGGER.info("Downloading audio: url={}, target={}", url, target);
    HttpResponse<Path> response;
    try {
      response = downloadClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageException("Audio download interrupted", e);
    }
    if (response.statusCode() / 100 != 2) {
      Files.deleteIfExists(target);
      throw new StageException(
          String.format("Audio download failed with status %d: %s", response.statusCode(), url));
    }
    return new AcquiredAudio(target, "Downloaded audio from URL");
  }

  private AcquiredAudio extract(String url, StageContext context) throws IOException {
    Path output = context.resolve("audio.mp3");
    JobParameters parameters = context.parameters();
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("url", url);
    arguments.put("output_path", output.toAbsolutePath().toString());
    arguments.put("format", "mp3");
    arguments.put("cookies_file", parameters.ytCookiesFile());
    arguments.put("cookies_from_browser", parameters.ytCookiesFromBrowser());
    arguments.put("user_agent", parameters.ytUserAgent());
    arguments.put("proxy", parameters.ytProxy());

    ToolResult result;
    try {
      result = toolService.call(SERVICE, TOOL, arguments);
    } catch (ToolInvocationException e) {
      throw new StageException(e.getMessage(), e);
    }
    Path extracted = locateExtracted(output, context.runDir(), result);
    return new AcquiredAudio(extracted, "YouTube audio extracted");
  }

  /** The tool may name the file differently from the requested output path. */
  private static Path locateExtracted(Path requested, Path runDir, ToolResult result)
      throws IOException {
    if (Files.isRegularFile(requested)) {
      return requested;
    }
    Optional<Path> reported = result.textField("file_path").map(Path::of);
    if (reported.isPresent() && Files.isRegularFile(reported.get())) {
      return reported.get();
    }
    Optional<Path> named =
        result.textField("filename").map(name -> runDir.resolve(Path.of(name).getFileName()));
    if (named.isPresent() && Files.isRegularFile(named.get())) {
      return named.get();
    }
    try (DirectoryStream<Path> audio = Files.newDirectoryStream(runDir, "*.{mp3,wav}")) {
      for (Path candidate : audio) {
        return candidate;
      }
    }
    throw new StageException("Audio file not found in " + runDir);
  }

  static boolean isAudioName(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    return lower.endsWith(".mp3") || lower.endsWith(".wav");
  }

  static String sanitizeFileName(String fileName) {
    String sanitized = fileName.replaceAll("[^A-Za-z0-9._-]+", "_");
    return sanitized.isBlank() || sanitized.startsWith(".") ? "audio" + sanitized : sanitized;
  }
}
