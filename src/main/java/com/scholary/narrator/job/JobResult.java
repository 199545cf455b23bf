package com.scholary.narrator.job;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * References to the artifacts a job produced. Paths are absolute file system paths; {@code urls}
 * holds presigned links keyed by artifact name when artifacts were published to object storage.
 * {@code speakerClips} lists the reference clips cut from the source audio, if any.
 */
public record JobResult(
    String runDir,
    String inputAudioPath,
    String transcriptPath,
    String translatedPath,
    String polishedPath,
    String summaryPath,
    String speakersPath,
    String audioPath,
    String summaryAudioPath,
    String mergedAudioPath,
    SpeakerClips speakerClips,
    Map<String, String> urls) {

  public JobResult {
    speakerClips = speakerClips == null ? SpeakerClips.NONE : speakerClips;
    urls = urls == null ? Map.of() : Map.copyOf(urls);
  }

  public JobResult withSummaryAudioPath(String path) {
    return new JobResult(
        runDir,
        inputAudioPath,
        transcriptPath,
        translatedPath,
        polishedPath,
        summaryPath,
        speakersPath,
        audioPath,
        path,
        mergedAudioPath,
        speakerClips,
        urls);
  }

  public JobResult withMergedAudioPath(String path) {
    return new JobResult(
        runDir,
        inputAudioPath,
        transcriptPath,
        translatedPath,
        polishedPath,
        summaryPath,
        speakersPath,
        audioPath,
        summaryAudioPath,
        path,
        speakerClips,
        urls);
  }

  public JobResult withAudio(String newSpeakersPath, String newAudioPath) {
    return new JobResult(
        runDir,
        inputAudioPath,
        transcriptPath,
        translatedPath,
        polishedPath,
        summaryPath,
        newSpeakersPath,
        newAudioPath,
        summaryAudioPath,
        mergedAudioPath,
        speakerClips,
        urls);
  }

  public JobResult withUrls(Map<String, String> published) {
    Map<String, String> merged = new LinkedHashMap<>(urls);
    merged.putAll(published);
    return new JobResult(
        runDir,
        inputAudioPath,
        transcriptPath,
        translatedPath,
        polishedPath,
        summaryPath,
        speakersPath,
        audioPath,
        summaryAudioPath,
        mergedAudioPath,
        speakerClips,
        merged);
  }

  /**
   * Artifact name to path, for every artifact that exists. Speaker clips are named after their
   * file, e.g. {@code speaker0}.
   */
  public Map<String, String> artifacts() {
    Map<String, String> artifacts = new LinkedHashMap<>();
    putIfSet(artifacts, "input_audio", inputAudioPath);
    putIfSet(artifacts, "transcript", transcriptPath);
    putIfSet(artifacts, "translated", translatedPath);
    putIfSet(artifacts, "polished", polishedPath);
    putIfSet(artifacts, "summary", summaryPath);
    putIfSet(artifacts, "speakers", speakersPath);
    putIfSet(artifacts, "audio", audioPath);
    putIfSet(artifacts, "summary_audio", summaryAudioPath);
    putIfSet(artifacts, "merged_audio", mergedAudioPath);
    for (String clip : speakerClips.audioPaths().values()) {
      putIfSet(artifacts, baseName(clip), clip);
    }
    return artifacts;
  }

  private static void putIfSet(Map<String, String> target, String name, String value) {
    if (value != null) {
      target.put(name, value);
    }
  }

  private static String baseName(String path) {
    String fileName = Path.of(path).getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
