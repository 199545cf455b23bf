package com.scholary.narrator.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.narrator.job.SpeakerClip;
import com.scholary.narrator.job.SpeakerClips;
import com.scholary.narrator.speaker.SpeakerClipPlanner;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.speaker.SpeakerProfileDeriver;
import com.scholary.narrator.speaker.SpeakerTranscript;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces {@code speakers.json} for the polished dialogue.
 *
 * <p>{@link #invoke} derives the profiles automatically; a text without speaker tags gets a single
 * default narrator. It also cuts one reference clip per diarized speaker out of the source audio,
 * named {@code speaker<n>.wav} after the speaker's number, and points the profile of the matching
 * {@code [SPEAKER<n>]} tag at it. Speakers whose clip cannot be cut keep the derived voice design.
 * When the user supplies the configuration instead, the executor calls {@link #write} with it.
 */
public class SpeakerConfigStage implements Stage<SpeakerSource, SpeakerSetup> {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerConfigStage.class);

  static final String FILE_NAME = "speakers.json";

  private final SpeakerProfileDeriver deriver;
  private final SpeakerClipPlanner planner;
  private final ClipExtractor clipExtractor;
  private final ObjectMapper objectMapper;

  public SpeakerConfigStage(
      SpeakerProfileDeriver deriver,
      SpeakerClipPlanner planner,
      ClipExtractor clipExtractor,
      ObjectMapper objectMapper) {
    this.deriver = deriver;
    this.planner = planner;
    this.clipExtractor = clipExtractor;
    this.objectMapper = objectMapper;
  }

  @Override
  public SpeakerSetup invoke(SpeakerSource source, StageContext context) {
    String text = source.polished().text();
    List<SpeakerConfig> speakers = suggest(text);
    SpeakerClips clips = extractClips(source, context.runDir());
    if (clips.isEmpty()) {
      LOGGER.info("No speaker clips extracted, using derived voice designs");
    }
    return write(context.runDir(), text, withReferences(speakers, clips), clips);
  }

  /** Tags the user must configure, in first-appearance order. */
  public List<String> detectTags(String text) {
    return SpeakerTranscript.parse(text).tags();
  }

  /** Profiles offered to the user as a starting point. */
  public List<SpeakerConfig> suggest(String text) {
    List<SpeakerConfig> speakers = deriver.derive(text);
    return speakers.isEmpty() ? List.of(deriver.defaultNarrator()) : speakers;
  }

  /** Store the given configuration and pair it with the normalized dialogue. */
  public SpeakerSetup write(Path runDir, String text, List<SpeakerConfig> speakers) {
    return write(runDir, text, speakers, SpeakerClips.NONE);
  }

  private SpeakerSetup write(
      Path runDir, String text, List<SpeakerConfig> speakers, SpeakerClips clips) {
    Path target = runDir.resolve(FILE_NAME);
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), speakers);
    } catch (IOException e) {
      throw new StageException("Could not write speaker configs: " + e.getMessage(), e);
    }
    return new SpeakerSetup(target, speakers, dialogue(text), clips);
  }

  private SpeakerClips extractClips(SpeakerSource source, Path runDir) {
    Map<String, List<SpeakerClip>> candidates =
        planner.candidates(SpeakerClipPlanner.groupBySpeaker(source.transcript().transcript()));
    Map<String, SpeakerClip> chosen = planner.select(candidates);
    List<String> labels = new ArrayList<>(chosen.keySet());
    labels.sort(Comparator.comparingInt(label -> SpeakerClipPlanner.speakerIndex(label).orElse(0)));

    Map<String, String> paths = new LinkedHashMap<>();
    Map<String, List<SpeakerClip>> candidatesByTag = new LinkedHashMap<>();
    Map<String, SpeakerClip> selected = new LinkedHashMap<>();
    for (int i = 0; i < labels.size(); i++) {
      String label = labels.get(i);
      int index = SpeakerClipPlanner.speakerIndex(label).orElse(i);
      String tag = "[SPEAKER" + index + "]";
      if (candidatesByTag.containsKey(tag)) {
        continue;
      }
      candidatesByTag.put(tag, candidates.get(label));
      SpeakerClip clip = chosen.get(label);
      Path output = runDir.resolve("speaker" + index + ".wav");
      try {
        clipExtractor.extract(source.audio().path(), clip.start(), clip.end(), output);
      } catch (StageException e) {
        LOGGER.warn("Speaker clip extraction failed for {}: {}", label, e.getMessage());
        continue;
      }
      LOGGER.info("Speaker clip saved for {}: {}", label, output.getFileName());
      paths.put(tag, output.toAbsolutePath().toString());
      selected.put(tag, clip);
    }
    return new SpeakerClips(paths, candidatesByTag, selected);
  }

  private static List<SpeakerConfig> withReferences(
      List<SpeakerConfig> speakers, SpeakerClips clips) {
    List<SpeakerConfig> referenced = new ArrayList<>();
    for (SpeakerConfig speaker : speakers) {
      String audioPath = clips.audioPaths().get(speaker.speakerTag());
      if (audioPath == null) {
        referenced.add(speaker);
        continue;
      }
      String transcript = clips.selected().get(speaker.speakerTag()).text();
      referenced.add(speaker.withReference(audioPath, transcript.isEmpty() ? null : transcript));
    }
    return referenced;
  }

  /** Text without any tag is narrated by {@code [SPEAKER0]} line by line. */
  public static String dialogue(String text) {
    String normalized = SpeakerTranscript.normalize(text);
    if (!normalized.isEmpty()) {
      return normalized;
    }
    List<String> lines = new ArrayList<>();
    for (String line : text.lines().toList()) {
      if (!line.isBlank()) {
        lines.add("[SPEAKER0]" + line.strip());
      }
    }
    return String.join("\n", lines);
  }
}
