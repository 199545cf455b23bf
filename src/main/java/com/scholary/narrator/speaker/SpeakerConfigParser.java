package com.scholary.narrator.speaker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses and validates user-supplied speaker configuration JSON.
 *
 * <p>Accepts either a JSON array of speaker objects or an object with a {@code speakers} array.
 * The tags must match the expected tags exactly, as a set. Relative {@code ref_audio} paths are
 * resolved against the voice prompt directory and must name an existing file.
 */
public class SpeakerConfigParser {

  static final String FALLBACK_TAG = "[SPEAKER0]";

  private final ObjectMapper objectMapper;
  private final Path voicePromptsDir;
  private final String defaultLanguage;

  public SpeakerConfigParser(
      ObjectMapper objectMapper, Path voicePromptsDir, String defaultLanguage) {
    this.objectMapper = objectMapper;
    this.voicePromptsDir = voicePromptsDir;
    this.defaultLanguage = defaultLanguage;
  }

  /**
   * @param speakersJson the raw JSON text
   * @param expectedTags tags detected in the text; empty means a single {@code [SPEAKER0]}
   * @return the validated configurations, in submitted order
   * @throws SpeakerInputException if the JSON is malformed, tags do not match, or a reference
   *     audio file is missing
   */
  public List<SpeakerConfig> parse(String speakersJson, List<String> expectedTags) {
    if (speakersJson == null || speakersJson.isBlank()) {
      throw new SpeakerInputException("Speaker configuration is empty");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(speakersJson);
    } catch (JsonProcessingException e) {
      throw new SpeakerInputException("Invalid JSON for speaker configs", e);
    }
    if (root != null && root.isObject() && root.has("speakers")) {
      root = root.get("speakers");
    }
    if (root == null || !root.isArray() || root.isEmpty()) {
      throw new SpeakerInputException("Speaker configs must be a non-empty list");
    }

    List<SpeakerConfig> configs = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (JsonNode item : root) {
      if (!item.isObject()) {
        throw new SpeakerInputException("Each speaker config must be an object");
      }
      String rawTag = text(item, "speaker_tag");
      if (rawTag == null || rawTag.isBlank()) {
        throw new SpeakerInputException("Each speaker config needs a speaker_tag");
      }
      String tag = SpeakerTranscript.normalizeTag(rawTag);
      if (!seen.add(tag)) {
        throw new SpeakerInputException("Duplicate speaker_tag: " + tag);
      }
      String language = text(item, "language");
      configs.add(
          new SpeakerConfig(
              tag,
              text(item, "design_text"),
              text(item, "design_instruct"),
              resolveReferenceAudio(tag, text(item, "ref_audio")),
              text(item, "ref_text"),
              language == null || language.isBlank() ? defaultLanguage : language));
    }

    Set<String> expected =
        new LinkedHashSet<>(expectedTags.isEmpty() ? List.of(FALLBACK_TAG) : expectedTags);
    if (!seen.equals(expected)) {
      Set<String> missing = new LinkedHashSet<>(expected);
      missing.removeAll(seen);
      Set<String> unexpected = new LinkedHashSet<>(seen);
      unexpected.removeAll(expected);
      throw new SpeakerInputException(
          String.format(
              "Speaker tags do not match detected speakers %s (missing: %s, unexpected: %s)",
              expected, missing, unexpected));
    }
    return configs;
  }

  private String resolveReferenceAudio(String tag, String refAudio) {
    if (refAudio == null || refAudio.isBlank()) {
      return null;
    }
    Path candidate;
    try {
      candidate = Path.of(refAudio);
    } catch (InvalidPathException e) {
      throw new SpeakerInputException("Invalid ref_audio path for " + tag + ": " + refAudio, e);
    }
    if (!candidate.isAbsolute()) {
      candidate = voicePromptsDir.resolve(candidate);
    }
    if (!Files.isRegularFile(candidate)) {
      throw new SpeakerInputException("Reference audio not found for " + tag + ": " + refAudio);
    }
    return candidate.toAbsolutePath().normalize().toString();
  }

  private static String text(JsonNode item, String field) {
    JsonNode value = item.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
