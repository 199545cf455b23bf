package com.scholary.narrator.speaker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Speaker-tagged transcript text, grouped by tag.
 *
 * <p>A line starting with {@code [SPEAKERn]} opens an utterance for that speaker; untagged lines
 * that follow belong to the same speaker. Untagged lines before the first tag are ignored. Tags
 * keep the order in which they first appear.
 */
public final class SpeakerTranscript {

  private static final Pattern SPEAKER_LINE = Pattern.compile("^\\[(SPEAKER\\d+)\\]\\s*(.*)$");
  private static final Pattern BARE_TAG = Pattern.compile("^\\[?(SPEAKER\\d+)\\]?$");

  private final Map<String, List<String>> utterances;

  private SpeakerTranscript(Map<String, List<String>> utterances) {
    this.utterances = utterances;
  }

  public static SpeakerTranscript parse(String text) {
    Map<String, List<String>> grouped = new LinkedHashMap<>();
    String current = null;
    for (String rawLine : lines(text)) {
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      String content;
      Matcher matcher = SPEAKER_LINE.matcher(line);
      if (matcher.matches()) {
        current = "[" + matcher.group(1) + "]";
        content = matcher.group(2).strip();
      } else {
        if (current == null) {
          continue;
        }
        content = line;
      }
      if (!content.isEmpty()) {
        grouped.computeIfAbsent(current, tag -> new ArrayList<>()).add(content);
      }
    }
    return new SpeakerTranscript(grouped);
  }

  /** Distinct tags in first-appearance order, bracketed, e.g. {@code [SPEAKER0]}. */
  public List<String> tags() {
    return List.copyOf(utterances.keySet());
  }

  public List<String> utterances(String tag) {
    return Collections.unmodifiableList(utterances.getOrDefault(tag, List.of()));
  }

  public boolean isEmpty() {
    return utterances.isEmpty();
  }

  /**
   * Rewrite the text as one {@code [TAG]content} line per utterance, dropping blank lines and any
   * text before the first tag.
   */
  public static String normalize(String text) {
    List<String> normalized = new ArrayList<>();
    String current = null;
    for (String rawLine : lines(text)) {
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      String content = line;
      Matcher matcher = SPEAKER_LINE.matcher(line);
      if (matcher.matches()) {
        current = matcher.group(1);
        content = matcher.group(2).strip();
      }
      if (current != null && !content.isEmpty()) {
        normalized.add("[" + current + "]" + content);
      }
    }
    return String.join("\n", normalized);
  }

  /**
   * Canonical bracketed form of a user-written tag: {@code speaker0}, {@code SPEAKER0} and {@code
   * [SPEAKER0]} all become {@code [SPEAKER0]}. Anything else is returned stripped but unchanged.
   */
  public static String normalizeTag(String raw) {
    String stripped = raw.strip();
    Matcher matcher = BARE_TAG.matcher(stripped.toUpperCase(Locale.ROOT));
    return matcher.matches() ? "[" + matcher.group(1) + "]" : stripped;
  }

  private static List<String> lines(String text) {
    return text == null ? List.of() : text.lines().toList();
  }
}
