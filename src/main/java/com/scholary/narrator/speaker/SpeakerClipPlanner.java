package com.scholary.narrator.speaker;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.narrator.job.SpeakerClip;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks, for every diarized speaker, the stretch of audio to cut a voice reference from.
 *
 * <p>Segments that overlap another speaker are avoided when the speaker has any others. The
 * candidates are the longest segments plus the one closest to the middle of the preferred
 * duration range; the selected clip is the candidate inside that range closest to its middle, or
 * the longest candidate when none fits.
 */
public class SpeakerClipPlanner {

  static final double MIN_SECONDS = 15.0;
  static final double MAX_SECONDS = 30.0;
  static final int MAX_CANDIDATES = 5;

  private static final Pattern SPEAKER_INDEX = Pattern.compile("SPEAKER_?(\\d{1,9})");

  private final double minSeconds;
  private final double maxSeconds;
  private final int maxCandidates;

  public SpeakerClipPlanner() {
    this(MIN_SECONDS, MAX_SECONDS, MAX_CANDIDATES);
  }

  public SpeakerClipPlanner(double minSeconds, double maxSeconds, int maxCandidates) {
    this.minSeconds = minSeconds;
    this.maxSeconds = maxSeconds;
    this.maxCandidates = maxCandidates;
  }

  /**
   * Timed segments of a transcript grouped by speaker label, in order of first appearance. Uses
   * {@code segments} and falls back to {@code speaker_segments} when no segment is timed.
   */
  public static Map<String, List<SpeakerClip>> groupBySpeaker(JsonNode transcript) {
    Map<String, List<SpeakerClip>> grouped = collect(transcript.path("segments"));
    return grouped.isEmpty() ? collect(transcript.path("speaker_segments")) : grouped;
  }

  /** Number in a label such as {@code SPEAKER_01} or {@code [SPEAKER1]}. */
  public static OptionalInt speakerIndex(String label) {
    Matcher matcher = SPEAKER_INDEX.matcher(label);
    if (!matcher.find()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(Integer.parseInt(matcher.group(1)));
  }

  /** Up to {@code maxCandidates} segments per speaker, longest first. */
  public Map<String, List<SpeakerClip>> candidates(Map<String, List<SpeakerClip>> grouped) {
    List<SpeakerClip> all = new ArrayList<>();
    grouped.values().forEach(segments -> segments.stream().filter(this::valid).forEach(all::add));

    Map<String, List<SpeakerClip>> candidates = new LinkedHashMap<>();
    for (Map.Entry<String, List<SpeakerClip>> entry : grouped.entrySet()) {
      List<SpeakerClip> items = new ArrayList<>();
      List<SpeakerClip> alone = new ArrayList<>();
      for (SpeakerClip segment : entry.getValue()) {
        if (!valid(segment)) {
          continue;
        }
        items.add(segment);
        boolean overlapped =
            all.stream()
                .anyMatch(
                    other ->
                        !other.speaker().equals(segment.speaker()) && other.overlaps(segment));
        if (!overlapped) {
          alone.add(segment);
        }
      }
      List<SpeakerClip> source = alone.isEmpty() ? items : alone;
      if (source.isEmpty()) {
        continue;
      }
      source.sort(Comparator.comparingDouble(SpeakerClip::duration).reversed());
      List<SpeakerClip> chosen =
          new ArrayList<>(source.subList(0, Math.min(maxCandidates, source.size())));
      SpeakerClip closest = source.stream().min(byDistanceToTarget()).orElseThrow();
      if (chosen.stream().noneMatch(candidate -> candidate.sameSpan(closest))) {
        chosen.set(chosen.size() - 1, closest);
      }
      candidates.put(entry.getKey(), List.copyOf(chosen));
    }
    return candidates;
  }

  /** The clip to cut per speaker, chosen from its candidates. */
  public Map<String, SpeakerClip> select(Map<String, List<SpeakerClip>> candidates) {
    Map<String, SpeakerClip> selected = new LinkedHashMap<>();
    candidates.forEach(
        (speaker, segments) -> {
          segments.stream()
              .filter(segment -> segment.duration() >= minSeconds)
              .filter(segment -> segment.duration() <= maxSeconds)
              .min(byDistanceToTarget())
              .or(() -> segments.stream().max(Comparator.comparingDouble(SpeakerClip::duration)))
              .ifPresent(segment -> selected.put(speaker, segment));
        });
    return selected;
  }

  private boolean valid(SpeakerClip segment) {
    return segment.end() > segment.start();
  }

  private Comparator<SpeakerClip> byDistanceToTarget() {
    double target = (minSeconds + maxSeconds) / 2;
    return Comparator.comparingDouble(segment -> Math.abs(segment.duration() - target));
  }

  private static Map<String, List<SpeakerClip>> collect(JsonNode segments) {
    Map<String, List<SpeakerClip>> grouped = new LinkedHashMap<>();
    for (JsonNode segment : segments) {
      String speaker = segment.path("speaker").asText("").strip();
      JsonNode start = segment.path("start");
      JsonNode end = segment.path("end");
      if (speaker.isEmpty() || !start.isNumber() || !end.isNumber()) {
        continue;
      }
      grouped
          .computeIfAbsent(speaker, key -> new ArrayList<>())
          .add(
              new SpeakerClip(
                  speaker,
                  start.asDouble(),
                  end.asDouble(),
                  segment.path("text").asText("").strip()));
    }
    grouped.values().forEach(list -> list.sort(Comparator.comparingDouble(SpeakerClip::start)));
    return grouped;
  }
}
