package com.scholary.narrator.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference clips cut from the source audio, one per speaker tag that got one.
 *
 * @param audioPaths speaker tag to the extracted clip file
 * @param candidates speaker tag to the segments considered for its clip, longest first
 * @param selected speaker tag to the segment its clip was cut from
 */
public record SpeakerClips(
    Map<String, String> audioPaths,
    Map<String, List<SpeakerClip>> candidates,
    Map<String, SpeakerClip> selected) {

  public static final SpeakerClips NONE = new SpeakerClips(Map.of(), Map.of(), Map.of());

  public SpeakerClips {
    audioPaths = ordered(audioPaths);
    selected = ordered(selected);
    Map<String, List<SpeakerClip>> lists = new LinkedHashMap<>();
    if (candidates != null) {
      candidates.forEach((tag, clips) -> lists.put(tag, List.copyOf(clips)));
    }
    candidates = Collections.unmodifiableMap(lists);
  }

  public boolean isEmpty() {
    return audioPaths.isEmpty();
  }

  private static <V> Map<String, V> ordered(Map<String, V> source) {
    return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
