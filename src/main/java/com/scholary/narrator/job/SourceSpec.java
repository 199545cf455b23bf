package com.scholary.narrator.job;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the audio for a job comes from. Exactly one of the three fields must be set.
 *
 * @param youtubeUrl a video page whose audio track is extracted by the acquisition service
 * @param audioUrl a direct http(s) link to an .mp3 or .wav file
 * @param audioPath a local .mp3 or .wav file
 */
public record SourceSpec(String youtubeUrl, String audioUrl, String audioPath) {

  public enum Kind {
    YOUTUBE,
    AUDIO_URL,
    AUDIO_PATH
  }

  public static SourceSpec youtube(String url) {
    return new SourceSpec(url, null, null);
  }

  public static SourceSpec audioUrl(String url) {
    return new SourceSpec(null, url, null);
  }

  public static SourceSpec audioPath(String path) {
    return new SourceSpec(null, null, path);
  }

  /** Number of non-blank sources; anything other than one is a validation error. */
  public int count() {
    return present().size();
  }

  public Kind kind() {
    List<Kind> present = present();
    if (present.size() != 1) {
      throw new IllegalStateException("Source must name exactly one location, found " + present);
    }
    return present.get(0);
  }

  /** The single location string, whichever field holds it. */
  public String location() {
    return switch (kind()) {
      case YOUTUBE -> youtubeUrl;
      case AUDIO_URL -> audioUrl;
      case AUDIO_PATH -> audioPath;
    };
  }

  private List<Kind> present() {
    List<Kind> kinds = new ArrayList<>();
    if (isSet(youtubeUrl)) {
      kinds.add(Kind.YOUTUBE);
    }
    if (isSet(audioUrl)) {
      kinds.add(Kind.AUDIO_URL);
    }
    if (isSet(audioPath)) {
      kinds.add(Kind.AUDIO_PATH);
    }
    return kinds;
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
