package com.scholary.narrator.job;

/**
 * A stretch of the source audio spoken by one diarized speaker.
 *
 * @param speaker the diarization label, e.g. {@code SPEAKER_01}
 * @param start offset in seconds
 * @param end offset in seconds, after {@code start}
 * @param text what was said, possibly empty
 */
public record SpeakerClip(String speaker, double start, double end, String text) {

  public double duration() {
    return end - start;
  }

  public boolean sameSpan(SpeakerClip other) {
    return Math.abs(start - other.start) < 1e-3 && Math.abs(end - other.end) < 1e-3;
  }

  public boolean overlaps(SpeakerClip other) {
    return end > other.start && other.end > start;
  }
}
