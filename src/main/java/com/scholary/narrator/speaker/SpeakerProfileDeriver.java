package com.scholary.narrator.speaker;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives default voice profiles from speaker-tagged text.
 *
 * <p>This is a pure function of the text and the configured thresholds: the same input always
 * yields the same profiles. Each tag gets a persona picked by its ordinal, a tone picked from how
 * long and how inquisitive its utterances are, and a verbatim excerpt used as the design sample.
 */
public class SpeakerProfileDeriver {

  static final int MAX_EXCERPT_LENGTH = 160;
  static final String DEFAULT_NARRATOR_TEXT = "Hello and welcome to this episode.";

  private static final List<String> PERSONAS =
      List.of(
          "Young male tech commentator in his twenties, brisk pace, bright voice, analytical.",
          "Female teacher around forty, moderate pace, warm and steady voice, patient explainer.",
          "Older male scholar around sixty, slow pace, slightly husky voice, reflective.",
          "Young female lifestyle host in her twenties, quick pace, lively voice, expressive.",
          "Male news anchor in his thirties, even pace, deep firm voice, objective delivery.",
          "Female podcast host in her thirties, medium pace, slightly husky, relaxed and friendly.",
          "Male documentary narrator around fifty, slow pace, deep rich voice, storyteller.",
          "Female counselor in her thirties, unhurried pace, soft warm voice, empathetic.",
          "Male financial commentator in his forties, medium-fast pace, measured, data driven.",
          "Female science presenter around thirty, moderate pace, crisp voice, easy to follow.");

  private final int minExcerptLength;
  private final String language;
  private final String narratorInstruct;

  public SpeakerProfileDeriver(int minExcerptLength, String language, String narratorInstruct) {
    this.minExcerptLength = minExcerptLength;
    this.language = language;
    this.narratorInstruct = narratorInstruct;
  }

  /**
   * Build one profile per distinct tag, in first-appearance order.
   *
   * @return an empty list when the text has no speaker tags
   */
  public List<SpeakerConfig> derive(String text) {
    SpeakerTranscript transcript = SpeakerTranscript.parse(text);
    List<SpeakerConfig> profiles = new ArrayList<>();
    int ordinal = 0;
    for (String tag : transcript.tags()) {
      List<String> utterances = transcript.utterances(tag);
      String instruct = PERSONAS.get(ordinal % PERSONAS.size()) + " " + tone(utterances);
      profiles.add(
          SpeakerConfig.designed(tag, excerpt(utterances, minExcerptLength), instruct, language));
      ordinal++;
    }
    return profiles;
  }

  /** Single narrator profile used when the text carries no speaker structure. */
  public SpeakerConfig defaultNarrator() {
    return SpeakerConfig.designed("[SPEAKER0]", DEFAULT_NARRATOR_TEXT, narratorInstruct, language);
  }

  static String tone(List<String> utterances) {
    if (utterances.isEmpty()) {
      return "Natural conversational delivery, balanced and relaxed.";
    }
    double totalLength = 0;
    int questions = 0;
    for (String utterance : utterances) {
      totalLength += utterance.length();
      if (utterance.contains("?") || utterance.contains("？") || utterance.contains("吗")) {
        questions++;
      }
    }
    double averageLength = totalLength / utterances.size();
    double questionRatio = (double) questions / utterances.size();

    if (questionRatio >= 0.35) {
      return "Guiding tone, often phrased as questions.";
    }
    if (averageLength >= 80) {
      return "Long-form delivery focused on complete, logical argument.";
    }
    if (averageLength <= 30) {
      return "Short, punchy delivery with a quick rhythm.";
    }
    return "Natural conversational delivery, balanced and relaxed.";
  }

  /** First utterance at least {@code minLength} long, else the longest; trimmed for display. */
  static String excerpt(List<String> utterances, int minLength) {
    String chosen = null;
    for (String utterance : utterances) {
      if (utterance.length() >= minLength) {
        chosen = utterance;
        break;
      }
    }
    if (chosen == null) {
      chosen = "";
      for (String utterance : utterances) {
        if (utterance.length() > chosen.length()) {
          chosen = utterance;
        }
      }
    }
    return trim(chosen, MAX_EXCERPT_LENGTH);
  }

  static String trim(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    return text.substring(0, maxLength - 3).stripTrailing() + "...";
  }
}
