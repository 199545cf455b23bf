package com.scholary.narrator.stage;

/**
 * What the speaker-config stage works from: the polished dialogue to voice, and the diarized
 * transcript with its source audio to cut reference clips from.
 */
public record SpeakerSource(
    TextArtifact polished, TranscriptArtifact transcript, AcquiredAudio audio) {}
