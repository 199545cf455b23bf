package com.scholary.narrator.stage;

import com.scholary.narrator.job.SourceSpec;

/** The fixed stage sequence, in execution order. */
public record PipelineStages(
    Stage<SourceSpec, AcquiredAudio> acquisition,
    Stage<AcquiredAudio, TranscriptArtifact> transcription,
    Stage<TranscriptArtifact, TextArtifact> translation,
    Stage<TextArtifact, TextArtifact> polish,
    Stage<TextArtifact, TextArtifact> summary,
    SpeakerConfigStage speakerConfig,
    Stage<SpeakerSetup, AudioArtifact> synthesis) {}
