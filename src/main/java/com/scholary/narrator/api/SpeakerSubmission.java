package com.scholary.narrator.api;

import jakarta.validation.constraints.NotBlank;

/** Speaker configuration as JSON text: a list of configs or {"speakers": [...]}. */
public record SpeakerSubmission(@NotBlank String speakersJson) {}
