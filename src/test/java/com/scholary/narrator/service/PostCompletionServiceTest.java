package com.scholary.narrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.narrator.job.IllegalJobStateException;
import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.JobSpec;
import com.scholary.narrator.job.JobStateStore;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.PipelineState;
import com.scholary.narrator.job.SourceSpec;
import com.scholary.narrator.job.SpeakerClips;
import com.scholary.narrator.job.ValidationException;
import com.scholary.narrator.objectstore.ArtifactPublisher;
import com.scholary.narrator.speaker.SpeakerClipPlanner;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.speaker.SpeakerConfigParser;
import com.scholary.narrator.speaker.SpeakerInputException;
import com.scholary.narrator.speaker.SpeakerProfileDeriver;
import com.scholary.narrator.stage.AudioMerger;
import com.scholary.narrator.stage.RemoteSynthesisStage;
import com.scholary.narrator.stage.SpeakerConfigStage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PostCompletionServiceTest {

  @TempDir Path runDir;

  @Mock private RemoteSynthesisStage synthesis;
  @Mock private AudioMerger merger;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SpeakerProfileDeriver deriver =
      new SpeakerProfileDeriver(12, "French", "Neutral narrator.");

  private JobRepository repository;
  private Job job;
  private Path intro;

  @BeforeEach
  void setUp() throws Exception {
    repository =
        new JobRepository(
            mock(JobStateStore.class), 10, new PipelineState.Settings(false, 1, List.of()));
    Files.writeString(runDir.resolve("summary.txt"), "Un resume de l'episode.");
    Files.writeString(runDir.resolve("polished.txt"), "[SPEAKER0]Bonjour.\n[SPEAKER1]Salut !");
    Files.writeString(runDir.resolve("audio.wav"), "RIFF");
    intro = Files.writeString(runDir.resolve("intro.wav"), "RIFF");

    job =
        new Job(
            "job-1",
            "alice",
            new JobSpec(SourceSpec.audioPath("/a.mp3"), null, false),
            Instant.now());
    repository.insert(job, List.of());
    job.markRunning(Instant.now());
    job.markCompleted(
        new JobResult(
            runDir.toString(),
            null,
            null,
            null,
            runDir.resolve("polished.txt").toString(),
            runDir.resolve("summary.txt").toString(),
            null,
            runDir.resolve("audio.wav").toString(),
            null,
            null,
            SpeakerClips.NONE,
            Map.of()),
        Instant.now());
    repository.update(job);
  }

  @Test
  void generateSummaryAudio_shouldNarrateSummaryWithDefaultVoice() {
    Path expected = runDir.resolve(PostCompletionService.SUMMARY_AUDIO);
    when(synthesis.synthesize(anyString(), anyList(), anyDouble(), eq(expected)))
        .thenReturn(expected);

    Job updated = service(List.of()).generateSummaryAudio("job-1", "alice");

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<SpeakerConfig>> speakers = ArgumentCaptor.forClass(List.class);
    verify(synthesis)
        .synthesize(
            eq("[SPEAKER0]Un resume de l'episode."),
            speakers.capture(),
            eq(1.0),
            eq(expected));
    assertThat(speakers.getValue()).containsExactly(deriver.defaultNarrator());
    assertThat(updated.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(updated.getResult().summaryAudioPath())
        .isEqualTo(expected.toAbsolutePath().toString());
  }

  @Test
  void mergeFinalAudio_shouldRequireSummaryAudio() {
    assertThatThrownBy(() -> service(List.of(intro)).mergeFinalAudio("job-1", "alice"))
        .isInstanceOf(IllegalJobStateException.class)
        .hasMessageContaining("summary audio");
    verifyNoInteractions(merger);
  }

  @Test
  void mergeFinalAudio_shouldConcatenateIntroSummaryAndDialogue() throws Exception {
    Path summaryAudio = Files.writeString(runDir.resolve("summary_audio.wav"), "RIFF");
    job.updateResult(job.getResult().withSummaryAudioPath(summaryAudio.toString()));

    Job updated = service(List.of(intro)).mergeFinalAudio("job-1", "alice");

    Path output = runDir.resolve(PostCompletionService.FINAL_AUDIO);
    verify(merger).merge(List.of(intro, summaryAudio, runDir.resolve("audio.wav")), output);
    assertThat(updated.getResult().mergedAudioPath())
        .isEqualTo(output.toAbsolutePath().toString());
  }

  @Test
  void mergeFinalAudio_shouldRejectMissingIntroAsset() throws Exception {
    Path summaryAudio = Files.writeString(runDir.resolve("summary_audio.wav"), "RIFF");
    job.updateResult(job.getResult().withSummaryAudioPath(summaryAudio.toString()));

    assertThatThrownBy(
            () ->
                service(List.of(runDir.resolve("missing.wav")))
                    .mergeFinalAudio("job-1", "alice"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Intro asset not found");
  }

  @Test
  void regenerateAudio_shouldRewriteSpeakersAndSynthesize() {
    Path output = runDir.resolve(PostCompletionService.DIALOGUE_AUDIO);
    when(synthesis.synthesize(anyString(), anyList(), anyDouble(), eq(output)))
        .thenReturn(output);

    Job updated =
        service(List.of())
            .regenerateAudio(
                "job-1",
                "alice",
                "[{\"speaker_tag\":\"[SPEAKER0]\",\"design_instruct\":\"deep\"},"
                    + "{\"speaker_tag\":\"[SPEAKER1]\",\"design_instruct\":\"bright\"}]");

    assertThat(updated.getResult().speakersPath()).endsWith("speakers.json");
    assertThat(runDir.resolve("speakers.json")).exists();
    verify(synthesis)
        .synthesize(eq("[SPEAKER0]Bonjour.\n[SPEAKER1]Salut !"), anyList(), eq(1.0), eq(output));
  }

  @Test
  void regenerateAudio_shouldRejectMismatchedSpeakers() {
    JobResult before = job.getResult();

    assertThatThrownBy(
            () ->
                service(List.of())
                    .regenerateAudio("job-1", "alice", "[{\"speaker_tag\":\"[SPEAKER0]\"}]"))
        .isInstanceOf(SpeakerInputException.class);
    verify(synthesis, never()).synthesize(anyString(), anyList(), anyDouble(), any());
    assertThat(job.getResult()).isEqualTo(before);
  }

  @Test
  void actions_shouldRejectOtherOwnersAndUnfinishedJobs() {
    Job running = new Job("job-2", "alice", job.getSpec(), Instant.now());
    repository.insert(running, List.of());
    running.markRunning(Instant.now());

    assertThatThrownBy(() -> service(List.of()).generateSummaryAudio("job-1", "bob"))
        .isInstanceOf(JobNotFoundException.class);
    assertThatThrownBy(() -> service(List.of()).generateSummaryAudio("job-2", "alice"))
        .isInstanceOf(IllegalJobStateException.class);
  }

  @Test
  void actions_shouldDropJobLockOnceFinished() {
    Path expected = runDir.resolve(PostCompletionService.SUMMARY_AUDIO);
    when(synthesis.synthesize(anyString(), anyList(), anyDouble(), eq(expected)))
        .thenReturn(expected);
    PostCompletionService service = service(List.of(intro));

    service.generateSummaryAudio("job-1", "alice");
    assertThatThrownBy(() -> service.regenerateAudio("job-1", "alice", "[]"))
        .isInstanceOf(SpeakerInputException.class);
    assertThatThrownBy(() -> service.generateSummaryAudio("missing", "alice"))
        .isInstanceOf(JobNotFoundException.class);

    assertThat(service.heldLocks()).isZero();
  }

  private PostCompletionService service(List<Path> introAssets) {
    SpeakerConfigStage speakerConfigStage =
        new SpeakerConfigStage(
            deriver,
            new SpeakerClipPlanner(),
            (source, start, end, output) -> {
              throw new AssertionError("no clips are cut after completion");
            },
            objectMapper);
    return new PostCompletionService(
        repository,
        synthesis,
        speakerConfigStage,
        new SpeakerConfigParser(objectMapper, runDir, "French"),
        deriver,
        merger,
        ArtifactPublisher.disabled(),
        introAssets);
  }
}
