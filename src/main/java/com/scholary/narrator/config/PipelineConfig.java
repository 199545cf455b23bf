package com.scholary.narrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.narrator.executor.SpeakerInputGate;
import com.scholary.narrator.executor.StepExecutorFactory;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobStateStore;
import com.scholary.narrator.job.JsonFileJobStateStore;
import com.scholary.narrator.job.PipelineState;
import com.scholary.narrator.objectstore.ArtifactPublisher;
import com.scholary.narrator.scheduler.PipelineScheduler;
import com.scholary.narrator.service.PipelineService;
import com.scholary.narrator.service.PostCompletionService;
import com.scholary.narrator.speaker.SpeakerClipPlanner;
import com.scholary.narrator.speaker.SpeakerConfigParser;
import com.scholary.narrator.speaker.SpeakerProfileDeriver;
import com.scholary.narrator.stage.AudioMerger;
import com.scholary.narrator.stage.ClipExtractor;
import com.scholary.narrator.stage.FfmpegProperties;
import com.scholary.narrator.stage.PipelineStages;
import com.scholary.narrator.stage.PolishStage;
import com.scholary.narrator.stage.RemoteSynthesisStage;
import com.scholary.narrator.stage.RemoteTranscriptionStage;
import com.scholary.narrator.stage.SourceAcquisitionStage;
import com.scholary.narrator.stage.SpeakerConfigStage;
import com.scholary.narrator.stage.SummaryStage;
import com.scholary.narrator.stage.TranslationStage;
import com.scholary.narrator.steplog.EventBroadcaster;
import com.scholary.narrator.tool.ToolService;
import com.scholary.narrator.tool.ToolServiceProperties;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the pipeline core: persistence, stages, executors, scheduler and the services on top.
 *
 * <p>Enables {@link PipelineProperties}, {@link ToolServiceProperties} and {@link
 * FfmpegProperties} to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  ToolServiceProperties.class,
  FfmpegProperties.class
})
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public JobStateStore jobStateStore(PipelineProperties properties, ObjectMapper objectMapper) {
    return new JsonFileJobStateStore(Path.of(properties.stateFile()), objectMapper);
  }

  @Bean
  public JobRepository jobRepository(JobStateStore stateStore, PipelineProperties properties) {
    return new JobRepository(
        stateStore,
        properties.retainedJobs(),
        new PipelineState.Settings(
            properties.parallelEnabled(), properties.maxConcurrent(), List.of()));
  }

  @Bean
  public EventBroadcaster eventBroadcaster(JobRepository repository) {
    return new EventBroadcaster(repository);
  }

  @Bean
  public SpeakerProfileDeriver speakerProfileDeriver(PipelineProperties properties) {
    return new SpeakerProfileDeriver(
        properties.minExcerptLength(),
        properties.synthesisLanguage(),
        properties.narratorInstruct());
  }

  @Bean
  public SpeakerConfigParser speakerConfigParser(
      PipelineProperties properties, ObjectMapper objectMapper) {
    return new SpeakerConfigParser(
        objectMapper, Path.of(properties.voicePromptsDir()), properties.synthesisLanguage());
  }

  @Bean
  public SpeakerInputGate speakerInputGate(SpeakerConfigParser parser) {
    return new SpeakerInputGate(parser);
  }

  @Bean
  public SpeakerConfigStage speakerConfigStage(
      SpeakerProfileDeriver deriver, ClipExtractor clipExtractor, ObjectMapper objectMapper) {
    return new SpeakerConfigStage(deriver, new SpeakerClipPlanner(), clipExtractor, objectMapper);
  }

  @Bean
  public RemoteSynthesisStage remoteSynthesisStage(
      ToolService toolService, ObjectMapper objectMapper) {
    return new RemoteSynthesisStage(toolService, objectMapper);
  }

  @Bean
  public PipelineStages pipelineStages(
      ToolService toolService,
      ToolServiceProperties toolProperties,
      ObjectMapper objectMapper,
      SpeakerConfigStage speakerConfigStage,
      RemoteSynthesisStage synthesisStage) {
    HttpClient downloadClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(toolProperties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    return new PipelineStages(
        new SourceAcquisitionStage(
            toolService, downloadClient, Duration.ofSeconds(toolProperties.readTimeout())),
        new RemoteTranscriptionStage(toolService, objectMapper),
        new TranslationStage(toolService),
        new PolishStage(toolService),
        new SummaryStage(toolService),
        speakerConfigStage,
        synthesisStage);
  }

  @Bean
  public StepExecutorFactory stepExecutorFactory(
      PipelineStages stages,
      EventBroadcaster broadcaster,
      JobRepository repository,
      SpeakerInputGate gate,
      ArtifactPublisher publisher,
      PipelineProperties properties,
      Clock clock) {
    return new StepExecutorFactory(
        stages, broadcaster, repository, gate, publisher, Path.of(properties.runsDir()), clock);
  }

  @Bean
  public PipelineScheduler pipelineScheduler(
      JobRepository repository,
      StepExecutorFactory executorFactory,
      @Qualifier(AsyncConfig.PIPELINE_EXECUTOR) ThreadPoolTaskExecutor pipelineExecutor,
      PipelineProperties properties,
      Clock clock) {
    return new PipelineScheduler(
        repository, executorFactory, pipelineExecutor, clock, properties.maxQueueSize());
  }

  @Bean
  public PipelineService pipelineService(
      PipelineScheduler scheduler,
      JobRepository repository,
      EventBroadcaster broadcaster,
      SpeakerInputGate gate,
      SpeakerConfigStage speakerConfigStage,
      PipelineProperties properties) {
    return new PipelineService(
        scheduler,
        repository,
        broadcaster,
        gate,
        speakerConfigStage,
        Path.of(properties.runsDir()));
  }

  @Bean
  public PostCompletionService postCompletionService(
      JobRepository repository,
      RemoteSynthesisStage synthesisStage,
      SpeakerConfigStage speakerConfigStage,
      SpeakerConfigParser parser,
      SpeakerProfileDeriver deriver,
      AudioMerger merger,
      ArtifactPublisher publisher,
      PipelineProperties properties) {
    return new PostCompletionService(
        repository,
        synthesisStage,
        speakerConfigStage,
        parser,
        deriver,
        merger,
        publisher,
        properties.introAssets().stream().map(Path::of).toList());
  }
}
