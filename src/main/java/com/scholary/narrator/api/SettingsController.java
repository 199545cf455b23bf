package com.scholary.narrator.api;

import com.scholary.narrator.service.PipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Scheduler settings: parallel mode, concurrency limit and the tag registry. */
@RestController
@RequestMapping("/api/settings")
@Tag(name = "Settings", description = "Scheduler limits and tag registry")
public class SettingsController {

  private final PipelineService pipelineService;

  public SettingsController(PipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @GetMapping
  @Operation(summary = "Current scheduler settings")
  public SettingsResponse get() {
    return SettingsResponse.from(pipelineService.settings());
  }

  @PatchMapping
  @Operation(
      summary = "Update scheduler settings",
      description =
          "Raising the limit starts queued jobs immediately; lowering it never stops running "
              + "jobs.")
  public SettingsResponse update(@RequestBody SettingsUpdateRequest request) {
    return SettingsResponse.from(
        pipelineService.updateSettings(
            request.parallelEnabled(), request.maxConcurrent(), request.tags()));
  }
}
