package com.scholary.narrator.api;

import com.scholary.narrator.service.PipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.file.Path;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/artifacts")
@Tag(name = "Artifacts", description = "Download files produced by pipeline runs")
public class ArtifactController {

  private final PipelineService pipelineService;

  public ArtifactController(PipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @GetMapping("/download")
  @Operation(summary = "Download an artifact by its path relative to the runs directory")
  public ResponseEntity<Resource> download(@RequestParam("path") String path) {
    Path file = pipelineService.resolveArtifact(path);
    MediaType mediaType =
        MediaTypeFactory.getMediaType(file.getFileName().toString())
            .orElse(MediaType.APPLICATION_OCTET_STREAM);
    return ResponseEntity.ok()
        .contentType(mediaType)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(file.getFileName().toString())
                .build()
                .toString())
        .body(new FileSystemResource(file));
  }
}
