package com.scholary.narrator.api;

import com.scholary.narrator.job.IllegalJobStateException;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.PersistenceException;
import com.scholary.narrator.job.ValidationException;
import com.scholary.narrator.scheduler.QueueFullException;
import com.scholary.narrator.service.ArtifactNotFoundException;
import com.scholary.narrator.speaker.SpeakerInputException;
import com.scholary.narrator.stage.StageException;
import java.io.UncheckedIOException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts pipeline exceptions to HTTP responses.
 *
 * <p>Client errors are logged at debug or warn; server-side failures at error with the cause.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  ResponseEntity<ApiError> handleValidation(ValidationException ex) {
    LOGGER.debug("Rejected request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
  }

  @ExceptionHandler(SpeakerInputException.class)
  ResponseEntity<ApiError> handleSpeakerInput(SpeakerInputException ex) {
    LOGGER.debug("Rejected speaker configuration: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "invalid_speaker_config", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(field -> field.getField() + " " + field.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, "validation_error", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, "malformed_request", "Request body is not valid JSON");
  }

  @ExceptionHandler(QueueFullException.class)
  ResponseEntity<ApiError> handleQueueFull(QueueFullException ex) {
    LOGGER.warn("Submission rejected: {}", ex.getMessage());
    return error(HttpStatus.TOO_MANY_REQUESTS, "queue_full", ex.getMessage());
  }

  @ExceptionHandler(JobNotFoundException.class)
  ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  ResponseEntity<ApiError> handleArtifactNotFound(ArtifactNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "artifact_not_found", ex.getMessage());
  }

  @ExceptionHandler(IllegalJobStateException.class)
  ResponseEntity<ApiError> handleIllegalState(IllegalJobStateException ex) {
    LOGGER.debug(
        "Conflict on job {} in state {}: {}", ex.getJobId(), ex.getStatus(), ex.getMessage());
    return error(HttpStatus.CONFLICT, "illegal_job_state", ex.getMessage());
  }

  /** A post-completion action whose collaborator call failed. */
  @ExceptionHandler(StageException.class)
  ResponseEntity<ApiError> handleStage(StageException ex) {
    LOGGER.error("Post-completion action failed: {}", ex.getMessage(), ex);
    return error(HttpStatus.BAD_GATEWAY, "stage_failed", ex.getMessage());
  }

  @ExceptionHandler({PersistenceException.class, UncheckedIOException.class})
  ResponseEntity<ApiError> handleStorage(RuntimeException ex) {
    LOGGER.error("Storage failure", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage_error", ex.getMessage());
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(ApiError.of(code, message));
  }
}
