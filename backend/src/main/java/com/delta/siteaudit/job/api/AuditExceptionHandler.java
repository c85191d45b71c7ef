package com.delta.siteaudit.job.api;

import com.delta.siteaudit.job.service.ArtifactNotReadyException;
import com.delta.siteaudit.job.service.InvalidJobRequestException;
import com.delta.siteaudit.job.service.JobNotFoundException;
import com.delta.siteaudit.render.NotEntitledException;
import com.delta.siteaudit.render.RendererUnavailableException;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class AuditExceptionHandler {

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
  }

  @ExceptionHandler(InvalidJobRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalid(InvalidJobRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
    String message = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .collect(Collectors.joining("; "));
    return error(HttpStatus.BAD_REQUEST, "invalid_request", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_request", "request body is not valid JSON");
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException ex) {
    HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
    String reason = ex.getReason() == null ? status.getReasonPhrase() : ex.getReason();
    return error(status, status == HttpStatus.BAD_REQUEST ? "invalid_request" : "request_failed", reason);
  }

  @ExceptionHandler(ArtifactNotReadyException.class)
  public ResponseEntity<Map<String, String>> handleNotReady(ArtifactNotReadyException ex) {
    return error(HttpStatus.CONFLICT, "artifact_not_ready", ex.getMessage());
  }

  @ExceptionHandler(NotEntitledException.class)
  public ResponseEntity<Map<String, String>> handleNotEntitled(NotEntitledException ex) {
    return error(HttpStatus.FORBIDDEN, "not_entitled", ex.getMessage());
  }

  @ExceptionHandler(RendererUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleNoRenderer(RendererUnavailableException ex) {
    return error(HttpStatus.NOT_IMPLEMENTED, "renderer_unavailable", ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(Map.of("error", code, "message", message));
  }
}
