package com.ableclub.monitor.events.api;

import com.ableclub.monitor.events.scheduler.JobConfigurationException;
import com.ableclub.monitor.events.scheduler.UnknownJobException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class JobExceptionHandler {

  @ExceptionHandler(UnknownJobException.class)
  public ResponseEntity<Map<String, String>> handleUnknownJob(UnknownJobException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_job", "message", ex.getMessage()));
  }

  @ExceptionHandler({JobConfigurationException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }
}
