package com.delta.scraper.scrape.api;

import com.delta.scraper.scrape.job.InvalidJobException;
import com.delta.scraper.scrape.job.JobStateException;
import com.delta.scraper.scrape.job.UnknownJobException;
import com.delta.scraper.scrape.proxy.InvalidProxyEndpointException;
import com.delta.scraper.scrape.proxy.NoProxyAvailableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(InvalidJobException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidJob(InvalidJobException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_job", "message", ex.getMessage(), "problems", ex.getProblems()));
  }

  @ExceptionHandler(UnknownJobException.class)
  public ResponseEntity<Map<String, String>> handleUnknownJob(UnknownJobException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_job", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobStateException.class)
  public ResponseEntity<Map<String, String>> handleJobState(JobStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "illegal_job_state", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidProxyEndpointException.class)
  public ResponseEntity<Map<String, String>> handleInvalidProxy(InvalidProxyEndpointException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_proxy", "message", ex.getMessage()));
  }

  @ExceptionHandler(NoProxyAvailableException.class)
  public ResponseEntity<Map<String, String>> handleNoProxy(NoProxyAvailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "no_proxy_available", "message", ex.getMessage()));
  }
}
