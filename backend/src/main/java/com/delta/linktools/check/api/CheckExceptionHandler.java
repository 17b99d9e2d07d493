package com.delta.linktools.check.api;

import com.delta.linktools.check.service.ActiveCheckRunException;
import com.delta.linktools.check.service.InvalidCheckRequestException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CheckExceptionHandler {

  @ExceptionHandler(ActiveCheckRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCheckRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "check_already_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidCheckRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidCheckRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", ex.getErrorCode(), "message", ex.getMessage()));
  }
}
