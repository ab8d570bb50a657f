package com.mk.fx.qa.synthetic.execution.resource;

import com.mk.fx.qa.synthetic.execution.dto.ErrorResponse;
import com.mk.fx.qa.synthetic.execution.persistence.PersistenceException;
import com.mk.fx.qa.synthetic.execution.registry.MonitorNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(MonitorNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleMonitorNotFound(MonitorNotFoundException ex) {
    log.warn(ex.getMessage());
    return responseFactory.notFound(ex.getMessage());
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException ex) {
    log.error("Persistence failure: {}", ex.getMessage(), ex);
    return responseFactory.unavailable("Persistence Unavailable", ex.getMessage());
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
    log.error("Registry unavailable: {}", ex.getMessage(), ex);
    return responseFactory.unavailable("Registry Unavailable", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Invalid request body: {}", details);
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", details);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
    log.warn("Invalid request parameter: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
    String details =
        ex.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream())
            .map(error -> error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Invalid request parameter: {}", details);
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", details);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
    log.warn("Malformed request: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return responseFactory.error(HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", ex.getMessage());
  }
}
