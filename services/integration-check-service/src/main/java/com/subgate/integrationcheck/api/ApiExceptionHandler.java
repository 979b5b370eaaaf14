package com.subgate.integrationcheck.api;

import com.subgate.integrationcheck.common.error.ErrorKind;
import com.subgate.integrationcheck.common.error.IntegrationException;
import com.subgate.integrationcheck.common.error.StorageFailureException;
import com.subgate.integrationcheck.proof.InvalidTransitionException;
import com.subgate.integrationcheck.proof.ProofAcknowledgementException;
import com.subgate.integrationcheck.proof.ProofConstraintException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

  static final String INTERNAL_ERROR = "internal-error";

  @ExceptionHandler(ProofConstraintException.class)
  public ResponseEntity<ErrorResponse> handleConstraint(ProofConstraintException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(e));
  }

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ErrorResponse> handleTransition(InvalidTransitionException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(e));
  }

  @ExceptionHandler({StorageFailureException.class, ProofAcknowledgementException.class})
  public ResponseEntity<ErrorResponse> handleUpstream(IntegrationException e) {
    log.warn("Proof upstream failure: {}", e.getMessage(), e.getCause());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of(e));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException e) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(
            ErrorResponse.of(
                ErrorKind.CONSTRAINT_VIOLATION.code(), "File too large. Maximum size is 5MB."));
  }

  @ExceptionHandler({
    ServletRequestBindingException.class,
    MissingServletRequestPartException.class,
    HttpMessageNotReadableException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of(ErrorKind.MALFORMED_INPUT.code(), e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handle500(Exception e) {
    log.error("Unhandled exception", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(INTERNAL_ERROR, "Unexpected error"));
  }

  public record ErrorResponse(String code, String message, Instant timestamp) {
    public static ErrorResponse of(String code, String message) {
      return new ErrorResponse(code, message, Instant.now());
    }

    static ErrorResponse of(IntegrationException e) {
      return of(e.kind().code(), e.getMessage());
    }
  }
}
