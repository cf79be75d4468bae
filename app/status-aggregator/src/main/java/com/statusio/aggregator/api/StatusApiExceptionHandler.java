package com.statusio.aggregator.api;

import com.statusio.aggregator.service.StatusAggregationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class StatusApiExceptionHandler {

  static final String AGGREGATION_FAILED = "AGGREGATION_FAILED";
  static final String INVALID_REQUEST = "INVALID_REQUEST";

  @ExceptionHandler(StatusAggregationException.class)
  public ResponseEntity<ApiErrorResponse> handleAggregationFailure(StatusAggregationException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(AGGREGATION_FAILED, ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(INVALID_REQUEST, "request body is invalid"));
  }
}
