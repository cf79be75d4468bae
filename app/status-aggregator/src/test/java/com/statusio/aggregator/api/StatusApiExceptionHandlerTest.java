package com.statusio.aggregator.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.statusio.aggregator.service.StatusAggregationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

class StatusApiExceptionHandlerTest {

  private final StatusApiExceptionHandler handler = new StatusApiExceptionHandler();

  @Test
  void aggregationFailureMapsTo500() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleAggregationFailure(
            new StatusAggregationException("status aggregation failed", new RuntimeException()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().code()).isEqualTo("AGGREGATION_FAILED");
  }

  @Test
  void unreadableBodyMapsTo400WithoutLeakingParserDetails() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleUnreadableBody(
            new HttpMessageNotReadableException(
                "JSON parse error: secret-ish details", new MockHttpInputMessage(new byte[0])));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().code()).isEqualTo("INVALID_REQUEST");
    assertThat(response.getBody().message()).doesNotContain("secret-ish");
  }
}
